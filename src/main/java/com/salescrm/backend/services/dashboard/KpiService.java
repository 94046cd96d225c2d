package com.salescrm.backend.services.dashboard;

import com.salescrm.backend.dto.dashboard.KpiTargetDto;
import com.salescrm.backend.dto.dashboard.KpiTargetRequest;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.LeadActivity;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.dashboard.KpiTarget;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.repositories.dashboard.KpiTargetRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class KpiService {

    private final KpiTargetRepository kpiTargetRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Add to every active target of the user whose period covers today.
     */
    public void increment(User user, KpiTarget.KpiType type, BigDecimal amount) {
        if (user == null || amount == null || amount.signum() == 0) {
            return;
        }
        List<KpiTarget> targets = kpiTargetRepository.findCurrent(user, type, LocalDate.now(clock));
        for (KpiTarget target : targets) {
            target.increment(amount);
            log.debug("KPI {} for user {} is now {}/{}", type, user.getId(),
                    target.getCurrentValue(), target.getTargetValue());
        }
        kpiTargetRepository.saveAll(targets);
    }

    public void increment(User user, KpiTarget.KpiType type) {
        increment(user, type, BigDecimal.ONE);
    }

    /**
     * Calls, emails and meetings count towards their matching targets.
     */
    public void recordActivity(User user, LeadActivity.ActivityType activityType) {
        switch (activityType) {
            case CALL -> increment(user, KpiTarget.KpiType.CALLS_MADE);
            case EMAIL -> increment(user, KpiTarget.KpiType.EMAILS_SENT);
            case MEETING -> increment(user, KpiTarget.KpiType.MEETINGS_SCHEDULED);
            default -> {
                // notes, status changes and assignments are not tracked
            }
        }
    }

    @Transactional(readOnly = true)
    public List<KpiTargetDto> getCurrentTargets(User user) {
        return kpiTargetRepository.findAllCurrent(user, LocalDate.now(clock)).stream()
                .map(KpiService::toDto)
                .collect(Collectors.toList());
    }

    /**
     * Active targets of the user whose period overlaps the given days.
     */
    @Transactional(readOnly = true)
    public List<KpiTargetDto> getTargets(User user, LocalDate from, LocalDate to) {
        return kpiTargetRepository.findOverlapping(user, from, to).stream()
                .map(KpiService::toDto)
                .collect(Collectors.toList());
    }

    /**
     * Create a target for the caller, or for a member of the caller's team when
     * the caller manages one.
     */
    public KpiTargetDto createTarget(User actor, KpiTargetRequest request) {
        User owner = actor;
        if (request.getUserId() != null && !Objects.equals(request.getUserId(), actor.getId())) {
            if (!actor.canManageTeam()) {
                throw new AccessDeniedException("Only managers and admins can set targets for other users");
            }
            owner = userRepository.findByIdAndOrganizationId(request.getUserId(), actor.getOrganization().getId())
                    .orElseThrow(() -> new EntityNotFoundException("User not found: " + request.getUserId()));
        }

        if (request.getPeriodEnd().isBefore(request.getPeriodStart())) {
            throw new CrmValidationException("Period end must not be before period start");
        }
        if (kpiTargetRepository.existsByUserAndKpiTypeAndPeriodStartAndPeriodEnd(
                owner, request.getKpiType(), request.getPeriodStart(), request.getPeriodEnd())) {
            throw new CrmValidationException("A target of this type already exists for the period");
        }

        KpiTarget target = KpiTarget.builder()
                .user(owner)
                .kpiType(request.getKpiType())
                .targetValue(request.getTargetValue())
                .periodStart(request.getPeriodStart())
                .periodEnd(request.getPeriodEnd())
                .build();

        KpiTarget saved = kpiTargetRepository.save(target);
        log.info("Created KPI target {} ({}) for user {}", saved.getId(), saved.getKpiType(), owner.getId());
        return toDto(saved);
    }

    public static KpiTargetDto toDto(KpiTarget target) {
        return KpiTargetDto.builder()
                .id(target.getId())
                .userId(target.getUser().getId())
                .userName(target.getUser().getFullName())
                .kpiType(target.getKpiType())
                .kpiLabel(target.getKpiType().getDisplayName())
                .targetValue(target.getTargetValue())
                .currentValue(target.getCurrentValue())
                .periodStart(target.getPeriodStart())
                .periodEnd(target.getPeriodEnd())
                .completionPercentage(target.getCompletionPercentage())
                .achieved(target.isAchieved())
                .build();
    }
}
