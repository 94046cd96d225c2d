package com.salescrm.backend.services;

import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.salescrm.backend.dto.lead.BulkUpdateResultDto;
import com.salescrm.backend.dto.lead.LeadActivityDto;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.dto.lead.LeadStatsDto;
import com.salescrm.backend.dto.lead.request.BulkLeadUpdateRequest;
import com.salescrm.backend.dto.lead.request.LeadActivityRequest;
import com.salescrm.backend.dto.lead.request.LeadRequest;
import com.salescrm.backend.dto.lead.request.LeadSearchRequest;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadActivity;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.dashboard.KpiTarget;
import com.salescrm.backend.repositories.LeadActivityRepository;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.repositories.LeadSourceRepository;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.dashboard.KpiService;
import com.salescrm.backend.services.email.SequenceTriggerService;
import com.salescrm.backend.util.LeadMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.salescrm.backend.repositories.LeadSpecifications.assigneeIs;
import static com.salescrm.backend.repositories.LeadSpecifications.createdBetween;
import static com.salescrm.backend.repositories.LeadSpecifications.idIn;
import static com.salescrm.backend.repositories.LeadSpecifications.matchesText;
import static com.salescrm.backend.repositories.LeadSpecifications.overdue;
import static com.salescrm.backend.repositories.LeadSpecifications.priorityIn;
import static com.salescrm.backend.repositories.LeadSpecifications.sourceIn;
import static com.salescrm.backend.repositories.LeadSpecifications.statusIn;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class LeadService {

    static final int MIN_PHONE_DIGITS = 10;
    static final int MIN_ACTIVITY_SUBJECT = 3;
    static final int OVERDUE_AFTER_DAYS = 7;

    private final LeadRepository leadRepository;
    private final LeadSourceRepository leadSourceRepository;
    private final LeadActivityRepository activityRepository;
    private final UserRepository userRepository;
    private final LeadAccessService leadAccessService;
    private final KpiService kpiService;
    private final SequenceTriggerService sequenceTriggerService;
    private final Clock clock;

    // ================================
    // CREATE / UPDATE
    // ================================

    public LeadDto createLead(User actor, LeadRequest request) {
        validate(request);

        Lead lead = Lead.builder()
                .organization(actor.getOrganization())
                .createdBy(actor)
                .build();
        applyFields(lead, request, actor);
        lead.setStatus(request.getStatus() != null ? request.getStatus() : LeadStatus.NEW);
        lead.setPriority(request.getPriority() != null ? request.getPriority() : LeadPriority.WARM);
        lead.setAssignedTo(request.getAssignedToId() != null
                ? resolveAssignee(actor, request.getAssignedToId())
                : actor);

        Lead saved = leadRepository.save(lead);
        logActivity(saved, actor, LeadActivity.ActivityType.NOTE, "Lead Created",
                "Lead " + saved.getFullName() + " was created");

        kpiService.increment(saved.getAssignedTo(), KpiTarget.KpiType.LEADS_CREATED);
        sequenceTriggerService.onLeadCreated(saved);

        log.info("Lead {} created by user {} and assigned to {}", saved.getId(), actor.getId(),
                saved.getAssignedTo().getId());
        return LeadMapper.toDto(saved, now());
    }

    /**
     * Writes every field of the request. Status, priority and assignee
     * changes are logged as activities and fire the sequence triggers.
     */
    public LeadDto updateLead(User actor, Long leadId, LeadRequest request) {
        validate(request);
        Lead lead = leadAccessService.requireAccessible(actor, leadId);

        LeadStatus oldStatus = lead.getStatus();
        LeadPriority oldPriority = lead.getPriority();
        User oldAssignee = lead.getAssignedTo();

        applyFields(lead, request, actor);
        if (request.getStatus() != null) {
            lead.setStatus(request.getStatus());
        }
        if (request.getPriority() != null) {
            lead.setPriority(request.getPriority());
        }
        if (request.getAssignedToId() != null
                && (oldAssignee == null || !request.getAssignedToId().equals(oldAssignee.getId()))) {
            lead.setAssignedTo(resolveAssignee(actor, request.getAssignedToId()));
        }

        Lead saved = leadRepository.save(lead);
        afterChange(saved, actor, oldStatus, oldPriority, oldAssignee);

        log.info("Lead {} updated by user {}", leadId, actor.getId());
        return LeadMapper.toDto(saved, now());
    }

    public BulkUpdateResultDto bulkUpdate(User actor, BulkLeadUpdateRequest request) {
        List<Lead> leads = leadRepository.findAll(
                leadAccessService.visibleTo(actor).and(idIn(request.getLeadIds())));

        User newAssignee = null;
        switch (request.getAction()) {
            case CHANGE_STATUS -> {
                if (request.getStatus() == null) {
                    throw new CrmValidationException("Status is required for CHANGE_STATUS");
                }
            }
            case CHANGE_PRIORITY -> {
                if (request.getPriority() == null) {
                    throw new CrmValidationException("Priority is required for CHANGE_PRIORITY");
                }
            }
            case ASSIGN_TO -> {
                if (request.getAssignToId() == null) {
                    throw new CrmValidationException("Assignee is required for ASSIGN_TO");
                }
                newAssignee = resolveAssignee(actor, request.getAssignToId());
                if (!newAssignee.isSalesRep() || !Boolean.TRUE.equals(newAssignee.getIsActive())) {
                    throw new CrmValidationException("Leads can only be bulk assigned to an active sales rep");
                }
            }
        }

        int updated = 0;
        for (Lead lead : leads) {
            LeadStatus oldStatus = lead.getStatus();
            LeadPriority oldPriority = lead.getPriority();
            User oldAssignee = lead.getAssignedTo();

            switch (request.getAction()) {
                case CHANGE_STATUS -> lead.setStatus(request.getStatus());
                case CHANGE_PRIORITY -> lead.setPriority(request.getPriority());
                case ASSIGN_TO -> lead.setAssignedTo(newAssignee);
            }
            leadRepository.save(lead);
            if (afterChange(lead, actor, oldStatus, oldPriority, oldAssignee)) {
                updated++;
            }
        }

        log.info("Bulk {} by user {}: {} of {} requested lead(s) changed", request.getAction(), actor.getId(),
                updated, request.getLeadIds().size());
        return BulkUpdateResultDto.builder()
                .requested(request.getLeadIds().size())
                .updated(updated)
                .message(String.format("%d lead(s) updated", updated))
                .build();
    }

    // ================================
    // ACTIVITIES
    // ================================

    public LeadActivityDto addActivity(User actor, Long leadId, LeadActivityRequest request) {
        String subject = request.getSubject() != null ? request.getSubject().trim() : "";
        if (subject.length() < MIN_ACTIVITY_SUBJECT) {
            throw new CrmValidationException("Subject must be at least " + MIN_ACTIVITY_SUBJECT + " characters long");
        }
        Lead lead = leadAccessService.requireAccessible(actor, leadId);

        LeadActivity activity = logActivity(lead, actor, request.getActivityType(), subject, request.getDescription());
        if (request.getActivityType().isContact()) {
            lead.setLastContacted(activity.getCreatedAt());
            leadRepository.save(lead);
        }
        kpiService.recordActivity(actor, request.getActivityType());

        return LeadMapper.toDto(activity);
    }

    @Transactional(readOnly = true)
    public List<LeadActivityDto> getActivities(User actor, Long leadId) {
        leadAccessService.requireAccessible(actor, leadId);
        return activityRepository.findByLeadIdOrderByCreatedAtDesc(leadId).stream()
                .map(LeadMapper::toDto)
                .collect(Collectors.toList());
    }

    // ================================
    // QUERIES
    // ================================

    @Transactional(readOnly = true)
    public LeadDto getLead(User actor, Long leadId) {
        return LeadMapper.toDto(leadAccessService.requireAccessible(actor, leadId), now());
    }

    /**
     * Filtered page of the leads the actor can see, newest first. The
     * assignee filter is only honoured for managers and admins.
     */
    @Transactional(readOnly = true)
    public Page<LeadDto> searchLeads(User actor, LeadSearchRequest filter, int page, int size) {
        Specification<Lead> spec = leadAccessService.visibleTo(actor)
                .and(matchesText(filter.getSearch()))
                .and(filter.getStatus() != null ? statusIn(List.of(filter.getStatus())) : null)
                .and(filter.getPriority() != null ? priorityIn(List.of(filter.getPriority())) : null)
                .and(filter.getSourceId() != null ? sourceIn(List.of(filter.getSourceId())) : null)
                .and(actor.canManageTeam() ? assigneeIs(filter.getAssignedToId()) : null)
                .and(createdBetween(
                        filter.getDateFrom() != null ? filter.getDateFrom().atStartOfDay().atOffset(ZoneOffset.UTC) : null,
                        filter.getDateTo() != null ? filter.getDateTo().plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC) : null));

        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 100),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        OffsetDateTime now = now();
        return leadRepository.findAll(spec, pageable).map(lead -> LeadMapper.toDto(lead, now));
    }

    @Transactional(readOnly = true)
    public LeadStatsDto getStats(User actor) {
        Specification<Lead> visible = leadAccessService.visibleTo(actor);

        Map<LeadStatus, Long> byStatus = new EnumMap<>(LeadStatus.class);
        for (LeadStatus status : LeadStatus.values()) {
            byStatus.put(status, leadRepository.count(visible.and(statusIn(List.of(status)))));
        }
        long total = leadRepository.count(visible);
        long hot = leadRepository.count(visible.and(priorityIn(List.of(LeadPriority.HOT))));
        long overdueCount = leadRepository.count(visible.and(overdue(now().minusDays(OVERDUE_AFTER_DAYS))));

        return LeadStatsDto.builder()
                .totalLeads(total)
                .byStatus(byStatus)
                .hotLeads(hot)
                .overdueLeads(overdueCount)
                .conversionRate(rate(byStatus.get(LeadStatus.WON), total))
                .build();
    }

    // ================================
    // HELPERS
    // ================================

    void validate(LeadRequest request) {
        List<String> errors = new ArrayList<>();
        if (request.getFirstName() == null || request.getFirstName().isBlank()) {
            errors.add("First name is required");
        }
        if (request.getPhone() != null && !request.getPhone().isBlank()
                && PhoneNumberUtil.normalizeDigitsOnly(request.getPhone()).length() < MIN_PHONE_DIGITS) {
            errors.add("Phone number must have at least " + MIN_PHONE_DIGITS + " digits");
        }
        if (request.getBudget() != null && request.getBudget().signum() < 0) {
            errors.add("Budget cannot be negative");
        }
        if (!errors.isEmpty()) {
            throw new CrmValidationException(errors);
        }
    }

    private void applyFields(Lead lead, LeadRequest request, User actor) {
        lead.setFirstName(request.getFirstName().trim());
        lead.setLastName(request.getLastName());
        lead.setEmail(request.getEmail() != null && !request.getEmail().isBlank()
                ? request.getEmail().trim().toLowerCase()
                : null);
        lead.setPhone(request.getPhone());
        lead.setCompany(request.getCompany());
        lead.setJobTitle(request.getJobTitle());
        lead.setAddress(request.getAddress());
        lead.setCity(request.getCity());
        lead.setState(request.getState());
        if (request.getCountry() != null) {
            lead.setCountry(request.getCountry());
        }
        lead.setPostalCode(request.getPostalCode());
        lead.setBudget(request.getBudget());
        lead.setRequirements(request.getRequirements());
        lead.setNotes(request.getNotes());
        lead.setSource(request.getSourceId() != null ? resolveSource(actor, request.getSourceId()) : null);
    }

    private LeadSource resolveSource(User actor, Long sourceId) {
        return leadSourceRepository.findByIdAndOrganizationId(sourceId, actor.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("Lead source not found: " + sourceId));
    }

    /**
     * Sales reps keep their leads to themselves; managers and admins may hand
     * leads to any active user of the organization.
     */
    private User resolveAssignee(User actor, Long assigneeId) {
        if (actor.isSalesRep() && !assigneeId.equals(actor.getId())) {
            throw new AccessDeniedException("Sales reps cannot assign leads to other users");
        }
        User assignee = userRepository.findByIdAndOrganizationId(assigneeId, actor.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("User not found: " + assigneeId));
        if (!Boolean.TRUE.equals(assignee.getIsActive())) {
            throw new CrmValidationException("Cannot assign leads to an inactive user");
        }
        return assignee;
    }

    /**
     * @return whether anything tracked actually changed
     */
    private boolean afterChange(Lead lead, User actor, LeadStatus oldStatus, LeadPriority oldPriority, User oldAssignee) {
        boolean changed = false;

        if (lead.getStatus() != oldStatus) {
            changed = true;
            logActivity(lead, actor, LeadActivity.ActivityType.STATUS_CHANGE,
                    "Status changed from " + oldStatus.getDisplayName() + " to " + lead.getStatus().getDisplayName(), null);
            if (lead.getStatus() == LeadStatus.WON) {
                kpiService.increment(lead.getAssignedTo(), KpiTarget.KpiType.LEADS_CONVERTED);
                if (lead.getBudget() != null) {
                    kpiService.increment(lead.getAssignedTo(), KpiTarget.KpiType.REVENUE_GENERATED, lead.getBudget());
                }
            }
            sequenceTriggerService.onStatusChanged(lead, oldStatus, lead.getStatus());
        }

        if (lead.getPriority() != oldPriority) {
            changed = true;
            logActivity(lead, actor, LeadActivity.ActivityType.NOTE,
                    "Priority changed from " + oldPriority.getDisplayName() + " to " + lead.getPriority().getDisplayName(), null);
            sequenceTriggerService.onPriorityChanged(lead, oldPriority, lead.getPriority());
        }

        Long oldAssigneeId = oldAssignee != null ? oldAssignee.getId() : null;
        Long newAssigneeId = lead.getAssignedTo() != null ? lead.getAssignedTo().getId() : null;
        if (!Objects.equals(oldAssigneeId, newAssigneeId)) {
            changed = true;
            logActivity(lead, actor, LeadActivity.ActivityType.ASSIGNMENT,
                    "Lead assigned to " + (lead.getAssignedTo() != null ? lead.getAssignedTo().getFullName() : "nobody"), null);
        }
        return changed;
    }

    private LeadActivity logActivity(Lead lead, User actor, LeadActivity.ActivityType type, String subject, String description) {
        return activityRepository.save(LeadActivity.builder()
                .lead(lead)
                .user(actor)
                .activityType(type)
                .subject(subject)
                .description(description)
                .createdAt(now())
                .build());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    static double rate(Long part, long whole) {
        if (whole == 0 || part == null) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / whole).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
