package com.salescrm.backend.services.dashboard;

import com.salescrm.backend.dto.dashboard.DashboardStatsDto;
import com.salescrm.backend.dto.dashboard.FunnelStageDto;
import com.salescrm.backend.dto.dashboard.MonthlyStatsDto;
import com.salescrm.backend.dto.dashboard.SourcePerformanceDto;
import com.salescrm.backend.dto.dashboard.StatusCountDto;
import com.salescrm.backend.dto.dashboard.TeamMemberPerformanceDto;
import com.salescrm.backend.dto.lead.LeadActivityDto;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.LeadActivityRepository;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.services.LeadAccessService;
import com.salescrm.backend.util.LeadMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.salescrm.backend.repositories.LeadSpecifications.createdBetween;
import static com.salescrm.backend.repositories.LeadSpecifications.overdue;

/**
 * Read-only reporting over the leads an actor can see. Aggregates are
 * computed in memory from the scoped lead list of the requested window.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    static final int OVERDUE_AFTER_DAYS = 7;
    static final int LIST_LIMIT = 10;
    static final int TOP_PERFORMERS = 5;
    static final int MONTHS_OF_HISTORY = 6;

    private static final DateTimeFormatter MONTH_LONG = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_SHORT = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private static final Set<LeadStatus> REACHED_CONTACTED = EnumSet.of(
            LeadStatus.CONTACTED, LeadStatus.QUALIFIED, LeadStatus.PROPOSAL, LeadStatus.NEGOTIATION, LeadStatus.WON);
    private static final Set<LeadStatus> REACHED_QUALIFIED = EnumSet.of(
            LeadStatus.QUALIFIED, LeadStatus.PROPOSAL, LeadStatus.NEGOTIATION, LeadStatus.WON);
    private static final Set<LeadStatus> REACHED_PROPOSAL = EnumSet.of(
            LeadStatus.PROPOSAL, LeadStatus.NEGOTIATION, LeadStatus.WON);

    private final LeadRepository leadRepository;
    private final LeadActivityRepository activityRepository;
    private final LeadAccessService leadAccessService;
    private final Clock clock;

    public DateRange.Window window(DateRange range, LocalDate from, LocalDate to) {
        return range.resolve(LocalDate.now(clock), from, to);
    }

    // ================================
    // STATS
    // ================================

    public DashboardStatsDto getStats(User actor, DateRange.Window window) {
        List<Lead> leads = leadsIn(actor, window);
        LocalDate today = LocalDate.now(clock);
        OffsetDateTime startOfToday = today.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime startOfWeek = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime startOfMonth = today.withDayOfMonth(1).atStartOfDay().atOffset(ZoneOffset.UTC);

        long total = leads.size();
        long won = count(leads, status(LeadStatus.WON));
        long hot = count(leads, priority(LeadPriority.HOT));
        long hotWon = count(leads, priority(LeadPriority.HOT).and(status(LeadStatus.WON)));

        BigDecimal totalRevenue = sumBudget(leads, status(LeadStatus.WON));
        BigDecimal potentialRevenue = sumBudget(leads, lead -> !lead.getStatus().isClosed());
        long wonWithBudget = count(leads, status(LeadStatus.WON).and(lead -> lead.getBudget() != null));
        BigDecimal avgDealSize = wonWithBudget == 0
                ? BigDecimal.ZERO.setScale(2)
                : totalRevenue.divide(BigDecimal.valueOf(wonWithBudget), 2, RoundingMode.HALF_UP);

        OffsetDateTime overdueCutoff = OffsetDateTime.now(clock).minusDays(OVERDUE_AFTER_DAYS);

        return DashboardStatsDto.builder()
                .dateFrom(window.from().toLocalDate())
                .dateTo(window.to().toLocalDate().minusDays(1))
                .totalLeads(total)
                .newLeads(count(leads, status(LeadStatus.NEW)))
                .contactedLeads(count(leads, status(LeadStatus.CONTACTED)))
                .qualifiedLeads(count(leads, status(LeadStatus.QUALIFIED)))
                .wonLeads(won)
                .lostLeads(count(leads, status(LeadStatus.LOST)))
                .hotLeads(hot)
                .warmLeads(count(leads, priority(LeadPriority.WARM)))
                .coldLeads(count(leads, priority(LeadPriority.COLD)))
                .todayLeads(count(leads, createdSince(startOfToday)))
                .weekLeads(count(leads, createdSince(startOfWeek)))
                .monthLeads(count(leads, createdSince(startOfMonth)))
                .conversionRate(percentage(won, total))
                .hotConversionRate(percentage(hotWon, hot))
                .totalRevenue(totalRevenue)
                .potentialRevenue(potentialRevenue)
                .avgDealSize(avgDealSize)
                .overdueLeads(count(leads, lead -> isOverdue(lead, overdueCutoff)))
                .build();
    }

    public List<FunnelStageDto> getFunnel(User actor, DateRange.Window window) {
        List<Lead> leads = leadsIn(actor, window);
        long total = leads.size();
        long contacted = count(leads, lead -> REACHED_CONTACTED.contains(lead.getStatus()));
        long qualified = count(leads, lead -> REACHED_QUALIFIED.contains(lead.getStatus()));
        long proposal = count(leads, lead -> REACHED_PROPOSAL.contains(lead.getStatus()));
        long won = count(leads, status(LeadStatus.WON));

        List<FunnelStageDto> funnel = new ArrayList<>();
        funnel.add(new FunnelStageDto("Total Leads", total, 100.0));
        funnel.add(new FunnelStageDto("Contacted", contacted, percentage(contacted, total)));
        funnel.add(new FunnelStageDto("Qualified", qualified, percentage(qualified, total)));
        funnel.add(new FunnelStageDto("Proposal", proposal, percentage(proposal, total)));
        funnel.add(new FunnelStageDto("Won", won, percentage(won, total)));
        return funnel;
    }

    // ================================
    // CHARTS
    // ================================

    /**
     * The current month and the five before it, oldest first.
     */
    public List<MonthlyStatsDto> getMonthlyStats(User actor) {
        YearMonth current = YearMonth.now(clock);
        YearMonth first = current.minusMonths(MONTHS_OF_HISTORY - 1L);
        DateRange.Window history = new DateRange.Window(
                first.atDay(1).atStartOfDay().atOffset(ZoneOffset.UTC),
                current.plusMonths(1).atDay(1).atStartOfDay().atOffset(ZoneOffset.UTC));
        List<Lead> leads = leadsIn(actor, history);

        List<MonthlyStatsDto> months = new ArrayList<>();
        for (YearMonth month = first; !month.isAfter(current); month = month.plusMonths(1)) {
            YearMonth target = month;
            List<Lead> inMonth = leads.stream()
                    .filter(lead -> YearMonth.from(lead.getCreatedAt().withOffsetSameInstant(ZoneOffset.UTC)).equals(target))
                    .collect(Collectors.toList());
            long total = inMonth.size();
            long won = count(inMonth, status(LeadStatus.WON));
            long lost = count(inMonth, status(LeadStatus.LOST));

            months.add(MonthlyStatsDto.builder()
                    .month(MONTH_LONG.format(month))
                    .monthShort(MONTH_SHORT.format(month))
                    .total(total)
                    .won(won)
                    .lost(lost)
                    .inProgress(total - won - lost)
                    .conversionRate(percentage(won, total))
                    .build());
        }
        return months;
    }

    /**
     * Statuses that occur in the window, in pipeline order.
     */
    public List<StatusCountDto> getStatusDistribution(User actor, DateRange.Window window) {
        List<Lead> leads = leadsIn(actor, window);
        List<StatusCountDto> distribution = new ArrayList<>();
        for (LeadStatus status : LeadStatus.values()) {
            long count = count(leads, status(status));
            if (count > 0) {
                distribution.add(StatusCountDto.builder()
                        .status(status)
                        .label(status.getDisplayName())
                        .count(count)
                        .percentage(percentage(count, leads.size()))
                        .build());
            }
        }
        return distribution;
    }

    public List<SourcePerformanceDto> getSourcePerformance(User actor, DateRange.Window window) {
        Map<Long, List<Lead>> bySource = leadsIn(actor, window).stream()
                .filter(lead -> lead.getSource() != null)
                .collect(Collectors.groupingBy(lead -> lead.getSource().getId(), LinkedHashMap::new, Collectors.toList()));

        return bySource.values().stream()
                .map(sourceLeads -> {
                    LeadSource source = sourceLeads.get(0).getSource();
                    long total = sourceLeads.size();
                    long won = count(sourceLeads, status(LeadStatus.WON));
                    return SourcePerformanceDto.builder()
                            .sourceId(source.getId())
                            .sourceName(source.getName())
                            .totalLeads(total)
                            .wonLeads(won)
                            .conversionRate(percentage(won, total))
                            .build();
                })
                .sorted(Comparator.comparingLong(SourcePerformanceDto::getTotalLeads).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Sales reps under the actor ranked by won leads. Empty for sales reps
     * and marketing users.
     */
    public List<TeamMemberPerformanceDto> getTeamPerformance(User actor, DateRange.Window window) {
        List<User> members = leadAccessService.teamMembers(actor);
        if (members.isEmpty()) {
            return List.of();
        }

        List<Lead> leads = leadRepository.findAll(Specification
                .where(leadAccessService.visibleTo(actor))
                .and(createdBetween(window.from(), window.to())));
        Map<Long, List<Lead>> byAssignee = leads.stream()
                .filter(lead -> lead.getAssignedTo() != null)
                .collect(Collectors.groupingBy(lead -> lead.getAssignedTo().getId()));

        return members.stream()
                .map(member -> {
                    List<Lead> own = byAssignee.getOrDefault(member.getId(), List.of());
                    long won = count(own, status(LeadStatus.WON));
                    return TeamMemberPerformanceDto.builder()
                            .userId(member.getId())
                            .name(member.getFullName())
                            .department(member.getDepartment())
                            .totalLeads(own.size())
                            .wonLeads(won)
                            .conversionRate(percentage(won, own.size()))
                            .revenue(sumBudget(own, status(LeadStatus.WON)))
                            .build();
                })
                .sorted(Comparator.comparingLong(TeamMemberPerformanceDto::getWonLeads).reversed())
                .collect(Collectors.toList());
    }

    public List<TeamMemberPerformanceDto> getTopPerformers(User actor, DateRange.Window window) {
        return getTeamPerformance(actor, window).stream()
                .limit(TOP_PERFORMERS)
                .collect(Collectors.toList());
    }

    // ================================
    // LISTS
    // ================================

    /**
     * Open leads without contact in the last week, oldest first.
     */
    public List<LeadDto> getOverdueLeads(User actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Specification<Lead> spec = leadAccessService.visibleTo(actor).and(overdue(now.minusDays(OVERDUE_AFTER_DAYS)));
        return leadRepository.findAll(spec, PageRequest.of(0, LIST_LIMIT, Sort.by(Sort.Direction.ASC, "createdAt")))
                .map(lead -> LeadMapper.toDto(lead, now))
                .getContent();
    }

    public List<LeadActivityDto> getRecentActivities(User actor) {
        List<Long> leadIds = leadRepository.findAll(leadAccessService.visibleTo(actor)).stream()
                .map(Lead::getId)
                .collect(Collectors.toList());
        if (leadIds.isEmpty()) {
            return List.of();
        }
        return activityRepository.findRecentForLeads(leadIds, PageRequest.of(0, LIST_LIMIT)).stream()
                .map(LeadMapper::toDto)
                .collect(Collectors.toList());
    }

    // ================================
    // HELPERS
    // ================================

    private List<Lead> leadsIn(User actor, DateRange.Window window) {
        return leadRepository.findAll(leadAccessService.visibleTo(actor)
                .and(createdBetween(window.from(), window.to())));
    }

    private static boolean isOverdue(Lead lead, OffsetDateTime cutoff) {
        return lead.getStatus().needsFollowUp()
                && (lead.getLastContacted() == null || lead.getLastContacted().isBefore(cutoff));
    }

    private static Predicate<Lead> status(LeadStatus status) {
        return lead -> lead.getStatus() == status;
    }

    private static Predicate<Lead> priority(LeadPriority priority) {
        return lead -> lead.getPriority() == priority;
    }

    private static Predicate<Lead> createdSince(OffsetDateTime since) {
        return lead -> lead.getCreatedAt() != null && !lead.getCreatedAt().isBefore(since);
    }

    private static long count(List<Lead> leads, Predicate<Lead> filter) {
        return leads.stream().filter(filter).count();
    }

    private static BigDecimal sumBudget(List<Lead> leads, Predicate<Lead> filter) {
        return leads.stream()
                .filter(filter)
                .map(Lead::getBudget)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Percentage rounded to one decimal, 0 for an empty whole.
     */
    static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / whole).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
