package com.salescrm.backend.services.dashboard;

import com.salescrm.backend.dto.dashboard.DashboardStatsDto;
import com.salescrm.backend.dto.dashboard.FunnelStageDto;
import com.salescrm.backend.dto.dashboard.MonthlyStatsDto;
import com.salescrm.backend.dto.dashboard.TeamMemberPerformanceDto;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.Organization;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.LeadActivityRepository;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.services.LeadAccessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    // A Thursday
    private static final Instant NOW = Instant.parse("2024-05-16T10:00:00Z");

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private LeadActivityRepository activityRepository;

    @Mock
    private LeadAccessService leadAccessService;

    private DashboardService dashboardService;

    private User manager;
    private DateRange.Window may;

    @BeforeEach
    void setUp() {
        dashboardService = new DashboardService(leadRepository, activityRepository, leadAccessService,
                Clock.fixed(NOW, ZoneOffset.UTC));

        Organization org = Organization.builder().id(1L).name("Test Organization").build();
        manager = User.builder()
                .id(20L)
                .firstName("Maya")
                .organization(org)
                .role(User.UserRole.SALES_MANAGER)
                .department("North")
                .build();
        may = new DateRange.Window(at("2024-05-01T00:00:00Z"), at("2024-05-17T00:00:00Z"));
    }

    @Test
    void getStats_ShouldAggregateLeadsInWindow() {
        // Given
        stubVisibleLeads(samplePipeline());

        // When
        DashboardStatsDto stats = dashboardService.getStats(manager, may);

        // Then
        assertThat(stats.getDateFrom()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(stats.getDateTo()).isEqualTo(LocalDate.of(2024, 5, 16));
        assertThat(stats.getTotalLeads()).isEqualTo(5);
        assertThat(stats.getWonLeads()).isEqualTo(2);
        assertThat(stats.getLostLeads()).isEqualTo(1);
        assertThat(stats.getHotLeads()).isEqualTo(2);
        assertThat(stats.getConversionRate()).isEqualTo(40.0);
        assertThat(stats.getHotConversionRate()).isEqualTo(50.0);
        assertThat(stats.getTotalRevenue()).isEqualByComparingTo("40000");
        assertThat(stats.getPotentialRevenue()).isEqualByComparingTo("20000");
        assertThat(stats.getAvgDealSize()).isEqualByComparingTo("20000.00");
        assertThat(stats.getTodayLeads()).isEqualTo(1);
        assertThat(stats.getWeekLeads()).isEqualTo(2);
        assertThat(stats.getMonthLeads()).isEqualTo(5);
        assertThat(stats.getOverdueLeads()).isEqualTo(1);
    }

    @Test
    void getStats_ShouldReturnZeroRatesWhenNoLeads() {
        // Given
        stubVisibleLeads(List.of());

        // When
        DashboardStatsDto stats = dashboardService.getStats(manager, may);

        // Then
        assertThat(stats.getTotalLeads()).isZero();
        assertThat(stats.getConversionRate()).isZero();
        assertThat(stats.getAvgDealSize()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void getFunnel_ShouldCountLeadsThatReachedEachStage() {
        // Given
        stubVisibleLeads(samplePipeline());

        // When
        List<FunnelStageDto> funnel = dashboardService.getFunnel(manager, may);

        // Then
        assertThat(funnel).extracting(FunnelStageDto::getStage)
                .containsExactly("Total Leads", "Contacted", "Qualified", "Proposal", "Won");
        assertThat(funnel).extracting(FunnelStageDto::getCount)
                .containsExactly(5L, 3L, 2L, 2L, 2L);
        assertThat(funnel.get(1).getPercentage()).isEqualTo(60.0);
    }

    @Test
    void getMonthlyStats_ShouldCoverSixMonthsOldestFirst() {
        // Given
        Lead march = lead(LeadStatus.WON, LeadPriority.WARM, "2024-03-12T09:00:00Z", null);
        Lead mayLost = lead(LeadStatus.LOST, LeadPriority.COLD, "2024-05-02T09:00:00Z", null);
        Lead mayOpen = lead(LeadStatus.NEW, LeadPriority.HOT, "2024-05-10T09:00:00Z", null);
        stubVisibleLeads(List.of(march, mayLost, mayOpen));

        // When
        List<MonthlyStatsDto> months = dashboardService.getMonthlyStats(manager);

        // Then
        assertThat(months).hasSize(6);
        assertThat(months.get(0).getMonthShort()).isEqualTo("Dec 2023");
        assertThat(months.get(3).getMonth()).isEqualTo("March 2024");
        assertThat(months.get(3).getWon()).isEqualTo(1);
        assertThat(months.get(3).getConversionRate()).isEqualTo(100.0);
        assertThat(months.get(5).getTotal()).isEqualTo(2);
        assertThat(months.get(5).getInProgress()).isEqualTo(1);
        assertThat(months.get(4).getTotal()).isZero();
    }

    @Test
    void getTeamPerformance_ShouldBeEmptyWithoutTeam() {
        // Given
        when(leadAccessService.teamMembers(manager)).thenReturn(List.of());

        // When
        List<TeamMemberPerformanceDto> result = dashboardService.getTeamPerformance(manager, may);

        // Then
        assertThat(result).isEmpty();
        verifyNoInteractions(leadRepository);
    }

    @Test
    void getTeamPerformance_ShouldRankMembersByWonLeads() {
        // Given
        User ravi = User.builder().id(11L).firstName("Ravi").role(User.UserRole.SALES_REP).build();
        User sita = User.builder().id(12L).firstName("Sita").role(User.UserRole.SALES_REP).build();
        Lead raviOpen = lead(LeadStatus.NEW, LeadPriority.WARM, "2024-05-03T09:00:00Z", null);
        raviOpen.setAssignedTo(ravi);
        Lead sitaWon = lead(LeadStatus.WON, LeadPriority.WARM, "2024-05-04T09:00:00Z", "12000");
        sitaWon.setAssignedTo(sita);
        Lead sitaOpen = lead(LeadStatus.QUALIFIED, LeadPriority.WARM, "2024-05-05T09:00:00Z", null);
        sitaOpen.setAssignedTo(sita);

        when(leadAccessService.teamMembers(manager)).thenReturn(List.of(ravi, sita));
        stubVisibleLeads(List.of(raviOpen, sitaWon, sitaOpen));

        // When
        List<TeamMemberPerformanceDto> result = dashboardService.getTeamPerformance(manager, may);

        // Then
        assertThat(result).extracting(TeamMemberPerformanceDto::getName).containsExactly("Sita", "Ravi");
        assertThat(result.get(0).getTotalLeads()).isEqualTo(2);
        assertThat(result.get(0).getConversionRate()).isEqualTo(50.0);
        assertThat(result.get(0).getRevenue()).isEqualByComparingTo("12000");
        assertThat(result.get(1).getRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void percentage_ShouldRoundToOneDecimal() {
        assertThat(DashboardService.percentage(1, 3)).isEqualTo(33.3);
        assertThat(DashboardService.percentage(2, 3)).isEqualTo(66.7);
        assertThat(DashboardService.percentage(4, 0)).isZero();
    }

    // ================================
    // HELPERS
    // ================================

    private void stubVisibleLeads(List<Lead> leads) {
        when(leadAccessService.visibleTo(manager)).thenReturn((root, query, cb) -> null);
        when(leadRepository.findAll(ArgumentMatchers.<Specification<Lead>>any())).thenReturn(leads);
    }

    private List<Lead> samplePipeline() {
        Lead freshToday = lead(LeadStatus.NEW, LeadPriority.HOT, "2024-05-16T08:00:00Z", null);
        Lead wonThisWeek = lead(LeadStatus.WON, LeadPriority.HOT, "2024-05-13T12:00:00Z", "30000");
        Lead wonEarlier = lead(LeadStatus.WON, LeadPriority.WARM, "2024-05-02T12:00:00Z", "10000");
        Lead lost = lead(LeadStatus.LOST, LeadPriority.COLD, "2024-05-01T12:00:00Z", "5000");
        Lead contacted = lead(LeadStatus.CONTACTED, LeadPriority.WARM, "2024-05-06T12:00:00Z", "20000");
        contacted.setLastContacted(at("2024-05-15T12:00:00Z"));
        return List.of(freshToday, wonThisWeek, wonEarlier, lost, contacted);
    }

    private static Lead lead(LeadStatus status, LeadPriority priority, String createdAt, String budget) {
        return Lead.builder()
                .firstName("Lead")
                .status(status)
                .priority(priority)
                .createdAt(at(createdAt))
                .budget(budget != null ? new BigDecimal(budget) : null)
                .build();
    }

    private static OffsetDateTime at(String instant) {
        return OffsetDateTime.ofInstant(Instant.parse(instant), ZoneOffset.UTC);
    }
}
