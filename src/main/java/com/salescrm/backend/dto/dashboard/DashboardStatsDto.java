package com.salescrm.backend.dto.dashboard;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class DashboardStatsDto {
    private LocalDate dateFrom;
    private LocalDate dateTo;

    private long totalLeads;
    private long newLeads;
    private long contactedLeads;
    private long qualifiedLeads;
    private long wonLeads;
    private long lostLeads;

    private long hotLeads;
    private long warmLeads;
    private long coldLeads;

    private long todayLeads;
    private long weekLeads;
    private long monthLeads;

    private double conversionRate;
    private double hotConversionRate;

    private BigDecimal totalRevenue;
    private BigDecimal potentialRevenue;
    private BigDecimal avgDealSize;

    private long overdueLeads;
}
