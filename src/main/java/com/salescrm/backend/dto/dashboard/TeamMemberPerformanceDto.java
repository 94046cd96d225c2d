package com.salescrm.backend.dto.dashboard;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class TeamMemberPerformanceDto {
    private Long userId;
    private String name;
    private String department;
    private long totalLeads;
    private long wonLeads;
    private double conversionRate;
    private BigDecimal revenue;
}
