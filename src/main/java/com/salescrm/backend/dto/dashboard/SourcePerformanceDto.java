package com.salescrm.backend.dto.dashboard;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SourcePerformanceDto {
    private Long sourceId;
    private String sourceName;
    private long totalLeads;
    private long wonLeads;
    private double conversionRate;
}
