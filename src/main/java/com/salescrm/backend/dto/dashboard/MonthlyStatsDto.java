package com.salescrm.backend.dto.dashboard;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MonthlyStatsDto {
    private String month;       // "March 2024"
    private String monthShort;  // "Mar 2024"
    private long total;
    private long won;
    private long lost;
    private long inProgress;
    private double conversionRate;
}
