package com.salescrm.backend.dto.lead;

import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class LeadStatsDto {
    private long totalLeads;
    private Map<LeadStatus, Long> byStatus;
    private long hotLeads;
    private long overdueLeads;
    private double conversionRate;
}
