package com.salescrm.backend.dto.dashboard;

import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StatusCountDto {
    private LeadStatus status;
    private String label;
    private long count;
    private double percentage;
}
