package com.salescrm.backend.dto.email;

import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.util.Set;

@Data
@Builder
public class EmailSequenceStepDto {
    private Long id;
    private Integer stepNumber;
    private Long templateId;
    private String templateName;
    private Integer delayDays;
    private Boolean sendOnlyIfNotReplied;
    private Set<LeadStatus> sendOnlyIfStatus;
    private Boolean isActive;
}
