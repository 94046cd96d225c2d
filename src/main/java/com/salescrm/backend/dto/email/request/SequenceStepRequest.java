package com.salescrm.backend.dto.email.request;

import com.salescrm.backend.enums.LeadStatus;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashSet;
import java.util.Set;

@Data
public class SequenceStepRequest {
    @NotNull(message = "Step number is required")
    @Min(1)
    private Integer stepNumber;

    @NotNull(message = "Template is required")
    private Long templateId;

    @Min(0)
    private Integer delayDays = 1;

    private Boolean sendOnlyIfNotReplied = true;
    private Set<LeadStatus> sendOnlyIfStatus = new HashSet<>();
    private Boolean isActive = true;
}
