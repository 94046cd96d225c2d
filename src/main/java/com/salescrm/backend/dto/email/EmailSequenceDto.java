package com.salescrm.backend.dto.email;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

@Data
@Builder
public class EmailSequenceDto {
    private Long id;
    private String name;
    private String description;
    private Boolean triggerOnLeadCreation;
    private Set<LeadStatus> triggerOnStatusChange;
    private Set<LeadPriority> triggerOnPriorityChange;
    private Boolean isActive;
    private Integer delayStartDays;
    private Integer stepCount;
    private List<EmailSequenceStepDto> steps;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
