package com.salescrm.backend.dto.email.request;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.HashSet;
import java.util.Set;

@Data
public class SequenceRequest {
    @NotBlank(message = "Sequence name is required")
    @Size(max = 200)
    private String name;

    private String description;

    private Boolean triggerOnLeadCreation = false;
    private Set<LeadStatus> triggerOnStatusChange = new HashSet<>();
    private Set<LeadPriority> triggerOnPriorityChange = new HashSet<>();

    private Boolean isActive = true;

    @Min(0)
    private Integer delayStartDays = 0;
}
