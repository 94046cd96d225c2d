package com.salescrm.backend.dto.lead.request;

import com.salescrm.backend.models.LeadActivity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LeadActivityRequest {
    @NotNull(message = "Activity type is required")
    private LeadActivity.ActivityType activityType;

    @NotBlank(message = "Subject is required")
    @Size(max = 200)
    private String subject;

    private String description;
}
