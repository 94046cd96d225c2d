package com.salescrm.backend.dto.lead;

import com.salescrm.backend.models.LeadActivity;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class LeadActivityDto {
    private Long id;
    private Long leadId;
    private String leadName;
    private Long userId;
    private String userName;
    private LeadActivity.ActivityType activityType;
    private String subject;
    private String description;
    private OffsetDateTime createdAt;
}
