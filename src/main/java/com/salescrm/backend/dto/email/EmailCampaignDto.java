package com.salescrm.backend.dto.email;

import com.salescrm.backend.enums.CampaignStatus;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.Set;

@Data
@Builder
public class EmailCampaignDto {
    private Long id;
    private String name;
    private Long templateId;
    private String templateName;
    private Long emailConfigId;
    private String emailConfigName;
    private CampaignStatus status;
    private OffsetDateTime scheduledAt;
    private Boolean sendNow;
    private Boolean targetAllLeads;
    private Set<LeadStatus> targetStatuses;
    private Set<LeadPriority> targetPriorities;
    private Set<Long> targetSourceIds;
    private Set<Long> specificLeadIds;
    private Integer batchSize;
    private Integer delayBetweenBatches;
    private Integer totalRecipients;
    private Integer emailsSent;
    private Integer emailsFailed;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime createdAt;
}
