package com.salescrm.backend.dto.email.request;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

@Data
public class CreateCampaignRequest {
    @NotBlank(message = "Campaign name is required")
    @Size(max = 200)
    private String name;

    @NotNull(message = "Template is required")
    private Long templateId;

    private Long emailConfigId; // Optional - falls back to the default configuration

    private Boolean sendNow = false;
    private OffsetDateTime scheduledAt;

    private Boolean targetAllLeads = false;
    private Set<LeadStatus> targetStatuses = new HashSet<>();
    private Set<LeadPriority> targetPriorities = new HashSet<>();
    private Set<Long> targetSourceIds = new HashSet<>();
    private Set<Long> specificLeadIds = new HashSet<>();

    @Min(1)
    @Max(1000)
    private Integer batchSize = 50;

    @Min(0)
    private Integer delayBetweenBatches = 60;
}
