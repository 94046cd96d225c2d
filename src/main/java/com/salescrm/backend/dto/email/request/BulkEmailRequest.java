package com.salescrm.backend.dto.email.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
public class BulkEmailRequest {
    @NotNull(message = "Template is required")
    private Long templateId;

    @NotEmpty(message = "Select at least one lead")
    private List<Long> leadIds;

    private Long emailConfigId;

    private OffsetDateTime scheduledAt; // Null sends immediately
}
