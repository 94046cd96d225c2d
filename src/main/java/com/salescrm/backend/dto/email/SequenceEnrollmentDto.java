package com.salescrm.backend.dto.email;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class SequenceEnrollmentDto {
    private Long id;
    private Long sequenceId;
    private String sequenceName;
    private Long leadId;
    private String leadName;
    private Integer currentStep;
    private Boolean isActive;
    private Integer emailsSent;
    private Boolean hasReplied;
    private OffsetDateTime enrolledAt;
    private OffsetDateTime lastEmailSent;
    private OffsetDateTime completedAt;
}
