package com.salescrm.backend.dto.email;

import com.salescrm.backend.enums.EmailStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
public class EmailDto {
    private Long id;
    private UUID trackingId;
    private Long leadId;
    private String leadName;
    private Long campaignId;
    private Long templateId;
    private String fromEmail;
    private String fromName;
    private String toEmail;
    private String toName;
    private String subject;
    private String bodyHtml;
    private String bodyText;
    private EmailStatus status;
    private String externalId;
    private Integer openCount;
    private Integer clickCount;
    private String errorMessage;
    private Integer retryCount;
    private Integer maxRetries;
    private OffsetDateTime createdAt;
    private OffsetDateTime sentAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime openedAt;
    private OffsetDateTime clickedAt;
}
