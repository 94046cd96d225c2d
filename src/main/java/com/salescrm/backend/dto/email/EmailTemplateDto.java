package com.salescrm.backend.dto.email;

import com.salescrm.backend.models.email.EmailTemplate;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class EmailTemplateDto {
    private Long id;
    private Long ownerId;
    private String ownerName;
    private String name;
    private EmailTemplate.TemplateType templateType;
    private String subject;
    private String bodyHtml;
    private String bodyText;
    private Boolean isActive;
    private Boolean isShared;
    private Integer usageCount;
    private OffsetDateTime lastUsed;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
