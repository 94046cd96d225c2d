package com.salescrm.backend.dto.email.request;

import com.salescrm.backend.models.email.EmailTemplate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class EmailTemplateRequest {
    @NotBlank(message = "Template name is required")
    @Size(max = 200)
    private String name;

    private EmailTemplate.TemplateType templateType = EmailTemplate.TemplateType.CUSTOM;

    private String subject;
    private String bodyHtml;
    private String bodyText;

    private Boolean isActive = true;
    private Boolean isShared = false;
}
