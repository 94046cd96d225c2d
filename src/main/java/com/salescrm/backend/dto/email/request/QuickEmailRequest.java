package com.salescrm.backend.dto.email.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Either a template, an explicit subject and body, or both. Explicit values
 * win over the template.
 */
@Data
public class QuickEmailRequest {
    private Long templateId;

    @Size(max = 300)
    private String subject;

    private String bodyHtml;

    private Long emailConfigId;
}
