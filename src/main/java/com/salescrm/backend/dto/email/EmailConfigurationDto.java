package com.salescrm.backend.dto.email;

import com.salescrm.backend.models.email.EmailConfiguration;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * The SMTP password never leaves the server.
 */
@Data
@Builder
public class EmailConfigurationDto {
    private Long id;
    private String name;
    private EmailConfiguration.Provider provider;
    private String smtpHost;
    private Integer smtpPort;
    private String smtpUsername;
    private Boolean hasPassword;
    private Boolean useTls;
    private Boolean useSsl;
    private String fromEmail;
    private String fromName;
    private String replyTo;
    private Boolean isActive;
    private Boolean isDefault;
    private Integer dailyLimit;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
