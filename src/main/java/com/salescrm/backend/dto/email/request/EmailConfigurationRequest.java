package com.salescrm.backend.dto.email.request;

import com.salescrm.backend.models.email.EmailConfiguration;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class EmailConfigurationRequest {
    @NotBlank(message = "Configuration name is required")
    @Size(max = 100)
    private String name;

    private EmailConfiguration.Provider provider = EmailConfiguration.Provider.SMTP;

    @NotBlank(message = "SMTP host is required")
    private String smtpHost;

    @Min(1)
    @Max(65535)
    private Integer smtpPort = 587;

    private String smtpUsername;

    // Left blank on update to keep the stored password
    private String smtpPassword;

    private Boolean useTls = true;
    private Boolean useSsl = false;

    @NotBlank(message = "From email is required")
    @Email(message = "Invalid from email")
    private String fromEmail;

    @NotBlank(message = "From name is required")
    @Size(max = 100)
    private String fromName;

    @Email(message = "Invalid reply-to email")
    private String replyTo;

    private Boolean isActive = true;
    private Boolean isDefault = false;

    @Min(1)
    private Integer dailyLimit = 500;
}
