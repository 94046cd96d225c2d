package com.salescrm.backend.dto.email.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TestEmailRequest {
    @NotBlank(message = "Recipient is required")
    @Email
    private String toEmail;
}
