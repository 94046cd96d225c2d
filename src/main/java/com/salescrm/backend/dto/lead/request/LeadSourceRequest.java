package com.salescrm.backend.dto.lead.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LeadSourceRequest {
    @NotBlank(message = "Source name is required")
    @Size(max = 100)
    private String name;

    private String description;

    private Boolean isActive = true;
}
