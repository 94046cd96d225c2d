package com.salescrm.backend.dto.lead.request;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Used for both create and update. On update every field is written, so
 * clients send the full lead.
 */
@Data
public class LeadRequest {
    @NotBlank(message = "First name is required")
    @Size(max = 100)
    private String firstName;

    @Size(max = 100)
    private String lastName;

    @Email(message = "Invalid email format")
    private String email;

    @Size(max = 20)
    private String phone;

    @Size(max = 200)
    private String company;

    @Size(max = 100)
    private String jobTitle;

    private Long sourceId;
    private LeadStatus status;
    private LeadPriority priority;
    private Long assignedToId;

    private String address;
    private String city;
    private String state;
    private String country;
    private String postalCode;

    private BigDecimal budget;
    private String requirements;
    private String notes;
}
