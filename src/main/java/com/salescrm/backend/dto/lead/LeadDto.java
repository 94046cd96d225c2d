package com.salescrm.backend.dto.lead;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
public class LeadDto {
    private Long id;
    private String firstName;
    private String lastName;
    private String fullName;
    private String email;
    private String phone;
    private String company;
    private String jobTitle;
    private Long sourceId;
    private String sourceName;
    private LeadStatus status;
    private String statusDisplay;
    private LeadPriority priority;
    private Long assignedToId;
    private String assignedToName;
    private Long createdById;
    private String address;
    private String city;
    private String state;
    private String country;
    private String postalCode;
    private BigDecimal budget;
    private String requirements;
    private String notes;
    private Boolean hot;
    private Boolean overdue;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime lastContacted;
}
