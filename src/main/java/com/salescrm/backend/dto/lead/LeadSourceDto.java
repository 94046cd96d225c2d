package com.salescrm.backend.dto.lead;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class LeadSourceDto {
    private Long id;
    private String name;
    private String description;
    private Boolean isActive;
    private OffsetDateTime createdAt;
}
