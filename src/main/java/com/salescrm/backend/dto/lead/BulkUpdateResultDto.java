package com.salescrm.backend.dto.lead;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BulkUpdateResultDto {
    private int requested;
    private int updated;
    private String message;
}
