package com.salescrm.backend.dto.email;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ConnectionTestDto {
    private boolean success;
    private String message;
}
