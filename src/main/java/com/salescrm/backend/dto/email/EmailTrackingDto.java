package com.salescrm.backend.dto.email;

import com.salescrm.backend.models.email.EmailTracking;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class EmailTrackingDto {
    private Long id;
    private EmailTracking.EventType eventType;
    private OffsetDateTime timestamp;
    private String ipAddress;
    private String userAgent;
    private String clickedUrl;
    private String bounceReason;
}
