package com.salescrm.backend.dto.email;

import lombok.Builder;
import lombok.Data;

/**
 * Delivery and engagement counts with percentage rates. Rates are 0 when
 * their denominator is 0.
 */
@Data
@Builder
public class EmailStatsDto {
    private long totalSent;
    private long delivered;
    private long opened;
    private long clicked;
    private long bounced;
    private long failed;
    private long queued;
    private double deliveryRate;
    private double openRate;
    private double clickRate;
    private double bounceRate;
}
