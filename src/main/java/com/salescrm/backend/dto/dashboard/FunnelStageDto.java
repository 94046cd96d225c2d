package com.salescrm.backend.dto.dashboard;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FunnelStageDto {
    private String stage;
    private long count;
    private double percentage;
}
