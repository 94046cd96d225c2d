package com.salescrm.backend.dto.dashboard;

import com.salescrm.backend.models.dashboard.KpiTarget;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class KpiTargetDto {
    private Long id;
    private Long userId;
    private String userName;
    private KpiTarget.KpiType kpiType;
    private String kpiLabel;
    private BigDecimal targetValue;
    private BigDecimal currentValue;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private double completionPercentage;
    private boolean achieved;
}
