package com.salescrm.backend.dto.dashboard;

import com.salescrm.backend.models.dashboard.KpiTarget;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class KpiTargetRequest {
    private Long userId; // Managers may set targets for their team; defaults to the caller

    @NotNull
    private KpiTarget.KpiType kpiType;

    @NotNull
    @DecimalMin(value = "0.01", message = "Target value must be positive")
    private BigDecimal targetValue;

    @NotNull
    private LocalDate periodStart;

    @NotNull
    private LocalDate periodEnd;
}
