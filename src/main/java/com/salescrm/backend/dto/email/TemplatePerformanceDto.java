package com.salescrm.backend.dto.email;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TemplatePerformanceDto {
    private Long templateId;
    private String templateName;
    private long totalSent;
    private long opened;
    private long clicked;
    private double openRate;
    private double clickRate;
    private int usageCount;
}
