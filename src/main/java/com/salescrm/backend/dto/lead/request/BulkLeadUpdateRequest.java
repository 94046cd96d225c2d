package com.salescrm.backend.dto.lead.request;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class BulkLeadUpdateRequest {
    @NotEmpty(message = "Select at least one lead")
    private List<Long> leadIds;

    @NotNull(message = "Action is required")
    private Action action;

    // Only the field matching the action is read
    private LeadStatus status;
    private LeadPriority priority;
    private Long assignToId;

    public enum Action {
        CHANGE_STATUS, CHANGE_PRIORITY, ASSIGN_TO
    }
}
