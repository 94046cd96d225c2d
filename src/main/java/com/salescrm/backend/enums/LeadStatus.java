package com.salescrm.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum LeadStatus {
    NEW("New"),
    CONTACTED("Contacted"),
    QUALIFIED("Qualified"),
    PROPOSAL("Proposal Sent"),
    NEGOTIATION("Negotiation"),
    WON("Won"),
    LOST("Lost"),
    ON_HOLD("On Hold");

    private static final Set<LeadStatus> OPEN_PIPELINE = EnumSet.of(NEW, CONTACTED, QUALIFIED);

    private final String displayName;

    LeadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isClosed() {
        return this == WON || this == LOST;
    }

    /**
     * Statuses that still expect a follow-up and count towards the overdue list.
     */
    public boolean needsFollowUp() {
        return OPEN_PIPELINE.contains(this);
    }
}
