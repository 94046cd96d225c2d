package com.salescrm.backend.enums;

public enum CampaignStatus {
    DRAFT("Draft"),
    SCHEDULED("Scheduled"),
    SENDING("Sending"),
    SENT("Sent"),
    PAUSED("Paused"),
    CANCELLED("Cancelled");

    private final String displayName;

    CampaignStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isFinished() {
        return this == SENT || this == CANCELLED;
    }

    public boolean canTransitionTo(CampaignStatus target) {
        if (target == CANCELLED) {
            return !isFinished();
        }
        return switch (this) {
            case DRAFT -> target == SCHEDULED || target == SENDING;
            case SCHEDULED -> target == SENDING;
            case SENDING -> target == SENT || target == PAUSED;
            case PAUSED -> target == SENDING;
            case SENT, CANCELLED -> false;
        };
    }
}
