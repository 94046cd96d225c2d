package com.salescrm.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum EmailStatus {
    QUEUED("Queued", 0),
    SENDING("Sending", 1),
    SENT("Sent", 2),
    DELIVERED("Delivered", 3),
    OPENED("Opened", 4),
    CLICKED("Clicked", 5),
    REPLIED("Replied", 6),
    BOUNCED("Bounced", 3),
    FAILED("Failed", 1),
    SPAM("Marked as Spam", 4);

    public static final Set<EmailStatus> SENT_OR_LATER = EnumSet.of(SENT, DELIVERED, OPENED, CLICKED);
    public static final Set<EmailStatus> DELIVERED_OR_LATER = EnumSet.of(DELIVERED, OPENED, CLICKED);
    public static final Set<EmailStatus> OPENED_OR_LATER = EnumSet.of(OPENED, CLICKED);

    private final String displayName;
    private final int rank;

    EmailStatus(String displayName, int rank) {
        this.displayName = displayName;
        this.rank = rank;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Statuses only move forward along the delivery path. Side branches
     * (bounced, spam, failed) are terminal except that a failed email may be
     * picked up again for a retry.
     */
    public boolean canTransitionTo(EmailStatus target) {
        if (this == target) {
            return false;
        }
        return switch (this) {
            case QUEUED -> target == SENDING || target == FAILED;
            case SENDING -> target == SENT || target == FAILED;
            case FAILED -> target == SENDING;
            case BOUNCED, SPAM, REPLIED -> false;
            case SENT, DELIVERED -> target == BOUNCED || target == SPAM || (target.rank > rank && target != FAILED);
            case OPENED, CLICKED -> target == SPAM || target.rank > rank;
        };
    }
}
