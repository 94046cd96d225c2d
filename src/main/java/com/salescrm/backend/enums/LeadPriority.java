package com.salescrm.backend.enums;

public enum LeadPriority {
    HOT("Hot"),
    WARM("Warm"),
    COLD("Cold");

    private final String displayName;

    LeadPriority(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
