package com.salescrm.backend.exceptions;

/**
 * The user has no active email configuration to send with.
 */
public class EmailConfigurationMissingException extends RuntimeException {

    private final Long userId;

    public EmailConfigurationMissingException(Long userId) {
        super("No active email configuration found. Please set up email configuration first.");
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
