package com.salescrm.backend.services.email;

public record SendResult(boolean success, String message, String messageId) {

    public static SendResult sent(String messageId) {
        return new SendResult(true, "Email sent successfully", messageId);
    }

    public static SendResult failed(String message) {
        return new SendResult(false, message, null);
    }
}
