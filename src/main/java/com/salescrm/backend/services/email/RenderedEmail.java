package com.salescrm.backend.services.email;

public record RenderedEmail(String subject, String htmlBody, String textBody) {
}
