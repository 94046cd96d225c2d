package com.salescrm.backend.services.email;

/**
 * A fully rendered message ready to hand to a transport.
 */
public record OutgoingEmail(
        String to,
        String toName,
        String subject,
        String htmlBody,
        String textBody,
        String replyTo
) {
}
