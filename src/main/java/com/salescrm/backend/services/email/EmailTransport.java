package com.salescrm.backend.services.email;

import com.salescrm.backend.models.email.EmailConfiguration;

/**
 * Delivers a message with the credentials of one {@link EmailConfiguration}.
 * Implementations report failures in the result and do not throw.
 */
public interface EmailTransport {

    SendResult send(OutgoingEmail email, EmailConfiguration config);

    ConnectionTestResult testConnection(EmailConfiguration config);
}
