package com.salescrm.backend.services.email;

import com.salescrm.backend.config.CrmProperties;
import com.salescrm.backend.models.email.EmailConfiguration;
import lombok.RequiredArgsConstructor;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Builds a {@link JavaMailSenderImpl} for one configuration. Senders are cheap
 * and hold no open connection, so one is created per use.
 */
@Component
@RequiredArgsConstructor
public class MailSenderFactory {

    private final CrmProperties properties;

    public JavaMailSenderImpl create(EmailConfiguration config) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(config.getSmtpHost());
        sender.setPort(config.getSmtpPort() != null ? config.getSmtpPort() : 587);
        sender.setDefaultEncoding("UTF-8");

        boolean auth = config.getSmtpUsername() != null && !config.getSmtpUsername().isBlank();
        if (auth) {
            sender.setUsername(config.getSmtpUsername());
            sender.setPassword(config.getSmtpPassword());
        }

        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", String.valueOf(auth));
        props.put("mail.smtp.connectiontimeout", String.valueOf(properties.connectionTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(properties.readTimeoutMs()));
        props.put("mail.smtp.writetimeout", String.valueOf(properties.readTimeoutMs()));

        if (Boolean.TRUE.equals(config.getUseSsl())) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (Boolean.TRUE.equals(config.getUseTls())) {
            props.put("mail.smtp.starttls.enable", "true");
        }
        return sender;
    }
}
