package com.salescrm.backend.services.email;

import com.salescrm.backend.models.email.EmailConfiguration;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;

/**
 * SMTP delivery for every provider type. Gmail, Outlook, SendGrid and SES
 * are all reached through their SMTP relays.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SmtpEmailTransport implements EmailTransport {

    private final MailSenderFactory mailSenderFactory;

    @Override
    public SendResult send(OutgoingEmail email, EmailConfiguration config) {
        try {
            JavaMailSenderImpl sender = mailSenderFactory.create(config);
            MimeMessage mimeMessage = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
            populateMessage(helper, email, config);
            sender.send(mimeMessage);

            String messageId = mimeMessage.getMessageID();
            log.debug("SMTP email sent to {} via {} with Message-ID: {}", email.to(), config.getSmtpHost(), messageId);
            return SendResult.sent(messageId);
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.error("Failed to send email to {} via configuration {}: {}", email.to(), config.getId(), e.getMessage());
            return SendResult.failed(e.getMessage());
        }
    }

    @Override
    public ConnectionTestResult testConnection(EmailConfiguration config) {
        try {
            mailSenderFactory.create(config).testConnection();
            return new ConnectionTestResult(true, "Connection successful");
        } catch (MessagingException e) {
            log.warn("SMTP connection test failed for configuration {}: {}", config.getId(), e.getMessage());
            return new ConnectionTestResult(false, e.getMessage());
        }
    }

    private void populateMessage(MimeMessageHelper helper, OutgoingEmail email, EmailConfiguration config)
            throws MessagingException, UnsupportedEncodingException {
        helper.setFrom(new InternetAddress(config.getFromEmail(), config.getFromName(), "UTF-8"));
        if (email.toName() != null && !email.toName().isBlank()) {
            helper.setTo(new InternetAddress(email.to(), email.toName(), "UTF-8"));
        } else {
            helper.setTo(email.to());
        }
        helper.setSubject(email.subject());

        if (email.textBody() != null && !email.textBody().isBlank()) {
            helper.setText(email.textBody(), email.htmlBody());
        } else {
            helper.setText(email.htmlBody(), true);
        }

        String replyTo = email.replyTo() != null ? email.replyTo() : config.getReplyTo();
        if (replyTo != null && !replyTo.isBlank()) {
            helper.setReplyTo(replyTo);
        }
    }
}
