package com.salescrm.backend.services.email;

import com.salescrm.backend.config.CrmProperties;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.models.LeadActivity;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailTracking;
import com.salescrm.backend.repositories.LeadActivityRepository;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailTrackingRepository;
import com.salescrm.backend.services.dashboard.KpiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Sends one {@link Email} row through the transport and records the outcome
 * on the row. Failures never propagate to the caller.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailDeliveryService {

    private final EmailTransport emailTransport;
    private final EmailRepository emailRepository;
    private final EmailTrackingRepository trackingRepository;
    private final LeadActivityRepository activityRepository;
    private final KpiService kpiService;
    private final CrmProperties properties;
    private final Clock clock;

    public SendResult deliver(Email email, EmailConfiguration config) {
        if (config == null || !config.isUsable()) {
            String reason = "Email configuration is missing or inactive";
            if (email.getStatus() == EmailStatus.FAILED) {
                email.setErrorMessage(reason);
            } else {
                email.markFailed(reason);
            }
            emailRepository.save(email);
            log.warn("Email {} not sent: {}", email.getId(), reason);
            return SendResult.failed(reason);
        }

        email.markSending();
        emailRepository.save(email);

        OutgoingEmail outgoing = new OutgoingEmail(
                email.getToEmail(),
                email.getToName(),
                email.getSubject(),
                withTrackingPixel(email),
                email.getBodyText(),
                email.getReplyTo());

        SendResult result;
        try {
            result = emailTransport.send(outgoing, config);
        } catch (RuntimeException e) {
            log.error("Transport error sending email {}: {}", email.getId(), e.getMessage(), e);
            result = SendResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (result.success()) {
            email.markSent(result.messageId(), now);
            emailRepository.save(email);

            trackingRepository.save(EmailTracking.builder()
                    .email(email)
                    .eventType(EmailTracking.EventType.SENT)
                    .timestamp(now)
                    .build());

            activityRepository.save(LeadActivity.builder()
                    .lead(email.getLead())
                    .user(email.getUser())
                    .activityType(LeadActivity.ActivityType.EMAIL)
                    .subject(truncate("Email sent: " + email.getSubject(), 200))
                    .description("Email sent to " + email.getToEmail())
                    .createdAt(now)
                    .build());

            kpiService.recordActivity(email.getUser(), LeadActivity.ActivityType.EMAIL);
            log.info("Email {} sent to {}", email.getId(), email.getToEmail());
        } else {
            email.markFailed(result.message());
            emailRepository.save(email);
            log.warn("Email {} to {} failed (attempt {}): {}",
                    email.getId(), email.getToEmail(), email.getRetryCount(), result.message());
        }
        return result;
    }

    /**
     * Appends the 1x1 open-tracking image. The stored body is left unchanged.
     */
    String withTrackingPixel(Email email) {
        String pixel = "<img src=\"" + trackingUrl(email, "opened")
                + "\" width=\"1\" height=\"1\" alt=\"\" style=\"display:none;\" />";
        String html = email.getBodyHtml() != null ? email.getBodyHtml() : "";
        int bodyEnd = html.toLowerCase().lastIndexOf("</body>");
        if (bodyEnd >= 0) {
            return html.substring(0, bodyEnd) + pixel + html.substring(bodyEnd);
        }
        return html + pixel;
    }

    public String trackingUrl(Email email, String event) {
        String base = properties.trackingBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/track/" + email.getTrackingId() + "/" + event;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
