package com.salescrm.backend.services.email;

import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailTracking;
import com.salescrm.backend.models.email.EmailTracking.EventType;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailTrackingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Records engagement callbacks. Callbacks are unauthenticated, so anything
 * that does not resolve to a known email and event is ignored silently.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailTrackingService {

    private final EmailRepository emailRepository;
    private final EmailTrackingRepository trackingRepository;
    private final EmailSequenceService sequenceService;
    private final Clock clock;

    /**
     * @return {@code true} when the event was recorded
     */
    public boolean record(String trackingId, String event, String ipAddress, String userAgent, String url) {
        EventType type = EventType.fromPath(event);
        if (type == null || type == EventType.SENT) {
            log.debug("Ignoring tracking event '{}' for {}", event, trackingId);
            return false;
        }

        Optional<Email> found = parse(trackingId).flatMap(emailRepository::findByTrackingId);
        if (found.isEmpty()) {
            log.debug("Ignoring tracking event {} for unknown id {}", type, trackingId);
            return false;
        }

        Email email = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);

        trackingRepository.save(EmailTracking.builder()
                .email(email)
                .eventType(type)
                .timestamp(now)
                .ipAddress(truncate(ipAddress, 45))
                .userAgent(userAgent)
                .clickedUrl(type == EventType.CLICKED ? truncate(url, 2048) : null)
                .build());

        switch (type) {
            case OPENED -> email.recordOpen(now);
            case CLICKED -> email.recordClick(now);
            case DELIVERED -> email.recordDelivered(now);
            case REPLIED -> {
                email.recordReply();
                sequenceService.markReplied(email.getLead());
            }
            case BOUNCED -> email.recordBounce();
            case SPAM -> email.recordSpam();
            default -> {
                // unsubscribes are only logged
            }
        }
        emailRepository.save(email);

        log.debug("Tracked {} for email {} (status now {})", type, email.getId(), email.getStatus());
        return true;
    }

    private static Optional<UUID> parse(String trackingId) {
        if (trackingId == null || trackingId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(trackingId.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
