package com.salescrm.backend.models.email;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;

/**
 * Append-only log of delivery and engagement events.
 */
@Entity
@Immutable
@Table(name = "email_tracking", indexes = @Index(name = "idx_email_tracking_email", columnList = "email_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailTracking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_id", nullable = false, updatable = false)
    private Email email;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20, updatable = false)
    private EventType eventType;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private OffsetDateTime timestamp;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "clicked_url", length = 2048, updatable = false)
    private String clickedUrl;

    @Column(name = "bounce_reason", columnDefinition = "TEXT", updatable = false)
    private String bounceReason;

    public enum EventType {
        SENT, DELIVERED, OPENED, CLICKED, REPLIED, BOUNCED, SPAM, UNSUBSCRIBED;

        /** Path segments arrive lower case ("opened"); anything else yields null. */
        public static EventType fromPath(String value) {
            if (value == null) {
                return null;
            }
            for (EventType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
            return null;
        }
    }
}
