package com.salescrm.backend.models.email;

import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One outbound message to one lead. Campaign rows are created QUEUED and
 * drained later; sequence and quick emails are created and sent at once.
 */
@Entity
@Table(name = "emails", indexes = {
        @Index(name = "idx_emails_campaign_status", columnList = "campaign_id, status"),
        @Index(name = "idx_emails_lead", columnList = "lead_id"),
        @Index(name = "idx_emails_tracking_id", columnList = "tracking_id", unique = true)
}, uniqueConstraints = @UniqueConstraint(columnNames = {"campaign_id", "lead_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"id", "toEmail", "subject", "status", "retryCount"})
public class Email {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id")
    private EmailCampaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id")
    private EmailTemplate template;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    // Sender fields are copied from the configuration when the row is created
    @Column(name = "from_email", nullable = false)
    private String fromEmail;

    @Column(name = "from_name", length = 100)
    private String fromName;

    @Column(name = "reply_to")
    private String replyTo;

    @Column(name = "to_email", nullable = false)
    private String toEmail;

    @Column(name = "to_name", length = 200)
    private String toName;

    @Column(nullable = false, length = 300)
    private String subject;

    @Column(name = "body_html", nullable = false, columnDefinition = "TEXT")
    private String bodyHtml;

    @Column(name = "body_text", columnDefinition = "TEXT")
    private String bodyText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EmailStatus status = EmailStatus.QUEUED;

    @Column(name = "external_id")
    private String externalId;

    @Column(name = "tracking_id", nullable = false, unique = true, updatable = false)
    @Builder.Default
    private UUID trackingId = UUID.randomUUID();

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "delivered_at")
    private OffsetDateTime deliveredAt;

    @Column(name = "opened_at")
    private OffsetDateTime openedAt;

    @Column(name = "clicked_at")
    private OffsetDateTime clickedAt;

    @Column(name = "open_count")
    @Builder.Default
    private Integer openCount = 0;

    @Column(name = "click_count")
    @Builder.Default
    private Integer clickCount = 0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count")
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries")
    @Builder.Default
    private Integer maxRetries = 3;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean canRetry() {
        return status == EmailStatus.FAILED && retryCount < maxRetries;
    }

    public void markSending() {
        moveTo(EmailStatus.SENDING);
    }

    public void markSent(String messageId, OffsetDateTime now) {
        moveTo(EmailStatus.SENT);
        this.externalId = messageId;
        this.sentAt = now;
        this.errorMessage = null;
    }

    public void markFailed(String error) {
        moveTo(EmailStatus.FAILED);
        this.errorMessage = error;
        this.retryCount = (retryCount != null ? retryCount : 0) + 1;
    }

    /**
     * Every open counts, but the status only advances from SENT or DELIVERED.
     */
    public void recordOpen(OffsetDateTime now) {
        openCount = (openCount != null ? openCount : 0) + 1;
        if (status == EmailStatus.SENT || status == EmailStatus.DELIVERED) {
            status = EmailStatus.OPENED;
        }
        if (openedAt == null) {
            openedAt = now;
        }
    }

    /**
     * A click implies the message was opened, so a missing open timestamp is
     * filled in as well.
     */
    public void recordClick(OffsetDateTime now) {
        clickCount = (clickCount != null ? clickCount : 0) + 1;
        if (status == EmailStatus.SENT || status == EmailStatus.DELIVERED || status == EmailStatus.OPENED) {
            status = EmailStatus.CLICKED;
        }
        if (clickedAt == null) {
            clickedAt = now;
        }
        if (openedAt == null) {
            openedAt = now;
        }
    }

    public void recordDelivered(OffsetDateTime now) {
        if (status.canTransitionTo(EmailStatus.DELIVERED)) {
            status = EmailStatus.DELIVERED;
        }
        if (deliveredAt == null) {
            deliveredAt = now;
        }
    }

    public void recordReply() {
        if (status.canTransitionTo(EmailStatus.REPLIED)) {
            status = EmailStatus.REPLIED;
        }
    }

    public void recordBounce() {
        if (status.canTransitionTo(EmailStatus.BOUNCED)) {
            status = EmailStatus.BOUNCED;
        }
    }

    public void recordSpam() {
        if (status.canTransitionTo(EmailStatus.SPAM)) {
            status = EmailStatus.SPAM;
        }
    }

    private void moveTo(EmailStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Email " + id + " cannot move from " + status + " to " + target);
        }
        status = target;
    }
}
