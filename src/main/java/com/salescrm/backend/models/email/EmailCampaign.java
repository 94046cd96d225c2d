package com.salescrm.backend.models.email;

import com.salescrm.backend.enums.CampaignStatus;
import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadSource;
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
import java.util.HashSet;
import java.util.Set;

/**
 * A one-shot bulk send. The audience is resolved once at creation time and
 * frozen into queued {@link Email} rows that are drained batch by batch.
 */
@Entity
@Table(name = "email_campaigns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(of = {"id", "name", "status", "totalRecipients", "emailsSent", "emailsFailed"})
public class EmailCampaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private EmailTemplate template;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_config_id", nullable = false)
    private EmailConfiguration emailConfig;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private CampaignStatus status = CampaignStatus.DRAFT;

    @Column(name = "scheduled_at")
    private OffsetDateTime scheduledAt;

    @Column(name = "send_now")
    @Builder.Default
    private Boolean sendNow = false;

    // Targeting
    @Column(name = "target_all_leads")
    @Builder.Default
    private Boolean targetAllLeads = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "email_campaign_target_statuses", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "status")
    @Builder.Default
    private Set<LeadStatus> targetStatuses = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "email_campaign_target_priorities", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "priority")
    @Builder.Default
    private Set<LeadPriority> targetPriorities = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "email_campaign_target_sources",
            joinColumns = @JoinColumn(name = "campaign_id"),
            inverseJoinColumns = @JoinColumn(name = "source_id"))
    @Builder.Default
    private Set<LeadSource> targetSources = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "email_campaign_specific_leads",
            joinColumns = @JoinColumn(name = "campaign_id"),
            inverseJoinColumns = @JoinColumn(name = "lead_id"))
    @Builder.Default
    private Set<Lead> specificLeads = new HashSet<>();

    // Sending settings
    @Column(name = "batch_size")
    @Builder.Default
    private Integer batchSize = 50;

    /** Seconds the caller should wait between batches. Not enforced by the engine. */
    @Column(name = "delay_between_batches")
    @Builder.Default
    private Integer delayBetweenBatches = 60;

    // Statistics
    @Column(name = "total_recipients")
    @Builder.Default
    private Integer totalRecipients = 0;

    @Column(name = "emails_sent")
    @Builder.Default
    private Integer emailsSent = 0;

    @Column(name = "emails_failed")
    @Builder.Default
    private Integer emailsFailed = 0;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean hasTargetingCriteria() {
        return Boolean.TRUE.equals(targetAllLeads)
                || !targetStatuses.isEmpty()
                || !targetPriorities.isEmpty()
                || !targetSources.isEmpty()
                || !specificLeads.isEmpty();
    }

    public void transitionTo(CampaignStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Campaign " + id + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    public void markStarted(OffsetDateTime now) {
        transitionTo(CampaignStatus.SENDING);
        if (startedAt == null) {
            startedAt = now;
        }
    }

    public void markCompleted(OffsetDateTime now) {
        transitionTo(CampaignStatus.SENT);
        completedAt = now;
    }

    public void recordBatch(int sent, int failed) {
        emailsSent += sent;
        emailsFailed += failed;
    }

    public void recordRetrySuccess() {
        emailsSent += 1;
        if (emailsFailed > 0) {
            emailsFailed -= 1;
        }
    }
}
