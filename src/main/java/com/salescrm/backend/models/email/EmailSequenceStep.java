package com.salescrm.backend.models.email;

import com.salescrm.backend.enums.LeadStatus;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "email_sequence_steps",
        uniqueConstraints = @UniqueConstraint(columnNames = {"sequence_id", "step_number"}))
public class EmailSequenceStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sequence_id", nullable = false)
    private EmailSequence sequence;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private EmailTemplate template;

    @Column(name = "step_number", nullable = false)
    private Integer stepNumber;

    @Column(name = "delay_days", nullable = false)
    private Integer delayDays = 1;

    @Column(name = "send_only_if_not_replied")
    private Boolean sendOnlyIfNotReplied = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "email_sequence_step_statuses", joinColumns = @JoinColumn(name = "step_id"))
    @Column(name = "status")
    private Set<LeadStatus> sendOnlyIfStatus = new HashSet<>();

    @Column(name = "is_active")
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public EmailSequenceStep() {}

    public EmailSequenceStep(Integer stepNumber, EmailTemplate template, Integer delayDays) {
        this.stepNumber = stepNumber;
        this.template = template;
        this.delayDays = delayDays;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public boolean isRunnable() {
        return Boolean.TRUE.equals(isActive);
    }

    /**
     * An empty status filter admits every lead.
     */
    public boolean admitsStatus(LeadStatus status) {
        return sendOnlyIfStatus == null || sendOnlyIfStatus.isEmpty() || sendOnlyIfStatus.contains(status);
    }

    // Getters and setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public EmailSequence getSequence() { return sequence; }
    public void setSequence(EmailSequence sequence) { this.sequence = sequence; }

    public EmailTemplate getTemplate() { return template; }
    public void setTemplate(EmailTemplate template) { this.template = template; }

    public Integer getStepNumber() { return stepNumber; }
    public void setStepNumber(Integer stepNumber) { this.stepNumber = stepNumber; }

    public Integer getDelayDays() { return delayDays; }
    public void setDelayDays(Integer delayDays) { this.delayDays = delayDays; }

    public Boolean getSendOnlyIfNotReplied() { return sendOnlyIfNotReplied; }
    public void setSendOnlyIfNotReplied(Boolean sendOnlyIfNotReplied) { this.sendOnlyIfNotReplied = sendOnlyIfNotReplied; }

    public Set<LeadStatus> getSendOnlyIfStatus() { return sendOnlyIfStatus; }
    public void setSendOnlyIfStatus(Set<LeadStatus> sendOnlyIfStatus) { this.sendOnlyIfStatus = sendOnlyIfStatus; }

    public Boolean getIsActive() { return isActive; }
    public void setIsActive(Boolean isActive) { this.isActive = isActive; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
