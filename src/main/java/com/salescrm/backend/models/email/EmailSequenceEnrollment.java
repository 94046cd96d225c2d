package com.salescrm.backend.models.email;

import com.salescrm.backend.models.Lead;
import jakarta.persistence.*;

import java.time.OffsetDateTime;

/**
 * Progress cursor of one lead through one sequence.
 */
@Entity
@Table(name = "email_sequence_enrollments",
        uniqueConstraints = @UniqueConstraint(columnNames = {"sequence_id", "lead_id"}))
public class EmailSequenceEnrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sequence_id", nullable = false)
    private EmailSequence sequence;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private OffsetDateTime enrolledAt;

    @Column(name = "current_step", nullable = false)
    private Integer currentStep = 0;

    @Column(name = "is_active")
    private Boolean isActive = true;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "emails_sent")
    private Integer emailsSent = 0;

    @Column(name = "last_email_sent")
    private OffsetDateTime lastEmailSent;

    @Column(name = "has_replied")
    private Boolean hasReplied = false;

    public EmailSequenceEnrollment() {}

    public EmailSequenceEnrollment(EmailSequence sequence, Lead lead, OffsetDateTime enrolledAt) {
        this.sequence = sequence;
        this.lead = lead;
        this.enrolledAt = enrolledAt;
    }

    @PrePersist
    protected void onCreate() {
        if (enrolledAt == null) {
            enrolledAt = OffsetDateTime.now();
        }
    }

    public boolean isRunning() {
        return Boolean.TRUE.equals(isActive);
    }

    public boolean replied() {
        return Boolean.TRUE.equals(hasReplied);
    }

    public void skipTo(int stepNumber) {
        this.currentStep = stepNumber;
    }

    public void recordSend(int stepNumber, OffsetDateTime sentAt) {
        this.currentStep = stepNumber;
        this.emailsSent = (emailsSent != null ? emailsSent : 0) + 1;
        this.lastEmailSent = sentAt;
    }

    public void complete(OffsetDateTime now) {
        this.isActive = false;
        this.completedAt = now;
    }

    // Getters and setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public EmailSequence getSequence() { return sequence; }
    public void setSequence(EmailSequence sequence) { this.sequence = sequence; }

    public Lead getLead() { return lead; }
    public void setLead(Lead lead) { this.lead = lead; }

    public OffsetDateTime getEnrolledAt() { return enrolledAt; }
    public void setEnrolledAt(OffsetDateTime enrolledAt) { this.enrolledAt = enrolledAt; }

    public Integer getCurrentStep() { return currentStep; }
    public void setCurrentStep(Integer currentStep) { this.currentStep = currentStep; }

    public Boolean getIsActive() { return isActive; }
    public void setIsActive(Boolean isActive) { this.isActive = isActive; }

    public OffsetDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(OffsetDateTime completedAt) { this.completedAt = completedAt; }

    public Integer getEmailsSent() { return emailsSent; }
    public void setEmailsSent(Integer emailsSent) { this.emailsSent = emailsSent; }

    public OffsetDateTime getLastEmailSent() { return lastEmailSent; }
    public void setLastEmailSent(OffsetDateTime lastEmailSent) { this.lastEmailSent = lastEmailSent; }

    public Boolean getHasReplied() { return hasReplied; }
    public void setHasReplied(Boolean hasReplied) { this.hasReplied = hasReplied; }
}
