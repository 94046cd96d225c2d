package com.salescrm.backend.models;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;

@Entity
@Table(name = "leads", indexes = {
        @Index(name = "idx_leads_org_status", columnList = "organization_id, status"),
        @Index(name = "idx_leads_assigned_to", columnList = "assigned_to_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"organization", "source", "assignedTo", "createdBy"})
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id", nullable = false)
    private Organization organization;

    // Basic information
    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "email")
    private String email;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "company", length = 200)
    private String company;

    @Column(name = "job_title", length = 100)
    private String jobTitle;

    // Lead details
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_id")
    private LeadSource source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private LeadPriority priority = LeadPriority.WARM;

    // Assignment
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_to_id")
    private User assignedTo;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by_id", nullable = false)
    private User createdBy;

    // Address
    @Column(columnDefinition = "TEXT")
    private String address;

    private String city;

    private String state;

    @Builder.Default
    private String country = "India";

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    // Business information
    @Column(precision = 12, scale = 2)
    private BigDecimal budget;

    @Column(columnDefinition = "TEXT")
    private String requirements;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "last_contacted")
    private OffsetDateTime lastContacted;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = LeadStatus.NEW;
        }
        if (priority == null) {
            priority = LeadPriority.WARM;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public String getFullName() {
        return (firstName + " " + (lastName != null ? lastName : "")).trim();
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    public boolean isHot() {
        return priority == LeadPriority.HOT;
    }

    /**
     * A lead is overdue when it was never contacted within three days of
     * creation, or when the last contact is more than a week old.
     */
    public boolean isOverdue(OffsetDateTime now) {
        if (lastContacted == null) {
            return createdAt != null && Duration.between(createdAt, now).toDays() > 3;
        }
        return Duration.between(lastContacted, now).toDays() > 7;
    }
}
