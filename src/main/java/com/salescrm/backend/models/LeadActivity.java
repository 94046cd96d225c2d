package com.salescrm.backend.models;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;

/**
 * Append-only log entry on a lead. Rows are never updated once written.
 */
@Entity
@Immutable
@Table(name = "lead_activities", indexes = @Index(name = "idx_lead_activities_lead", columnList = "lead_id, created_at"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"lead", "user"})
public class LeadActivity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false, updatable = false)
    private Lead lead;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 20, updatable = false)
    private ActivityType activityType;

    @Column(nullable = false, length = 200, updatable = false)
    private String subject;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public enum ActivityType {
        CALL("Call"),
        EMAIL("Email"),
        MEETING("Meeting"),
        NOTE("Note"),
        STATUS_CHANGE("Status Change"),
        ASSIGNMENT("Assignment");

        private final String displayName;

        ActivityType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        /**
         * Activities that count as reaching out to the lead.
         */
        public boolean isContact() {
            return this == CALL || this == EMAIL || this == MEETING;
        }
    }
}
