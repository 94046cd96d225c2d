package com.salescrm.backend.models.email;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Automated drip of ordered steps. Leads are enrolled automatically when they
 * are created or when their status or priority changes into a trigger set.
 */
@Entity
@Table(name = "email_sequences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"user", "steps"})
public class EmailSequence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "trigger_on_lead_creation")
    @Builder.Default
    private Boolean triggerOnLeadCreation = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "email_sequence_status_triggers", joinColumns = @JoinColumn(name = "sequence_id"))
    @Column(name = "status")
    @Builder.Default
    private Set<LeadStatus> triggerOnStatusChange = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @Enumerated(EnumType.STRING)
    @CollectionTable(name = "email_sequence_priority_triggers", joinColumns = @JoinColumn(name = "sequence_id"))
    @Column(name = "priority")
    @Builder.Default
    private Set<LeadPriority> triggerOnPriorityChange = new HashSet<>();

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "delay_start_days")
    @Builder.Default
    private Integer delayStartDays = 0;

    @OneToMany(mappedBy = "sequence", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("stepNumber ASC")
    @Builder.Default
    private List<EmailSequenceStep> steps = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isRunning() {
        return Boolean.TRUE.equals(isActive);
    }

    public void addStep(EmailSequenceStep step) {
        step.setSequence(this);
        steps.add(step);
    }
}
