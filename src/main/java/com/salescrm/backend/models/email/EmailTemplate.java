package com.salescrm.backend.models.email;

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

@Entity
@Table(name = "email_templates")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"user", "bodyHtml", "bodyText"})
public class EmailTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "template_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TemplateType templateType = TemplateType.CUSTOM;

    @Column(name = "subject", nullable = false, length = 300)
    private String subject;

    @Column(name = "body_html", nullable = false, columnDefinition = "TEXT")
    private String bodyHtml;

    @Column(name = "body_text", columnDefinition = "TEXT")
    private String bodyText;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "is_shared")
    @Builder.Default
    private Boolean isShared = false;

    // Usage stats, the only fields touched at send time
    @Column(name = "usage_count")
    @Builder.Default
    private Integer usageCount = 0;

    @Column(name = "last_used")
    private OffsetDateTime lastUsed;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public enum TemplateType {
        WELCOME("Welcome Email"),
        FOLLOW_UP("Follow-up Email"),
        QUOTE_REQUEST("Quote Request"),
        PROPOSAL("Proposal Email"),
        THANK_YOU("Thank You Email"),
        NURTURE("Nurture Campaign"),
        APPOINTMENT("Appointment Confirmation"),
        CUSTOM("Custom Template");

        private final String displayName;

        TemplateType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public void recordUsage(OffsetDateTime usedAt) {
        usageCount = (usageCount != null ? usageCount : 0) + 1;
        lastUsed = usedAt;
    }

    public boolean isVisibleTo(User viewer) {
        if (user != null && user.getId() != null && user.getId().equals(viewer.getId())) {
            return true;
        }
        return Boolean.TRUE.equals(isShared)
                && user != null
                && user.getOrganization() != null
                && viewer.belongsToOrganization(user.getOrganization().getId());
    }
}
