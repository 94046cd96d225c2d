package com.salescrm.backend.models.dashboard;

import com.salescrm.backend.models.User;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A measurable goal for one user over a period. The current value is bumped
 * by the lead and activity operations that count toward it.
 */
@Entity
@Table(name = "kpi_targets",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "kpi_type", "period_start", "period_end"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "user")
public class KpiTarget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "kpi_type", nullable = false, length = 30)
    private KpiType kpiType;

    @Column(name = "target_value", nullable = false, precision = 12, scale = 2)
    private BigDecimal targetValue;

    @Column(name = "current_value", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal currentValue = BigDecimal.ZERO;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "is_active")
    @Builder.Default
    private Boolean isActive = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public enum KpiType {
        LEADS_CREATED("Leads Created"),
        LEADS_CONVERTED("Leads Converted"),
        REVENUE_GENERATED("Revenue Generated"),
        CALLS_MADE("Calls Made"),
        EMAILS_SENT("Emails Sent"),
        MEETINGS_SCHEDULED("Meetings Scheduled");

        private final String displayName;

        KpiType(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public void increment(BigDecimal amount) {
        currentValue = currentValue.add(amount);
    }

    public double getCompletionPercentage() {
        if (targetValue == null || targetValue.signum() <= 0) {
            return 0.0;
        }
        BigDecimal pct = currentValue.multiply(BigDecimal.valueOf(100))
                .divide(targetValue, 2, RoundingMode.HALF_UP);
        return Math.min(pct.doubleValue(), 100.0);
    }

    public boolean isAchieved() {
        return targetValue != null && currentValue.compareTo(targetValue) >= 0;
    }
}
