package com.salescrm.backend.repositories;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.Collection;

/**
 * Reusable predicates over {@link Lead}. Each returns {@code null} when its
 * argument is empty so callers can chain them with {@code and}.
 */
public final class LeadSpecifications {

    private LeadSpecifications() {
    }

    public static Specification<Lead> inOrganization(Long organizationId) {
        return (root, query, cb) -> cb.equal(root.get("organization").get("id"), organizationId);
    }

    public static Specification<Lead> assignedTo(User user) {
        return (root, query, cb) -> cb.equal(root.get("assignedTo").get("id"), user.getId());
    }

    public static Specification<Lead> assignedToAny(Collection<Long> userIds) {
        return (root, query, cb) -> root.get("assignedTo").get("id").in(userIds);
    }

    public static Specification<Lead> hasEmail() {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("email")),
                cb.notEqual(cb.trim(root.get("email")), ""));
    }

    public static Specification<Lead> statusIn(Collection<LeadStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> root.get("status").in(statuses);
    }

    public static Specification<Lead> priorityIn(Collection<LeadPriority> priorities) {
        if (priorities == null || priorities.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> root.get("priority").in(priorities);
    }

    public static Specification<Lead> sourceIn(Collection<Long> sourceIds) {
        if (sourceIds == null || sourceIds.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> root.get("source").get("id").in(sourceIds);
    }

    public static Specification<Lead> idIn(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        return (root, query, cb) -> root.get("id").in(ids);
    }

    public static Specification<Lead> assigneeIs(Long userId) {
        if (userId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("assignedTo").get("id"), userId);
    }

    public static Specification<Lead> createdBetween(OffsetDateTime from, OffsetDateTime to) {
        if (from == null && to == null) {
            return null;
        }
        return (root, query, cb) -> {
            if (from == null) {
                return cb.lessThan(root.get("createdAt"), to);
            }
            if (to == null) {
                return cb.greaterThanOrEqualTo(root.get("createdAt"), from);
            }
            return cb.and(cb.greaterThanOrEqualTo(root.get("createdAt"), from),
                    cb.lessThan(root.get("createdAt"), to));
        };
    }

    /**
     * Open-pipeline leads never contacted, or last contacted before the cutoff.
     */
    public static Specification<Lead> overdue(OffsetDateTime contactCutoff) {
        return (root, query, cb) -> cb.and(
                root.get("status").in(LeadStatus.NEW, LeadStatus.CONTACTED, LeadStatus.QUALIFIED),
                cb.or(cb.isNull(root.get("lastContacted")),
                        cb.lessThan(root.get("lastContacted"), contactCutoff)));
    }

    /**
     * Case-insensitive match over names, email, company and phone.
     */
    public static Specification<Lead> matchesText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String like = "%" + text.trim().toLowerCase() + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("firstName")), like),
                cb.like(cb.lower(cb.coalesce(root.get("lastName"), "")), like),
                cb.like(cb.lower(cb.coalesce(root.get("email"), "")), like),
                cb.like(cb.lower(cb.coalesce(root.get("company"), "")), like),
                cb.like(cb.coalesce(root.get("phone"), ""), like));
    }
}
