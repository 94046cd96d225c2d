package com.salescrm.backend.services;

import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.repositories.UserRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.salescrm.backend.repositories.LeadSpecifications.assignedTo;
import static com.salescrm.backend.repositories.LeadSpecifications.assignedToAny;
import static com.salescrm.backend.repositories.LeadSpecifications.inOrganization;

/**
 * Role based lead visibility. Sales reps see their own leads, managers see
 * their own plus those of the active reps in their department, everyone else
 * sees the whole organization.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class LeadAccessService {

    private final LeadRepository leadRepository;
    private final UserRepository userRepository;

    public Specification<Lead> visibleTo(User actor) {
        Specification<Lead> spec = inOrganization(actor.getOrganization().getId());
        if (actor.isSalesRep()) {
            return spec.and(assignedTo(actor));
        }
        if (actor.isSalesManager()) {
            return spec.and(assignedToAny(teamUserIds(actor)));
        }
        return spec;
    }

    /**
     * The manager plus the active sales reps of the manager's department.
     */
    public List<Long> teamUserIds(User manager) {
        List<Long> ids = new ArrayList<>();
        ids.add(manager.getId());
        if (manager.getDepartment() != null) {
            userRepository.findTeamMembers(manager.getOrganization().getId(), manager.getDepartment(), User.UserRole.SALES_REP)
                    .forEach(member -> ids.add(member.getId()));
        }
        return ids;
    }

    public List<User> teamMembers(User actor) {
        Long orgId = actor.getOrganization().getId();
        if (actor.isSalesManager()) {
            if (actor.getDepartment() == null) {
                return List.of();
            }
            return userRepository.findTeamMembers(orgId, actor.getDepartment(), User.UserRole.SALES_REP);
        }
        if (actor.isAdmin()) {
            return userRepository.findByOrganizationIdAndRoleAndIsActiveTrue(orgId, User.UserRole.SALES_REP);
        }
        return List.of();
    }

    public boolean canAccess(User actor, Lead lead) {
        if (!actor.belongsToOrganization(lead.getOrganization().getId())) {
            return false;
        }
        Long assigneeId = lead.getAssignedTo() != null ? lead.getAssignedTo().getId() : null;
        if (actor.isSalesRep()) {
            return Objects.equals(assigneeId, actor.getId());
        }
        if (actor.isSalesManager()) {
            return assigneeId != null && teamUserIds(actor).contains(assigneeId);
        }
        return true;
    }

    /**
     * Load a lead of the actor's organization, failing when the actor's role does not reach it.
     */
    public Lead requireAccessible(User actor, Long leadId) {
        Lead lead = leadRepository.findByIdAndOrganizationId(leadId, actor.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        if (!canAccess(actor, lead)) {
            throw new AccessDeniedException("You do not have access to lead " + leadId);
        }
        return lead;
    }
}
