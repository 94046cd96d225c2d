package com.salescrm.backend.repositories.email;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailSequenceRepository extends JpaRepository<EmailSequence, Long> {

    List<EmailSequence> findByUserOrderByCreatedAtDesc(User user);

    Optional<EmailSequence> findByIdAndUser(Long id, User user);

    @Query("SELECT s FROM EmailSequence s WHERE s.isActive = true AND s.triggerOnLeadCreation = true " +
            "AND s.user.organization.id = :orgId")
    List<EmailSequence> findCreationTriggered(@Param("orgId") Long organizationId);

    @Query("SELECT DISTINCT s FROM EmailSequence s JOIN s.triggerOnStatusChange t " +
            "WHERE s.isActive = true AND t = :status AND s.user.organization.id = :orgId")
    List<EmailSequence> findStatusTriggered(@Param("orgId") Long organizationId, @Param("status") LeadStatus status);

    @Query("SELECT DISTINCT s FROM EmailSequence s JOIN s.triggerOnPriorityChange t " +
            "WHERE s.isActive = true AND t = :priority AND s.user.organization.id = :orgId")
    List<EmailSequence> findPriorityTriggered(@Param("orgId") Long organizationId, @Param("priority") LeadPriority priority);
}
