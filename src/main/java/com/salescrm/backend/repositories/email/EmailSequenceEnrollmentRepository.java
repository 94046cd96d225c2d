package com.salescrm.backend.repositories.email;

import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.models.email.EmailSequenceEnrollment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailSequenceEnrollmentRepository extends JpaRepository<EmailSequenceEnrollment, Long> {

    Optional<EmailSequenceEnrollment> findBySequenceAndLead(EmailSequence sequence, Lead lead);

    List<EmailSequenceEnrollment> findBySequenceOrderByEnrolledAtDesc(EmailSequence sequence);

    List<EmailSequenceEnrollment> findByLeadAndIsActiveTrue(Lead lead);

    @Query("SELECT e FROM EmailSequenceEnrollment e WHERE e.isActive = true AND e.sequence.isActive = true ORDER BY e.id ASC")
    List<EmailSequenceEnrollment> findRunnable();

    long countBySequenceAndIsActiveTrue(EmailSequence sequence);

    long countBySequenceAndCompletedAtIsNotNull(EmailSequence sequence);
}
