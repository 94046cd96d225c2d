package com.salescrm.backend.repositories.email;

import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.models.email.EmailSequenceStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailSequenceStepRepository extends JpaRepository<EmailSequenceStep, Long> {

    List<EmailSequenceStep> findBySequenceOrderByStepNumberAsc(EmailSequence sequence);

    Optional<EmailSequenceStep> findBySequenceAndStepNumber(EmailSequence sequence, Integer stepNumber);

    Optional<EmailSequenceStep> findBySequenceAndStepNumberAndIsActiveTrue(EmailSequence sequence, Integer stepNumber);

    boolean existsBySequenceAndStepNumber(EmailSequence sequence, Integer stepNumber);
}
