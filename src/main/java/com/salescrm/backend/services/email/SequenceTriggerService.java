package com.salescrm.backend.services.email;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.repositories.email.EmailSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Enrolls leads into the sequences of their organization when they are
 * created or move into a trigger status or priority. Matching happens inside
 * the lead operation; enrollment runs after it has committed, one sequence
 * per transaction, so a failing sequence never undoes the lead change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceTriggerService {

    private final EmailSequenceRepository sequenceRepository;
    private final EmailSequenceService sequenceService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public void onLeadCreated(Lead lead) {
        List<EmailSequence> sequences = sequenceRepository.findCreationTriggered(lead.getOrganization().getId());
        publish(lead, sequences, "LEAD_CREATED");
    }

    @Transactional
    public void onStatusChanged(Lead lead, LeadStatus oldStatus, LeadStatus newStatus) {
        if (newStatus == null || newStatus == oldStatus) {
            return;
        }
        List<EmailSequence> sequences = sequenceRepository.findStatusTriggered(lead.getOrganization().getId(), newStatus);
        publish(lead, sequences, "STATUS_CHANGED to " + newStatus);
    }

    @Transactional
    public void onPriorityChanged(Lead lead, LeadPriority oldPriority, LeadPriority newPriority) {
        if (newPriority == null || newPriority == oldPriority) {
            return;
        }
        List<EmailSequence> sequences = sequenceRepository.findPriorityTriggered(lead.getOrganization().getId(), newPriority);
        publish(lead, sequences, "PRIORITY_CHANGED to " + newPriority);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void enrollTriggered(LeadTriggeredEvent event) {
        for (Long sequenceId : event.sequenceIds()) {
            try {
                sequenceService.enrollTriggered(sequenceId, event.leadId());
            } catch (Exception e) {
                log.error("Error enrolling lead {} in sequence {} ({}): {}",
                        event.leadId(), sequenceId, event.trigger(), e.getMessage(), e);
            }
        }
    }

    private void publish(Lead lead, List<EmailSequence> sequences, String trigger) {
        if (sequences.isEmpty()) {
            return;
        }
        log.info("Trigger {} for lead {} matches {} sequence(s)", trigger, lead.getId(), sequences.size());
        List<Long> sequenceIds = sequences.stream()
                .map(EmailSequence::getId)
                .collect(Collectors.toList());
        eventPublisher.publishEvent(new LeadTriggeredEvent(lead.getId(), sequenceIds, trigger));
    }
}
