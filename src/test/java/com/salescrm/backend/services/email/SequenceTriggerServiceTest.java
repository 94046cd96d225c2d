package com.salescrm.backend.services.email;

import com.salescrm.backend.enums.LeadPriority;
import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.Organization;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.repositories.email.EmailSequenceRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SequenceTriggerServiceTest {

    @Mock
    private EmailSequenceRepository sequenceRepository;

    @Mock
    private EmailSequenceService sequenceService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private SequenceTriggerService triggerService;

    private Lead lead;

    @BeforeEach
    void setUp() {
        lead = Lead.builder()
                .id(20L)
                .firstName("Neha")
                .organization(Organization.builder().id(1L).name("Org").build())
                .build();
    }

    @Test
    void onLeadCreated_ShouldPublishMatchingSequencesForAfterCommit() {
        // Given
        when(sequenceRepository.findCreationTriggered(1L)).thenReturn(List.of(sequence(3L), sequence(4L)));

        // When
        triggerService.onLeadCreated(lead);

        // Then
        verify(eventPublisher).publishEvent(new LeadTriggeredEvent(20L, List.of(3L, 4L), "LEAD_CREATED"));
        verifyNoInteractions(sequenceService);
    }

    @Test
    void onStatusChanged_ShouldIgnoreUnchangedStatus() {
        // When
        triggerService.onStatusChanged(lead, LeadStatus.QUALIFIED, LeadStatus.QUALIFIED);

        // Then
        verifyNoInteractions(sequenceRepository, eventPublisher);
    }

    @Test
    void onPriorityChanged_ShouldPublishNothingWithoutMatchingSequence() {
        // Given
        when(sequenceRepository.findPriorityTriggered(1L, LeadPriority.HOT)).thenReturn(List.of());

        // When
        triggerService.onPriorityChanged(lead, LeadPriority.WARM, LeadPriority.HOT);

        // Then
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void enrollTriggered_ShouldKeepEnrollingAfterOneSequenceFails() {
        // Given
        doThrow(new EntityNotFoundException("Sequence not found: 3"))
                .when(sequenceService).enrollTriggered(3L, 20L);

        // When
        triggerService.enrollTriggered(new LeadTriggeredEvent(20L, List.of(3L, 4L), "STATUS_CHANGED to QUALIFIED"));

        // Then
        verify(sequenceService).enrollTriggered(3L, 20L);
        verify(sequenceService).enrollTriggered(4L, 20L);
    }

    private EmailSequence sequence(Long id) {
        return EmailSequence.builder().id(id).name("Sequence " + id).build();
    }
}
