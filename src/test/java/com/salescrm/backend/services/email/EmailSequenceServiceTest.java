package com.salescrm.backend.services.email;

import com.salescrm.backend.enums.LeadStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.Organization;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.models.email.EmailSequenceEnrollment;
import com.salescrm.backend.models.email.EmailSequenceStep;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailSequenceEnrollmentRepository;
import com.salescrm.backend.repositories.email.EmailSequenceRepository;
import com.salescrm.backend.repositories.email.EmailSequenceStepRepository;
import com.salescrm.backend.services.LeadAccessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailSequenceServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2024-06-10T09:00:00Z");

    @Mock
    private EmailSequenceRepository sequenceRepository;

    @Mock
    private EmailSequenceStepRepository stepRepository;

    @Mock
    private EmailSequenceEnrollmentRepository enrollmentRepository;

    @Mock
    private EmailRepository emailRepository;

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private EmailTemplateService templateService;

    @Mock
    private EmailConfigurationService configurationService;

    @Mock
    private EmailDeliveryService deliveryService;

    @Mock
    private TemplateRenderer templateRenderer;

    @Mock
    private LeadAccessService leadAccessService;

    private EmailSequenceService sequenceService;

    private User owner;
    private Lead lead;
    private EmailSequence sequence;
    private EmailConfiguration config;
    private EmailTemplate template;

    @BeforeEach
    void setUp() {
        sequenceService = new EmailSequenceService(sequenceRepository, stepRepository, enrollmentRepository,
                emailRepository, leadRepository, templateService, configurationService, deliveryService, templateRenderer,
                leadAccessService, new TransactionTemplate(mock(PlatformTransactionManager.class)),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));

        owner = User.builder()
                .id(1L)
                .firstName("Owner")
                .email("owner@example.com")
                .organization(Organization.builder().id(1L).name("Org").build())
                .build();
        lead = Lead.builder()
                .id(20L)
                .firstName("Neha")
                .email("neha@leads.test")
                .status(LeadStatus.NEW)
                .build();
        sequence = EmailSequence.builder()
                .id(3L)
                .name("Onboarding")
                .user(owner)
                .build();
        config = EmailConfiguration.builder()
                .id(7L)
                .user(owner)
                .fromEmail("sales@example.com")
                .build();
        template = EmailTemplate.builder()
                .id(5L)
                .user(owner)
                .subject("Hi")
                .bodyHtml("<p>Hi</p>")
                .build();
    }

    @Test
    void enroll_ShouldReturnExistingEnrollmentUnchanged() {
        // Given
        EmailSequenceEnrollment existing = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(3));
        when(enrollmentRepository.findBySequenceAndLead(sequence, lead)).thenReturn(Optional.of(existing));

        // When
        EmailSequenceEnrollment result = sequenceService.enroll(lead, sequence);

        // Then
        assertThat(result).isSameAs(existing);
        verify(enrollmentRepository, never()).save(any());
        verifyNoInteractions(stepRepository, deliveryService);
    }

    @Test
    void enroll_ShouldSendFirstStepRightAwayWithoutStartDelay() {
        // Given
        EmailSequenceStep first = step(1, 0);
        when(enrollmentRepository.findBySequenceAndLead(sequence, lead)).thenReturn(Optional.empty());
        when(enrollmentRepository.save(any(EmailSequenceEnrollment.class))).thenAnswer(inv -> inv.getArgument(0));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 1))
                .thenReturn(Optional.of(first));
        stubSending();

        // When
        EmailSequenceEnrollment enrollment = sequenceService.enroll(lead, sequence);

        // Then
        assertThat(enrollment.getEnrolledAt()).isEqualTo(NOW);
        assertThat(enrollment.getCurrentStep()).isEqualTo(1);
        assertThat(enrollment.getEmailsSent()).isEqualTo(1);
        assertThat(enrollment.getLastEmailSent()).isEqualTo(NOW);
        verify(deliveryService).deliver(any(Email.class), eq(config));
        verify(templateService).recordUsage(template);
    }

    @Test
    void enroll_ShouldWaitWhenSequenceHasStartDelay() {
        // Given
        sequence.setDelayStartDays(2);
        when(enrollmentRepository.findBySequenceAndLead(sequence, lead)).thenReturn(Optional.empty());
        when(enrollmentRepository.save(any(EmailSequenceEnrollment.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        EmailSequenceEnrollment enrollment = sequenceService.enroll(lead, sequence);

        // Then
        assertThat(enrollment.getCurrentStep()).isZero();
        assertThat(enrollment.isRunning()).isTrue();
        verifyNoInteractions(stepRepository, deliveryService);
    }

    @Test
    void advance_ShouldPassOverNoReplyStepsOnceLeadReplied() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(5));
        enrollment.setHasReplied(true);
        EmailSequenceStep reminder = step(1, 1);
        EmailSequenceStep thanks = step(2, 1);
        thanks.setSendOnlyIfNotReplied(false);
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 1))
                .thenReturn(Optional.of(reminder));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 2))
                .thenReturn(Optional.of(thanks));
        stubSending();

        // When
        boolean sent = sequenceService.advance(enrollment);

        // Then
        assertThat(sent).isTrue();
        assertThat(enrollment.getCurrentStep()).isEqualTo(2);
        assertThat(enrollment.getEmailsSent()).isEqualTo(1);
    }

    @Test
    void advance_ShouldPassOverStepsWhoseStatusFilterExcludesLead() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(5));
        EmailSequenceStep qualifiedOnly = step(1, 1);
        qualifiedOnly.setSendOnlyIfStatus(Set.of(LeadStatus.QUALIFIED));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 1))
                .thenReturn(Optional.of(qualifiedOnly));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 2))
                .thenReturn(Optional.empty());

        // When
        boolean sent = sequenceService.advance(enrollment);

        // Then
        assertThat(sent).isFalse();
        assertThat(enrollment.isRunning()).isFalse();
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW);
        assertThat(enrollment.getEmailsSent()).isZero();
        verifyNoInteractions(deliveryService);
    }

    @Test
    void advance_ShouldHoldPositionWithoutEmailConfiguration() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(5));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 1))
                .thenReturn(Optional.of(step(1, 0)));
        when(configurationService.resolveSendingConfig(owner)).thenReturn(Optional.empty());

        // When
        boolean sent = sequenceService.advance(enrollment);

        // Then
        assertThat(sent).isFalse();
        assertThat(enrollment.getCurrentStep()).isZero();
        assertThat(enrollment.isRunning()).isTrue();
        verifyNoInteractions(deliveryService, emailRepository);
    }

    @Test
    void advance_ShouldIgnoreFinishedEnrollment() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(5));
        enrollment.complete(NOW.minusDays(1));

        // When & Then
        assertThat(sequenceService.advance(enrollment)).isFalse();
        verifyNoInteractions(stepRepository);
    }

    @Test
    void isDue_ShouldCountDaysSinceLastEmail() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(10));
        enrollment.recordSend(1, NOW.minusDays(2));

        // When & Then
        assertThat(sequenceService.isDue(enrollment, step(2, 2), NOW)).isTrue();
        assertThat(sequenceService.isDue(enrollment, step(2, 3), NOW)).isFalse();
    }

    @Test
    void isDue_ShouldCountFromEnrollmentBeforeFirstEmail() {
        // Given
        sequence.setDelayStartDays(3);
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(2));

        // When & Then
        assertThat(sequenceService.isDue(enrollment, step(1, 1), NOW)).isTrue();
        assertThat(sequenceService.isDue(enrollment, step(1, 2), NOW)).isTrue();
        assertThat(sequenceService.isDue(enrollment, step(1, 3), NOW)).isFalse();
    }

    @Test
    void advance_ShouldCompleteWhenFollowingStepNumberIsMissing() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(5));
        enrollment.recordSend(1, NOW.minusDays(3));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 2)).thenReturn(Optional.empty());

        // When
        boolean sent = sequenceService.advance(enrollment);

        // Then
        assertThat(sent).isFalse();
        assertThat(enrollment.isRunning()).isFalse();
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW);
        verify(stepRepository, never()).findBySequenceAndStepNumberAndIsActiveTrue(sequence, 3);
        verifyNoInteractions(deliveryService);
    }

    @Test
    void tick_ShouldLeaveEnrollmentWithoutNextStepRunning() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(10));
        enrollment.setId(40L);
        enrollment.recordSend(2, NOW.minusDays(6));
        when(enrollmentRepository.findRunnable()).thenReturn(List.of(enrollment));
        when(enrollmentRepository.findById(40L)).thenReturn(Optional.of(enrollment));
        when(stepRepository.findBySequenceAndStepNumber(sequence, 3)).thenReturn(Optional.empty());

        // When
        ProcessingSummary summary = sequenceService.tick();

        // Then
        assertThat(summary).isEqualTo(new ProcessingSummary(1, 0, 0));
        assertThat(enrollment.isRunning()).isTrue();
        assertThat(enrollment.getCompletedAt()).isNull();
        verify(enrollmentRepository, never()).save(any());
    }

    @Test
    void tick_ShouldLeaveEnrollmentsThatAreNotDue() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(10));
        enrollment.setId(40L);
        enrollment.recordSend(1, NOW.minusDays(1));
        when(enrollmentRepository.findRunnable()).thenReturn(List.of(enrollment));
        when(enrollmentRepository.findById(40L)).thenReturn(Optional.of(enrollment));
        when(stepRepository.findBySequenceAndStepNumber(sequence, 2)).thenReturn(Optional.of(step(2, 3)));

        // When
        ProcessingSummary summary = sequenceService.tick();

        // Then
        assertThat(summary).isEqualTo(new ProcessingSummary(1, 0, 0));
        assertThat(enrollment.getCurrentStep()).isEqualTo(1);
        verifyNoInteractions(deliveryService);
    }

    @Test
    void tick_ShouldSendDueStepAndCountErrors() {
        // Given
        EmailSequenceEnrollment due = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(10));
        due.setId(40L);
        due.recordSend(1, NOW.minusDays(4));
        when(enrollmentRepository.findRunnable()).thenReturn(List.of(due, enrollmentWithId(41L)));
        when(enrollmentRepository.findById(40L)).thenReturn(Optional.of(due));
        when(enrollmentRepository.findById(41L)).thenThrow(new IllegalStateException("database down"));
        EmailSequenceStep second = step(2, 3);
        when(stepRepository.findBySequenceAndStepNumber(sequence, 2)).thenReturn(Optional.of(second));
        when(stepRepository.findBySequenceAndStepNumberAndIsActiveTrue(sequence, 2)).thenReturn(Optional.of(second));
        stubSending();

        // When
        ProcessingSummary summary = sequenceService.tick();

        // Then
        assertThat(summary).isEqualTo(new ProcessingSummary(2, 1, 1));
        assertThat(due.getCurrentStep()).isEqualTo(2);
    }

    @Test
    void enrollTriggered_ShouldEnrollLeadInActiveSequence() {
        // Given
        sequence.setDelayStartDays(1);
        when(sequenceRepository.findById(3L)).thenReturn(Optional.of(sequence));
        when(leadRepository.findById(20L)).thenReturn(Optional.of(lead));
        when(enrollmentRepository.findBySequenceAndLead(sequence, lead)).thenReturn(Optional.empty());
        when(enrollmentRepository.save(any(EmailSequenceEnrollment.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        sequenceService.enrollTriggered(3L, 20L);

        // Then
        verify(enrollmentRepository).save(any(EmailSequenceEnrollment.class));
        verifyNoInteractions(deliveryService);
    }

    @Test
    void enrollTriggered_ShouldSkipSequenceSwitchedOffSinceTheTrigger() {
        // Given
        sequence.setIsActive(false);
        when(sequenceRepository.findById(3L)).thenReturn(Optional.of(sequence));

        // When
        sequenceService.enrollTriggered(3L, 20L);

        // Then
        verifyNoInteractions(leadRepository, enrollmentRepository);
    }

    @Test
    void markReplied_ShouldFlagActiveEnrollments() {
        // Given
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW.minusDays(1));
        when(enrollmentRepository.findByLeadAndIsActiveTrue(lead)).thenReturn(List.of(enrollment));

        // When
        sequenceService.markReplied(lead);

        // Then
        assertThat(enrollment.replied()).isTrue();
        verify(enrollmentRepository).saveAll(List.of(enrollment));
    }

    private void stubSending() {
        when(configurationService.resolveSendingConfig(owner)).thenReturn(Optional.of(config));
        when(templateRenderer.render(eq(template), eq(lead), eq(owner)))
                .thenReturn(new RenderedEmail("Hi", "<p>Hi</p>", "Hi"));
        when(emailRepository.save(any(Email.class))).thenAnswer(inv -> inv.getArgument(0));
        when(deliveryService.deliver(any(Email.class), eq(config))).thenReturn(SendResult.sent("msg"));
    }

    private EmailSequenceStep step(int number, int delayDays) {
        EmailSequenceStep step = new EmailSequenceStep(number, template, delayDays);
        step.setSequence(sequence);
        return step;
    }

    private EmailSequenceEnrollment enrollmentWithId(Long id) {
        EmailSequenceEnrollment enrollment = new EmailSequenceEnrollment(sequence, lead, NOW);
        enrollment.setId(id);
        return enrollment;
    }
}
