package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.EmailSequenceDto;
import com.salescrm.backend.dto.email.EmailSequenceStepDto;
import com.salescrm.backend.dto.email.SequenceEnrollmentDto;
import com.salescrm.backend.dto.email.request.SequenceRequest;
import com.salescrm.backend.dto.email.request.SequenceStepRequest;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.Lead;
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
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailSequenceService {

    private final EmailSequenceRepository sequenceRepository;
    private final EmailSequenceStepRepository stepRepository;
    private final EmailSequenceEnrollmentRepository enrollmentRepository;
    private final EmailRepository emailRepository;
    private final LeadRepository leadRepository;
    private final EmailTemplateService templateService;
    private final EmailConfigurationService configurationService;
    private final EmailDeliveryService deliveryService;
    private final TemplateRenderer templateRenderer;
    private final LeadAccessService leadAccessService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // ================================
    // SEQUENCE MANAGEMENT
    // ================================

    @Transactional(readOnly = true)
    public List<EmailSequenceDto> getSequences(User user) {
        return sequenceRepository.findByUserOrderByCreatedAtDesc(user).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmailSequence getOwned(User user, Long sequenceId) {
        return sequenceRepository.findByIdAndUser(sequenceId, user)
                .orElseThrow(() -> new EntityNotFoundException("Sequence not found: " + sequenceId));
    }

    public EmailSequenceDto createSequence(User user, SequenceRequest request) {
        EmailSequence sequence = EmailSequence.builder()
                .user(user)
                .build();
        apply(sequence, request);

        EmailSequence saved = sequenceRepository.save(sequence);
        log.info("Created sequence {} '{}' for user {}", saved.getId(), saved.getName(), user.getId());
        return EmailMapper.toDto(saved);
    }

    public EmailSequenceDto updateSequence(User user, Long sequenceId, SequenceRequest request) {
        EmailSequence sequence = getOwned(user, sequenceId);
        apply(sequence, request);
        return EmailMapper.toDto(sequenceRepository.save(sequence));
    }

    /**
     * Deactivating a sequence pauses it: enrollments keep their position and
     * continue when it is switched back on.
     */
    public EmailSequenceDto setActive(User user, Long sequenceId, boolean active) {
        EmailSequence sequence = getOwned(user, sequenceId);
        sequence.setIsActive(active);
        log.info("Sequence {} {}", sequenceId, active ? "activated" : "deactivated");
        return EmailMapper.toDto(sequenceRepository.save(sequence));
    }

    public EmailSequenceStepDto addStep(User user, Long sequenceId, SequenceStepRequest request) {
        EmailSequence sequence = getOwned(user, sequenceId);
        if (stepRepository.existsBySequenceAndStepNumber(sequence, request.getStepNumber())) {
            throw new CrmValidationException("Step " + request.getStepNumber() + " already exists in this sequence");
        }
        EmailTemplate template = templateService.getVisible(user, request.getTemplateId());

        EmailSequenceStep step = new EmailSequenceStep(request.getStepNumber(), template,
                request.getDelayDays() != null ? request.getDelayDays() : 1);
        step.setSendOnlyIfNotReplied(!Boolean.FALSE.equals(request.getSendOnlyIfNotReplied()));
        step.setSendOnlyIfStatus(request.getSendOnlyIfStatus() != null
                ? new HashSet<>(request.getSendOnlyIfStatus())
                : new HashSet<>());
        step.setIsActive(!Boolean.FALSE.equals(request.getIsActive()));
        sequence.addStep(step);

        EmailSequenceStep saved = stepRepository.save(step);
        log.info("Added step {} to sequence {}", saved.getStepNumber(), sequenceId);
        return EmailMapper.toDto(saved);
    }

    public void deleteStep(User user, Long sequenceId, Long stepId) {
        EmailSequence sequence = getOwned(user, sequenceId);
        EmailSequenceStep step = sequence.getSteps().stream()
                .filter(s -> s.getId().equals(stepId))
                .findFirst()
                .orElseThrow(() -> new EntityNotFoundException("Step not found: " + stepId));
        sequence.getSteps().remove(step);
        sequenceRepository.save(sequence);
        log.info("Removed step {} from sequence {}", step.getStepNumber(), sequenceId);
    }

    @Transactional(readOnly = true)
    public List<SequenceEnrollmentDto> getEnrollments(User user, Long sequenceId) {
        EmailSequence sequence = getOwned(user, sequenceId);
        return enrollmentRepository.findBySequenceOrderByEnrolledAtDesc(sequence).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    // ================================
    // ENROLLMENT
    // ================================

    /**
     * Manual enrollment. The lead must be visible to the sequence owner.
     */
    public SequenceEnrollmentDto enrollLead(User user, Long sequenceId, Long leadId) {
        EmailSequence sequence = getOwned(user, sequenceId);
        if (!sequence.isRunning()) {
            throw new IllegalStateException("Sequence " + sequenceId + " is not active");
        }
        Lead lead = leadAccessService.requireAccessible(user, leadId);
        return EmailMapper.toDto(enroll(lead, sequence));
    }

    /**
     * Enroll a lead once. An existing enrollment is returned unchanged; a new
     * one without a start delay sends its first step right away.
     */
    public EmailSequenceEnrollment enroll(Lead lead, EmailSequence sequence) {
        Optional<EmailSequenceEnrollment> existing = enrollmentRepository.findBySequenceAndLead(sequence, lead);
        if (existing.isPresent()) {
            log.debug("Lead {} already enrolled in sequence {}", lead.getId(), sequence.getId());
            return existing.get();
        }

        EmailSequenceEnrollment enrollment = enrollmentRepository.save(
                new EmailSequenceEnrollment(sequence, lead, OffsetDateTime.now(clock)));
        log.info("Enrolled lead {} in sequence {} '{}'", lead.getId(), sequence.getId(), sequence.getName());

        if (sequence.getDelayStartDays() == null || sequence.getDelayStartDays() == 0) {
            advance(enrollment);
        }
        return enrollment;
    }

    /**
     * Enrollment fired by a lead trigger. Runs in its own transaction so a
     * failure stays with this sequence.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void enrollTriggered(Long sequenceId, Long leadId) {
        EmailSequence sequence = sequenceRepository.findById(sequenceId)
                .orElseThrow(() -> new EntityNotFoundException("Sequence not found: " + sequenceId));
        if (!sequence.isRunning()) {
            log.debug("Sequence {} was deactivated, not enrolling lead {}", sequenceId, leadId);
            return;
        }
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        enroll(lead, sequence);
    }

    public SequenceEnrollmentDto unenroll(User user, Long sequenceId, Long enrollmentId) {
        EmailSequence sequence = getOwned(user, sequenceId);
        EmailSequenceEnrollment enrollment = enrollmentRepository.findById(enrollmentId)
                .filter(e -> e.getSequence().getId().equals(sequence.getId()))
                .orElseThrow(() -> new EntityNotFoundException("Enrollment not found: " + enrollmentId));
        if (enrollment.isRunning()) {
            enrollment.complete(OffsetDateTime.now(clock));
            enrollmentRepository.save(enrollment);
            log.info("Lead {} removed from sequence {}", enrollment.getLead().getId(), sequenceId);
        }
        return EmailMapper.toDto(enrollment);
    }

    /**
     * Flag every active enrollment of the lead as replied.
     */
    public void markReplied(Lead lead) {
        List<EmailSequenceEnrollment> active = enrollmentRepository.findByLeadAndIsActiveTrue(lead);
        for (EmailSequenceEnrollment enrollment : active) {
            enrollment.setHasReplied(true);
        }
        enrollmentRepository.saveAll(active);
    }

    // ================================
    // EXECUTION
    // ================================

    /**
     * Move the enrollment to step {@code current_step + 1} and send it. Steps
     * whose conditions do not hold are passed over. When that step does not
     * exist or is switched off the enrollment completes.
     *
     * @return {@code true} when an email went out
     */
    public boolean advance(EmailSequenceEnrollment enrollment) {
        if (!enrollment.isRunning()) {
            return false;
        }

        EmailSequence sequence = enrollment.getSequence();
        Lead lead = enrollment.getLead();
        OffsetDateTime now = OffsetDateTime.now(clock);

        while (true) {
            Optional<EmailSequenceStep> next = stepRepository
                    .findBySequenceAndStepNumberAndIsActiveTrue(sequence, enrollment.getCurrentStep() + 1);

            if (next.isEmpty()) {
                enrollment.complete(now);
                enrollmentRepository.save(enrollment);
                log.info("Enrollment {} completed sequence {}", enrollment.getId(), sequence.getId());
                return false;
            }

            EmailSequenceStep step = next.get();
            if (Boolean.TRUE.equals(step.getSendOnlyIfNotReplied()) && enrollment.replied()) {
                log.debug("Skipping step {} for enrollment {}: lead replied", step.getStepNumber(), enrollment.getId());
                enrollment.skipTo(step.getStepNumber());
                continue;
            }
            if (!step.admitsStatus(lead.getStatus())) {
                log.debug("Skipping step {} for enrollment {}: lead status {}",
                        step.getStepNumber(), enrollment.getId(), lead.getStatus());
                enrollment.skipTo(step.getStepNumber());
                continue;
            }

            Optional<EmailConfiguration> config = configurationService.resolveSendingConfig(sequence.getUser());
            if (config.isEmpty()) {
                log.warn("No email configuration for user {}, sequence {} cannot send step {}",
                        sequence.getUser().getId(), sequence.getId(), step.getStepNumber());
                enrollmentRepository.save(enrollment);
                return false;
            }
            if (!lead.hasEmail()) {
                log.warn("Lead {} has no email address, sequence {} cannot send step {}",
                        lead.getId(), sequence.getId(), step.getStepNumber());
                enrollmentRepository.save(enrollment);
                return false;
            }

            sendStep(enrollment, step, config.get(), now);
            return true;
        }
    }

    private void sendStep(EmailSequenceEnrollment enrollment, EmailSequenceStep step,
                          EmailConfiguration config, OffsetDateTime now) {
        User owner = enrollment.getSequence().getUser();
        Lead lead = enrollment.getLead();
        RenderedEmail rendered = templateRenderer.render(step.getTemplate(), lead, owner);

        Email email = emailRepository.save(Email.builder()
                .lead(lead)
                .template(step.getTemplate())
                .user(owner)
                .fromEmail(config.getFromEmail())
                .fromName(config.getFromName())
                .replyTo(config.getReplyTo())
                .toEmail(lead.getEmail())
                .toName(lead.getFullName())
                .subject(rendered.subject())
                .bodyHtml(rendered.htmlBody())
                .bodyText(rendered.textBody())
                .status(EmailStatus.QUEUED)
                .build());

        enrollment.recordSend(step.getStepNumber(), now);
        enrollmentRepository.save(enrollment);

        SendResult result = deliveryService.deliver(email, config);
        templateService.recordUsage(step.getTemplate());
        log.info("Sequence {} step {} for lead {}: {}", enrollment.getSequence().getId(), step.getStepNumber(),
                lead.getId(), result.success() ? "sent" : result.message());
    }

    /**
     * Advance every running enrollment whose next step is due. Each enrollment
     * is handled in its own transaction. Enrollments without a next step are
     * left as they are.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public ProcessingSummary tick() {
        List<Long> ids = enrollmentRepository.findRunnable().stream()
                .map(EmailSequenceEnrollment::getId)
                .collect(Collectors.toList());

        int sent = 0;
        int failed = 0;
        for (Long id : ids) {
            try {
                Boolean advanced = transactionTemplate.execute(status -> tickOne(id));
                if (Boolean.TRUE.equals(advanced)) {
                    sent++;
                }
            } catch (RuntimeException e) {
                log.error("Error processing sequence enrollment {}: {}", id, e.getMessage(), e);
                failed++;
            }
        }

        if (sent > 0 || failed > 0) {
            log.info("Sequence tick over {} enrollment(s): {} email(s) sent, {} error(s)", ids.size(), sent, failed);
        }
        return new ProcessingSummary(ids.size(), sent, failed);
    }

    private boolean tickOne(Long enrollmentId) {
        EmailSequenceEnrollment enrollment = enrollmentRepository.findById(enrollmentId)
                .orElseThrow(() -> new EntityNotFoundException("Enrollment not found: " + enrollmentId));
        if (!enrollment.isRunning() || !enrollment.getSequence().isRunning()) {
            return false;
        }

        Optional<EmailSequenceStep> next = stepRepository
                .findBySequenceAndStepNumber(enrollment.getSequence(), enrollment.getCurrentStep() + 1);
        if (next.isEmpty() || !isDue(enrollment, next.get(), OffsetDateTime.now(clock))) {
            return false;
        }
        return advance(enrollment);
    }

    boolean isDue(EmailSequenceEnrollment enrollment, EmailSequenceStep step, OffsetDateTime now) {
        OffsetDateTime reference = enrollment.getLastEmailSent() != null
                ? enrollment.getLastEmailSent()
                : enrollment.getEnrolledAt();
        long elapsedDays = ChronoUnit.DAYS.between(reference, now);
        int delay = step.getDelayDays() != null ? step.getDelayDays() : 0;
        return elapsedDays >= delay;
    }

    private void apply(EmailSequence sequence, SequenceRequest request) {
        sequence.setName(request.getName().trim());
        sequence.setDescription(request.getDescription());
        sequence.setTriggerOnLeadCreation(Boolean.TRUE.equals(request.getTriggerOnLeadCreation()));
        sequence.setTriggerOnStatusChange(request.getTriggerOnStatusChange() != null
                ? new HashSet<>(request.getTriggerOnStatusChange())
                : new HashSet<>());
        sequence.setTriggerOnPriorityChange(request.getTriggerOnPriorityChange() != null
                ? new HashSet<>(request.getTriggerOnPriorityChange())
                : new HashSet<>());
        sequence.setIsActive(!Boolean.FALSE.equals(request.getIsActive()));
        sequence.setDelayStartDays(request.getDelayStartDays() != null ? request.getDelayStartDays() : 0);
    }
}
