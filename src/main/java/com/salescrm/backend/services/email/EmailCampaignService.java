package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.EmailCampaignDto;
import com.salescrm.backend.dto.email.EmailStatsDto;
import com.salescrm.backend.dto.email.request.BulkEmailRequest;
import com.salescrm.backend.dto.email.request.CreateCampaignRequest;
import com.salescrm.backend.enums.CampaignStatus;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.exceptions.EmailConfigurationMissingException;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailCampaign;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.LeadRepository;
import com.salescrm.backend.repositories.LeadSourceRepository;
import com.salescrm.backend.repositories.email.EmailCampaignRepository;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.services.LeadAccessService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.salescrm.backend.repositories.LeadSpecifications.hasEmail;
import static com.salescrm.backend.repositories.LeadSpecifications.idIn;
import static com.salescrm.backend.repositories.LeadSpecifications.inOrganization;
import static com.salescrm.backend.repositories.LeadSpecifications.priorityIn;
import static com.salescrm.backend.repositories.LeadSpecifications.sourceIn;
import static com.salescrm.backend.repositories.LeadSpecifications.statusIn;

/**
 * Bulk sends. A campaign's audience is resolved once, frozen into QUEUED
 * {@link Email} rows, and drained in batches by repeated {@link #sendBatch} calls.
 * Concurrent batch calls for the same campaign are not guarded against;
 * the scheduler runs with a fixed delay so passes never overlap.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailCampaignService {

    private static final DateTimeFormatter BULK_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final EmailCampaignRepository campaignRepository;
    private final EmailRepository emailRepository;
    private final LeadRepository leadRepository;
    private final LeadSourceRepository leadSourceRepository;
    private final EmailTemplateService templateService;
    private final EmailConfigurationService configurationService;
    private final EmailDeliveryService deliveryService;
    private final TemplateRenderer templateRenderer;
    private final LeadAccessService leadAccessService;
    private final EmailAnalyticsService analyticsService;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ================================
    // QUERIES
    // ================================

    @Transactional(readOnly = true)
    public List<EmailCampaignDto> getCampaigns(User user) {
        return campaignRepository.findByUserOrderByCreatedAtDesc(user).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmailCampaign getOwned(User user, Long campaignId) {
        return campaignRepository.findByIdAndUser(campaignId, user)
                .orElseThrow(() -> new EntityNotFoundException("Campaign not found: " + campaignId));
    }

    @Transactional(readOnly = true)
    public EmailStatsDto getCampaignStats(User user, Long campaignId) {
        return analyticsService.getCampaignStats(getOwned(user, campaignId));
    }

    // ================================
    // CREATION
    // ================================

    /**
     * Create a campaign, resolve its audience and queue one email per recipient.
     * Send-now campaigns start right away, others wait for their scheduled time.
     */
    public EmailCampaign createCampaign(User user, CreateCampaignRequest request) {
        List<String> errors = new ArrayList<>();
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean sendNow = Boolean.TRUE.equals(request.getSendNow());

        if (!sendNow && request.getScheduledAt() == null) {
            errors.add("Either select 'Send Now' or set a scheduled time");
        }
        if (!sendNow && request.getScheduledAt() != null && request.getScheduledAt().isBefore(now)) {
            errors.add("Scheduled time must be in the future");
        }
        boolean anyTarget = Boolean.TRUE.equals(request.getTargetAllLeads())
                || !isEmpty(request.getTargetStatuses())
                || !isEmpty(request.getTargetPriorities())
                || !isEmpty(request.getTargetSourceIds())
                || !isEmpty(request.getSpecificLeadIds());
        if (!anyTarget) {
            errors.add("Please select at least one targeting criteria or choose 'Target All Leads'");
        }
        if (!errors.isEmpty()) {
            throw new CrmValidationException(errors);
        }

        EmailTemplate template = templateService.getVisible(user, request.getTemplateId());
        if (!Boolean.TRUE.equals(template.getIsActive())) {
            throw new CrmValidationException("Template '" + template.getName() + "' is inactive");
        }
        EmailConfiguration config = resolveConfig(user, request.getEmailConfigId());

        Long orgId = user.getOrganization().getId();
        Set<LeadSource> sources = isEmpty(request.getTargetSourceIds())
                ? new HashSet<>()
                : new HashSet<>(leadSourceRepository.findByIdInAndOrganizationId(request.getTargetSourceIds(), orgId));
        Set<Lead> specificLeads = isEmpty(request.getSpecificLeadIds())
                ? new HashSet<>()
                : new HashSet<>(leadRepository.findByIdInAndOrganizationId(request.getSpecificLeadIds(), orgId));

        EmailCampaign campaign = EmailCampaign.builder()
                .name(request.getName().trim())
                .user(user)
                .template(template)
                .emailConfig(config)
                .sendNow(sendNow)
                .scheduledAt(sendNow ? null : request.getScheduledAt())
                .targetAllLeads(Boolean.TRUE.equals(request.getTargetAllLeads()))
                .targetStatuses(isEmpty(request.getTargetStatuses()) ? new HashSet<>() : new HashSet<>(request.getTargetStatuses()))
                .targetPriorities(isEmpty(request.getTargetPriorities()) ? new HashSet<>() : new HashSet<>(request.getTargetPriorities()))
                .targetSources(sources)
                .specificLeads(specificLeads)
                .batchSize(request.getBatchSize() != null ? request.getBatchSize() : 50)
                .delayBetweenBatches(request.getDelayBetweenBatches() != null ? request.getDelayBetweenBatches() : 60)
                .build();

        return persistAndQueue(campaign, now);
    }

    /**
     * One-off campaign to an explicit list of the caller's leads.
     */
    public EmailCampaign bulkEmail(User user, BulkEmailRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (request.getScheduledAt() != null && request.getScheduledAt().isBefore(now)) {
            throw new CrmValidationException("Scheduled time must be in the future");
        }

        Specification<Lead> visible = leadAccessService.visibleTo(user).and(idIn(request.getLeadIds()));
        Set<Lead> leads = new HashSet<>(leadRepository.findAll(visible));
        if (leads.isEmpty()) {
            throw new CrmValidationException("None of the selected leads are available to you");
        }

        EmailTemplate template = templateService.getVisible(user, request.getTemplateId());
        EmailConfiguration config = resolveConfig(user, request.getEmailConfigId());
        boolean sendNow = request.getScheduledAt() == null;

        EmailCampaign campaign = EmailCampaign.builder()
                .name("Bulk Email - " + now.format(BULK_NAME_FORMAT))
                .user(user)
                .template(template)
                .emailConfig(config)
                .sendNow(sendNow)
                .scheduledAt(request.getScheduledAt())
                .specificLeads(leads)
                .build();

        return persistAndQueue(campaign, now);
    }

    private EmailCampaign persistAndQueue(EmailCampaign campaign, OffsetDateTime now) {
        List<Lead> recipients = resolveTargets(campaign);
        if (recipients.isEmpty()) {
            throw new CrmValidationException("No leads with an email address match the selected criteria");
        }
        campaign.setTotalRecipients(recipients.size());
        EmailCampaign saved = campaignRepository.save(campaign);

        int queued = materialize(saved);
        log.info("Campaign {} '{}' created with {} recipients ({} queued)",
                saved.getId(), saved.getName(), saved.getTotalRecipients(), queued);

        if (Boolean.TRUE.equals(saved.getSendNow())) {
            saved.markStarted(now);
            campaignRepository.save(saved);
            eventPublisher.publishEvent(new CampaignLaunchedEvent(saved.getId()));
        } else {
            saved.transitionTo(CampaignStatus.SCHEDULED);
            campaignRepository.save(saved);
        }
        return saved;
    }

    // ================================
    // ENGINE
    // ================================

    /**
     * Leads of the campaign's organization that match the targeting, each once,
     * restricted to leads with an email address.
     */
    @Transactional(readOnly = true)
    public List<Lead> resolveTargets(EmailCampaign campaign) {
        Long orgId = campaign.getUser().getOrganization().getId();
        Specification<Lead> spec = inOrganization(orgId).and(hasEmail());

        if (!Boolean.TRUE.equals(campaign.getTargetAllLeads())) {
            Specification<Lead> anyOf = null;
            for (Specification<Lead> criterion : List.of(
                    nullSafe(statusIn(campaign.getTargetStatuses())),
                    nullSafe(priorityIn(campaign.getTargetPriorities())),
                    nullSafe(sourceIn(campaign.getTargetSources().stream().map(LeadSource::getId).collect(Collectors.toSet()))),
                    nullSafe(idIn(campaign.getSpecificLeads().stream().map(Lead::getId).collect(Collectors.toSet()))))) {
                if (criterion == NONE) {
                    continue;
                }
                anyOf = anyOf == null ? criterion : anyOf.or(criterion);
            }
            if (anyOf == null) {
                return List.of();
            }
            spec = spec.and(anyOf);
        }
        return leadRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "id"));
    }

    /**
     * Queue an email for every resolved lead that has none yet in this campaign.
     *
     * @return number of rows created by this call
     */
    public int materialize(EmailCampaign campaign) {
        Set<Long> alreadyQueued = emailRepository.findLeadIdsByCampaign(campaign);
        EmailConfiguration config = campaign.getEmailConfig();

        List<Email> created = new ArrayList<>();
        for (Lead lead : resolveTargets(campaign)) {
            if (alreadyQueued.contains(lead.getId())) {
                continue;
            }
            RenderedEmail rendered = templateRenderer.render(campaign.getTemplate(), lead, campaign.getUser());
            created.add(Email.builder()
                    .campaign(campaign)
                    .lead(lead)
                    .template(campaign.getTemplate())
                    .user(campaign.getUser())
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
        }
        emailRepository.saveAll(created);
        return created.size();
    }

    /**
     * Deliver up to one batch of queued emails. Every email is sent and counted
     * in its own transaction, so a failing recipient leaves the rest of the
     * batch committed. When nothing is left queued afterwards the campaign is
     * marked sent.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BatchResult sendBatch(Long campaignId, Integer batchSizeOverride) {
        EmailCampaign campaign = findCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.SENDING) {
            log.debug("Campaign {} is {}, skipping batch", campaignId, campaign.getStatus());
            return BatchResult.EMPTY;
        }

        int size = batchSizeOverride != null && batchSizeOverride > 0 ? batchSizeOverride : campaign.getBatchSize();
        List<Long> batch = emailRepository.findByCampaignAndStatusOrderByCreatedAtAscIdAsc(
                        campaign, EmailStatus.QUEUED, PageRequest.of(0, size)).stream()
                .map(Email::getId)
                .collect(Collectors.toList());

        int sent = 0;
        int failed = 0;
        for (Long emailId : batch) {
            try {
                Boolean delivered = transactionTemplate.execute(status -> sendOne(campaignId, emailId));
                if (delivered == null) {
                    continue;
                }
                if (delivered) {
                    sent++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error delivering email {} of campaign {}: {}",
                        emailId, campaignId, e.getMessage(), e);
                failed++;
                recordUnexpectedFailure(campaignId, emailId, e);
            }
        }

        transactionTemplate.executeWithoutResult(status -> completeIfDrained(campaignId));
        log.info("Campaign {} batch: {} sent, {} failed", campaignId, sent, failed);
        return new BatchResult(sent, failed);
    }

    /**
     * @return {@code null} when the email was skipped, otherwise whether it went out
     */
    private Boolean sendOne(Long campaignId, Long emailId) {
        EmailCampaign campaign = findCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.SENDING) {
            return null;
        }
        Email email = emailRepository.findById(emailId)
                .orElseThrow(() -> new EntityNotFoundException("Email not found: " + emailId));
        if (email.getStatus() != EmailStatus.QUEUED) {
            return null;
        }

        SendResult result = deliveryService.deliver(email, campaign.getEmailConfig());
        campaign.recordBatch(result.success() ? 1 : 0, result.success() ? 0 : 1);
        campaignRepository.save(campaign);
        return result.success();
    }

    private void recordUnexpectedFailure(Long campaignId, Long emailId, RuntimeException cause) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Email email = emailRepository.findById(emailId).orElse(null);
                if (email == null || !email.getStatus().canTransitionTo(EmailStatus.FAILED)) {
                    return;
                }
                email.markFailed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
                emailRepository.save(email);

                EmailCampaign campaign = findCampaign(campaignId);
                campaign.recordBatch(0, 1);
                campaignRepository.save(campaign);
            });
        } catch (RuntimeException e) {
            log.error("Could not mark email {} of campaign {} as failed: {}", emailId, campaignId, e.getMessage(), e);
        }
    }

    private void completeIfDrained(Long campaignId) {
        EmailCampaign campaign = findCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.SENDING
                || emailRepository.countByCampaignAndStatus(campaign, EmailStatus.QUEUED) > 0) {
            return;
        }
        campaign.markCompleted(OffsetDateTime.now(clock));
        campaignRepository.save(campaign);
        log.info("Campaign {} completed: {} sent, {} failed",
                campaign.getId(), campaign.getEmailsSent(), campaign.getEmailsFailed());
    }

    /**
     * Manual trigger for the next batch of a running campaign.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public BatchResult sendNextBatch(User user, Long campaignId, Integer batchSize) {
        EmailCampaign campaign = getOwned(user, campaignId);
        if (campaign.getStatus() != CampaignStatus.SENDING) {
            throw new IllegalStateException("Campaign " + campaignId + " is " + campaign.getStatus() + ", not sending");
        }
        return sendBatch(campaignId, batchSize);
    }

    // ================================
    // LIFECYCLE
    // ================================

    /**
     * Start a draft or scheduled campaign now. Its first batch goes out after commit.
     */
    public EmailCampaign startCampaign(User user, Long campaignId) {
        EmailCampaign campaign = getOwned(user, campaignId);
        campaign.markStarted(OffsetDateTime.now(clock));
        campaignRepository.save(campaign);
        eventPublisher.publishEvent(new CampaignLaunchedEvent(campaignId));
        log.info("Campaign {} started by user {}", campaignId, user.getId());
        return campaign;
    }

    public EmailCampaign pauseCampaign(User user, Long campaignId) {
        EmailCampaign campaign = getOwned(user, campaignId);
        campaign.transitionTo(CampaignStatus.PAUSED);
        log.info("Campaign {} paused by user {}", campaignId, user.getId());
        return campaignRepository.save(campaign);
    }

    /**
     * Paused campaigns go back to sending; the scheduler picks up the next batch.
     */
    public EmailCampaign resumeCampaign(User user, Long campaignId) {
        EmailCampaign campaign = getOwned(user, campaignId);
        campaign.transitionTo(CampaignStatus.SENDING);
        log.info("Campaign {} resumed by user {}", campaignId, user.getId());
        return campaignRepository.save(campaign);
    }

    public EmailCampaign cancelCampaign(User user, Long campaignId) {
        EmailCampaign campaign = getOwned(user, campaignId);
        campaign.transitionTo(CampaignStatus.CANCELLED);
        log.info("Campaign {} cancelled by user {}", campaignId, user.getId());
        return campaignRepository.save(campaign);
    }

    // ================================
    // BACKGROUND PROCESSING
    // ================================

    /**
     * Start due scheduled campaigns and send the next batch of running ones.
     * Starting a campaign commits before its first batch; batches commit per email.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public ProcessingSummary processCampaigns() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        List<Long> dueIds = campaignRepository.findDue(CampaignStatus.SCHEDULED, now).stream()
                .map(EmailCampaign::getId)
                .collect(Collectors.toList());
        for (Long id : dueIds) {
            runIsolated("start scheduled campaign", id, succeeded, failed, () -> {
                transactionTemplate.executeWithoutResult(status -> {
                    EmailCampaign campaign = findCampaign(id);
                    campaign.markStarted(now);
                    campaignRepository.save(campaign);
                });
                sendBatch(id, null);
            });
        }

        List<Long> runningIds = campaignRepository.findByStatusOrderByStartedAtAsc(CampaignStatus.SENDING).stream()
                .map(EmailCampaign::getId)
                .filter(id -> !dueIds.contains(id))
                .collect(Collectors.toList());
        for (Long id : runningIds) {
            runIsolated("continue campaign", id, succeeded, failed, () -> sendBatch(id, null));
        }

        int processed = dueIds.size() + runningIds.size();
        if (processed > 0) {
            log.info("Processed {} campaign(s): {} ok, {} failed", processed, succeeded.get(), failed.get());
        }
        return new ProcessingSummary(processed, succeeded.get(), failed.get());
    }

    /**
     * Resubmit failed emails that still have retries left. Campaign emails use
     * the campaign's configuration while it is active, everything else the
     * owner's sending configuration.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public ProcessingSummary retryFailedEmails() {
        List<Long> ids = emailRepository.findRetryable(EmailStatus.FAILED).stream()
                .map(Email::getId)
                .collect(Collectors.toList());

        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        for (Long id : ids) {
            try {
                Boolean ok = transactionTemplate.execute(status -> retryOne(id));
                if (Boolean.TRUE.equals(ok)) {
                    succeeded.incrementAndGet();
                } else {
                    failed.incrementAndGet();
                }
            } catch (RuntimeException e) {
                log.error("Error retrying email {}: {}", id, e.getMessage(), e);
                failed.incrementAndGet();
            }
        }

        if (!ids.isEmpty()) {
            log.info("Retried {} failed email(s): {} sent, {} still failing", ids.size(), succeeded.get(), failed.get());
        }
        return new ProcessingSummary(ids.size(), succeeded.get(), failed.get());
    }

    private boolean retryOne(Long emailId) {
        Email email = emailRepository.findById(emailId)
                .orElseThrow(() -> new EntityNotFoundException("Email not found: " + emailId));
        if (!email.canRetry()) {
            return false;
        }

        EmailCampaign campaign = email.getCampaign();
        EmailConfiguration config = campaign != null && campaign.getEmailConfig().isUsable()
                ? campaign.getEmailConfig()
                : configurationService.resolveSendingConfig(email.getUser()).orElse(null);
        if (config == null) {
            log.warn("No email configuration for user {}, cannot retry email {}", email.getUser().getId(), emailId);
            return false;
        }

        SendResult result = deliveryService.deliver(email, config);
        if (result.success() && campaign != null) {
            campaign.recordRetrySuccess();
            campaignRepository.save(campaign);
        }
        return result.success();
    }

    private void runIsolated(String action, Long campaignId, AtomicInteger succeeded, AtomicInteger failed, Runnable work) {
        try {
            work.run();
            succeeded.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("Failed to {} {}: {}", action, campaignId, e.getMessage(), e);
            failed.incrementAndGet();
        }
    }

    private EmailCampaign findCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new EntityNotFoundException("Campaign not found: " + campaignId));
    }

    private EmailConfiguration resolveConfig(User user, Long configId) {
        if (configId != null) {
            EmailConfiguration config = configurationService.getOwned(user, configId);
            if (!config.isUsable()) {
                throw new CrmValidationException("Email configuration '" + config.getName() + "' is inactive");
            }
            return config;
        }
        return configurationService.resolveSendingConfig(user)
                .orElseThrow(() -> new EmailConfigurationMissingException(user.getId()));
    }

    private static final Specification<Lead> NONE = (root, query, cb) -> cb.disjunction();

    private static Specification<Lead> nullSafe(Specification<Lead> spec) {
        return spec != null ? spec : NONE;
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }
}
