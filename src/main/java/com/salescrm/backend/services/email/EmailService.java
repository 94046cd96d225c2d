package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.EmailDto;
import com.salescrm.backend.dto.email.EmailTrackingDto;
import com.salescrm.backend.dto.email.request.QuickEmailRequest;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.exceptions.EmailConfigurationMissingException;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailTrackingRepository;
import com.salescrm.backend.services.LeadAccessService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single emails sent by hand, plus the read side of the outbox.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailService {

    private static final int MAX_PAGE_SIZE = 100;

    private final EmailRepository emailRepository;
    private final EmailTrackingRepository trackingRepository;
    private final EmailTemplateService templateService;
    private final EmailConfigurationService configurationService;
    private final EmailDeliveryService deliveryService;
    private final TemplateRenderer templateRenderer;
    private final LeadAccessService leadAccessService;

    /**
     * Send one email to a lead right away. A template supplies whatever the
     * request leaves blank; explicit subject and body go through the same
     * variable substitution.
     */
    public EmailDto quickEmail(User actor, Long leadId, QuickEmailRequest request) {
        Lead lead = leadAccessService.requireAccessible(actor, leadId);
        if (!lead.hasEmail()) {
            throw new CrmValidationException("Lead " + leadId + " has no email address");
        }

        EmailTemplate template = request.getTemplateId() != null
                ? templateService.getVisible(actor, request.getTemplateId())
                : null;
        boolean hasSubject = request.getSubject() != null && !request.getSubject().isBlank();
        boolean hasBody = request.getBodyHtml() != null && !request.getBodyHtml().isBlank();
        if (template == null && (!hasSubject || !hasBody)) {
            throw new CrmValidationException("Choose a template or provide both a subject and a body");
        }

        EmailConfiguration config = request.getEmailConfigId() != null
                ? configurationService.getOwned(actor, request.getEmailConfigId())
                : configurationService.resolveSendingConfig(actor)
                        .orElseThrow(() -> new EmailConfigurationMissingException(actor.getId()));

        Map<String, String> context = templateRenderer.buildContext(lead, actor);
        RenderedEmail fromTemplate = template != null ? templateRenderer.render(template, lead, actor) : null;

        String subject = hasSubject
                ? templateRenderer.fitSubject(templateRenderer.replaceVariables(request.getSubject(), context))
                : fromTemplate.subject();
        String html = hasBody
                ? templateRenderer.replaceVariables(request.getBodyHtml(), context)
                : fromTemplate.htmlBody();
        String text = hasBody ? templateRenderer.htmlToText(html) : fromTemplate.textBody();

        Email email = emailRepository.save(Email.builder()
                .lead(lead)
                .template(template)
                .user(actor)
                .fromEmail(config.getFromEmail())
                .fromName(config.getFromName())
                .replyTo(config.getReplyTo())
                .toEmail(lead.getEmail())
                .toName(lead.getFullName())
                .subject(subject)
                .bodyHtml(html)
                .bodyText(text)
                .status(EmailStatus.QUEUED)
                .build());

        SendResult result = deliveryService.deliver(email, config);
        if (template != null) {
            templateService.recordUsage(template);
        }

        log.info("Quick email {} to lead {} by user {}: {}",
                email.getId(), leadId, actor.getId(), result.success() ? "sent" : result.message());
        return EmailMapper.toDto(email);
    }

    @Transactional(readOnly = true)
    public List<EmailDto> getEmails(User user, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return emailRepository.findByUserOrderByCreatedAtDesc(user, PageRequest.of(Math.max(page, 0), pageSize))
                .stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmailDto getEmail(User user, Long emailId) {
        return emailRepository.findByIdAndUser(emailId, user)
                .map(EmailMapper::toDto)
                .orElseThrow(() -> new EntityNotFoundException("Email not found: " + emailId));
    }

    @Transactional(readOnly = true)
    public List<EmailDto> getEmailsForLead(User actor, Long leadId) {
        leadAccessService.requireAccessible(actor, leadId);
        return emailRepository.findByLeadIdOrderByCreatedAtDesc(leadId).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<EmailTrackingDto> getTrackingEvents(User user, Long emailId) {
        Email email = emailRepository.findByIdAndUser(emailId, user)
                .orElseThrow(() -> new EntityNotFoundException("Email not found: " + emailId));
        return trackingRepository.findByEmailIdOrderByTimestampAsc(email.getId()).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }
}
