package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.EmailTemplateDto;
import com.salescrm.backend.dto.email.request.EmailTemplateRequest;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.email.EmailTemplateRepository;
import com.salescrm.backend.services.LeadAccessService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailTemplateService {

    private final EmailTemplateRepository templateRepository;
    private final TemplateRenderer templateRenderer;
    private final LeadAccessService leadAccessService;
    private final Clock clock;

    /**
     * Own templates plus the ones shared within the organization
     */
    @Transactional(readOnly = true)
    public List<EmailTemplateDto> getVisibleTemplates(User user) {
        return templateRepository.findVisibleTo(user, user.getOrganization().getId()).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmailTemplate getVisible(User user, Long templateId) {
        return templateRepository.findVisibleById(templateId, user, user.getOrganization().getId())
                .orElseThrow(() -> new EntityNotFoundException("Email template not found: " + templateId));
    }

    public EmailTemplateDto createTemplate(User user, EmailTemplateRequest request) {
        requireValid(request);

        EmailTemplate template = EmailTemplate.builder()
                .user(user)
                .build();
        apply(template, request);

        EmailTemplate saved = templateRepository.save(template);
        log.info("Created email template {} '{}' for user {}", saved.getId(), saved.getName(), user.getId());
        return EmailMapper.toDto(saved);
    }

    public EmailTemplateDto updateTemplate(User user, Long templateId, EmailTemplateRequest request) {
        EmailTemplate template = getOwned(user, templateId);
        requireValid(request);
        apply(template, request);
        return EmailMapper.toDto(templateRepository.save(template));
    }

    public void deleteTemplate(User user, Long templateId) {
        EmailTemplate template = getOwned(user, templateId);
        // Campaigns and sequence steps keep pointing at the row, so it is only switched off
        template.setIsActive(false);
        templateRepository.save(template);
        log.info("Deactivated email template {} of user {}", templateId, user.getId());
    }

    /**
     * Render the template against one of the caller's leads without sending.
     */
    @Transactional(readOnly = true)
    public RenderedEmail preview(User user, Long templateId, Long leadId) {
        EmailTemplate template = getVisible(user, templateId);
        Lead lead = leadAccessService.requireAccessible(user, leadId);
        return templateRenderer.render(template, lead, user);
    }

    public List<String> validate(EmailTemplateRequest request) {
        return templateRenderer.validate(request.getSubject(), request.getBodyHtml());
    }

    public void recordUsage(EmailTemplate template) {
        template.recordUsage(OffsetDateTime.now(clock));
        templateRepository.save(template);
    }

    /**
     * Starter templates every new user gets.
     */
    public void createDefaultTemplates(User user) {
        createDefault(user, "Welcome Email", EmailTemplate.TemplateType.WELCOME,
                "Welcome {{first_name}}! Thank you for your interest",
                "<p>Dear {{first_name}},</p>"
                        + "<p>Thank you for your interest in our services. We're excited to help "
                        + "{{company}} achieve its goals.</p>"
                        + "<p>I'll be your point of contact and will reach out shortly to discuss "
                        + "your requirements in detail.</p>"
                        + "<p>Best regards,<br>{{user_name}}<br>{{user_email}}</p>");

        createDefault(user, "Follow-up Email", EmailTemplate.TemplateType.FOLLOW_UP,
                "Following up on our conversation, {{first_name}}",
                "<p>Hi {{first_name}},</p>"
                        + "<p>I wanted to follow up on our previous conversation about your requirements.</p>"
                        + "<p>Do you have any questions, or would you like to schedule a call to discuss further?</p>"
                        + "<p>Looking forward to hearing from you.</p>"
                        + "<p>Best regards,<br>{{user_name}}</p>");
    }

    private void createDefault(User user, String name, EmailTemplate.TemplateType type, String subject, String html) {
        if (templateRepository.existsByUserAndName(user, name)) {
            return;
        }
        templateRepository.save(EmailTemplate.builder()
                .user(user)
                .name(name)
                .templateType(type)
                .subject(subject)
                .bodyHtml(html)
                .build());
    }

    private EmailTemplate getOwned(User user, Long templateId) {
        EmailTemplate template = getVisible(user, templateId);
        if (!template.getUser().getId().equals(user.getId())) {
            throw new AccessDeniedException("Shared templates can only be changed by their owner");
        }
        return template;
    }

    private void requireValid(EmailTemplateRequest request) {
        List<String> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new CrmValidationException(errors);
        }
    }

    private void apply(EmailTemplate template, EmailTemplateRequest request) {
        template.setName(request.getName().trim());
        template.setTemplateType(request.getTemplateType() != null
                ? request.getTemplateType()
                : EmailTemplate.TemplateType.CUSTOM);
        template.setSubject(request.getSubject().trim());
        template.setBodyHtml(request.getBodyHtml());
        template.setBodyText(request.getBodyText() != null && !request.getBodyText().isBlank()
                ? request.getBodyText()
                : null);
        template.setIsActive(request.getIsActive() == null || request.getIsActive());
        template.setIsShared(Boolean.TRUE.equals(request.getIsShared()));
    }
}
