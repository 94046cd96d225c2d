package com.salescrm.backend.util;

import com.salescrm.backend.dto.email.EmailCampaignDto;
import com.salescrm.backend.dto.email.EmailConfigurationDto;
import com.salescrm.backend.dto.email.EmailDto;
import com.salescrm.backend.dto.email.EmailSequenceDto;
import com.salescrm.backend.dto.email.EmailSequenceStepDto;
import com.salescrm.backend.dto.email.EmailTemplateDto;
import com.salescrm.backend.dto.email.EmailTrackingDto;
import com.salescrm.backend.dto.email.SequenceEnrollmentDto;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.LeadSource;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailCampaign;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.models.email.EmailSequence;
import com.salescrm.backend.models.email.EmailSequenceEnrollment;
import com.salescrm.backend.models.email.EmailSequenceStep;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.models.email.EmailTracking;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

public class EmailMapper {

    public static EmailConfigurationDto toDto(EmailConfiguration config) {
        if (config == null) {
            return null;
        }

        return EmailConfigurationDto.builder()
                .id(config.getId())
                .name(config.getName())
                .provider(config.getProvider())
                .smtpHost(config.getSmtpHost())
                .smtpPort(config.getSmtpPort())
                .smtpUsername(config.getSmtpUsername())
                .hasPassword(config.getSmtpPassword() != null && !config.getSmtpPassword().isEmpty())
                .useTls(config.getUseTls())
                .useSsl(config.getUseSsl())
                .fromEmail(config.getFromEmail())
                .fromName(config.getFromName())
                .replyTo(config.getReplyTo())
                .isActive(config.getIsActive())
                .isDefault(config.getIsDefault())
                .dailyLimit(config.getDailyLimit())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .build();
    }

    public static EmailTemplateDto toDto(EmailTemplate template) {
        if (template == null) {
            return null;
        }

        return EmailTemplateDto.builder()
                .id(template.getId())
                .ownerId(template.getUser() != null ? template.getUser().getId() : null)
                .ownerName(template.getUser() != null ? template.getUser().getFullName() : null)
                .name(template.getName())
                .templateType(template.getTemplateType())
                .subject(template.getSubject())
                .bodyHtml(template.getBodyHtml())
                .bodyText(template.getBodyText())
                .isActive(template.getIsActive())
                .isShared(template.getIsShared())
                .usageCount(template.getUsageCount())
                .lastUsed(template.getLastUsed())
                .createdAt(template.getCreatedAt())
                .updatedAt(template.getUpdatedAt())
                .build();
    }

    public static EmailCampaignDto toDto(EmailCampaign campaign) {
        if (campaign == null) {
            return null;
        }

        return EmailCampaignDto.builder()
                .id(campaign.getId())
                .name(campaign.getName())
                .templateId(campaign.getTemplate().getId())
                .templateName(campaign.getTemplate().getName())
                .emailConfigId(campaign.getEmailConfig().getId())
                .emailConfigName(campaign.getEmailConfig().getName())
                .status(campaign.getStatus())
                .scheduledAt(campaign.getScheduledAt())
                .sendNow(campaign.getSendNow())

                // Targeting
                .targetAllLeads(campaign.getTargetAllLeads())
                .targetStatuses(new HashSet<>(campaign.getTargetStatuses()))
                .targetPriorities(new HashSet<>(campaign.getTargetPriorities()))
                .targetSourceIds(campaign.getTargetSources().stream().map(LeadSource::getId).collect(Collectors.toSet()))
                .specificLeadIds(campaign.getSpecificLeads().stream().map(Lead::getId).collect(Collectors.toSet()))

                .batchSize(campaign.getBatchSize())
                .delayBetweenBatches(campaign.getDelayBetweenBatches())

                // Counters
                .totalRecipients(campaign.getTotalRecipients())
                .emailsSent(campaign.getEmailsSent())
                .emailsFailed(campaign.getEmailsFailed())

                .startedAt(campaign.getStartedAt())
                .completedAt(campaign.getCompletedAt())
                .createdAt(campaign.getCreatedAt())
                .build();
    }

    public static EmailDto toDto(Email email) {
        if (email == null) {
            return null;
        }

        return EmailDto.builder()
                .id(email.getId())
                .trackingId(email.getTrackingId())
                .leadId(email.getLead().getId())
                .leadName(email.getLead().getFullName())
                .campaignId(email.getCampaign() != null ? email.getCampaign().getId() : null)
                .templateId(email.getTemplate() != null ? email.getTemplate().getId() : null)
                .fromEmail(email.getFromEmail())
                .fromName(email.getFromName())
                .toEmail(email.getToEmail())
                .toName(email.getToName())
                .subject(email.getSubject())
                .bodyHtml(email.getBodyHtml())
                .bodyText(email.getBodyText())
                .status(email.getStatus())
                .externalId(email.getExternalId())
                .openCount(email.getOpenCount())
                .clickCount(email.getClickCount())
                .errorMessage(email.getErrorMessage())
                .retryCount(email.getRetryCount())
                .maxRetries(email.getMaxRetries())
                .createdAt(email.getCreatedAt())
                .sentAt(email.getSentAt())
                .deliveredAt(email.getDeliveredAt())
                .openedAt(email.getOpenedAt())
                .clickedAt(email.getClickedAt())
                .build();
    }

    public static EmailSequenceDto toDto(EmailSequence sequence) {
        if (sequence == null) {
            return null;
        }

        List<EmailSequenceStepDto> steps = sequence.getSteps().stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());

        return EmailSequenceDto.builder()
                .id(sequence.getId())
                .name(sequence.getName())
                .description(sequence.getDescription())
                .triggerOnLeadCreation(sequence.getTriggerOnLeadCreation())
                .triggerOnStatusChange(new HashSet<>(sequence.getTriggerOnStatusChange()))
                .triggerOnPriorityChange(new HashSet<>(sequence.getTriggerOnPriorityChange()))
                .isActive(sequence.getIsActive())
                .delayStartDays(sequence.getDelayStartDays())
                .stepCount(steps.size())
                .steps(steps)
                .createdAt(sequence.getCreatedAt())
                .updatedAt(sequence.getUpdatedAt())
                .build();
    }

    public static EmailSequenceStepDto toDto(EmailSequenceStep step) {
        if (step == null) {
            return null;
        }

        return EmailSequenceStepDto.builder()
                .id(step.getId())
                .stepNumber(step.getStepNumber())
                .templateId(step.getTemplate().getId())
                .templateName(step.getTemplate().getName())
                .delayDays(step.getDelayDays())
                .sendOnlyIfNotReplied(step.getSendOnlyIfNotReplied())
                .sendOnlyIfStatus(new HashSet<>(step.getSendOnlyIfStatus()))
                .isActive(step.getIsActive())
                .build();
    }

    public static SequenceEnrollmentDto toDto(EmailSequenceEnrollment enrollment) {
        if (enrollment == null) {
            return null;
        }

        return SequenceEnrollmentDto.builder()
                .id(enrollment.getId())
                .sequenceId(enrollment.getSequence().getId())
                .sequenceName(enrollment.getSequence().getName())
                .leadId(enrollment.getLead().getId())
                .leadName(enrollment.getLead().getFullName())
                .currentStep(enrollment.getCurrentStep())
                .isActive(enrollment.getIsActive())
                .emailsSent(enrollment.getEmailsSent())
                .hasReplied(enrollment.getHasReplied())
                .enrolledAt(enrollment.getEnrolledAt())
                .lastEmailSent(enrollment.getLastEmailSent())
                .completedAt(enrollment.getCompletedAt())
                .build();
    }

    public static EmailTrackingDto toDto(EmailTracking event) {
        return EmailTrackingDto.builder()
                .id(event.getId())
                .eventType(event.getEventType())
                .timestamp(event.getTimestamp())
                .ipAddress(event.getIpAddress())
                .userAgent(event.getUserAgent())
                .clickedUrl(event.getClickedUrl())
                .bounceReason(event.getBounceReason())
                .build();
    }
}
