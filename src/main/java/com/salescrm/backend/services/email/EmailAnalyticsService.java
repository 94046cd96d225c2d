package com.salescrm.backend.services.email;

import com.salescrm.backend.dto.email.EmailStatsDto;
import com.salescrm.backend.dto.email.TemplatePerformanceDto;
import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailCampaign;
import com.salescrm.backend.models.email.EmailTemplate;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailTemplateRepository;
import com.salescrm.backend.services.dashboard.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only email reporting.
 * Sent counts include everything that left the server; open and click
 * rates are measured against delivered mail, template rates against sent mail.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class EmailAnalyticsService {

    private final EmailRepository emailRepository;
    private final EmailTemplateRepository templateRepository;

    public EmailStatsDto getUserStats(User user, DateRange.Window window) {
        long sent = emailRepository.countByUserAndStatusInAndCreatedAtBetween(
                user, EmailStatus.SENT_OR_LATER, window.from(), window.to());
        long delivered = emailRepository.countByUserAndStatusInAndCreatedAtBetween(
                user, EmailStatus.DELIVERED_OR_LATER, window.from(), window.to());
        long opened = emailRepository.countByUserAndStatusInAndCreatedAtBetween(
                user, EmailStatus.OPENED_OR_LATER, window.from(), window.to());
        long clicked = emailRepository.countByUserAndStatusAndCreatedAtBetween(
                user, EmailStatus.CLICKED, window.from(), window.to());
        long bounced = emailRepository.countByUserAndStatusAndCreatedAtBetween(
                user, EmailStatus.BOUNCED, window.from(), window.to());
        long failed = emailRepository.countByUserAndStatusAndCreatedAtBetween(
                user, EmailStatus.FAILED, window.from(), window.to());
        long queued = emailRepository.countByUserAndStatusAndCreatedAtBetween(
                user, EmailStatus.QUEUED, window.from(), window.to());

        return build(sent, delivered, opened, clicked, bounced, failed, queued);
    }

    public EmailStatsDto getCampaignStats(EmailCampaign campaign) {
        long sent = emailRepository.countByCampaignAndStatusIn(campaign, EmailStatus.SENT_OR_LATER);
        long delivered = emailRepository.countByCampaignAndStatusIn(campaign, EmailStatus.DELIVERED_OR_LATER);
        long opened = emailRepository.countByCampaignAndStatusIn(campaign, EmailStatus.OPENED_OR_LATER);
        long clicked = emailRepository.countByCampaignAndStatus(campaign, EmailStatus.CLICKED);
        long bounced = emailRepository.countByCampaignAndStatus(campaign, EmailStatus.BOUNCED);
        long failed = emailRepository.countByCampaignAndStatus(campaign, EmailStatus.FAILED);
        long queued = emailRepository.countByCampaignAndStatus(campaign, EmailStatus.QUEUED);

        return build(sent, delivered, opened, clicked, bounced, failed, queued);
    }

    public TemplatePerformanceDto getTemplatePerformance(EmailTemplate template) {
        long sent = emailRepository.countByTemplateAndStatusIn(template, EmailStatus.SENT_OR_LATER);
        long opened = emailRepository.countByTemplateAndStatusIn(template, EmailStatus.OPENED_OR_LATER);
        long clicked = emailRepository.countByTemplateAndStatusIn(template, EnumSet.of(EmailStatus.CLICKED));

        return TemplatePerformanceDto.builder()
                .templateId(template.getId())
                .templateName(template.getName())
                .totalSent(sent)
                .opened(opened)
                .clicked(clicked)
                .openRate(percentage(opened, sent))
                .clickRate(percentage(clicked, sent))
                .usageCount(template.getUsageCount() != null ? template.getUsageCount() : 0)
                .build();
    }

    /**
     * Performance of the user's own templates, best open rate first.
     */
    public List<TemplatePerformanceDto> getTemplatePerformance(User user) {
        return templateRepository.findByUserOrderByCreatedAtDesc(user).stream()
                .map(this::getTemplatePerformance)
                .sorted(Comparator.comparingDouble(TemplatePerformanceDto::getOpenRate).reversed())
                .collect(Collectors.toList());
    }

    private EmailStatsDto build(long sent, long delivered, long opened, long clicked,
                                long bounced, long failed, long queued) {
        return EmailStatsDto.builder()
                .totalSent(sent)
                .delivered(delivered)
                .opened(opened)
                .clicked(clicked)
                .bounced(bounced)
                .failed(failed)
                .queued(queued)
                .deliveryRate(percentage(delivered, sent))
                .openRate(percentage(opened, delivered))
                .clickRate(percentage(clicked, delivered))
                .bounceRate(percentage(bounced, sent))
                .build();
    }

    static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / whole).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
