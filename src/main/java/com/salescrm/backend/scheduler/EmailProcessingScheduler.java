package com.salescrm.backend.scheduler;

import com.salescrm.backend.services.email.EmailCampaignService;
import com.salescrm.backend.services.email.EmailSequenceService;
import com.salescrm.backend.services.email.ProcessingSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Background email jobs. Fixed delays keep each job from overlapping with
 * its own previous run.
 */
@Component
@ConditionalOnProperty(prefix = "crm.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EmailProcessingScheduler {

    private final EmailCampaignService campaignService;
    private final EmailSequenceService sequenceService;
    private final MeterRegistry meterRegistry;

    @Scheduled(fixedDelayString = "${crm.scheduler.campaigns-delay-ms:60000}",
            initialDelayString = "${crm.scheduler.initial-delay-ms:30000}")
    public void processCampaigns() {
        run("campaigns", campaignService::processCampaigns);
    }

    @Scheduled(fixedDelayString = "${crm.scheduler.sequences-delay-ms:300000}",
            initialDelayString = "${crm.scheduler.initial-delay-ms:30000}")
    public void processSequences() {
        run("sequences", sequenceService::tick);
    }

    @Scheduled(fixedDelayString = "${crm.scheduler.retry-delay-ms:900000}",
            initialDelayString = "${crm.scheduler.initial-delay-ms:30000}")
    public void retryFailedEmails() {
        run("retry", campaignService::retryFailedEmails);
    }

    private void run(String job, Supplier<ProcessingSummary> work) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ProcessingSummary summary = work.get();
            record(job, "success", summary.succeeded());
            record(job, "failure", summary.failed());
            if (summary.processed() > 0) {
                log.info("Email job '{}' finished: {} processed, {} ok, {} failed",
                        job, summary.processed(), summary.succeeded(), summary.failed());
            } else {
                log.debug("Email job '{}' had nothing to do", job);
            }
        } catch (Exception e) {
            Counter.builder("crm.email.jobs.errors")
                    .description("Email job runs that aborted")
                    .tag("job", job)
                    .register(meterRegistry)
                    .increment();
            log.error("Email job '{}' failed: {}", job, e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("crm.email.jobs.duration")
                    .description("Email job run duration")
                    .tag("job", job)
                    .register(meterRegistry));
        }
    }

    private void record(String job, String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter.builder("crm.email.jobs.items")
                .description("Units handled by the email jobs")
                .tag("job", job)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment(amount);
    }
}
