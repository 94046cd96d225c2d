package com.salescrm.backend.scheduler;

import com.salescrm.backend.services.email.EmailCampaignService;
import com.salescrm.backend.services.email.EmailSequenceService;
import com.salescrm.backend.services.email.ProcessingSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailProcessingSchedulerTest {

    @Mock
    private EmailCampaignService campaignService;

    @Mock
    private EmailSequenceService sequenceService;

    private MeterRegistry meterRegistry;

    private EmailProcessingScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new EmailProcessingScheduler(campaignService, sequenceService, meterRegistry);
    }

    @Test
    void processCampaigns_ShouldRecordOutcomeCounters() {
        // Given
        when(campaignService.processCampaigns()).thenReturn(new ProcessingSummary(3, 2, 1));

        // When
        scheduler.processCampaigns();

        // Then
        assertThat(meterRegistry.get("crm.email.jobs.items")
                .tag("job", "campaigns").tag("outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("crm.email.jobs.items")
                .tag("job", "campaigns").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("crm.email.jobs.duration").tag("job", "campaigns").timer().count())
                .isEqualTo(1);
    }

    @Test
    void processSequences_ShouldTickEnrollments() {
        // Given
        when(sequenceService.tick()).thenReturn(new ProcessingSummary(0, 0, 0));

        // When
        scheduler.processSequences();

        // Then
        verify(sequenceService).tick();
        assertThat(meterRegistry.find("crm.email.jobs.items").counter()).isNull();
    }

    @Test
    void retryFailedEmails_ShouldNotPropagateErrors() {
        // Given
        when(campaignService.retryFailedEmails()).thenThrow(new IllegalStateException("database down"));

        // When & Then
        assertThatCode(() -> scheduler.retryFailedEmails()).doesNotThrowAnyException();
        assertThat(meterRegistry.get("crm.email.jobs.errors").tag("job", "retry").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("crm.email.jobs.duration").tag("job", "retry").timer().count())
                .isEqualTo(1);
    }
}
