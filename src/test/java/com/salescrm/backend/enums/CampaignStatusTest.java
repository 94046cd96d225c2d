package com.salescrm.backend.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CampaignStatusTest {

    @Test
    void canTransitionTo_ShouldAllowLifecycle() {
        assertThat(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.SCHEDULED)).isTrue();
        assertThat(CampaignStatus.SCHEDULED.canTransitionTo(CampaignStatus.SENDING)).isTrue();
        assertThat(CampaignStatus.SENDING.canTransitionTo(CampaignStatus.PAUSED)).isTrue();
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.SENDING)).isTrue();
        assertThat(CampaignStatus.SENDING.canTransitionTo(CampaignStatus.SENT)).isTrue();
    }

    @Test
    void canTransitionTo_ShouldAllowCancelUntilFinished() {
        assertThat(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.CANCELLED)).isTrue();
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.CANCELLED)).isTrue();
        assertThat(CampaignStatus.SENT.canTransitionTo(CampaignStatus.CANCELLED)).isFalse();
        assertThat(CampaignStatus.CANCELLED.canTransitionTo(CampaignStatus.CANCELLED)).isFalse();
    }

    @Test
    void canTransitionTo_ShouldRejectSkippingOrRestarting() {
        assertThat(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.SENT)).isFalse();
        assertThat(CampaignStatus.PAUSED.canTransitionTo(CampaignStatus.SENT)).isFalse();
        assertThat(CampaignStatus.SENT.canTransitionTo(CampaignStatus.SENDING)).isFalse();
        assertThat(CampaignStatus.CANCELLED.canTransitionTo(CampaignStatus.SENDING)).isFalse();
    }
}
