package com.salescrm.backend.services.email;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignLaunchListener {

    private final EmailCampaignService campaignService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCampaignLaunched(CampaignLaunchedEvent event) {
        try {
            BatchResult result = campaignService.sendBatch(event.campaignId(), null);
            log.info("First batch of campaign {}: {} sent, {} failed",
                    event.campaignId(), result.sent(), result.failed());
        } catch (Exception e) {
            // the scheduler picks the campaign up on its next pass
            log.error("Failed to send first batch of campaign {}", event.campaignId(), e);
        }
    }
}
