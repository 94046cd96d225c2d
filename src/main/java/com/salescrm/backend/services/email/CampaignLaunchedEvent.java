package com.salescrm.backend.services.email;

/**
 * Published when a campaign moves to SENDING from a user action. The first
 * batch goes out once the launching transaction has committed.
 */
public record CampaignLaunchedEvent(Long campaignId) {
}
