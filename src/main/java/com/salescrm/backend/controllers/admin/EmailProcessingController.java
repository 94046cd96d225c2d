package com.salescrm.backend.controllers.admin;

import com.salescrm.backend.services.email.EmailCampaignService;
import com.salescrm.backend.services.email.EmailSequenceService;
import com.salescrm.backend.services.email.ProcessingSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual triggers for the background email jobs. Useful when the scheduler
 * is disabled or when an operator wants to drain a backlog immediately.
 */
@RestController
@RequestMapping("/api/admin/email-processing")
@RequiredArgsConstructor
@Slf4j
public class EmailProcessingController {

    private final EmailCampaignService campaignService;
    private final EmailSequenceService sequenceService;

    @PostMapping("/campaigns")
    public ResponseEntity<ProcessingSummary> processCampaigns() {
        log.info("Admin request: processing campaigns");
        return ResponseEntity.ok(campaignService.processCampaigns());
    }

    @PostMapping("/sequences")
    public ResponseEntity<ProcessingSummary> processSequences() {
        log.info("Admin request: processing sequence enrollments");
        return ResponseEntity.ok(sequenceService.tick());
    }

    @PostMapping("/retry")
    public ResponseEntity<ProcessingSummary> retryFailed() {
        log.info("Admin request: retrying failed emails");
        return ResponseEntity.ok(campaignService.retryFailedEmails());
    }
}
