package com.salescrm.backend.controllers.email;

import com.salescrm.backend.dto.email.EmailCampaignDto;
import com.salescrm.backend.dto.email.EmailStatsDto;
import com.salescrm.backend.dto.email.request.CreateCampaignRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.email.BatchResult;
import com.salescrm.backend.services.email.EmailCampaignService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/email/campaigns")
@RequiredArgsConstructor
@Slf4j
public class EmailCampaignController {

    private final EmailCampaignService campaignService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<List<EmailCampaignDto>> getCampaigns(Authentication authentication) {
        return ResponseEntity.ok(campaignService.getCampaigns(getCurrentUser(authentication)));
    }

    @GetMapping("/{campaignId}")
    public ResponseEntity<EmailCampaignDto> getCampaign(@PathVariable Long campaignId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(campaignService.getOwned(user, campaignId)));
    }

    @PostMapping
    public ResponseEntity<EmailCampaignDto> createCampaign(
            @Valid @RequestBody CreateCampaignRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        log.info("User {} creating campaign '{}'", user.getId(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EmailMapper.toDto(campaignService.createCampaign(user, request)));
    }

    @GetMapping("/{campaignId}/stats")
    public ResponseEntity<EmailStatsDto> getStats(@PathVariable Long campaignId, Authentication authentication) {
        return ResponseEntity.ok(campaignService.getCampaignStats(getCurrentUser(authentication), campaignId));
    }

    @PostMapping("/{campaignId}/start")
    public ResponseEntity<EmailCampaignDto> start(@PathVariable Long campaignId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(campaignService.startCampaign(user, campaignId)));
    }

    @PostMapping("/{campaignId}/pause")
    public ResponseEntity<EmailCampaignDto> pause(@PathVariable Long campaignId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(campaignService.pauseCampaign(user, campaignId)));
    }

    @PostMapping("/{campaignId}/resume")
    public ResponseEntity<EmailCampaignDto> resume(@PathVariable Long campaignId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(campaignService.resumeCampaign(user, campaignId)));
    }

    @PostMapping("/{campaignId}/cancel")
    public ResponseEntity<EmailCampaignDto> cancel(@PathVariable Long campaignId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(campaignService.cancelCampaign(user, campaignId)));
    }

    @PostMapping("/{campaignId}/send-batch")
    public ResponseEntity<BatchResult> sendBatch(
            @PathVariable Long campaignId,
            @RequestParam(required = false) Integer batchSize,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(campaignService.sendNextBatch(user, campaignId, batchSize));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
