package com.salescrm.backend.controllers.email;

import com.salescrm.backend.dto.email.EmailCampaignDto;
import com.salescrm.backend.dto.email.EmailDto;
import com.salescrm.backend.dto.email.EmailStatsDto;
import com.salescrm.backend.dto.email.EmailTrackingDto;
import com.salescrm.backend.dto.email.TemplatePerformanceDto;
import com.salescrm.backend.dto.email.request.BulkEmailRequest;
import com.salescrm.backend.dto.email.request.QuickEmailRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.dashboard.DateRange;
import com.salescrm.backend.services.email.EmailAnalyticsService;
import com.salescrm.backend.services.email.EmailCampaignService;
import com.salescrm.backend.services.email.EmailService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * One-off sends, the outbound email log and per-user email analytics.
 */
@RestController
@RequestMapping("/api/email")
@RequiredArgsConstructor
@Slf4j
public class EmailController {

    private final EmailService emailService;
    private final EmailCampaignService campaignService;
    private final EmailAnalyticsService analyticsService;
    private final UserRepository userRepository;
    private final Clock clock;

    @GetMapping("/emails")
    public ResponseEntity<List<EmailDto>> getEmails(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "25") int size,
            Authentication authentication) {
        return ResponseEntity.ok(emailService.getEmails(getCurrentUser(authentication), page, size));
    }

    @GetMapping("/emails/{emailId}")
    public ResponseEntity<EmailDto> getEmail(@PathVariable Long emailId, Authentication authentication) {
        return ResponseEntity.ok(emailService.getEmail(getCurrentUser(authentication), emailId));
    }

    @GetMapping("/emails/{emailId}/tracking")
    public ResponseEntity<List<EmailTrackingDto>> getTracking(@PathVariable Long emailId, Authentication authentication) {
        return ResponseEntity.ok(emailService.getTrackingEvents(getCurrentUser(authentication), emailId));
    }

    @PostMapping("/leads/{leadId}/quick")
    public ResponseEntity<EmailDto> quickEmail(
            @PathVariable Long leadId,
            @Valid @RequestBody QuickEmailRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(emailService.quickEmail(user, leadId, request));
    }

    @PostMapping("/bulk")
    public ResponseEntity<EmailCampaignDto> bulkEmail(
            @Valid @RequestBody BulkEmailRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        log.info("User {} sending bulk email to {} leads", user.getId(), request.getLeadIds().size());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EmailMapper.toDto(campaignService.bulkEmail(user, request)));
    }

    @GetMapping("/analytics")
    public ResponseEntity<EmailStatsDto> getAnalytics(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        DateRange.Window window = DateRange.parse(range).resolve(LocalDate.now(clock), from, to);
        return ResponseEntity.ok(analyticsService.getUserStats(user, window));
    }

    @GetMapping("/analytics/templates")
    public ResponseEntity<List<TemplatePerformanceDto>> getTemplateAnalytics(Authentication authentication) {
        return ResponseEntity.ok(analyticsService.getTemplatePerformance(getCurrentUser(authentication)));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
