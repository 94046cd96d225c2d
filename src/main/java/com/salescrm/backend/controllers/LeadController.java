package com.salescrm.backend.controllers;

import com.salescrm.backend.dto.email.EmailDto;
import com.salescrm.backend.dto.lead.BulkUpdateResultDto;
import com.salescrm.backend.dto.lead.LeadActivityDto;
import com.salescrm.backend.dto.lead.LeadDto;
import com.salescrm.backend.dto.lead.LeadStatsDto;
import com.salescrm.backend.dto.lead.request.BulkLeadUpdateRequest;
import com.salescrm.backend.dto.lead.request.LeadActivityRequest;
import com.salescrm.backend.dto.lead.request.LeadRequest;
import com.salescrm.backend.dto.lead.request.LeadSearchRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.LeadService;
import com.salescrm.backend.services.email.EmailService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/leads")
@RequiredArgsConstructor
@Slf4j
public class LeadController {

    private final LeadService leadService;
    private final EmailService emailService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<Page<LeadDto>> searchLeads(
            @ModelAttribute LeadSearchRequest filter,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "25") int size,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(leadService.searchLeads(user, filter, page, size));
    }

    @GetMapping("/stats")
    public ResponseEntity<LeadStatsDto> getStats(Authentication authentication) {
        return ResponseEntity.ok(leadService.getStats(getCurrentUser(authentication)));
    }

    @GetMapping("/{leadId}")
    public ResponseEntity<LeadDto> getLead(@PathVariable Long leadId, Authentication authentication) {
        return ResponseEntity.ok(leadService.getLead(getCurrentUser(authentication), leadId));
    }

    @PostMapping
    public ResponseEntity<LeadDto> createLead(
            @Valid @RequestBody LeadRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(leadService.createLead(user, request));
    }

    @PutMapping("/{leadId}")
    public ResponseEntity<LeadDto> updateLead(
            @PathVariable Long leadId,
            @Valid @RequestBody LeadRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(leadService.updateLead(user, leadId, request));
    }

    @PostMapping("/bulk-update")
    public ResponseEntity<BulkUpdateResultDto> bulkUpdate(
            @Valid @RequestBody BulkLeadUpdateRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(leadService.bulkUpdate(user, request));
    }

    // ================================
    // ACTIVITIES
    // ================================

    @GetMapping("/{leadId}/activities")
    public ResponseEntity<List<LeadActivityDto>> getActivities(
            @PathVariable Long leadId,
            Authentication authentication) {
        return ResponseEntity.ok(leadService.getActivities(getCurrentUser(authentication), leadId));
    }

    @PostMapping("/{leadId}/activities")
    public ResponseEntity<LeadActivityDto> addActivity(
            @PathVariable Long leadId,
            @Valid @RequestBody LeadActivityRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(leadService.addActivity(user, leadId, request));
    }

    @GetMapping("/{leadId}/emails")
    public ResponseEntity<List<EmailDto>> getEmails(@PathVariable Long leadId, Authentication authentication) {
        return ResponseEntity.ok(emailService.getEmailsForLead(getCurrentUser(authentication), leadId));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
