package com.salescrm.backend.controllers;

import com.salescrm.backend.dto.lead.LeadSourceDto;
import com.salescrm.backend.dto.lead.request.LeadSourceRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.LeadSourceService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/lead-sources")
@RequiredArgsConstructor
public class LeadSourceController {

    private final LeadSourceService leadSourceService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<List<LeadSourceDto>> getSources(
            @RequestParam(defaultValue = "false") boolean activeOnly,
            Authentication authentication) {
        return ResponseEntity.ok(leadSourceService.getSources(getCurrentUser(authentication), activeOnly));
    }

    @PostMapping
    public ResponseEntity<LeadSourceDto> createSource(
            @Valid @RequestBody LeadSourceRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(leadSourceService.createSource(user, request));
    }

    @PutMapping("/{sourceId}")
    public ResponseEntity<LeadSourceDto> updateSource(
            @PathVariable Long sourceId,
            @Valid @RequestBody LeadSourceRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(leadSourceService.updateSource(user, sourceId, request));
    }

    @DeleteMapping("/{sourceId}")
    public ResponseEntity<Void> deactivateSource(@PathVariable Long sourceId, Authentication authentication) {
        leadSourceService.deactivateSource(getCurrentUser(authentication), sourceId);
        return ResponseEntity.noContent().build();
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
