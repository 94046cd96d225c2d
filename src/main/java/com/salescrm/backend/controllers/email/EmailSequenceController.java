package com.salescrm.backend.controllers.email;

import com.salescrm.backend.dto.email.EmailSequenceDto;
import com.salescrm.backend.dto.email.EmailSequenceStepDto;
import com.salescrm.backend.dto.email.SequenceEnrollmentDto;
import com.salescrm.backend.dto.email.request.SequenceRequest;
import com.salescrm.backend.dto.email.request.SequenceStepRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.email.EmailSequenceService;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/email/sequences")
@RequiredArgsConstructor
public class EmailSequenceController {

    private final EmailSequenceService sequenceService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<List<EmailSequenceDto>> getSequences(Authentication authentication) {
        return ResponseEntity.ok(sequenceService.getSequences(getCurrentUser(authentication)));
    }

    @GetMapping("/{sequenceId}")
    public ResponseEntity<EmailSequenceDto> getSequence(@PathVariable Long sequenceId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(sequenceService.getOwned(user, sequenceId)));
    }

    @PostMapping
    public ResponseEntity<EmailSequenceDto> createSequence(
            @Valid @RequestBody SequenceRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(sequenceService.createSequence(user, request));
    }

    @PutMapping("/{sequenceId}")
    public ResponseEntity<EmailSequenceDto> updateSequence(
            @PathVariable Long sequenceId,
            @Valid @RequestBody SequenceRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(sequenceService.updateSequence(user, sequenceId, request));
    }

    @PostMapping("/{sequenceId}/activate")
    public ResponseEntity<EmailSequenceDto> activate(@PathVariable Long sequenceId, Authentication authentication) {
        return ResponseEntity.ok(sequenceService.setActive(getCurrentUser(authentication), sequenceId, true));
    }

    @PostMapping("/{sequenceId}/deactivate")
    public ResponseEntity<EmailSequenceDto> deactivate(@PathVariable Long sequenceId, Authentication authentication) {
        return ResponseEntity.ok(sequenceService.setActive(getCurrentUser(authentication), sequenceId, false));
    }

    @PostMapping("/{sequenceId}/steps")
    public ResponseEntity<EmailSequenceStepDto> addStep(
            @PathVariable Long sequenceId,
            @Valid @RequestBody SequenceStepRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(sequenceService.addStep(user, sequenceId, request));
    }

    @DeleteMapping("/{sequenceId}/steps/{stepId}")
    public ResponseEntity<Void> deleteStep(
            @PathVariable Long sequenceId,
            @PathVariable Long stepId,
            Authentication authentication) {
        sequenceService.deleteStep(getCurrentUser(authentication), sequenceId, stepId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sequenceId}/enrollments")
    public ResponseEntity<List<SequenceEnrollmentDto>> getEnrollments(
            @PathVariable Long sequenceId,
            Authentication authentication) {
        return ResponseEntity.ok(sequenceService.getEnrollments(getCurrentUser(authentication), sequenceId));
    }

    @PostMapping("/{sequenceId}/enroll/{leadId}")
    public ResponseEntity<SequenceEnrollmentDto> enroll(
            @PathVariable Long sequenceId,
            @PathVariable Long leadId,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(sequenceService.enrollLead(user, sequenceId, leadId));
    }

    @PostMapping("/{sequenceId}/enrollments/{enrollmentId}/unenroll")
    public ResponseEntity<SequenceEnrollmentDto> unenroll(
            @PathVariable Long sequenceId,
            @PathVariable Long enrollmentId,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(sequenceService.unenroll(user, sequenceId, enrollmentId));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
