package com.salescrm.backend.controllers.email;

import com.salescrm.backend.dto.email.ConnectionTestDto;
import com.salescrm.backend.dto.email.EmailConfigurationDto;
import com.salescrm.backend.dto.email.request.EmailConfigurationRequest;
import com.salescrm.backend.dto.email.request.TestEmailRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.email.EmailConfigurationService;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/email/configurations")
@RequiredArgsConstructor
public class EmailConfigurationController {

    private final EmailConfigurationService configurationService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<List<EmailConfigurationDto>> getConfigurations(Authentication authentication) {
        return ResponseEntity.ok(configurationService.getConfigurations(getCurrentUser(authentication)));
    }

    @PostMapping
    public ResponseEntity<EmailConfigurationDto> createConfiguration(
            @Valid @RequestBody EmailConfigurationRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(configurationService.createConfiguration(user, request));
    }

    @PutMapping("/{configId}")
    public ResponseEntity<EmailConfigurationDto> updateConfiguration(
            @PathVariable Long configId,
            @Valid @RequestBody EmailConfigurationRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(configurationService.updateConfiguration(user, configId, request));
    }

    @PostMapping("/{configId}/default")
    public ResponseEntity<EmailConfigurationDto> setDefault(@PathVariable Long configId, Authentication authentication) {
        return ResponseEntity.ok(configurationService.setDefault(getCurrentUser(authentication), configId));
    }

    @DeleteMapping("/{configId}")
    public ResponseEntity<Void> deleteConfiguration(@PathVariable Long configId, Authentication authentication) {
        configurationService.deleteConfiguration(getCurrentUser(authentication), configId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{configId}/test")
    public ResponseEntity<ConnectionTestDto> testConnection(@PathVariable Long configId, Authentication authentication) {
        return ResponseEntity.ok(configurationService.testConnection(getCurrentUser(authentication), configId));
    }

    @PostMapping("/{configId}/test-email")
    public ResponseEntity<ConnectionTestDto> sendTestEmail(
            @PathVariable Long configId,
            @Valid @RequestBody TestEmailRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(configurationService.sendTestEmail(user, configId, request.getToEmail()));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
