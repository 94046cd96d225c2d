package com.salescrm.backend.controllers.email;

import com.salescrm.backend.dto.email.EmailTemplateDto;
import com.salescrm.backend.dto.email.TemplatePerformanceDto;
import com.salescrm.backend.dto.email.request.EmailTemplateRequest;
import com.salescrm.backend.models.User;
import com.salescrm.backend.repositories.UserRepository;
import com.salescrm.backend.services.email.EmailAnalyticsService;
import com.salescrm.backend.services.email.EmailTemplateService;
import com.salescrm.backend.services.email.RenderedEmail;
import com.salescrm.backend.services.email.TemplateRenderer;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@RestController
@RequestMapping("/api/email/templates")
@RequiredArgsConstructor
public class EmailTemplateController {

    private final EmailTemplateService templateService;
    private final EmailAnalyticsService analyticsService;
    private final UserRepository userRepository;

    @GetMapping
    public ResponseEntity<List<EmailTemplateDto>> getTemplates(Authentication authentication) {
        return ResponseEntity.ok(templateService.getVisibleTemplates(getCurrentUser(authentication)));
    }

    @GetMapping("/variables")
    public ResponseEntity<List<String>> getVariables() {
        return ResponseEntity.ok(List.copyOf(new TreeSet<>(TemplateRenderer.AVAILABLE_VARIABLES)));
    }

    @GetMapping("/{templateId}")
    public ResponseEntity<EmailTemplateDto> getTemplate(@PathVariable Long templateId, Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(EmailMapper.toDto(templateService.getVisible(user, templateId)));
    }

    @PostMapping
    public ResponseEntity<EmailTemplateDto> createTemplate(
            @Valid @RequestBody EmailTemplateRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(templateService.createTemplate(user, request));
    }

    @PutMapping("/{templateId}")
    public ResponseEntity<EmailTemplateDto> updateTemplate(
            @PathVariable Long templateId,
            @Valid @RequestBody EmailTemplateRequest request,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(templateService.updateTemplate(user, templateId, request));
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable Long templateId, Authentication authentication) {
        templateService.deleteTemplate(getCurrentUser(authentication), templateId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validateTemplate(@RequestBody EmailTemplateRequest request) {
        List<String> errors = templateService.validate(request);

        Map<String, Object> response = new HashMap<>();
        response.put("valid", errors.isEmpty());
        response.put("errors", errors);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{templateId}/preview")
    public ResponseEntity<RenderedEmail> preview(
            @PathVariable Long templateId,
            @RequestParam Long leadId,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(templateService.preview(user, templateId, leadId));
    }

    @GetMapping("/{templateId}/performance")
    public ResponseEntity<TemplatePerformanceDto> getPerformance(
            @PathVariable Long templateId,
            Authentication authentication) {
        User user = getCurrentUser(authentication);
        return ResponseEntity.ok(analyticsService.getTemplatePerformance(templateService.getVisible(user, templateId)));
    }

    private User getCurrentUser(Authentication authentication) {
        return userRepository.findByEmailIgnoreCase(authentication.getName())
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
    }
}
