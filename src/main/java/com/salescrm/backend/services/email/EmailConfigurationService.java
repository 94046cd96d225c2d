package com.salescrm.backend.services.email;

import com.salescrm.backend.config.CrmProperties;
import com.salescrm.backend.dto.email.ConnectionTestDto;
import com.salescrm.backend.dto.email.EmailConfigurationDto;
import com.salescrm.backend.dto.email.request.EmailConfigurationRequest;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.repositories.email.EmailConfigurationRepository;
import com.salescrm.backend.util.EmailMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-user sending identities. A user has at most one default configuration;
 * saving a default clears the flag on the others in the same transaction.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EmailConfigurationService {

    private final EmailConfigurationRepository configurationRepository;
    private final EmailTransport emailTransport;
    private final CrmProperties properties;

    @Transactional(readOnly = true)
    public List<EmailConfigurationDto> getConfigurations(User user) {
        return configurationRepository.findByUserOrderByCreatedAtDesc(user).stream()
                .map(EmailMapper::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public EmailConfiguration getOwned(User user, Long configId) {
        return configurationRepository.findByIdAndUser(configId, user)
                .orElseThrow(() -> new EntityNotFoundException("Email configuration not found: " + configId));
    }

    /**
     * The configuration outgoing mail of this user goes through: the active
     * default, otherwise the oldest active one.
     */
    @Transactional(readOnly = true)
    public Optional<EmailConfiguration> resolveSendingConfig(User user) {
        Optional<EmailConfiguration> preferred = configurationRepository.findFirstByUserAndIsDefaultTrueAndIsActiveTrue(user);
        if (preferred.isPresent()) {
            return preferred;
        }
        return configurationRepository.findFirstByUserAndIsActiveTrueOrderByIdAsc(user);
    }

    public EmailConfigurationDto createConfiguration(User user, EmailConfigurationRequest request) {
        if (configurationRepository.existsByUserAndNameIgnoreCase(user, request.getName())) {
            throw new CrmValidationException("You already have a configuration named '" + request.getName() + "'");
        }
        validateSecurity(request);

        EmailConfiguration config = EmailConfiguration.builder()
                .user(user)
                .build();
        apply(config, request);

        EmailConfiguration saved = save(config);
        log.info("Created email configuration {} for user {}", saved.getId(), user.getId());
        return EmailMapper.toDto(saved);
    }

    public EmailConfigurationDto updateConfiguration(User user, Long configId, EmailConfigurationRequest request) {
        EmailConfiguration config = getOwned(user, configId);
        if (!config.getName().equalsIgnoreCase(request.getName())
                && configurationRepository.existsByUserAndNameIgnoreCase(user, request.getName())) {
            throw new CrmValidationException("You already have a configuration named '" + request.getName() + "'");
        }
        validateSecurity(request);

        apply(config, request);
        return EmailMapper.toDto(save(config));
    }

    public EmailConfigurationDto setDefault(User user, Long configId) {
        EmailConfiguration config = getOwned(user, configId);
        if (!config.isUsable()) {
            throw new CrmValidationException("An inactive configuration cannot be the default");
        }
        config.setIsDefault(true);
        return EmailMapper.toDto(save(config));
    }

    public void deleteConfiguration(User user, Long configId) {
        EmailConfiguration config = getOwned(user, configId);
        configurationRepository.delete(config);
        log.info("Deleted email configuration {} of user {}", configId, user.getId());
    }

    public ConnectionTestDto testConnection(User user, Long configId) {
        EmailConfiguration config = getOwned(user, configId);
        ConnectionTestResult result = emailTransport.testConnection(config);
        return ConnectionTestDto.builder()
                .success(result.success())
                .message(result.message())
                .build();
    }

    /**
     * Send a fixed message to the given address through the configuration.
     */
    public ConnectionTestDto sendTestEmail(User user, Long configId, String toEmail) {
        EmailConfiguration config = getOwned(user, configId);

        String html = "<p>This is a test email from your Sales CRM email configuration "
                + "<strong>" + config.getName() + "</strong>.</p>"
                + "<p>If you received this email, your configuration is working correctly.</p>";
        String text = "This is a test email from your Sales CRM email configuration " + config.getName() + ".\n\n"
                + "If you received this email, your configuration is working correctly.";

        SendResult result = emailTransport.send(
                new OutgoingEmail(toEmail, null, properties.testSubject(), html, text, null), config);

        log.info("Test email via configuration {} to {}: {}", configId, toEmail, result.success() ? "sent" : result.message());
        return ConnectionTestDto.builder()
                .success(result.success())
                .message(result.success() ? "Test email sent successfully" : result.message())
                .build();
    }

    /**
     * Persist, then clear the default flag on every sibling when this one is
     * the default. A user's first active configuration becomes the default.
     */
    EmailConfiguration save(EmailConfiguration config) {
        if (!Boolean.TRUE.equals(config.getIsDefault()) && config.isUsable()
                && configurationRepository.countByUserAndIsDefaultTrue(config.getUser()) == 0) {
            config.setIsDefault(true);
        }
        EmailConfiguration saved = configurationRepository.save(config);
        if (Boolean.TRUE.equals(saved.getIsDefault())) {
            int cleared = configurationRepository.clearDefaultExcept(saved.getUser(), saved.getId());
            if (cleared > 0) {
                log.debug("Cleared default flag on {} other configuration(s) of user {}", cleared, saved.getUser().getId());
            }
        }
        return saved;
    }

    private void apply(EmailConfiguration config, EmailConfigurationRequest request) {
        config.setName(request.getName().trim());
        config.setProvider(request.getProvider() != null ? request.getProvider() : EmailConfiguration.Provider.SMTP);
        config.setSmtpHost(request.getSmtpHost().trim());
        config.setSmtpPort(request.getSmtpPort() != null ? request.getSmtpPort() : 587);
        config.setSmtpUsername(request.getSmtpUsername());
        if (request.getSmtpPassword() != null && !request.getSmtpPassword().isEmpty()) {
            config.setSmtpPassword(request.getSmtpPassword());
        }
        config.setUseTls(Boolean.TRUE.equals(request.getUseTls()));
        config.setUseSsl(Boolean.TRUE.equals(request.getUseSsl()));
        config.setFromEmail(request.getFromEmail().trim());
        config.setFromName(request.getFromName().trim());
        config.setReplyTo(request.getReplyTo() != null && !request.getReplyTo().isBlank() ? request.getReplyTo().trim() : null);
        config.setIsActive(request.getIsActive() == null || request.getIsActive());
        config.setIsDefault(Boolean.TRUE.equals(request.getIsDefault()) && config.isUsable());
        config.setDailyLimit(request.getDailyLimit() != null ? request.getDailyLimit() : 500);
    }

    private void validateSecurity(EmailConfigurationRequest request) {
        if (Boolean.TRUE.equals(request.getUseTls()) && Boolean.TRUE.equals(request.getUseSsl())) {
            throw new CrmValidationException("Choose either TLS or SSL, not both");
        }
    }
}
