package com.salescrm.backend.services.email;

import com.salescrm.backend.config.CrmProperties;
import com.salescrm.backend.dto.email.ConnectionTestDto;
import com.salescrm.backend.dto.email.EmailConfigurationDto;
import com.salescrm.backend.dto.email.request.EmailConfigurationRequest;
import com.salescrm.backend.exceptions.CrmValidationException;
import com.salescrm.backend.models.User;
import com.salescrm.backend.models.email.EmailConfiguration;
import com.salescrm.backend.repositories.email.EmailConfigurationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailConfigurationServiceTest {

    @Mock
    private EmailConfigurationRepository configurationRepository;

    @Mock
    private EmailTransport emailTransport;

    private EmailConfigurationService configurationService;

    private User testUser;

    @BeforeEach
    void setUp() {
        configurationService = new EmailConfigurationService(configurationRepository, emailTransport, CrmProperties.defaults());
        testUser = User.builder()
                .id(1L)
                .email("rep@example.com")
                .build();
    }

    @Test
    void createConfiguration_ShouldClearOtherDefaultsWhenSavedAsDefault() {
        // Given
        EmailConfigurationRequest request = request("Office SMTP");
        request.setIsDefault(true);
        when(configurationRepository.existsByUserAndNameIgnoreCase(testUser, "Office SMTP")).thenReturn(false);
        when(configurationRepository.save(any(EmailConfiguration.class))).thenAnswer(inv -> {
            EmailConfiguration config = inv.getArgument(0);
            config.setId(11L);
            return config;
        });

        // When
        EmailConfigurationDto result = configurationService.createConfiguration(testUser, request);

        // Then
        assertThat(result.getIsDefault()).isTrue();
        verify(configurationRepository).clearDefaultExcept(testUser, 11L);
    }

    @Test
    void createConfiguration_ShouldMakeFirstActiveConfigurationTheDefault() {
        // Given
        EmailConfigurationRequest request = request("First");
        when(configurationRepository.countByUserAndIsDefaultTrue(testUser)).thenReturn(0L);
        when(configurationRepository.save(any(EmailConfiguration.class))).thenAnswer(inv -> {
            EmailConfiguration config = inv.getArgument(0);
            config.setId(12L);
            return config;
        });

        // When
        EmailConfigurationDto result = configurationService.createConfiguration(testUser, request);

        // Then
        assertThat(result.getIsDefault()).isTrue();
        verify(configurationRepository).clearDefaultExcept(testUser, 12L);
    }

    @Test
    void createConfiguration_ShouldKeepExistingDefault() {
        // Given
        EmailConfigurationRequest request = request("Second");
        when(configurationRepository.countByUserAndIsDefaultTrue(testUser)).thenReturn(1L);
        when(configurationRepository.save(any(EmailConfiguration.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        EmailConfigurationDto result = configurationService.createConfiguration(testUser, request);

        // Then
        assertThat(result.getIsDefault()).isFalse();
        verify(configurationRepository, never()).clearDefaultExcept(any(), any());
    }

    @Test
    void createConfiguration_ShouldRejectDuplicateName() {
        // Given
        when(configurationRepository.existsByUserAndNameIgnoreCase(testUser, "Office SMTP")).thenReturn(true);

        // When & Then
        assertThatThrownBy(() -> configurationService.createConfiguration(testUser, request("Office SMTP")))
                .isInstanceOf(CrmValidationException.class);
        verify(configurationRepository, never()).save(any());
    }

    @Test
    void createConfiguration_ShouldRejectTlsAndSslTogether() {
        // Given
        EmailConfigurationRequest request = request("Both");
        request.setUseSsl(true);

        // When & Then
        assertThatThrownBy(() -> configurationService.createConfiguration(testUser, request))
                .isInstanceOf(CrmValidationException.class)
                .hasMessageContaining("TLS or SSL");
    }

    @Test
    void setDefault_ShouldRejectInactiveConfiguration() {
        // Given
        EmailConfiguration inactive = EmailConfiguration.builder().id(3L).user(testUser).isActive(false).build();
        when(configurationRepository.findByIdAndUser(3L, testUser)).thenReturn(Optional.of(inactive));

        // When & Then
        assertThatThrownBy(() -> configurationService.setDefault(testUser, 3L))
                .isInstanceOf(CrmValidationException.class);
    }

    @Test
    void resolveSendingConfig_ShouldFallBackToOldestActiveConfiguration() {
        // Given
        EmailConfiguration oldest = EmailConfiguration.builder().id(2L).user(testUser).build();
        when(configurationRepository.findFirstByUserAndIsDefaultTrueAndIsActiveTrue(testUser)).thenReturn(Optional.empty());
        when(configurationRepository.findFirstByUserAndIsActiveTrueOrderByIdAsc(testUser)).thenReturn(Optional.of(oldest));

        // When & Then
        assertThat(configurationService.resolveSendingConfig(testUser)).containsSame(oldest);
    }

    @Test
    void sendTestEmail_ShouldSendFixedMessageThroughConfiguration() {
        // Given
        EmailConfiguration config = EmailConfiguration.builder().id(4L).name("Office").user(testUser).build();
        when(configurationRepository.findByIdAndUser(4L, testUser)).thenReturn(Optional.of(config));
        when(emailTransport.send(any(OutgoingEmail.class), eq(config))).thenReturn(SendResult.sent("<id@test>"));

        // When
        ConnectionTestDto result = configurationService.sendTestEmail(testUser, 4L, "me@example.com");

        // Then
        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<OutgoingEmail> sent = ArgumentCaptor.forClass(OutgoingEmail.class);
        verify(emailTransport).send(sent.capture(), eq(config));
        assertThat(sent.getValue().to()).isEqualTo("me@example.com");
        assertThat(sent.getValue().subject()).isEqualTo("Test Email from Sales CRM");
        assertThat(sent.getValue().htmlBody()).contains("Office");
    }

    private EmailConfigurationRequest request(String name) {
        EmailConfigurationRequest request = new EmailConfigurationRequest();
        request.setName(name);
        request.setSmtpHost("smtp.example.com");
        request.setSmtpUsername("user");
        request.setSmtpPassword("secret");
        request.setFromEmail("sales@example.com");
        request.setFromName("Sales Team");
        return request;
    }
}
