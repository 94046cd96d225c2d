package com.salescrm.backend.services.email;

import com.salescrm.backend.enums.EmailStatus;
import com.salescrm.backend.models.Lead;
import com.salescrm.backend.models.email.Email;
import com.salescrm.backend.models.email.EmailTracking;
import com.salescrm.backend.repositories.email.EmailRepository;
import com.salescrm.backend.repositories.email.EmailTrackingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailTrackingServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-10T09:00:00Z");
    private static final UUID TRACKING_ID = UUID.fromString("0b6f1c9e-3a4d-4e5f-8a7b-6c5d4e3f2a1b");

    @Mock
    private EmailRepository emailRepository;

    @Mock
    private EmailTrackingRepository trackingRepository;

    @Mock
    private EmailSequenceService sequenceService;

    private EmailTrackingService trackingService;

    private Lead lead;
    private Email email;

    @BeforeEach
    void setUp() {
        trackingService = new EmailTrackingService(emailRepository, trackingRepository, sequenceService,
                Clock.fixed(NOW, ZoneOffset.UTC));
        lead = Lead.builder().id(20L).firstName("Neha").build();
        email = Email.builder()
                .id(100L)
                .lead(lead)
                .trackingId(TRACKING_ID)
                .status(EmailStatus.SENT)
                .build();
    }

    @Test
    void record_ShouldMoveSentEmailToOpened() {
        // Given
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        boolean recorded = trackingService.record(TRACKING_ID.toString(), "opened", "10.0.0.1", "Mozilla/5.0", null);

        // Then
        assertThat(recorded).isTrue();
        assertThat(email.getStatus()).isEqualTo(EmailStatus.OPENED);
        assertThat(email.getOpenCount()).isEqualTo(1);
        assertThat(email.getOpenedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));

        ArgumentCaptor<EmailTracking> event = ArgumentCaptor.forClass(EmailTracking.class);
        verify(trackingRepository).save(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(EmailTracking.EventType.OPENED);
        assertThat(event.getValue().getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(event.getValue().getClickedUrl()).isNull();
    }

    @Test
    void record_ShouldNotRegressClickedEmailOnLaterOpen() {
        // Given
        email.setStatus(EmailStatus.CLICKED);
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        trackingService.record(TRACKING_ID.toString(), "opened", null, null, null);

        // Then
        assertThat(email.getStatus()).isEqualTo(EmailStatus.CLICKED);
        assertThat(email.getOpenCount()).isEqualTo(1);
    }

    @Test
    void record_ShouldKeepClickedUrlAndSetOpenedAt() {
        // Given
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        trackingService.record(TRACKING_ID.toString(), "CLICKED", null, null, "https://example.com/pricing");

        // Then
        assertThat(email.getStatus()).isEqualTo(EmailStatus.CLICKED);
        assertThat(email.getClickCount()).isEqualTo(1);
        assertThat(email.getOpenedAt()).isNotNull();

        ArgumentCaptor<EmailTracking> event = ArgumentCaptor.forClass(EmailTracking.class);
        verify(trackingRepository).save(event.capture());
        assertThat(event.getValue().getClickedUrl()).isEqualTo("https://example.com/pricing");
    }

    @Test
    void record_ShouldFlagSequenceEnrollmentsOnReply() {
        // Given
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        trackingService.record(TRACKING_ID.toString(), "replied", null, null, null);

        // Then
        assertThat(email.getStatus()).isEqualTo(EmailStatus.REPLIED);
        verify(sequenceService).markReplied(lead);
    }

    @Test
    void record_ShouldNotBounceEmailThatWasAlreadyOpened() {
        // Given
        email.setStatus(EmailStatus.OPENED);
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        trackingService.record(TRACKING_ID.toString(), "bounced", null, null, null);

        // Then
        assertThat(email.getStatus()).isEqualTo(EmailStatus.OPENED);
    }

    @Test
    void record_ShouldIgnoreUnknownTrackingId() {
        // Given
        when(emailRepository.findByTrackingId(any(UUID.class))).thenReturn(Optional.empty());

        // When
        boolean recorded = trackingService.record(UUID.randomUUID().toString(), "opened", null, null, null);

        // Then
        assertThat(recorded).isFalse();
        verifyNoInteractions(trackingRepository);
        verify(emailRepository, never()).save(any());
    }

    @Test
    void record_ShouldIgnoreMalformedIdAndUnknownEvent() {
        assertThat(trackingService.record("not-a-uuid", "opened", null, null, null)).isFalse();
        assertThat(trackingService.record(TRACKING_ID.toString(), "forwarded", null, null, null)).isFalse();
        assertThat(trackingService.record(TRACKING_ID.toString(), "sent", null, null, null)).isFalse();
        verifyNoInteractions(emailRepository, trackingRepository);
    }

    @Test
    void record_ShouldTruncateLongIpAddress() {
        // Given
        when(emailRepository.findByTrackingId(TRACKING_ID)).thenReturn(Optional.of(email));

        // When
        trackingService.record(TRACKING_ID.toString(), "delivered", "1".repeat(60), null, null);

        // Then
        ArgumentCaptor<EmailTracking> event = ArgumentCaptor.forClass(EmailTracking.class);
        verify(trackingRepository).save(event.capture());
        assertThat(event.getValue().getIpAddress()).hasSize(45);
        assertThat(email.getStatus()).isEqualTo(EmailStatus.DELIVERED);
        assertThat(email.getDeliveredAt()).isNotNull();
    }
}
