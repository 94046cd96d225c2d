package com.salescrm.backend.controllers;

import com.salescrm.backend.services.email.EmailTrackingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class TrackingControllerTest {

    private static final String TRACKING_ID = "3f2b8c1e-8d4a-4c7e-9a51-0f6f2d9b7c10";

    @Mock
    private EmailTrackingService trackingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TrackingController(trackingService)).build();
    }

    @Test
    void opened_ShouldReturnUncachedPixel() throws Exception {
        // Given
        when(trackingService.record(eq(TRACKING_ID), eq("opened"), anyString(), eq("MailClient/1.0"), isNull()))
                .thenReturn(true);

        // When & Then
        mockMvc.perform(get("/track/{id}/opened", TRACKING_ID).header("User-Agent", "MailClient/1.0"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_GIF))
                .andExpect(header().string("Pragma", "no-cache"))
                .andExpect(header().string("Expires", "0"));
    }

    @Test
    void clicked_ShouldForwardUrlAndFirstForwardedAddress() throws Exception {
        // Given
        when(trackingService.record(TRACKING_ID, "clicked", "203.0.113.7", null, "https://example.com/pricing"))
                .thenReturn(true);

        // When & Then
        mockMvc.perform(get("/track/{id}/clicked", TRACKING_ID)
                        .param("url", "https://example.com/pricing")
                        .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1"))
                .andExpect(status().isNoContent());
        verify(trackingService).record(TRACKING_ID, "clicked", "203.0.113.7", null, "https://example.com/pricing");
    }

    @Test
    void unknownTrackingId_ShouldAnswerNoContent() throws Exception {
        // Given
        when(trackingService.record(eq("missing"), eq("opened"), anyString(), isNull(), isNull()))
                .thenReturn(false);

        // When & Then
        mockMvc.perform(get("/track/missing/opened"))
                .andExpect(status().isNoContent());
    }
}
