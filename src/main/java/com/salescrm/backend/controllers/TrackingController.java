package com.salescrm.backend.controllers;

import com.salescrm.backend.services.email.EmailTrackingService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;

/**
 * Public engagement callbacks. Open events are answered with a transparent
 * pixel so the URL can be embedded as an image.
 */
@RestController
@RequestMapping("/track")
@RequiredArgsConstructor
public class TrackingController {

    private static final byte[] PIXEL = Base64.getDecoder()
            .decode("R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAIBRAA7");

    private final EmailTrackingService trackingService;

    @GetMapping("/{trackingId}/{event}")
    public ResponseEntity<byte[]> track(
            @PathVariable String trackingId,
            @PathVariable String event,
            @RequestParam(required = false) String url,
            HttpServletRequest request) {
        boolean recorded = trackingService.record(trackingId, event, clientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT), url);

        if (recorded && "opened".equalsIgnoreCase(event)) {
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_GIF)
                    .cacheControl(CacheControl.noStore().mustRevalidate())
                    .header(HttpHeaders.PRAGMA, "no-cache")
                    .header(HttpHeaders.EXPIRES, "0")
                    .body(PIXEL);
        }
        return ResponseEntity.noContent().build();
    }

    private String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
