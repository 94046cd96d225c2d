package com.salescrm.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for outbound email and tracking, bound from {@code crm.email.*}.
 */
@ConfigurationProperties(prefix = "crm.email")
public record CrmProperties(
        String trackingBaseUrl,
        Integer defaultBatchSize,
        Integer maxRetries,
        Integer connectionTimeoutMs,
        Integer readTimeoutMs,
        String testSubject
) {
    public CrmProperties {
        if (trackingBaseUrl == null || trackingBaseUrl.isBlank()) {
            trackingBaseUrl = "http://localhost:8080";
        }
        if (defaultBatchSize == null || defaultBatchSize <= 0) {
            defaultBatchSize = 50;
        }
        if (maxRetries == null || maxRetries < 0) {
            maxRetries = 3;
        }
        if (connectionTimeoutMs == null || connectionTimeoutMs <= 0) {
            connectionTimeoutMs = 10000;
        }
        if (readTimeoutMs == null || readTimeoutMs <= 0) {
            readTimeoutMs = 30000;
        }
        if (testSubject == null || testSubject.isBlank()) {
            testSubject = "Test Email from Sales CRM";
        }
    }

    public static CrmProperties defaults() {
        return new CrmProperties(null, null, null, null, null, null);
    }
}
