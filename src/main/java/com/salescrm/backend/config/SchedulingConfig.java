package com.salescrm.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background email processing can be switched off, which the tests do.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "crm.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
