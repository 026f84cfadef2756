package com.example.secureshare.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the retention reaper's timer. Disabled with
 * {@code secure-share.reaper.enabled=false}, e.g. in tests that drive sweeps by hand.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "secure-share.reaper.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    public SchedulingConfig(SecureShareProperties properties) {
        log.info("Retention reaper scheduled every {}", properties.getReaper().getInterval());
    }
}
