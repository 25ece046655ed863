package com.rabs.backend.modules.loom.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly roll: materialises the day that entered the window since the last run.
 */
@Component
@ConditionalOnProperty(prefix = "rabs.loom.roll", name = "enabled", havingValue = "true")
public class LoomWindowRollScheduler {

    private static final Logger log = LoggerFactory.getLogger(LoomWindowRollScheduler.class);

    private final LoomWindowService loomWindowService;

    public LoomWindowRollScheduler(LoomWindowService loomWindowService) {
        this.loomWindowService = loomWindowService;
    }

    @Scheduled(cron = "${rabs.loom.roll.cron:0 5 0 * * *}", zone = "${rabs.loom.time-zone:Australia/Sydney}")
    public void rollWindow() {
        try {
            int created = loomWindowService.rollWindow();
            if (created > 0) {
                log.info("Loom window roll created {} instance(s)", created);
            }
        } catch (RuntimeException ex) {
            log.warn("Loom window roll failed: {}", ex.getMessage(), ex);
        }
    }
}
