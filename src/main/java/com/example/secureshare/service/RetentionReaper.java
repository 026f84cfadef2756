package com.example.secureshare.service;

import com.example.secureshare.model.ReapResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically removes expired shared links and the files only they referenced.
 * The timer only fires when scheduling is enabled (see SchedulingConfig);
 * {@link #sweep()} can be called directly at any time.
 */
@Service
public class RetentionReaper {

    private static final Logger log = LoggerFactory.getLogger(RetentionReaper.class);

    private final PersistenceGateway gateway;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RetentionReaper(PersistenceGateway gateway) {
        this.gateway = gateway;
    }

    @Scheduled(initialDelayString = "${secure-share.reaper.initial-delay:PT1M}",
               fixedDelayString = "${secure-share.reaper.interval:PT1H}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // keep the timer alive, the next run retries
            log.error("Retention sweep failed", e);
        }
    }

    /**
     * Runs one sweep. If another sweep is already in progress this one is skipped
     * and {@link ReapResult#NOTHING} is returned.
     */
    public ReapResult sweep() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Retention sweep already running, skipping");
            return ReapResult.NOTHING;
        }
        try {
            ReapResult result = gateway.deleteExpired();
            if (result.isEmpty()) {
                log.debug("Retention sweep found nothing to delete");
            } else {
                log.info("Retention sweep deleted {} shared links and {} files",
                        result.linksDeleted(), result.filesDeleted());
            }
            return result;
        } finally {
            running.set(false);
        }
    }
}
