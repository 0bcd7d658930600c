package com.tennis.edge.scheduler;

import com.tennis.edge.signal.SignalCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps expired opening-odds entries from the signal cache.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalCacheScheduler {

    private final SignalCache signalCache;

    @Scheduled(fixedDelayString = "${signal.cache.sweep-interval:600000}",
            initialDelayString = "${signal.cache.sweep-interval:600000}")
    public void sweep() {
        try {
            int removed = signalCache.evictExpired();
            log.debug("Signal cache sweep: {} removed, {} cached", removed, signalCache.size());
        } catch (Exception e) {
            log.error("Error during signal cache sweep: {}", e.getMessage(), e);
        }
    }
}
