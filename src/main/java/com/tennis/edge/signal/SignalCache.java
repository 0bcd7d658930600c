package com.tennis.edge.signal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opening-odds memory: keeps the first signal seen for each match so that later
 * polls without pre-match odds can still be compared against the opening line.
 *
 * <p>Entries expire {@code signal.cache.ttl-minutes} after they were stored. Expired
 * entries are evicted on read and by {@link #evictExpired()}, which the cache sweep
 * scheduler calls periodically. Thread-safe via {@link ConcurrentHashMap}.
 */
@Component
@Slf4j
public class SignalCache {

    private final ConcurrentHashMap<String, CachedSignal> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public SignalCache(@Value("${signal.cache.ttl-minutes:360}") long ttlMinutes) {
        this(Duration.ofMinutes(ttlMinutes), Clock.systemUTC());
    }

    public SignalCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Store the signal if no live entry exists for its match. Returns the opening signal.
     */
    public MatchSignal remember(MatchSignal signal) {
        if (signal == null || signal.getMatchId() == null) {
            return signal;
        }
        Instant now = clock.instant();
        CachedSignal entry = store.compute(signal.getMatchId(), (id, existing) ->
                existing == null || isExpired(existing, now) ? new CachedSignal(signal, now) : existing);
        return entry.opening();
    }

    /**
     * Opening signal for a match, or empty if absent or expired.
     */
    public Optional<MatchSignal> getOpening(String matchId) {
        if (matchId == null) {
            return Optional.empty();
        }
        CachedSignal entry = store.get(matchId);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            store.remove(matchId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.opening());
    }

    /**
     * Remember the signal and, when it carries no pre-match odds, fill them in from the
     * opening signal. The opening line is its initial odds if present, else its current odds.
     */
    public MatchSignal withOpeningOdds(MatchSignal signal) {
        MatchSignal opening = remember(signal);
        if (signal == null || signal.hasInitialOdds() || opening == null || opening == signal) {
            return signal;
        }

        BigDecimal openingA = opening.getInitialOddsA() != null ? opening.getInitialOddsA() : opening.getCurrentOddsA();
        BigDecimal openingB = opening.getInitialOddsB() != null ? opening.getInitialOddsB() : opening.getCurrentOddsB();
        if (openingA == null || openingB == null) {
            return signal;
        }

        log.debug("Filled opening odds for match {}: {} / {}", signal.getMatchId(), openingA, openingB);
        return signal.toBuilder()
                .initialOddsA(signal.getInitialOddsA() != null ? signal.getInitialOddsA() : openingA)
                .initialOddsB(signal.getInitialOddsB() != null ? signal.getInitialOddsB() : openingB)
                .build();
    }

    public void evict(String matchId) {
        if (matchId != null) {
            store.remove(matchId);
        }
    }

    /**
     * Remove every expired entry. Returns the number removed.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = store.size();
        store.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        int removed = before - store.size();
        if (removed > 0) {
            log.info("Signal cache sweep removed {} expired entries, {} remaining", removed, store.size());
        }
        return removed;
    }

    public int size() {
        return store.size();
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(CachedSignal entry, Instant now) {
        return !now.isBefore(entry.storedAt().plus(ttl));
    }
}
