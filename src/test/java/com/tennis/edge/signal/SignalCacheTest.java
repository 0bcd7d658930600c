package com.tennis.edge.signal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SignalCache Tests")
class SignalCacheTest {

    private MutableClock clock;
    private SignalCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new SignalCache(Duration.ofMinutes(60), clock);
    }

    @Test
    @DisplayName("First signal seen is kept as the opening signal")
    void keepsFirstSignal() {
        MatchSignal opening = signal("M1", "1.40", "3.00");
        MatchSignal later = signal("M1", "1.90", "1.95");

        cache.remember(opening);
        MatchSignal stored = cache.remember(later);

        assertThat(stored).isSameAs(opening);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing initial odds are filled from the opening line")
    void fillsOpeningOdds() {
        cache.remember(signal("M2", "1.40", "3.00"));

        MatchSignal enriched = cache.withOpeningOdds(signal("M2", "1.90", "1.95"));

        assertThat(enriched.getInitialOddsA()).isEqualByComparingTo("1.40");
        assertThat(enriched.getInitialOddsB()).isEqualByComparingTo("3.00");
        assertThat(enriched.getCurrentOddsA()).isEqualByComparingTo("1.90");
    }

    @Test
    @DisplayName("Signals that already carry initial odds are returned unchanged")
    void keepsExistingInitialOdds() {
        cache.remember(signal("M3", "1.40", "3.00"));
        MatchSignal withInitial = signal("M3", "1.90", "1.95").toBuilder()
                .initialOddsA(new BigDecimal("1.35"))
                .initialOddsB(new BigDecimal("3.20"))
                .build();

        assertThat(cache.withOpeningOdds(withInitial)).isSameAs(withInitial);
    }

    @Test
    @DisplayName("Entries expire after the TTL")
    void entriesExpire() {
        cache.remember(signal("M4", "1.40", "3.00"));

        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.getOpening("M4")).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.getOpening("M4")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("Sweep removes only expired entries")
    void sweepRemovesExpired() {
        cache.remember(signal("OLD", "1.40", "3.00"));
        clock.advance(Duration.ofMinutes(30));
        cache.remember(signal("NEW", "1.60", "2.40"));
        clock.advance(Duration.ofMinutes(40));

        int removed = cache.evictExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(cache.getOpening("OLD")).isEmpty();
        assertThat(cache.getOpening("NEW")).isPresent();
    }

    private static MatchSignal signal(String matchId, String oddsA, String oddsB) {
        return MatchSignal.builder()
                .matchId(matchId)
                .currentOddsA(new BigDecimal(oddsA))
                .currentOddsB(new BigDecimal(oddsB))
                .build();
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
