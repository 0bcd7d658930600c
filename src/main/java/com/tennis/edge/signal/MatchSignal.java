package com.tennis.edge.signal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of a match as delivered by the collection layer each polling cycle.
 * Any field may be missing; detectors treat a missing field as "no opportunity".
 */
@Value
@Builder(toBuilder = true)
public class MatchSignal {

    String matchId;
    String sport;
    String surface;
    String tournament;

    String playerA;
    String playerB;

    // Decimal odds
    BigDecimal initialOddsA;
    BigDecimal initialOddsB;
    BigDecimal currentOddsA;
    BigDecimal currentOddsB;

    // Fatigue risk 0-100
    Integer fatigueRiskA;
    Integer fatigueRiskB;

    // Historical rate of winning after losing set 1
    Double threeSetWinRateA;
    Double threeSetWinRateB;

    H2HRecord h2hOverall;

    @Singular("h2hOnSurface")
    Map<String, H2HRecord> h2hBySurface;

    // Live score, e.g. "4-6, 2-1"
    String currentScore;

    LocalDateTime capturedAt;

    public BigDecimal initialOdds(Side side) {
        return side == Side.A ? initialOddsA : initialOddsB;
    }

    public BigDecimal currentOdds(Side side) {
        return side == Side.A ? currentOddsA : currentOddsB;
    }

    public Integer fatigueRisk(Side side) {
        return side == Side.A ? fatigueRiskA : fatigueRiskB;
    }

    public Double threeSetWinRate(Side side) {
        return side == Side.A ? threeSetWinRateA : threeSetWinRateB;
    }

    public String playerName(Side side) {
        String name = side == Side.A ? playerA : playerB;
        return name != null && !name.isBlank() ? name : "Player " + side.name();
    }

    public boolean hasInitialOdds() {
        return initialOddsA != null && initialOddsB != null;
    }

    /**
     * Head-to-head record for the match surface, falling back to the overall record.
     */
    public Optional<H2HRecord> h2hForSurface() {
        return surfaceRecord().or(() -> Optional.ofNullable(h2hOverall));
    }

    /**
     * True when a non-null surface-specific record exists for the current surface.
     */
    public boolean hasSurfaceH2H() {
        return surfaceRecord().isPresent();
    }

    private Optional<H2HRecord> surfaceRecord() {
        if (surface == null || h2hBySurface == null) {
            return Optional.empty();
        }
        String key = surface.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, H2HRecord> entry : h2hBySurface.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(key)
                    && entry.getValue() != null) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Structural problems with this signal. Empty when the signal is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (matchId == null || matchId.isBlank()) {
            errors.add("matchId is missing");
        }
        checkOdds(errors, "initialOddsA", initialOddsA);
        checkOdds(errors, "initialOddsB", initialOddsB);
        checkOdds(errors, "currentOddsA", currentOddsA);
        checkOdds(errors, "currentOddsB", currentOddsB);
        checkRisk(errors, "fatigueRiskA", fatigueRiskA);
        checkRisk(errors, "fatigueRiskB", fatigueRiskB);
        checkRate(errors, "threeSetWinRateA", threeSetWinRateA);
        checkRate(errors, "threeSetWinRateB", threeSetWinRateB);
        return errors;
    }

    public static boolean isUsableOdds(BigDecimal odds) {
        return odds != null && odds.compareTo(BigDecimal.ONE) > 0;
    }

    private static void checkOdds(List<String> errors, String field, BigDecimal odds) {
        if (odds != null && !isUsableOdds(odds)) {
            errors.add(field + " must be greater than 1.0 but was " + odds);
        }
    }

    private static void checkRisk(List<String> errors, String field, Integer risk) {
        if (risk != null && (risk < 0 || risk > 100)) {
            errors.add(field + " must be within 0-100 but was " + risk);
        }
    }

    private static void checkRate(List<String> errors, String field, Double rate) {
        if (rate != null && (rate.isNaN() || rate < 0.0 || rate > 1.0)) {
            errors.add(field + " must be within 0-1 but was " + rate);
        }
    }
}
