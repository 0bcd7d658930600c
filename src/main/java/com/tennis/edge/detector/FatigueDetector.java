package com.tennis.edge.detector;

import com.tennis.edge.signal.MatchSignal;
import com.tennis.edge.signal.ProbabilityEstimator;
import com.tennis.edge.signal.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Backs the opponent of a player whose fatigue risk is at or above the threshold.
 *
 * The fatigue edge (fatigue/100 × 0.15, capped at 0.15) is added to the base win
 * probability from the {@link ProbabilityEstimator}:
 * EV% = (odds × (base + edge) − 1) × 100, confidence = min(fatigue/100, 0.85).
 */
@Component
@Slf4j
public class FatigueDetector implements OpportunityDetector {

    private static final double EDGE_PER_RISK_UNIT = 0.15;

    private final ProbabilityEstimator probabilityEstimator;
    private final int riskThreshold;
    private final double maxEdge;
    private final double maxConfidence;
    private final double minEvPct;

    public FatigueDetector(
            ProbabilityEstimator probabilityEstimator,
            @Value("${detector.fatigue.risk-threshold:70}") int riskThreshold,
            @Value("${detector.fatigue.max-edge:0.15}") double maxEdge,
            @Value("${detector.fatigue.max-confidence:0.85}") double maxConfidence,
            @Value("${detector.fatigue.min-ev-pct:5}") double minEvPct) {
        this.probabilityEstimator = probabilityEstimator;
        this.riskThreshold = riskThreshold;
        this.maxEdge = maxEdge;
        this.maxConfidence = maxConfidence;
        this.minEvPct = minEvPct;
    }

    @Override
    public Optional<ROIOpportunity> detect(MatchSignal signal) {
        if (signal == null || signal.getMatchId() == null) {
            return Optional.empty();
        }

        // A is checked first
        for (Side fatigued : Side.values()) {
            Integer risk = signal.fatigueRisk(fatigued);
            if (risk != null && risk >= riskThreshold && risk <= 100) {
                return createOpportunity(signal, fatigued.opponent(), fatigued, risk);
            }
        }
        return Optional.empty();
    }

    private Optional<ROIOpportunity> createOpportunity(MatchSignal signal, Side favored, Side fatigued, int risk) {
        BigDecimal currentOdds = signal.currentOdds(favored);
        if (!MatchSignal.isUsableOdds(currentOdds)) {
            return Optional.empty();
        }

        OptionalDouble baseProbability = probabilityEstimator.estimate(signal, favored);
        if (baseProbability.isEmpty()) {
            return Optional.empty();
        }

        double fatigueEdge = Math.min(risk / 100.0 * EDGE_PER_RISK_UNIT, maxEdge);
        double adjustedProbability = baseProbability.getAsDouble() + fatigueEdge;
        double odds = currentOdds.doubleValue();
        double evPct = (odds * adjustedProbability - 1.0) * 100.0;

        if (evPct < minEvPct) {
            log.debug("Fatigue rejected for {}: EV {}% below {}%", signal.getMatchId(), evPct, minEvPct);
            return Optional.empty();
        }

        double confidence = Math.min(risk / 100.0, maxConfidence);

        String player = signal.playerName(favored);
        String reasoning = String.format(Locale.ROOT,
                "%s has high fatigue risk (%d/100) indicating potential advantage for %s.",
                signal.playerName(fatigued), risk, player);

        log.debug("Fatigue opportunity for {}: {} EV={}%", signal.getMatchId(), player, evPct);

        return Optional.of(ROIOpportunity.builder()
                .matchId(signal.getMatchId())
                .sport(signal.getSport())
                .opportunityType(OpportunityType.FATIGUE_EXPLOIT)
                .strategy(OpportunityType.FATIGUE_EXPLOIT.getStrategyName())
                .side(favored)
                .selection(player)
                .odds(currentOdds)
                .expectedValuePct(BigDecimal.valueOf(evPct).setScale(2, RoundingMode.HALF_UP))
                .confidenceScore(confidence)
                .reasoning(reasoning)
                .detectedAt(signal.getCapturedAt())
                .build());
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.FATIGUE_EXPLOIT;
    }
}
