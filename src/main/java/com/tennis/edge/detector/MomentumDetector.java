package com.tennis.edge.detector;

import com.tennis.edge.signal.MatchSignal;
import com.tennis.edge.signal.SetScore;
import com.tennis.edge.signal.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Detects a pre-match favourite that lost set 1, drifted out to value odds and has a
 * strong record of winning after dropping the first set.
 *
 * EV = max(0, odds × recoveryRate − 1)
 * confidence = recoveryRate + min(0.20, 0.2 × relative odds drift)
 */
@Component
@Slf4j
public class MomentumDetector implements OpportunityDetector {

    private static final double MAX_DRIFT_BONUS = 0.20;
    private static final double DRIFT_BONUS_FACTOR = 0.2;

    private final BigDecimal favoriteThreshold;
    private final BigDecimal valueThreshold;
    private final double minThreeSetWinRate;
    private final double minEvPct;

    public MomentumDetector(
            @Value("${detector.momentum.favorite-threshold:1.50}") BigDecimal favoriteThreshold,
            @Value("${detector.momentum.value-threshold:1.80}") BigDecimal valueThreshold,
            @Value("${detector.momentum.min-three-set-win-rate:0.70}") double minThreeSetWinRate,
            @Value("${detector.momentum.min-ev-pct:10}") double minEvPct) {
        this.favoriteThreshold = favoriteThreshold;
        this.valueThreshold = valueThreshold;
        this.minThreeSetWinRate = minThreeSetWinRate;
        this.minEvPct = minEvPct;
    }

    @Override
    public Optional<ROIOpportunity> detect(MatchSignal signal) {
        if (signal == null || signal.getMatchId() == null) {
            return Optional.empty();
        }

        // Set 1 finished and set 2 under way
        List<SetScore> sets = SetScore.parseAll(signal.getCurrentScore());
        if (sets.size() < 2) {
            return Optional.empty();
        }
        Optional<Side> set1Winner = sets.get(0).winner();
        if (set1Winner.isEmpty()) {
            return Optional.empty();
        }

        Optional<Side> favorite = findFavorite(signal);
        if (favorite.isEmpty()) {
            return Optional.empty();
        }
        Side fav = favorite.get();

        if (set1Winner.get() != fav.opponent()) {
            return Optional.empty();
        }

        BigDecimal currentOdds = signal.currentOdds(fav);
        if (!MatchSignal.isUsableOdds(currentOdds) || currentOdds.compareTo(valueThreshold) < 0) {
            return Optional.empty();
        }

        Double recoveryRate = signal.threeSetWinRate(fav);
        if (recoveryRate == null || recoveryRate.isNaN() || recoveryRate < minThreeSetWinRate) {
            return Optional.empty();
        }

        double odds = currentOdds.doubleValue();
        double evPct = Math.max(0.0, odds * recoveryRate - 1.0) * 100.0;
        if (evPct < minEvPct) {
            log.debug("Momentum rejected for {}: EV {}% below {}%", signal.getMatchId(), evPct, minEvPct);
            return Optional.empty();
        }

        double initialOdds = signal.initialOdds(fav).doubleValue();
        double drift = (odds - initialOdds) / initialOdds;
        double driftBonus = Math.max(0.0, Math.min(drift * DRIFT_BONUS_FACTOR, MAX_DRIFT_BONUS));
        double confidence = Math.min(recoveryRate + driftBonus, 1.0);

        String player = signal.playerName(fav);
        String reasoning = String.format(Locale.ROOT,
                "%s was favourite (odds %.2f) but lost set 1. Current odds %.2f represent value "
                        + "given a %.1f%% record of winning after losing the first set.",
                player, initialOdds, odds, recoveryRate * 100);

        log.debug("Momentum opportunity for {}: {} EV={}%", signal.getMatchId(), player, evPct);

        return Optional.of(ROIOpportunity.builder()
                .matchId(signal.getMatchId())
                .sport(signal.getSport())
                .opportunityType(OpportunityType.MOMENTUM_SHIFT)
                .strategy(OpportunityType.MOMENTUM_SHIFT.getStrategyName())
                .side(fav)
                .selection(player)
                .odds(currentOdds)
                .expectedValuePct(BigDecimal.valueOf(evPct).setScale(2, RoundingMode.HALF_UP))
                .confidenceScore(confidence)
                .reasoning(reasoning)
                .detectedAt(signal.getCapturedAt())
                .build());
    }

    /**
     * The side priced below the favourite threshold before the match. When both are,
     * the shorter price wins.
     */
    private Optional<Side> findFavorite(MatchSignal signal) {
        BigDecimal oddsA = signal.getInitialOddsA();
        BigDecimal oddsB = signal.getInitialOddsB();
        if (!MatchSignal.isUsableOdds(oddsA) || !MatchSignal.isUsableOdds(oddsB)) {
            return Optional.empty();
        }

        boolean favoriteA = oddsA.compareTo(favoriteThreshold) < 0;
        boolean favoriteB = oddsB.compareTo(favoriteThreshold) < 0;
        if (favoriteA && favoriteB) {
            return Optional.of(oddsA.compareTo(oddsB) <= 0 ? Side.A : Side.B);
        }
        if (favoriteA) {
            return Optional.of(Side.A);
        }
        if (favoriteB) {
            return Optional.of(Side.B);
        }
        return Optional.empty();
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.MOMENTUM_SHIFT;
    }
}
