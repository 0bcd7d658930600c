package com.tennis.edge.staking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts a confidence, decimal odds and bankroll into a stake.
 *
 * Every method floors the stake at {@code min-stake} and caps it at
 * {@code max-stake-pct} of the bankroll. When the cap itself is below the floor the
 * stake is zero, so the result is always within [0, max-stake-pct × bankroll].
 */
@Component
@Slf4j
public class StakeSizer {

    private static final int MONEY_SCALE = 2;

    private final double kellyFraction;
    private final double maxStakePct;
    private final BigDecimal minStake;
    private final double fixedPct;
    private final double confidenceMinPct;
    private final double confidenceMaxPct;
    private final StakingMethod defaultMethod;

    public StakeSizer(
            @Value("${staking.kelly-fraction:0.25}") double kellyFraction,
            @Value("${staking.max-stake-pct:0.05}") double maxStakePct,
            @Value("${staking.min-stake:10.00}") BigDecimal minStake,
            @Value("${staking.fixed-pct:0.02}") double fixedPct,
            @Value("${staking.confidence-min-pct:0.01}") double confidenceMinPct,
            @Value("${staking.confidence-max-pct:0.03}") double confidenceMaxPct,
            @Value("${staking.default-method:KELLY}") StakingMethod defaultMethod) {
        this.kellyFraction = kellyFraction;
        this.maxStakePct = maxStakePct;
        this.minStake = minStake;
        this.fixedPct = fixedPct;
        this.confidenceMinPct = confidenceMinPct;
        this.confidenceMaxPct = confidenceMaxPct;
        this.defaultMethod = defaultMethod;
    }

    public BigDecimal size(double confidence, BigDecimal odds, BigDecimal bankroll) {
        return size(confidence, odds, bankroll, defaultMethod);
    }

    public BigDecimal size(double confidence, BigDecimal odds, BigDecimal bankroll, StakingMethod method) {
        if (bankroll == null || bankroll.signum() <= 0 || odds == null || Double.isNaN(confidence)) {
            return BigDecimal.ZERO;
        }
        StakingMethod effective = method != null ? method : defaultMethod;

        double fraction = switch (effective) {
            case KELLY -> kellyFraction(confidence, odds.doubleValue());
            case FIXED -> fixedPct;
            case CONFIDENCE -> confidenceFraction(confidence);
        };

        if (fraction <= 0 || odds.compareTo(BigDecimal.ONE) <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal cap = bankroll.multiply(BigDecimal.valueOf(maxStakePct))
                .setScale(MONEY_SCALE, RoundingMode.DOWN);
        if (cap.compareTo(minStake) < 0) {
            log.debug("Stake cap {} is below minimum stake {}, skipping", cap, minStake);
            return BigDecimal.ZERO;
        }

        BigDecimal raw = bankroll.multiply(BigDecimal.valueOf(fraction))
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal stake = raw.max(minStake).min(cap);

        log.debug("Sized {} stake: confidence={}, odds={}, bankroll={} -> {}",
                effective, confidence, odds, bankroll, stake);
        return stake.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Fractional Kelly: f* = (p·b − q) / b scaled by the Kelly fraction, never negative.
     */
    double kellyFraction(double confidence, double odds) {
        double b = odds - 1.0;
        if (b <= 0 || confidence <= 0 || confidence > 1) {
            return 0.0;
        }
        double p = confidence;
        double q = 1.0 - p;
        double fullKelly = (p * b - q) / b;
        return Math.max(0.0, fullKelly * kellyFraction);
    }

    double confidenceFraction(double confidence) {
        double clamped = Math.max(0.5, Math.min(1.0, confidence));
        return confidenceMinPct + (clamped - 0.5) / 0.5 * (confidenceMaxPct - confidenceMinPct);
    }

    public StakingMethod getDefaultMethod() {
        return defaultMethod;
    }

    public BigDecimal getMinStake() {
        return minStake;
    }

    public double getMaxStakePct() {
        return maxStakePct;
    }
}
