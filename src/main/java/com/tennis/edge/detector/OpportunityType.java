package com.tennis.edge.detector;

/**
 * Kind of edge a detector found. The code is the stable identifier used in
 * persisted bets and reports.
 */
public enum OpportunityType {

    /**
     * Pre-match favourite dropped the first set and drifted to value odds.
     */
    MOMENTUM_SHIFT("momentum_shift", "First Set Recovery"),

    /**
     * One side carries a high fatigue risk, favouring the opponent.
     */
    FATIGUE_EXPLOIT("fatigue_exploit", "Fatigue Exploit"),

    /**
     * Lopsided head-to-head history.
     */
    H2H_IMBALANCE("h2h_imbalance", "H2H Exploit");

    private final String code;
    private final String strategyName;

    OpportunityType(String code, String strategyName) {
        this.code = code;
        this.strategyName = strategyName;
    }

    public String getCode() {
        return code;
    }

    /**
     * Default strategy label attached to opportunities of this type.
     */
    public String getStrategyName() {
        return strategyName;
    }
}
