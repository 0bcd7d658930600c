package com.tennis.edge.staking;

public enum StakingMethod {
    KELLY,        // Fractional Kelly criterion
    FIXED,        // Constant share of bankroll
    CONFIDENCE    // Share scaled linearly with confidence
}
