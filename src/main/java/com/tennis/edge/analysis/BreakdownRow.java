package com.tennis.edge.analysis;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a grouped performance table (per sport or per strategy).
 */
@Value
@Builder
public class BreakdownRow {

    String key;
    int bets;
    int wins;
    BigDecimal winRate;
    BigDecimal staked;
    BigDecimal profit;
    BigDecimal roi;
}
