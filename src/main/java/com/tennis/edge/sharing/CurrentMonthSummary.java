package com.tennis.edge.sharing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Running figures for the month in progress. Nothing is stored.
 */
@Value
@Builder
public class CurrentMonthSummary {

    YearMonth period;
    BigDecimal currentBalance;
    BigDecimal stakesPlaced;
    BigDecimal winnings;
    BigDecimal expenses;
    BigDecimal grossProfit;
    BigDecimal netProfit;
    int totalBets;
    int winningBets;
    BigDecimal winRate;
    BigDecimal roi;
    BigDecimal projectedPartnerShare;
    BigDecimal projectedMyShare;
}
