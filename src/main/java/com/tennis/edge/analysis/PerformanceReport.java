package com.tennis.edge.analysis;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Performance figures over the ledger's bets.
 */
@Data
@Builder
public class PerformanceReport {

    // Counts
    private int totalBets;
    private int settledBets;          // won + lost
    private int wonBets;
    private int lostBets;
    private int voidBets;
    private int pendingBets;

    // Rates, percent
    private BigDecimal winRate;
    private BigDecimal roi;

    // Money
    private BigDecimal totalStaked;
    private BigDecimal totalWinnings;     // stake × odds of won bets
    private BigDecimal netProfit;
    private BigDecimal grossWins;         // profit of winning bets
    private BigDecimal grossLosses;       // stakes of losing bets
    private BigDecimal profitFactor;

    // Risk
    private BigDecimal peakBalance;
    private BigDecimal maxDrawdown;
    private BigDecimal maxDrawdownPct;
    private BigDecimal sharpeRatio;

    // Averages over settled bets
    private BigDecimal averageOdds;
    private double averageConfidence;
    private BigDecimal averageExpectedValuePct;

    private List<BreakdownRow> bySport;
    private List<BreakdownRow> byStrategy;

    // Start of the analysed window, null for all history
    private LocalDateTime since;
    private LocalDateTime calculatedAt;

    public boolean hasSettledBets() {
        return settledBets > 0;
    }
}
