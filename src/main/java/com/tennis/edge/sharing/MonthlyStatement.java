package com.tennis.edge.sharing;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;

/**
 * Profit-split statement for one calendar month.
 */
@Data
@Builder
public class MonthlyStatement {

    private int year;
    private int month;

    private BigDecimal startingBalance;
    private BigDecimal endingBalance;

    // Period flows, all non-negative except winnings after reversals
    private BigDecimal deposits;
    private BigDecimal withdrawals;
    private BigDecimal stakesPlaced;
    private BigDecimal winnings;
    private BigDecimal expenses;
    private BigDecimal totalLosses;       // stakes - winnings

    private BigDecimal grossProfit;       // winnings - stakes
    private BigDecimal netProfit;         // gross - expenses
    private BigDecimal partnerShare;
    private BigDecimal myShare;
    private BigDecimal estimatedTax;
    private BigDecimal afterTaxProfit;

    private int totalBets;
    private int winningBets;
    private BigDecimal winRate;           // percent
    private BigDecimal roi;               // percent

    private LocalDateTime generatedAt;

    public YearMonth getPeriod() {
        return YearMonth.of(year, month);
    }

    public boolean isSplit() {
        return partnerShare.signum() != 0 || myShare.signum() != 0;
    }
}
