package com.tennis.edge.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "monthly_statement",
        uniqueConstraints = @UniqueConstraint(name = "uk_statement_period",
                columnNames = {"statement_year", "statement_month"}))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyStatementEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "statement_year", nullable = false)
    private int year;

    @Column(name = "statement_month", nullable = false)
    private int month;

    @Column(name = "starting_balance", precision = 18, scale = 2, nullable = false)
    private BigDecimal startingBalance;

    @Column(name = "ending_balance", precision = 18, scale = 2, nullable = false)
    private BigDecimal endingBalance;

    // Period flows
    @Column(name = "deposits", precision = 18, scale = 2, nullable = false)
    private BigDecimal deposits;

    @Column(name = "withdrawals", precision = 18, scale = 2, nullable = false)
    private BigDecimal withdrawals;

    @Column(name = "stakes_placed", precision = 18, scale = 2, nullable = false)
    private BigDecimal stakesPlaced;

    @Column(name = "winnings", precision = 18, scale = 2, nullable = false)
    private BigDecimal winnings;

    @Column(name = "expenses", precision = 18, scale = 2, nullable = false)
    private BigDecimal expenses;

    @Column(name = "total_losses", precision = 18, scale = 2, nullable = false)
    private BigDecimal totalLosses;

    @Column(name = "gross_profit", precision = 18, scale = 2, nullable = false)
    private BigDecimal grossProfit;

    @Column(name = "net_profit", precision = 18, scale = 2, nullable = false)
    private BigDecimal netProfit;

    @Column(name = "partner_share", precision = 18, scale = 2, nullable = false)
    private BigDecimal partnerShare;

    @Column(name = "my_share", precision = 18, scale = 2, nullable = false)
    private BigDecimal myShare;

    @Column(name = "estimated_tax", precision = 18, scale = 2, nullable = false)
    private BigDecimal estimatedTax;

    @Column(name = "after_tax_profit", precision = 18, scale = 2, nullable = false)
    private BigDecimal afterTaxProfit;

    // Betting stats
    @Column(name = "total_bets", nullable = false)
    private int totalBets;

    @Column(name = "winning_bets", nullable = false)
    private int winningBets;

    @Column(name = "win_rate", precision = 7, scale = 2, nullable = false)
    private BigDecimal winRate;

    @Column(name = "roi", precision = 10, scale = 2, nullable = false)
    private BigDecimal roi;

    @Column(name = "generated_at", nullable = false)
    private LocalDateTime generatedAt;
}
