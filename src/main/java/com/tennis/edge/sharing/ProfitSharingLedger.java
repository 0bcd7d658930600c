package com.tennis.edge.sharing;

import com.tennis.edge.ledger.BettingLedger;
import com.tennis.edge.ledger.LedgerSnapshot;
import com.tennis.edge.persistence.LedgerTransactionEntity;
import com.tennis.edge.persistence.MonthlyStatementEntity;
import com.tennis.edge.persistence.MonthlyStatementRepository;
import com.tennis.edge.persistence.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Rolls the ledger's transaction log up into monthly profit-split statements.
 *
 * Profit below {@code minimum-profit-for-split} is retained in the bankroll rather than
 * split: both shares are zero for such a month.
 */
@Service
@Slf4j
public class ProfitSharingLedger {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BettingLedger ledger;
    private final MonthlyStatementRepository statementRepository;
    private final BigDecimal partnerPercentage;
    private final BigDecimal myPercentage;
    private final BigDecimal minimumProfitForSplit;
    private final BigDecimal taxRate;

    public ProfitSharingLedger(
            BettingLedger ledger,
            MonthlyStatementRepository statementRepository,
            @Value("${profit-sharing.partner-percentage:50.0}") BigDecimal partnerPercentage,
            @Value("${profit-sharing.my-percentage:50.0}") BigDecimal myPercentage,
            @Value("${profit-sharing.minimum-profit-for-split:100.0}") BigDecimal minimumProfitForSplit,
            @Value("${profit-sharing.tax-rate:30.0}") BigDecimal taxRate) {
        this.ledger = ledger;
        this.statementRepository = statementRepository;
        this.partnerPercentage = partnerPercentage;
        this.myPercentage = myPercentage;
        this.minimumProfitForSplit = minimumProfitForSplit;
        this.taxRate = taxRate;

        if (partnerPercentage.add(myPercentage).compareTo(HUNDRED) != 0) {
            log.warn("Profit split percentages add up to {} instead of 100",
                    partnerPercentage.add(myPercentage));
        }
    }

    // ==================== Statements ====================

    /**
     * Generate and store the statement for a month, replacing any earlier statement for
     * the same period. Runs under the ledger's write lock, so concurrent regenerations of one
     * month serialize and the figures match the log at that instant.
     */
    public MonthlyStatement generateStatement(int year, int month) {
        YearMonth period = YearMonth.of(year, month);
        log.info("Generating statement for {}", period);

        MonthlyStatement statement = ledger.runExclusive(() -> {
            MonthlyStatement calculated = calculate(ledger.snapshot(), period);

            MonthlyStatementEntity entity = toEntity(calculated);
            statementRepository.findByPeriod(year, month).ifPresent(existing -> {
                log.info("Replacing existing statement for {}", period);
                entity.setId(existing.getId());
            });
            statementRepository.save(entity);
            return calculated;
        });

        log.info("Statement for {}: net profit {}, partner share {}, my share {}",
                period, statement.getNetProfit(), statement.getPartnerShare(), statement.getMyShare());
        return statement;
    }

    public Optional<MonthlyStatement> getStatement(int year, int month) {
        return statementRepository.findByPeriod(year, month).map(this::toDto);
    }

    /**
     * Compute a statement from a ledger snapshot without storing it.
     */
    MonthlyStatement calculate(LedgerSnapshot snapshot, YearMonth period) {
        LocalDateTime start = period.atDay(1).atStartOfDay();
        LocalDateTime end = period.plusMonths(1).atDay(1).atStartOfDay();

        BigDecimal startingBalance = snapshot.startingBalance();
        for (LedgerTransactionEntity tx : snapshot.transactions()) {
            if (tx.getCreatedAt().isBefore(start)) {
                startingBalance = startingBalance.add(tx.getAmount());
            }
        }

        PeriodFlows flows = PeriodFlows.of(snapshot.transactions().stream()
                .filter(tx -> !tx.getCreatedAt().isBefore(start) && tx.getCreatedAt().isBefore(end))
                .toList());

        BigDecimal grossProfit = flows.winnings.subtract(flows.stakes);
        BigDecimal netProfit = grossProfit.subtract(flows.expenses);
        ProfitSplit shares = split(netProfit);
        BigDecimal tax = estimateTax(netProfit);

        return MonthlyStatement.builder()
                .year(period.getYear())
                .month(period.getMonthValue())
                .startingBalance(money(startingBalance))
                .endingBalance(money(startingBalance.add(flows.net)))
                .deposits(money(flows.deposits))
                .withdrawals(money(flows.withdrawals))
                .stakesPlaced(money(flows.stakes))
                .winnings(money(flows.winnings))
                .expenses(money(flows.expenses))
                .totalLosses(money(flows.stakes.subtract(flows.winnings)))
                .grossProfit(money(grossProfit))
                .netProfit(money(netProfit))
                .partnerShare(shares.partnerShare())
                .myShare(shares.myShare())
                .estimatedTax(tax)
                .afterTaxProfit(money(netProfit.subtract(tax)))
                .totalBets(flows.betCount)
                .winningBets(flows.winCount)
                .winRate(percent(BigDecimal.valueOf(flows.winCount), BigDecimal.valueOf(flows.betCount)))
                .roi(percent(grossProfit, flows.stakes))
                .generatedAt(LocalDateTime.now())
                .build();
    }

    /**
     * Partner and own share of a period's net profit, both zero below the split minimum.
     */
    public ProfitSplit split(BigDecimal netProfit) {
        if (netProfit.compareTo(minimumProfitForSplit) < 0) {
            return new ProfitSplit(money(BigDecimal.ZERO), money(BigDecimal.ZERO));
        }
        return new ProfitSplit(
                netProfit.multiply(partnerPercentage).divide(HUNDRED, 2, RoundingMode.HALF_UP),
                netProfit.multiply(myPercentage).divide(HUNDRED, 2, RoundingMode.HALF_UP));
    }

    private BigDecimal estimateTax(BigDecimal netProfit) {
        if (netProfit.signum() <= 0) {
            return money(BigDecimal.ZERO);
        }
        return netProfit.multiply(taxRate).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    // ==================== Summaries ====================

    public CurrentMonthSummary getCurrentMonthSummary() {
        YearMonth period = YearMonth.now();
        LedgerSnapshot snapshot = ledger.snapshot();
        MonthlyStatement running = calculate(snapshot, period);

        return CurrentMonthSummary.builder()
                .period(period)
                .currentBalance(snapshot.currentBalance())
                .stakesPlaced(running.getStakesPlaced())
                .winnings(running.getWinnings())
                .expenses(running.getExpenses())
                .grossProfit(running.getGrossProfit())
                .netProfit(running.getNetProfit())
                .totalBets(running.getTotalBets())
                .winningBets(running.getWinningBets())
                .winRate(running.getWinRate())
                .roi(running.getRoi())
                .projectedPartnerShare(running.getPartnerShare())
                .projectedMyShare(running.getMyShare())
                .build();
    }

    /**
     * Totals over the stored statements of a year.
     */
    public AnnualSummary getAnnualSummary(int year) {
        List<MonthlyStatement> statements = statementRepository.findByYear(year).stream()
                .map(this::toDto)
                .toList();
        if (statements.isEmpty()) {
            return AnnualSummary.empty(year);
        }

        List<MonthlyStatement> withBets = statements.stream().filter(s -> s.getTotalBets() > 0).toList();
        List<MonthlyStatement> withStakes = statements.stream()
                .filter(s -> s.getStakesPlaced().signum() > 0).toList();

        return AnnualSummary.builder()
                .year(year)
                .monthsActive(statements.size())
                .totalNetProfit(sum(statements, MonthlyStatement::getNetProfit))
                .totalPartnerShare(sum(statements, MonthlyStatement::getPartnerShare))
                .totalMyShare(sum(statements, MonthlyStatement::getMyShare))
                .totalBets(statements.stream().mapToInt(MonthlyStatement::getTotalBets).sum())
                .totalWinningBets(statements.stream().mapToInt(MonthlyStatement::getWinningBets).sum())
                .averageWinRate(mean(withBets, MonthlyStatement::getWinRate))
                .averageRoi(mean(withStakes, MonthlyStatement::getRoi))
                .statements(statements)
                .build();
    }

    // ==================== Helpers ====================

    /**
     * Flows of one period. Stakes are net of refunds; reversal entries carry negative
     * amounts and so cancel the entry they reverse.
     */
    private static final class PeriodFlows {
        BigDecimal deposits = BigDecimal.ZERO;
        BigDecimal withdrawals = BigDecimal.ZERO;
        BigDecimal stakes = BigDecimal.ZERO;
        BigDecimal winnings = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;
        int betCount;
        int winCount;

        static PeriodFlows of(List<LedgerTransactionEntity> transactions) {
            PeriodFlows flows = new PeriodFlows();
            for (LedgerTransactionEntity tx : transactions) {
                BigDecimal amount = tx.getAmount();
                flows.net = flows.net.add(amount);
                TransactionType type = tx.getType();
                switch (type) {
                    case DEPOSIT -> flows.deposits = flows.deposits.add(amount);
                    case WITHDRAWAL -> flows.withdrawals = flows.withdrawals.add(amount.negate());
                    case BET -> {
                        flows.stakes = flows.stakes.add(amount.negate());
                        flows.betCount++;
                    }
                    case REFUND -> flows.stakes = flows.stakes.subtract(amount);
                    case WIN -> {
                        flows.winnings = flows.winnings.add(amount);
                        flows.winCount += amount.signum();
                    }
                    case EXPENSE -> flows.expenses = flows.expenses.add(amount.negate());
                    case LOSS -> {
                        // zero-amount marker
                    }
                }
            }
            return flows;
        }
    }

    private MonthlyStatementEntity toEntity(MonthlyStatement s) {
        return MonthlyStatementEntity.builder()
                .year(s.getYear())
                .month(s.getMonth())
                .startingBalance(s.getStartingBalance())
                .endingBalance(s.getEndingBalance())
                .deposits(s.getDeposits())
                .withdrawals(s.getWithdrawals())
                .stakesPlaced(s.getStakesPlaced())
                .winnings(s.getWinnings())
                .expenses(s.getExpenses())
                .totalLosses(s.getTotalLosses())
                .grossProfit(s.getGrossProfit())
                .netProfit(s.getNetProfit())
                .partnerShare(s.getPartnerShare())
                .myShare(s.getMyShare())
                .estimatedTax(s.getEstimatedTax())
                .afterTaxProfit(s.getAfterTaxProfit())
                .totalBets(s.getTotalBets())
                .winningBets(s.getWinningBets())
                .winRate(s.getWinRate())
                .roi(s.getRoi())
                .generatedAt(s.getGeneratedAt())
                .build();
    }

    private MonthlyStatement toDto(MonthlyStatementEntity e) {
        return MonthlyStatement.builder()
                .year(e.getYear())
                .month(e.getMonth())
                .startingBalance(e.getStartingBalance())
                .endingBalance(e.getEndingBalance())
                .deposits(e.getDeposits())
                .withdrawals(e.getWithdrawals())
                .stakesPlaced(e.getStakesPlaced())
                .winnings(e.getWinnings())
                .expenses(e.getExpenses())
                .totalLosses(e.getTotalLosses())
                .grossProfit(e.getGrossProfit())
                .netProfit(e.getNetProfit())
                .partnerShare(e.getPartnerShare())
                .myShare(e.getMyShare())
                .estimatedTax(e.getEstimatedTax())
                .afterTaxProfit(e.getAfterTaxProfit())
                .totalBets(e.getTotalBets())
                .winningBets(e.getWinningBets())
                .winRate(e.getWinRate())
                .roi(e.getRoi())
                .generatedAt(e.getGeneratedAt())
                .build();
    }

    private static BigDecimal sum(List<MonthlyStatement> statements,
                                  Function<MonthlyStatement, BigDecimal> field) {
        return money(statements.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private static BigDecimal mean(List<MonthlyStatement> statements,
                                   Function<MonthlyStatement, BigDecimal> field) {
        if (statements.isEmpty()) {
            return money(BigDecimal.ZERO);
        }
        return statements.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(statements.size()), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return money(BigDecimal.ZERO);
        }
        return numerator.multiply(HUNDRED).divide(denominator, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
