package com.tennis.edge.analysis;

import com.tennis.edge.ledger.BettingLedger;
import com.tennis.edge.ledger.LedgerSnapshot;
import com.tennis.edge.persistence.BetEntity;
import com.tennis.edge.persistence.BetStatus;
import com.tennis.edge.persistence.LedgerTransactionEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only performance analytics over a ledger snapshot. An empty ledger yields a zeroed
 * report.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PerformanceAnalyzer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String UNKNOWN = "unknown";

    private final BettingLedger ledger;

    /**
     * Analyse the whole ledger history.
     */
    public PerformanceReport analyze() {
        return analyze(ledger.snapshot(), null);
    }

    /**
     * Analyse bets placed, and balance movements recorded, at or after {@code since}.
     */
    public PerformanceReport analyzeSince(LocalDateTime since) {
        return analyze(ledger.snapshot(), since);
    }

    public List<BreakdownRow> breakdownBySport() {
        return breakdown(settled(ledger.snapshot().bets()), BetEntity::getSport);
    }

    public List<BreakdownRow> breakdownByStrategy() {
        return breakdown(settled(ledger.snapshot().bets()), BetEntity::getStrategy);
    }

    // ==================== Calculation ====================

    PerformanceReport analyze(LedgerSnapshot snapshot, LocalDateTime since) {
        List<BetEntity> bets = snapshot.bets().stream()
                .filter(b -> since == null || !b.getPlacedAt().isBefore(since))
                .toList();
        List<BetEntity> settled = settled(bets);

        int won = (int) settled.stream().filter(b -> b.getStatus() == BetStatus.WON).count();
        int lost = settled.size() - won;

        BigDecimal totalStaked = sum(settled, BetEntity::getStake);
        BigDecimal totalWinnings = settled.stream()
                .filter(b -> b.getStatus() == BetStatus.WON)
                .map(b -> b.getStake().multiply(b.getOdds()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal netProfit = totalWinnings.subtract(totalStaked);

        BigDecimal grossWins = settled.stream()
                .filter(b -> b.getStatus() == BetStatus.WON)
                .map(BetEntity::getProfitLoss)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLosses = settled.stream()
                .filter(b -> b.getStatus() == BetStatus.LOST)
                .map(b -> b.getProfitLoss().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal profitFactor = grossLosses.signum() == 0
                ? BigDecimal.ZERO
                : grossWins.divide(grossLosses, 4, RoundingMode.HALF_UP);

        List<BigDecimal> dailyBalances = dailyBalanceSeries(snapshot, since);
        BigDecimal peak = since == null
                ? snapshot.peakBalance()
                : dailyBalances.stream().max(Comparator.naturalOrder()).orElse(snapshot.currentBalance());
        BigDecimal trough = dailyBalances.stream().min(Comparator.naturalOrder()).orElse(peak);
        BigDecimal maxDrawdown = peak.subtract(trough).max(BigDecimal.ZERO);

        PerformanceReport report = PerformanceReport.builder()
                .totalBets(bets.size())
                .settledBets(settled.size())
                .wonBets(won)
                .lostBets(lost)
                .voidBets(count(bets, BetStatus.VOID))
                .pendingBets(count(bets, BetStatus.PENDING))
                .winRate(percent(BigDecimal.valueOf(won), BigDecimal.valueOf(settled.size())))
                .roi(percent(netProfit, totalStaked))
                .totalStaked(money(totalStaked))
                .totalWinnings(money(totalWinnings))
                .netProfit(money(netProfit))
                .grossWins(money(grossWins))
                .grossLosses(money(grossLosses))
                .profitFactor(profitFactor)
                .peakBalance(money(peak))
                .maxDrawdown(money(maxDrawdown))
                .maxDrawdownPct(percent(maxDrawdown, peak))
                .sharpeRatio(sharpe(dailyBalances))
                .averageOdds(average(settled, BetEntity::getOdds, 3))
                .averageConfidence(settled.stream().mapToDouble(BetEntity::getConfidence).average().orElse(0.0))
                .averageExpectedValuePct(average(settled.stream()
                        .filter(b -> b.getExpectedValuePct() != null).toList(), BetEntity::getExpectedValuePct, 2))
                .bySport(breakdown(settled, BetEntity::getSport))
                .byStrategy(breakdown(settled, BetEntity::getStrategy))
                .since(since)
                .calculatedAt(LocalDateTime.now())
                .build();

        log.debug("Performance: {} settled, win rate {}%, ROI {}%, drawdown {}",
                report.getSettledBets(), report.getWinRate(), report.getRoi(), report.getMaxDrawdown());
        return report;
    }

    /**
     * End-of-day balances, preceded by the balance at the start of the window.
     */
    List<BigDecimal> dailyBalanceSeries(LedgerSnapshot snapshot, LocalDateTime since) {
        BigDecimal balance = snapshot.startingBalance();
        List<LedgerTransactionEntity> inWindow = new ArrayList<>();
        for (LedgerTransactionEntity tx : snapshot.transactions()) {
            if (since != null && tx.getCreatedAt().isBefore(since)) {
                balance = balance.add(tx.getAmount());
            } else {
                inWindow.add(tx);
            }
        }

        List<BigDecimal> series = new ArrayList<>();
        series.add(balance);

        // Transactions are in log order, which is chronological
        Map<LocalDate, BigDecimal> endOfDay = new TreeMap<>();
        for (LedgerTransactionEntity tx : inWindow) {
            balance = balance.add(tx.getAmount());
            endOfDay.put(tx.getCreatedAt().toLocalDate(), balance);
        }
        series.addAll(endOfDay.values());
        return series;
    }

    /**
     * mean(daily return) / stdev(daily return), 0 with fewer than two returns or no variance.
     */
    BigDecimal sharpe(List<BigDecimal> balances) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < balances.size(); i++) {
            double previous = balances.get(i - 1).doubleValue();
            if (previous != 0.0) {
                returns.add((balances.get(i).doubleValue() - previous) / previous);
            }
        }
        if (returns.size() < 2) {
            return BigDecimal.ZERO.setScale(4);
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum() / (returns.size() - 1);
        double stdev = Math.sqrt(variance);
        if (stdev == 0.0 || Double.isNaN(stdev)) {
            return BigDecimal.ZERO.setScale(4);
        }
        return BigDecimal.valueOf(mean / stdev).setScale(4, RoundingMode.HALF_UP);
    }

    List<BreakdownRow> breakdown(List<BetEntity> settled, Function<BetEntity, String> key) {
        Map<String, List<BetEntity>> groups = settled.stream()
                .collect(Collectors.groupingBy(b -> Optional.ofNullable(key.apply(b)).orElse(UNKNOWN),
                        TreeMap::new, Collectors.toList()));

        List<BreakdownRow> rows = new ArrayList<>();
        groups.forEach((name, group) -> {
            int wins = (int) group.stream().filter(b -> b.getStatus() == BetStatus.WON).count();
            BigDecimal staked = sum(group, BetEntity::getStake);
            BigDecimal profit = sum(group, BetEntity::getProfitLoss);
            rows.add(BreakdownRow.builder()
                    .key(name)
                    .bets(group.size())
                    .wins(wins)
                    .winRate(percent(BigDecimal.valueOf(wins), BigDecimal.valueOf(group.size())))
                    .staked(money(staked))
                    .profit(money(profit))
                    .roi(percent(profit, staked))
                    .build());
        });
        rows.sort(Comparator.comparing(BreakdownRow::getProfit).reversed());
        return rows;
    }

    // ==================== Helpers ====================

    private static List<BetEntity> settled(List<BetEntity> bets) {
        return bets.stream()
                .filter(b -> b.getStatus() == BetStatus.WON || b.getStatus() == BetStatus.LOST)
                .toList();
    }

    private static int count(List<BetEntity> bets, BetStatus status) {
        return (int) bets.stream().filter(b -> b.getStatus() == status).count();
    }

    private static BigDecimal sum(List<BetEntity> bets, Function<BetEntity, BigDecimal> field) {
        return bets.stream().map(field).filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(List<BetEntity> bets, Function<BetEntity, BigDecimal> field, int scale) {
        if (bets.isEmpty()) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return sum(bets, field).divide(BigDecimal.valueOf(bets.size()), scale, RoundingMode.HALF_UP);
    }

    private static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return numerator.multiply(HUNDRED).divide(denominator, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
