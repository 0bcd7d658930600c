package com.tennis.edge.sharing;

import com.tennis.edge.BaseIntegrationTest;
import com.tennis.edge.ledger.BetRequest;
import com.tennis.edge.ledger.BettingLedger;
import com.tennis.edge.ledger.LedgerSnapshot;
import com.tennis.edge.ledger.SettlementOutcome;
import com.tennis.edge.persistence.LedgerTransactionEntity;
import com.tennis.edge.persistence.MonthlyStatementRepository;
import com.tennis.edge.persistence.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProfitSharingLedger Tests")
class ProfitSharingLedgerTest extends BaseIntegrationTest {

    @Autowired
    private ProfitSharingLedger sharing;

    @Autowired
    private BettingLedger ledger;

    @Autowired
    private MonthlyStatementRepository statementRepository;

    private final YearMonth now = YearMonth.now();

    @BeforeEach
    void setUp() {
        openLedger("10000.00");
    }

    private void winBet(String matchId, String stake, String odds) {
        String betId = ledger.placeBet(BetRequest.builder()
                .matchId(matchId)
                .sport("tennis")
                .surface("Hard")
                .strategy("First Set Recovery")
                .selection("Alcaraz")
                .odds(new BigDecimal(odds))
                .stake(new BigDecimal(stake))
                .confidence(0.74)
                .build()).getBet().getBetId();
        ledger.settleBet(betId, SettlementOutcome.WIN, false);
    }

    @Nested
    @DisplayName("Monthly statements")
    class StatementTests {

        @Test
        @DisplayName("Profit below the split minimum is retained")
        void belowMinimum() {
            // Given - 100 @ 1.40 won
            winBet("M1", "100", "1.40");

            // When
            MonthlyStatement statement = sharing.generateStatement(now.getYear(), now.getMonthValue());

            // Then
            assertThat(statement.getNetProfit()).isEqualByComparingTo("40.00");
            assertThat(statement.getPartnerShare()).isEqualByComparingTo("0");
            assertThat(statement.getMyShare()).isEqualByComparingTo("0");
            assertThat(statement.isSplit()).isFalse();
            assertThat(statement.getEstimatedTax()).isEqualByComparingTo("12.00");
        }

        @Test
        @DisplayName("Profit net of expenses is split and taxed")
        void splitAndTax() {
            winBet("M1", "500", "2.1");
            ledger.recordExpense(new BigDecimal("50"), "Odds feed subscription", true);

            MonthlyStatement statement = sharing.generateStatement(now.getYear(), now.getMonthValue());

            assertThat(statement.getStartingBalance()).isEqualByComparingTo("10000.00");
            assertThat(statement.getEndingBalance()).isEqualByComparingTo("10500.00");
            assertThat(statement.getStakesPlaced()).isEqualByComparingTo("500.00");
            assertThat(statement.getWinnings()).isEqualByComparingTo("1050.00");
            assertThat(statement.getExpenses()).isEqualByComparingTo("50.00");
            assertThat(statement.getGrossProfit()).isEqualByComparingTo("550.00");
            assertThat(statement.getNetProfit()).isEqualByComparingTo("500.00");
            assertThat(statement.getPartnerShare()).isEqualByComparingTo("250.00");
            assertThat(statement.getMyShare()).isEqualByComparingTo("250.00");
            assertThat(statement.getEstimatedTax()).isEqualByComparingTo("150.00");
            assertThat(statement.getAfterTaxProfit()).isEqualByComparingTo("350.00");
            assertThat(statement.getTotalBets()).isEqualTo(1);
            assertThat(statement.getWinningBets()).isEqualTo(1);
            assertThat(statement.getWinRate()).isEqualByComparingTo("100.00");
            assertThat(statement.getRoi()).isEqualByComparingTo("110.00");
        }

        @Test
        @DisplayName("Regenerating a month replaces the stored statement")
        void regenerate() {
            winBet("M1", "500", "2.1");
            sharing.generateStatement(now.getYear(), now.getMonthValue());
            ledger.recordExpense(new BigDecimal("100"), "Data", false);

            sharing.generateStatement(now.getYear(), now.getMonthValue());

            assertThat(statementRepository.count()).isEqualTo(1);
            assertThat(sharing.getStatement(now.getYear(), now.getMonthValue()))
                    .hasValueSatisfying(s -> assertThat(s.getNetProfit()).isEqualByComparingTo("450.00"));
        }

        @Test
        @DisplayName("Concurrent regenerations of the same months keep one statement each")
        void concurrentRegeneration() throws Exception {
            // Given
            winBet("M1", "500", "2.1");
            int months = 6;
            int callersPerMonth = 4;
            ExecutorService executor = Executors.newFixedThreadPool(callersPerMonth);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<MonthlyStatement>> futures = new ArrayList<>();

            // When
            for (int month = 1; month <= months; month++) {
                int m = month;
                for (int i = 0; i < callersPerMonth; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return sharing.generateStatement(2025, m);
                    }));
                }
            }
            start.countDown();

            List<MonthlyStatement> statements = new ArrayList<>();
            for (Future<MonthlyStatement> future : futures) {
                statements.add(future.get(30, TimeUnit.SECONDS));
            }
            executor.shutdown();

            // Then
            assertThat(statements).hasSize(months * callersPerMonth);
            assertThat(statementRepository.count()).isEqualTo(months);
            assertThat(sharing.getAnnualSummary(2025).getMonthsActive()).isEqualTo(months);
        }

        @Test
        @DisplayName("Voided stakes do not count as placed")
        void refundsNetted() {
            String betId = ledger.placeBet(BetRequest.builder()
                    .matchId("M1").sport("tennis").strategy("Fatigue Advantage").selection("Rune")
                    .odds(new BigDecimal("2.40")).stake(new BigDecimal("200")).confidence(0.65)
                    .build()).getBet().getBetId();
            ledger.settleBet(betId, SettlementOutcome.VOID, false);

            MonthlyStatement statement = sharing.generateStatement(now.getYear(), now.getMonthValue());

            assertThat(statement.getStakesPlaced()).isEqualByComparingTo("0");
            assertThat(statement.getNetProfit()).isEqualByComparingTo("0");
            assertThat(statement.getEstimatedTax()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Unknown period has no statement")
        void missingStatement() {
            assertThat(sharing.getStatement(1999, 1)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Period boundaries")
    class PeriodTests {

        private LedgerTransactionEntity tx(TransactionType type, String amount, LocalDateTime at) {
            return LedgerTransactionEntity.builder().type(type).amount(new BigDecimal(amount)).createdAt(at).build();
        }

        @Test
        @DisplayName("Starting balance carries earlier months' movements")
        void startingBalance() {
            YearMonth march = YearMonth.of(2026, 3);
            List<LedgerTransactionEntity> log = List.of(
                    tx(TransactionType.DEPOSIT, "2000", LocalDateTime.of(2026, 2, 27, 9, 0)),
                    tx(TransactionType.BET, "-300", LocalDateTime.of(2026, 2, 28, 23, 59)),
                    tx(TransactionType.WIN, "570", LocalDateTime.of(2026, 3, 1, 0, 0)),
                    tx(TransactionType.BET, "-100", LocalDateTime.of(2026, 3, 31, 23, 0)),
                    tx(TransactionType.DEPOSIT, "999", LocalDateTime.of(2026, 4, 1, 0, 0)));
            LedgerSnapshot snapshot = new LedgerSnapshot(new BigDecimal("10000.00"), new BigDecimal("13169.00"),
                    new BigDecimal("13169.00"), LocalDateTime.of(2026, 1, 1, 0, 0), List.of(), log,
                    LocalDateTime.of(2026, 4, 2, 0, 0));

            MonthlyStatement statement = sharing.calculate(snapshot, march);

            assertThat(statement.getStartingBalance()).isEqualByComparingTo("11700.00");
            assertThat(statement.getEndingBalance()).isEqualByComparingTo("12170.00");
            assertThat(statement.getWinnings()).isEqualByComparingTo("570.00");
            assertThat(statement.getStakesPlaced()).isEqualByComparingTo("100.00");
            assertThat(statement.getDeposits()).isEqualByComparingTo("0");
            assertThat(statement.getPeriod()).isEqualTo(march);
        }

        @Test
        @DisplayName("Split applies from the minimum upward")
        void splitBoundary() {
            assertThat(sharing.split(new BigDecimal("99.99")))
                    .isEqualTo(new ProfitSplit(new BigDecimal("0.00"), new BigDecimal("0.00")));
            ProfitSplit atMinimum = sharing.split(new BigDecimal("100.00"));
            assertThat(atMinimum.partnerShare()).isEqualByComparingTo("50.00");
            assertThat(atMinimum.myShare()).isEqualByComparingTo("50.00");
            assertThat(sharing.split(new BigDecimal("-250")).partnerShare()).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Summaries")
    class SummaryTests {

        @Test
        @DisplayName("Current month summary projects shares from the running figures")
        void currentMonth() {
            winBet("M1", "500", "2.1");

            CurrentMonthSummary summary = sharing.getCurrentMonthSummary();

            assertThat(summary.getPeriod()).isEqualTo(now);
            assertThat(summary.getCurrentBalance()).isEqualByComparingTo("10550.00");
            assertThat(summary.getNetProfit()).isEqualByComparingTo("550.00");
            assertThat(summary.getProjectedPartnerShare()).isEqualByComparingTo("275.00");
            assertThat(statementRepository.count()).isZero();
        }

        @Test
        @DisplayName("Annual summary totals stored statements")
        void annual() {
            winBet("M1", "500", "2.1");
            sharing.generateStatement(now.getYear(), now.getMonthValue());

            AnnualSummary summary = sharing.getAnnualSummary(now.getYear());

            assertThat(summary.getMonthsActive()).isEqualTo(1);
            assertThat(summary.getTotalNetProfit()).isEqualByComparingTo("550.00");
            assertThat(summary.getTotalPartnerShare()).isEqualByComparingTo("275.00");
            assertThat(summary.getTotalBets()).isEqualTo(1);
            assertThat(summary.getAverageWinRate()).isEqualByComparingTo("100.00");
            assertThat(summary.getStatements()).hasSize(1);
        }

        @Test
        @DisplayName("Year without statements is empty")
        void emptyYear() {
            AnnualSummary summary = sharing.getAnnualSummary(1999);

            assertThat(summary.getMonthsActive()).isZero();
            assertThat(summary.getTotalNetProfit()).isEqualByComparingTo("0");
        }
    }
}
