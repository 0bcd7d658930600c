package com.tennis.edge.ledger;

import com.tennis.edge.BaseIntegrationTest;
import com.tennis.edge.exception.BetNotFoundException;
import com.tennis.edge.exception.InsufficientBankrollException;
import com.tennis.edge.exception.LedgerIntegrityException;
import com.tennis.edge.persistence.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Integration tests for BettingLedger: placement, settlement and balance bookkeeping.
 */
@DisplayName("BettingLedger Tests")
class BettingLedgerTest extends BaseIntegrationTest {

    @Autowired
    private BettingLedger ledger;

    @Autowired
    private LedgerAccountRepository accountRepository;

    @Autowired
    private CalibrationRecordRepository calibrationRepository;

    @BeforeEach
    void setUp() {
        openLedger("10000.00");
    }

    private static BetRequest bet(String matchId, String stake, String odds) {
        return BetRequest.builder()
                .matchId(matchId)
                .sport("tennis")
                .surface("Hard")
                .strategy("First Set Recovery")
                .selection("Medvedev")
                .odds(new BigDecimal(odds))
                .stake(new BigDecimal(stake))
                .confidence(0.72)
                .expectedValuePct(new BigDecimal("12.00"))
                .build();
    }

    private void assertBalanceReconciles() {
        LedgerSnapshot snapshot = ledger.snapshot();
        BigDecimal sum = snapshot.transactions().stream()
                .map(LedgerTransactionEntity::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(snapshot.currentBalance()).isEqualByComparingTo(snapshot.startingBalance().add(sum));
    }

    @Nested
    @DisplayName("Placement")
    class PlacementTests {

        @Test
        @DisplayName("Placing a bet debits the stake immediately")
        void debitsStake() {
            PlacementResult result = ledger.placeBet(bet("M1", "500", "2.10"));

            assertThat(result.getStatus()).isEqualTo(PlacementResult.Status.PLACED);
            assertThat(result.getBet().getBetId()).startsWith("BET-");
            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.PENDING);
            assertThat(result.getBalanceAfter()).isEqualByComparingTo("9500.00");
            assertThat(ledger.getBalance()).isEqualByComparingTo("9500.00");
            assertThat(ledger.getPendingBets()).hasSize(1);
            assertThat(ledger.getTransactions()).singleElement()
                    .satisfies(tx -> {
                        assertThat(tx.getType()).isEqualTo(TransactionType.BET);
                        assertThat(tx.getAmount()).isEqualByComparingTo("-500.00");
                    });
        }

        @Test
        @DisplayName("Overdraft is refused without touching state")
        void refusesOverdraft() {
            PlacementResult result = ledger.placeBet(bet("M1", "10000.01", "2.00"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getStatus()).isEqualTo(PlacementResult.Status.INSUFFICIENT_BANKROLL);
            assertThat(ledger.getBalance()).isEqualByComparingTo("10000.00");
            assertThat(ledger.getTransactions()).isEmpty();
            assertThat(ledger.snapshot().bets()).isEmpty();
        }

        @Test
        @DisplayName("Whole bankroll can be staked")
        void wholeBankroll() {
            PlacementResult result = ledger.placeBet(bet("M1", "10000.00", "2.00"));

            assertThat(result.isNewBet()).isTrue();
            assertThat(ledger.getBalance()).isEqualByComparingTo("0.00");
        }

        @Test
        @DisplayName("Invalid requests are rejected")
        void invalidRequests() {
            assertThat(ledger.placeBet(bet("M1", "0", "2.00")).getStatus())
                    .isEqualTo(PlacementResult.Status.INVALID_STAKE);
            assertThat(ledger.placeBet(bet("M1", "-5", "2.00")).getStatus())
                    .isEqualTo(PlacementResult.Status.INVALID_STAKE);
            assertThat(ledger.placeBet(bet("M1", "50", "1.00")).getStatus())
                    .isEqualTo(PlacementResult.Status.INVALID_STAKE);
            assertThat(ledger.placeBet(bet(" ", "50", "2.00")).getStatus())
                    .isEqualTo(PlacementResult.Status.INVALID_STAKE);
            assertThat(ledger.placeBet(bet("M1", "50", "2.1234567")).getStatus())
                    .isEqualTo(PlacementResult.Status.INVALID_STAKE);
            assertThat(ledger.getTransactions()).isEmpty();
        }

        @Test
        @DisplayName("Second bet on a match with an open bet returns the open bet")
        void oneOpenBetPerMatch() {
            PlacementResult first = ledger.placeBet(bet("M1", "200", "1.90"));
            PlacementResult second = ledger.placeBet(bet("M1", "300", "2.20"));

            assertThat(second.getStatus()).isEqualTo(PlacementResult.Status.EXISTING);
            assertThat(second.getBet().getBetId()).isEqualTo(first.getBet().getBetId());
            assertThat(ledger.getBalance()).isEqualByComparingTo("9800.00");
            assertThat(ledger.getBetsForMatch("M1")).hasSize(1);
        }

        @Test
        @DisplayName("A new bet can be placed once the previous one is settled")
        void newBetAfterSettlement() {
            PlacementResult first = ledger.placeBet(bet("M1", "200", "1.90"));
            ledger.settleBet(first.getBet().getBetId(), SettlementOutcome.LOSS, false);

            PlacementResult second = ledger.placeBet(bet("M1", "100", "2.20"));

            assertThat(second.getStatus()).isEqualTo(PlacementResult.Status.PLACED);
            assertThat(ledger.getBetsForMatch("M1")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Settlement")
    class SettlementTests {

        @Test
        @DisplayName("Win credits stake times odds")
        void winCredits() {
            String betId = ledger.placeBet(bet("M1", "500", "2.1")).getBet().getBetId();

            SettlementResult result = ledger.settleBet(betId, SettlementOutcome.WIN, false);

            assertThat(result.getStatus()).isEqualTo(SettlementResult.Status.SETTLED);
            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.WON);
            assertThat(result.getBet().getProfitLoss()).isEqualByComparingTo("550.00");
            assertThat(result.getBet().getSettledAt()).isNotNull();
            assertThat(ledger.getBalance()).isEqualByComparingTo("10550.00");
            assertThat(ledger.snapshot().peakBalance()).isEqualByComparingTo("10550.00");
        }

        @Test
        @DisplayName("Win at four-decimal odds credits the exact odds placed")
        void winAtPreciseOdds() {
            String betId = ledger.placeBet(bet("M1", "1000", "2.1234")).getBet().getBetId();

            SettlementResult result = ledger.settleBet(betId, SettlementOutcome.WIN, false);

            assertThat(ledger.getBet(betId)).hasValueSatisfying(
                    b -> assertThat(b.getOdds()).isEqualByComparingTo("2.1234"));
            // 1000 x 2.1234 - 1000
            assertThat(result.getBet().getProfitLoss()).isEqualByComparingTo("1123.40");
            assertThat(ledger.getBalance()).isEqualByComparingTo("11123.40");
            assertBalanceReconciles();
        }

        @Test
        @DisplayName("Loss leaves the debited stake in place")
        void lossKeepsDebit() {
            String betId = ledger.placeBet(bet("M1", "300", "1.8")).getBet().getBetId();

            SettlementResult result = ledger.settleBet(betId, SettlementOutcome.LOSS, false);

            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.LOST);
            assertThat(result.getBet().getProfitLoss()).isEqualByComparingTo("-300.00");
            assertThat(ledger.getBalance()).isEqualByComparingTo("9700.00");
            assertThat(ledger.snapshot().peakBalance()).isEqualByComparingTo("10000.00");
        }

        @Test
        @DisplayName("Void refunds the stake and records no calibration entry")
        void voidRefunds() {
            String betId = ledger.placeBet(bet("M1", "250", "3.0")).getBet().getBetId();

            SettlementResult result = ledger.settleBet(betId, "void", false);

            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.VOID);
            assertThat(result.getBet().getProfitLoss()).isEqualByComparingTo("0");
            assertThat(ledger.getBalance()).isEqualByComparingTo("10000.00");
            assertThat(calibrationRepository.findByBetId(betId)).isEmpty();
        }

        @Test
        @DisplayName("Results-feed outcome is matched against the selection")
        void outcomeFromFeed() {
            String won = ledger.placeBet(bet("M1", "100", "2.0")).getBet().getBetId();
            String lost = ledger.placeBet(bet("M2", "100", "2.0")).getBet().getBetId();

            assertThat(ledger.settleBet(won, "MEDVEDEV", false).getBet().getStatus()).isEqualTo(BetStatus.WON);
            assertThat(ledger.settleBet(lost, "Zverev", false).getBet().getStatus()).isEqualTo(BetStatus.LOST);
        }

        @Test
        @DisplayName("Settling twice without force changes nothing")
        void idempotentSettlement() {
            String betId = ledger.placeBet(bet("M1", "500", "2.1")).getBet().getBetId();
            ledger.settleBet(betId, SettlementOutcome.WIN, false);
            int transactions = ledger.getTransactions().size();

            SettlementResult again = ledger.settleBet(betId, SettlementOutcome.LOSS, false);

            assertThat(again.getStatus()).isEqualTo(SettlementResult.Status.ALREADY_SETTLED);
            assertThat(again.isChanged()).isFalse();
            assertThat(again.getBet().getStatus()).isEqualTo(BetStatus.WON);
            assertThat(ledger.getBalance()).isEqualByComparingTo("10550.00");
            assertThat(ledger.getTransactions()).hasSize(transactions);
            assertThat(calibrationRepository.findByBetId(betId)).hasSize(1);
        }

        @Test
        @DisplayName("Forced re-settlement reverses the earlier credit")
        void forcedResettlement() {
            String betId = ledger.placeBet(bet("M1", "500", "2.1")).getBet().getBetId();
            ledger.settleBet(betId, SettlementOutcome.WIN, false);

            SettlementResult result = ledger.settleBet(betId, SettlementOutcome.LOSS, true);

            assertThat(result.getStatus()).isEqualTo(SettlementResult.Status.RESETTLED);
            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.LOST);
            assertThat(result.getBet().getProfitLoss()).isEqualByComparingTo("-500.00");
            assertThat(ledger.getBalance()).isEqualByComparingTo("9500.00");
            assertThat(ledger.getTransactions())
                    .anySatisfy(tx -> {
                        assertThat(tx.getType()).isEqualTo(TransactionType.WIN);
                        assertThat(tx.getAmount()).isEqualByComparingTo("-1050.00");
                    });
            assertThat(calibrationRepository.findByBetId(betId)).singleElement()
                    .satisfies(record -> assertThat(record.isCorrect()).isFalse());
            assertBalanceReconciles();
        }

        @Test
        @DisplayName("Settling the match settles its open bet")
        void settleByMatch() {
            ledger.placeBet(bet("M9", "100", "1.5"));

            SettlementResult result = ledger.settleMatch("M9", "Medvedev", false);

            assertThat(result.getBet().getStatus()).isEqualTo(BetStatus.WON);
            assertThat(ledger.getBalance()).isEqualByComparingTo("10050.00");
        }

        @Test
        @DisplayName("Unknown bets and matches are reported")
        void notFound() {
            assertThatThrownBy(() -> ledger.settleBet("BET-NOPE", SettlementOutcome.WIN, false))
                    .isInstanceOf(BetNotFoundException.class);
            assertThatThrownBy(() -> ledger.settleMatch("NO-MATCH", "x", false))
                    .isInstanceOf(BetNotFoundException.class)
                    .hasMessageContaining("NO-MATCH");
            assertThat(ledger.getBet("BET-NOPE")).isEmpty();
        }

        @Test
        @DisplayName("Calibration record is bucketed by confidence")
        void calibrationRecord() {
            String betId = ledger.placeBet(bet("M1", "100", "2.0")).getBet().getBetId();
            ledger.settleBet(betId, SettlementOutcome.WIN, false);

            assertThat(ledger.getCalibrationData(10)).singleElement().satisfies(record -> {
                assertThat(record.getMatchId()).isEqualTo("M1");
                assertThat(record.getConfidenceBucket()).isEqualTo("0.70-0.75");
                assertThat(record.isCorrect()).isTrue();
                assertThat(record.getCalibrationError()).isCloseTo(0.28, within(1e-9));
                assertThat(record.getSurface()).isEqualTo("Hard");
            });
        }
    }

    @Nested
    @DisplayName("Cash movements")
    class CashTests {

        @Test
        @DisplayName("Deposits, withdrawals and expenses adjust the balance")
        void movements() {
            ledger.deposit(new BigDecimal("1000"), "Top up");
            ledger.withdraw(new BigDecimal("250.50"), "Payout");
            LedgerTransactionEntity expense = ledger.recordExpense(new BigDecimal("49.50"), "Odds feed", true);

            assertThat(expense.getAmount()).isEqualByComparingTo("-49.50");
            assertThat(expense.getShared()).isTrue();
            assertThat(ledger.getBalance()).isEqualByComparingTo("10700.00");
            assertThat(ledger.snapshot().peakBalance()).isEqualByComparingTo("11000.00");
            assertBalanceReconciles();
        }

        @Test
        @DisplayName("Withdrawing more than the balance fails")
        void overdrawnWithdrawal() {
            assertThatThrownBy(() -> ledger.withdraw(new BigDecimal("10000.01"), "Too much"))
                    .isInstanceOf(InsufficientBankrollException.class);
            assertThatThrownBy(() -> ledger.deposit(BigDecimal.ZERO, "Nothing"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(ledger.getBalance()).isEqualByComparingTo("10000.00");
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("Balance equals starting balance plus all transactions after mixed operations")
        void balanceReconciles() {
            String a = ledger.placeBet(bet("M1", "500", "2.1")).getBet().getBetId();
            String b = ledger.placeBet(bet("M2", "300", "1.8")).getBet().getBetId();
            String c = ledger.placeBet(bet("M3", "120", "3.4")).getBet().getBetId();
            ledger.settleBet(a, SettlementOutcome.WIN, false);
            ledger.settleBet(b, SettlementOutcome.LOSS, false);
            ledger.settleBet(c, SettlementOutcome.VOID, false);
            ledger.settleBet(b, SettlementOutcome.WIN, true);
            ledger.recordExpense(new BigDecimal("20"), "Data", false);

            assertBalanceReconciles();
            ledger.verifyIntegrity();
            // 10000 + 550 + 240 - 20
            assertThat(ledger.getBalance()).isEqualByComparingTo("10770.00");
        }

        @Test
        @DisplayName("Tampered balance fails the integrity check")
        void integrityViolation() {
            ledger.placeBet(bet("M1", "500", "2.1"));
            LedgerAccountEntity account = accountRepository.findFirstByOrderByIdAsc().orElseThrow();
            account.setCurrentBalance(new BigDecimal("9999.00"));
            accountRepository.save(account);

            assertThatThrownBy(() -> ledger.verifyIntegrity())
                    .isInstanceOf(LedgerIntegrityException.class)
                    .hasMessageContaining("9500.00");
        }

        @Test
        @DisplayName("Concurrent placements never overdraw the bankroll")
        void concurrentPlacements() throws Exception {
            int threads = 20;
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<PlacementResult>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                String matchId = "C-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.placeBet(bet(matchId, "600", "2.0"));
                }));
            }
            start.countDown();

            int placed = 0;
            for (Future<PlacementResult> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).isNewBet()) {
                    placed++;
                }
            }
            executor.shutdown();

            assertThat(placed).isEqualTo(16);
            assertThat(ledger.getBalance()).isEqualByComparingTo("400.00");
            assertThat(ledger.getPendingBets()).hasSize(16);
            ledger.verifyIntegrity();
        }
    }

    @Test
    @DisplayName("Statistics summarise bets and bankroll")
    void statistics() {
        String a = ledger.placeBet(bet("M1", "500", "2.1")).getBet().getBetId();
        String b = ledger.placeBet(bet("M2", "300", "1.8")).getBet().getBetId();
        ledger.placeBet(bet("M3", "100", "2.0"));
        ledger.settleBet(a, SettlementOutcome.WIN, false);
        ledger.settleBet(b, SettlementOutcome.LOSS, false);

        LedgerStatistics stats = ledger.getStatistics();

        assertThat(stats.getTotalBets()).isEqualTo(3);
        assertThat(stats.getPendingBets()).isEqualTo(1);
        assertThat(stats.getWonBets()).isEqualTo(1);
        assertThat(stats.getLostBets()).isEqualTo(1);
        assertThat(stats.getWinRate()).isEqualByComparingTo("50.00");
        assertThat(stats.getTotalStaked()).isEqualByComparingTo("800.00");
        assertThat(stats.getTotalProfitLoss()).isEqualByComparingTo("250.00");
        assertThat(stats.getRoi()).isEqualByComparingTo("31.25");
        // 10000 - 500 + 1050 - 300 - 100
        assertThat(stats.getCurrentBalance()).isEqualByComparingTo("10150.00");
        assertThat(stats.getBankrollChangePct()).isEqualByComparingTo("1.50");
    }

    @Test
    @DisplayName("Empty ledger reports neutral statistics")
    void emptyStatistics() {
        LedgerStatistics stats = ledger.getStatistics();

        assertThat(stats.getTotalBets()).isZero();
        assertThat(stats.getWinRate()).isEqualByComparingTo("0");
        assertThat(stats.getRoi()).isEqualByComparingTo("0");
        assertThat(stats.getCurrentBalance()).isEqualByComparingTo("10000.00");
    }
}
