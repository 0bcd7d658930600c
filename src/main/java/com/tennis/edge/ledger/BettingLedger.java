package com.tennis.edge.ledger;

import com.tennis.edge.analysis.CalibrationRecorder;
import com.tennis.edge.exception.BetNotFoundException;
import com.tennis.edge.exception.InsufficientBankrollException;
import com.tennis.edge.exception.LedgerIntegrityException;
import com.tennis.edge.persistence.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Bankroll and bet bookkeeping.
 *
 * Every mutation runs under the write lock and commits its database transaction before
 * the lock is released, so callers never observe a half-written state and a returned
 * success is durable. Reads take the read lock and hand out detached copies.
 *
 * The stored balance always equals the opening balance plus the signed sum of the
 * transaction log.
 */
@Service
@Slf4j
public class BettingLedger {

    private static final int MONEY_SCALE = 2;
    private static final int ODDS_SCALE = 6;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private final LedgerAccountRepository accountRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final BetRepository betRepository;
    private final CalibrationRecorder calibrationRecorder;
    private final TransactionTemplate transactionTemplate;
    private final BigDecimal defaultStartingBalance;
    private final boolean oneOpenBetPerMatch;

    public BettingLedger(
            LedgerAccountRepository accountRepository,
            LedgerTransactionRepository transactionRepository,
            BetRepository betRepository,
            CalibrationRecorder calibrationRecorder,
            PlatformTransactionManager transactionManager,
            @Value("${ledger.starting-balance:10000.00}") BigDecimal defaultStartingBalance,
            @Value("${ledger.one-open-bet-per-match:true}") boolean oneOpenBetPerMatch) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.betRepository = betRepository;
        this.calibrationRecorder = calibrationRecorder;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.defaultStartingBalance = money(defaultStartingBalance);
        this.oneOpenBetPerMatch = oneOpenBetPerMatch;
    }

    // ==================== Placement ====================

    /**
     * Open a bet and reserve its stake. Never throws for an overdraft: the result carries
     * INSUFFICIENT_BANKROLL and nothing is written.
     */
    public PlacementResult placeBet(BetRequest request) {
        String problem = validate(request);
        if (problem != null) {
            log.warn("Rejected bet: {}", problem);
            return PlacementResult.rejected(PlacementResult.Status.INVALID_STAKE, getBalance(), problem);
        }

        BigDecimal stake = money(request.getStake());

        return write(() -> {
            LedgerAccountEntity account = loadOrOpenAccount();

            if (oneOpenBetPerMatch) {
                List<BetEntity> open = betRepository.findPendingByMatchId(request.getMatchId());
                if (!open.isEmpty()) {
                    BetEntity existing = open.get(0);
                    log.info("Match {} already has open bet {}, not placing another",
                            request.getMatchId(), existing.getBetId());
                    return PlacementResult.existing(copy(existing), account.getCurrentBalance());
                }
            }

            if (stake.compareTo(account.getCurrentBalance()) > 0) {
                log.warn("Rejected bet on {}: stake {} exceeds balance {}",
                        request.getMatchId(), stake, account.getCurrentBalance());
                return PlacementResult.rejected(PlacementResult.Status.INSUFFICIENT_BANKROLL,
                        account.getCurrentBalance(),
                        "Stake " + stake + " exceeds available bankroll " + account.getCurrentBalance());
            }

            BetEntity bet = betRepository.save(BetEntity.builder()
                    .betId(newBetId())
                    .matchId(request.getMatchId())
                    .sport(request.getSport())
                    .surface(request.getSurface())
                    .strategy(request.getStrategy())
                    .selection(request.getSelection())
                    .odds(request.getOdds())
                    .stake(stake)
                    .confidence(request.getConfidence())
                    .expectedValuePct(request.getExpectedValuePct())
                    .placedAt(LocalDateTime.now())
                    .status(BetStatus.PENDING)
                    .build());

            append(account, TransactionType.BET, stake.negate(), bet.getBetId(),
                    "Stake on " + bet.getSelection() + " @ " + bet.getOdds(), null);

            log.info("Placed bet {}: {} on {} @ {} (match {}), balance {}",
                    bet.getBetId(), stake, bet.getSelection(), bet.getOdds(),
                    bet.getMatchId(), account.getCurrentBalance());

            return PlacementResult.placed(copy(bet), account.getCurrentBalance());
        });
    }

    // ==================== Settlement ====================

    /**
     * Settle from a results-feed outcome: "void", the selection's name for a win, anything
     * else for a loss.
     */
    public SettlementResult settleBet(String betId, String actualOutcome, boolean force) {
        return write(() -> {
            BetEntity bet = betRepository.findByBetId(betId)
                    .orElseThrow(() -> new BetNotFoundException("bet " + betId));
            return settle(bet, SettlementOutcome.resolve(actualOutcome, bet.getSelection()), actualOutcome, force);
        });
    }

    public SettlementResult settleBet(String betId, SettlementOutcome outcome, boolean force) {
        return write(() -> {
            BetEntity bet = betRepository.findByBetId(betId)
                    .orElseThrow(() -> new BetNotFoundException("bet " + betId));
            return settle(bet, outcome, describe(bet, outcome), force);
        });
    }

    /**
     * Settle the open bet for a match, or its most recent bet when none is open.
     */
    public SettlementResult settleMatch(String matchId, String actualOutcome, boolean force) {
        return write(() -> {
            List<BetEntity> bets = betRepository.findByMatchIdNewestFirst(matchId);
            if (bets.isEmpty()) {
                throw new BetNotFoundException("match " + matchId);
            }
            BetEntity bet = bets.stream()
                    .filter(BetEntity::isPending)
                    .findFirst()
                    .orElse(bets.get(0));
            return settle(bet, SettlementOutcome.resolve(actualOutcome, bet.getSelection()), actualOutcome, force);
        });
    }

    private SettlementResult settle(BetEntity bet, SettlementOutcome outcome, String actualOutcome, boolean force) {
        LedgerAccountEntity account = loadOrOpenAccount();

        if (bet.getStatus().isTerminal() && !force) {
            log.info("Bet {} already settled as {}, ignoring {}", bet.getBetId(), bet.getStatus(), outcome);
            return new SettlementResult(SettlementResult.Status.ALREADY_SETTLED, copy(bet), account.getCurrentBalance());
        }

        boolean resettle = bet.getStatus().isTerminal();
        if (resettle) {
            reverse(account, bet, outcome);
        }

        BigDecimal stake = bet.getStake();
        BigDecimal profitLoss;
        switch (outcome) {
            case WIN -> {
                BigDecimal payout = money(stake.multiply(bet.getOdds()));
                append(account, TransactionType.WIN, payout, bet.getBetId(),
                        "Won " + bet.getSelection() + " @ " + bet.getOdds(), null);
                profitLoss = payout.subtract(stake);
            }
            case LOSS -> {
                append(account, TransactionType.LOSS, money(BigDecimal.ZERO), bet.getBetId(),
                        "Lost " + bet.getSelection(), null);
                profitLoss = stake.negate();
            }
            default -> {
                append(account, TransactionType.REFUND, stake, bet.getBetId(),
                        "Void " + bet.getSelection(), null);
                profitLoss = money(BigDecimal.ZERO);
            }
        }

        bet.setStatus(outcome.getStatus());
        bet.setSettledAt(LocalDateTime.now());
        bet.setOutcome(actualOutcome);
        bet.setProfitLoss(profitLoss);
        betRepository.save(bet);

        if (outcome != SettlementOutcome.VOID) {
            calibrationRecorder.record(bet, outcome == SettlementOutcome.WIN, actualOutcome);
        }

        log.info("{} bet {} as {}: P/L {}, balance {}",
                resettle ? "Re-settled" : "Settled", bet.getBetId(), bet.getStatus(),
                profitLoss, account.getCurrentBalance());

        return new SettlementResult(resettle ? SettlementResult.Status.RESETTLED : SettlementResult.Status.SETTLED,
                copy(bet), account.getCurrentBalance());
    }

    /**
     * Undo the credit of an earlier settlement with a negative entry of the same type, and
     * drop its calibration record.
     */
    private void reverse(LedgerAccountEntity account, BetEntity bet, SettlementOutcome next) {
        BigDecimal previousCredit = credit(bet, bet.getStatus());
        BigDecimal nextCredit = credit(bet, next.getStatus());
        BigDecimal balanceAfter = account.getCurrentBalance().subtract(previousCredit).add(nextCredit);
        if (balanceAfter.signum() < 0) {
            throw new InsufficientBankrollException(previousCredit.subtract(nextCredit), account.getCurrentBalance());
        }

        if (previousCredit.signum() > 0) {
            TransactionType type = bet.getStatus() == BetStatus.WON ? TransactionType.WIN : TransactionType.REFUND;
            append(account, type, previousCredit.negate(), bet.getBetId(),
                    "Reversal of " + bet.getStatus() + " settlement", null);
        }
        calibrationRecorder.discard(bet.getBetId());

        log.warn("Forcing re-settlement of bet {} from {} to {}", bet.getBetId(), bet.getStatus(), next.getStatus());
    }

    private BigDecimal credit(BetEntity bet, BetStatus status) {
        return switch (status) {
            case WON -> money(bet.getStake().multiply(bet.getOdds()));
            case VOID -> bet.getStake();
            default -> money(BigDecimal.ZERO);
        };
    }

    // ==================== Cash Movements ====================

    public LedgerTransactionEntity deposit(BigDecimal amount, String description) {
        BigDecimal value = positive(amount, "Deposit");
        return write(() -> {
            LedgerAccountEntity account = loadOrOpenAccount();
            LedgerTransactionEntity tx = append(account, TransactionType.DEPOSIT, value, null, description, null);
            log.info("Deposit of {} recorded, balance {}", value, account.getCurrentBalance());
            return copy(tx);
        });
    }

    public LedgerTransactionEntity withdraw(BigDecimal amount, String description) {
        BigDecimal value = positive(amount, "Withdrawal");
        return write(() -> {
            LedgerAccountEntity account = loadOrOpenAccount();
            requireFunds(account, value);
            LedgerTransactionEntity tx = append(account, TransactionType.WITHDRAWAL, value.negate(), null, description, null);
            log.info("Withdrawal of {} recorded, balance {}", value, account.getCurrentBalance());
            return copy(tx);
        });
    }

    public LedgerTransactionEntity recordExpense(BigDecimal amount, String description, boolean shared) {
        BigDecimal value = positive(amount, "Expense");
        return write(() -> {
            LedgerAccountEntity account = loadOrOpenAccount();
            requireFunds(account, value);
            LedgerTransactionEntity tx = append(account, TransactionType.EXPENSE, value.negate(), null, description, shared);
            log.info("Expense of {} recorded ({}), balance {}", value, description, account.getCurrentBalance());
            return copy(tx);
        });
    }

    private void requireFunds(LedgerAccountEntity account, BigDecimal amount) {
        if (amount.compareTo(account.getCurrentBalance()) > 0) {
            throw new InsufficientBankrollException(amount, account.getCurrentBalance());
        }
    }

    // ==================== Query Methods ====================

    public BigDecimal getBalance() {
        return read(() -> currentAccount().getCurrentBalance());
    }

    public Optional<BetEntity> getBet(String betId) {
        return read(() -> betRepository.findByBetId(betId).map(this::copy));
    }

    public List<BetEntity> getBetsForMatch(String matchId) {
        return read(() -> betRepository.findByMatchIdNewestFirst(matchId).stream().map(this::copy).toList());
    }

    public List<BetEntity> getPendingBets() {
        return read(() -> betRepository.findByStatus(BetStatus.PENDING).stream().map(this::copy).toList());
    }

    public List<LedgerTransactionEntity> getTransactions() {
        return read(() -> transactionRepository.findAllByOrderByIdAsc().stream().map(this::copy).toList());
    }

    public List<CalibrationRecordEntity> getCalibrationData(int limit) {
        return read(() -> calibrationRecorder.getCalibrationData(limit));
    }

    /**
     * Consistent copy of account, bets and transaction log.
     */
    public LedgerSnapshot snapshot() {
        return read(() -> {
            LedgerAccountEntity account = currentAccount();
            return new LedgerSnapshot(
                    account.getStartingBalance(),
                    account.getCurrentBalance(),
                    account.getPeakBalance(),
                    account.getOpenedAt(),
                    betRepository.findAllByOrderByIdAsc().stream().map(this::copy).toList(),
                    transactionRepository.findAllByOrderByIdAsc().stream().map(this::copy).toList(),
                    LocalDateTime.now());
        });
    }

    public LedgerStatistics getStatistics() {
        return LedgerStatistics.from(snapshot());
    }

    /**
     * Reconcile the stored balance with the transaction log.
     *
     * @throws LedgerIntegrityException when they disagree
     */
    public void verifyIntegrity() {
        read(() -> {
            LedgerAccountEntity account = currentAccount();
            BigDecimal expected = money(account.getStartingBalance().add(transactionRepository.sumAllAmounts()));
            if (expected.compareTo(account.getCurrentBalance()) != 0) {
                log.error("Ledger integrity check failed: expected {}, stored {}", expected, account.getCurrentBalance());
                throw new LedgerIntegrityException(expected, account.getCurrentBalance());
            }
            return null;
        });
    }

    // ==================== Locking ====================

    /**
     * Run an action under the ledger's write lock inside a single committed transaction.
     */
    public <T> T runExclusive(Supplier<T> action) {
        return write(action);
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return transactionTemplate.execute(status -> action.get());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Internals ====================

    private LedgerTransactionEntity append(LedgerAccountEntity account, TransactionType type, BigDecimal amount,
                                           String betId, String description, Boolean shared) {
        BigDecimal signed = money(amount);
        BigDecimal balance = account.getCurrentBalance().add(signed);
        LocalDateTime now = LocalDateTime.now();

        account.setCurrentBalance(balance);
        if (balance.compareTo(account.getPeakBalance()) > 0) {
            account.setPeakBalance(balance);
        }
        account.setUpdatedAt(now);
        accountRepository.save(account);

        return transactionRepository.save(LedgerTransactionEntity.builder()
                .type(type)
                .amount(signed)
                .balanceAfter(balance)
                .betId(betId)
                .description(description)
                .shared(shared)
                .createdAt(now)
                .build());
    }

    private LedgerAccountEntity loadOrOpenAccount() {
        return accountRepository.findFirstByOrderByIdAsc()
                .orElseGet(() -> {
                    log.info("Opening ledger with starting balance {}", defaultStartingBalance);
                    return accountRepository.save(LedgerAccountEntity.open(defaultStartingBalance));
                });
    }

    // Unsaved default when no account exists yet, so reads never write
    private LedgerAccountEntity currentAccount() {
        return accountRepository.findFirstByOrderByIdAsc()
                .orElseGet(() -> LedgerAccountEntity.open(defaultStartingBalance));
    }

    private static String validate(BetRequest request) {
        if (request == null) {
            return "bet request is missing";
        }
        if (request.getMatchId() == null || request.getMatchId().isBlank()) {
            return "match id is missing";
        }
        if (request.getSelection() == null || request.getSelection().isBlank()) {
            return "selection is missing";
        }
        if (request.getOdds() == null || request.getOdds().compareTo(BigDecimal.ONE) <= 0) {
            return "odds must be greater than 1.0";
        }
        if (request.getOdds().stripTrailingZeros().scale() > ODDS_SCALE) {
            return "odds may carry at most " + ODDS_SCALE + " decimals";
        }
        if (request.getStake() == null || money(request.getStake()).signum() <= 0) {
            return "stake must be positive";
        }
        if (request.getConfidence() < 0.0 || request.getConfidence() > 1.0) {
            return "confidence must be within 0-1";
        }
        return null;
    }

    private static BigDecimal positive(BigDecimal amount, String what) {
        if (amount == null || money(amount).signum() <= 0) {
            throw new IllegalArgumentException(what + " amount must be positive");
        }
        return money(amount);
    }

    private static String describe(BetEntity bet, SettlementOutcome outcome) {
        return switch (outcome) {
            case WIN -> bet.getSelection();
            case VOID -> "void";
            case LOSS -> "lost";
        };
    }

    private static String newBetId() {
        return "BET-" + UUID.randomUUID().toString().replace("-", "").substring(0, 16).toUpperCase();
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private BetEntity copy(BetEntity bet) {
        return bet.toBuilder().build();
    }

    private LedgerTransactionEntity copy(LedgerTransactionEntity tx) {
        return tx.toBuilder().build();
    }
}
