package com.tennis.edge.ledger;

import com.tennis.edge.persistence.BetEntity;
import com.tennis.edge.persistence.LedgerTransactionEntity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Copy-on-read view of the ledger taken under the read lock. The lists are detached
 * copies; changing them does not touch the ledger.
 */
public record LedgerSnapshot(
        BigDecimal startingBalance,
        BigDecimal currentBalance,
        BigDecimal peakBalance,
        LocalDateTime openedAt,
        List<BetEntity> bets,
        List<LedgerTransactionEntity> transactions,
        LocalDateTime takenAt
) {
    public List<BetEntity> pendingBets() {
        return bets.stream().filter(BetEntity::isPending).toList();
    }

    public List<BetEntity> settledBets() {
        return bets.stream().filter(b -> !b.isPending()).toList();
    }
}
