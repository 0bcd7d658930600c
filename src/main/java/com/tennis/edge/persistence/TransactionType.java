package com.tennis.edge.persistence;

/**
 * Kinds of entries in the ledger transaction log. Amounts are signed: money leaving the
 * bankroll is negative.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    BET,        // stake reserved at placement
    WIN,        // stake × odds credited on a winning bet
    LOSS,       // zero-amount marker, the stake was already debited
    REFUND,     // stake returned on a void bet
    EXPENSE
}
