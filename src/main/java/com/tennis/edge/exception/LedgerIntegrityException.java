package com.tennis.edge.exception;

import java.math.BigDecimal;

/**
 * The stored balance no longer reconciles with the transaction log.
 */
public class LedgerIntegrityException extends LedgerException {

    private final BigDecimal expected;
    private final BigDecimal actual;

    public LedgerIntegrityException(BigDecimal expected, BigDecimal actual) {
        super("Ledger out of balance: expected " + expected + " from transaction log, found " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public BigDecimal getExpected() {
        return expected;
    }

    public BigDecimal getActual() {
        return actual;
    }
}
