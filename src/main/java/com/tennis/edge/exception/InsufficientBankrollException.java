package com.tennis.edge.exception;

import java.math.BigDecimal;

public class InsufficientBankrollException extends LedgerException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientBankrollException(BigDecimal requested, BigDecimal available) {
        super("Requested " + requested + " exceeds available bankroll " + available);
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
