package com.tennis.edge.exception;

public class BetNotFoundException extends LedgerException {

    private final String reference;

    public BetNotFoundException(String reference) {
        super("No bet found for " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
