package com.tennis.edge.persistence;

public enum BetStatus {
    PENDING,
    WON,
    LOST,
    VOID;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
