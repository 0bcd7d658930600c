package com.tennis.edge.ledger;

import com.tennis.edge.persistence.BetStatus;

import java.util.Locale;

public enum SettlementOutcome {
    WIN(BetStatus.WON),
    LOSS(BetStatus.LOST),
    VOID(BetStatus.VOID);

    private final BetStatus status;

    SettlementOutcome(BetStatus status) {
        this.status = status;
    }

    public BetStatus getStatus() {
        return status;
    }

    /**
     * Resolve a results-feed outcome against the backed selection: "void" voids the bet,
     * the selection's name (case-insensitive) wins it, anything else loses it.
     */
    public static SettlementOutcome resolve(String actualOutcome, String selection) {
        if (actualOutcome == null || actualOutcome.isBlank()) {
            return LOSS;
        }
        String normalized = actualOutcome.trim();
        if (normalized.toLowerCase(Locale.ROOT).equals("void")) {
            return VOID;
        }
        if (selection != null && normalized.equalsIgnoreCase(selection.trim())) {
            return WIN;
        }
        return LOSS;
    }
}
