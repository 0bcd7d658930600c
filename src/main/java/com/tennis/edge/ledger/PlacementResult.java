package com.tennis.edge.ledger;

import com.tennis.edge.persistence.BetEntity;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PlacementResult {

    public enum Status {
        PLACED,
        EXISTING,               // open bet already held for the match
        INSUFFICIENT_BANKROLL,
        INVALID_STAKE
    }

    Status status;
    BetEntity bet;
    BigDecimal balanceAfter;
    String message;

    public boolean isSuccess() {
        return status == Status.PLACED || status == Status.EXISTING;
    }

    public boolean isNewBet() {
        return status == Status.PLACED;
    }

    static PlacementResult placed(BetEntity bet, BigDecimal balanceAfter) {
        return new PlacementResult(Status.PLACED, bet, balanceAfter, "Bet placed");
    }

    static PlacementResult existing(BetEntity bet, BigDecimal balance) {
        return new PlacementResult(Status.EXISTING, bet, balance,
                "Open bet " + bet.getBetId() + " already held for match " + bet.getMatchId());
    }

    static PlacementResult rejected(Status status, BigDecimal balance, String message) {
        return new PlacementResult(status, null, balance, message);
    }
}
