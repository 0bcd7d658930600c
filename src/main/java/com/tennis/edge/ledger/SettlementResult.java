package com.tennis.edge.ledger;

import com.tennis.edge.persistence.BetEntity;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class SettlementResult {

    public enum Status {
        SETTLED,
        RESETTLED,
        ALREADY_SETTLED
    }

    Status status;
    BetEntity bet;
    BigDecimal balanceAfter;

    public boolean isChanged() {
        return status != Status.ALREADY_SETTLED;
    }
}
