package com.tennis.edge.signal;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.OptionalDouble;

/**
 * Market-implied probability {@code 1 / current odds}.
 */
@Component
public class ImpliedOddsEstimator implements ProbabilityEstimator {

    @Override
    public OptionalDouble estimate(MatchSignal signal, Side side) {
        if (signal == null || side == null) {
            return OptionalDouble.empty();
        }
        BigDecimal odds = signal.currentOdds(side);
        if (!MatchSignal.isUsableOdds(odds)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(1.0 / odds.doubleValue());
    }
}
