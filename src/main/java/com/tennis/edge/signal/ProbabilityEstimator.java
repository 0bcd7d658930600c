package com.tennis.edge.signal;

import java.util.OptionalDouble;

/**
 * Estimates the probability that a side wins the match.
 * A statistical or ML model can be plugged in behind this interface.
 */
public interface ProbabilityEstimator {

    /**
     * @return win probability in [0, 1], or empty when the estimator has no view
     */
    OptionalDouble estimate(MatchSignal signal, Side side);
}
