package com.tennis.edge.detector;

import com.tennis.edge.signal.MatchSignal;

import java.util.Optional;

/**
 * Pure signal-to-opportunity function. Implementations hold no mutable state, perform
 * no I/O and never throw on missing or malformed signal fields: they return empty instead.
 */
public interface OpportunityDetector {

    Optional<ROIOpportunity> detect(MatchSignal signal);

    OpportunityType getType();
}
