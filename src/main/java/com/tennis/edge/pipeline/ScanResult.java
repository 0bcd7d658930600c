package com.tennis.edge.pipeline;

import com.tennis.edge.detector.ROIOpportunity;
import com.tennis.edge.ledger.PlacementResult;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of running one match signal through detection, sizing and placement.
 */
@Data
@Builder
public class ScanResult {

    public enum Status {
        INVALID_SIGNAL,
        NO_OPPORTUNITY,
        ZERO_STAKE,
        PLACED,
        EXISTING,
        REJECTED
    }

    private String matchId;
    private Status status;

    // Every detector hit, before aggregation
    private List<ROIOpportunity> opportunities;
    private ROIOpportunity selected;

    private BigDecimal stake;
    private PlacementResult placement;

    private List<String> validationErrors;

    public boolean isPlaced() {
        return status == Status.PLACED;
    }
}
