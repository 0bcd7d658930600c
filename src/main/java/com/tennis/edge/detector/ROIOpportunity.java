package com.tennis.edge.detector;

import com.tennis.edge.signal.Side;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A quantified betting edge produced by one detector for one match.
 */
@Value
@Builder
public class ROIOpportunity {

    String matchId;
    String sport;
    OpportunityType opportunityType;
    String strategy;

    // What to back and at which price
    Side side;
    String selection;
    BigDecimal odds;

    BigDecimal expectedValuePct;
    double confidenceScore;
    String reasoning;

    // Capture time of the signal this was derived from
    LocalDateTime detectedAt;

    public boolean meetsGate(BigDecimal minEvPct, double minConfidence) {
        return expectedValuePct != null
                && expectedValuePct.compareTo(minEvPct) >= 0
                && confidenceScore >= minConfidence;
    }
}
