package com.tennis.edge.ledger;

import com.tennis.edge.detector.ROIOpportunity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Everything the ledger needs to open a bet.
 */
@Value
@Builder
public class BetRequest {

    String matchId;
    String sport;
    String surface;
    String strategy;
    String selection;
    BigDecimal odds;
    BigDecimal stake;
    double confidence;
    BigDecimal expectedValuePct;

    public static BetRequest from(ROIOpportunity opportunity, String surface, BigDecimal stake) {
        return BetRequest.builder()
                .matchId(opportunity.getMatchId())
                .sport(opportunity.getSport())
                .surface(surface)
                .strategy(opportunity.getStrategy())
                .selection(opportunity.getSelection())
                .odds(opportunity.getOdds())
                .stake(stake)
                .confidence(opportunity.getConfidenceScore())
                .expectedValuePct(opportunity.getExpectedValuePct())
                .build();
    }
}
