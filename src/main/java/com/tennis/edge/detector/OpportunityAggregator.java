package com.tennis.edge.detector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Picks at most one opportunity per match: the highest EV among those clearing the
 * EV/confidence gate, ties broken by detector priority.
 */
@Component
@Slf4j
public class OpportunityAggregator {

    private final double minConfidence;
    private final BigDecimal minEvPct;
    private final List<OpportunityType> priority;

    public OpportunityAggregator(
            @Value("${aggregator.min-confidence:0.60}") double minConfidence,
            @Value("${aggregator.min-ev-pct:5}") BigDecimal minEvPct,
            @Value("${aggregator.priority:MOMENTUM_SHIFT,H2H_IMBALANCE,FATIGUE_EXPLOIT}") List<OpportunityType> priority) {
        this.minConfidence = minConfidence;
        this.minEvPct = minEvPct;
        this.priority = completePriority(priority);
    }

    /**
     * Select the winner among opportunities for a single match.
     */
    public Optional<ROIOpportunity> select(Collection<ROIOpportunity> opportunities) {
        if (opportunities == null || opportunities.isEmpty()) {
            return Optional.empty();
        }

        Comparator<ROIOpportunity> byEv = Comparator.comparing(ROIOpportunity::getExpectedValuePct);
        Comparator<ROIOpportunity> byPriority = Comparator.comparingInt(o -> -priorityRank(o.getOpportunityType()));

        Optional<ROIOpportunity> winner = opportunities.stream()
                .filter(Objects::nonNull)
                .filter(o -> o.meetsGate(minEvPct, minConfidence))
                .max(byEv.thenComparing(byPriority));

        if (winner.isEmpty()) {
            log.debug("No opportunity cleared the gate (EV >= {}%, confidence >= {}) out of {}",
                    minEvPct, minConfidence, opportunities.size());
        }
        return winner;
    }

    /**
     * Group opportunities by match and select a winner for each. Matches are returned in
     * first-seen order.
     */
    public Map<String, ROIOpportunity> selectPerMatch(Collection<ROIOpportunity> opportunities) {
        Map<String, List<ROIOpportunity>> byMatch = opportunities.stream()
                .filter(o -> o != null && o.getMatchId() != null)
                .collect(Collectors.groupingBy(ROIOpportunity::getMatchId, LinkedHashMap::new, Collectors.toList()));

        Map<String, ROIOpportunity> winners = new LinkedHashMap<>();
        byMatch.forEach((matchId, candidates) ->
                select(candidates).ifPresent(o -> winners.put(matchId, o)));
        return winners;
    }

    public List<OpportunityType> getPriority() {
        return Collections.unmodifiableList(priority);
    }

    private int priorityRank(OpportunityType type) {
        int index = priority.indexOf(type);
        return index < 0 ? priority.size() : index;
    }

    // Types missing from the configured order rank after the listed ones
    private static List<OpportunityType> completePriority(List<OpportunityType> configured) {
        List<OpportunityType> order = new ArrayList<>();
        if (configured != null) {
            for (OpportunityType type : configured) {
                if (type != null && !order.contains(type)) {
                    order.add(type);
                }
            }
        }
        for (OpportunityType type : OpportunityType.values()) {
            if (!order.contains(type)) {
                order.add(type);
            }
        }
        return order;
    }
}
