package com.tennis.edge.pipeline;

import com.tennis.edge.detector.OpportunityAggregator;
import com.tennis.edge.detector.OpportunityDetector;
import com.tennis.edge.detector.ROIOpportunity;
import com.tennis.edge.ledger.BetRequest;
import com.tennis.edge.ledger.BettingLedger;
import com.tennis.edge.ledger.PlacementResult;
import com.tennis.edge.ledger.SettlementResult;
import com.tennis.edge.signal.MatchSignal;
import com.tennis.edge.signal.SignalCache;
import com.tennis.edge.staking.StakeSizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Signal to bet: detectors, aggregation, stake sizing and ledger placement.
 *
 * Detection is stateless and runs in parallel across a batch; placement goes through
 * the ledger one signal at a time in input order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpportunityPipeline {

    private final List<OpportunityDetector> detectors;
    private final OpportunityAggregator aggregator;
    private final StakeSizer stakeSizer;
    private final BettingLedger ledger;
    private final SignalCache signalCache;

    public ScanResult process(MatchSignal signal) {
        if (signal == null) {
            return ScanResult.builder()
                    .status(ScanResult.Status.INVALID_SIGNAL)
                    .opportunities(List.of())
                    .validationErrors(List.of("signal is missing"))
                    .build();
        }
        return place(signal, detect(signal));
    }

    public List<ScanResult> processBatch(List<MatchSignal> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }

        List<List<ROIOpportunity>> detected = signals.parallelStream()
                .map(s -> s == null ? List.<ROIOpportunity>of() : detect(s))
                .toList();

        List<ScanResult> results = new ArrayList<>(signals.size());
        for (int i = 0; i < signals.size(); i++) {
            results.add(signals.get(i) == null ? process(null) : place(signals.get(i), detected.get(i)));
        }

        long placed = results.stream().filter(ScanResult::isPlaced).count();
        log.info("Processed {} signals, {} bets placed", signals.size(), placed);
        return results;
    }

    /**
     * Settle the match's bet from a results-feed outcome and forget its opening odds.
     */
    public SettlementResult recordResult(String matchId, String actualOutcome) {
        SettlementResult result = ledger.settleMatch(matchId, actualOutcome, false);
        signalCache.evict(matchId);
        return result;
    }

    /**
     * Run every detector against the signal. Invalid signals yield nothing.
     */
    List<ROIOpportunity> detect(MatchSignal signal) {
        if (!signal.validate().isEmpty()) {
            return List.of();
        }
        MatchSignal enriched = signalCache.withOpeningOdds(signal);

        List<ROIOpportunity> found = new ArrayList<>();
        for (OpportunityDetector detector : detectors) {
            try {
                detector.detect(enriched).ifPresent(found::add);
            } catch (RuntimeException e) {
                log.error("{} detector failed on match {}: {}",
                        detector.getType(), signal.getMatchId(), e.getMessage(), e);
            }
        }
        return found;
    }

    private ScanResult place(MatchSignal signal, List<ROIOpportunity> opportunities) {
        List<String> errors = signal.validate();
        if (!errors.isEmpty()) {
            log.warn("Skipping invalid signal {}: {}", signal.getMatchId(), errors);
            return ScanResult.builder()
                    .matchId(signal.getMatchId())
                    .status(ScanResult.Status.INVALID_SIGNAL)
                    .opportunities(List.of())
                    .validationErrors(errors)
                    .build();
        }

        ScanResult.ScanResultBuilder result = ScanResult.builder()
                .matchId(signal.getMatchId())
                .opportunities(opportunities)
                .validationErrors(List.of());

        Optional<ROIOpportunity> selected = aggregator.select(opportunities);
        if (selected.isEmpty()) {
            return result.status(ScanResult.Status.NO_OPPORTUNITY).build();
        }
        ROIOpportunity opportunity = selected.get();
        result.selected(opportunity);

        BigDecimal stake = stakeSizer.size(opportunity.getConfidenceScore(), opportunity.getOdds(), ledger.getBalance());
        result.stake(stake);
        if (stake.signum() <= 0) {
            log.debug("Zero stake for {} on {}, not placing", opportunity.getStrategy(), signal.getMatchId());
            return result.status(ScanResult.Status.ZERO_STAKE).build();
        }

        PlacementResult placement = ledger.placeBet(BetRequest.from(opportunity, signal.getSurface(), stake));
        result.placement(placement);

        ScanResult.Status status = switch (placement.getStatus()) {
            case PLACED -> ScanResult.Status.PLACED;
            case EXISTING -> ScanResult.Status.EXISTING;
            default -> ScanResult.Status.REJECTED;
        };
        return result.status(status).build();
    }
}
