package com.tennis.edge.detector;

import com.tennis.edge.signal.H2HRecord;
import com.tennis.edge.signal.MatchSignal;
import com.tennis.edge.signal.Side;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Backs a side that dominates the head-to-head record, preferring the record on the
 * match surface over the overall one.
 *
 * Dominance: at least {@code min-dominance} wins without a loss, or a win rate of at
 * least {@code min-win-rate} over at least {@code min-meetings} meetings.
 * confidence = 0.5 × min(meetings / 10, 1) + 0.5 × winRate
 */
@Component
@Slf4j
public class H2HDetector implements OpportunityDetector {

    private static final double FULL_SAMPLE_MEETINGS = 10.0;

    private final int minDominance;
    private final double minWinRate;
    private final int minMeetings;
    private final double minEvPct;

    public H2HDetector(
            @Value("${detector.h2h.min-dominance:4}") int minDominance,
            @Value("${detector.h2h.min-win-rate:0.75}") double minWinRate,
            @Value("${detector.h2h.min-meetings:3}") int minMeetings,
            @Value("${detector.h2h.min-ev-pct:5}") double minEvPct) {
        this.minDominance = minDominance;
        this.minWinRate = minWinRate;
        this.minMeetings = minMeetings;
        this.minEvPct = minEvPct;
    }

    @Override
    public Optional<ROIOpportunity> detect(MatchSignal signal) {
        if (signal == null || signal.getMatchId() == null) {
            return Optional.empty();
        }

        Optional<H2HRecord> h2h = signal.h2hForSurface();
        if (h2h.isEmpty() || h2h.get().isEmpty() || h2h.get().winsA() < 0 || h2h.get().winsB() < 0) {
            return Optional.empty();
        }
        H2HRecord record = h2h.get();

        Optional<Side> dominant = findDominantSide(record);
        if (dominant.isEmpty()) {
            return Optional.empty();
        }

        return createOpportunity(signal, dominant.get(), record);
    }

    private Optional<Side> findDominantSide(H2HRecord record) {
        if (record.winsA() >= minDominance && record.winsB() == 0) {
            return Optional.of(Side.A);
        }
        if (record.winsB() >= minDominance && record.winsA() == 0) {
            return Optional.of(Side.B);
        }

        int meetings = record.meetings();
        if (meetings >= minMeetings) {
            if ((double) record.winsA() / meetings >= minWinRate) {
                return Optional.of(Side.A);
            }
            if ((double) record.winsB() / meetings >= minWinRate) {
                return Optional.of(Side.B);
            }
        }
        return Optional.empty();
    }

    private Optional<ROIOpportunity> createOpportunity(MatchSignal signal, Side favored, H2HRecord record) {
        BigDecimal currentOdds = signal.currentOdds(favored);
        if (!MatchSignal.isUsableOdds(currentOdds)) {
            return Optional.empty();
        }

        int wins = record.winsFor(favored);
        int losses = record.lossesFor(favored);
        double winRate = (double) wins / (wins + losses);
        double odds = currentOdds.doubleValue();
        double evPct = (odds * winRate - 1.0) * 100.0;

        if (evPct < minEvPct) {
            log.debug("H2H rejected for {}: EV {}% below {}%", signal.getMatchId(), evPct, minEvPct);
            return Optional.empty();
        }

        double sampleFactor = Math.min((wins + losses) / FULL_SAMPLE_MEETINGS, 1.0);
        double confidence = sampleFactor * 0.5 + winRate * 0.5;

        String player = signal.playerName(favored);
        String surfaceText = signal.hasSurfaceH2H() ? " on " + signal.getSurface().toLowerCase(Locale.ROOT) : "";
        String reasoning = String.format(Locale.ROOT,
                "%s dominates H2H%s (%d-%d). Historical edge suggests value at current odds %.2f.",
                player, surfaceText, wins, losses, odds);

        log.debug("H2H opportunity for {}: {} ({}-{}) EV={}%", signal.getMatchId(), player, wins, losses, evPct);

        return Optional.of(ROIOpportunity.builder()
                .matchId(signal.getMatchId())
                .sport(signal.getSport())
                .opportunityType(OpportunityType.H2H_IMBALANCE)
                .strategy(OpportunityType.H2H_IMBALANCE.getStrategyName())
                .side(favored)
                .selection(player)
                .odds(currentOdds)
                .expectedValuePct(BigDecimal.valueOf(evPct).setScale(2, RoundingMode.HALF_UP))
                .confidenceScore(confidence)
                .reasoning(reasoning)
                .detectedAt(signal.getCapturedAt())
                .build());
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.H2H_IMBALANCE;
    }
}
