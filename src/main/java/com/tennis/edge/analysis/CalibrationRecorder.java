package com.tennis.edge.analysis;

import com.tennis.edge.persistence.BetEntity;
import com.tennis.edge.persistence.CalibrationRecordEntity;
import com.tennis.edge.persistence.CalibrationRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Records predicted confidence against actual outcome for every decided bet, and
 * analyses how well the confidence scores match observed win rates.
 */
@Service
@Slf4j
public class CalibrationRecorder {

    private static final String UNKNOWN_SURFACE = "unknown";

    private final CalibrationRecordRepository recordRepository;
    private final int minBucketSamples;
    private final double calibratedGap;

    public CalibrationRecorder(
            CalibrationRecordRepository recordRepository,
            @Value("${calibration.min-bucket-samples:5}") int minBucketSamples,
            @Value("${calibration.calibrated-gap:0.05}") double calibratedGap) {
        this.recordRepository = recordRepository;
        this.minBucketSamples = minBucketSamples;
        this.calibratedGap = calibratedGap;
    }

    // ==================== Recording ====================

    /**
     * Store a calibration record for a settled bet. Called by the ledger inside its
     * settlement transaction.
     */
    public CalibrationRecordEntity record(BetEntity bet, boolean correct, String actualOutcome) {
        double confidence = bet.getConfidence();
        CalibrationRecordEntity record = CalibrationRecordEntity.builder()
                .betId(bet.getBetId())
                .matchId(bet.getMatchId())
                .surface(bet.getSurface())
                .predictedConfidence(confidence)
                .predictedOutcome(bet.getSelection())
                .actualOutcome(actualOutcome)
                .correct(correct)
                .calibrationError(Math.abs(confidence - (correct ? 1.0 : 0.0)))
                .confidenceBucket(ConfidenceBucket.of(confidence).getLabel())
                .recordedAt(LocalDateTime.now())
                .build();

        CalibrationRecordEntity saved = recordRepository.save(record);
        log.debug("Calibration record for {}: confidence={}, correct={}, bucket={}",
                bet.getMatchId(), confidence, correct, saved.getConfidenceBucket());
        return saved;
    }

    /**
     * Drop the records of a bet that is being re-settled.
     */
    public int discard(String betId) {
        int removed = recordRepository.deleteByBetId(betId);
        if (removed > 0) {
            log.info("Discarded {} calibration record(s) for bet {}", removed, betId);
        }
        return removed;
    }

    // ==================== Query Methods ====================

    /**
     * Most recent records, newest first.
     */
    public List<CalibrationRecordEntity> getCalibrationData(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return recordRepository.findLatest(PageRequest.of(0, limit));
    }

    public CalibrationReport analyze() {
        return analyze(recordRepository.findAllByOrderByIdAsc());
    }

    /**
     * Same analysis per surface. Records without a surface are grouped as "unknown".
     */
    public Map<String, CalibrationReport> analyzeBySurface() {
        Map<String, List<CalibrationRecordEntity>> bySurface = recordRepository.findAllByOrderByIdAsc().stream()
                .collect(Collectors.groupingBy(
                        r -> r.getSurface() != null ? r.getSurface().toLowerCase(Locale.ROOT) : UNKNOWN_SURFACE,
                        TreeMap::new, Collectors.toList()));

        Map<String, CalibrationReport> reports = new LinkedHashMap<>();
        bySurface.forEach((surface, records) -> reports.put(surface, analyze(records)));
        return reports;
    }

    // ==================== Analysis ====================

    CalibrationReport analyze(List<CalibrationRecordEntity> records) {
        List<BucketCalibration> buckets = new ArrayList<>();
        for (ConfidenceBucket bucket : ConfidenceBucket.values()) {
            List<CalibrationRecordEntity> inBucket = records.stream()
                    .filter(r -> bucket.contains(r.getPredictedConfidence()))
                    .toList();
            buckets.add(analyzeBucket(bucket, inBucket));
        }

        if (records.isEmpty()) {
            return CalibrationReport.builder()
                    .buckets(buckets)
                    .issues(List.of())
                    .recommendations(List.of())
                    .build();
        }

        int total = records.size();
        int correct = (int) records.stream().filter(CalibrationRecordEntity::isCorrect).count();
        double accuracy = (double) correct / total;
        double avgConfidence = average(records, CalibrationRecordEntity::getPredictedConfidence);
        double avgError = average(records, CalibrationRecordEntity::getCalibrationError);
        double gap = Math.abs(avgConfidence - accuracy);
        double brier = records.stream()
                .mapToDouble(r -> {
                    double diff = r.getPredictedConfidence() - (r.isCorrect() ? 1.0 : 0.0);
                    return diff * diff;
                })
                .average()
                .orElse(0.0);

        List<CalibrationIssue> issues = identifyIssues(buckets);

        return CalibrationReport.builder()
                .totalRecords(total)
                .correctPredictions(correct)
                .overallAccuracy(accuracy)
                .averageConfidence(avgConfidence)
                .averageCalibrationError(avgError)
                .calibrationGap(gap)
                .reliability(1.0 - Math.min(gap, 1.0))
                .brierScore(brier)
                .buckets(buckets)
                .issues(issues)
                .recommendations(recommend(gap, brier, issues))
                .build();
    }

    private BucketCalibration analyzeBucket(ConfidenceBucket bucket, List<CalibrationRecordEntity> records) {
        if (records.size() < minBucketSamples || records.isEmpty()) {
            return BucketCalibration.builder()
                    .bucket(bucket)
                    .status(BucketCalibration.Status.INSUFFICIENT_DATA)
                    .samples(records.size())
                    .build();
        }

        double avgConfidence = average(records, CalibrationRecordEntity::getPredictedConfidence);
        double winRate = records.stream().filter(CalibrationRecordEntity::isCorrect).count() / (double) records.size();
        double gap = Math.abs(avgConfidence - winRate);

        return BucketCalibration.builder()
                .bucket(bucket)
                .status(BucketCalibration.Status.ANALYZED)
                .samples(records.size())
                .averageConfidence(avgConfidence)
                .actualWinRate(winRate)
                .averageCalibrationError(average(records, CalibrationRecordEntity::getCalibrationError))
                .gap(gap)
                .calibrated(gap < calibratedGap)
                .build();
    }

    private List<CalibrationIssue> identifyIssues(List<BucketCalibration> buckets) {
        List<CalibrationIssue> issues = new ArrayList<>();
        for (BucketCalibration bucket : buckets) {
            if (bucket.getStatus() != BucketCalibration.Status.ANALYZED || bucket.isCalibrated()) {
                continue;
            }
            CalibrationIssue.Type type = bucket.getAverageConfidence() > bucket.getActualWinRate()
                    ? CalibrationIssue.Type.OVERCONFIDENT
                    : CalibrationIssue.Type.UNDERCONFIDENT;
            issues.add(new CalibrationIssue(bucket.getBucket(), type,
                    CalibrationIssue.severityOf(bucket.getGap()), bucket.getGap(),
                    bucket.getAverageConfidence(), bucket.getActualWinRate()));
        }
        return issues;
    }

    private List<String> recommend(double gap, double brier, List<CalibrationIssue> issues) {
        List<String> recommendations = new ArrayList<>();

        if (gap > 0.10) {
            recommendations.add(String.format(Locale.ROOT,
                    "High overall calibration gap (%.1f%%). Retrain the probability estimator.", gap * 100));
        } else if (gap > 0.05) {
            recommendations.add(String.format(Locale.ROOT,
                    "Moderate calibration gap (%.1f%%). Adjust confidence thresholds.", gap * 100));
        }

        long high = issues.stream().filter(i -> i.getSeverity() == CalibrationIssue.Severity.HIGH).count();
        if (high > 0) {
            recommendations.add(high + " high-severity bucket(s). Focus on these confidence ranges.");
        }

        long over = issues.stream().filter(i -> i.getType() == CalibrationIssue.Type.OVERCONFIDENT).count();
        if (over > 0) {
            recommendations.add("Overconfident in " + over + " bucket(s). Scale confidence scores down.");
        }
        long under = issues.size() - over;
        if (under > 0) {
            recommendations.add("Underconfident in " + under + " bucket(s). Scale confidence scores up.");
        }

        if (brier > 0.25) {
            recommendations.add(String.format(Locale.ROOT, "High Brier score (%.4f).", brier));
        } else if (brier > 0.20) {
            recommendations.add(String.format(Locale.ROOT, "Moderate Brier score (%.4f).", brier));
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Confidence scores are well calibrated.");
        }
        return recommendations;
    }

    private static double average(List<CalibrationRecordEntity> records,
                                  ToDoubleFunction<CalibrationRecordEntity> field) {
        return records.stream().mapToDouble(field).average().orElse(0.0);
    }
}
