package com.tennis.edge.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Predicted confidence versus observed outcomes. An empty record set yields a zeroed
 * report with every bucket marked INSUFFICIENT_DATA.
 */
@Value
@Builder
public class CalibrationReport {

    int totalRecords;
    int correctPredictions;

    double overallAccuracy;
    double averageConfidence;
    double averageCalibrationError;
    double calibrationGap;
    double reliability;        // 1 - min(gap, 1)
    double brierScore;         // mean((confidence - correct)^2), lower is better

    List<BucketCalibration> buckets;
    List<CalibrationIssue> issues;
    List<String> recommendations;

    public boolean hasData() {
        return totalRecords > 0;
    }

    public long countIssues(CalibrationIssue.Severity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }
}
