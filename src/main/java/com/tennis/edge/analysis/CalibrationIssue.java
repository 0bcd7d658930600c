package com.tennis.edge.analysis;

import lombok.Value;

@Value
public class CalibrationIssue {

    public enum Type {
        OVERCONFIDENT,
        UNDERCONFIDENT
    }

    public enum Severity {
        HIGH,
        MEDIUM,
        LOW
    }

    ConfidenceBucket bucket;
    Type type;
    Severity severity;
    double gap;
    double averageConfidence;
    double actualWinRate;

    static Severity severityOf(double gap) {
        if (gap > 0.10) return Severity.HIGH;
        if (gap > 0.05) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
