package com.tennis.edge.analysis;

/**
 * Discretised confidence ranges. Lower bound inclusive, upper bound exclusive.
 */
public enum ConfidenceBucket {
    BELOW_60("<0.60", 0.0, 0.60),
    FROM_60_TO_65("0.60-0.65", 0.60, 0.65),
    FROM_65_TO_70("0.65-0.70", 0.65, 0.70),
    FROM_70_TO_75("0.70-0.75", 0.70, 0.75),
    FROM_75_TO_80("0.75-0.80", 0.75, 0.80),
    FROM_80("0.80+", 0.80, Double.POSITIVE_INFINITY);

    private final String label;
    private final double lower;
    private final double upper;

    ConfidenceBucket(String label, double lower, double upper) {
        this.label = label;
        this.lower = lower;
        this.upper = upper;
    }

    public String getLabel() {
        return label;
    }

    public boolean contains(double confidence) {
        return confidence >= lower && confidence < upper;
    }

    public static ConfidenceBucket of(double confidence) {
        for (ConfidenceBucket bucket : values()) {
            if (bucket.contains(confidence)) {
                return bucket;
            }
        }
        return BELOW_60;
    }

    public static ConfidenceBucket fromLabel(String label) {
        for (ConfidenceBucket bucket : values()) {
            if (bucket.label.equals(label)) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Unknown confidence bucket: " + label);
    }
}
