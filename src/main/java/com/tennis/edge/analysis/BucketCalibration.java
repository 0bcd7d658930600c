package com.tennis.edge.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BucketCalibration {

    public enum Status {
        ANALYZED,
        INSUFFICIENT_DATA
    }

    ConfidenceBucket bucket;
    Status status;
    int samples;

    // Populated only when ANALYZED
    double averageConfidence;
    double actualWinRate;
    double averageCalibrationError;
    double gap;
    boolean calibrated;

    public String getLabel() {
        return bucket.getLabel();
    }
}
