package com.tennis.edge.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "calibration_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_calibration_bet_time",
                columnNames = {"bet_id", "match_id", "recorded_at"}),
        indexes = @Index(name = "idx_calibration_bet", columnList = "bet_id"))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bet_id", length = 40)
    private String betId;

    @Column(name = "match_id", length = 100, nullable = false)
    private String matchId;

    @Column(name = "surface", length = 30)
    private String surface;

    @Column(name = "predicted_confidence", nullable = false)
    private double predictedConfidence;

    @Column(name = "predicted_outcome", length = 200)
    private String predictedOutcome;

    @Column(name = "actual_outcome", length = 200)
    private String actualOutcome;

    @Column(name = "correct", nullable = false)
    private boolean correct;

    // |confidence - 1{correct}|
    @Column(name = "calibration_error", nullable = false)
    private double calibrationError;

    @Column(name = "confidence_bucket", length = 20, nullable = false)
    private String confidenceBucket;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
