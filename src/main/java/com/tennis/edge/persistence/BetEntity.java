package com.tennis.edge.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "bet", indexes = {
        @Index(name = "idx_bet_match", columnList = "match_id"),
        @Index(name = "idx_bet_status", columnList = "status")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BetEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bet_id", length = 40, nullable = false, unique = true)
    private String betId;

    @Column(name = "match_id", length = 100, nullable = false)
    private String matchId;

    @Column(name = "sport", length = 50)
    private String sport;

    @Column(name = "surface", length = 30)
    private String surface;

    @Column(name = "strategy", length = 100)
    private String strategy;

    @Column(name = "selection", length = 200, nullable = false)
    private String selection;

    @Column(name = "odds", precision = 14, scale = 6, nullable = false)
    private BigDecimal odds;

    @Column(name = "stake", precision = 18, scale = 2, nullable = false)
    private BigDecimal stake;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "expected_value_pct", precision = 10, scale = 2)
    private BigDecimal expectedValuePct;

    @Column(name = "placed_at", nullable = false)
    private LocalDateTime placedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 10, nullable = false)
    private BetStatus status;

    @Column(name = "settled_at")
    private LocalDateTime settledAt;

    @Column(name = "outcome", length = 200)
    private String outcome;

    @Column(name = "profit_loss", precision = 18, scale = 2)
    private BigDecimal profitLoss;

    public boolean isPending() {
        return status == BetStatus.PENDING;
    }
}
