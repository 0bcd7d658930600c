package com.tennis.edge.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "ledger_account")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerAccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "starting_balance", precision = 18, scale = 2, nullable = false)
    private BigDecimal startingBalance;

    @Column(name = "current_balance", precision = 18, scale = 2, nullable = false)
    private BigDecimal currentBalance;

    @Column(name = "peak_balance", precision = 18, scale = 2, nullable = false)
    private BigDecimal peakBalance;

    @Column(name = "opened_at", nullable = false)
    private LocalDateTime openedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static LedgerAccountEntity open(BigDecimal startingBalance) {
        LocalDateTime now = LocalDateTime.now();
        return LedgerAccountEntity.builder()
                .startingBalance(startingBalance)
                .currentBalance(startingBalance)
                .peakBalance(startingBalance)
                .openedAt(now)
                .updatedAt(now)
                .build();
    }
}
