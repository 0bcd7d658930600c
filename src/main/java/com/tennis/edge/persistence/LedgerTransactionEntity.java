package com.tennis.edge.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only ledger entry. Rows are never updated once written.
 */
@Entity
@Table(name = "ledger_transaction", indexes = {
        @Index(name = "idx_ledger_tx_created", columnList = "created_at"),
        @Index(name = "idx_ledger_tx_bet", columnList = "bet_id")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "tx_type", length = 20, nullable = false)
    private TransactionType type;

    // Signed amount applied to the balance
    @Column(name = "amount", precision = 18, scale = 2, nullable = false)
    private BigDecimal amount;

    @Column(name = "balance_after", precision = 18, scale = 2, nullable = false)
    private BigDecimal balanceAfter;

    @Column(name = "bet_id", length = 40)
    private String betId;

    @Column(name = "description", length = 500)
    private String description;

    // Expenses only: whether the cost is shared between partners
    @Column(name = "shared")
    private Boolean shared;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
