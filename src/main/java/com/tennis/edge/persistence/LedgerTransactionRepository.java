package com.tennis.edge.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, Long> {

    List<LedgerTransactionEntity> findAllByOrderByIdAsc();

    @Query("SELECT t FROM LedgerTransactionEntity t WHERE t.betId = :betId ORDER BY t.id ASC")
    List<LedgerTransactionEntity> findByBetId(@Param("betId") String betId);

    /**
     * Transactions in [start, end), in log order.
     */
    @Query("SELECT t FROM LedgerTransactionEntity t WHERE t.createdAt >= :start AND t.createdAt < :end ORDER BY t.id ASC")
    List<LedgerTransactionEntity> findInPeriod(@Param("start") LocalDateTime start,
                                               @Param("end") LocalDateTime end);

    /**
     * Signed sum of everything recorded before the given instant.
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t WHERE t.createdAt < :before")
    BigDecimal sumAmountsBefore(@Param("before") LocalDateTime before);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM LedgerTransactionEntity t")
    BigDecimal sumAllAmounts();

}
