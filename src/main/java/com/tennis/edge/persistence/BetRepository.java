package com.tennis.edge.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BetRepository extends JpaRepository<BetEntity, Long> {

    Optional<BetEntity> findByBetId(String betId);

    @Query("SELECT b FROM BetEntity b WHERE b.matchId = :matchId ORDER BY b.placedAt DESC, b.id DESC")
    List<BetEntity> findByMatchIdNewestFirst(@Param("matchId") String matchId);

    /**
     * Open bet for a match, newest first.
     */
    @Query("SELECT b FROM BetEntity b WHERE b.matchId = :matchId AND b.status = com.tennis.edge.persistence.BetStatus.PENDING ORDER BY b.id DESC")
    List<BetEntity> findPendingByMatchId(@Param("matchId") String matchId);

    @Query("SELECT b FROM BetEntity b WHERE b.status = :status ORDER BY b.placedAt ASC, b.id ASC")
    List<BetEntity> findByStatus(@Param("status") BetStatus status);

    List<BetEntity> findAllByOrderByIdAsc();

    @Query("SELECT b FROM BetEntity b WHERE b.placedAt >= :since ORDER BY b.placedAt ASC, b.id ASC")
    List<BetEntity> findPlacedSince(@Param("since") LocalDateTime since);

    long countByStatus(BetStatus status);

}
