package com.tennis.edge.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CalibrationRecordRepository extends JpaRepository<CalibrationRecordEntity, Long> {

    @Query("SELECT c FROM CalibrationRecordEntity c ORDER BY c.recordedAt DESC, c.id DESC")
    List<CalibrationRecordEntity> findLatest(Pageable pageable);

    List<CalibrationRecordEntity> findAllByOrderByIdAsc();

    List<CalibrationRecordEntity> findByBetId(String betId);

    @Modifying
    @Query("DELETE FROM CalibrationRecordEntity c WHERE c.betId = :betId")
    int deleteByBetId(@Param("betId") String betId);

}
