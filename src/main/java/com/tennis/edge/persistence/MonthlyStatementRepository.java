package com.tennis.edge.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MonthlyStatementRepository extends JpaRepository<MonthlyStatementEntity, Long> {

    @Query("SELECT s FROM MonthlyStatementEntity s WHERE s.year = :year AND s.month = :month")
    Optional<MonthlyStatementEntity> findByPeriod(@Param("year") int year, @Param("month") int month);

    @Query("SELECT s FROM MonthlyStatementEntity s WHERE s.year = :year ORDER BY s.month ASC")
    List<MonthlyStatementEntity> findByYear(@Param("year") int year);

}
