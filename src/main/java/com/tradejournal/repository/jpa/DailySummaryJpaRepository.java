package com.tradejournal.repository.jpa;

import com.tradejournal.entity.DailySummaryEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the daily_summaries table.
 * One row per trading day.
 */
@Repository
public interface DailySummaryJpaRepository extends JpaRepository<DailySummaryEntity, Long> {

    Optional<DailySummaryEntity> findByDate(LocalDate date);

    @Query("SELECT d FROM DailySummaryEntity d WHERE d.date BETWEEN :from AND :to ORDER BY d.date ASC")
    List<DailySummaryEntity> findByDateRange(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
