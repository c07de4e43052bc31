package com.tradejournal.repository.jpa;

import com.tradejournal.entity.RoundTripEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the round_trips table.
 * Queried by day for the journal and review, by range for statistics and by symbol for history.
 */
@Repository
public interface RoundTripJpaRepository extends JpaRepository<RoundTripEntity, String> {

    List<RoundTripEntity> findByDateOrderByEntryTimeAsc(LocalDate date);

    @Query("SELECT r FROM RoundTripEntity r WHERE r.date BETWEEN :from AND :to ORDER BY r.date ASC, r.entryTime ASC")
    List<RoundTripEntity> findByDateRange(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("SELECT r FROM RoundTripEntity r WHERE r.symbol = :symbol ORDER BY r.date DESC, r.entryTime DESC")
    List<RoundTripEntity> findBySymbol(@Param("symbol") String symbol, Pageable pageable);

    @Query("SELECT r FROM RoundTripEntity r ORDER BY r.date ASC, r.entryTime ASC")
    List<RoundTripEntity> findAllOrdered();

    @Query("SELECT DISTINCT r.date FROM RoundTripEntity r ORDER BY r.date ASC")
    List<LocalDate> findDistinctDates();

    long countByDateAndSymbol(LocalDate date, String symbol);
}
