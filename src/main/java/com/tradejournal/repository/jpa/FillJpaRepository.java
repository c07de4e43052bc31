package com.tradejournal.repository.jpa;

import com.tradejournal.domain.enums.FillSide;
import com.tradejournal.entity.FillEntity;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the fills table.
 * Lookups by natural key back the per-day upsert.
 */
@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, Long> {

    @Query("SELECT f FROM FillEntity f WHERE f.date = :date AND f.time = :time AND f.symbol = :symbol"
            + " AND f.side = :side AND f.price = :price AND f.quantity = :quantity AND f.account = :account")
    Optional<FillEntity> findByNaturalKey(
            @Param("date") LocalDate date,
            @Param("time") LocalTime time,
            @Param("symbol") String symbol,
            @Param("side") FillSide side,
            @Param("price") BigDecimal price,
            @Param("quantity") int quantity,
            @Param("account") String account);

    List<FillEntity> findByDateOrderByTimeAsc(LocalDate date);
}
