package com.tradejournal.entity;

import com.tradejournal.domain.enums.FillSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the fills table.
 * Raw broker executions as ingested, one row per fill. Re-ingesting a day updates rows in place
 * using the natural key (date, time, symbol, side, price, quantity, account).
 */
@Entity
@Table(
        name = "fills",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_fills_natural_key",
                        columnNames = {"trade_date", "fill_time", "symbol", "side", "price", "quantity", "account"}),
        indexes = @Index(name = "idx_fills_date", columnList = "trade_date"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_date", nullable = false)
    private LocalDate date;

    @Column(name = "fill_time", nullable = false)
    private LocalTime time;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    private FillSide side;

    @Column(precision = 15, scale = 4, nullable = false)
    private BigDecimal price;

    @Column(nullable = false)
    private int quantity;

    @Column(length = 20)
    private String route;

    @Column(nullable = false, length = 40)
    private String account;

    @Column(name = "liquidity_type", length = 10)
    private String liquidityType;

    @Column(precision = 15, scale = 4)
    private BigDecimal fee;

    @Column(name = "reported_pnl", precision = 15, scale = 4)
    private BigDecimal reportedPnl;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
