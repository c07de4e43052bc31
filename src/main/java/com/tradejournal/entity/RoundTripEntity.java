package com.tradejournal.entity;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
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
 * JPA entity for the round_trips table.
 * One row per reconstructed trade, keyed by the {@code {date}-{symbol}-{n}} trade ID.
 * Setup, notes and chart are journal annotations that survive re-ingestion of the day.
 */
@Entity
@Table(
        name = "round_trips",
        indexes = {
            @Index(name = "idx_round_trips_date", columnList = "trade_date"),
            @Index(name = "idx_round_trips_symbol", columnList = "symbol"),
            @Index(name = "idx_round_trips_setup", columnList = "setup"),
            @Index(name = "idx_round_trips_account_type", columnList = "account_type")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundTripEntity {

    @Id
    @Column(length = 48)
    private String id;

    @Column(name = "trade_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 5)
    private TradeDirection direction;

    @Column(name = "entry_price", precision = 15, scale = 2)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 15, scale = 2)
    private BigDecimal exitPrice;

    @Column(name = "total_shares")
    private long totalShares;

    @Column(name = "gross_pnl", precision = 15, scale = 2)
    private BigDecimal grossPnl;

    @Column(precision = 15, scale = 2)
    private BigDecimal fees;

    @Column(name = "net_pnl", precision = 15, scale = 2)
    private BigDecimal netPnl;

    @Column(name = "fill_count")
    private int fillCount;

    @Column(name = "entry_time")
    private LocalTime entryTime;

    @Column(name = "exit_time")
    private LocalTime exitTime;

    @Column(name = "duration_minutes")
    private long durationMinutes;

    /** JSON array of account names, e.g. ["A1","TR1"]. */
    @Column(columnDefinition = "TEXT")
    private String accounts;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", length = 10)
    private AccountType accountType;

    @Column(length = 100)
    private String setup;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(length = 255)
    private String chart;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
