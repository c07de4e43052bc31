package com.tradejournal.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the daily_summaries table.
 * One row per trading day, rewritten whenever the day's round trips change.
 * The live/training split is flattened into columns; live includes mixed-account trades.
 */
@Entity
@Table(name = "daily_summaries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySummaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_date", unique = true, nullable = false)
    private LocalDate date;

    @Column(length = 500)
    private String source;

    @Column(name = "total_pnl", precision = 15, scale = 2)
    private BigDecimal totalPnl;

    @Column(name = "total_fees", precision = 15, scale = 2)
    private BigDecimal totalFees;

    @Column(name = "total_net_pnl", precision = 15, scale = 2)
    private BigDecimal totalNetPnl;

    @Column(name = "total_trades")
    private int totalTrades;

    private int winners;

    private int losers;

    private int breakeven;

    @Column(name = "win_rate", precision = 5, scale = 2)
    private BigDecimal winRate;

    /** JSON array of symbols in first-traded order. */
    @Column(columnDefinition = "TEXT")
    private String symbols;

    @Column(name = "live_trades")
    private int liveTrades;

    @Column(name = "live_pnl", precision = 15, scale = 2)
    private BigDecimal livePnl;

    @Column(name = "live_winners")
    private int liveWinners;

    @Column(name = "live_losers")
    private int liveLosers;

    @Column(name = "live_win_rate", precision = 5, scale = 2)
    private BigDecimal liveWinRate;

    @Column(name = "training_trades")
    private int trainingTrades;

    @Column(name = "training_pnl", precision = 15, scale = 2)
    private BigDecimal trainingPnl;

    @Column(name = "training_winners")
    private int trainingWinners;

    @Column(name = "training_losers")
    private int trainingLosers;

    @Column(name = "training_win_rate", precision = 5, scale = 2)
    private BigDecimal trainingWinRate;

    @Column(name = "mixed_trades")
    private int mixedTrades;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
