package com.tradejournal.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate over one trading day's round trips. Always derived from the trades, never edited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummary {

    private LocalDate date;

    /** Folder the fills were ingested from, {@code manual} or {@code database}. */
    private String source;

    private BigDecimal totalPnl;
    private BigDecimal totalFees;
    private BigDecimal totalNetPnl;
    private int totalTrades;
    private int winners;
    private int losers;
    private int breakeven;
    private BigDecimal winRate;
    private List<String> symbols;
    private AccountSplit byAccount;
}
