package com.tradejournal.reporting;

import com.tradejournal.domain.model.AccountSplit;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Performance statistics over a date range (a single day, an explicit range or the last week).
 *
 * <p>{@code profitFactor} is null when the period has no losing trades. {@code avgWin} and
 * {@code avgLoss} are zero when there are no winners or losers respectively.
 */
@Data
@Builder
public class PeriodStatsReport {

    private LocalDate from;
    private LocalDate to;
    private String symbol;
    private int daysTraded;
    private int totalTrades;
    private BigDecimal totalPnl;
    private BigDecimal totalFees;
    private BigDecimal winRate;
    private int winners;
    private int losers;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal profitFactor;
    private AccountSplit byAccount;
    private List<SymbolBreakdown> bySymbol;
}
