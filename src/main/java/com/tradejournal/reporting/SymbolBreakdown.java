package com.tradejournal.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Trade count, P&L and win/loss split for one symbol over a period. */
@Data
@Builder
public class SymbolBreakdown {

    private String symbol;
    private int trades;
    private BigDecimal pnl;
    private int winners;
    private int losers;
}
