package com.tradejournal.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Trade count, P&L and win rate for one account bucket (live or training). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountBreakdown {

    private int trades;
    private BigDecimal pnl;
    private int winners;
    private int losers;
    private BigDecimal winRate;

    public static AccountBreakdown empty() {
        return AccountBreakdown.builder()
                .trades(0)
                .pnl(BigDecimal.ZERO.setScale(2))
                .winners(0)
                .losers(0)
                .winRate(BigDecimal.ZERO.setScale(2))
                .build();
    }
}
