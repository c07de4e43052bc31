package com.tradejournal.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * One row of a grouped statistics breakdown (by setup, time-of-day bucket or account type).
 * {@code avgPnl} is the plain arithmetic mean of the group's net P&L.
 */
@Data
@Builder
public class GroupedStat {

    private String key;
    private int tradeCount;
    private BigDecimal totalPnl;
    private BigDecimal avgPnl;
    private int winners;
    private int losers;
    private BigDecimal winRate;
}
