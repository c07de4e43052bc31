package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.FillSide;
import java.math.BigDecimal;
import java.time.LocalTime;
import lombok.Builder;
import lombok.Value;

/**
 * A single broker execution (partial or full order fill), normalized from one export row.
 *
 * <p>The broker's per-fill realized P&L is authoritative and already fee-adjusted, so round trips
 * aggregate {@code reportedPnl} instead of recomputing P&L from prices.
 */
@Value
@Builder
public class Fill {

    LocalTime time;
    String symbol;
    FillSide side;
    BigDecimal price;
    int quantity;
    String route;
    String account;
    String liquidityType;

    /** Absolute cost of the execution (ECN fee). Rebates are stored as their absolute value. */
    BigDecimal fee;

    BigDecimal reportedPnl;
}
