package com.tradejournal.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Result of comparing the computed daily P&L against the broker's positions report.
 * A difference beyond tolerance is a warning only.
 */
@Data
@Builder
public class PnlCrossCheck {

    private BigDecimal reportedPnl;
    private BigDecimal computedPnl;
    private BigDecimal difference;
    private BigDecimal tolerance;
    private boolean withinTolerance;
}
