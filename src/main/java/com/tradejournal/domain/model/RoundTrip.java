package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reconstructed trade: the fills for one symbol and account taking the position from flat
 * back to flat, or left open at the end of the day.
 *
 * <p>Prices are quantity-weighted averages of the entry-side and exit-side fills. {@code netPnl}
 * equals {@code grossPnl} because the broker's per-fill P&L already includes fees; {@code fees}
 * is reported alongside and is not subtracted again.
 *
 * <p>{@code setup}, {@code notes} and {@code chart} are annotations attached after
 * reconstruction; everything else is fixed once the round trip is built.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoundTrip {

    /** {@code {date}-{symbol}-{n}}, numbered by entry order within the symbol for the day. */
    private String id;

    private LocalDate date;
    private String symbol;
    private TradeDirection direction;
    private BigDecimal entryPrice;

    /** Zero when the round trip is still open (no exit-side fills). */
    private BigDecimal exitPrice;

    private long totalShares;
    private BigDecimal grossPnl;
    private BigDecimal fees;
    private BigDecimal netPnl;
    private int fillCount;
    private LocalTime entryTime;
    private LocalTime exitTime;
    private long durationMinutes;
    private List<String> accounts;
    private AccountType accountType;

    private String setup;
    private String notes;
    private String chart;
}
