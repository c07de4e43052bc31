package com.tradejournal.ingest;

import com.tradejournal.domain.enums.FillSide;
import com.tradejournal.domain.model.Fill;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw broker export rows into canonical {@link Fill}s.
 *
 * <p>Rows missing time, symbol or side, or whose price/quantity are not positive numbers, are dropped
 * and counted; the rest of the batch is unaffected. Optional columns (route, account, liquidity,
 * fee, P&L) default to empty or zero.
 */
@Component
public class FillNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FillNormalizer.class);

    static final String COL_TIME = "Time";
    static final String COL_SYMBOL = "Symbol";
    static final String COL_SIDE = "Side";
    static final String COL_PRICE = "Price";
    static final String COL_QTY = "Qty";
    static final String COL_ROUTE = "Route";
    static final String COL_ACCOUNT = "Account";
    static final String COL_LIQUIDITY = "LiqType";
    static final String COL_FEE = "ECNFee";
    static final String COL_PNL = "P / L";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm[:ss]");

    /** Normalizes all rows, keeping input order. */
    public Result normalize(List<Map<String, String>> rows) {
        List<Fill> fills = new ArrayList<>(rows.size());
        int skipped = 0;
        for (Map<String, String> row : rows) {
            Optional<Fill> fill = toFill(row);
            if (fill.isPresent()) {
                fills.add(fill.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed fill rows out of {}", skipped, rows.size());
        }
        return new Result(fills, skipped);
    }

    /** Parses one row, or returns empty when a required field is missing or invalid. */
    public Optional<Fill> toFill(Map<String, String> row) {
        String rawTime = text(row, COL_TIME);
        String symbol = text(row, COL_SYMBOL);
        Optional<FillSide> side = FillSide.fromCode(text(row, COL_SIDE));
        BigDecimal price = decimal(row, COL_PRICE);
        Integer quantity = integer(row, COL_QTY);

        if (rawTime.isEmpty() || symbol.isEmpty() || side.isEmpty() || price == null || quantity == null) {
            log.debug("Dropping fill row with missing or invalid required field: {}", row);
            return Optional.empty();
        }
        if (price.signum() <= 0 || quantity <= 0) {
            log.debug("Dropping fill row with non-positive price or quantity: {}", row);
            return Optional.empty();
        }

        LocalTime time;
        try {
            time = LocalTime.parse(rawTime, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Dropping fill row with unparseable time '{}'", rawTime);
            return Optional.empty();
        }

        BigDecimal fee = decimal(row, COL_FEE);
        BigDecimal pnl = decimal(row, COL_PNL);

        return Optional.of(Fill.builder()
                .time(time)
                .symbol(symbol)
                .side(side.get())
                .price(price)
                .quantity(quantity)
                .route(text(row, COL_ROUTE))
                .account(text(row, COL_ACCOUNT))
                .liquidityType(text(row, COL_LIQUIDITY))
                .fee(fee != null ? fee.abs() : BigDecimal.ZERO)
                .reportedPnl(pnl != null ? pnl : BigDecimal.ZERO)
                .build());
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }

    private static BigDecimal decimal(Map<String, String> row, String column) {
        String value = text(row, column);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer integer(Map<String, String> row, String column) {
        BigDecimal value = decimal(row, column);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /** Parsed fills in input order plus the number of rows dropped. */
    public record Result(List<Fill> fills, int skippedRows) {}
}
