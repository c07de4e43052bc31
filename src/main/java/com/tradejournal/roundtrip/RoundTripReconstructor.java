package com.tradejournal.roundtrip;

import com.tradejournal.domain.enums.TradeDirection;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.RoundTrip;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rebuilds a trading day's round-trip trades from its broker fills.
 *
 * <p>Reconstruction runs in two passes over two different groupings:
 * <ol>
 *   <li><b>Per (symbol, account):</b> fills are replayed in time order against a running signed
 *       position (BUY adds, SELL and SELL_SHORT subtract). Each return to exactly zero closes a round
 *       trip; whatever is left at the end of the day becomes one open round trip. Tracking per account
 *       keeps a live and a training account trading the same symbol from corrupting each other's
 *       position.</li>
 *   <li><b>Per symbol:</b> the round trips of every account that traded the symbol are ordered by entry
 *       and numbered {@code {date}-{symbol}-{n}}.</li>
 * </ol>
 *
 * <p>Entry order is the position of a round trip's first fill in the time-sorted fill list, so equal
 * timestamps keep the broker's input order and the output is identical for identical input.
 */
@Service
public class RoundTripReconstructor {

    private static final Logger log = LoggerFactory.getLogger(RoundTripReconstructor.class);

    private final AccountClassifier accountClassifier;
    private final ChartLocator chartLocator;

    public RoundTripReconstructor(AccountClassifier accountClassifier, ChartLocator chartLocator) {
        this.accountClassifier = accountClassifier;
        this.chartLocator = chartLocator;
    }

    public List<RoundTrip> reconstruct(LocalDate date, List<Fill> fills) {
        return reconstruct(date, fills, null);
    }

    /**
     * Reconstructs round trips for one day.
     *
     * @param date        trading date, used for IDs
     * @param fills       the day's fills in any order
     * @param chartFolder folder searched for chart screenshots, or null to skip the lookup
     * @return round trips sorted by entry across all symbols; empty when there are no fills
     */
    public List<RoundTrip> reconstruct(LocalDate date, List<Fill> fills, Path chartFolder) {
        if (fills.isEmpty()) {
            return List.of();
        }

        // Broker exports are usually newest-first; List.sort is stable so ties keep input order
        List<Fill> chronological = new ArrayList<>(fills);
        chronological.sort(Comparator.comparing(Fill::getTime));
        List<SequencedFill> sequenced = new ArrayList<>(chronological.size());
        for (int i = 0; i < chronological.size(); i++) {
            sequenced.add(new SequencedFill(i, chronological.get(i)));
        }

        Map<AccountKey, List<SequencedFill>> byAccount = groupByAccount(sequenced);
        Map<String, List<PendingRoundTrip>> bySymbol = new LinkedHashMap<>();
        for (Map.Entry<AccountKey, List<SequencedFill>> group : byAccount.entrySet()) {
            bySymbol.computeIfAbsent(group.getKey().symbol(), s -> new ArrayList<>())
                    .addAll(splitAtFlat(group.getKey(), group.getValue()));
        }

        List<NumberedRoundTrip> numbered = new ArrayList<>();
        for (Map.Entry<String, List<PendingRoundTrip>> entry : bySymbol.entrySet()) {
            String symbol = entry.getKey();
            String chart = chartLocator.findChart(symbol, chartFolder).orElse(null);
            List<PendingRoundTrip> pending = new ArrayList<>(entry.getValue());
            pending.sort(Comparator.comparingInt(PendingRoundTrip::firstSequence));
            for (int i = 0; i < pending.size(); i++) {
                String id = date + "-" + symbol + "-" + (i + 1);
                RoundTrip roundTrip = build(id, date, symbol, pending.get(i).fills(), chart);
                numbered.add(new NumberedRoundTrip(pending.get(i).firstSequence(), roundTrip));
            }
        }

        numbered.sort(Comparator.comparingInt(NumberedRoundTrip::firstSequence));
        List<RoundTrip> roundTrips =
                numbered.stream().map(NumberedRoundTrip::roundTrip).toList();

        log.debug("Reconstructed {} round trips from {} fills for {}", roundTrips.size(), fills.size(), date);
        return roundTrips;
    }

    private Map<AccountKey, List<SequencedFill>> groupByAccount(List<SequencedFill> sequenced) {
        Map<AccountKey, List<SequencedFill>> groups = new LinkedHashMap<>();
        for (SequencedFill fill : sequenced) {
            AccountKey key = new AccountKey(fill.fill().getSymbol(), fill.fill().getAccount());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(fill);
        }
        return groups;
    }

    /** Cuts one account's fills for a symbol into round trips at every return to a flat position. */
    private List<PendingRoundTrip> splitAtFlat(AccountKey key, List<SequencedFill> groupFills) {
        List<PendingRoundTrip> closed = new ArrayList<>();
        List<Fill> buffer = new ArrayList<>();
        int firstSequence = -1;
        long position = 0;

        for (SequencedFill sequencedFill : groupFills) {
            Fill fill = sequencedFill.fill();
            if (buffer.isEmpty()) {
                firstSequence = sequencedFill.sequence();
            }
            buffer.add(fill);
            position += fill.getSide().signedQuantity(fill.getQuantity());

            if (position == 0) {
                closed.add(new PendingRoundTrip(firstSequence, buffer));
                buffer = new ArrayList<>();
            }
        }

        if (!buffer.isEmpty()) {
            log.debug(
                    "Open position at end of day: symbol={}, account={}, residual={}",
                    key.symbol(),
                    key.account(),
                    position);
            closed.add(new PendingRoundTrip(firstSequence, buffer));
        }
        return closed;
    }

    private RoundTrip build(String id, LocalDate date, String symbol, List<Fill> fills, String chart) {
        Fill first = fills.get(0);
        Fill last = fills.get(fills.size() - 1);
        TradeDirection direction = TradeDirection.openedBy(first.getSide());

        BigDecimal entryNotional = BigDecimal.ZERO;
        BigDecimal exitNotional = BigDecimal.ZERO;
        long entryShares = 0;
        long exitShares = 0;
        BigDecimal pnl = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;

        for (Fill fill : fills) {
            BigDecimal notional = fill.getPrice().multiply(BigDecimal.valueOf(fill.getQuantity()));
            if (direction.isEntrySide(fill.getSide())) {
                entryNotional = entryNotional.add(notional);
                entryShares += fill.getQuantity();
            } else {
                exitNotional = exitNotional.add(notional);
                exitShares += fill.getQuantity();
            }
            pnl = pnl.add(fill.getReportedPnl());
            fees = fees.add(fill.getFee().abs());
        }

        BigDecimal grossPnl = pnl.setScale(2, RoundingMode.HALF_UP);
        long durationMinutes = Math.round(
                Duration.between(first.getTime(), last.getTime()).getSeconds() / 60.0);
        List<String> accounts = fills.stream().map(Fill::getAccount).distinct().toList();

        return RoundTrip.builder()
                .id(id)
                .date(date)
                .symbol(symbol)
                .direction(direction)
                .entryPrice(weightedAverage(entryNotional, entryShares))
                .exitPrice(weightedAverage(exitNotional, exitShares))
                .totalShares(Math.max(entryShares, exitShares))
                .grossPnl(grossPnl)
                .fees(fees.setScale(2, RoundingMode.HALF_UP))
                // Broker P&L already nets fees
                .netPnl(grossPnl)
                .fillCount(fills.size())
                .entryTime(first.getTime())
                .exitTime(last.getTime())
                .durationMinutes(Math.max(durationMinutes, 0))
                .accounts(accounts)
                .accountType(accountClassifier.classify(accounts))
                .chart(chart)
                .build();
    }

    private static BigDecimal weightedAverage(BigDecimal notional, long shares) {
        if (shares == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return notional.divide(BigDecimal.valueOf(shares), 2, RoundingMode.HALF_UP);
    }

    private record SequencedFill(int sequence, Fill fill) {}

    private record AccountKey(String symbol, String account) {}

    private record PendingRoundTrip(int firstSequence, List<Fill> fills) {}

    private record NumberedRoundTrip(int firstSequence, RoundTrip roundTrip) {}
}
