package com.tradejournal.reporting;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.pnl.DailySummaryAggregator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Groups round trips (one day or many) by setup tag, entry time-of-day bucket or account type.
 *
 * <p>Rows are built from unrounded sums; money is rounded to 2 dp only when a row is produced.
 * Ties in the P&L-sorted groupings keep first-appearance order.
 */
@Component
public class StatisticsEngine {

    public static final String UNTAGGED = "(untagged)";

    public List<GroupedStat> bySetup(List<RoundTrip> roundTrips) {
        return sortedByPnl(group(roundTrips, StatisticsEngine::setupKey));
    }

    public List<GroupedStat> byTimeOfDay(List<RoundTrip> roundTrips) {
        Map<TimeOfDayBucket, List<RoundTrip>> buckets = new EnumMap<>(TimeOfDayBucket.class);
        for (RoundTrip roundTrip : roundTrips) {
            buckets.computeIfAbsent(TimeOfDayBucket.of(roundTrip.getEntryTime()), b -> new ArrayList<>())
                    .add(roundTrip);
        }
        List<GroupedStat> stats = new ArrayList<>();
        buckets.forEach((bucket, trades) -> stats.add(toStat(bucket.getLabel(), trades)));
        return stats;
    }

    public List<GroupedStat> byAccountType(List<RoundTrip> roundTrips) {
        return sortedByPnl(group(roundTrips, rt -> accountTypeOf(rt).label()));
    }

    /** Groups by setup in first-appearance order, without sorting. */
    public List<GroupedStat> bySetupInOrder(List<RoundTrip> roundTrips) {
        return group(roundTrips, StatisticsEngine::setupKey);
    }

    static String setupKey(RoundTrip roundTrip) {
        String setup = roundTrip.getSetup();
        return setup == null || setup.isBlank() ? UNTAGGED : setup;
    }

    private static AccountType accountTypeOf(RoundTrip roundTrip) {
        return roundTrip.getAccountType() != null ? roundTrip.getAccountType() : AccountType.LIVE;
    }

    private List<GroupedStat> group(List<RoundTrip> roundTrips, Function<RoundTrip, String> keyFn) {
        Map<String, List<RoundTrip>> groups = new LinkedHashMap<>();
        for (RoundTrip roundTrip : roundTrips) {
            groups.computeIfAbsent(keyFn.apply(roundTrip), k -> new ArrayList<>()).add(roundTrip);
        }
        List<GroupedStat> stats = new ArrayList<>(groups.size());
        groups.forEach((key, trades) -> stats.add(toStat(key, trades)));
        return stats;
    }

    private static List<GroupedStat> sortedByPnl(List<GroupedStat> stats) {
        List<GroupedStat> sorted = new ArrayList<>(stats);
        sorted.sort(Comparator.comparing(GroupedStat::getTotalPnl).reversed());
        return sorted;
    }

    private static GroupedStat toStat(String key, List<RoundTrip> trades) {
        BigDecimal total = BigDecimal.ZERO;
        int winners = 0;
        int losers = 0;
        for (RoundTrip trade : trades) {
            BigDecimal pnl = trade.getNetPnl();
            total = total.add(pnl);
            if (pnl.signum() > 0) {
                winners++;
            } else if (pnl.signum() < 0) {
                losers++;
            }
        }
        return GroupedStat.builder()
                .key(key)
                .tradeCount(trades.size())
                .totalPnl(total.setScale(2, RoundingMode.HALF_UP))
                .avgPnl(total.divide(BigDecimal.valueOf(trades.size()), 2, RoundingMode.HALF_UP))
                .winners(winners)
                .losers(losers)
                .winRate(DailySummaryAggregator.winRate(winners, trades.size()))
                .build();
    }
}
