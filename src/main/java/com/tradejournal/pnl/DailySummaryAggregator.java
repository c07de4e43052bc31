package com.tradejournal.pnl;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.model.AccountBreakdown;
import com.tradejournal.domain.model.AccountSplit;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.RoundTrip;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Folds a day's round trips into a {@link DailySummary}.
 *
 * <p>Winners, losers and breakeven are classified on {@code netPnl}. In the per-account split, MIXED
 * trades are reported under LIVE (see {@link AccountType#reportingBucket()}) and also counted on their
 * own in {@code mixedTrades}.
 */
@Component
public class DailySummaryAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public DailySummary summarize(LocalDate date, String source, List<RoundTrip> roundTrips) {
        BigDecimal grossTotal = BigDecimal.ZERO;
        BigDecimal feeTotal = BigDecimal.ZERO;
        int winners = 0;
        int losers = 0;
        int breakeven = 0;

        for (RoundTrip roundTrip : roundTrips) {
            grossTotal = grossTotal.add(roundTrip.getGrossPnl());
            feeTotal = feeTotal.add(roundTrip.getFees());
            int sign = roundTrip.getNetPnl().signum();
            if (sign > 0) {
                winners++;
            } else if (sign < 0) {
                losers++;
            } else {
                breakeven++;
            }
        }

        BigDecimal totalPnl = round(grossTotal);
        List<String> symbols =
                roundTrips.stream().map(RoundTrip::getSymbol).distinct().toList();

        return DailySummary.builder()
                .date(date)
                .source(source)
                .totalPnl(totalPnl)
                .totalFees(round(feeTotal))
                .totalNetPnl(totalPnl)
                .totalTrades(roundTrips.size())
                .winners(winners)
                .losers(losers)
                .breakeven(breakeven)
                .winRate(winRate(winners, roundTrips.size()))
                .symbols(symbols)
                .byAccount(splitByAccount(roundTrips))
                .build();
    }

    public AccountSplit splitByAccount(List<RoundTrip> roundTrips) {
        List<RoundTrip> live = roundTrips.stream()
                .filter(rt -> bucketOf(rt) == AccountType.LIVE)
                .toList();
        List<RoundTrip> training = roundTrips.stream()
                .filter(rt -> bucketOf(rt) == AccountType.TRAINING)
                .toList();
        int mixed = (int) roundTrips.stream()
                .filter(rt -> rt.getAccountType() == AccountType.MIXED)
                .count();

        return AccountSplit.builder()
                .live(breakdown(live))
                .training(breakdown(training))
                .mixedTrades(mixed)
                .build();
    }

    /** Winners as a percentage of trades, 2 dp; zero when there are no trades. */
    public static BigDecimal winRate(int winners, int trades) {
        if (trades == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(winners)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(trades), 2, RoundingMode.HALF_UP);
    }

    private static AccountType bucketOf(RoundTrip roundTrip) {
        AccountType type = roundTrip.getAccountType() != null ? roundTrip.getAccountType() : AccountType.LIVE;
        return type.reportingBucket();
    }

    private static AccountBreakdown breakdown(List<RoundTrip> roundTrips) {
        if (roundTrips.isEmpty()) {
            return AccountBreakdown.empty();
        }
        BigDecimal pnl = BigDecimal.ZERO;
        int winners = 0;
        int losers = 0;
        for (RoundTrip roundTrip : roundTrips) {
            pnl = pnl.add(roundTrip.getNetPnl());
            if (roundTrip.getNetPnl().signum() > 0) {
                winners++;
            } else if (roundTrip.getNetPnl().signum() < 0) {
                losers++;
            }
        }
        return AccountBreakdown.builder()
                .trades(roundTrips.size())
                .pnl(round(pnl))
                .winners(winners)
                .losers(losers)
                .winRate(winRate(winners, roundTrips.size()))
                .build();
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
