package com.tradejournal.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.enums.TradeDirection;
import com.tradejournal.domain.model.AccountSplit;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.pnl.DailySummaryAggregator;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DailySummaryAggregator: totals, win/loss counts, symbol order and the
 * live/training split with mixed trades reported under live.
 */
class DailySummaryAggregatorTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 15);

    private final DailySummaryAggregator aggregator = new DailySummaryAggregator();

    @Nested
    @DisplayName("Totals")
    class Totals {

        @Test
        @DisplayName("Sums P&L and fees and counts winners, losers and breakeven")
        void totalsAndCounts() {
            List<RoundTrip> trades = List.of(
                    trade("AAPL", "250.00", "1.00", AccountType.LIVE),
                    trade("MSFT", "-75.50", "0.40", AccountType.LIVE),
                    trade("AAPL", "0", "0.10", AccountType.LIVE),
                    trade("NVDA", "30.25", "0.20", AccountType.LIVE));

            DailySummary summary = aggregator.summarize(DATE, "data/2026-01-15", trades);

            assertThat(summary.getDate()).isEqualTo(DATE);
            assertThat(summary.getSource()).isEqualTo("data/2026-01-15");
            assertThat(summary.getTotalPnl()).isEqualByComparingTo("204.75");
            assertThat(summary.getTotalNetPnl()).isEqualByComparingTo("204.75");
            assertThat(summary.getTotalFees()).isEqualByComparingTo("1.70");
            assertThat(summary.getTotalTrades()).isEqualTo(4);
            assertThat(summary.getWinners()).isEqualTo(2);
            assertThat(summary.getLosers()).isEqualTo(1);
            assertThat(summary.getBreakeven()).isEqualTo(1);
            assertThat(summary.getWinRate()).isEqualByComparingTo("50.00");
            assertThat(summary.getSymbols()).containsExactly("AAPL", "MSFT", "NVDA");
        }

        @Test
        @DisplayName("Win rate rounds to two decimals")
        void winRateRounding() {
            List<RoundTrip> trades = List.of(
                    trade("AAPL", "10", "0", AccountType.LIVE),
                    trade("AAPL", "10", "0", AccountType.LIVE),
                    trade("AAPL", "-10", "0", AccountType.LIVE));

            assertThat(aggregator.summarize(DATE, "s", trades).getWinRate()).isEqualByComparingTo("66.67");
        }

        @Test
        @DisplayName("Empty day has zero totals and zero win rate")
        void emptyDay() {
            DailySummary summary = aggregator.summarize(DATE, "s", List.of());

            assertThat(summary.getTotalTrades()).isZero();
            assertThat(summary.getTotalPnl()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(summary.getWinRate()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(summary.getSymbols()).isEmpty();
            assertThat(summary.getByAccount().getLive().getTrades()).isZero();
        }
    }

    @Nested
    @DisplayName("Account split")
    class AccountSplitPolicy {

        @Test
        @DisplayName("Mixed trades count toward live and are counted separately")
        void mixedReportedAsLive() {
            List<RoundTrip> trades = List.of(
                    trade("AAPL", "100", "0", AccountType.LIVE),
                    trade("AAPL", "-40", "0", AccountType.MIXED),
                    trade("MSFT", "25", "0", AccountType.TRAINING),
                    trade("MSFT", "-5", "0", AccountType.TRAINING));

            AccountSplit split = aggregator.summarize(DATE, "s", trades).getByAccount();

            assertThat(split.getLive().getTrades()).isEqualTo(2);
            assertThat(split.getLive().getPnl()).isEqualByComparingTo("60.00");
            assertThat(split.getLive().getWinners()).isEqualTo(1);
            assertThat(split.getLive().getLosers()).isEqualTo(1);
            assertThat(split.getLive().getWinRate()).isEqualByComparingTo("50.00");
            assertThat(split.getTraining().getTrades()).isEqualTo(2);
            assertThat(split.getTraining().getPnl()).isEqualByComparingTo("20.00");
            assertThat(split.getMixedTrades()).isEqualTo(1);
        }

        @Test
        @DisplayName("Reporting bucket policy maps MIXED to LIVE only")
        void reportingBucket() {
            assertThat(AccountType.MIXED.reportingBucket()).isEqualTo(AccountType.LIVE);
            assertThat(AccountType.LIVE.reportingBucket()).isEqualTo(AccountType.LIVE);
            assertThat(AccountType.TRAINING.reportingBucket()).isEqualTo(AccountType.TRAINING);
        }

        @Test
        @DisplayName("Live plus training trades equals total trades")
        void splitIsConsistentWithTotals() {
            List<RoundTrip> trades = List.of(
                    trade("AAPL", "1", "0", AccountType.LIVE),
                    trade("AAPL", "2", "0", AccountType.MIXED),
                    trade("AAPL", "3", "0", AccountType.TRAINING));

            DailySummary summary = aggregator.summarize(DATE, "s", trades);

            assertThat(summary.getByAccount().getLive().getTrades()
                            + summary.getByAccount().getTraining().getTrades())
                    .isEqualTo(summary.getTotalTrades());
            assertThat(summary.getByAccount().getLive().getPnl()
                            .add(summary.getByAccount().getTraining().getPnl()))
                    .isEqualByComparingTo(summary.getTotalPnl());
        }
    }

    private static RoundTrip trade(String symbol, String pnl, String fees, AccountType accountType) {
        BigDecimal value = new BigDecimal(pnl);
        return RoundTrip.builder()
                .id(DATE + "-" + symbol)
                .date(DATE)
                .symbol(symbol)
                .direction(TradeDirection.LONG)
                .grossPnl(value)
                .netPnl(value)
                .fees(new BigDecimal(fees))
                .accountType(accountType)
                .build();
    }
}
