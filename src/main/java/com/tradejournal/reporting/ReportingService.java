package com.tradejournal.reporting;

import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.ResourceNotFoundException;
import com.tradejournal.pnl.DailySummaryAggregator;
import com.tradejournal.service.TradeHistoryService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Central reporting service: period statistics, end-of-day session review and the grouped
 * breakdowns of the {@link StatisticsEngine}.
 *
 * <p>Trades are read through {@link TradeHistoryService}, so reports keep working from the YAML
 * trade logs when the database is unavailable.
 */
@Service
public class ReportingService {

    private static final Logger log = LoggerFactory.getLogger(ReportingService.class);

    static final List<String> REFLECTION_QUESTIONS = List.of(
            "What was your best trade today and why?",
            "What was your worst trade today and why?",
            "Did you follow your playbook on every trade?",
            "What is the one thing you will improve tomorrow?",
            "Did you honor your stops and risk rules?",
            "Rate your discipline today (1-10):");

    private static final String DATABASE_SOURCE = "database";

    private final TradeHistoryService tradeHistoryService;
    private final DailySummaryAggregator dailySummaryAggregator;
    private final StatisticsEngine statisticsEngine;

    public ReportingService(
            TradeHistoryService tradeHistoryService,
            DailySummaryAggregator dailySummaryAggregator,
            StatisticsEngine statisticsEngine) {
        this.tradeHistoryService = tradeHistoryService;
        this.dailySummaryAggregator = dailySummaryAggregator;
        this.statisticsEngine = statisticsEngine;
    }

    /**
     * Statistics for a period: an explicit {@code from}/{@code to} range, the last seven days when
     * {@code week} is set, otherwise the single {@code date} (today when null).
     */
    public PeriodStatsReport getPeriodStats(
            LocalDate date, LocalDate from, LocalDate to, boolean week, String symbol) {
        LocalDate start;
        LocalDate end;
        if (from != null || to != null) {
            requireRange(from, to);
            start = from;
            end = to;
        } else if (week) {
            end = LocalDate.now();
            start = end.minusDays(6);
        } else {
            start = date != null ? date : LocalDate.now();
            end = start;
        }

        List<RoundTrip> trades = tradeHistoryService.tradesBetween(start, end);
        String symbolFilter = symbol != null && !symbol.isBlank() ? symbol.trim().toUpperCase(Locale.ROOT) : null;
        if (symbolFilter != null) {
            trades = trades.stream().filter(t -> symbolFilter.equals(t.getSymbol())).toList();
        }
        return buildPeriodStats(start, end, symbolFilter, trades);
    }

    PeriodStatsReport buildPeriodStats(LocalDate from, LocalDate to, String symbol, List<RoundTrip> trades) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        BigDecimal grossWin = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        int winners = 0;
        int losers = 0;

        for (RoundTrip trade : trades) {
            BigDecimal pnl = trade.getNetPnl();
            total = total.add(pnl);
            fees = fees.add(trade.getFees() != null ? trade.getFees() : BigDecimal.ZERO);
            if (pnl.signum() > 0) {
                winners++;
                grossWin = grossWin.add(pnl);
            } else if (pnl.signum() < 0) {
                losers++;
                grossLoss = grossLoss.add(pnl);
            }
        }

        // Profit factor is undefined without losing trades
        BigDecimal profitFactor = losers > 0 && grossLoss.signum() != 0
                ? grossWin.divide(grossLoss.abs(), 2, RoundingMode.HALF_UP)
                : null;

        int daysTraded = (int) trades.stream().map(RoundTrip::getDate).distinct().count();

        log.debug("Stats {}..{} symbol={}: {} trades over {} days", from, to, symbol, trades.size(), daysTraded);

        return PeriodStatsReport.builder()
                .from(from)
                .to(to)
                .symbol(symbol)
                .daysTraded(daysTraded)
                .totalTrades(trades.size())
                .totalPnl(round(total))
                .totalFees(round(fees))
                .winRate(DailySummaryAggregator.winRate(winners, trades.size()))
                .winners(winners)
                .losers(losers)
                .avgWin(average(grossWin, winners))
                .avgLoss(average(grossLoss, losers))
                .profitFactor(profitFactor)
                .byAccount(dailySummaryAggregator.splitByAccount(trades))
                .bySymbol(bySymbol(trades))
                .build();
    }

    /**
     * Review of one session.
     *
     * @throws ResourceNotFoundException if no trades are stored for the day
     */
    public SessionReview getSessionReview(LocalDate date) {
        List<RoundTrip> trades = tradeHistoryService.tradesOn(date);
        if (trades.isEmpty()) {
            throw new ResourceNotFoundException("Trades", date.toString());
        }
        DailySummary summary = tradeHistoryService
                .summaryOn(date)
                .orElseGet(() -> dailySummaryAggregator.summarize(date, DATABASE_SOURCE, trades));

        RoundTrip best = trades.get(0);
        RoundTrip worst = trades.get(0);
        for (RoundTrip trade : trades) {
            if (trade.getNetPnl().compareTo(best.getNetPnl()) > 0) {
                best = trade;
            }
            if (trade.getNetPnl().compareTo(worst.getNetPnl()) <= 0) {
                worst = trade;
            }
        }

        return SessionReview.builder()
                .date(date)
                .summary(summary)
                .bestTrade(best)
                .worstTrade(worst)
                .setupBreakdown(statisticsEngine.bySetupInOrder(trades))
                .trades(trades)
                .reflectionQuestions(REFLECTION_QUESTIONS)
                .build();
    }

    public List<GroupedStat> getStatsBySetup(LocalDate from, LocalDate to) {
        return statisticsEngine.bySetup(tradesInRange(from, to));
    }

    public List<GroupedStat> getStatsByTimeOfDay(LocalDate from, LocalDate to) {
        return statisticsEngine.byTimeOfDay(tradesInRange(from, to));
    }

    public List<GroupedStat> getStatsByAccountType(LocalDate from, LocalDate to) {
        return statisticsEngine.byAccountType(tradesInRange(from, to));
    }

    /** All stored trades when neither bound is given, otherwise the inclusive range. */
    private List<RoundTrip> tradesInRange(LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return tradeHistoryService.allTrades();
        }
        requireRange(from, to);
        return tradeHistoryService.tradesBetween(from, to);
    }

    private static void requireRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new BusinessException("Both 'from' and 'to' are required for a date range");
        }
        if (from.isAfter(to)) {
            throw new BusinessException(
                    "'from' must not be after 'to'", Map.of("from", from.toString(), "to", to.toString()));
        }
    }

    private static List<SymbolBreakdown> bySymbol(List<RoundTrip> trades) {
        Map<String, List<RoundTrip>> grouped = new LinkedHashMap<>();
        for (RoundTrip trade : trades) {
            grouped.computeIfAbsent(trade.getSymbol(), s -> new ArrayList<>()).add(trade);
        }
        List<SymbolBreakdown> rows = new ArrayList<>();
        grouped.forEach((symbol, symbolTrades) -> {
            BigDecimal pnl = BigDecimal.ZERO;
            int winners = 0;
            int losers = 0;
            for (RoundTrip trade : symbolTrades) {
                pnl = pnl.add(trade.getNetPnl());
                if (trade.getNetPnl().signum() > 0) {
                    winners++;
                } else if (trade.getNetPnl().signum() < 0) {
                    losers++;
                }
            }
            rows.add(SymbolBreakdown.builder()
                    .symbol(symbol)
                    .trades(symbolTrades.size())
                    .pnl(round(pnl))
                    .winners(winners)
                    .losers(losers)
                    .build());
        });
        rows.sort(Comparator.comparing(SymbolBreakdown::getPnl).reversed());
        return rows;
    }

    private static BigDecimal average(BigDecimal sum, int count) {
        if (count == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return sum.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
