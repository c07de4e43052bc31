package com.tradejournal.service;

import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.enums.TradeDirection;
import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.pnl.DailySummaryAggregator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records a trade entered by hand (no broker fills), e.g. from another platform.
 *
 * <p>P&L is computed from the prices: {@code (exit - entry) * shares} for longs and
 * {@code (entry - exit) * shares} for shorts, with no fees. The trade is booked to the {@code manual}
 * account as LIVE and numbered after the symbol's existing trades for the day. The day's summary and
 * YAML log are rebuilt afterwards.
 */
@Service
public class ManualTradeService {

    private static final Logger log = LoggerFactory.getLogger(ManualTradeService.class);

    static final String MANUAL_ACCOUNT = "manual";

    private final JournalPersistenceService journalPersistenceService;
    private final DailySummaryAggregator dailySummaryAggregator;
    private final TradeLogStore tradeLogStore;

    public ManualTradeService(
            JournalPersistenceService journalPersistenceService,
            DailySummaryAggregator dailySummaryAggregator,
            TradeLogStore tradeLogStore) {
        this.journalPersistenceService = journalPersistenceService;
        this.dailySummaryAggregator = dailySummaryAggregator;
        this.tradeLogStore = tradeLogStore;
    }

    /**
     * Logs the trade.
     *
     * @param draft symbol, direction, entry/exit price and shares; date and entry time default to now,
     *              setup and notes are optional
     */
    @Transactional
    public RoundTrip logTrade(RoundTrip draft) {
        LocalDate date = draft.getDate() != null ? draft.getDate() : LocalDate.now();
        LocalTime time = draft.getEntryTime() != null
                ? draft.getEntryTime()
                : LocalTime.now().truncatedTo(ChronoUnit.SECONDS);
        String symbol = draft.getSymbol().trim().toUpperCase(Locale.ROOT);

        BigDecimal shares = BigDecimal.valueOf(draft.getTotalShares());
        BigDecimal move = draft.getDirection() == TradeDirection.LONG
                ? draft.getExitPrice().subtract(draft.getEntryPrice())
                : draft.getEntryPrice().subtract(draft.getExitPrice());
        BigDecimal pnl = move.multiply(shares).setScale(2, RoundingMode.HALF_UP);

        long existing = journalPersistenceService.countTrades(date, symbol);
        RoundTrip trade = RoundTrip.builder()
                .id(date + "-" + symbol + "-" + (existing + 1))
                .date(date)
                .symbol(symbol)
                .direction(draft.getDirection())
                .entryPrice(draft.getEntryPrice().setScale(2, RoundingMode.HALF_UP))
                .exitPrice(draft.getExitPrice().setScale(2, RoundingMode.HALF_UP))
                .totalShares(draft.getTotalShares())
                .grossPnl(pnl)
                .fees(BigDecimal.ZERO.setScale(2))
                .netPnl(pnl)
                .fillCount(0)
                .entryTime(time)
                .exitTime(time)
                .durationMinutes(0)
                .accounts(List.of(MANUAL_ACCOUNT))
                .accountType(AccountType.LIVE)
                .setup(blankToNull(draft.getSetup()))
                .notes(blankToNull(draft.getNotes()))
                .build();

        RoundTrip saved = journalPersistenceService.saveTrade(trade);

        List<RoundTrip> dayTrades = journalPersistenceService.findTrades(date);
        String source = journalPersistenceService
                .findSummary(date)
                .map(DailySummary::getSource)
                .orElse(MANUAL_ACCOUNT);
        DailySummary summary = dailySummaryAggregator.summarize(date, source, dayTrades);
        journalPersistenceService.upsertSummary(summary);
        tradeLogStore.write(new DailyLog(date, source, summary, dayTrades));

        log.info("Manual trade logged: id={}, {} {} {} @ {} -> {}, P&L {}",
                saved.getId(), saved.getDirection(), saved.getTotalShares(), symbol,
                saved.getEntryPrice(), saved.getExitPrice(), pnl);
        return saved;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
