package com.tradejournal.service;

import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.domain.model.TradeLogTransferResult;
import com.tradejournal.exception.ResourceNotFoundException;
import com.tradejournal.exception.TradeLogException;
import com.tradejournal.pnl.DailySummaryAggregator;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves days between the database and the YAML trade log directory.
 *
 * <p>Export writes one day from the database to YAML. Import loads every YAML log into the database,
 * skipping files that cannot be parsed or lack a date or trade list.
 */
@Service
public class TradeLogTransferService {

    private static final Logger log = LoggerFactory.getLogger(TradeLogTransferService.class);

    static final String EXPORT_SOURCE = "database-export";

    private final JournalPersistenceService journalPersistenceService;
    private final DailySummaryAggregator dailySummaryAggregator;
    private final TradeLogStore tradeLogStore;

    public TradeLogTransferService(
            JournalPersistenceService journalPersistenceService,
            DailySummaryAggregator dailySummaryAggregator,
            TradeLogStore tradeLogStore) {
        this.journalPersistenceService = journalPersistenceService;
        this.dailySummaryAggregator = dailySummaryAggregator;
        this.tradeLogStore = tradeLogStore;
    }

    /**
     * Exports the stored day to its YAML log.
     *
     * @throws ResourceNotFoundException if the database holds no trades for the day
     */
    public TradeLogTransferResult exportDay(LocalDate date) {
        List<RoundTrip> trades = journalPersistenceService.findTrades(date);
        if (trades.isEmpty()) {
            throw new ResourceNotFoundException("Trades", date.toString());
        }
        DailySummary summary = journalPersistenceService
                .findSummary(date)
                .orElseGet(() -> dailySummaryAggregator.summarize(date, EXPORT_SOURCE, trades));
        String source = summary.getSource() != null ? summary.getSource() : EXPORT_SOURCE;

        Path written = tradeLogStore.write(new DailyLog(date, source, summary, trades));
        log.info("Exported {} trades for {} to {}", trades.size(), date, written);
        return TradeLogTransferResult.builder()
                .days(1)
                .trades(trades.size())
                .files(List.of(written.toString()))
                .skippedFiles(List.of())
                .build();
    }

    /** Imports every YAML log in the trade log directory, oldest first. */
    public TradeLogTransferResult importAll() {
        List<String> imported = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int trades = 0;

        for (Path file : tradeLogStore.listLogFiles()) {
            String name = file.getFileName().toString();
            DailyLog dailyLog;
            try {
                dailyLog = tradeLogStore.parse(file);
            } catch (TradeLogException e) {
                log.warn("Skipping unreadable trade log {}: {}", name, e.getMessage());
                skipped.add(name);
                continue;
            }
            if (dailyLog == null || dailyLog.getDate() == null || dailyLog.getTrades() == null) {
                log.warn("Skipping trade log {}: invalid format", name);
                skipped.add(name);
                continue;
            }

            List<RoundTrip> dayTrades = journalPersistenceService.upsertRoundTrips(withDate(dailyLog));
            DailySummary summary = dailySummaryAggregator.summarize(dailyLog.getDate(), dailyLog.getSource(), dayTrades);
            journalPersistenceService.upsertSummary(summary);
            trades += dayTrades.size();
            imported.add(name);
            log.debug("Imported {}: {} trades", name, dayTrades.size());
        }

        log.info("Imported {} days, {} trades from trade logs ({} skipped)", imported.size(), trades, skipped.size());
        return TradeLogTransferResult.builder()
                .days(imported.size())
                .trades(trades)
                .files(imported)
                .skippedFiles(skipped)
                .build();
    }

    private static List<RoundTrip> withDate(DailyLog dailyLog) {
        return dailyLog.getTrades().stream()
                .map(t -> t.getDate() != null ? t : t.toBuilder().date(dailyLog.getDate()).build())
                .toList();
    }
}
