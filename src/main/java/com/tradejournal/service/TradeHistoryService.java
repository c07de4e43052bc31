package com.tradejournal.service;

import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.RoundTrip;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Read path for stored trades. Queries the database and falls back to the YAML trade logs when the
 * database cannot be read.
 */
@Service
public class TradeHistoryService {

    private static final Logger log = LoggerFactory.getLogger(TradeHistoryService.class);

    private final JournalPersistenceService journalPersistenceService;
    private final TradeLogStore tradeLogStore;

    public TradeHistoryService(JournalPersistenceService journalPersistenceService, TradeLogStore tradeLogStore) {
        this.journalPersistenceService = journalPersistenceService;
        this.tradeLogStore = tradeLogStore;
    }

    public List<RoundTrip> tradesOn(LocalDate date) {
        try {
            return journalPersistenceService.findTrades(date);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Database read failed for {}, reading trade log: {}", date, e.getMessage());
            return tradeLogStore.read(date).map(DailyLog::getTrades).orElse(List.of());
        }
    }

    public List<RoundTrip> tradesBetween(LocalDate from, LocalDate to) {
        try {
            return journalPersistenceService.findTrades(from, to);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Database read failed for {}..{}, reading trade logs: {}", from, to, e.getMessage());
            return flatten(tradeLogStore.readRange(from, to));
        }
    }

    public List<RoundTrip> allTrades() {
        try {
            return journalPersistenceService.findAllTrades();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Database read failed, reading all trade logs: {}", e.getMessage());
            List<DailyLog> logs = new ArrayList<>();
            for (Path file : tradeLogStore.listLogFiles()) {
                logs.add(tradeLogStore.parse(file));
            }
            return flatten(logs);
        }
    }

    public List<RoundTrip> tradesForSymbol(String symbol, Integer limit) {
        return journalPersistenceService.findTradesBySymbol(symbol, limit);
    }

    public Optional<DailySummary> summaryOn(LocalDate date) {
        try {
            return journalPersistenceService.findSummary(date);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Database read failed for summary {}, reading trade log: {}", date, e.getMessage());
            return tradeLogStore.read(date).map(DailyLog::getSummary);
        }
    }

    private static List<RoundTrip> flatten(List<DailyLog> logs) {
        List<RoundTrip> trades = new ArrayList<>();
        for (DailyLog dailyLog : logs) {
            if (dailyLog.getTrades() != null) {
                trades.addAll(dailyLog.getTrades());
            }
        }
        return trades;
    }
}
