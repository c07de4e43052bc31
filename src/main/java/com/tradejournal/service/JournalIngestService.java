package com.tradejournal.service;

import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.enums.IngestStatus;
import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.IngestResult;
import com.tradejournal.domain.model.PnlCrossCheck;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.exception.ResourceNotFoundException;
import com.tradejournal.ingest.BrokerCsvReader;
import com.tradejournal.ingest.FillNormalizer;
import com.tradejournal.pnl.DailySummaryAggregator;
import com.tradejournal.reconciliation.PnlReconciliationService;
import com.tradejournal.roundtrip.RoundTripReconstructor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Ingests one trading day from the broker's export folder.
 *
 * <p>Flow: read {@code trades-{date}.csv} from {@code {base}/YYYY/MM/YYYY-MM-DD/}, normalize rows into
 * fills, reconstruct round trips, aggregate the daily summary, cross-check against
 * {@code positions-{date}.csv} when present, then (unless dry run) persist to the database and write
 * the YAML trade log.
 *
 * <p>A database failure does not lose the day: the YAML log is still written and the result is
 * returned with {@code persisted=false}. This covers an unreachable datasource, which surfaces as a
 * {@link TransactionException} when the transaction cannot be opened.
 */
@Service
public class JournalIngestService {

    private static final Logger log = LoggerFactory.getLogger(JournalIngestService.class);

    private final JournalConfig journalConfig;
    private final BrokerCsvReader brokerCsvReader;
    private final FillNormalizer fillNormalizer;
    private final RoundTripReconstructor roundTripReconstructor;
    private final DailySummaryAggregator dailySummaryAggregator;
    private final PnlReconciliationService pnlReconciliationService;
    private final JournalPersistenceService journalPersistenceService;
    private final TradeLogStore tradeLogStore;

    public JournalIngestService(
            JournalConfig journalConfig,
            BrokerCsvReader brokerCsvReader,
            FillNormalizer fillNormalizer,
            RoundTripReconstructor roundTripReconstructor,
            DailySummaryAggregator dailySummaryAggregator,
            PnlReconciliationService pnlReconciliationService,
            JournalPersistenceService journalPersistenceService,
            TradeLogStore tradeLogStore) {
        this.journalConfig = journalConfig;
        this.brokerCsvReader = brokerCsvReader;
        this.fillNormalizer = fillNormalizer;
        this.roundTripReconstructor = roundTripReconstructor;
        this.dailySummaryAggregator = dailySummaryAggregator;
        this.pnlReconciliationService = pnlReconciliationService;
        this.journalPersistenceService = journalPersistenceService;
        this.tradeLogStore = tradeLogStore;
    }

    /**
     * Ingests the day.
     *
     * @param date       trading date
     * @param sourceBase overrides the configured trade review path; may be null
     * @param dryRun     compute and return without writing anything
     * @throws ResourceNotFoundException if the day folder or the trades CSV does not exist
     */
    public IngestResult ingest(LocalDate date, String sourceBase, boolean dryRun) {
        Path dayDir = dayDirectory(sourceBase, date);
        if (!Files.isDirectory(dayDir)) {
            throw new ResourceNotFoundException("Trade review folder", dayDir.toString());
        }
        Path tradesCsv = dayDir.resolve("trades-" + date + ".csv");
        if (!Files.isRegularFile(tradesCsv)) {
            throw new ResourceNotFoundException("Trades CSV", tradesCsv.toString());
        }

        FillNormalizer.Result normalized = fillNormalizer.normalize(brokerCsvReader.readRows(tradesCsv));
        List<Fill> fills = normalized.fills();
        if (fills.isEmpty()) {
            log.info("No fills found in {}", tradesCsv);
            return IngestResult.builder()
                    .date(date)
                    .status(IngestStatus.NO_FILLS)
                    .skippedRows(normalized.skippedRows())
                    .warnings(List.of())
                    .build();
        }

        List<RoundTrip> roundTrips = roundTripReconstructor.reconstruct(date, fills, dayDir);
        String source = dayDir.toString().replace('\\', '/');
        DailySummary summary = dailySummaryAggregator.summarize(date, source, roundTrips);

        List<String> warnings = new ArrayList<>();
        if (normalized.skippedRows() > 0) {
            warnings.add(normalized.skippedRows() + " malformed rows skipped");
        }
        PnlCrossCheck crossCheck = pnlReconciliationService
                .crossCheck(dayDir.resolve("positions-" + date + ".csv"), summary.getTotalPnl())
                .orElse(null);
        if (crossCheck != null && !crossCheck.isWithinTolerance()) {
            warnings.add("P&L discrepancy of " + crossCheck.getDifference() + " against positions summary");
        }

        IngestResult.IngestResultBuilder result = IngestResult.builder()
                .date(date)
                .fillCount(fills.size())
                .skippedRows(normalized.skippedRows())
                .reconciliation(crossCheck)
                .warnings(warnings);

        if (dryRun) {
            log.info("Dry run for {}: {} fills -> {} round trips, P&L {}",
                    date, fills.size(), roundTrips.size(), summary.getTotalPnl());
            return result.status(IngestStatus.DRY_RUN)
                    .log(new DailyLog(date, source, summary, roundTrips))
                    .persisted(false)
                    .build();
        }

        List<RoundTrip> stored = roundTrips;
        boolean persisted = false;
        try {
            stored = journalPersistenceService.saveDay(date, fills, roundTrips, summary);
            persisted = true;
        } catch (DataAccessException | TransactionException e) {
            log.warn("Database write failed for {}, keeping YAML log only: {}", date, e.getMessage());
            warnings.add("Database unavailable; day written to the trade log only");
        }

        DailyLog dailyLog = new DailyLog(date, source, summary, stored);
        Path logPath = tradeLogStore.write(dailyLog);

        log.info("Ingested {}: {} fills -> {} round trips, P&L {}",
                date, fills.size(), stored.size(), summary.getTotalPnl());
        return result.status(IngestStatus.INGESTED)
                .log(dailyLog)
                .persisted(persisted)
                .tradeLogPath(logPath.toString())
                .build();
    }

    Path dayDirectory(String sourceBase, LocalDate date) {
        String base = sourceBase != null && !sourceBase.isBlank() ? sourceBase : journalConfig.getTradeReviewPath();
        return Paths.get(
                base, String.valueOf(date.getYear()), String.format("%02d", date.getMonthValue()), date.toString());
    }
}
