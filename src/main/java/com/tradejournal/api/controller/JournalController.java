package com.tradejournal.api.controller;

import com.tradejournal.api.dto.request.ManualTradeRequest;
import com.tradejournal.api.dto.request.TradeAnnotationRequest;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.IngestResult;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.domain.model.TradeLogTransferResult;
import com.tradejournal.reporting.ReportingService;
import com.tradejournal.reporting.SessionReview;
import com.tradejournal.service.JournalIngestService;
import com.tradejournal.service.JournalPersistenceService;
import com.tradejournal.service.ManualTradeService;
import com.tradejournal.service.TradeAnnotationService;
import com.tradejournal.service.TradeHistoryService;
import com.tradejournal.service.TradeLogTransferService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the trade journal: ingesting broker exports, listing and annotating trades,
 * manual entries, session review and YAML log transfer.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/journal/ingest} -- ingest a day's broker export</li>
 *   <li>{@code GET /api/journal/trades} -- a day's round trips</li>
 *   <li>{@code GET /api/journal/trades/symbol/{symbol}} -- trades for a symbol, newest first</li>
 *   <li>{@code POST /api/journal/trades} -- log a trade by hand</li>
 *   <li>{@code PATCH /api/journal/trades/{id}} -- set setup, notes or chart</li>
 *   <li>{@code GET /api/journal/fills} -- a day's raw fills</li>
 *   <li>{@code GET /api/journal/review} -- end-of-day session review</li>
 *   <li>{@code POST /api/journal/export} -- write a stored day to its YAML log</li>
 *   <li>{@code POST /api/journal/import} -- load all YAML logs into the database</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/journal")
public class JournalController {

    private final JournalIngestService journalIngestService;
    private final TradeHistoryService tradeHistoryService;
    private final JournalPersistenceService journalPersistenceService;
    private final ManualTradeService manualTradeService;
    private final TradeAnnotationService tradeAnnotationService;
    private final TradeLogTransferService tradeLogTransferService;
    private final ReportingService reportingService;

    public JournalController(
            JournalIngestService journalIngestService,
            TradeHistoryService tradeHistoryService,
            JournalPersistenceService journalPersistenceService,
            ManualTradeService manualTradeService,
            TradeAnnotationService tradeAnnotationService,
            TradeLogTransferService tradeLogTransferService,
            ReportingService reportingService) {
        this.journalIngestService = journalIngestService;
        this.tradeHistoryService = tradeHistoryService;
        this.journalPersistenceService = journalPersistenceService;
        this.manualTradeService = manualTradeService;
        this.tradeAnnotationService = tradeAnnotationService;
        this.tradeLogTransferService = tradeLogTransferService;
        this.reportingService = reportingService;
    }

    @PostMapping("/ingest")
    public IngestResult ingest(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String source,
            @RequestParam(defaultValue = "false") boolean dryRun) {
        return journalIngestService.ingest(date, source, dryRun);
    }

    @GetMapping("/trades")
    public List<RoundTrip> getTrades(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return tradeHistoryService.tradesOn(date != null ? date : LocalDate.now());
    }

    @GetMapping("/trades/symbol/{symbol}")
    public List<RoundTrip> getTradesBySymbol(
            @PathVariable String symbol, @RequestParam(required = false) Integer limit) {
        return tradeHistoryService.tradesForSymbol(symbol.toUpperCase(Locale.ROOT), limit);
    }

    @PostMapping("/trades")
    @ResponseStatus(HttpStatus.CREATED)
    public RoundTrip logTrade(@RequestBody @Valid ManualTradeRequest request) {
        RoundTrip draft = RoundTrip.builder()
                .symbol(request.getSymbol())
                .direction(request.getDirection())
                .entryPrice(request.getEntryPrice())
                .exitPrice(request.getExitPrice())
                .totalShares(request.getShares())
                .setup(request.getSetup())
                .notes(request.getNotes())
                .date(request.getDate())
                .entryTime(request.getTime())
                .build();
        return manualTradeService.logTrade(draft);
    }

    @PatchMapping("/trades/{id}")
    public RoundTrip annotateTrade(@PathVariable String id, @RequestBody @Valid TradeAnnotationRequest request) {
        return tradeAnnotationService.annotate(id, request.getSetup(), request.getNotes(), request.getChart());
    }

    @GetMapping("/fills")
    public List<Fill> getFills(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return journalPersistenceService.findFills(date);
    }

    @GetMapping("/review")
    public SessionReview getReview(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return reportingService.getSessionReview(date != null ? date : LocalDate.now());
    }

    @PostMapping("/export")
    public TradeLogTransferResult exportDay(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return tradeLogTransferService.exportDay(date != null ? date : LocalDate.now());
    }

    @PostMapping("/import")
    public TradeLogTransferResult importLogs() {
        return tradeLogTransferService.importAll();
    }
}
