package com.tradejournal.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradejournal.api.controller.JournalController;
import com.tradejournal.domain.enums.AccountType;
import com.tradejournal.domain.enums.IngestStatus;
import com.tradejournal.domain.enums.TradeDirection;
import com.tradejournal.domain.model.IngestResult;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.domain.model.TradeLogTransferResult;
import com.tradejournal.exception.GlobalExceptionHandler;
import com.tradejournal.exception.ResourceNotFoundException;
import com.tradejournal.reporting.ReportingService;
import com.tradejournal.service.JournalIngestService;
import com.tradejournal.service.JournalPersistenceService;
import com.tradejournal.service.ManualTradeService;
import com.tradejournal.service.TradeAnnotationService;
import com.tradejournal.service.TradeHistoryService;
import com.tradejournal.service.TradeLogTransferService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for JournalController.
 *
 * <p>Verifies: ingest parameters, trade listing, manual entry (201 and validation), annotation,
 * not-found mapping, and export/import.
 */
class JournalControllerTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 15);

    private MockMvc mockMvc;

    @Mock
    private JournalIngestService journalIngestService;

    @Mock
    private TradeHistoryService tradeHistoryService;

    @Mock
    private JournalPersistenceService journalPersistenceService;

    @Mock
    private ManualTradeService manualTradeService;

    @Mock
    private TradeAnnotationService tradeAnnotationService;

    @Mock
    private TradeLogTransferService tradeLogTransferService;

    @Mock
    private ReportingService reportingService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        JournalController controller = new JournalController(
                journalIngestService,
                tradeHistoryService,
                journalPersistenceService,
                manualTradeService,
                tradeAnnotationService,
                tradeLogTransferService,
                reportingService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void ingest_passesDateSourceAndDryRun() throws Exception {
        when(journalIngestService.ingest(DATE, "/data/review", true))
                .thenReturn(IngestResult.builder()
                        .date(DATE)
                        .status(IngestStatus.DRY_RUN)
                        .fillCount(4)
                        .warnings(List.of())
                        .build());

        mockMvc.perform(post("/api/journal/ingest")
                        .param("date", "2026-01-15")
                        .param("source", "/data/review")
                        .param("dryRun", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRY_RUN"))
                .andExpect(jsonPath("$.fillCount").value(4));
    }

    @Test
    void ingest_missingDate_returns400() throws Exception {
        mockMvc.perform(post("/api/journal/ingest")).andExpect(status().isBadRequest());
    }

    @Test
    void ingest_missingFolder_returns404() throws Exception {
        when(journalIngestService.ingest(eq(DATE), isNull(), eq(false)))
                .thenThrow(new ResourceNotFoundException("Trade review folder", "data/trade-review/2026/01/2026-01-15"));

        mockMvc.perform(post("/api/journal/ingest").param("date", "2026-01-15"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void getTrades_returnsDay() throws Exception {
        when(tradeHistoryService.tradesOn(DATE)).thenReturn(List.of(trade()));

        mockMvc.perform(get("/api/journal/trades").param("date", "2026-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("2026-01-15-AAPL-1"))
                .andExpect(jsonPath("$[0].direction").value("LONG"))
                .andExpect(jsonPath("$[0].netPnl").value(250.00));
    }

    @Test
    void getTrades_emptyDayIsEmptyList() throws Exception {
        when(tradeHistoryService.tradesOn(DATE)).thenReturn(List.of());

        mockMvc.perform(get("/api/journal/trades").param("date", "2026-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void getTradesBySymbol_upperCasesSymbol() throws Exception {
        when(tradeHistoryService.tradesForSymbol("AAPL", 10)).thenReturn(List.of(trade()));

        mockMvc.perform(get("/api/journal/trades/symbol/aapl").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].symbol").value("AAPL"));
    }

    @Test
    void logTrade_returns201() throws Exception {
        when(manualTradeService.logTrade(any())).thenReturn(trade());

        mockMvc.perform(post("/api/journal/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"symbol":"AAPL","direction":"LONG","entryPrice":150.00,"exitPrice":152.50,"shares":100,"setup":"orb","date":"2026-01-15","time":"09:30:00"}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("2026-01-15-AAPL-1"));

        ArgumentCaptor<RoundTrip> draft = ArgumentCaptor.forClass(RoundTrip.class);
        verify(manualTradeService).logTrade(draft.capture());
        assertThat(draft.getValue().getTotalShares()).isEqualTo(100);
        assertThat(draft.getValue().getEntryTime()).isEqualTo(LocalTime.of(9, 30));
    }

    @Test
    void logTrade_zeroShares_returns400() throws Exception {
        mockMvc.perform(post("/api/journal/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"symbol":"AAPL","direction":"LONG","entryPrice":150.00,"exitPrice":152.50,"shares":0}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.shares").value("Shares must be at least 1"));
        verify(manualTradeService, never()).logTrade(any());
    }

    @Test
    void logTrade_missingDirection_returns400() throws Exception {
        mockMvc.perform(post("/api/journal/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"symbol":"AAPL","entryPrice":150.00,"exitPrice":152.50,"shares":10}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void annotateTrade_returnsUpdatedTrade() throws Exception {
        RoundTrip annotated = trade();
        annotated.setSetup("orb");
        when(tradeAnnotationService.annotate("2026-01-15-AAPL-1", "orb", null, null)).thenReturn(annotated);

        mockMvc.perform(patch("/api/journal/trades/2026-01-15-AAPL-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"setup":"orb"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.setup").value("orb"));
    }

    @Test
    void annotateTrade_unknownId_returns404() throws Exception {
        when(tradeAnnotationService.annotate(eq("nope"), any(), any(), any()))
                .thenThrow(new ResourceNotFoundException("Trade", "nope"));

        mockMvc.perform(patch("/api/journal/trades/nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\":\"x\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void review_noTrades_returns404() throws Exception {
        when(reportingService.getSessionReview(DATE)).thenThrow(new ResourceNotFoundException("Trades", "2026-01-15"));

        mockMvc.perform(get("/api/journal/review").param("date", "2026-01-15"))
                .andExpect(status().isNotFound());
    }

    @Test
    void exportAndImport() throws Exception {
        when(tradeLogTransferService.exportDay(DATE))
                .thenReturn(TradeLogTransferResult.builder()
                        .days(1)
                        .trades(3)
                        .files(List.of("data/trade-log/2026-01-15.yaml"))
                        .skippedFiles(List.of())
                        .build());
        when(tradeLogTransferService.importAll())
                .thenReturn(TradeLogTransferResult.builder()
                        .days(2)
                        .trades(5)
                        .files(List.of("2026-01-14.yaml", "2026-01-15.yaml"))
                        .skippedFiles(List.of("broken.yaml"))
                        .build());

        mockMvc.perform(post("/api/journal/export").param("date", "2026-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trades").value(3));
        mockMvc.perform(post("/api/journal/import"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.days").value(2))
                .andExpect(jsonPath("$.skippedFiles[0]").value("broken.yaml"));
    }

    private static RoundTrip trade() {
        return RoundTrip.builder()
                .id("2026-01-15-AAPL-1")
                .date(DATE)
                .symbol("AAPL")
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("150.00"))
                .exitPrice(new BigDecimal("152.50"))
                .totalShares(100)
                .grossPnl(new BigDecimal("250.00"))
                .fees(new BigDecimal("0.60"))
                .netPnl(new BigDecimal("250.00"))
                .entryTime(LocalTime.of(9, 30))
                .exitTime(LocalTime.of(9, 45))
                .accounts(List.of("A1"))
                .accountType(AccountType.LIVE)
                .build();
    }
}
