package com.tradejournal.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.domain.model.IngestResult;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.domain.model.TradeLogTransferResult;
import com.tradejournal.entity.DailySummaryEntity;
import com.tradejournal.entity.RoundTripEntity;
import com.tradejournal.ingest.BrokerCsvReader;
import com.tradejournal.ingest.FillNormalizer;
import com.tradejournal.mapper.DailySummaryMapper;
import com.tradejournal.mapper.FillMapper;
import com.tradejournal.mapper.RoundTripMapper;
import com.tradejournal.pnl.DailySummaryAggregator;
import com.tradejournal.reconciliation.PnlReconciliationService;
import com.tradejournal.reporting.ReportingService;
import com.tradejournal.reporting.SessionReview;
import com.tradejournal.reporting.StatisticsEngine;
import com.tradejournal.repository.jpa.DailySummaryJpaRepository;
import com.tradejournal.repository.jpa.FillJpaRepository;
import com.tradejournal.repository.jpa.RoundTripJpaRepository;
import com.tradejournal.roundtrip.AccountClassifier;
import com.tradejournal.roundtrip.ChartLocator;
import com.tradejournal.roundtrip.RoundTripReconstructor;
import com.tradejournal.service.JournalIngestService;
import com.tradejournal.service.JournalPersistenceService;
import com.tradejournal.service.TradeAnnotationService;
import com.tradejournal.service.TradeHistoryService;
import com.tradejournal.service.TradeLogStore;
import com.tradejournal.service.TradeLogTransferService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

/**
 * Cross-service integration test for the ingest flow.
 * Wires broker CSV -> fills -> round trips -> summary -> persistence -> trade log, then annotation,
 * re-ingest, reporting and trade log import against map-backed repositories.
 */
class IngestFlowIntegrationTest {

    private static final LocalDate DATE = LocalDate.of(2026, 1, 15);

    private static final String TRADES = """
            Time,Symbol,Side,Price,Qty,Route,Account,LiqType,ECNFee,P / L,
            09:31:05,AAPL,B,150.00,100,SMAT,A1,A,-0.30,0,
            09:35:40,AAPL,B,151.00,100,SMAT,A1,A,-0.30,0,
            09:52:10,AAPL,S,152.00,200,SMAT,A1,R,0.20,300.00,
            10:02:10,MSFT,SS,400.00,50,SMAT,TR1,A,0.10,0,
            10:20:40,MSFT,B,401.00,50,SMAT,TR1,A,0.10,-50.20,
            """;

    @TempDir
    Path dir;

    @Mock
    private FillJpaRepository fillJpaRepository;

    @Mock
    private RoundTripJpaRepository roundTripJpaRepository;

    @Mock
    private DailySummaryJpaRepository dailySummaryJpaRepository;

    private final Map<String, RoundTripEntity> roundTripTable = new LinkedHashMap<>();
    private final Map<LocalDate, DailySummaryEntity> summaryTable = new LinkedHashMap<>();

    private JournalConfig config;
    private JournalIngestService ingestService;
    private TradeAnnotationService annotationService;
    private ReportingService reportingService;
    private TradeLogTransferService transferService;
    private TradeLogStore tradeLogStore;

    @BeforeEach
    void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        stubRepositories();

        config = new JournalConfig();
        config.setTradeReviewPath(dir.resolve("review").toString());
        config.setTradeLogDirectory(dir.resolve("trade-log").toString());

        BrokerCsvReader csvReader = new BrokerCsvReader();
        DailySummaryAggregator aggregator = new DailySummaryAggregator();
        tradeLogStore = new TradeLogStore(config);
        JournalPersistenceService persistence = new JournalPersistenceService(
                fillJpaRepository,
                roundTripJpaRepository,
                dailySummaryJpaRepository,
                Mappers.getMapper(FillMapper.class),
                Mappers.getMapper(RoundTripMapper.class),
                Mappers.getMapper(DailySummaryMapper.class));

        ingestService = new JournalIngestService(
                config,
                csvReader,
                new FillNormalizer(),
                new RoundTripReconstructor(new AccountClassifier(config), new ChartLocator()),
                aggregator,
                new PnlReconciliationService(csvReader, config),
                persistence,
                tradeLogStore);
        annotationService = new TradeAnnotationService(persistence);
        reportingService = new ReportingService(
                new TradeHistoryService(persistence, tradeLogStore), aggregator, new StatisticsEngine());
        transferService = new TradeLogTransferService(persistence, aggregator, tradeLogStore);

        Path day = Files.createDirectories(dir.resolve("review").resolve("2026").resolve("01").resolve("2026-01-15"));
        Files.writeString(day.resolve("trades-2026-01-15.csv"), TRADES);
        Files.writeString(day.resolve("positions-2026-01-15.csv"), "Symbol,Realized,\nSummary,249.80,\n");
        Files.writeString(day.resolve("AAPL_0931.png"), "png");
    }

    @Test
    @DisplayName("Ingest stores round trips, summary and trade log")
    void ingestStoresEverything() {
        IngestResult result = ingestService.ingest(DATE, null, false);

        assertThat(result.isPersisted()).isTrue();
        assertThat(result.getReconciliation().isWithinTolerance()).isTrue();
        assertThat(roundTripTable).containsOnlyKeys("2026-01-15-AAPL-1", "2026-01-15-MSFT-1");

        RoundTripEntity aapl = roundTripTable.get("2026-01-15-AAPL-1");
        assertThat(aapl.getEntryPrice()).isEqualByComparingTo("150.50");
        assertThat(aapl.getExitPrice()).isEqualByComparingTo("152.00");
        assertThat(aapl.getTotalShares()).isEqualTo(200);
        assertThat(aapl.getFillCount()).isEqualTo(3);
        assertThat(aapl.getChart()).isEqualTo("AAPL_0931.png");

        DailySummaryEntity summary = summaryTable.get(DATE);
        assertThat(summary.getTotalPnl()).isEqualByComparingTo("249.80");
        assertThat(summary.getLiveTrades()).isEqualTo(1);
        assertThat(summary.getTrainingTrades()).isEqualTo(1);

        DailyLog written = tradeLogStore.read(DATE).orElseThrow();
        assertThat(written.getTrades()).hasSize(2);
    }

    @Test
    @DisplayName("Annotations survive re-ingesting the day")
    void annotationsSurviveReingest() {
        ingestService.ingest(DATE, null, false);
        annotationService.annotate("2026-01-15-AAPL-1", "orb", "waited for the pullback", null);

        IngestResult again = ingestService.ingest(DATE, null, false);

        assertThat(roundTripTable).hasSize(2);
        assertThat(roundTripTable.get("2026-01-15-AAPL-1").getSetup()).isEqualTo("orb");
        RoundTrip logged = again.getLog().getTrades().stream()
                .filter(t -> t.getId().equals("2026-01-15-AAPL-1"))
                .findFirst()
                .orElseThrow();
        assertThat(logged.getNotes()).isEqualTo("waited for the pullback");
        assertThat(tradeLogStore.read(DATE).orElseThrow().getTrades())
                .anyMatch(t -> "orb".equals(t.getSetup()));
    }

    @Test
    @DisplayName("Reports read the stored day")
    void reportsReadStoredDay() {
        ingestService.ingest(DATE, null, false);
        annotationService.annotate("2026-01-15-AAPL-1", "orb", null, null);

        List<GroupedStat> bySetup = reportingService.getStatsBySetup(DATE, DATE);
        assertThat(bySetup).extracting(GroupedStat::getKey).containsExactly("orb", "(untagged)");

        SessionReview review = reportingService.getSessionReview(DATE);
        assertThat(review.getBestTrade().getSymbol()).isEqualTo("AAPL");
        assertThat(review.getWorstTrade().getSymbol()).isEqualTo("MSFT");
        assertThat(review.getSummary().getTotalTrades()).isEqualTo(2);

        List<GroupedStat> byAccount = reportingService.getStatsByAccountType(null, null);
        assertThat(byAccount).extracting(GroupedStat::getKey).containsExactly("live", "training");
    }

    @Test
    @DisplayName("Trade log import rebuilds an empty database")
    void importRebuildsDatabase() {
        ingestService.ingest(DATE, null, false);
        roundTripTable.clear();
        summaryTable.clear();

        TradeLogTransferResult result = transferService.importAll();

        assertThat(result.getDays()).isEqualTo(1);
        assertThat(result.getTrades()).isEqualTo(2);
        assertThat(roundTripTable).containsOnlyKeys("2026-01-15-AAPL-1", "2026-01-15-MSFT-1");
        assertThat(summaryTable.get(DATE).getTotalPnl()).isEqualByComparingTo("249.80");
    }

    private void stubRepositories() {
        when(fillJpaRepository.findByNaturalKey(any(), any(), any(), any(), any(), anyInt(), any()))
                .thenReturn(Optional.empty());
        when(fillJpaRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        when(roundTripJpaRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(roundTripTable.get(inv.<String>getArgument(0))));
        when(roundTripJpaRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<RoundTripEntity> entities = inv.getArgument(0);
            entities.forEach(e -> roundTripTable.put(e.getId(), e));
            return entities;
        });
        when(roundTripJpaRepository.findByDateOrderByEntryTimeAsc(any()))
                .thenAnswer(inv -> tradesBetween(inv.getArgument(0), inv.getArgument(0)));
        when(roundTripJpaRepository.findByDateRange(any(), any()))
                .thenAnswer(inv -> tradesBetween(inv.getArgument(0), inv.getArgument(1)));
        when(roundTripJpaRepository.findAllOrdered())
                .thenAnswer(inv -> tradesBetween(LocalDate.MIN, LocalDate.MAX));

        when(dailySummaryJpaRepository.findByDate(any()))
                .thenAnswer(inv -> Optional.ofNullable(summaryTable.get(inv.<LocalDate>getArgument(0))));
        when(dailySummaryJpaRepository.save(any(DailySummaryEntity.class))).thenAnswer(inv -> {
            DailySummaryEntity entity = inv.getArgument(0);
            summaryTable.put(entity.getDate(), entity);
            return entity;
        });
    }

    private List<RoundTripEntity> tradesBetween(LocalDate from, LocalDate to) {
        return roundTripTable.values().stream()
                .filter(e -> !e.getDate().isBefore(from) && !e.getDate().isAfter(to))
                .sorted(Comparator.comparing(RoundTripEntity::getDate).thenComparing(RoundTripEntity::getEntryTime))
                .toList();
    }
}
