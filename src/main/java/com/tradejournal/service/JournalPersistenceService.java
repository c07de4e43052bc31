package com.tradejournal.service;

import com.tradejournal.domain.enums.FillSide;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.entity.DailySummaryEntity;
import com.tradejournal.entity.FillEntity;
import com.tradejournal.entity.RoundTripEntity;
import com.tradejournal.mapper.DailySummaryMapper;
import com.tradejournal.mapper.FillMapper;
import com.tradejournal.mapper.RoundTripMapper;
import com.tradejournal.repository.jpa.DailySummaryJpaRepository;
import com.tradejournal.repository.jpa.FillJpaRepository;
import com.tradejournal.repository.jpa.RoundTripJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database side of the journal: upserts fills, round trips and daily summaries, and serves the
 * by-day, by-range and by-symbol queries.
 *
 * <p>Round trips are upserted by trade ID. Setup, notes and chart already stored for a trade are kept
 * when the incoming round trip carries none.
 */
@Service
public class JournalPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(JournalPersistenceService.class);

    private final FillJpaRepository fillJpaRepository;
    private final RoundTripJpaRepository roundTripJpaRepository;
    private final DailySummaryJpaRepository dailySummaryJpaRepository;
    private final FillMapper fillMapper;
    private final RoundTripMapper roundTripMapper;
    private final DailySummaryMapper dailySummaryMapper;

    public JournalPersistenceService(
            FillJpaRepository fillJpaRepository,
            RoundTripJpaRepository roundTripJpaRepository,
            DailySummaryJpaRepository dailySummaryJpaRepository,
            FillMapper fillMapper,
            RoundTripMapper roundTripMapper,
            DailySummaryMapper dailySummaryMapper) {
        this.fillJpaRepository = fillJpaRepository;
        this.roundTripJpaRepository = roundTripJpaRepository;
        this.dailySummaryJpaRepository = dailySummaryJpaRepository;
        this.fillMapper = fillMapper;
        this.roundTripMapper = roundTripMapper;
        this.dailySummaryMapper = dailySummaryMapper;
    }

    /**
     * Stores a freshly ingested day in one transaction.
     *
     * @return the day's round trips as stored, with previously attached annotations merged in
     */
    @Transactional
    public List<RoundTrip> saveDay(LocalDate date, List<Fill> fills, List<RoundTrip> roundTrips, DailySummary summary) {
        upsertFills(date, fills);
        List<RoundTrip> stored = upsertRoundTrips(roundTrips);
        upsertSummary(summary);
        log.info("Persisted {}: {} fills, {} round trips", date, fills.size(), stored.size());
        return stored;
    }

    /**
     * Upserts the day's fills by natural key. Identical partial fills within one export collapse into a
     * single row, the later one replacing the earlier.
     */
    @Transactional
    public void upsertFills(LocalDate date, List<Fill> fills) {
        Map<FillKey, Fill> unique = new LinkedHashMap<>();
        for (Fill fill : fills) {
            unique.put(FillKey.of(fill), fill);
        }
        if (unique.size() < fills.size()) {
            log.debug("Collapsed {} duplicate fills for {}", fills.size() - unique.size(), date);
        }

        List<FillEntity> entities = new ArrayList<>(unique.size());
        LocalDateTime now = LocalDateTime.now();
        for (Fill fill : unique.values()) {
            FillEntity entity = fillMapper.toEntity(fill, date);
            fillJpaRepository
                    .findByNaturalKey(
                            date,
                            fill.getTime(),
                            fill.getSymbol(),
                            fill.getSide(),
                            fill.getPrice(),
                            fill.getQuantity(),
                            fill.getAccount())
                    .ifPresentOrElse(
                            existing -> {
                                entity.setId(existing.getId());
                                entity.setCreatedAt(existing.getCreatedAt());
                            },
                            () -> entity.setCreatedAt(now));
            entities.add(entity);
        }
        fillJpaRepository.saveAll(entities);
    }

    @Transactional
    public List<RoundTrip> upsertRoundTrips(List<RoundTrip> roundTrips) {
        List<RoundTripEntity> entities = new ArrayList<>(roundTrips.size());
        LocalDateTime now = LocalDateTime.now();
        for (RoundTrip roundTrip : roundTrips) {
            RoundTripEntity entity = roundTripJpaRepository
                    .findById(roundTrip.getId())
                    .map(existing -> {
                        roundTripMapper.updateEntity(roundTrip, existing);
                        return existing;
                    })
                    .orElseGet(() -> {
                        RoundTripEntity created = roundTripMapper.toEntity(roundTrip);
                        created.setCreatedAt(now);
                        return created;
                    });
            entity.setUpdatedAt(now);
            entities.add(entity);
        }
        return roundTripMapper.toDomainList(roundTripJpaRepository.saveAll(entities));
    }

    @Transactional
    public void upsertSummary(DailySummary summary) {
        DailySummaryEntity entity = dailySummaryJpaRepository
                .findByDate(summary.getDate())
                .map(existing -> {
                    dailySummaryMapper.updateEntity(summary, existing);
                    return existing;
                })
                .orElseGet(() -> dailySummaryMapper.toEntity(summary));
        entity.setUpdatedAt(LocalDateTime.now());
        dailySummaryJpaRepository.save(entity);
    }

    /** Saves changes to a single stored round trip, e.g. new annotations. */
    @Transactional
    public RoundTrip saveTrade(RoundTrip roundTrip) {
        return upsertRoundTrips(List.of(roundTrip)).get(0);
    }

    public Optional<RoundTrip> findTrade(String id) {
        return roundTripJpaRepository.findById(id).map(roundTripMapper::toDomain);
    }

    public List<RoundTrip> findTrades(LocalDate date) {
        return roundTripMapper.toDomainList(roundTripJpaRepository.findByDateOrderByEntryTimeAsc(date));
    }

    public List<RoundTrip> findTrades(LocalDate from, LocalDate to) {
        return roundTripMapper.toDomainList(roundTripJpaRepository.findByDateRange(from, to));
    }

    public List<RoundTrip> findAllTrades() {
        return roundTripMapper.toDomainList(roundTripJpaRepository.findAllOrdered());
    }

    /** Trades for a symbol, newest first; a null or non-positive limit returns all of them. */
    public List<RoundTrip> findTradesBySymbol(String symbol, Integer limit) {
        Pageable page = limit != null && limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        return roundTripMapper.toDomainList(roundTripJpaRepository.findBySymbol(symbol, page));
    }

    public long countTrades(LocalDate date, String symbol) {
        return roundTripJpaRepository.countByDateAndSymbol(date, symbol);
    }

    public List<LocalDate> findTradingDates() {
        return roundTripJpaRepository.findDistinctDates();
    }

    public Optional<DailySummary> findSummary(LocalDate date) {
        return dailySummaryJpaRepository.findByDate(date).map(dailySummaryMapper::toDomain);
    }

    public List<Fill> findFills(LocalDate date) {
        return fillMapper.toDomainList(fillJpaRepository.findByDateOrderByTimeAsc(date));
    }

    /** Natural key of a stored fill within one day. Prices compare by value, so 150 and 150.00 match. */
    private record FillKey(
            LocalTime time, String symbol, FillSide side, BigDecimal price, int quantity, String account) {

        static FillKey of(Fill fill) {
            BigDecimal price = fill.getPrice() == null ? null : fill.getPrice().stripTrailingZeros();
            return new FillKey(
                    fill.getTime(), fill.getSymbol(), fill.getSide(), price, fill.getQuantity(), fill.getAccount());
        }
    }
}
