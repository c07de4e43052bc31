package com.tradejournal.service;

import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Attaches journal annotations (setup tag, notes, chart) to a stored round trip.
 * Only non-null fields of the update are applied. P&L is untouched, so the day's summary stays valid.
 */
@Service
public class TradeAnnotationService {

    private static final Logger log = LoggerFactory.getLogger(TradeAnnotationService.class);

    private final JournalPersistenceService journalPersistenceService;

    public TradeAnnotationService(JournalPersistenceService journalPersistenceService) {
        this.journalPersistenceService = journalPersistenceService;
    }

    @Transactional
    public RoundTrip annotate(String tradeId, String setup, String notes, String chart) {
        RoundTrip trade = journalPersistenceService
                .findTrade(tradeId)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));

        if (setup != null) {
            trade.setSetup(setup.trim());
        }
        if (notes != null) {
            trade.setNotes(notes);
        }
        if (chart != null) {
            trade.setChart(chart.trim());
        }

        RoundTrip saved = journalPersistenceService.saveTrade(trade);
        log.info("Trade annotated: id={}, setup={}", tradeId, saved.getSetup());
        return saved;
    }
}
