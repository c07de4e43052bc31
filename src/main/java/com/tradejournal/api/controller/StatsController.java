package com.tradejournal.api.controller;

import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.reporting.PeriodStatsReport;
import com.tradejournal.reporting.ReportingService;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for trading statistics.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/stats} -- period stats for a day, a range or the last week</li>
 *   <li>{@code GET /api/stats/by-setup} -- grouped by setup tag</li>
 *   <li>{@code GET /api/stats/by-time} -- grouped by entry time-of-day bucket</li>
 *   <li>{@code GET /api/stats/by-account} -- grouped by account type</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final ReportingService reportingService;

    public StatsController(ReportingService reportingService) {
        this.reportingService = reportingService;
    }

    @GetMapping
    public PeriodStatsReport getStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(defaultValue = "false") boolean week,
            @RequestParam(required = false) String symbol) {
        return reportingService.getPeriodStats(date, from, to, week, symbol);
    }

    @GetMapping("/by-setup")
    public List<GroupedStat> getStatsBySetup(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportingService.getStatsBySetup(from, to);
    }

    @GetMapping("/by-time")
    public List<GroupedStat> getStatsByTimeOfDay(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportingService.getStatsByTimeOfDay(from, to);
    }

    @GetMapping("/by-account")
    public List<GroupedStat> getStatsByAccountType(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return reportingService.getStatsByAccountType(from, to);
    }
}
