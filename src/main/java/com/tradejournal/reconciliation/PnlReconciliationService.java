package com.tradejournal.reconciliation;

import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.model.PnlCrossCheck;
import com.tradejournal.ingest.BrokerCsvReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-checks a day's computed P&L against the broker's positions report.
 *
 * <p>The positions export ends with a {@code Summary} row whose {@code Realized} column is the
 * broker's own total for the day. A difference above the configured tolerance is logged at WARN and
 * reported back to the caller; it never fails the ingest.
 */
@Service
public class PnlReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PnlReconciliationService.class);

    static final String SUMMARY_SYMBOL = "Summary";
    static final String COL_SYMBOL = "Symbol";
    static final String COL_REALIZED = "Realized";

    private final BrokerCsvReader brokerCsvReader;
    private final JournalConfig journalConfig;

    public PnlReconciliationService(BrokerCsvReader brokerCsvReader, JournalConfig journalConfig) {
        this.brokerCsvReader = brokerCsvReader;
        this.journalConfig = journalConfig;
    }

    /**
     * Compares against the positions report, if one exists.
     *
     * @return empty when the file is absent or carries no usable Summary row
     */
    public Optional<PnlCrossCheck> crossCheck(Path positionsCsv, BigDecimal computedPnl) {
        if (positionsCsv == null || !Files.isRegularFile(positionsCsv)) {
            return Optional.empty();
        }
        return reportedRealizedPnl(brokerCsvReader.readRows(positionsCsv))
                .map(reported -> compare(reported, computedPnl));
    }

    public Optional<BigDecimal> reportedRealizedPnl(List<Map<String, String>> rows) {
        for (Map<String, String> row : rows) {
            if (!SUMMARY_SYMBOL.equals(row.get(COL_SYMBOL))) {
                continue;
            }
            String realized = row.get(COL_REALIZED);
            try {
                return Optional.of(new BigDecimal(realized));
            } catch (NumberFormatException | NullPointerException e) {
                log.debug("Positions Summary row has no numeric Realized value: {}", realized);
                return Optional.empty();
            }
        }
        log.debug("Positions report has no Summary row");
        return Optional.empty();
    }

    public PnlCrossCheck compare(BigDecimal reportedPnl, BigDecimal computedPnl) {
        BigDecimal tolerance = journalConfig.getReconciliationTolerance();
        BigDecimal difference = reportedPnl.subtract(computedPnl).abs().setScale(2, RoundingMode.HALF_UP);
        boolean within = difference.compareTo(tolerance) <= 0;

        if (!within) {
            log.warn(
                    "P&L discrepancy: positions summary={}, computed={}, diff={}",
                    reportedPnl.setScale(2, RoundingMode.HALF_UP),
                    computedPnl,
                    difference);
        }

        return PnlCrossCheck.builder()
                .reportedPnl(reportedPnl.setScale(2, RoundingMode.HALF_UP))
                .computedPnl(computedPnl)
                .difference(difference)
                .tolerance(tolerance)
                .withinTolerance(within)
                .build();
    }
}
