package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.IngestStatus;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of ingesting one day of broker fills.
 *
 * <p>{@code reconciliation} is null when no positions report was found. {@code persisted} is false
 * for dry runs and when the database could not be written; the reconstructed log is still returned.
 */
@Data
@Builder
public class IngestResult {

    private LocalDate date;
    private IngestStatus status;
    private int fillCount;
    private int skippedRows;
    private DailyLog log;
    private PnlCrossCheck reconciliation;
    private boolean persisted;
    private String tradeLogPath;
    private List<String> warnings;
}
