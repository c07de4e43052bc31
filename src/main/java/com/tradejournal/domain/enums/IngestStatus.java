package com.tradejournal.domain.enums;

/** Terminal state of an ingest run. NO_FILLS is a normal outcome, not an error. */
public enum IngestStatus {
    INGESTED,
    DRY_RUN,
    NO_FILLS
}
