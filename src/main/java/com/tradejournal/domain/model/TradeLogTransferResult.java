package com.tradejournal.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of exporting days to, or importing days from, the YAML trade log directory. */
@Data
@Builder
public class TradeLogTransferResult {

    private int days;
    private int trades;
    private List<String> files;
    private List<String> skippedFiles;
}
