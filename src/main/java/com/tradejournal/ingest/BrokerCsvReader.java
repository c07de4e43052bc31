package com.tradejournal.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.tradejournal.exception.TradeLogException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reads broker CSV exports into header-keyed rows.
 *
 * <p>Broker exports carry a trailing comma on every line (including the header) and pad values with
 * spaces, so rows are read as plain string arrays and keyed by the trimmed header names. Columns with
 * a blank header are dropped; short rows simply lack the missing keys.
 */
@Component
public class BrokerCsvReader {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Reads the given CSV file.
     *
     * @throws TradeLogException if the file cannot be read or is not valid CSV
     */
    public List<Map<String, String>> readRows(Path csv) {
        try {
            return parseRows(Files.readString(csv, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TradeLogException("Failed to read broker export " + csv, e);
        }
    }

    /** Parses CSV content whose first non-empty line is the header. */
    public List<Map<String, String>> parseRows(String content) {
        if (content.startsWith(BYTE_ORDER_MARK)) {
            content = content.substring(1);
        }

        List<String[]> lines;
        try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class).readValues(content)) {
            lines = it.readAll();
        } catch (IOException e) {
            throw new TradeLogException("Malformed CSV content", e);
        }

        List<Map<String, String>> rows = new ArrayList<>();
        if (lines.isEmpty()) {
            return rows;
        }

        String[] header = lines.get(0);
        for (int i = 1; i < lines.size(); i++) {
            String[] values = lines.get(i);
            Map<String, String> row = new LinkedHashMap<>();
            boolean blank = true;
            for (int col = 0; col < Math.min(header.length, values.length); col++) {
                String name = header[col] == null ? "" : header[col].trim();
                if (name.isEmpty()) {
                    continue;
                }
                String value = values[col] == null ? "" : values[col].trim();
                row.put(name, value);
                blank &= value.isEmpty();
            }
            if (!blank) {
                rows.add(row);
            }
        }
        return rows;
    }
}
