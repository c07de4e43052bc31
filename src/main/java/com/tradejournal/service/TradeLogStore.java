package com.tradejournal.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradejournal.config.JournalConfig;
import com.tradejournal.domain.model.DailyLog;
import com.tradejournal.exception.TradeLogException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads and writes the per-day YAML trade logs ({@code {tradeLogDirectory}/YYYY-MM-DD.yaml}).
 *
 * <p>The YAML log is the portable record of a day and the fallback read path when the database is
 * unavailable. Keys are snake_case.
 */
@Service
public class TradeLogStore {

    private static final Logger log = LoggerFactory.getLogger(TradeLogStore.class);

    private static final String EXTENSION = ".yaml";

    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        YAML = new ObjectMapper(factory);
        YAML.registerModule(new JavaTimeModule());
        YAML.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        YAML.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        YAML.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    private final JournalConfig journalConfig;

    public TradeLogStore(JournalConfig journalConfig) {
        this.journalConfig = journalConfig;
    }

    public Path pathFor(LocalDate date) {
        return directory().resolve(date + EXTENSION);
    }

    /**
     * Writes (or overwrites) the log for the day.
     *
     * @return the file written
     * @throws TradeLogException if the directory or file cannot be written
     */
    public Path write(DailyLog dailyLog) {
        Path target = pathFor(dailyLog.getDate());
        try {
            Files.createDirectories(target.getParent());
            YAML.writeValue(target.toFile(), dailyLog);
        } catch (IOException e) {
            throw new TradeLogException("Failed to write trade log " + target, e);
        }
        log.info("Trade log written: {} ({} trades)", target, dailyLog.getTrades().size());
        return target;
    }

    /**
     * Reads the log for the day.
     *
     * @return empty if no log exists for the day
     * @throws TradeLogException if the file exists but cannot be parsed
     */
    public Optional<DailyLog> read(LocalDate date) {
        Path file = pathFor(date);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(parse(file));
    }

    /** Reads every log in the date range, skipping days without one. */
    public List<DailyLog> readRange(LocalDate from, LocalDate to) {
        List<DailyLog> logs = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            read(day).ifPresent(logs::add);
        }
        return logs;
    }

    /** Lists all YAML files in the trade log directory, sorted by name (and so by date). */
    public List<Path> listLogFiles() {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TradeLogException("Failed to list trade log directory " + dir, e);
        }
    }

    /**
     * Parses a single log file.
     *
     * @throws TradeLogException if the file cannot be read or is not a trade log
     */
    public DailyLog parse(Path file) {
        try {
            return YAML.readValue(file.toFile(), DailyLog.class);
        } catch (IOException e) {
            throw new TradeLogException("Failed to read trade log " + file, e);
        }
    }

    private Path directory() {
        return Paths.get(journalConfig.getTradeLogDirectory());
    }
}
