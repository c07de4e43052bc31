package com.tradejournal.roundtrip;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort lookup of a chart screenshot saved next to the day's broker export.
 *
 * <p>Matches the first image (alphabetical order) whose file name starts with the symbol, ignoring
 * case. A missing or unreadable folder means "no chart".
 */
@Component
public class ChartLocator {

    private static final Logger log = LoggerFactory.getLogger(ChartLocator.class);

    public Optional<String> findChart(String symbol, Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            return Optional.empty();
        }
        String prefix = symbol.toLowerCase(Locale.ROOT);
        try (Stream<Path> files = Files.list(folder)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.toLowerCase(Locale.ROOT).startsWith(prefix))
                    .filter(ChartLocator::isImage)
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            log.debug("Chart lookup failed for {} in {}: {}", symbol, folder, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isImage(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".jpg") || lower.endsWith(".jpeg") || lower.endsWith(".png");
    }
}
