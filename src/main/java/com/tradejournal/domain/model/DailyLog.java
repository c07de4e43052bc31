package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One day's trade log document, as written to and read from the YAML trade log directory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DailyLog {

    private LocalDate date;
    private String source;
    private DailySummary summary;
    private List<RoundTrip> trades;
}
