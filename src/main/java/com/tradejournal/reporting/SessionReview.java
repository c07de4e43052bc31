package com.tradejournal.reporting;

import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.domain.model.GroupedStat;
import com.tradejournal.domain.model.RoundTrip;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** End-of-day review of one session: the summary, best and worst trades, and reflection prompts. */
@Data
@Builder
public class SessionReview {

    private LocalDate date;
    private DailySummary summary;
    private RoundTrip bestTrade;
    private RoundTrip worstTrade;
    private List<GroupedStat> setupBreakdown;
    private List<RoundTrip> trades;
    private List<String> reflectionQuestions;
}
