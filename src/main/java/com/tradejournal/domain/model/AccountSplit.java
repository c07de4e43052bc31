package com.tradejournal.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live vs training breakdown of a set of round trips.
 *
 * <p>{@code live} includes MIXED trades; {@code mixedTrades} keeps their count visible on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSplit {

    private AccountBreakdown live;
    private AccountBreakdown training;
    private int mixedTrades;
}
