package com.tradejournal.domain.enums;

import java.util.Locale;

/**
 * Classification of the accounts touched by a round trip.
 *
 * <p>LIVE = real-money accounts only, TRAINING = simulated accounts only (name starts with the
 * configured training prefix), MIXED = both.
 */
public enum AccountType {
    LIVE,
    TRAINING,
    MIXED;

    /**
     * Bucket this type is reported under in the per-account P&L breakdown.
     * MIXED trades carry live risk, so their P&L and win rate count toward LIVE.
     */
    public AccountType reportingBucket() {
        return this == MIXED ? LIVE : this;
    }

    /** Lower-case label used as the grouping key in statistics ({@code live}, {@code training}, {@code mixed}). */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
