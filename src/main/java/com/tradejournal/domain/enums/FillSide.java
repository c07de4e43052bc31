package com.tradejournal.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Side of a single broker execution. Broker exports report these as {@code B}, {@code S} and {@code SS}.
 *
 * <p>SELL and SELL_SHORT both reduce the running position: the feed does not distinguish
 * sell-to-close from sell-to-open at fill level.
 */
public enum FillSide {
    BUY("B"),
    SELL("S"),
    SELL_SHORT("SS");

    private final String code;

    FillSide(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Signed position change for a fill of this side: +qty for BUY, -qty otherwise. */
    public long signedQuantity(int quantity) {
        return this == BUY ? quantity : -(long) quantity;
    }

    public boolean isSell() {
        return this != BUY;
    }

    /** Resolves a broker code or enum name ({@code B}, {@code Buy}, {@code SS}, {@code SellShort}...). */
    public static Optional<FillSide> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("_", "");
        return switch (normalized) {
            case "B", "BUY" -> Optional.of(BUY);
            case "S", "SELL" -> Optional.of(SELL);
            case "SS", "SELLSHORT", "SHORT" -> Optional.of(SELL_SHORT);
            default -> Optional.empty();
        };
    }
}
