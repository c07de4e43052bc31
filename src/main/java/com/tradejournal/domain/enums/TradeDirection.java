package com.tradejournal.domain.enums;

/** Direction of a round trip, fixed by the side of its first fill. */
public enum TradeDirection {
    LONG,
    SHORT;

    public static TradeDirection openedBy(FillSide side) {
        return side == FillSide.BUY ? LONG : SHORT;
    }

    /** True when a fill of the given side adds to (rather than reduces) a position in this direction. */
    public boolean isEntrySide(FillSide side) {
        return this == LONG ? side == FillSide.BUY : side.isSell();
    }
}
