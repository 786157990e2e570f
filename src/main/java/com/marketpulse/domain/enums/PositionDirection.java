package com.marketpulse.domain.enums;

/**
 * Side of an option position. LONG pays the premium (debit), SHORT collects it (credit).
 */
public enum PositionDirection {
    LONG(1),
    SHORT(-1);

    private final int sign;

    PositionDirection(int sign) {
        this.sign = sign;
    }

    /** +1 for long, -1 for short. */
    public int sign() {
        return sign;
    }
}
