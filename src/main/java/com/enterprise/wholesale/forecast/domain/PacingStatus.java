package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;

public enum PacingStatus {
    AHEAD,
    ON_TRACK,
    BEHIND;

    private static final BigDecimal BAND = BigDecimal.valueOf(5);

    /** {@code >= 5%} ahead, {@code >= -5%} on track, otherwise behind. */
    public static PacingStatus of(BigDecimal variancePct) {
        if (variancePct.compareTo(BAND) >= 0) {
            return AHEAD;
        }
        if (variancePct.compareTo(BAND.negate()) >= 0) {
            return ON_TRACK;
        }
        return BEHIND;
    }
}
