package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.forecast.domain.NewDoorFactors;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Partial-year contribution of new doors.
 *
 * <p>A door opened in month {@code m} (1-based) yields {@code (13 - m) / 12} of
 * a full year. Averaging that over the completed months gives the acquired
 * factor; averaging over the remaining months gives the remaining factor.
 */
public final class NewDoorContributionFactors {

    private static final int SCALE = 10;
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private NewDoorContributionFactors() {}

    public static NewDoorFactors compute(int fiscalYear, LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        int elapsed;
        if (asOf.getYear() < fiscalYear) {
            elapsed = 0;
        } else if (asOf.getYear() > fiscalYear) {
            elapsed = 12;
        } else {
            elapsed = asOf.getMonthValue() - 1;
        }
        int remaining = 12 - elapsed;
        return new NewDoorFactors(elapsed, remaining, acquiredFactor(elapsed), remainingFactor(remaining));
    }

    static BigDecimal acquiredFactor(int monthsElapsed) {
        if (monthsElapsed == 0) {
            return BigDecimal.ZERO;
        }
        int sum = 0;
        for (int i = 0; i < monthsElapsed; i++) {
            sum += 12 - i;
        }
        return average(sum, monthsElapsed);
    }

    static BigDecimal remainingFactor(int monthsRemaining) {
        if (monthsRemaining == 0) {
            return BigDecimal.ZERO;
        }
        int sum = 0;
        for (int k = 1; k <= monthsRemaining; k++) {
            sum += k;
        }
        return average(sum, monthsRemaining);
    }

    private static BigDecimal average(int monthSum, int months) {
        return BigDecimal.valueOf(monthSum)
            .divide(BigDecimal.valueOf(months).multiply(TWELVE), SCALE, RoundingMode.HALF_UP);
    }
}
