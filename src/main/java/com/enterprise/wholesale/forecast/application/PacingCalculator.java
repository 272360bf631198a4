package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.forecast.domain.PacingStatus;
import com.enterprise.wholesale.forecast.domain.QuarterPacing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Quarter-by-quarter comparison of actual revenue to target for the as-of year.
 */
public class PacingCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<QuarterPacing> buildQuarterlyPacing(List<BigDecimal> targets,
                                                    List<BigDecimal> actuals,
                                                    LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        requireQuarters("targets", targets);
        requireQuarters("actuals", actuals);

        int currentQuarter = asOf.get(IsoFields.QUARTER_OF_YEAR);
        List<QuarterPacing> result = new ArrayList<>(4);
        for (int q = 1; q <= 4; q++) {
            BigDecimal target = targets.get(q - 1);
            BigDecimal actual = actuals.get(q - 1);
            BigDecimal variance = actual.subtract(target);
            BigDecimal variancePct = target.signum() > 0
                    ? variance.multiply(HUNDRED).divide(target, 1, RoundingMode.HALF_UP)
                    : BigDecimal.ZERO.setScale(1);

            LocalDate start = quarterStart(asOf.getYear(), q);
            int daysTotal = daysInQuarter(q, asOf.getYear());
            int daysElapsed;
            if (q < currentQuarter) {
                daysElapsed = daysTotal;
            } else if (q == currentQuarter) {
                daysElapsed = (int) ChronoUnit.DAYS.between(start, asOf) + 1;
            } else {
                daysElapsed = 0;
            }

            result.add(new QuarterPacing(q, target, actual, variance, variancePct,
                    q < currentQuarter, q == currentQuarter, daysElapsed, daysTotal,
                    PacingStatus.of(variancePct)));
        }
        return result;
    }

    /** Q1 has 91 days in leap years, 90 otherwise. */
    public static int daysInQuarter(int quarter, int year) {
        LocalDate start = quarterStart(year, quarter);
        return (int) ChronoUnit.DAYS.between(start, start.plusMonths(3));
    }

    private static LocalDate quarterStart(int year, int quarter) {
        return LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
    }

    private static void requireQuarters(String name, List<BigDecimal> values) {
        if (values == null || values.size() != 4 || values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(name + " must hold four quarterly amounts: " + values);
        }
    }
}
