package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Share of a quarter's revenue falling in each of its three months.
 */
public record MonthlySplit(List<BigDecimal> weights) {

    public static final MonthlySplit DEFAULT = new MonthlySplit(WeightSet.of("0.30", "0.33", "0.37"));

    /** Q4 split, back-loaded toward December. */
    public static final MonthlySplit HOLIDAY = new MonthlySplit(WeightSet.of("0.28", "0.32", "0.40"));

    public MonthlySplit {
        weights = WeightSet.validate("Monthly split", weights, 3);
    }

    /** One split per quarter: the default for Q1 to Q3 and the holiday split for Q4. */
    public static List<MonthlySplit> standardYear() {
        return List.of(DEFAULT, DEFAULT, DEFAULT, HOLIDAY);
    }
}
