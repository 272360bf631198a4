package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Share of annual revenue falling in each quarter, Q1 first.
 */
public record SeasonalityCurve(List<BigDecimal> weights) {

    public static final SeasonalityCurve B2B = new SeasonalityCurve(
            WeightSet.of("0.20", "0.21", "0.22", "0.37"));

    /** Corporate gifting lands mostly in Q4. */
    public static final SeasonalityCurve CORPORATE = new SeasonalityCurve(
            WeightSet.of("0.20", "0.06", "0.16", "0.58"));

    public SeasonalityCurve {
        weights = WeightSet.validate("Seasonality curve", weights, 4);
    }

    public static SeasonalityCurve of(List<BigDecimal> weights) {
        return new SeasonalityCurve(weights);
    }

    public static SeasonalityCurve forChannel(Channel channel) {
        return channel == Channel.CORPORATE ? CORPORATE : B2B;
    }

    /** Weight of a 1-based quarter. */
    public BigDecimal weight(int quarter) {
        return weights.get(quarter - 1);
    }
}
