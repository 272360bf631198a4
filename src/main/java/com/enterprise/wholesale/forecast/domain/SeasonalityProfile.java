package com.enterprise.wholesale.forecast.domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Quarterly curve per channel plus the monthly split of each quarter.
 */
public record SeasonalityProfile(Map<Channel, SeasonalityCurve> curves, List<MonthlySplit> monthlySplits) {

    public SeasonalityProfile {
        for (Channel channel : Channel.values()) {
            Objects.requireNonNull(curves.get(channel), () -> "no seasonality curve for " + channel);
        }
        if (monthlySplits.size() != 4) {
            throw new IllegalArgumentException("one monthly split per quarter is required, got "
                    + monthlySplits.size());
        }
        curves = Map.copyOf(new EnumMap<>(curves));
        monthlySplits = List.copyOf(monthlySplits);
    }

    public static SeasonalityProfile standard() {
        return new SeasonalityProfile(
            Map.of(Channel.B2B, SeasonalityCurve.B2B, Channel.CORPORATE, SeasonalityCurve.CORPORATE),
            MonthlySplit.standardYear());
    }

    public SeasonalityCurve curve(Channel channel) {
        return curves.get(channel);
    }
}
