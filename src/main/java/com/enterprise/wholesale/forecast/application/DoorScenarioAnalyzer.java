package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.forecast.domain.DoorScenario;
import com.enterprise.wholesale.forecast.domain.ForecastDrivers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Re-runs a forecast under five driver variations.
 */
public class DoorScenarioAnalyzer {

    static final BigDecimal CONSERVATIVE_ORGANIC = new BigDecimal("0.05");
    static final BigDecimal AGGRESSIVE_NEW_DOORS = new BigDecimal("1.25");
    static final BigDecimal HIGHER_CHURN = new BigDecimal("1.5");
    static final BigDecimal OPTIMISTIC_ORGANIC = new BigDecimal("1.2");
    static final BigDecimal OPTIMISTIC_NEW_DOORS = new BigDecimal("1.15");
    static final BigDecimal OPTIMISTIC_CHURN = new BigDecimal("0.8");

    private final DoorMathForecaster forecaster;
    private final BigDecimal benchmarkChurnPct;

    public DoorScenarioAnalyzer(DoorMathForecaster forecaster, BigDecimal benchmarkChurnPct) {
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster");
        this.benchmarkChurnPct = Objects.requireNonNull(benchmarkChurnPct, "benchmarkChurnPct");
    }

    public List<DoorScenario> computeScenarios(ForecastDrivers drivers, int startingDoors, LocalDate asOf) {
        return List.of(
            scenario("Base Plan", "Current plan assumptions",
                    drivers, startingDoors, asOf),
            scenario("Conservative", "5% organic growth",
                    drivers.withOrganicGrowthPct(CONSERVATIVE_ORGANIC), startingDoors, asOf),
            scenario("Aggressive", "+25% new doors",
                    drivers.withNewDoorTargets(scaleTargets(drivers, AGGRESSIVE_NEW_DOORS)),
                    startingDoors, asOf),
            scenario("Higher Churn", "Churn +50%",
                    scaleChurn(drivers, HIGHER_CHURN, startingDoors), startingDoors, asOf),
            scenario("Optimistic", "Organic x1.2, new doors +15%, churn -20%",
                    scaleChurn(drivers
                                .withOrganicGrowthPct(drivers.organicGrowthPct().multiply(OPTIMISTIC_ORGANIC))
                                .withNewDoorTargets(scaleTargets(drivers, OPTIMISTIC_NEW_DOORS)),
                            OPTIMISTIC_CHURN, startingDoors),
                    startingDoors, asOf));
    }

    private DoorScenario scenario(String name, String description, ForecastDrivers drivers,
                                  int startingDoors, LocalDate asOf) {
        return new DoorScenario(name, description, drivers,
                forecaster.projectForecast(drivers, startingDoors, asOf));
    }

    private static Map<CustomerSegment, Integer> scaleTargets(ForecastDrivers drivers, BigDecimal factor) {
        Map<CustomerSegment, Integer> scaled = new EnumMap<>(CustomerSegment.class);
        drivers.newDoorTargets().forEach((segment, target) -> scaled.put(segment, scale(target, factor)));
        return scaled;
    }

    /** Churn is capped at the whole starting base. */
    private ForecastDrivers scaleChurn(ForecastDrivers drivers, BigDecimal factor, int startingDoors) {
        if (drivers.expectedChurnDoors() != null) {
            int doors = Math.min(startingDoors, scale(drivers.expectedChurnDoors(), factor));
            return drivers.withChurn(drivers.expectedChurnPct(), doors);
        }
        BigDecimal pct = drivers.expectedChurnPct() != null ? drivers.expectedChurnPct() : benchmarkChurnPct;
        return drivers.withChurn(pct.multiply(factor).min(BigDecimal.ONE), null);
    }

    private static int scale(int value, BigDecimal factor) {
        return BigDecimal.valueOf(value).multiply(factor).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }
}
