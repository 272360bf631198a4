package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DoorScenarioRow(
    Long forecastId,
    LocalDate asOfDate,
    String scenarioName,
    String description,
    int expectedChurnDoors,
    int totalNewDoors,
    BigDecimal organicGrowthPct,
    BigDecimal projectedRevenue,
    int endingDoors,
    BigDecimal gap,
    BigDecimal gapPct
) {

    public static DoorScenarioRow of(Long forecastId, DoorScenario scenario) {
        ForecastProjection p = scenario.projection();
        return new DoorScenarioRow(
            forecastId,
            p.asOfDate(),
            scenario.name(),
            scenario.description(),
            p.expectedChurnDoors(),
            p.totalNewDoors(),
            scenario.drivers().organicGrowthPct(),
            ForecastProjectionRow.whole(p.projectedRevenue()),
            p.endingDoors(),
            ForecastProjectionRow.whole(p.gap()),
            p.gapPct());
    }
}
