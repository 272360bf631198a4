package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.forecast.domain.DoorScenario;
import com.enterprise.wholesale.forecast.domain.ForecastDrivers;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.enterprise.wholesale.forecast.ForecastFixtures.*;
import static org.assertj.core.api.Assertions.*;

class DoorScenarioAnalyzerTest {

    private static final LocalDate AS_OF = LocalDate.of(2026, 10, 18);

    private final DoorMathForecaster forecaster = new DoorMathForecaster(benchmarks());
    private final DoorScenarioAnalyzer analyzer = new DoorScenarioAnalyzer(forecaster, new BigDecimal("0.17"));

    @Test
    void producesFiveNamedScenariosInOrder() {
        List<DoorScenario> scenarios = analyzer.computeScenarios(withTargets(drivers(2027), 0, 10, 0), 200, AS_OF);

        assertThat(scenarios).extracting(DoorScenario::name)
            .containsExactly("Base Plan", "Conservative", "Aggressive", "Higher Churn", "Optimistic");
    }

    @Test
    void basePlanMatchesPlainProjection() {
        ForecastDrivers drivers = withTargets(drivers(2027), 0, 10, 0);

        DoorScenario base = analyzer.computeScenarios(drivers, 200, AS_OF).get(0);

        assertThat(base.projection()).isEqualTo(forecaster.projectForecast(drivers, 200, AS_OF));
    }

    @Test
    void eachScenarioAdjustsItsDriver() {
        List<DoorScenario> s = analyzer.computeScenarios(withTargets(drivers(2027), 0, 10, 0), 200, AS_OF);

        assertThat(s.get(1).drivers().organicGrowthPct()).isEqualByComparingTo("0.05");
        assertThat(s.get(2).drivers().newDoorTarget(CustomerSegment.MID)).isEqualTo(13);
        assertThat(s.get(3).projection().expectedChurnDoors()).isEqualTo(51);

        DoorScenario optimistic = s.get(4);
        assertThat(optimistic.drivers().organicGrowthPct()).isEqualByComparingTo("0.132");
        assertThat(optimistic.drivers().newDoorTarget(CustomerSegment.MID)).isEqualTo(12);
        assertThat(optimistic.projection().expectedChurnDoors()).isEqualTo(27);
    }

    @Test
    void higherChurnUsesBenchmarkWhenForecastHasNone() {
        ForecastDrivers drivers = drivers(2027).withChurn(null, null);

        DoorScenario higher = analyzer.computeScenarios(drivers, 100, AS_OF).get(3);

        assertThat(higher.drivers().expectedChurnPct()).isEqualByComparingTo("0.255");
        assertThat(higher.projection().expectedChurnDoors()).isEqualTo(26);
    }

    @Test
    void scaledChurnNeverExceedsStartingDoors() {
        DoorScenario byPct = analyzer.computeScenarios(
                drivers(2027).withChurn(new BigDecimal("0.8"), null), 200, AS_OF).get(3);
        DoorScenario byCount = analyzer.computeScenarios(
                drivers(2027).withChurn(null, 150), 200, AS_OF).get(3);

        assertThat(byPct.drivers().expectedChurnPct()).isEqualByComparingTo("1");
        assertThat(byPct.projection().retainedDoors()).isZero();
        assertThat(byCount.projection().expectedChurnDoors()).isEqualTo(200);
    }
}
