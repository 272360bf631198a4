package com.enterprise.wholesale.forecast;

import com.enterprise.wholesale.WholesaleAnalyticsApplication;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end test for the forecast job, as of 2026-10-18.
 *
 * <p>Forecast 1 (FY2026) plans from 200 doors with nine months elapsed.
 * Forecast 2 (FY2027) has no starting door count, so it starts from the
 * eight active doors in the customer fixture. Forecast 3 is inactive.
 */
@SpringBootTest(classes = WholesaleAnalyticsApplication.class)
@TestPropertySource(properties = {
    "spring.batch.job.enabled=false",
    "analytics.report.output-dir=target/test-output/forecast"
})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ForecastJobTest {

    @Autowired private JobLauncher jobLauncher;
    @Autowired @Qualifier("forecastJob") private Job forecastJob;
    @Autowired private JdbcTemplate jdbc;

    @Autowired @Qualifier("currentDoorCountStep") private Step currentDoorCountStep;

    private JobExecution jobExecution;

    @BeforeAll
    void runJob() throws Exception {
        jobExecution = jobLauncher.run(forecastJob,
            new JobParametersBuilder()
                .addString("asOfDate", "2026-10-18")
                .addLong("run.id", System.currentTimeMillis())
                .toJobParameters());
    }

    @Test
    void doorCountStepRerunsOnRestartToRefillRunContext() {
        assertThat(currentDoorCountStep.isAllowStartIfComplete()).isTrue();
    }

    @Test
    void jobCompletesAllSteps() {
        assertThat(jobExecution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(jobExecution.getStepExecutions())
            .extracting(StepExecution::getStepName)
            .containsExactly("analysisDateStep", "currentDoorCountStep", "forecastProjectionStep",
                "monthlyTargetStep", "doorScenarioStep");
    }

    @Test
    void onlyActiveForecastsAreProjected() {
        assertThat(jdbc.queryForList("SELECT forecast_id FROM forecast_projections ORDER BY forecast_id", Long.class))
            .containsExactly(1L, 2L);
    }

    @Test
    void inYearProjectionFromPlannedDoors() {
        Map<String, Object> p = projection(1);

        assertThat(p.get("STARTING_DOORS")).isEqualTo(200);
        assertThat(p.get("EXPECTED_CHURN_DOORS")).isEqualTo(34);
        assertThat(p.get("RETAINED_DOORS")).isEqualTo(166);
        assertThat((BigDecimal) p.get("EXISTING_DOOR_BASE")).isEqualByComparingTo("1909000");
        assertThat((BigDecimal) p.get("ORGANIC_GROWTH")).isEqualByComparingTo("209990");
        assertThat((BigDecimal) p.get("PROJECTED_REVENUE")).isEqualByComparingTo("2118990");
        assertThat((BigDecimal) p.get("GAP")).isEqualByComparingTo("-118990");
        assertThat((BigDecimal) p.get("GAP_PCT")).isEqualByComparingTo("-5.9");
        assertThat(p.get("DOORS_NEEDED")).isEqualTo(0);
        assertThat(p.get("ENDING_DOORS")).isEqualTo(166);
    }

    @Test
    void nextYearProjectionStartsFromCurrentActiveDoors() {
        Map<String, Object> p = projection(2);

        assertThat(p.get("STARTING_DOORS")).isEqualTo(8);
        assertThat(p.get("EXPECTED_CHURN_DOORS")).isEqualTo(1);
        assertThat((BigDecimal) p.get("EXISTING_DOOR_TOTAL")).isEqualByComparingTo("84525");
        assertThat(p.get("TOTAL_NEW_DOORS")).isEqualTo(16);
        assertThat((BigDecimal) p.get("NEW_DOOR_REVENUE")).isEqualByComparingTo("57958");
        assertThat((BigDecimal) p.get("PROJECTED_REVENUE")).isEqualByComparingTo("142483");
        assertThat((BigDecimal) p.get("GAP_PCT")).isEqualByComparingTo("52.5");
        assertThat(p.get("DOORS_NEEDED")).isEqualTo(49);
        assertThat(p.get("ENDING_DOORS")).isEqualTo(23);
    }

    @Test
    void monthlyTargetsFollowChannelSeasonality() {
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM forecast_monthly_targets", Integer.class))
            .isEqualTo(48);

        List<BigDecimal> b2bQuarters = jdbc.queryForList(
            "SELECT SUM(target) FROM forecast_monthly_targets WHERE forecast_id = 1 AND channel = 'B2B' "
            + "GROUP BY quarter ORDER BY quarter", BigDecimal.class);
        assertThat(b2bQuarters).extracting(BigDecimal::toBigInteger).extracting(Object::toString)
            .containsExactly("400000", "420000", "440000", "740000");

        assertThat(target(1, "B2B", 1)).isEqualByComparingTo("120000");
        assertThat(target(1, "B2B", 12)).isEqualByComparingTo("296000");
        assertThat(target(1, "CORPORATE", 4)).isEqualByComparingTo("9000");
        assertThat(target(1, "CORPORATE", 12)).isEqualByComparingTo("116000");
    }

    @Test
    void monthlyTargetsReconcileToAnnualTargets() {
        assertThat(channelTotal(1, "B2B")).isEqualByComparingTo("2000000");
        assertThat(channelTotal(1, "CORPORATE")).isEqualByComparingTo("500000");
        assertThat(channelTotal(2, "B2B")).isEqualByComparingTo("300000");
        assertThat(channelTotal(2, "CORPORATE")).isEqualByComparingTo("100000");
    }

    @Test
    void fiveScenariosPerForecast() {
        List<Map<String, Object>> rows = jdbc.queryForList(
            "SELECT scenario_name, expected_churn_doors, projected_revenue FROM forecast_scenarios "
            + "WHERE forecast_id = 1");

        assertThat(rows).hasSize(5);
        assertThat(revenue(rows, "Base Plan")).isEqualByComparingTo("2118990");
        assertThat(revenue(rows, "Conservative")).isEqualByComparingTo("2004450");
        assertThat(scenario(rows, "Higher Churn").get("EXPECTED_CHURN_DOORS")).isEqualTo(51);
        assertThat(revenue(rows, "Higher Churn")).isEqualByComparingTo("1901985");
        assertThat(scenario(rows, "Optimistic").get("EXPECTED_CHURN_DOORS")).isEqualTo(27);
        assertThat(revenue(rows, "Optimistic")).isEqualByComparingTo("2252114");

        assertThat(jdbc.queryForObject(
            "SELECT expected_churn_doors FROM forecast_scenarios WHERE forecast_id = 2 AND scenario_name = 'Higher Churn'",
            Integer.class)).isEqualTo(2);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM forecast_scenarios", Integer.class)).isEqualTo(10);
    }

    @Test
    void writesCsvReports() throws Exception {
        Path dir = Path.of("target/test-output/forecast");

        assertThat(Files.readAllLines(dir.resolve("forecast_projections.csv"))).hasSize(3);
        assertThat(Files.readAllLines(dir.resolve("forecast_monthly_targets.csv"))).hasSize(49);
        assertThat(Files.readAllLines(dir.resolve("forecast_scenarios.csv"))).hasSize(11);
    }

    private Map<String, Object> projection(long forecastId) {
        return jdbc.queryForMap("SELECT * FROM forecast_projections WHERE forecast_id = ?", forecastId);
    }

    private BigDecimal target(long forecastId, String channel, int month) {
        return jdbc.queryForObject(
            "SELECT target FROM forecast_monthly_targets WHERE forecast_id = ? AND channel = ? AND target_month = ?",
            BigDecimal.class, forecastId, channel, month);
    }

    private BigDecimal channelTotal(long forecastId, String channel) {
        return jdbc.queryForObject(
            "SELECT SUM(target) FROM forecast_monthly_targets WHERE forecast_id = ? AND channel = ?",
            BigDecimal.class, forecastId, channel);
    }

    private static BigDecimal revenue(List<Map<String, Object>> rows, String name) {
        return (BigDecimal) scenario(rows, name).get("PROJECTED_REVENUE");
    }

    private static Map<String, Object> scenario(List<Map<String, Object>> rows, String name) {
        return rows.stream().filter(r -> name.equals(r.get("SCENARIO_NAME"))).findFirst().orElseThrow();
    }
}
