package com.enterprise.wholesale.forecast.infrastructure;

import com.enterprise.wholesale.customer.application.CustomerQueries;
import com.enterprise.wholesale.customer.application.FunnelCalculator;
import com.enterprise.wholesale.customer.application.HealthClassifier;
import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerSnapshot;
import com.enterprise.wholesale.customer.infrastructure.CustomerSnapshotRowMapper;
import com.enterprise.wholesale.forecast.application.DoorMathForecaster;
import com.enterprise.wholesale.forecast.application.DoorScenarioAnalyzer;
import com.enterprise.wholesale.forecast.application.ForecastDmlProviders;
import com.enterprise.wholesale.forecast.application.ForecastQueries;
import com.enterprise.wholesale.forecast.application.ForecastRunContext;
import com.enterprise.wholesale.forecast.application.SeasonalityDistributor;
import com.enterprise.wholesale.forecast.domain.Channel;
import com.enterprise.wholesale.forecast.domain.DoorScenarioRow;
import com.enterprise.wholesale.forecast.domain.ForecastDrivers;
import com.enterprise.wholesale.forecast.domain.ForecastProjectionRow;
import com.enterprise.wholesale.forecast.domain.MonthlyTarget;
import com.enterprise.wholesale.forecast.domain.SeasonalDistribution;
import com.enterprise.wholesale.forecast.domain.SeasonalityProfile;
import com.enterprise.wholesale.forecast.domain.WholesaleForecast;
import com.enterprise.wholesale.shared.chunkutils.adapter.ExplodingItemReader;
import com.enterprise.wholesale.shared.config.AnalyticsProperties;
import com.enterprise.wholesale.shared.filebridge.adapter.CsvWriterFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.BatchReaderFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.BatchWriterFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.DmlProviderRegistry;
import com.enterprise.wholesale.shared.querybridge.adapter.QueryProviderRegistry;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;
import com.enterprise.wholesale.shared.tasklets.adapter.AnalysisDateTasklet;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.database.JdbcBatchItemWriter;
import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.support.CompositeItemWriter;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.enterprise.wholesale.shared.filebridge.adapter.ReportFiles.columns;
import static com.enterprise.wholesale.shared.filebridge.adapter.ReportFiles.reportFile;

/**
 * Batch job: measures today's active door count, then for every active
 * forecast writes the door-math projection, 24 monthly channel targets and
 * five what-if scenarios to tables + CSV.
 */
@Slf4j
@Configuration
public class ForecastJobConfig {

    @Autowired
    void registerProviders(QueryProviderRegistry queryRegistry,
                           DmlProviderRegistry dmlRegistry) {
        queryRegistry.register("activeForecasts", ForecastQueries.activeForecasts());
        dmlRegistry.register("upsertProjection", ForecastDmlProviders.upsertProjection());
        dmlRegistry.register("upsertMonthlyTarget", ForecastDmlProviders.upsertMonthlyTarget());
        dmlRegistry.register("upsertScenario", ForecastDmlProviders.upsertScenario());
    }

    // --- JobScope context ---

    @Bean
    @JobScope
    ForecastRunContext forecastRunContext() {
        return new ForecastRunContext();
    }

    // --- Step 1: as-of date ---

    @Bean
    Step forecastAnalysisDateStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalysisDateTasklet analysisDateTasklet) {
        return new StepBuilder("analysisDateStep", jobRepository)
            .tasklet(analysisDateTasklet, transactionManager)
            .build();
    }

    // --- Step 2: current door count ---

    @Bean
    Step currentDoorCountStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            ForecastRunContext runContext,
            HealthClassifier classifier,
            FunnelCalculator funnelCalculator,
            NamedParameterJdbcTemplate jdbc) {
        return new StepBuilder("currentDoorCountStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                LocalDate asOf = asOf(chunkContext.getStepContext().getJobExecutionContext());

                SqlResult query = CustomerQueries.allCustomers().buildQuery(Map.of());
                List<CustomerSnapshot> snapshots = jdbc.query(
                    query.sql(), query.namedParameters(), new CustomerSnapshotRowMapper());
                List<ClassifiedCustomer> classified = classifier.classifyAll(snapshots, asOf);

                int doors = funnelCalculator.computeFunnel(classified).activeDoors();
                runContext.setCurrentDoorCount(doors);
                contribution.incrementReadCount();
                log.info("Current door count as of {}: {} ({} customers read)", asOf, doors, snapshots.size());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .allowStartIfComplete(true)
            .build();
    }

    // --- Step 3: projection ---

    @Bean
    @StepScope
    JdbcCursorItemReader<WholesaleForecast> projectionForecastReader(
            @Value("#{jobParameters}") Map<String, Object> jobParams,
            BatchReaderFactory factory, QueryProviderRegistry registry) {
        return factory.cursorReader("projectionForecastReader",
            registry.get("activeForecasts"), new WholesaleForecastRowMapper(), jobParams);
    }

    @Bean
    @StepScope
    ItemProcessor<WholesaleForecast, ForecastProjectionRow> forecastProjectionProcessor(
            @Value("#{jobExecutionContext['asOfDate']}") LocalDate asOf,
            DoorMathForecaster forecaster,
            ForecastRunContext runContext) {
        return forecast -> {
            ForecastDrivers drivers = forecast.drivers();
            return ForecastProjectionRow.of(forecast.forecastId(),
                forecaster.projectForecast(drivers, runContext.startingDoors(drivers), asOf));
        };
    }

    @Bean
    @StepScope
    JdbcBatchItemWriter<ForecastProjectionRow> forecastProjectionDbWriter(
            BatchWriterFactory factory, DmlProviderRegistry registry) {
        return factory.templateWriter(
            "forecastProjectionDbWriter",
            registry.get("upsertProjection"),
            row -> new MapSqlParameterSource()
                .addValue("forecast_id", row.forecastId())
                .addValue("as_of_date", row.asOfDate())
                .addValue("fiscal_year", row.fiscalYear())
                .addValue("starting_doors", row.startingDoors())
                .addValue("expected_churn_doors", row.expectedChurnDoors())
                .addValue("retained_doors", row.retainedDoors())
                .addValue("existing_door_base", row.existingDoorBase())
                .addValue("organic_growth", row.organicGrowth())
                .addValue("existing_door_total", row.existingDoorTotal())
                .addValue("total_new_doors", row.totalNewDoors())
                .addValue("new_door_revenue", row.newDoorRevenue())
                .addValue("projected_revenue", row.projectedRevenue())
                .addValue("ending_doors", row.endingDoors())
                .addValue("annual_target", row.annualTarget())
                .addValue("gap", row.gap())
                .addValue("gap_pct", row.gapPct())
                .addValue("doors_needed", row.doorsNeeded()),
            Map.of());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<ForecastProjectionRow> forecastProjectionCsvWriter(
            CsvWriterFactory csvFactory, AnalyticsProperties properties) {
        return csvFactory.recordWriter("forecastProjectionCsvWriter",
            reportFile(properties.getReport().getOutputDir(), "forecast_projections.csv"),
            ForecastProjectionRow.class, columns(
                "forecastId", "forecast_id",
                "fiscalYear", "fiscal_year",
                "startingDoors", "starting_doors",
                "expectedChurnDoors", "expected_churn_doors",
                "retainedDoors", "retained_doors",
                "existingDoorTotal", "existing_door_total",
                "totalNewDoors", "total_new_doors",
                "newDoorRevenue", "new_door_revenue",
                "projectedRevenue", "projected_revenue",
                "endingDoors", "ending_doors",
                "annualTarget", "annual_target",
                "gap", "gap",
                "gapPct", "gap_pct",
                "doorsNeeded", "doors_needed"));
    }

    @Bean
    @StepScope
    CompositeItemWriter<ForecastProjectionRow> forecastProjectionCompositeWriter(
            JdbcBatchItemWriter<ForecastProjectionRow> forecastProjectionDbWriter,
            FlatFileItemWriter<ForecastProjectionRow> forecastProjectionCsvWriter) {
        CompositeItemWriter<ForecastProjectionRow> writer = new CompositeItemWriter<>();
        writer.setDelegates(List.of(forecastProjectionDbWriter, forecastProjectionCsvWriter));
        return writer;
    }

    @Bean
    Step forecastProjectionStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalyticsProperties properties,
            JdbcCursorItemReader<WholesaleForecast> projectionForecastReader,
            ItemProcessor<WholesaleForecast, ForecastProjectionRow> forecastProjectionProcessor,
            CompositeItemWriter<ForecastProjectionRow> forecastProjectionCompositeWriter) {
        return new StepBuilder("forecastProjectionStep", jobRepository)
            .<WholesaleForecast, ForecastProjectionRow>chunk(properties.getReport().getChunkSize(), transactionManager)
            .reader(projectionForecastReader)
            .processor(forecastProjectionProcessor)
            .writer(forecastProjectionCompositeWriter)
            .build();
    }

    // --- Step 4: monthly targets (1 forecast → 24 rows) ---

    @Bean
    @StepScope
    ExplodingItemReader<WholesaleForecast, MonthlyTarget> monthlyTargetReader(
            @Value("#{jobParameters}") Map<String, Object> jobParams,
            BatchReaderFactory factory,
            QueryProviderRegistry registry,
            SeasonalityDistributor distributor,
            SeasonalityProfile profile) {
        var delegate = factory.cursorReader("monthlyTargetForecastReader",
            registry.get("activeForecasts"), new WholesaleForecastRowMapper(), jobParams);

        return new ExplodingItemReader<>(delegate, forecast -> {
            ForecastDrivers drivers = forecast.drivers();
            List<MonthlyTarget> targets = new ArrayList<>(24);
            for (Channel channel : Channel.values()) {
                BigDecimal annual = channel == Channel.CORPORATE
                        ? drivers.corporateAnnualTarget()
                        : drivers.b2bAnnualTarget();
                SeasonalDistribution distribution = distributor.distribute(
                        annual, profile.curve(channel), profile.monthlySplits());
                for (int month = 1; month <= 12; month++) {
                    targets.add(new MonthlyTarget(forecast.forecastId(), drivers.fiscalYear(),
                            channel, (month - 1) / 3 + 1, month, distribution.month(month)));
                }
            }
            return targets;
        });
    }

    @Bean
    @StepScope
    JdbcBatchItemWriter<MonthlyTarget> monthlyTargetDbWriter(
            BatchWriterFactory factory, DmlProviderRegistry registry) {
        return factory.templateWriter(
            "monthlyTargetDbWriter",
            registry.get("upsertMonthlyTarget"),
            t -> new MapSqlParameterSource()
                .addValue("forecast_id", t.forecastId())
                .addValue("channel", t.channel().name())
                .addValue("target_month", t.month())
                .addValue("fiscal_year", t.fiscalYear())
                .addValue("quarter", t.quarter())
                .addValue("target", t.target()),
            Map.of());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<MonthlyTarget> monthlyTargetCsvWriter(
            CsvWriterFactory csvFactory, AnalyticsProperties properties) {
        return csvFactory.recordWriter("monthlyTargetCsvWriter",
            reportFile(properties.getReport().getOutputDir(), "forecast_monthly_targets.csv"),
            MonthlyTarget.class, columns(
                "forecastId", "forecast_id",
                "fiscalYear", "fiscal_year",
                "channel", "channel",
                "quarter", "quarter",
                "month", "month",
                "target", "target"));
    }

    @Bean
    @StepScope
    CompositeItemWriter<MonthlyTarget> monthlyTargetCompositeWriter(
            JdbcBatchItemWriter<MonthlyTarget> monthlyTargetDbWriter,
            FlatFileItemWriter<MonthlyTarget> monthlyTargetCsvWriter) {
        CompositeItemWriter<MonthlyTarget> writer = new CompositeItemWriter<>();
        writer.setDelegates(List.of(monthlyTargetDbWriter, monthlyTargetCsvWriter));
        return writer;
    }

    @Bean
    Step monthlyTargetStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalyticsProperties properties,
            ExplodingItemReader<WholesaleForecast, MonthlyTarget> monthlyTargetReader,
            CompositeItemWriter<MonthlyTarget> monthlyTargetCompositeWriter) {
        return new StepBuilder("monthlyTargetStep", jobRepository)
            .<MonthlyTarget, MonthlyTarget>chunk(properties.getReport().getChunkSize(), transactionManager)
            .reader(monthlyTargetReader)
            .writer(monthlyTargetCompositeWriter)
            .build();
    }

    // --- Step 5: scenarios (1 forecast → 5 rows) ---

    @Bean
    @StepScope
    ExplodingItemReader<WholesaleForecast, DoorScenarioRow> doorScenarioReader(
            @Value("#{jobParameters}") Map<String, Object> jobParams,
            @Value("#{jobExecutionContext['asOfDate']}") LocalDate asOf,
            BatchReaderFactory factory,
            QueryProviderRegistry registry,
            DoorScenarioAnalyzer analyzer,
            ForecastRunContext runContext) {
        var delegate = factory.cursorReader("scenarioForecastReader",
            registry.get("activeForecasts"), new WholesaleForecastRowMapper(), jobParams);

        return new ExplodingItemReader<>(delegate, forecast -> {
            ForecastDrivers drivers = forecast.drivers();
            return analyzer.computeScenarios(drivers, runContext.startingDoors(drivers), asOf).stream()
                .map(scenario -> DoorScenarioRow.of(forecast.forecastId(), scenario))
                .toList();
        });
    }

    @Bean
    @StepScope
    JdbcBatchItemWriter<DoorScenarioRow> doorScenarioDbWriter(
            BatchWriterFactory factory, DmlProviderRegistry registry) {
        return factory.templateWriter(
            "doorScenarioDbWriter",
            registry.get("upsertScenario"),
            s -> new MapSqlParameterSource()
                .addValue("forecast_id", s.forecastId())
                .addValue("as_of_date", s.asOfDate())
                .addValue("scenario_name", s.scenarioName())
                .addValue("description", s.description())
                .addValue("expected_churn_doors", s.expectedChurnDoors())
                .addValue("total_new_doors", s.totalNewDoors())
                .addValue("organic_growth_pct", s.organicGrowthPct())
                .addValue("projected_revenue", s.projectedRevenue())
                .addValue("ending_doors", s.endingDoors())
                .addValue("gap", s.gap())
                .addValue("gap_pct", s.gapPct()),
            Map.of());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<DoorScenarioRow> doorScenarioCsvWriter(
            CsvWriterFactory csvFactory, AnalyticsProperties properties) {
        return csvFactory.recordWriter("doorScenarioCsvWriter",
            reportFile(properties.getReport().getOutputDir(), "forecast_scenarios.csv"),
            DoorScenarioRow.class, columns(
                "forecastId", "forecast_id",
                "scenarioName", "scenario",
                "description", "description",
                "expectedChurnDoors", "expected_churn_doors",
                "totalNewDoors", "total_new_doors",
                "organicGrowthPct", "organic_growth_pct",
                "projectedRevenue", "projected_revenue",
                "endingDoors", "ending_doors",
                "gap", "gap",
                "gapPct", "gap_pct"));
    }

    @Bean
    @StepScope
    CompositeItemWriter<DoorScenarioRow> doorScenarioCompositeWriter(
            JdbcBatchItemWriter<DoorScenarioRow> doorScenarioDbWriter,
            FlatFileItemWriter<DoorScenarioRow> doorScenarioCsvWriter) {
        CompositeItemWriter<DoorScenarioRow> writer = new CompositeItemWriter<>();
        writer.setDelegates(List.of(doorScenarioDbWriter, doorScenarioCsvWriter));
        return writer;
    }

    @Bean
    Step doorScenarioStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalyticsProperties properties,
            ExplodingItemReader<WholesaleForecast, DoorScenarioRow> doorScenarioReader,
            CompositeItemWriter<DoorScenarioRow> doorScenarioCompositeWriter) {
        return new StepBuilder("doorScenarioStep", jobRepository)
            .<DoorScenarioRow, DoorScenarioRow>chunk(properties.getReport().getChunkSize(), transactionManager)
            .reader(doorScenarioReader)
            .writer(doorScenarioCompositeWriter)
            .build();
    }

    @Bean
    Job forecastJob(JobRepository jobRepository,
            Step forecastAnalysisDateStep,
            Step currentDoorCountStep,
            Step forecastProjectionStep,
            Step monthlyTargetStep,
            Step doorScenarioStep) {
        return new JobBuilder("forecastJob", jobRepository)
            .start(forecastAnalysisDateStep)
            .next(currentDoorCountStep)
            .next(forecastProjectionStep)
            .next(monthlyTargetStep)
            .next(doorScenarioStep)
            .build();
    }

    private static LocalDate asOf(Map<String, Object> jobExecutionContext) {
        return (LocalDate) jobExecutionContext.get(AnalysisDateTasklet.AS_OF_DATE);
    }
}
