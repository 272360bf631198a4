package com.enterprise.wholesale.churn.infrastructure;

import com.enterprise.wholesale.churn.application.DoorHealthDmlProviders;
import com.enterprise.wholesale.churn.application.DoorHealthReporter;
import com.enterprise.wholesale.churn.application.DoorHealthRunContext;
import com.enterprise.wholesale.churn.domain.ChurnedBreakdownRow;
import com.enterprise.wholesale.churn.domain.CohortRetention;
import com.enterprise.wholesale.churn.domain.DoorFunnelRow;
import com.enterprise.wholesale.churn.domain.DoorHealthReport;
import com.enterprise.wholesale.churn.domain.DudCohort;
import com.enterprise.wholesale.churn.domain.YearChurn;
import com.enterprise.wholesale.customer.application.CustomerQueries;
import com.enterprise.wholesale.customer.application.HealthClassifier;
import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerHealthRow;
import com.enterprise.wholesale.customer.domain.CustomerSnapshot;
import com.enterprise.wholesale.customer.infrastructure.CustomerSnapshotRowMapper;
import com.enterprise.wholesale.shared.config.AnalyticsProperties;
import com.enterprise.wholesale.shared.filebridge.adapter.CsvWriterFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.BatchReaderFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.BatchWriterFactory;
import com.enterprise.wholesale.shared.querybridge.adapter.DmlProviderRegistry;
import com.enterprise.wholesale.shared.querybridge.adapter.QueryProviderRegistry;
import com.enterprise.wholesale.shared.tasklets.adapter.AnalysisDateTasklet;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.database.ItemSqlParameterSourceProvider;
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
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.enterprise.wholesale.shared.filebridge.adapter.ReportFiles.columns;
import static com.enterprise.wholesale.shared.filebridge.adapter.ReportFiles.reportFile;

/**
 * Batch job: classifies every wholesale customer as of the run date, writes
 * {@code customer_health}, then publishes the door health report (funnel,
 * churn by year, churn breakdown, cohort retention, dud rate) to tables + CSV.
 */
@Slf4j
@Configuration
public class DoorHealthJobConfig {

    @Autowired
    void registerProviders(QueryProviderRegistry queryRegistry,
                           DmlProviderRegistry dmlRegistry) {
        queryRegistry.register("allCustomers", CustomerQueries.allCustomers());
        dmlRegistry.register("upsertCustomerHealth", DoorHealthDmlProviders.upsertCustomerHealth());
        dmlRegistry.register("upsertDoorFunnel", DoorHealthDmlProviders.upsertDoorFunnel());
        dmlRegistry.register("upsertChurnByYear", DoorHealthDmlProviders.upsertChurnByYear());
        dmlRegistry.register("upsertChurnedBreakdown", DoorHealthDmlProviders.upsertChurnedBreakdown());
        dmlRegistry.register("upsertCohortRetention", DoorHealthDmlProviders.upsertCohortRetention());
        dmlRegistry.register("upsertDudRate", DoorHealthDmlProviders.upsertDudRate());
    }

    // --- JobScope context ---

    @Bean
    @JobScope
    DoorHealthRunContext doorHealthRunContext() {
        return new DoorHealthRunContext();
    }

    // --- Step 1: as-of date ---

    @Bean
    Step doorHealthAnalysisDateStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalysisDateTasklet analysisDateTasklet) {
        return new StepBuilder("analysisDateStep", jobRepository)
            .tasklet(analysisDateTasklet, transactionManager)
            .build();
    }

    // --- Step 2: classify customers ---

    @Bean
    @StepScope
    JdbcCursorItemReader<CustomerSnapshot> customerSnapshotReader(
            BatchReaderFactory factory, QueryProviderRegistry registry) {
        JdbcCursorItemReader<CustomerSnapshot> reader = factory.cursorReader(
            "customerSnapshotReader",
            registry.get("allCustomers"),
            new CustomerSnapshotRowMapper(),
            Map.of());
        // the run context only holds what this execution classified, so always read from the top
        reader.setSaveState(false);
        return reader;
    }

    @Bean
    @StepScope
    ItemProcessor<CustomerSnapshot, CustomerHealthRow> customerHealthProcessor(
            @Value("#{jobExecutionContext['asOfDate']}") LocalDate asOf,
            HealthClassifier classifier,
            DoorHealthRunContext runContext) {
        return snapshot -> {
            ClassifiedCustomer classified = classifier.classify(snapshot, asOf);
            runContext.add(classified);
            return CustomerHealthRow.of(classified, asOf);
        };
    }

    @Bean
    @StepScope
    JdbcBatchItemWriter<CustomerHealthRow> customerHealthDbWriter(
            BatchWriterFactory factory, DmlProviderRegistry registry) {
        return factory.templateWriter(
            "customerHealthDbWriter",
            registry.get("upsertCustomerHealth"),
            row -> new MapSqlParameterSource()
                .addValue("as_of_date", row.asOfDate())
                .addValue("customer_id", row.customerId())
                .addValue("company_name", row.companyName())
                .addValue("segment", row.segment().name())
                .addValue("health_status", row.healthStatus().name())
                .addValue("days_since_last_order", row.daysSinceLastOrder())
                .addValue("lifespan_months", row.lifespanMonths())
                .addValue("churn_year", row.churnYear())
                .addValue("is_door", row.door())
                .addValue("is_declining", row.declining())
                .addValue("is_reactivated", row.reactivated())
                .addValue("lifetime_revenue", row.lifetimeRevenue()),
            Map.of());
    }

    @Bean
    @StepScope
    FlatFileItemWriter<CustomerHealthRow> customerHealthCsvWriter(
            CsvWriterFactory csvFactory, AnalyticsProperties properties) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("asOfDate",           "as_of_date");
        columns.put("customerId",         "customer_id");
        columns.put("companyName",        "company_name");
        columns.put("segment",            "segment");
        columns.put("healthStatus",       "health_status");
        columns.put("daysSinceLastOrder", "days_since_last_order");
        columns.put("lifespanMonths",     "lifespan_months");
        columns.put("churnYear",          "churn_year");
        columns.put("door",               "is_door");
        columns.put("declining",          "is_declining");
        columns.put("reactivated",        "is_reactivated");
        columns.put("lifetimeRevenue",    "lifetime_revenue");

        return csvFactory.recordWriter("customerHealthCsvWriter",
                reportFile(properties.getReport().getOutputDir(), "customer_health.csv"),
                CustomerHealthRow.class, columns);
    }

    @Bean
    @StepScope
    CompositeItemWriter<CustomerHealthRow> customerHealthCompositeWriter(
            JdbcBatchItemWriter<CustomerHealthRow> customerHealthDbWriter,
            FlatFileItemWriter<CustomerHealthRow> customerHealthCsvWriter) {
        CompositeItemWriter<CustomerHealthRow> writer = new CompositeItemWriter<>();
        writer.setDelegates(List.of(customerHealthDbWriter, customerHealthCsvWriter));
        return writer;
    }

    @Bean
    Step customerHealthStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            AnalyticsProperties properties,
            JdbcCursorItemReader<CustomerSnapshot> customerSnapshotReader,
            ItemProcessor<CustomerSnapshot, CustomerHealthRow> customerHealthProcessor,
            CompositeItemWriter<CustomerHealthRow> customerHealthCompositeWriter) {
        return new StepBuilder("customerHealthStep", jobRepository)
            .<CustomerSnapshot, CustomerHealthRow>chunk(properties.getReport().getChunkSize(), transactionManager)
            .reader(customerSnapshotReader)
            .processor(customerHealthProcessor)
            .writer(customerHealthCompositeWriter)
            // refills the job-scoped run context when a failed report step is restarted
            .allowStartIfComplete(true)
            .build();
    }

    // --- Step 3: door health report ---

    @Bean
    Step doorHealthReportStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            DoorHealthRunContext runContext,
            DoorHealthReporter reporter,
            BatchWriterFactory writerFactory,
            DmlProviderRegistry registry,
            CsvWriterFactory csvFactory,
            AnalyticsProperties properties) {
        return new StepBuilder("doorHealthReportStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                LocalDate asOf = (LocalDate) chunkContext.getStepContext()
                        .getJobExecutionContext().get(AnalysisDateTasklet.AS_OF_DATE);
                DoorHealthReport report = reporter.report(runContext.classified(), asOf);

                // 1. Funnel + headline metrics
                publish(List.of(DoorFunnelRow.of(report)),
                    writerFactory.templateWriter("doorFunnelDbWriter",
                        registry.get("upsertDoorFunnel"), funnelParams(), Map.of()),
                    csvFactory.recordWriter("doorFunnelCsvWriter",
                        reportFile(properties.getReport().getOutputDir(), "door_funnel.csv"),
                        DoorFunnelRow.class, funnelColumns()));

                // 2. Pool-adjusted churn by year
                publish(report.churnByYear(),
                    writerFactory.templateWriter("churnByYearDbWriter",
                        registry.get("upsertChurnByYear"),
                        (YearChurn y) -> new MapSqlParameterSource()
                            .addValue("as_of_date", asOf)
                            .addValue("churn_year", y.year())
                            .addValue("churned_count", y.churnedCount())
                            .addValue("churned_revenue", y.churnedRevenue())
                            .addValue("pool_size", y.poolSize())
                            .addValue("churn_rate", y.churnRate())
                            .addValue("integrity_fault", y.integrityFault()),
                        Map.of()),
                    csvFactory.recordWriter("churnByYearCsvWriter",
                        reportFile(properties.getReport().getOutputDir(), "churn_by_year.csv"),
                        YearChurn.class, columns(
                            "year", "churn_year",
                            "churnedCount", "churned_count",
                            "churnedRevenue", "churned_revenue",
                            "poolSize", "pool_size",
                            "churnRate", "churn_rate",
                            "integrityFault", "integrity_fault")));

                // 3. Churned by segment and lifespan
                publish(ChurnedBreakdownRow.of(report),
                    writerFactory.templateWriter("churnedBreakdownDbWriter",
                        registry.get("upsertChurnedBreakdown"),
                        (ChurnedBreakdownRow r) -> new MapSqlParameterSource()
                            .addValue("as_of_date", r.asOfDate())
                            .addValue("dimension", r.dimension())
                            .addValue("bucket", r.bucket())
                            .addValue("churned_count", r.churnedCount())
                            .addValue("churned_revenue", r.churnedRevenue())
                            .addValue("avg_lifespan_months", r.avgLifespanMonths()),
                        Map.of()),
                    csvFactory.recordWriter("churnedBreakdownCsvWriter",
                        reportFile(properties.getReport().getOutputDir(), "churned_breakdown.csv"),
                        ChurnedBreakdownRow.class, columns(
                            "dimension", "dimension",
                            "bucket", "bucket",
                            "churnedCount", "churned_count",
                            "churnedRevenue", "churned_revenue",
                            "avgLifespanMonths", "avg_lifespan_months")));

                // 4. Cohort retention
                publish(report.cohortRetention(),
                    writerFactory.templateWriter("cohortRetentionDbWriter",
                        registry.get("upsertCohortRetention"),
                        (CohortRetention c) -> new MapSqlParameterSource()
                            .addValue("as_of_date", asOf)
                            .addValue("cohort_year", c.cohortYear())
                            .addValue("acquired", c.acquired())
                            .addValue("healthy", c.healthy())
                            .addValue("at_risk", c.atRisk())
                            .addValue("churning", c.churning())
                            .addValue("churned", c.churned())
                            .addValue("retained", c.retained())
                            .addValue("retention_pct", c.retentionPct())
                            .addValue("is_maturing", c.maturing()),
                        Map.of()),
                    csvFactory.recordWriter("cohortRetentionCsvWriter",
                        reportFile(properties.getReport().getOutputDir(), "cohort_retention.csv"),
                        CohortRetention.class, columns(
                            "cohortYear", "cohort_year",
                            "acquired", "acquired",
                            "healthy", "healthy",
                            "atRisk", "at_risk",
                            "churning", "churning",
                            "churned", "churned",
                            "retained", "retained",
                            "retentionPct", "retention_pct",
                            "maturing", "is_maturing")));

                // 5. Dud rate
                publish(report.dudRateByCohort(),
                    writerFactory.templateWriter("dudRateDbWriter",
                        registry.get("upsertDudRate"),
                        (DudCohort d) -> new MapSqlParameterSource()
                            .addValue("as_of_date", asOf)
                            .addValue("cohort", d.cohort())
                            .addValue("total_acquired", d.totalAcquired())
                            .addValue("mature_customers", d.matureCustomers())
                            .addValue("mature_one_time", d.matureOneTime())
                            .addValue("dud_rate", d.dudRate())
                            .addValue("is_mature", d.mature()),
                        Map.of()),
                    csvFactory.recordWriter("dudRateCsvWriter",
                        reportFile(properties.getReport().getOutputDir(), "dud_rate_by_cohort.csv"),
                        DudCohort.class, columns(
                            "cohort", "cohort",
                            "totalAcquired", "total_acquired",
                            "matureCustomers", "mature_customers",
                            "matureOneTime", "mature_one_time",
                            "dudRate", "dud_rate",
                            "mature", "is_mature")));

                contribution.incrementWriteCount(1);
                log.info("Published door health report for {} ({} customers classified)",
                        asOf, runContext.size());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    @Bean
    Job doorHealthJob(JobRepository jobRepository,
            Step doorHealthAnalysisDateStep,
            Step customerHealthStep,
            Step doorHealthReportStep) {
        return new JobBuilder("doorHealthJob", jobRepository)
            .start(doorHealthAnalysisDateStep)
            .next(customerHealthStep)
            .next(doorHealthReportStep)
            .build();
    }

    // --- Helpers ---

    private static <T> void publish(List<T> rows,
                                    JdbcBatchItemWriter<T> dbWriter,
                                    FlatFileItemWriter<T> csvWriter) throws Exception {
        Chunk<T> chunk = new Chunk<>(rows);
        // not a container bean, so named-parameter detection has to be triggered here
        dbWriter.afterPropertiesSet();
        dbWriter.write(chunk);
        csvWriter.open(new ExecutionContext());
        try {
            csvWriter.write(chunk);
        } finally {
            csvWriter.close();
        }
    }

    private static ItemSqlParameterSourceProvider<DoorFunnelRow> funnelParams() {
        return r -> new MapSqlParameterSource()
            .addValue("as_of_date", r.asOfDate())
            .addValue("active", r.active())
            .addValue("at_risk", r.atRisk())
            .addValue("churning", r.churning())
            .addValue("churned", r.churned())
            .addValue("healthy_declining", r.healthyDeclining())
            .addValue("reactivated", r.reactivated())
            .addValue("total_doors", r.totalDoors())
            .addValue("active_doors", r.activeDoors())
            .addValue("rolling_churn_rate", r.rollingChurnRate())
            .addValue("churn_rate_ytd", r.churnRateYtd())
            .addValue("churn_rate_prior_year", r.churnRatePriorYear())
            .addValue("churn_rate_change", r.churnRateChange())
            .addValue("avg_lifespan_months", r.avgLifespanMonths())
            .addValue("avg_lifespan_months_prior_year", r.avgLifespanMonthsPriorYear())
            .addValue("lost_revenue", r.lostRevenue())
            .addValue("revenue_at_risk", r.revenueAtRisk());
    }

    private static Map<String, String> funnelColumns() {
        return columns(
            "asOfDate", "as_of_date",
            "active", "active",
            "atRisk", "at_risk",
            "churning", "churning",
            "churned", "churned",
            "healthyDeclining", "healthy_declining",
            "reactivated", "reactivated",
            "totalDoors", "total_doors",
            "activeDoors", "active_doors",
            "rollingChurnRate", "rolling_churn_rate",
            "churnRateYtd", "churn_rate_ytd",
            "churnRatePriorYear", "churn_rate_prior_year",
            "churnRateChange", "churn_rate_change",
            "avgLifespanMonths", "avg_lifespan_months",
            "avgLifespanMonthsPriorYear", "avg_lifespan_months_prior_year",
            "lostRevenue", "lost_revenue",
            "revenueAtRisk", "revenue_at_risk");
    }
}
