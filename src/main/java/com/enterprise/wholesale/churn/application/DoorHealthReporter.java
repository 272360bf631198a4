package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.churn.domain.DoorHealthReport;
import com.enterprise.wholesale.customer.application.FunnelCalculator;
import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;

/**
 * Runs every door health analyzer over one classified population.
 */
@Slf4j
public class DoorHealthReporter {

    private final FunnelCalculator funnelCalculator;
    private final ChurnCalculator churnCalculator;
    private final CohortRetentionAnalyzer cohortRetentionAnalyzer;
    private final DudRateAnalyzer dudRateAnalyzer;

    public DoorHealthReporter(FunnelCalculator funnelCalculator,
                              ChurnCalculator churnCalculator,
                              CohortRetentionAnalyzer cohortRetentionAnalyzer,
                              DudRateAnalyzer dudRateAnalyzer) {
        this.funnelCalculator = funnelCalculator;
        this.churnCalculator = churnCalculator;
        this.cohortRetentionAnalyzer = cohortRetentionAnalyzer;
        this.dudRateAnalyzer = dudRateAnalyzer;
    }

    public DoorHealthReport report(Collection<ClassifiedCustomer> classified, LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        DoorHealthReport report = new DoorHealthReport(
            asOf,
            funnelCalculator.computeFunnel(classified),
            churnCalculator.summarize(classified, asOf),
            churnCalculator.computeChurnByYear(classified),
            churnCalculator.churnedBySegment(classified),
            churnCalculator.churnedByLifespan(classified),
            cohortRetentionAnalyzer.computeCohortRetention(classified, asOf),
            dudRateAnalyzer.computeDudRateByCohort(classified, asOf));

        log.info("Door health report as of {}: {} doors, {} churn years, {} cohorts, {} dud cohorts",
                asOf, report.summary().totalDoors(), report.churnByYear().size(),
                report.cohortRetention().size(), report.dudRateByCohort().size());
        return report;
    }
}
