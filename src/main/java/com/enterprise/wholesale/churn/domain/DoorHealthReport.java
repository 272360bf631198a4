package com.enterprise.wholesale.churn.domain;

import com.enterprise.wholesale.customer.domain.Funnel;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything the door health job publishes for one as-of date.
 */
public record DoorHealthReport(
    LocalDate asOfDate,
    Funnel funnel,
    ChurnSummary summary,
    List<YearChurn> churnByYear,
    List<ChurnedBySegment> churnedBySegment,
    List<ChurnedByLifespan> churnedByLifespan,
    List<CohortRetention> cohortRetention,
    List<DudCohort> dudRateByCohort
) {

    public DoorHealthReport {
        churnByYear = List.copyOf(churnByYear);
        churnedBySegment = List.copyOf(churnedBySegment);
        churnedByLifespan = List.copyOf(churnedByLifespan);
        cohortRetention = List.copyOf(cohortRetention);
        dudRateByCohort = List.copyOf(dudRateByCohort);
    }
}
