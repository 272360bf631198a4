package com.enterprise.wholesale.shared.tasklets.port;

import java.time.LocalDate;

/**
 * Resolves the as-of date for a run when none is passed as a job parameter.
 */
@FunctionalInterface
public interface AnalysisDateResolver {

    LocalDate today();
}
