package com.enterprise.wholesale.shared.tasklets.adapter;

import com.enterprise.wholesale.shared.tasklets.port.AnalysisDateResolver;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Fixes the as-of date of a job execution and writes it to the
 * {@link org.springframework.batch.core.JobExecution} execution context
 * under {@value #AS_OF_DATE}, so every later step sees the same date.
 *
 * <p>The {@code asOfDate} job parameter wins (a {@link LocalDate} or an ISO
 * string); otherwise the resolver supplies today.
 */
@Slf4j
public class AnalysisDateTasklet implements Tasklet {

    public static final String AS_OF_DATE = "asOfDate";

    private final AnalysisDateResolver resolver;

    public AnalysisDateTasklet(AnalysisDateResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Object param = chunkContext.getStepContext().getJobParameters().get(AS_OF_DATE);
        LocalDate asOf = param != null ? toDate(param) : resolver.today();

        chunkContext.getStepContext()
                .getStepExecution()
                .getJobExecution()
                .getExecutionContext()
                .put(AS_OF_DATE, asOf);
        log.info("Analysis date resolved to {} ({})", asOf, param != null ? "job parameter" : "clock");
        return RepeatStatus.FINISHED;
    }

    static LocalDate toDate(Object param) {
        if (param instanceof LocalDate date) {
            return date;
        }
        try {
            return LocalDate.parse(param.toString().trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Job parameter " + AS_OF_DATE
                    + " is not an ISO date: " + param, e);
        }
    }
}
