package com.enterprise.wholesale.shared.tasklets;

import com.enterprise.wholesale.shared.tasklets.adapter.AnalysisDateTasklet;
import com.enterprise.wholesale.shared.tasklets.adapter.ClockAnalysisDateResolver;

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobInstance;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class AnalysisDateTaskletTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
    private final AnalysisDateTasklet tasklet = new AnalysisDateTasklet(new ClockAnalysisDateResolver(clock));

    @Test
    void jobParameterWinsOverClock() throws Exception {
        JobExecution execution = run(new JobParametersBuilder()
            .addString(AnalysisDateTasklet.AS_OF_DATE, "2026-10-18")
            .toJobParameters());

        assertThat(execution.getExecutionContext().get(AnalysisDateTasklet.AS_OF_DATE))
            .isEqualTo(LocalDate.of(2026, 10, 18));
    }

    @Test
    void clockSuppliesDateWhenNoParameterIsGiven() throws Exception {
        JobExecution execution = run(new JobParameters());

        assertThat(execution.getExecutionContext().get(AnalysisDateTasklet.AS_OF_DATE))
            .isEqualTo(LocalDate.of(2026, 3, 2));
    }

    @Test
    void malformedDateParameterFailsTheStep() {
        JobParameters params = new JobParametersBuilder()
            .addString(AnalysisDateTasklet.AS_OF_DATE, "18/10/2026")
            .toJobParameters();

        assertThatIllegalArgumentException()
            .isThrownBy(() -> run(params))
            .withMessageContaining("18/10/2026");
    }

    private JobExecution run(JobParameters params) throws Exception {
        JobExecution jobExecution = new JobExecution(new JobInstance(1L, "testJob"), 1L, params);
        StepExecution stepExecution = jobExecution.createStepExecution("analysisDateStep");
        ChunkContext chunkContext = new ChunkContext(new StepContext(stepExecution));

        RepeatStatus status = tasklet.execute(new StepContribution(stepExecution), chunkContext);

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        return jobExecution;
    }
}
