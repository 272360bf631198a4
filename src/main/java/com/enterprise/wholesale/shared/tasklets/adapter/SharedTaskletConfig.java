package com.enterprise.wholesale.shared.tasklets.adapter;

import com.enterprise.wholesale.shared.tasklets.port.AnalysisDateResolver;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Tasklets shared by every job.
 */
@Configuration
public class SharedTaskletConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AnalysisDateResolver analysisDateResolver(Clock clock) {
        return new ClockAnalysisDateResolver(clock);
    }

    @Bean
    public AnalysisDateTasklet analysisDateTasklet(AnalysisDateResolver resolver) {
        return new AnalysisDateTasklet(resolver);
    }
}
