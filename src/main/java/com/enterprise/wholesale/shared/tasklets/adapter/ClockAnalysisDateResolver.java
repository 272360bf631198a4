package com.enterprise.wholesale.shared.tasklets.adapter;

import com.enterprise.wholesale.shared.tasklets.port.AnalysisDateResolver;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Reads "today" from an injected {@link Clock} so tests can pin it.
 */
public class ClockAnalysisDateResolver implements AnalysisDateResolver {

    private final Clock clock;

    public ClockAnalysisDateResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
