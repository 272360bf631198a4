package com.enterprise.wholesale.shared.querybridge.port;

import java.util.Map;

/**
 * Contract for Spring Batch DML providers.
 *
 * <p>Providers return templates with {@code :column} placeholders. Values
 * are bound per item by the writer's parameter source provider, so the
 * returned {@link SqlResult} normally has no parameters of its own.
 */
@FunctionalInterface
public interface BatchDmlProvider {

    /**
     * Builds a DML statement using the given job parameters.
     *
     * @param jobParams parameters from the Spring Batch job execution
     * @return statement template ready for writer consumption
     */
    SqlResult buildDml(Map<String, Object> jobParams);
}
