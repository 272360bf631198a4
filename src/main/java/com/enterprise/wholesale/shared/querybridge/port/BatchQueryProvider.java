package com.enterprise.wholesale.shared.querybridge.port;

import java.util.Map;

/**
 * Contract for Spring Batch reader queries.
 *
 * <p>Implementations are stateless; every call returns a fresh {@link SqlResult}
 * bound to the given job parameters.
 *
 * <pre>{@code
 * public static BatchQueryProvider activeForecasts() {
 *     return params -> SqlResult.of(
 *         "SELECT * FROM wholesale_forecasts WHERE fiscal_year = :fiscal_year",
 *         Map.of("fiscal_year", params.get("fiscalYear")));
 * }
 * }</pre>
 */
@FunctionalInterface
public interface BatchQueryProvider {

    SqlResult buildQuery(Map<String, Object> jobParams);
}
