package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.shared.querybridge.port.BatchQueryProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

import java.util.Map;

/**
 * Reads of the {@code wholesale_forecasts} driver table.
 */
public final class ForecastQueries {

    private static final String COLUMNS = """
            forecast_id, fiscal_year, existing_doors_start, expected_churn_pct,
            expected_churn_doors, organic_growth_pct, new_major_doors, new_mid_doors,
            new_small_doors, major_yield, mid_yield, small_yield,
            doors_acquired_to_date, b2b_annual_target, corporate_annual_target""";

    private ForecastQueries() {}

    /**
     * Active forecasts. A {@code fiscalYear} job parameter narrows the read to
     * that year.
     */
    public static BatchQueryProvider activeForecasts() {
        return params -> {
            Object fiscalYear = params.get("fiscalYear");
            if (fiscalYear == null) {
                return SqlResult.of("SELECT " + COLUMNS
                        + " FROM wholesale_forecasts WHERE is_active = TRUE ORDER BY forecast_id");
            }
            return SqlResult.of("SELECT " + COLUMNS
                    + " FROM wholesale_forecasts WHERE is_active = TRUE AND fiscal_year = :fiscal_year"
                    + " ORDER BY forecast_id",
                    Map.of("fiscal_year", Integer.valueOf(fiscalYear.toString())));
        };
    }
}
