package com.enterprise.wholesale.forecast.infrastructure;

import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.forecast.domain.ForecastDrivers;
import com.enterprise.wholesale.forecast.domain.WholesaleForecast;

import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a {@code wholesale_forecasts} row to its drivers. Nullable columns stay
 * null so the forecaster can fall back to the current door count and benchmarks.
 */
public class WholesaleForecastRowMapper implements RowMapper<WholesaleForecast> {

    @Override
    public WholesaleForecast mapRow(ResultSet rs, int rowNum) throws SQLException {
        Map<CustomerSegment, Integer> targets = new EnumMap<>(CustomerSegment.class);
        targets.put(CustomerSegment.MAJOR, intOrZero(rs, "new_major_doors"));
        targets.put(CustomerSegment.MID, intOrZero(rs, "new_mid_doors"));
        targets.put(CustomerSegment.SMALL, intOrZero(rs, "new_small_doors"));

        Map<CustomerSegment, BigDecimal> yields = new EnumMap<>(CustomerSegment.class);
        putIfPresent(yields, CustomerSegment.MAJOR, rs.getBigDecimal("major_yield"));
        putIfPresent(yields, CustomerSegment.MID, rs.getBigDecimal("mid_yield"));
        putIfPresent(yields, CustomerSegment.SMALL, rs.getBigDecimal("small_yield"));

        ForecastDrivers drivers = new ForecastDrivers(
            rs.getInt("fiscal_year"),
            rs.getObject("existing_doors_start", Integer.class),
            rs.getBigDecimal("expected_churn_pct"),
            rs.getObject("expected_churn_doors", Integer.class),
            rs.getBigDecimal("organic_growth_pct"),
            targets,
            yields,
            rs.getObject("doors_acquired_to_date", Integer.class),
            rs.getBigDecimal("b2b_annual_target"),
            rs.getBigDecimal("corporate_annual_target"));
        return new WholesaleForecast(rs.getLong("forecast_id"), drivers);
    }

    private static int intOrZero(ResultSet rs, String column) throws SQLException {
        Integer value = rs.getObject(column, Integer.class);
        return value == null ? 0 : value;
    }

    private static void putIfPresent(Map<CustomerSegment, BigDecimal> map,
                                     CustomerSegment segment, BigDecimal value) {
        if (value != null) {
            map.put(segment, value);
        }
    }
}
