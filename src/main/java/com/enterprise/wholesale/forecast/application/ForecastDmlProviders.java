package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.shared.querybridge.port.BatchDmlProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

public final class ForecastDmlProviders {

    private ForecastDmlProviders() {}

    public static BatchDmlProvider upsertProjection() {
        return params -> SqlResult.of("""
            MERGE INTO forecast_projections (
                forecast_id, as_of_date, fiscal_year, starting_doors, expected_churn_doors,
                retained_doors, existing_door_base, organic_growth, existing_door_total,
                total_new_doors, new_door_revenue, projected_revenue, ending_doors,
                annual_target, gap, gap_pct, doors_needed)
            KEY (forecast_id, as_of_date)
            VALUES (
                :forecast_id, :as_of_date, :fiscal_year, :starting_doors, :expected_churn_doors,
                :retained_doors, :existing_door_base, :organic_growth, :existing_door_total,
                :total_new_doors, :new_door_revenue, :projected_revenue, :ending_doors,
                :annual_target, :gap, :gap_pct, :doors_needed)""");
    }

    public static BatchDmlProvider upsertMonthlyTarget() {
        return params -> SqlResult.of("""
            MERGE INTO forecast_monthly_targets (
                forecast_id, channel, target_month, fiscal_year, quarter, target)
            KEY (forecast_id, channel, target_month)
            VALUES (
                :forecast_id, :channel, :target_month, :fiscal_year, :quarter, :target)""");
    }

    public static BatchDmlProvider upsertScenario() {
        return params -> SqlResult.of("""
            MERGE INTO forecast_scenarios (
                forecast_id, as_of_date, scenario_name, description, expected_churn_doors,
                total_new_doors, organic_growth_pct, projected_revenue, ending_doors,
                gap, gap_pct)
            KEY (forecast_id, as_of_date, scenario_name)
            VALUES (
                :forecast_id, :as_of_date, :scenario_name, :description, :expected_churn_doors,
                :total_new_doors, :organic_growth_pct, :projected_revenue, :ending_doors,
                :gap, :gap_pct)""");
    }
}
