package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.shared.querybridge.port.BatchDmlProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

/**
 * Upserts for the door health output tables. Every table is keyed by
 * {@code as_of_date}, so re-running a date replaces its rows.
 */
public final class DoorHealthDmlProviders {

    private DoorHealthDmlProviders() {}

    public static BatchDmlProvider upsertCustomerHealth() {
        return params -> SqlResult.of("""
            MERGE INTO customer_health (
                as_of_date, customer_id, company_name, segment, health_status,
                days_since_last_order, lifespan_months, churn_year, is_door,
                is_declining, is_reactivated, lifetime_revenue)
            KEY (as_of_date, customer_id)
            VALUES (
                :as_of_date, :customer_id, :company_name, :segment, :health_status,
                :days_since_last_order, :lifespan_months, :churn_year, :is_door,
                :is_declining, :is_reactivated, :lifetime_revenue)""");
    }

    public static BatchDmlProvider upsertDoorFunnel() {
        return params -> SqlResult.of("""
            MERGE INTO door_funnel (
                as_of_date, active, at_risk, churning, churned, healthy_declining,
                reactivated, total_doors, active_doors, rolling_churn_rate,
                churn_rate_ytd, churn_rate_prior_year, churn_rate_change,
                avg_lifespan_months, avg_lifespan_months_prior_year,
                lost_revenue, revenue_at_risk)
            KEY (as_of_date)
            VALUES (
                :as_of_date, :active, :at_risk, :churning, :churned, :healthy_declining,
                :reactivated, :total_doors, :active_doors, :rolling_churn_rate,
                :churn_rate_ytd, :churn_rate_prior_year, :churn_rate_change,
                :avg_lifespan_months, :avg_lifespan_months_prior_year,
                :lost_revenue, :revenue_at_risk)""");
    }

    public static BatchDmlProvider upsertChurnByYear() {
        return params -> SqlResult.of("""
            MERGE INTO churn_by_year (
                as_of_date, churn_year, churned_count, churned_revenue,
                pool_size, churn_rate, integrity_fault)
            KEY (as_of_date, churn_year)
            VALUES (
                :as_of_date, :churn_year, :churned_count, :churned_revenue,
                :pool_size, :churn_rate, :integrity_fault)""");
    }

    public static BatchDmlProvider upsertChurnedBreakdown() {
        return params -> SqlResult.of("""
            MERGE INTO churned_breakdown (
                as_of_date, dimension, bucket, churned_count, churned_revenue,
                avg_lifespan_months)
            KEY (as_of_date, dimension, bucket)
            VALUES (
                :as_of_date, :dimension, :bucket, :churned_count, :churned_revenue,
                :avg_lifespan_months)""");
    }

    public static BatchDmlProvider upsertCohortRetention() {
        return params -> SqlResult.of("""
            MERGE INTO cohort_retention (
                as_of_date, cohort_year, acquired, healthy, at_risk, churning,
                churned, retained, retention_pct, is_maturing)
            KEY (as_of_date, cohort_year)
            VALUES (
                :as_of_date, :cohort_year, :acquired, :healthy, :at_risk, :churning,
                :churned, :retained, :retention_pct, :is_maturing)""");
    }

    public static BatchDmlProvider upsertDudRate() {
        return params -> SqlResult.of("""
            MERGE INTO dud_rate_by_cohort (
                as_of_date, cohort, total_acquired, mature_customers,
                mature_one_time, dud_rate, is_mature)
            KEY (as_of_date, cohort)
            VALUES (
                :as_of_date, :cohort, :total_acquired, :mature_customers,
                :mature_one_time, :dud_rate, :is_mature)""");
    }
}
