package com.enterprise.wholesale.customer.domain;

/**
 * Door counts per lifecycle bucket.
 *
 * <p>{@code active + atRisk + churning + churned} equals the number of doors
 * with order history. {@code healthyDeclining} is a subset of {@code active};
 * {@code reactivated} cuts across the non-churned buckets.
 */
public record Funnel(
    int active,
    int atRisk,
    int churning,
    int churned,
    int healthyDeclining,
    int reactivated
) {

    public int total() {
        return active + atRisk + churning + churned;
    }

    /** Doors that have not crossed the churn threshold. */
    public int activeDoors() {
        return active + atRisk + churning;
    }
}
