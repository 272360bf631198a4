package com.enterprise.wholesale.customer.domain;

/**
 * Cross-cutting tags attached during classification. Tags never change the
 * funnel bucket.
 */
public enum CustomerFlag {
    /** Year-over-year revenue fell below the decline threshold. */
    DECLINING,
    /** Churned in the prior period, not churned now. */
    REACTIVATED
}
