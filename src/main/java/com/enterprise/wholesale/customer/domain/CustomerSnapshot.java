package com.enterprise.wholesale.customer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One wholesale account as fetched for an analysis run.
 *
 * @param customerId          account identifier
 * @param companyName         display name
 * @param firstSaleDate       first transaction date, null if never ordered
 * @param lastSaleDate        most recent transaction date, null if never ordered
 * @param lifetimeRevenue     total revenue, zero when unknown
 * @param lifetimeOrders      total order count
 * @param corporate           corporate gifting account, excluded from B2B analytics
 * @param wasChurned          churned in the prior period
 * @param yoyRevenueChangePct year-over-year revenue change in percent, null if unknown
 */
public record CustomerSnapshot(
    Long customerId,
    String companyName,
    LocalDate firstSaleDate,
    LocalDate lastSaleDate,
    BigDecimal lifetimeRevenue,
    int lifetimeOrders,
    boolean corporate,
    boolean wasChurned,
    BigDecimal yoyRevenueChangePct
) {

    public CustomerSnapshot {
        if (lifetimeRevenue == null) {
            lifetimeRevenue = BigDecimal.ZERO;
        }
    }
}
