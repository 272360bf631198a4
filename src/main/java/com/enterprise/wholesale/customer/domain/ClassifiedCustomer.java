package com.enterprise.wholesale.customer.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A snapshot together with the fields derived from it for one as-of date.
 *
 * @param snapshot           source record
 * @param daysSinceLastOrder days between last sale and as-of date, null if never ordered
 * @param lifespanMonths     whole months between first and last sale, null if either is missing
 * @param segment            revenue tier
 * @param healthStatus       lifecycle status
 * @param churnYear          year in which last sale + 365 days falls, null if never ordered
 * @param door               counts as a B2B door (not corporate, has orders and revenue)
 * @param flags              cross-cutting tags
 */
public record ClassifiedCustomer(
    CustomerSnapshot snapshot,
    Integer daysSinceLastOrder,
    Integer lifespanMonths,
    CustomerSegment segment,
    HealthStatus healthStatus,
    Integer churnYear,
    boolean door,
    Set<CustomerFlag> flags
) {

    public ClassifiedCustomer {
        flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public boolean hasFlag(CustomerFlag flag) {
        return flags.contains(flag);
    }

    /** Door with a last sale date, the population of the funnel and churn pool. */
    public boolean hasOrderHistory() {
        return door && daysSinceLastOrder != null;
    }

    public boolean isChurned() {
        return healthStatus == HealthStatus.CHURNED;
    }
}
