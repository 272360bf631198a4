package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.shared.querybridge.port.BatchQueryProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

/**
 * Reads of the {@code wholesale_customers} snapshot table.
 */
public final class CustomerQueries {

    static final String SNAPSHOT_COLUMNS = """
            customer_id, company_name, first_sale_date, last_sale_date,
            lifetime_revenue, lifetime_orders, is_corporate, was_churned,
            yoy_revenue_change_pct""";

    private CustomerQueries() {}

    /** Every snapshot row, corporate accounts included; the classifier decides eligibility. */
    public static BatchQueryProvider allCustomers() {
        return params -> SqlResult.of(
            "SELECT " + SNAPSHOT_COLUMNS + " FROM wholesale_customers ORDER BY customer_id");
    }
}
