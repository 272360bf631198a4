package com.enterprise.wholesale.customer.infrastructure;

import com.enterprise.wholesale.customer.domain.CustomerSnapshot;

import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

/**
 * Maps a {@code wholesale_customers} row to a {@link CustomerSnapshot}.
 */
public class CustomerSnapshotRowMapper implements RowMapper<CustomerSnapshot> {

    @Override
    public CustomerSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
        Integer orders = rs.getObject("lifetime_orders", Integer.class);
        return new CustomerSnapshot(
            rs.getLong("customer_id"),
            rs.getString("company_name"),
            rs.getObject("first_sale_date", LocalDate.class),
            rs.getObject("last_sale_date", LocalDate.class),
            rs.getBigDecimal("lifetime_revenue"),
            orders == null ? 0 : orders,
            rs.getBoolean("is_corporate"),
            rs.getBoolean("was_churned"),
            rs.getObject("yoy_revenue_change_pct", BigDecimal.class));
    }
}
