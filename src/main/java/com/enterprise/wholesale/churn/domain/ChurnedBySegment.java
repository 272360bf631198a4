package com.enterprise.wholesale.churn.domain;

import com.enterprise.wholesale.customer.domain.CustomerSegment;

import java.math.BigDecimal;

public record ChurnedBySegment(
    CustomerSegment segment,
    int count,
    BigDecimal revenue,
    BigDecimal avgLifespanMonths
) {}
