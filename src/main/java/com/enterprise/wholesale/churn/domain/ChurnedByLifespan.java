package com.enterprise.wholesale.churn.domain;

import com.enterprise.wholesale.customer.domain.LifespanBucket;

import java.math.BigDecimal;

public record ChurnedByLifespan(
    LifespanBucket bucket,
    int count,
    BigDecimal revenue
) {}
