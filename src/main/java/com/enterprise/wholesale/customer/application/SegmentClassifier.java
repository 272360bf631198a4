package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Maps lifetime revenue to a {@link CustomerSegment}.
 *
 * <p>MAJOR ({@literal >=} major threshold), MID ({@literal >=} mid threshold), SMALL (rest).
 */
public class SegmentClassifier {

    private final BigDecimal majorThreshold;
    private final BigDecimal midThreshold;

    public SegmentClassifier(DoorHealthRules rules) {
        Objects.requireNonNull(rules, "rules");
        this.majorThreshold = rules.majorRevenue();
        this.midThreshold = rules.midRevenue();
    }

    public CustomerSegment classify(BigDecimal lifetimeRevenue) {
        BigDecimal revenue = lifetimeRevenue != null ? lifetimeRevenue : BigDecimal.ZERO;
        if (revenue.compareTo(majorThreshold) >= 0) {
            return CustomerSegment.MAJOR;
        }
        if (revenue.compareTo(midThreshold) >= 0) {
            return CustomerSegment.MID;
        }
        return CustomerSegment.SMALL;
    }
}
