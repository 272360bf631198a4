package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerFlag;
import com.enterprise.wholesale.customer.domain.Funnel;

import java.util.Collection;

/**
 * Single-pass aggregation of classified customers into a {@link Funnel}.
 */
public class FunnelCalculator {

    public Funnel computeFunnel(Collection<ClassifiedCustomer> classified) {
        int active = 0;
        int atRisk = 0;
        int churning = 0;
        int churned = 0;
        int declining = 0;
        int reactivated = 0;

        for (ClassifiedCustomer c : classified) {
            if (!c.hasOrderHistory()) {
                continue;
            }
            switch (c.healthStatus()) {
                case HEALTHY -> active++;
                case HEALTHY_DECLINING -> {
                    active++;
                    declining++;
                }
                case AT_RISK -> atRisk++;
                case CHURNING -> churning++;
                case CHURNED -> churned++;
                default -> { }
            }
            if (c.hasFlag(CustomerFlag.REACTIVATED)) {
                reactivated++;
            }
        }
        return new Funnel(active, atRisk, churning, churned, declining, reactivated);
    }
}
