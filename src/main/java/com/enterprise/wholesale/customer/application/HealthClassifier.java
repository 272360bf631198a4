package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerFlag;
import com.enterprise.wholesale.customer.domain.CustomerSnapshot;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;
import com.enterprise.wholesale.customer.domain.HealthStatus;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives lifecycle fields for one customer as of a given date.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>No last sale date → {@link HealthStatus#NO_HISTORY}</li>
 *   <li>Not a door (corporate, no orders or no revenue) → {@link HealthStatus#EXCLUDED}</li>
 *   <li>Days since last order bucketed into HEALTHY / AT_RISK / CHURNING / CHURNED</li>
 *   <li>HEALTHY with year-over-year change below the decline threshold → HEALTHY_DECLINING</li>
 * </ol>
 *
 * <p>The classifier holds no state between calls, so classifying the same
 * snapshot twice with the same date gives equal results.
 */
@Slf4j
public class HealthClassifier {

    private final DoorHealthRules rules;
    private final SegmentClassifier segmentClassifier;

    public HealthClassifier(DoorHealthRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.segmentClassifier = new SegmentClassifier(rules);
    }

    public ClassifiedCustomer classify(CustomerSnapshot customer, LocalDate asOf) {
        Objects.requireNonNull(customer, "customer");
        Objects.requireNonNull(asOf, "asOf");

        Integer days = daysBetween(customer.lastSaleDate(), asOf);
        boolean door = isDoor(customer);
        boolean declining = isDeclining(customer);
        HealthStatus status = deriveStatus(days, door, declining);

        Set<CustomerFlag> flags = EnumSet.noneOf(CustomerFlag.class);
        if (declining) {
            flags.add(CustomerFlag.DECLINING);
        }
        if (customer.wasChurned() && status.inFunnel() && status != HealthStatus.CHURNED) {
            flags.add(CustomerFlag.REACTIVATED);
        }

        ClassifiedCustomer classified = new ClassifiedCustomer(
            customer,
            days,
            lifespanMonths(customer.firstSaleDate(), customer.lastSaleDate()),
            segmentClassifier.classify(customer.lifetimeRevenue()),
            status,
            churnYear(customer.lastSaleDate()),
            door,
            flags);

        log.debug("Classified customer {} as {} ({} days since last order)",
                customer.customerId(), status, days);
        return classified;
    }

    public List<ClassifiedCustomer> classifyAll(List<CustomerSnapshot> customers, LocalDate asOf) {
        return customers.stream()
            .map(c -> classify(c, asOf))
            .toList();
    }

    /** Corporate accounts and accounts without orders or revenue are never doors. */
    public static boolean isDoor(CustomerSnapshot customer) {
        return !customer.corporate()
            && customer.lifetimeOrders() > 0
            && customer.lifetimeRevenue().signum() > 0;
    }

    private HealthStatus deriveStatus(Integer days, boolean door, boolean declining) {
        if (days == null) {
            return HealthStatus.NO_HISTORY;
        }
        if (!door) {
            return HealthStatus.EXCLUDED;
        }
        if (days < rules.atRiskDays()) {
            return declining ? HealthStatus.HEALTHY_DECLINING : HealthStatus.HEALTHY;
        }
        if (days < rules.churningDays()) {
            return HealthStatus.AT_RISK;
        }
        if (days < rules.churnedDays()) {
            return HealthStatus.CHURNING;
        }
        return HealthStatus.CHURNED;
    }

    private boolean isDeclining(CustomerSnapshot customer) {
        return customer.yoyRevenueChangePct() != null
            && customer.yoyRevenueChangePct().compareTo(rules.decliningYoyPct()) < 0;
    }

    private Integer churnYear(LocalDate lastSaleDate) {
        if (lastSaleDate == null) {
            return null;
        }
        return lastSaleDate.plusDays(rules.churnedDays()).getYear();
    }

    private static Integer daysBetween(LocalDate from, LocalDate to) {
        if (from == null) {
            return null;
        }
        return (int) ChronoUnit.DAYS.between(from, to);
    }

    /** Calendar-month difference, day of month ignored, floored at zero. */
    private static Integer lifespanMonths(LocalDate first, LocalDate last) {
        if (first == null || last == null) {
            return null;
        }
        int months = (last.getYear() - first.getYear()) * 12
                + (last.getMonthValue() - first.getMonthValue());
        return Math.max(0, months);
    }
}
