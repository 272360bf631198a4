package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.churn.domain.DudCohort;
import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Share of doors per acquisition cohort that never placed a second order.
 *
 * <p>A door only counts once it has had {@code dudMaturityDays} to reorder.
 * Cohorts of the as-of year are split into halves ({@code "2026 H1"},
 * {@code "2026 H2"}); earlier cohorts are whole years ({@code "2025"}).
 */
public class DudRateAnalyzer {

    private final int maturityDays;

    public DudRateAnalyzer(DoorHealthRules rules) {
        this.maturityDays = Objects.requireNonNull(rules, "rules").dudMaturityDays();
    }

    public List<DudCohort> computeDudRateByCohort(Collection<ClassifiedCustomer> classified,
                                                  LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");

        Map<String, List<ClassifiedCustomer>> byCohort = new TreeMap<>();
        for (ClassifiedCustomer c : classified) {
            LocalDate firstSale = c.snapshot().firstSaleDate();
            if (c.door() && firstSale != null) {
                byCohort.computeIfAbsent(cohortKey(firstSale, asOf), k -> new ArrayList<>()).add(c);
            }
        }

        List<DudCohort> result = new ArrayList<>(byCohort.size());
        byCohort.forEach((key, members) -> result.add(toCohort(key, members, asOf)));
        return result;
    }

    static String cohortKey(LocalDate firstSale, LocalDate asOf) {
        int year = firstSale.getYear();
        if (year == asOf.getYear()) {
            return year + (firstSale.getMonthValue() <= 6 ? " H1" : " H2");
        }
        return String.valueOf(year);
    }

    private DudCohort toCohort(String key, List<ClassifiedCustomer> members, LocalDate asOf) {
        int mature = 0;
        int matureOneTime = 0;
        for (ClassifiedCustomer c : members) {
            long age = ChronoUnit.DAYS.between(c.snapshot().firstSaleDate(), asOf);
            if (age >= maturityDays) {
                mature++;
                if (c.snapshot().lifetimeOrders() == 1) {
                    matureOneTime++;
                }
            }
        }
        return new DudCohort(
            key,
            members.size(),
            mature,
            matureOneTime,
            mature == 0 ? null : Rates.percent(matureOneTime, mature),
            mature == members.size());
    }
}
