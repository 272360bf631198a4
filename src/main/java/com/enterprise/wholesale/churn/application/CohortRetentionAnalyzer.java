package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.churn.domain.CohortRetention;
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
 * Groups doors by the year of their first sale and reports how many of each
 * cohort are still buying.
 *
 * <p>Doors without a last sale date are counted as healthy so that a data gap
 * never shows up as churn.
 */
public class CohortRetentionAnalyzer {

    private final DoorHealthRules rules;

    public CohortRetentionAnalyzer(DoorHealthRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public List<CohortRetention> computeCohortRetention(Collection<ClassifiedCustomer> classified,
                                                        LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");

        Map<Integer, List<ClassifiedCustomer>> byYear = new TreeMap<>();
        for (ClassifiedCustomer c : classified) {
            LocalDate firstSale = c.snapshot().firstSaleDate();
            if (c.door() && firstSale != null) {
                byYear.computeIfAbsent(firstSale.getYear(), y -> new ArrayList<>()).add(c);
            }
        }

        List<CohortRetention> result = new ArrayList<>(byYear.size());
        byYear.forEach((year, members) -> result.add(toCohort(year, members, asOf)));
        return result;
    }

    private CohortRetention toCohort(int year, List<ClassifiedCustomer> members, LocalDate asOf) {
        int healthy = 0;
        int atRisk = 0;
        int churning = 0;
        int churned = 0;
        for (ClassifiedCustomer c : members) {
            switch (c.healthStatus()) {
                case AT_RISK -> atRisk++;
                case CHURNING -> churning++;
                case CHURNED -> churned++;
                default -> healthy++;
            }
        }
        int acquired = members.size();
        int retained = acquired - churned;
        long daysSinceYearEnd = ChronoUnit.DAYS.between(LocalDate.of(year, 12, 31), asOf);
        return new CohortRetention(
            year,
            acquired,
            healthy,
            atRisk,
            churning,
            churned,
            retained,
            Rates.percent(retained, acquired),
            daysSinceYearEnd < rules.churnedDays());
    }
}
