package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.churn.domain.ChurnSummary;
import com.enterprise.wholesale.churn.domain.ChurnedByLifespan;
import com.enterprise.wholesale.churn.domain.ChurnedBySegment;
import com.enterprise.wholesale.churn.domain.YearChurn;
import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.customer.domain.HealthStatus;
import com.enterprise.wholesale.customer.domain.LifespanBucket;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Churn rates over a classified customer set.
 *
 * <p>The population is always the doors with order history; corporate,
 * never-ordered and zero-revenue accounts are ignored.
 *
 * <p><b>Pool-adjusted churn by year.</b> Years are processed in ascending
 * order and each year's denominator is the door total minus every door that
 * churned in an earlier year, so a door leaves the pool exactly once.
 */
@Slf4j
public class ChurnCalculator {

    /** Point-in-time share of doors currently past the churn threshold. */
    public BigDecimal rollingChurnRate(Collection<ClassifiedCustomer> classified) {
        int total = 0;
        int churned = 0;
        for (ClassifiedCustomer c : classified) {
            if (c.hasOrderHistory()) {
                total++;
                if (c.isChurned()) {
                    churned++;
                }
            }
        }
        return Rates.percent(churned, total);
    }

    public List<YearChurn> computeChurnByYear(Collection<ClassifiedCustomer> classified) {
        int totalDoors = countDoorsWithOrders(classified);

        Map<Integer, List<ClassifiedCustomer>> byYear = new TreeMap<>();
        for (ClassifiedCustomer c : churnedDoors(classified)) {
            byYear.computeIfAbsent(c.churnYear(), y -> new ArrayList<>()).add(c);
        }

        List<YearChurn> result = new ArrayList<>();
        int cumulativeChurned = 0;
        for (Map.Entry<Integer, List<ClassifiedCustomer>> entry : byYear.entrySet()) {
            int year = entry.getKey();
            int count = entry.getValue().size();
            int pool = totalDoors - cumulativeChurned;
            result.add(poolAdjusted(year, count, revenueOf(entry.getValue()), pool));
            cumulativeChurned += count;
        }
        return result;
    }

    /**
     * One year's rate against its pool. Churned doors are a subset of the
     * doors counted into the pool, so from {@link #computeChurnByYear} the
     * fault branch only fires on an inconsistent classified set.
     */
    YearChurn poolAdjusted(int year, int count, BigDecimal revenue, int pool) {
        if (pool < 0 || count > pool) {
            log.warn("Churn pool integrity fault for {}: {} churned against a pool of {}; reporting 0%",
                    year, count, pool);
            return new YearChurn(year, count, revenue, pool, BigDecimal.ZERO.setScale(1), true);
        }
        return new YearChurn(year, count, revenue, pool, Rates.percent(count, pool), false);
    }

    public ChurnSummary summarize(Collection<ClassifiedCustomer> classified, LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        int currentYear = asOf.getYear();
        int priorYear = currentYear - 1;

        int totalDoors = 0;
        int active = 0;
        int churned = 0;
        int churnedYtd = 0;
        int churnedPrior = 0;
        List<Integer> lifespansYtd = new ArrayList<>();
        List<Integer> lifespansPrior = new ArrayList<>();
        BigDecimal lostRevenue = BigDecimal.ZERO;
        BigDecimal revenueAtRisk = BigDecimal.ZERO;

        for (ClassifiedCustomer c : classified) {
            if (!c.hasOrderHistory()) {
                continue;
            }
            totalDoors++;
            HealthStatus status = c.healthStatus();
            BigDecimal revenue = c.snapshot().lifetimeRevenue();
            if (status.isActive()) {
                active++;
            } else if (status == HealthStatus.AT_RISK || status == HealthStatus.CHURNING) {
                revenueAtRisk = revenueAtRisk.add(revenue);
            } else if (status == HealthStatus.CHURNED) {
                churned++;
                lostRevenue = lostRevenue.add(revenue);
                if (c.churnYear() == currentYear) {
                    churnedYtd++;
                    addIfPresent(lifespansYtd, c.lifespanMonths());
                } else if (c.churnYear() == priorYear) {
                    churnedPrior++;
                    addIfPresent(lifespansPrior, c.lifespanMonths());
                }
            }
        }

        BigDecimal rateYtd = Rates.percent(churnedYtd, totalDoors);
        BigDecimal ratePrior = Rates.percent(churnedPrior, totalDoors);
        return new ChurnSummary(
            totalDoors,
            active,
            totalDoors - active,
            churned,
            Rates.percent(churned, totalDoors),
            rateYtd,
            ratePrior,
            rateYtd.subtract(ratePrior),
            Rates.average(lifespansYtd),
            Rates.average(lifespansPrior),
            lostRevenue,
            revenueAtRisk);
    }

    /** Churned doors per segment, largest segment first; empty segments omitted. */
    public List<ChurnedBySegment> churnedBySegment(Collection<ClassifiedCustomer> classified) {
        Map<CustomerSegment, List<ClassifiedCustomer>> bySegment = new EnumMap<>(CustomerSegment.class);
        for (ClassifiedCustomer c : churnedDoors(classified)) {
            bySegment.computeIfAbsent(c.segment(), s -> new ArrayList<>()).add(c);
        }

        List<ChurnedBySegment> result = new ArrayList<>();
        bySegment.forEach((segment, members) -> {
            List<Integer> lifespans = new ArrayList<>();
            members.forEach(m -> addIfPresent(lifespans, m.lifespanMonths()));
            result.add(new ChurnedBySegment(segment, members.size(),
                    revenueOf(members), Rates.average(lifespans)));
        });
        return result;
    }

    /** Churned doors per lifespan bucket; every bucket is present, possibly with zero. */
    public List<ChurnedByLifespan> churnedByLifespan(Collection<ClassifiedCustomer> classified) {
        Map<LifespanBucket, List<ClassifiedCustomer>> byBucket = new EnumMap<>(LifespanBucket.class);
        for (LifespanBucket bucket : LifespanBucket.values()) {
            byBucket.put(bucket, new ArrayList<>());
        }
        for (ClassifiedCustomer c : churnedDoors(classified)) {
            byBucket.get(LifespanBucket.of(c.lifespanMonths())).add(c);
        }

        List<ChurnedByLifespan> result = new ArrayList<>();
        byBucket.forEach((bucket, members) ->
            result.add(new ChurnedByLifespan(bucket, members.size(), revenueOf(members))));
        return result;
    }

    // ===================== Internal =====================

    private static int countDoorsWithOrders(Collection<ClassifiedCustomer> classified) {
        return (int) classified.stream().filter(ClassifiedCustomer::hasOrderHistory).count();
    }

    private static List<ClassifiedCustomer> churnedDoors(Collection<ClassifiedCustomer> classified) {
        return classified.stream()
            .filter(ClassifiedCustomer::hasOrderHistory)
            .filter(ClassifiedCustomer::isChurned)
            .toList();
    }

    private static BigDecimal revenueOf(List<ClassifiedCustomer> members) {
        return members.stream()
            .map(m -> m.snapshot().lifetimeRevenue())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void addIfPresent(List<Integer> values, Integer value) {
        if (value != null) {
            values.add(value);
        }
    }
}
