package com.enterprise.wholesale.churn.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Churned doors broken down by segment or by lifespan bucket.
 *
 * @param dimension {@code SEGMENT} or {@code LIFESPAN}
 * @param bucket    segment name or lifespan label
 * @param avgLifespanMonths null for lifespan rows
 */
public record ChurnedBreakdownRow(
    LocalDate asOfDate,
    String dimension,
    String bucket,
    int churnedCount,
    BigDecimal churnedRevenue,
    BigDecimal avgLifespanMonths
) {

    public static final String SEGMENT = "SEGMENT";
    public static final String LIFESPAN = "LIFESPAN";

    public static List<ChurnedBreakdownRow> of(DoorHealthReport report) {
        List<ChurnedBreakdownRow> rows = new ArrayList<>();
        for (ChurnedBySegment s : report.churnedBySegment()) {
            rows.add(new ChurnedBreakdownRow(report.asOfDate(), SEGMENT, s.segment().name(),
                    s.count(), s.revenue(), s.avgLifespanMonths()));
        }
        for (ChurnedByLifespan l : report.churnedByLifespan()) {
            rows.add(new ChurnedBreakdownRow(report.asOfDate(), LIFESPAN, l.bucket().label(),
                    l.count(), l.revenue(), null));
        }
        return rows;
    }
}
