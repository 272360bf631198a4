package com.enterprise.wholesale.shared.config;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Business rules and output settings bound from {@code analytics.*}.
 *
 * <p>Defaults match the historical values, so an empty configuration yields
 * the standard rule set.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private Health health = new Health();

    private Forecast forecast = new Forecast();

    private Report report = new Report();

    @Data
    public static class Health {

        /** First day since last order counted as at risk. */
        private int atRiskDays = 180;

        private int churningDays = 270;

        private int churnedDays = 365;

        /** Lifetime revenue at which an account is a major account. */
        private BigDecimal majorRevenue = new BigDecimal("20000");

        private BigDecimal midRevenue = new BigDecimal("5000");

        /** Year-over-year change (percent) below which an account is declining. */
        private BigDecimal decliningYoyPct = new BigDecimal("-20");

        /** Days a new door gets to reorder before it can count as a dud. */
        private int dudMaturityDays = 133;
    }

    @Data
    public static class Forecast {

        private BigDecimal churnPct = new BigDecimal("0.17");

        private BigDecimal sameStoreGrowthPct = new BigDecimal("0.11");

        private BigDecimal newDoorFirstYearYield = new BigDecimal("6000");

        private BigDecimal returningDoorAvgYield = new BigDecimal("11500");

        private BigDecimal majorYield = new BigDecimal("25000");

        private BigDecimal midYield = new BigDecimal("8000");

        private BigDecimal smallYield = new BigDecimal("2500");

        private List<BigDecimal> b2bCurve = new ArrayList<>(List.of(
                new BigDecimal("0.20"), new BigDecimal("0.21"),
                new BigDecimal("0.22"), new BigDecimal("0.37")));

        private List<BigDecimal> corporateCurve = new ArrayList<>(List.of(
                new BigDecimal("0.20"), new BigDecimal("0.06"),
                new BigDecimal("0.16"), new BigDecimal("0.58")));

        private List<BigDecimal> defaultMonthlySplit = new ArrayList<>(List.of(
                new BigDecimal("0.30"), new BigDecimal("0.33"), new BigDecimal("0.37")));

        private List<BigDecimal> holidayMonthlySplit = new ArrayList<>(List.of(
                new BigDecimal("0.28"), new BigDecimal("0.32"), new BigDecimal("0.40")));
    }

    @Data
    public static class Report {

        /** Directory the CSV reports are written to. */
        private String outputDir = "output";

        private String delimiter = ",";

        private int chunkSize = 100;
    }
}
