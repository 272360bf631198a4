package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.forecast.domain.MonthlySplit;
import com.enterprise.wholesale.forecast.domain.SeasonalDistribution;
import com.enterprise.wholesale.forecast.domain.SeasonalityCurve;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SeasonalityDistributorTest {

    private final SeasonalityDistributor distributor = new SeasonalityDistributor();

    @Test
    void spreadsB2bTargetOverQuartersAndMonths() {
        SeasonalDistribution d = distributor.distribute(new BigDecimal("2000000"), SeasonalityCurve.B2B);

        assertThat(d.quarterly()).extracting(BigDecimal::toPlainString)
            .containsExactly("400000.00", "420000.00", "440000.00", "740000.00");
        assertThat(d.month(1)).isEqualByComparingTo("120000");
        assertThat(d.month(2)).isEqualByComparingTo("132000");
        assertThat(d.month(3)).isEqualByComparingTo("148000");
        assertThat(d.month(10)).isEqualByComparingTo("207200");
        assertThat(d.month(12)).isEqualByComparingTo("296000");
    }

    @Test
    void awkwardAmountsStillReconcileToTheCent() {
        BigDecimal annual = new BigDecimal("333333.33");

        SeasonalDistribution d = distributor.distribute(annual, SeasonalityCurve.CORPORATE);

        assertThat(d.quarterly().stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo(annual);
        assertThat(d.monthly().stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo(annual);
        for (int q = 1; q <= 4; q++) {
            BigDecimal months = d.month(q * 3 - 2).add(d.month(q * 3 - 1)).add(d.month(q * 3));
            assertThat(months).as("Q%d", q).isEqualByComparingTo(d.quarter(q));
        }
        assertThat(d.monthly()).allSatisfy(m -> assertThat(m.scale()).isEqualTo(2));
    }

    @Test
    void zeroTrailingWeightNeverGoesNegative() {
        SeasonalityCurve frontLoaded = SeasonalityCurve.of(List.of(
                new BigDecimal("0.5"), new BigDecimal("0.5"), BigDecimal.ZERO, BigDecimal.ZERO));

        SeasonalDistribution d = distributor.distribute(new BigDecimal("0.01"), frontLoaded);

        assertThat(d.quarterly()).extracting(BigDecimal::toPlainString)
            .containsExactly("0.01", "0.00", "0.00", "0.00");
        assertThat(d.monthly()).allSatisfy(m -> assertThat(m.signum()).isNotNegative());
        assertThat(d.month(3)).isEqualByComparingTo("0.01");
        assertThat(d.monthly().stream().reduce(BigDecimal.ZERO, BigDecimal::add)).isEqualByComparingTo("0.01");
    }

    @Test
    void leftoverCentsGoToTheLargestRoundingLoss() {
        List<BigDecimal> parts = SeasonalityDistributor.allocate(new BigDecimal("1.00"),
                List.of(new BigDecimal("0.3333"), new BigDecimal("0.3333"), new BigDecimal("0.3334")));

        assertThat(parts).extracting(BigDecimal::toPlainString).containsExactly("0.33", "0.33", "0.34");
    }

    @Test
    void zeroAnnualGivesZeroSlots() {
        SeasonalDistribution d = distributor.distribute(BigDecimal.ZERO, SeasonalityCurve.B2B);

        assertThat(d.monthly()).hasSize(12).allSatisfy(m -> assertThat(m).isEqualByComparingTo("0"));
    }

    @Test
    void customMonthlySplitsAreApplied() {
        MonthlySplit lastHeavy = new MonthlySplit(List.of(
                new BigDecimal("0.25"), new BigDecimal("0.25"), new BigDecimal("0.50")));

        SeasonalDistribution d = distributor.distribute(new BigDecimal("1200"), SeasonalityCurve.B2B,
                List.of(lastHeavy, lastHeavy, lastHeavy, lastHeavy));

        assertThat(d.month(1)).isEqualByComparingTo("60.00");
        assertThat(d.month(3)).isEqualByComparingTo("120.00");
    }

    @Test
    void rejectsNegativeAmountAndMissingSplits() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> distributor.distribute(new BigDecimal("-1"), SeasonalityCurve.B2B));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> distributor.distribute(BigDecimal.TEN, SeasonalityCurve.B2B,
                    List.of(MonthlySplit.DEFAULT)));
    }
}
