package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.CustomerFlag;
import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.customer.domain.CustomerSnapshot;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;
import com.enterprise.wholesale.customer.domain.HealthStatus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;

import static com.enterprise.wholesale.customer.CustomerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class HealthClassifierTest {

    private final HealthClassifier classifier = new HealthClassifier(DoorHealthRules.defaults());

    @ParameterizedTest
    @CsvSource({
        "0,   HEALTHY",
        "179, HEALTHY",
        "180, AT_RISK",
        "269, AT_RISK",
        "270, CHURNING",
        "364, CHURNING",
        "365, CHURNED",
        "900, CHURNED"
    })
    void bucketsByDaysSinceLastOrder(int days, HealthStatus expected) {
        ClassifiedCustomer c = classifier.classify(door(days), AS_OF);

        assertThat(c.daysSinceLastOrder()).isEqualTo(days);
        assertThat(c.healthStatus()).isEqualTo(expected);
    }

    @Test
    void noLastSaleDateHasNoHistory() {
        ClassifiedCustomer c = classifier.classify(neverOrdered(), AS_OF);

        assertThat(c.healthStatus()).isEqualTo(HealthStatus.NO_HISTORY);
        assertThat(c.daysSinceLastOrder()).isNull();
        assertThat(c.lifespanMonths()).isNull();
        assertThat(c.churnYear()).isNull();
        assertThat(c.hasOrderHistory()).isFalse();
    }

    @Test
    void corporateAndZeroRevenueAccountsAreExcluded() {
        CustomerSnapshot zeroRevenue = new CustomerSnapshot(99L, "Refunded",
                AS_OF.minusDays(400), AS_OF.minusDays(400), BigDecimal.ZERO, 2, false, false, null);

        ClassifiedCustomer corp = classifier.classify(corporate(500), AS_OF);
        ClassifiedCustomer refunded = classifier.classify(zeroRevenue, AS_OF);

        assertThat(corp.healthStatus()).isEqualTo(HealthStatus.EXCLUDED);
        assertThat(corp.door()).isFalse();
        assertThat(refunded.healthStatus()).isEqualTo(HealthStatus.EXCLUDED);
        assertThat(refunded.isChurned()).isFalse();
    }

    @Test
    void decliningOnlyChangesStatusInsideHealthyBucket() {
        ClassifiedCustomer healthy = classifier.classify(declining(30, "-25"), AS_OF);
        ClassifiedCustomer atRisk = classifier.classify(declining(200, "-25"), AS_OF);
        ClassifiedCustomer atThreshold = classifier.classify(declining(30, "-20"), AS_OF);

        assertThat(healthy.healthStatus()).isEqualTo(HealthStatus.HEALTHY_DECLINING);
        assertThat(healthy.hasFlag(CustomerFlag.DECLINING)).isTrue();
        assertThat(atRisk.healthStatus()).isEqualTo(HealthStatus.AT_RISK);
        assertThat(atRisk.hasFlag(CustomerFlag.DECLINING)).isTrue();
        assertThat(atThreshold.healthStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void reactivatedWhenPreviouslyChurnedAndNowBuying() {
        assertThat(classifier.classify(previouslyChurned(40), AS_OF).hasFlag(CustomerFlag.REACTIVATED)).isTrue();
        assertThat(classifier.classify(previouslyChurned(200), AS_OF).hasFlag(CustomerFlag.REACTIVATED)).isTrue();
        assertThat(classifier.classify(previouslyChurned(400), AS_OF).hasFlag(CustomerFlag.REACTIVATED)).isFalse();
    }

    @Test
    void lifespanIsCalendarMonthDifference() {
        CustomerSnapshot s = door(LocalDate.of(2022, 11, 30), LocalDate.of(2024, 2, 1), 4, "3000");

        assertThat(classifier.classify(s, AS_OF).lifespanMonths()).isEqualTo(15);
    }

    @Test
    void lifespanFlooredAtZeroWhenDatesAreInverted() {
        CustomerSnapshot s = door(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 3, 1), 2, "3000");

        assertThat(classifier.classify(s, AS_OF).lifespanMonths()).isZero();
    }

    @Test
    void churnYearIsYearOfLastSalePlusChurnThreshold() {
        CustomerSnapshot earlyYear = door(LocalDate.of(2023, 1, 1), LocalDate.of(2024, 2, 1), 4, "3000");
        CustomerSnapshot lateYear = door(LocalDate.of(2023, 1, 1), LocalDate.of(2024, 12, 31), 4, "3000");

        assertThat(classifier.classify(earlyYear, AS_OF).churnYear()).isEqualTo(2025);
        assertThat(classifier.classify(lateYear, AS_OF).churnYear()).isEqualTo(2025);
    }

    @Test
    void assignsSegmentFromLifetimeRevenue() {
        assertThat(classifier.classify(door(10, "25000"), AS_OF).segment()).isEqualTo(CustomerSegment.MAJOR);
        assertThat(classifier.classify(door(10, "6000"), AS_OF).segment()).isEqualTo(CustomerSegment.MID);
        assertThat(classifier.classify(door(10, "100"), AS_OF).segment()).isEqualTo(CustomerSegment.SMALL);
    }

    @Test
    void classificationIsIdempotent() {
        CustomerSnapshot s = declining(75, "-40");

        assertThat(classifier.classify(s, AS_OF)).isEqualTo(classifier.classify(s, AS_OF));
    }

    @Test
    void rulesRejectUnorderedThresholds() {
        assertThatIllegalArgumentException().isThrownBy(() -> new DoorHealthRules(
                270, 180, 365, new BigDecimal("20000"), new BigDecimal("5000"), new BigDecimal("-20"), 133))
            .withMessageContaining("atRisk < churning < churned");
        assertThatIllegalArgumentException().isThrownBy(() -> new DoorHealthRules(
                180, 270, 365, new BigDecimal("5000"), new BigDecimal("5000"), new BigDecimal("-20"), 133))
            .withMessageContaining("major > mid > 0");
    }
}
