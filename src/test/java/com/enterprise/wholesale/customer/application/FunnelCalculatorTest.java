package com.enterprise.wholesale.customer.application;

import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;
import com.enterprise.wholesale.customer.domain.Funnel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.enterprise.wholesale.customer.CustomerFixtures.*;
import static org.assertj.core.api.Assertions.*;

class FunnelCalculatorTest {

    private final HealthClassifier classifier = new HealthClassifier(DoorHealthRules.defaults());
    private final FunnelCalculator calculator = new FunnelCalculator();

    @Test
    void countsEveryDoorWithOrderHistoryExactlyOnce() {
        List<ClassifiedCustomer> classified = classifier.classifyAll(List.of(
            door(10), door(100), declining(50, "-30"),
            door(200), door(300), door(301),
            door(365), door(1000),
            previouslyChurned(20),
            corporate(10), corporate(500), neverOrdered()), AS_OF);

        Funnel funnel = calculator.computeFunnel(classified);

        assertThat(funnel.active()).isEqualTo(4);
        assertThat(funnel.healthyDeclining()).isEqualTo(1);
        assertThat(funnel.atRisk()).isEqualTo(1);
        assertThat(funnel.churning()).isEqualTo(2);
        assertThat(funnel.churned()).isEqualTo(2);
        assertThat(funnel.reactivated()).isEqualTo(1);
        assertThat(funnel.total()).isEqualTo(9);
        assertThat(funnel.activeDoors()).isEqualTo(7);
        assertThat(funnel.total())
            .isEqualTo((int) classified.stream().filter(ClassifiedCustomer::hasOrderHistory).count());
    }

    @Test
    void emptyPopulationGivesEmptyFunnel() {
        assertThat(calculator.computeFunnel(List.of())).isEqualTo(new Funnel(0, 0, 0, 0, 0, 0));
    }
}
