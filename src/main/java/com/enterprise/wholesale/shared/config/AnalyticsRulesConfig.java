package com.enterprise.wholesale.shared.config;

import com.enterprise.wholesale.churn.application.ChurnCalculator;
import com.enterprise.wholesale.churn.application.CohortRetentionAnalyzer;
import com.enterprise.wholesale.churn.application.DoorHealthReporter;
import com.enterprise.wholesale.churn.application.DudRateAnalyzer;
import com.enterprise.wholesale.customer.application.FunnelCalculator;
import com.enterprise.wholesale.customer.application.HealthClassifier;
import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.customer.domain.DoorHealthRules;
import com.enterprise.wholesale.forecast.application.DoorMathForecaster;
import com.enterprise.wholesale.forecast.application.DoorScenarioAnalyzer;
import com.enterprise.wholesale.forecast.application.PacingCalculator;
import com.enterprise.wholesale.forecast.application.SeasonalityDistributor;
import com.enterprise.wholesale.forecast.domain.Channel;
import com.enterprise.wholesale.forecast.domain.ForecastBenchmarks;
import com.enterprise.wholesale.forecast.domain.MonthlySplit;
import com.enterprise.wholesale.forecast.domain.SeasonalityCurve;
import com.enterprise.wholesale.forecast.domain.SeasonalityProfile;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Turns {@link AnalyticsProperties} into validated rule objects and the
 * engine beans built on them. A bad threshold or weight set fails startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsRulesConfig {

    @Bean
    public DoorHealthRules doorHealthRules(AnalyticsProperties properties) {
        AnalyticsProperties.Health h = properties.getHealth();
        DoorHealthRules rules = new DoorHealthRules(
            h.getAtRiskDays(),
            h.getChurningDays(),
            h.getChurnedDays(),
            h.getMajorRevenue(),
            h.getMidRevenue(),
            h.getDecliningYoyPct(),
            h.getDudMaturityDays());
        log.info("Door health rules: {}", rules);
        return rules;
    }

    @Bean
    public ForecastBenchmarks forecastBenchmarks(AnalyticsProperties properties) {
        AnalyticsProperties.Forecast f = properties.getForecast();
        return new ForecastBenchmarks(
            f.getChurnPct(),
            f.getSameStoreGrowthPct(),
            f.getNewDoorFirstYearYield(),
            f.getReturningDoorAvgYield(),
            Map.of(CustomerSegment.MAJOR, f.getMajorYield(),
                   CustomerSegment.MID, f.getMidYield(),
                   CustomerSegment.SMALL, f.getSmallYield()));
    }

    @Bean
    public SeasonalityProfile seasonalityProfile(AnalyticsProperties properties) {
        AnalyticsProperties.Forecast f = properties.getForecast();
        MonthlySplit standard = new MonthlySplit(f.getDefaultMonthlySplit());
        return new SeasonalityProfile(
            Map.of(Channel.B2B, SeasonalityCurve.of(f.getB2bCurve()),
                   Channel.CORPORATE, SeasonalityCurve.of(f.getCorporateCurve())),
            List.of(standard, standard, standard, new MonthlySplit(f.getHolidayMonthlySplit())));
    }

    // --- Engine ---

    @Bean
    public HealthClassifier healthClassifier(DoorHealthRules rules) {
        return new HealthClassifier(rules);
    }

    @Bean
    public FunnelCalculator funnelCalculator() {
        return new FunnelCalculator();
    }

    @Bean
    public DoorHealthReporter doorHealthReporter(DoorHealthRules rules, FunnelCalculator funnelCalculator) {
        return new DoorHealthReporter(
            funnelCalculator,
            new ChurnCalculator(),
            new CohortRetentionAnalyzer(rules),
            new DudRateAnalyzer(rules));
    }

    @Bean
    public SeasonalityDistributor seasonalityDistributor() {
        return new SeasonalityDistributor();
    }

    @Bean
    public DoorMathForecaster doorMathForecaster(ForecastBenchmarks benchmarks) {
        return new DoorMathForecaster(benchmarks);
    }

    @Bean
    public DoorScenarioAnalyzer doorScenarioAnalyzer(DoorMathForecaster forecaster,
                                                     ForecastBenchmarks benchmarks) {
        return new DoorScenarioAnalyzer(forecaster, benchmarks.churnPct());
    }

    @Bean
    public PacingCalculator pacingCalculator() {
        return new PacingCalculator();
    }
}
