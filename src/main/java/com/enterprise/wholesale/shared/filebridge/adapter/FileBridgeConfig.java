package com.enterprise.wholesale.shared.filebridge.adapter;

import com.enterprise.wholesale.shared.config.AnalyticsProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CSV writer factory configured from {@code analytics.report.*}.
 */
@Configuration
public class FileBridgeConfig {

    @Bean
    public CsvWriterFactory csvWriterFactory(AnalyticsProperties properties) {
        CsvWriterFactory factory = new CsvWriterFactory();
        factory.setDelimiter(properties.getReport().getDelimiter());
        return factory;
    }
}
