package com.enterprise.wholesale.shared.querybridge.adapter;

import com.enterprise.wholesale.shared.config.AnalyticsProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * JDBC reader and writer factories for the analytics jobs, plus the provider
 * registries each job configuration fills with its statements.
 */
@Configuration
public class SpringBatchQueryConfig {

    @Bean
    public BatchReaderFactory batchReaderFactory(DataSource dataSource, AnalyticsProperties properties) {
        BatchReaderFactory factory = new BatchReaderFactory(dataSource);
        // one round trip per chunk
        factory.setFetchSize(properties.getReport().getChunkSize());
        return factory;
    }

    @Bean
    public BatchWriterFactory batchWriterFactory(NamedParameterJdbcTemplate jdbcTemplate) {
        return new BatchWriterFactory(jdbcTemplate);
    }

    @Bean
    public QueryProviderRegistry queryProviderRegistry() {
        return new QueryProviderRegistry();
    }

    @Bean
    public DmlProviderRegistry dmlProviderRegistry() {
        return new DmlProviderRegistry();
    }
}
