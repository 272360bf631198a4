package com.enterprise.wholesale.shared.querybridge.adapter;

import com.enterprise.wholesale.shared.querybridge.port.BatchDmlProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.item.database.ItemSqlParameterSourceProvider;
import org.springframework.batch.item.database.JdbcBatchItemWriter;
import org.springframework.batch.item.database.builder.JdbcBatchItemWriterBuilder;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Map;
import java.util.Objects;

/**
 * Creates {@link JdbcBatchItemWriter} instances from a {@link BatchDmlProvider}.
 * Every writer asserts that each item touched a row, which a {@code MERGE}
 * upsert always does.
 *
 * <p>Typical usage:
 * <pre>{@code
 * @Bean
 * JdbcBatchItemWriter<CustomerHealthRow> customerHealthDbWriter(BatchWriterFactory factory) {
 *     return factory.templateWriter("customerHealthDbWriter",
 *             DoorHealthDmlProviders.insertCustomerHealth(),
 *             row -> new MapSqlParameterSource().addValue("customer_id", row.customerId()),
 *             Map.of());
 * }
 * }</pre>
 */
@Slf4j
public class BatchWriterFactory {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public BatchWriterFactory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /**
     * Creates a writer from a {@code :column} template. The template's own
     * parameters are not verified because values arrive per item.
     *
     * @param <T>                 item type
     * @param name                writer name (for logging)
     * @param provider            DML provider
     * @param paramSourceProvider maps each item to named parameters
     * @param jobParams           job execution parameters forwarded to the provider
     * @return configured writer
     */
    public <T> JdbcBatchItemWriter<T> templateWriter(
            String name,
            BatchDmlProvider provider,
            ItemSqlParameterSourceProvider<T> paramSourceProvider,
            Map<String, Object> jobParams) {

        SqlResult result = provider.buildDml(jobParams);
        log.debug("Writer {} statement: {}", name, result.sql());

        return new JdbcBatchItemWriterBuilder<T>()
                .namedParametersJdbcTemplate(jdbcTemplate)
                .sql(result.sql())
                .itemSqlParameterSourceProvider(paramSourceProvider)
                .assertUpdates(true)
                .build();
    }
}
