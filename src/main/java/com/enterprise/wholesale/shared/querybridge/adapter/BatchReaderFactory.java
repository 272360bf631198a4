package com.enterprise.wholesale.shared.querybridge.adapter;

import com.enterprise.wholesale.shared.querybridge.port.BatchQueryProvider;
import com.enterprise.wholesale.shared.querybridge.port.SqlResult;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.item.database.JdbcCursorItemReader;
import org.springframework.batch.item.database.builder.JdbcCursorItemReaderBuilder;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.util.Map;
import java.util.Objects;

/**
 * Creates {@link JdbcCursorItemReader} instances from a {@link BatchQueryProvider}.
 *
 * <p>Named parameters are rewritten to positional ones before the cursor opens.
 */
@Slf4j
public class BatchReaderFactory {

    private final DataSource dataSource;
    private int fetchSize = 1000;
    private int queryTimeout = -1;

    public BatchReaderFactory(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    public <T> JdbcCursorItemReader<T> cursorReader(
            String name,
            BatchQueryProvider provider,
            RowMapper<T> rowMapper,
            Map<String, Object> jobParams) {

        SqlResult result = resolveQuery(provider, jobParams);
        SqlResult.PositionalQuery positional = result.toPositional();
        log.debug("Reader {} query: {}", name, result.toDebugString());

        return new JdbcCursorItemReaderBuilder<T>()
                .name(name)
                .dataSource(dataSource)
                .sql(positional.sql())
                .preparedStatementSetter(new ArgumentPreparedStatementSetter(positional.values()))
                .rowMapper(rowMapper)
                .fetchSize(fetchSize)
                .queryTimeout(queryTimeout)
                .build();
    }

    /** Resolves and verifies the query without creating a reader. */
    public SqlResult resolveQuery(BatchQueryProvider provider, Map<String, Object> jobParams) {
        SqlResult result = provider.buildQuery(jobParams);
        result.verify();
        return result;
    }

    /** JDBC fetch size hint. Default {@code 1000}. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds, {@code -1} for the driver default. */
    public void setQueryTimeout(int queryTimeout) {
        this.queryTimeout = queryTimeout;
    }
}
