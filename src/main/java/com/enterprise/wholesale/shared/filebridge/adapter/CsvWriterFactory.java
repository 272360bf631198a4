package com.enterprise.wholesale.shared.filebridge.adapter;

import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.transform.DelimitedLineAggregator;
import org.springframework.batch.item.file.transform.FieldExtractor;
import org.springframework.batch.item.file.transform.RecordFieldExtractor;
import org.springframework.core.io.WritableResource;

import java.util.Map;

/**
 * Creates the CSV {@link FlatFileItemWriter}s behind the analytics reports.
 *
 * <p>Report rows are records. A column map drives both value extraction and
 * the header line: keys are record component names, values are CSV header
 * names, and insertion order is column order, so pass a
 * {@link java.util.LinkedHashMap} (see {@link ReportFiles#columns}).
 *
 * <pre>{@code
 * return factory.recordWriter("dudRateCsvWriter",
 *         reportFile(outputDir, "dud_rate_by_cohort.csv"),
 *         DudCohort.class, columns("cohort", "cohort", "dudRate", "dud_rate"));
 * }</pre>
 *
 * <p>Null components (a dud rate with no mature members, a missing lifespan)
 * are written as {@link #setNullValue(String) the null value}, an empty field
 * by default.
 */
public class CsvWriterFactory {

    private String delimiter = ",";
    private String encoding = "UTF-8";
    private String nullValue = "";

    /**
     * Creates a CSV writer for a record type.
     *
     * @param <T>        record type
     * @param name       writer name (for restart data and logging)
     * @param resource   output file, replaced on every run
     * @param recordType record class
     * @param columns    component name → CSV header name (insertion-ordered)
     * @return configured writer; the caller opens and closes it
     */
    public <T> FlatFileItemWriter<T> recordWriter(
            String name,
            WritableResource resource,
            Class<T> recordType,
            Map<String, String> columns) {

        if (recordType == null || !recordType.isRecord()) {
            throw new IllegalArgumentException("recordType must be a record class: " + recordType);
        }
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty for writer " + name);
        }

        RecordFieldExtractor<T> components = new RecordFieldExtractor<>(recordType);
        components.setNames(columns.keySet().toArray(String[]::new));

        DelimitedLineAggregator<T> aggregator = new DelimitedLineAggregator<>();
        aggregator.setDelimiter(delimiter);
        aggregator.setFieldExtractor(blankNulls(components));

        String header = String.join(delimiter, columns.values());

        FlatFileItemWriter<T> writer = new FlatFileItemWriter<>();
        writer.setName(name);
        writer.setResource(resource);
        writer.setEncoding(encoding);
        writer.setShouldDeleteIfExists(true);
        writer.setLineAggregator(aggregator);
        writer.setHeaderCallback(w -> w.write(header));
        return writer;
    }

    private <T> FieldExtractor<T> blankNulls(FieldExtractor<T> extractor) {
        String replacement = nullValue;
        return item -> {
            Object[] values = extractor.extract(item);
            for (int i = 0; i < values.length; i++) {
                if (values[i] == null) {
                    values[i] = replacement;
                }
            }
            return values;
        };
    }

    /** Field delimiter. Default {@code ","}. */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /** File encoding. Default {@code "UTF-8"}. */
    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    /** Text written for null values. Default empty. */
    public void setNullValue(String nullValue) {
        this.nullValue = nullValue;
    }
}
