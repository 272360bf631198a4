package com.enterprise.wholesale.shared.filebridge;

import com.enterprise.wholesale.shared.filebridge.adapter.CsvWriterFactory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.WritableResource;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.enterprise.wholesale.shared.filebridge.adapter.ReportFiles.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CsvWriterFactory} and the report file helpers.
 */
class FileBridgeTests {

    public static class CohortBean {
        public String getCohort() { return "2024"; }
    }

    public record DudRow(String cohort, int matureCustomers, BigDecimal dudRate) {}

    @Test
    void headerFollowsColumnMapOrder(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("cohorts.csv");

        FlatFileItemWriter<DudRow> writer = new CsvWriterFactory().recordWriter("cohorts",
                new FileSystemResource(file), DudRow.class,
                columns("matureCustomers", "mature_customers", "cohort", "cohort"));

        write(writer, new DudRow("2024", 12, null), new DudRow("2025", 7, null));

        assertThat(Files.readAllLines(file))
            .containsExactly("mature_customers,cohort", "12,2024", "7,2025");
    }

    @Test
    void nullValueIsConfigurable(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("dud.csv");
        CsvWriterFactory factory = new CsvWriterFactory();
        factory.setNullValue("n/a");

        write(factory.recordWriter("dud", new FileSystemResource(file), DudRow.class,
                columns("cohort", "cohort", "dudRate", "dud_rate")),
            new DudRow("2026 H2", 0, null));

        assertThat(Files.readAllLines(file)).containsExactly("cohort,dud_rate", "2026 H2,n/a");
    }

    @Test
    void recordWriterReadsComponentsAndKeepsNullsEmpty(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("dud.csv");

        FlatFileItemWriter<DudRow> writer = new CsvWriterFactory().recordWriter("dud",
                new FileSystemResource(file), DudRow.class,
                columns("cohort", "cohort", "matureCustomers", "mature_customers", "dudRate", "dud_rate"));

        write(writer, new DudRow("2026 H1", 2, new BigDecimal("50.0")), new DudRow("2026 H2", 0, null));

        assertThat(Files.readAllLines(file))
            .containsExactly("cohort,mature_customers,dud_rate", "2026 H1,2,50.0", "2026 H2,0,");
    }

    @Test
    void customDelimiterAppliesToHeaderAndRows(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("dud.csv");
        CsvWriterFactory factory = new CsvWriterFactory();
        factory.setDelimiter(";");

        FlatFileItemWriter<DudRow> writer = factory.recordWriter("dud",
                new FileSystemResource(file), DudRow.class,
                columns("cohort", "cohort", "dudRate", "dud_rate"));

        write(writer, new DudRow("2022", 2, new BigDecimal("0.0")));

        assertThat(Files.readAllLines(file)).containsExactly("cohort;dud_rate", "2022;0.0");
    }

    @Test
    void rerunReplacesPreviousFile(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("dud.csv");
        CsvWriterFactory factory = new CsvWriterFactory();
        Map<String, String> cols = columns("cohort", "cohort");

        write(factory.recordWriter("dud", new FileSystemResource(file), DudRow.class, cols),
                new DudRow("old", 0, null));
        write(factory.recordWriter("dud", new FileSystemResource(file), DudRow.class, cols),
                new DudRow("new", 0, null));

        assertThat(Files.readAllLines(file)).containsExactly("cohort", "new");
    }

    @Test
    void recordWriterRejectsNonRecordTypes() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new CsvWriterFactory().recordWriter("x",
                    new FileSystemResource("unused.csv"), CohortBean.class, columns("cohort", "cohort")))
            .withMessageContaining("record");
    }

    @Test
    void emptyColumnsAreRejected() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> new CsvWriterFactory().recordWriter("x",
                    new FileSystemResource("unused.csv"), DudRow.class, Map.of()))
            .withMessageContaining("columns");
    }

    @Test
    void columnsNeedPairs() {
        assertThat(columns("a", "A", "b", "B")).containsExactly(entry("a", "A"), entry("b", "B"));
        assertThatIllegalArgumentException().isThrownBy(() -> columns("a", "A", "b"));
    }

    @Test
    void reportFileCreatesMissingDirectories(@TempDir Path tmp) {
        Path dir = tmp.resolve("reports/2026-10-18");

        WritableResource resource = reportFile(dir.toString(), "door_funnel.csv");

        assertThat(dir).isDirectory();
        assertThat(resource.getFilename()).isEqualTo("door_funnel.csv");
    }

    @SafeVarargs
    private static <T> void write(FlatFileItemWriter<T> writer, T... items) throws Exception {
        writer.open(new ExecutionContext());
        writer.write(new Chunk<>(List.of(items)));
        writer.close();
    }
}
