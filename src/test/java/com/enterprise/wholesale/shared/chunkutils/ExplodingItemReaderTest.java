package com.enterprise.wholesale.shared.chunkutils;

import com.enterprise.wholesale.shared.chunkutils.adapter.ExplodingItemReader;

import org.junit.jupiter.api.Test;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.ItemStreamReader;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class ExplodingItemReaderTest {

    @Test
    void explodesEachForecastIntoItsMonthsAndSkipsEmptyOnes() throws Exception {
        ItemReader<Long> forecasts = sequenceReader(1L, 2L, 3L);

        ExplodingItemReader<Long, String> reader = new ExplodingItemReader<>(forecasts,
            id -> id == 2L
                ? List.of()
                : IntStream.rangeClosed(1, 12).mapToObj(m -> id + "-" + m).toList());

        List<String> read = drain(reader);

        assertThat(read).hasSize(24);
        assertThat(read.get(0)).isEqualTo("1-1");
        assertThat(read.get(11)).isEqualTo("1-12");
        assertThat(read.get(12)).isEqualTo("3-1");
        assertThat(reader.getSourceCount()).isEqualTo(3);
        assertThat(reader.getExplodedCount()).isEqualTo(24);
    }

    @Test
    void nullExplosionIsTreatedAsEmpty() throws Exception {
        ExplodingItemReader<String, String> reader = new ExplodingItemReader<>(
            sequenceReader("skip", "keep"),
            item -> item.equals("skip") ? null : List.of(item));

        assertThat(reader.read()).isEqualTo("keep");
        assertThat(reader.read()).isNull();
    }

    @Test
    void delegatesLifecycleAndDropsBufferedItemsOnReopen() throws Exception {
        List<String> events = new ArrayList<>();
        ItemReader<String> source = sequenceReader("A", "B");
        ItemStreamReader<String> delegate = new ItemStreamReader<>() {
            @Override public String read() throws Exception { return source.read(); }
            @Override public void open(ExecutionContext ec) { events.add("open"); }
            @Override public void update(ExecutionContext ec) { events.add("update"); }
            @Override public void close() { events.add("close"); }
        };

        ExplodingItemReader<String, String> reader =
            new ExplodingItemReader<>(delegate, item -> List.of(item + "1", item + "2"));

        reader.open(new ExecutionContext());
        assertThat(reader.read()).isEqualTo("A1");
        reader.update(new ExecutionContext());
        reader.close();
        reader.open(new ExecutionContext());

        assertThat(reader.getExplodedCount()).isZero();
        assertThat(reader.read()).isEqualTo("B1");
        assertThat(reader.getSourceCount()).isEqualTo(1);
        assertThat(events).containsExactly("open", "update", "close", "open");
    }

    @Test
    void skipsLifecycleForNonStreamDelegate() {
        ExplodingItemReader<String, String> reader = new ExplodingItemReader<>(() -> null, List::of);

        assertThatNoException().isThrownBy(() -> {
            reader.open(new ExecutionContext());
            reader.update(new ExecutionContext());
            reader.close();
        });
    }

    private static <T> List<T> drain(ItemReader<T> reader) throws Exception {
        List<T> items = new ArrayList<>();
        for (T item = reader.read(); item != null; item = reader.read()) {
            items.add(item);
        }
        return items;
    }

    @SafeVarargs
    private static <T> ItemReader<T> sequenceReader(T... items) {
        int[] idx = {0};
        return () -> idx[0] < items.length ? items[idx[0]++] : null;
    }
}
