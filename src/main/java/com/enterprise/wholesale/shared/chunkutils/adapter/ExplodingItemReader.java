package com.enterprise.wholesale.shared.chunkutils.adapter;

import com.enterprise.wholesale.shared.chunkutils.port.ItemExploder;

import lombok.extern.slf4j.Slf4j;

import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemReader;
import org.springframework.batch.item.ItemStream;
import org.springframework.batch.item.ItemStreamReader;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.Queue;

/**
 * Reader decorator for 1:N steps: one forecast row becomes twenty-four
 * monthly targets or five scenarios. A source item that explodes into
 * nothing is skipped.
 *
 * <p>Pending output is not saved in the execution context, so a restart
 * resumes at the next source item and re-derives its rows. That is safe
 * because every writer downstream upserts.
 *
 * @param <I> source item type
 * @param <O> exploded item type
 */
@Slf4j
public class ExplodingItemReader<I, O> implements ItemStreamReader<O> {

    private final ItemReader<I> source;
    private final ItemExploder<I, O> exploder;
    private final Queue<O> pending = new ArrayDeque<>();

    private long sourceCount;
    private long explodedCount;

    public ExplodingItemReader(ItemReader<I> source, ItemExploder<I, O> exploder) {
        this.source = Objects.requireNonNull(source, "source");
        this.exploder = Objects.requireNonNull(exploder, "exploder");
    }

    @Override
    public O read() throws Exception {
        O next = pending.poll();
        while (next == null) {
            I item = source.read();
            if (item == null) {
                return null;
            }
            sourceCount++;
            Collection<O> rows = exploder.explode(item);
            if (rows != null && !rows.isEmpty()) {
                explodedCount += rows.size();
                pending.addAll(rows);
            }
            next = pending.poll();
        }
        return next;
    }

    /** Source items consumed since the last {@link #open}. */
    public long getSourceCount() {
        return sourceCount;
    }

    /** Rows produced since the last {@link #open}. */
    public long getExplodedCount() {
        return explodedCount;
    }

    @Override
    public void open(ExecutionContext executionContext) {
        pending.clear();
        sourceCount = 0;
        explodedCount = 0;
        if (source instanceof ItemStream stream) {
            stream.open(executionContext);
        }
    }

    @Override
    public void update(ExecutionContext executionContext) {
        if (source instanceof ItemStream stream) {
            stream.update(executionContext);
        }
    }

    @Override
    public void close() {
        if (sourceCount > 0) {
            log.info("Exploded {} source items into {} rows", sourceCount, explodedCount);
        }
        pending.clear();
        if (source instanceof ItemStream stream) {
            stream.close();
        }
    }
}
