package com.eventwatch.watch.filter;

import com.eventwatch.watch.registry.WatchEmitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Delivers one tick's records: all in one call when batching, otherwise one call per record in order.
 * Nothing is delivered for an empty tick.
 */
public class EmissionPolicy<R> {

    private final boolean batch;
    private final WatchEmitter<R> emitter;

    public EmissionPolicy(boolean batch, WatchEmitter<R> emitter) {
        this.batch = batch;
        this.emitter = emitter;
    }

    public void emit(List<R> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        if (batch) {
            emitter.emitRecords(Collections.unmodifiableList(new ArrayList<>(records)));
            return;
        }
        for (R record : records) {
            emitter.emitRecords(Collections.singletonList(record));
        }
    }

    public void error(Throwable error) {
        emitter.emitError(error);
    }
}
