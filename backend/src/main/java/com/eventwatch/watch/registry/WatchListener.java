package com.eventwatch.watch.registry;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One subscriber's callbacks. onError is optional.
 */
public record WatchListener<R>(Consumer<List<R>> onRecords, Consumer<Throwable> onError) {

    public WatchListener {
        Objects.requireNonNull(onRecords, "onRecords");
    }
}
