package com.eventwatch.watch.registry;

import java.util.List;

/**
 * Fan-out to every listener currently registered for one fingerprint, in registration order.
 */
public interface WatchEmitter<R> {

    void emitRecords(List<R> records);

    void emitError(Throwable error);
}
