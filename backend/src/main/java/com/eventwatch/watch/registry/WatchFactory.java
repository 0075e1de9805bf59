package com.eventwatch.watch.registry;

/**
 * Starts the shared watch for a new fingerprint and returns its teardown.
 */
@FunctionalInterface
public interface WatchFactory<R> {

    Runnable start(WatchEmitter<R> emitter);
}
