package com.eventwatch.watch;

/**
 * Stops one subscription. Calling it more than once has no further effect.
 */
@FunctionalInterface
public interface Unwatch {

    void unwatch();
}
