package com.eventwatch.watch.poll;

import java.time.Duration;

/**
 * Drives a tick on a fixed delay: the next tick starts {@code interval} after the previous one completed,
 * so a slow tick delays the loop instead of overlapping it. A failing tick does not end the loop.
 */
public interface PollScheduler {

    /**
     * @param tick        work for one poll
     * @param interval    delay between the end of one tick and the start of the next
     * @param emitOnStart run the first tick immediately instead of after one interval
     */
    PollHandle schedule(Runnable tick, Duration interval, boolean emitOnStart);
}
