package com.eventwatch.watch.poll;

/**
 * Running poll loop. {@link #stop()} lets an in-flight tick finish but schedules no further one.
 */
public interface PollHandle {

    void stop();

    boolean isStopped();
}
