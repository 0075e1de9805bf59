package com.eventwatch.watch.poll;

import com.eventwatch.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PollScheduler} on the shared watch {@link TaskScheduler} pool.
 */
@Slf4j
@Component
public class TaskSchedulerPollScheduler implements PollScheduler {

    private final TaskScheduler taskScheduler;

    public TaskSchedulerPollScheduler(@Qualifier(SchedulerConfig.WATCH_SCHEDULER) TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public PollHandle schedule(Runnable tick, Duration interval, boolean emitOnStart) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Polling interval must be positive: " + interval);
        }
        Instant firstRun = emitOnStart ? Instant.now() : Instant.now().plus(interval);
        AtomicBoolean stopped = new AtomicBoolean(false);
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(() -> {
            if (stopped.get()) {
                return;
            }
            try {
                tick.run();
            } catch (RuntimeException e) {
                log.warn("Poll tick failed, next tick in {} ms: {}", interval.toMillis(), e.getMessage(), e);
            }
        }, firstRun, interval);
        return new PollHandle() {
            @Override
            public void stop() {
                if (stopped.compareAndSet(false, true)) {
                    future.cancel(false);
                }
            }

            @Override
            public boolean isStopped() {
                return stopped.get();
            }
        };
    }
}
