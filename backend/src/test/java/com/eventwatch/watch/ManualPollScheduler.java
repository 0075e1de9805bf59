package com.eventwatch.watch;

import com.eventwatch.watch.poll.PollHandle;
import com.eventwatch.watch.poll.PollScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Poll scheduler whose ticks are fired by the test.
 */
class ManualPollScheduler implements PollScheduler {

    final List<Loop> loops = new ArrayList<>();

    @Override
    public PollHandle schedule(Runnable tick, Duration interval, boolean emitOnStart) {
        Loop loop = new Loop(tick, interval, emitOnStart);
        loops.add(loop);
        return loop;
    }

    /** One tick on every loop that is still running. */
    void tickAll() {
        for (Loop loop : new ArrayList<>(loops)) {
            loop.fire();
        }
    }

    static final class Loop implements PollHandle {

        final Runnable tick;
        final Duration interval;
        final boolean emitOnStart;
        int ticks;
        private boolean stopped;

        Loop(Runnable tick, Duration interval, boolean emitOnStart) {
            this.tick = tick;
            this.interval = interval;
            this.emitOnStart = emitOnStart;
        }

        void fire() {
            if (!stopped) {
                ticks++;
                tick.run();
            }
        }

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }
    }
}
