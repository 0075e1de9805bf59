package com.eventwatch.watch.registry;

import com.eventwatch.watch.Unwatch;
import com.eventwatch.watch.fingerprint.Fingerprint;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide table of shared watches keyed by fingerprint. The first listener for a fingerprint starts the watch,
 * the last one to leave tears it down. Table and listener changes are serialized on one lock; teardowns and
 * fan-out run outside it, so a slow filter release never holds up other watches.
 */
@Slf4j
@Component
public class ObserverRegistry {

    private final Object lock = new Object();
    private final Map<Fingerprint, Observation<?>> observations = new HashMap<>();

    /**
     * Register a listener for the fingerprint, starting the shared watch through {@code factory} when none exists.
     *
     * @return idempotent handle removing exactly this listener
     */
    @SuppressWarnings("unchecked")
    public <R> Unwatch join(Fingerprint fingerprint, WatchListener<R> listener, WatchFactory<R> factory) {
        Registration<R> registration;
        synchronized (lock) {
            Observation<R> observation = (Observation<R>) observations.get(fingerprint);
            boolean created = observation == null;
            if (created) {
                observation = new Observation<>(fingerprint);
                observations.put(fingerprint, observation);
            }
            registration = observation.add(listener);
            if (created) {
                try {
                    observation.teardown = factory.start(observation);
                } catch (RuntimeException e) {
                    observations.remove(fingerprint);
                    throw e;
                }
                log.info("Started watch {}", fingerprint.shortId());
            } else {
                log.debug("Joined watch {} ({} listeners)", fingerprint.shortId(), observation.listeners.size());
            }
        }
        AtomicBoolean left = new AtomicBoolean(false);
        Registration<R> joined = registration;
        return () -> {
            if (left.compareAndSet(false, true)) {
                leave(joined);
            }
        };
    }

    public int activeWatchCount() {
        synchronized (lock) {
            return observations.size();
        }
    }

    public int listenerCount(Fingerprint fingerprint) {
        synchronized (lock) {
            Observation<?> observation = observations.get(fingerprint);
            return observation != null ? observation.listeners.size() : 0;
        }
    }

    /**
     * Tear down every active watch. Listeners get no further callbacks.
     */
    @PreDestroy
    public void shutdown() {
        List<Observation<?>> stopped;
        List<Runnable> teardowns = new ArrayList<>();
        synchronized (lock) {
            stopped = new ArrayList<>(observations.values());
            observations.clear();
            for (Observation<?> observation : stopped) {
                observation.listeners.clear();
                teardowns.add(takeTeardown(observation));
            }
        }
        for (int i = 0; i < stopped.size(); i++) {
            runTeardown(stopped.get(i), teardowns.get(i));
        }
        if (!stopped.isEmpty()) {
            log.info("Observer registry shut down, {} watches stopped", stopped.size());
        }
    }

    private void leave(Registration<?> registration) {
        Observation<?> observation = registration.observation;
        Runnable teardown;
        synchronized (lock) {
            if (!observation.listeners.remove(registration)) {
                return;
            }
            if (!observation.listeners.isEmpty()) {
                return;
            }
            if (observations.get(observation.fingerprint) == observation) {
                observations.remove(observation.fingerprint);
            }
            teardown = takeTeardown(observation);
        }
        runTeardown(observation, teardown);
    }

    private static Runnable takeTeardown(Observation<?> observation) {
        Runnable teardown = observation.teardown;
        observation.teardown = null;
        return teardown;
    }

    private void runTeardown(Observation<?> observation, Runnable teardown) {
        if (teardown == null) {
            return;
        }
        try {
            teardown.run();
            log.info("Stopped watch {}", observation.fingerprint.shortId());
        } catch (RuntimeException e) {
            log.warn("Teardown of watch {} failed, removed anyway: {}", observation.fingerprint.shortId(), e.getMessage(), e);
        }
    }

    private static final class Registration<R> {

        private final Observation<R> observation;
        private final WatchListener<R> listener;

        private Registration(Observation<R> observation, WatchListener<R> listener) {
            this.observation = observation;
            this.listener = listener;
        }
    }

    private static final class Observation<R> implements WatchEmitter<R> {

        private final Fingerprint fingerprint;
        private final List<Registration<R>> listeners = new CopyOnWriteArrayList<>();
        private Runnable teardown;

        private Observation(Fingerprint fingerprint) {
            this.fingerprint = fingerprint;
        }

        private Registration<R> add(WatchListener<R> listener) {
            Registration<R> registration = new Registration<>(this, listener);
            listeners.add(registration);
            return registration;
        }

        @Override
        public void emitRecords(List<R> records) {
            for (Registration<R> registration : listeners) {
                try {
                    registration.listener.onRecords().accept(records);
                } catch (RuntimeException e) {
                    log.warn("Listener of watch {} failed on {} records: {}",
                            fingerprint.shortId(), records.size(), e.getMessage(), e);
                }
            }
        }

        @Override
        public void emitError(Throwable error) {
            for (Registration<R> registration : listeners) {
                if (registration.listener.onError() == null) {
                    continue;
                }
                try {
                    registration.listener.onError().accept(error);
                } catch (RuntimeException e) {
                    log.warn("Error listener of watch {} failed: {}", fingerprint.shortId(), e.getMessage(), e);
                }
            }
        }
    }
}
