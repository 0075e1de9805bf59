package com.eventwatch.watch;

import com.eventwatch.config.WatchProperties;
import com.eventwatch.domain.WatchCriteria;
import com.eventwatch.source.WatchSource;
import com.eventwatch.source.evm.EvmLogSources;
import com.eventwatch.watch.filter.EmissionPolicy;
import com.eventwatch.watch.filter.FilterLifecycle;
import com.eventwatch.watch.fingerprint.Fingerprint;
import com.eventwatch.watch.fingerprint.FingerprintBuilder;
import com.eventwatch.watch.poll.PollHandle;
import com.eventwatch.watch.poll.PollScheduler;
import com.eventwatch.watch.registry.ObserverRegistry;
import com.eventwatch.watch.registry.WatchListener;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * Entry point for event subscriptions. Identical subscriptions (same fingerprint) share one poll loop and one remote
 * filter; each caller still gets its own callbacks and its own unwatch handle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventWatcher {

    static final String OPERATION = "watchEvent";

    private final ObserverRegistry observerRegistry;
    private final FingerprintBuilder fingerprintBuilder;
    private final PollScheduler pollScheduler;
    private final WatchProperties watchProperties;
    private final EvmLogSources evmLogSources;

    /**
     * Watch event logs on a configured EVM network.
     */
    public Unwatch watchNetwork(String networkId, WatchRequest<JsonNode> request) {
        return watch(evmLogSources.forNetwork(networkId), request);
    }

    public <R> Unwatch watch(WatchSource<R> source, WatchRequest<R> request) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(request, "request");
        Duration interval = request.pollingInterval() != null
                ? request.pollingInterval()
                : Duration.ofMillis(watchProperties.getPollingIntervalMs());
        WatchCriteria criteria = request.criteria();
        boolean batch = request.batch();
        Fingerprint fingerprint = fingerprintBuilder.build(OPERATION, criteria, batch, source.id(), interval);
        WatchListener<R> listener = new WatchListener<>(request.onRecords(), request.onError());

        return observerRegistry.join(fingerprint, listener, emitter -> {
            FilterLifecycle<R> lifecycle = new FilterLifecycle<>(
                    source, criteria, new EmissionPolicy<>(batch, emitter), fingerprint.shortId());
            log.debug("Watch {} on {} polling every {} ms (batch={})",
                    fingerprint.shortId(), source.id(), interval.toMillis(), batch);
            PollHandle poll = pollScheduler.schedule(lifecycle::tick, interval, true);
            return () -> {
                poll.stop();
                lifecycle.close();
            };
        });
    }
}
