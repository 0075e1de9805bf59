package com.eventwatch.watch;

import com.eventwatch.domain.WatchCriteria;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One subscription: what to match, how to deliver and where to report failures.
 *
 * @param addresses       contract addresses; empty for all
 * @param event           encoded event topic, or null
 * @param args            indexed argument topics in declaration order
 * @param strict          drop logs not matching every indexed argument position; default false
 * @param batch           deliver each tick's records in one call (default) or one call per record
 * @param pollingInterval null to use the configured default
 * @param onRecords       required
 * @param onError         optional
 */
public record WatchRequest<R>(
        List<String> addresses,
        String event,
        Map<String, Object> args,
        boolean strict,
        boolean batch,
        Duration pollingInterval,
        Consumer<List<R>> onRecords,
        Consumer<Throwable> onError
) {

    public WatchRequest {
        Objects.requireNonNull(onRecords, "onRecords");
        if (pollingInterval != null && (pollingInterval.isZero() || pollingInterval.isNegative())) {
            throw new IllegalArgumentException("Polling interval must be positive: " + pollingInterval);
        }
    }

    public WatchCriteria criteria() {
        return new WatchCriteria(addresses, event, args, strict);
    }

    public static <R> Builder<R> builder(Consumer<List<R>> onRecords) {
        return new Builder<>(onRecords);
    }

    public static final class Builder<R> {

        private final Consumer<List<R>> onRecords;
        private List<String> addresses = List.of();
        private String event;
        private final Map<String, Object> args = new LinkedHashMap<>();
        private boolean strict;
        private boolean batch = true;
        private Duration pollingInterval;
        private Consumer<Throwable> onError;

        private Builder(Consumer<List<R>> onRecords) {
            this.onRecords = onRecords;
        }

        public Builder<R> address(String... addresses) {
            this.addresses = List.of(addresses);
            return this;
        }

        public Builder<R> event(String eventTopic) {
            this.event = eventTopic;
            return this;
        }

        /** Adds an indexed argument; call order is topic order. */
        public Builder<R> arg(String name, Object topicValue) {
            this.args.put(name, topicValue);
            return this;
        }

        public Builder<R> strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder<R> batch(boolean batch) {
            this.batch = batch;
            return this;
        }

        public Builder<R> pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder<R> onError(Consumer<Throwable> onError) {
            this.onError = onError;
            return this;
        }

        public WatchRequest<R> build() {
            return new WatchRequest<>(addresses, event, new LinkedHashMap<>(args), strict, batch, pollingInterval, onRecords, onError);
        }
    }
}
