package com.eventwatch;

import com.eventwatch.config.RpcClientConfig;
import com.eventwatch.config.SchedulerConfig;
import com.eventwatch.domain.FilterHandle;
import com.eventwatch.domain.WatchCriteria;
import com.eventwatch.source.WatchSource;
import com.eventwatch.source.evm.EvmLogSources;
import com.eventwatch.watch.EventWatcher;
import com.eventwatch.watch.Unwatch;
import com.eventwatch.watch.WatchRequest;
import com.eventwatch.watch.registry.ObserverRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class EventWatchApplicationTest {

    @Autowired
    EventWatcher eventWatcher;

    @Autowired
    ObserverRegistry observerRegistry;

    @Autowired
    EvmLogSources evmLogSources;

    @Autowired
    @Qualifier(RpcClientConfig.EVM_RPC_RATE_LIMITER)
    RateLimiter evmRpcRateLimiter;

    @Autowired
    @Qualifier(SchedulerConfig.WATCH_SCHEDULER)
    ThreadPoolTaskScheduler watchScheduler;

    @Test
    @DisplayName("context wires the watcher, scheduler pool and EVM sources from application.yml")
    void contextWired() {
        assertThat(eventWatcher).isNotNull();
        assertThat(watchScheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(4);
        assertThat(evmRpcRateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(50);
        assertThat(evmLogSources.forNetwork("ETHEREUM").id()).isEqualTo("evm:ETHEREUM");
    }

    @Test
    @DisplayName("two identical subscriptions poll one filter on the real scheduler; the last unwatch uninstalls it")
    void sharedWatch_endToEnd() throws InterruptedException {
        CountingSource source = new CountingSource();
        CountDownLatch firstDelivered = new CountDownLatch(1);
        CountDownLatch secondDelivered = new CountDownLatch(1);
        List<List<String>> first = new CopyOnWriteArrayList<>();

        Unwatch a = eventWatcher.watch(source, WatchRequest.<String>builder(records -> {
            first.add(records);
            firstDelivered.countDown();
        }).event("0xtransfer").pollingInterval(Duration.ofMillis(50)).build());
        Unwatch b = eventWatcher.watch(source, WatchRequest.<String>builder(records -> secondDelivered.countDown())
                .event("0xtransfer").pollingInterval(Duration.ofMillis(50)).build());

        assertThat(firstDelivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(secondDelivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(source.created.get()).isEqualTo(1);
        assertThat(first.get(0)).containsExactly("log-1");

        a.unwatch();
        assertThat(source.released.getCount()).isEqualTo(1);
        b.unwatch();

        assertThat(source.released.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(observerRegistry.activeWatchCount()).isZero();
    }

    private static class CountingSource implements WatchSource<String> {

        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger polls = new AtomicInteger();
        final CountDownLatch released = new CountDownLatch(1);

        @Override
        public String id() {
            return "test:counting";
        }

        @Override
        public FilterHandle createFilter(WatchCriteria criteria) {
            return new FilterHandle("0x" + created.incrementAndGet(), criteria);
        }

        @Override
        public List<String> pollFilter(FilterHandle handle) {
            return List.of("log-" + polls.incrementAndGet());
        }

        @Override
        public List<String> fetchRange(WatchCriteria criteria, long from, long to) {
            return List.of();
        }

        @Override
        public long currentPosition() {
            return 0;
        }

        @Override
        public void releaseFilter(FilterHandle handle) {
            released.countDown();
        }
    }
}
