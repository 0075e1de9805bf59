package com.eventwatch.watch.filter;

import com.eventwatch.domain.FilterHandle;
import com.eventwatch.domain.WatchCriteria;
import com.eventwatch.source.RpcErrorKind;
import com.eventwatch.source.RpcException;
import com.eventwatch.source.WatchSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Per-watch tick logic. Prefers a remote filter; falls back to block-range queries for good when the provider
 * cannot create one; recreates the filter once after the provider reports it invalid.
 * <p>
 * Ticks of one watch never overlap. {@link #close()} may run concurrently with a tick.
 */
@Slf4j
public class FilterLifecycle<R> {

    private final WatchSource<R> source;
    private final WatchCriteria criteria;
    private final EmissionPolicy<R> emission;
    private final String watchId;

    private final Object stateLock = new Object();
    private FilterPhase phase = FilterPhase.UNINITIALIZED;
    private FilterHandle handle;
    private boolean closed;
    private volatile Long lastPosition;

    public FilterLifecycle(WatchSource<R> source, WatchCriteria criteria, EmissionPolicy<R> emission, String watchId) {
        this.source = source;
        this.criteria = criteria;
        this.emission = emission;
        this.watchId = watchId;
    }

    public void tick() {
        FilterPhase current;
        FilterHandle currentHandle;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            current = phase;
            currentHandle = handle;
        }
        switch (current) {
            case UNINITIALIZED -> {
                if (!installFilter()) {
                    pollRange();
                }
            }
            case ACTIVE -> pollFilter(currentHandle);
            case UNAVAILABLE -> pollRange();
        }
    }

    /**
     * Stop using the remote filter and uninstall it. Release failures are logged and ignored.
     */
    public void close() {
        FilterHandle toRelease;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            toRelease = handle;
            handle = null;
        }
        if (toRelease != null) {
            releaseQuietly(toRelease);
        }
    }

    FilterPhase getPhase() {
        synchronized (stateLock) {
            return phase;
        }
    }

    Long getLastPosition() {
        return lastPosition;
    }

    /**
     * @return true when a filter was installed (the tick ends there), false when the watch fell back to range queries
     */
    private boolean installFilter() {
        FilterHandle created;
        try {
            created = source.createFilter(criteria);
        } catch (RuntimeException e) {
            synchronized (stateLock) {
                phase = FilterPhase.UNAVAILABLE;
                handle = null;
            }
            log.debug("Watch {} on {}: filter not available ({}), using range queries: {}",
                    watchId, source.id(), RpcException.kindOf(e), e.getMessage());
            return false;
        }
        boolean orphaned;
        synchronized (stateLock) {
            orphaned = closed;
            if (!orphaned) {
                handle = created;
                phase = FilterPhase.ACTIVE;
            }
        }
        if (orphaned) {
            releaseQuietly(created);
        } else {
            log.info("Watch {} on {}: installed filter {}", watchId, source.id(), created.id());
        }
        return true;
    }

    private void pollFilter(FilterHandle current) {
        List<R> records;
        try {
            records = source.pollFilter(current);
        } catch (RuntimeException e) {
            RpcErrorKind kind = RpcException.kindOf(e);
            switch (kind) {
                case INVALID_FILTER -> {
                    synchronized (stateLock) {
                        if (handle == current) {
                            handle = null;
                            phase = FilterPhase.UNINITIALIZED;
                        }
                    }
                    log.info("Watch {} on {}: filter {} is no longer valid, recreating on next tick",
                            watchId, source.id(), current.id());
                }
                case UNSUPPORTED, OTHER -> log.warn("Watch {} on {}: polling filter {} failed ({}): {}",
                        watchId, source.id(), current.id(), kind, e.getMessage());
            }
            emission.error(e);
            return;
        }
        emission.emit(records);
    }

    private void pollRange() {
        List<R> records;
        long current;
        try {
            current = source.currentPosition();
            Long previous = lastPosition;
            // A marker that moved backwards (lagging endpoint) yields no range; the marker still follows it.
            if (previous != null && current > previous) {
                records = source.fetchRange(criteria, previous + 1, current);
            } else {
                records = List.of();
            }
        } catch (RuntimeException e) {
            log.warn("Watch {} on {}: range poll failed ({}): {}",
                    watchId, source.id(), RpcException.kindOf(e), e.getMessage());
            emission.error(e);
            return;
        }
        lastPosition = current;
        emission.emit(records);
    }

    private void releaseQuietly(FilterHandle toRelease) {
        try {
            source.releaseFilter(toRelease);
            log.info("Watch {} on {}: uninstalled filter {}", watchId, source.id(), toRelease.id());
        } catch (RuntimeException e) {
            log.warn("Watch {} on {}: uninstalling filter {} failed, ignored: {}",
                    watchId, source.id(), toRelease.id(), e.getMessage());
        }
    }
}
