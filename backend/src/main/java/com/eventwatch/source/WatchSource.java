package com.eventwatch.source;

import com.eventwatch.domain.FilterHandle;
import com.eventwatch.domain.WatchCriteria;

import java.util.List;

/**
 * Remote data source a watch polls. Every call may fail with {@link RpcException}.
 *
 * @param <R> record type, passed to consumers unchanged
 */
public interface WatchSource<R> {

    /**
     * Stable identity of this source (client); part of the watch fingerprint.
     */
    String id();

    /**
     * Install a stateful filter for the criteria.
     *
     * @throws RpcException with {@link RpcErrorKind#UNSUPPORTED} when the provider has no filters
     */
    FilterHandle createFilter(WatchCriteria criteria);

    /**
     * Records matched since the previous poll of this filter.
     *
     * @throws RpcException with {@link RpcErrorKind#INVALID_FILTER} when the handle is no longer known remotely
     */
    List<R> pollFilter(FilterHandle handle);

    /**
     * Records matching the criteria in the inclusive position range.
     */
    List<R> fetchRange(WatchCriteria criteria, long fromPosition, long toPosition);

    /**
     * Current position marker of the source (e.g. latest block number).
     */
    long currentPosition();

    /**
     * Uninstall the filter. Callers treat failure as best-effort.
     */
    void releaseFilter(FilterHandle handle);
}
