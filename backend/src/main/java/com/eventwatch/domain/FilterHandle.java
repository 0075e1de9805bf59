package com.eventwatch.domain;

/**
 * Filter installed on the remote provider (e.g. the id returned by eth_newFilter) with the criteria it was created for.
 */
public record FilterHandle(String id, WatchCriteria criteria) {

    public FilterHandle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Filter id required");
        }
    }
}
