package com.eventwatch.watch.filter;

/**
 * Remote filter state of one watch.
 */
public enum FilterPhase {

    /** No filter yet; the next tick tries to create one. */
    UNINITIALIZED,

    /** Filter installed; ticks poll it for changes. */
    ACTIVE,

    /** Provider cannot create filters; ticks use block-range queries for the rest of the watch. */
    UNAVAILABLE
}
