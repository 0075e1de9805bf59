package com.eventwatch.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a watch matches on the remote side: contract address(es), event topic and indexed argument topics.
 * Argument order is kept as given; it becomes the topic order.
 *
 * @param addresses contract addresses; empty means all contracts
 * @param event     encoded event topic (topic0), or null for any event
 * @param args      indexed argument name → encoded topic value (String, List of alternatives, or null wildcard)
 * @param strict    drop logs that cannot match every indexed argument position
 */
public record WatchCriteria(List<String> addresses, String event, Map<String, Object> args, boolean strict) {

    public WatchCriteria {
        addresses = addresses != null ? List.copyOf(addresses) : List.of();
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }

    public boolean hasTopics() {
        return event != null || !args.isEmpty();
    }
}
