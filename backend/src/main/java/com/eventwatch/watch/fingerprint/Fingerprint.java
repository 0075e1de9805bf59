package com.eventwatch.watch.fingerprint;

/**
 * Identity of a shared watch: the literal JSON serialization of its fingerprint-relevant parameters.
 */
public record Fingerprint(String value) {

    public Fingerprint {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Fingerprint value required");
        }
    }

    /** Short form for log lines. */
    public String shortId() {
        return Integer.toHexString(value.hashCode());
    }
}
