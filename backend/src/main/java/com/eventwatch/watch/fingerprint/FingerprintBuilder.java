package com.eventwatch.watch.fingerprint;

import com.eventwatch.domain.WatchCriteria;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;

/**
 * Builds watch fingerprints from operation name, address, args, batch flag, source id, event and polling interval.
 * Callbacks and strictness are not part of it. Args are serialized in their own iteration order, so maps with
 * the same entries in a different order yield different fingerprints.
 */
@Component
public class FingerprintBuilder {

    private final ObjectWriter writer;

    public FingerprintBuilder(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer()
                .without(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .without(SerializationFeature.INDENT_OUTPUT);
    }

    public Fingerprint build(String operation, WatchCriteria criteria, boolean batch, String sourceId, Duration pollingInterval) {
        Object address = criteria.addresses().isEmpty() ? null : criteria.addresses();
        Object args = criteria.args().isEmpty() ? null : criteria.args();
        try {
            return new Fingerprint(writer.writeValueAsString(Arrays.asList(
                    operation,
                    address,
                    args,
                    batch,
                    sourceId,
                    criteria.event(),
                    pollingInterval.toMillis())));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Watch parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
