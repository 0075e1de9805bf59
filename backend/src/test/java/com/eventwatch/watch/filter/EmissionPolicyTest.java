package com.eventwatch.watch.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmissionPolicyTest {

    @Test
    @DisplayName("batching delivers all records of a tick in one call, in source order")
    void batch_oneCall() {
        RecordingEmitter<String> emitter = new RecordingEmitter<>();
        new EmissionPolicy<>(true, emitter).emit(List.of("a", "b", "c"));

        assertThat(emitter.batches).containsExactly(List.of("a", "b", "c"));
    }

    @Test
    @DisplayName("without batching N records become N single-record calls in order")
    void noBatch_oneCallPerRecord() {
        RecordingEmitter<String> emitter = new RecordingEmitter<>();
        new EmissionPolicy<>(false, emitter).emit(List.of("a", "b", "c"));

        assertThat(emitter.batches).containsExactly(List.of("a"), List.of("b"), List.of("c"));
    }

    @Test
    @DisplayName("empty or null tick result delivers nothing")
    void empty_noDelivery() {
        RecordingEmitter<String> emitter = new RecordingEmitter<>();
        EmissionPolicy<String> policy = new EmissionPolicy<>(true, emitter);
        policy.emit(List.of());
        policy.emit(null);

        assertThat(emitter.batches).isEmpty();
    }

    @Test
    void error_forwardedOnce() {
        RecordingEmitter<String> emitter = new RecordingEmitter<>();
        IllegalStateException error = new IllegalStateException("boom");
        new EmissionPolicy<>(false, emitter).error(error);

        assertThat(emitter.errors).containsExactly(error);
    }
}
