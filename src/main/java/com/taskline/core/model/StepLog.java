package com.taskline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent-provided transparency data attached to a task, used for both the
 * reasoning log and the execution steps.
 * <p>
 * The payload arrives in one of two shapes: a flat object of arbitrary
 * metadata, or an ordered array of typed step records. The shape is decided
 * once, where the request is parsed; the lifecycle code only copies the value.
 * On the wire each variant serializes back to its original JSON shape.
 */
@JsonDeserialize(using = StepLogDeserializer.class)
public sealed interface StepLog permits StepLog.Metadata, StepLog.Steps {

    /**
     * Flat key/value metadata.
     */
    record Metadata(Map<String, Object> entries) implements StepLog {
        public Metadata {
            entries = entries == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        @JsonValue
        public Map<String, Object> entries() {
            return entries;
        }
    }

    /**
     * Ordered sequence of typed step records.
     */
    record Steps(List<StepRecord> steps) implements StepLog {
        public Steps {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        @Override
        @JsonValue
        public List<StepRecord> steps() {
            return steps;
        }
    }

    static StepLog metadata(Map<String, Object> entries) {
        return new Metadata(entries);
    }

    static StepLog steps(List<StepRecord> steps) {
        return new Steps(steps);
    }
}
