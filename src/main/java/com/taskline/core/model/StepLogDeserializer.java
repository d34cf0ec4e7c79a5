package com.taskline.core.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link StepLog} from JSON: objects become {@link StepLog.Metadata},
 * arrays become {@link StepLog.Steps}.
 */
public class StepLogDeserializer extends JsonDeserializer<StepLog> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public StepLog deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        try {
            return read(node, parser.getCodec());
        } catch (IllegalArgumentException e) {
            return (StepLog) ctxt.handleUnexpectedToken(StepLog.class, parser);
        }
    }

    /**
     * Converts an already-parsed JSON node.
     *
     * @throws IllegalArgumentException if the node is neither an object nor an array
     */
    public static StepLog read(JsonNode node, ObjectCodec codec) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> entries = codec.readValue(codec.treeAsTokens(node), MAP_TYPE);
            return new StepLog.Metadata(entries);
        }
        if (node.isArray()) {
            List<StepRecord> steps = new ArrayList<>();
            for (JsonNode element : node) {
                steps.add(codec.treeToValue(element, StepRecord.class));
            }
            return new StepLog.Steps(steps);
        }
        throw new IllegalArgumentException("Step log must be a JSON object or array, got " + node.getNodeType());
    }
}
