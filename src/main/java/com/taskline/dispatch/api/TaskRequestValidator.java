package com.taskline.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskline.core.error.ValidationException;
import com.taskline.core.model.NewTask;
import com.taskline.core.model.StepLog;
import com.taskline.core.model.StepLogDeserializer;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskPatch;
import com.taskline.core.model.TaskPriority;
import com.taskline.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns raw request JSON into typed task inputs, collecting every problem
 * into a single {@link ValidationException}.
 * <p>
 * Checks here are about shape and range only. Lifecycle rules (legal status
 * edges, forced review) belong to the state machine.
 */
@Component
public class TaskRequestValidator {

    static final int MAX_TITLE_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 10_000;

    private final ObjectMapper objectMapper;

    public TaskRequestValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NewTask parseCreate(JsonNode body) {
        requireObject(body);
        List<String> issues = new ArrayList<>();

        String title = text(body, "title", issues);
        if (title == null) {
            if (!issues.contains("title must be a string")) {
                issues.add("title is required");
            }
        } else {
            title = checkTitle(title, issues);
        }

        NewTask task = new NewTask(
                title,
                description(body, issues),
                enumValue(body, "priority", TaskPriority.class, issues),
                text(body, "agentId", issues),
                confidence(body, issues),
                stepLog(body, "reasoningLog", issues),
                stepLog(body, "executionSteps", issues),
                bool(body, "requiresReview", issues));
        throwIfAny(issues);
        return task;
    }

    public TaskPatch parsePatch(JsonNode body) {
        requireObject(body);
        List<String> issues = new ArrayList<>();

        String title = text(body, "title", issues);
        TaskPatch patch = TaskPatch.builder()
                .title(title != null ? checkTitle(title, issues) : null)
                .description(description(body, issues))
                .status(enumValue(body, "status", TaskStatus.class, issues))
                .priority(enumValue(body, "priority", TaskPriority.class, issues))
                .agentId(text(body, "agentId", issues))
                .confidenceScore(confidence(body, issues))
                .reasoningLog(stepLog(body, "reasoningLog", issues))
                .executionSteps(stepLog(body, "executionSteps", issues))
                .requiresReview(bool(body, "requiresReview", issues))
                .reviewNotes(text(body, "reviewNotes", issues))
                .wasOverridden(bool(body, "wasOverridden", issues))
                .errorMessage(text(body, "errorMessage", issues))
                .errorCode(text(body, "errorCode", issues))
                .markAsReviewed(Boolean.TRUE.equals(bool(body, "markAsReviewed", issues)))
                .retry(Boolean.TRUE.equals(bool(body, "retry", issues)))
                .build();
        throwIfAny(issues);
        return patch;
    }

    /**
     * Builds a listing filter from query parameters; blank parameters are ignored.
     */
    public TaskFilter parseFilter(String status, String priority, String agentId, String requiresReview) {
        List<String> issues = new ArrayList<>();
        TaskStatus statusValue = enumText("status", status, TaskStatus.class, issues);
        TaskPriority priorityValue = enumText("priority", priority, TaskPriority.class, issues);
        Boolean review = null;
        if (requiresReview != null && !requiresReview.isBlank()) {
            if ("true".equalsIgnoreCase(requiresReview) || "false".equalsIgnoreCase(requiresReview)) {
                review = Boolean.valueOf(requiresReview);
            } else {
                issues.add("requiresReview must be true or false");
            }
        }
        throwIfAny(issues);
        String agent = agentId != null && !agentId.isBlank() ? agentId : null;
        return new TaskFilter(statusValue, priorityValue, agent, review);
    }

    // --- Field readers: a missing or null field yields null ---

    private String checkTitle(String title, List<String> issues) {
        String trimmed = title.trim();
        if (trimmed.isEmpty()) {
            issues.add("title must not be blank");
        } else if (trimmed.length() > MAX_TITLE_LENGTH) {
            issues.add("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        return trimmed;
    }

    private String description(JsonNode body, List<String> issues) {
        String description = text(body, "description", issues);
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            issues.add("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description;
    }

    private Double confidence(JsonNode body, List<String> issues) {
        JsonNode node = body.get("confidenceScore");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            issues.add("confidenceScore must be a number");
            return null;
        }
        double value = node.doubleValue();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            issues.add("confidenceScore must be between 0 and 1");
            return null;
        }
        return value;
    }

    private StepLog stepLog(JsonNode body, String field, List<String> issues) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                JsonNode step = node.get(i);
                if (!step.isObject()) {
                    issues.add(field + "[" + i + "] must be an object");
                    return null;
                }
                JsonNode action = step.get("action");
                if (action == null || !action.isTextual() || action.asText().isBlank()) {
                    issues.add(field + "[" + i + "].action is required");
                    return null;
                }
                JsonNode confidence = step.get("confidence");
                if (confidence != null && !confidence.isNull()
                        && (!confidence.isNumber() || confidence.doubleValue() < 0.0 || confidence.doubleValue() > 1.0)) {
                    issues.add(field + "[" + i + "].confidence must be between 0 and 1");
                    return null;
                }
            }
        } else if (!node.isObject()) {
            issues.add(field + " must be an object or an array of steps");
            return null;
        }
        try {
            return StepLogDeserializer.read(node, objectMapper);
        } catch (IOException | IllegalArgumentException e) {
            issues.add(field + " is malformed: " + e.getMessage());
            return null;
        }
    }

    private String text(JsonNode body, String field, List<String> issues) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            issues.add(field + " must be a string");
            return null;
        }
        return node.asText();
    }

    private Boolean bool(JsonNode body, String field, List<String> issues) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            issues.add(field + " must be a boolean");
            return null;
        }
        return node.booleanValue();
    }

    private <E extends Enum<E>> E enumValue(JsonNode body, String field, Class<E> type, List<String> issues) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            issues.add(field + " must be one of " + Arrays.toString(type.getEnumConstants()));
            return null;
        }
        return enumText(field, node.asText(), type, issues);
    }

    private <E extends Enum<E>> E enumText(String field, String value, Class<E> type, List<String> issues) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            issues.add(field + " must be one of " + Arrays.toString(type.getEnumConstants()));
            return null;
        }
    }

    private static void requireObject(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new ValidationException("Request body must be a JSON object");
        }
    }

    private static void throwIfAny(List<String> issues) {
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }
    }
}
