package com.taskline.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskline.core.error.ValidationException;
import com.taskline.core.model.NewTask;
import com.taskline.core.model.StepLog;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskPatch;
import com.taskline.core.model.TaskPriority;
import com.taskline.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskRequestValidatorTest {

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
    private final TaskRequestValidator validator = new TaskRequestValidator(mapper);

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Nested
    @DisplayName("parseCreate")
    class CreateTests {

        @Test
        @DisplayName("trims the title and reads every field")
        void fullRequest() throws Exception {
            NewTask task = validator.parseCreate(json("""
                    {"title": "  Summarise logs ", "description": "last 24h", "priority": "URGENT",
                     "agentId": "agent-a", "confidenceScore": 0.65, "requiresReview": true,
                     "reasoningLog": {"model": "m-1"},
                     "executionSteps": [{"action": "fetch", "confidence": 0.9}]}
                    """));

            assertEquals("Summarise logs", task.title());
            assertEquals("last 24h", task.description());
            assertEquals(TaskPriority.URGENT, task.priority());
            assertEquals("agent-a", task.agentId());
            assertEquals(0.65, task.confidenceScore());
            assertTrue(task.requiresReview());
            assertInstanceOf(StepLog.Metadata.class, task.reasoningLog());
            assertInstanceOf(StepLog.Steps.class, task.executionSteps());
        }

        @Test
        @DisplayName("missing and blank titles are rejected")
        void titleRequired() {
            var missing = assertThrows(ValidationException.class, () -> validator.parseCreate(json("{}")));
            assertEquals(List.of("title is required"), missing.issues());

            var blank = assertThrows(ValidationException.class,
                    () -> validator.parseCreate(json("{\"title\": \"   \"}")));
            assertTrue(blank.issues().contains("title must not be blank"));
        }

        @Test
        @DisplayName("title longer than 255 characters is rejected")
        void titleTooLong() {
            String title = "x".repeat(256);
            var ex = assertThrows(ValidationException.class,
                    () -> validator.parseCreate(json("{\"title\": \"" + title + "\"}")));
            assertTrue(ex.issues().contains("title must be at most 255 characters"));
        }

        @Test
        @DisplayName("collects every issue in one exception")
        void collectsIssues() {
            var ex = assertThrows(ValidationException.class, () -> validator.parseCreate(json("""
                    {"title": 42, "priority": "CRITICAL", "confidenceScore": -0.1, "requiresReview": "yes"}
                    """)));

            assertTrue(ex.issues().contains("title must be a string"));
            assertFalse(ex.issues().contains("title is required"));
            assertTrue(ex.issues().stream().anyMatch(i -> i.startsWith("priority must be one of")));
            assertTrue(ex.issues().contains("confidenceScore must be between 0 and 1"));
            assertTrue(ex.issues().contains("requiresReview must be a boolean"));
        }

        @Test
        @DisplayName("non-object bodies are rejected")
        void nonObject() {
            var ex = assertThrows(ValidationException.class, () -> validator.parseCreate(json("[1, 2]")));
            assertEquals("Request body must be a JSON object", ex.issues().get(0));
        }
    }

    @Nested
    @DisplayName("step logs")
    class StepLogTests {

        @Test
        @DisplayName("step without an action is rejected")
        void stepNeedsAction() {
            var ex = assertThrows(ValidationException.class, () -> validator.parseCreate(json("""
                    {"title": "t", "reasoningLog": [{"reasoning": "because"}]}
                    """)));
            assertTrue(ex.issues().contains("reasoningLog[0].action is required"));
        }

        @Test
        @DisplayName("step confidence outside [0,1] is rejected")
        void stepConfidenceRange() {
            var ex = assertThrows(ValidationException.class, () -> validator.parseCreate(json("""
                    {"title": "t", "executionSteps": [{"action": "a", "confidence": 2}]}
                    """)));
            assertTrue(ex.issues().contains("executionSteps[0].confidence must be between 0 and 1"));
        }

        @Test
        @DisplayName("scalar step log is rejected")
        void scalarLog() {
            var ex = assertThrows(ValidationException.class, () -> validator.parseCreate(json("""
                    {"title": "t", "reasoningLog": "thought hard"}
                    """)));
            assertTrue(ex.issues().contains("reasoningLog must be an object or an array of steps"));
        }
    }

    @Nested
    @DisplayName("parsePatch")
    class PatchTests {

        @Test
        @DisplayName("absent fields stay null and flags default to false")
        void sparsePatch() throws Exception {
            TaskPatch patch = validator.parsePatch(json("{\"status\": \"IN_PROGRESS\"}"));

            assertEquals(TaskStatus.IN_PROGRESS, patch.status());
            assertNull(patch.title());
            assertNull(patch.requiresReview());
            assertFalse(patch.retry());
            assertFalse(patch.markAsReviewed());
        }

        @Test
        @DisplayName("empty body is an empty patch")
        void emptyPatch() throws Exception {
            assertTrue(validator.parsePatch(json("{}")).isEmpty());
        }

        @Test
        @DisplayName("unknown status is rejected")
        void unknownStatus() {
            var ex = assertThrows(ValidationException.class,
                    () -> validator.parsePatch(json("{\"status\": \"FAILED\"}")));
            assertTrue(ex.issues().get(0).startsWith("status must be one of"));
        }

        @Test
        @DisplayName("reads action flags and error fields")
        void flags() throws Exception {
            TaskPatch patch = validator.parsePatch(json("""
                    {"retry": true, "markAsReviewed": true, "wasOverridden": false,
                     "errorMessage": "timeout", "errorCode": "E_TIMEOUT"}
                    """));

            assertTrue(patch.retry());
            assertTrue(patch.markAsReviewed());
            assertEquals(Boolean.FALSE, patch.wasOverridden());
            assertEquals("timeout", patch.errorMessage());
            assertEquals("E_TIMEOUT", patch.errorCode());
        }
    }

    @Nested
    @DisplayName("parseFilter")
    class FilterTests {

        @Test
        @DisplayName("blank parameters are ignored")
        void blanks() {
            assertEquals(TaskFilter.none(), validator.parseFilter("", null, " ", null));
        }

        @Test
        @DisplayName("parses every criterion")
        void parses() {
            assertEquals(new TaskFilter(TaskStatus.REVIEW, TaskPriority.LOW, "agent-a", false),
                    validator.parseFilter("REVIEW", "LOW", "agent-a", "false"));
        }

        @Test
        @DisplayName("bad boolean is rejected")
        void badBoolean() {
            var ex = assertThrows(ValidationException.class,
                    () -> validator.parseFilter(null, null, null, "maybe"));
            assertTrue(ex.issues().contains("requiresReview must be true or false"));
        }
    }
}
