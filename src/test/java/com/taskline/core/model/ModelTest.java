package com.taskline.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .build();

    private static Task task(String id, TaskStatus status) {
        return Task.builder()
                .id(id)
                .ownerId("u1")
                .title("Task " + id)
                .status(status)
                .createdAt(T0)
                .updatedAt(T0)
                .build();
    }

    @Nested
    @DisplayName("Task")
    class TaskTests {

        @Test
        @DisplayName("builder defaults to TODO and MEDIUM")
        void builderDefaults() {
            Task task = Task.builder().id("t1").ownerId("u1").title("x").build();

            assertEquals(TaskStatus.TODO, task.status());
            assertEquals(TaskPriority.MEDIUM, task.priority());
            assertEquals(0, task.retryCount());
            assertFalse(task.requiresReview());
            assertFalse(task.wasOverridden());
        }

        @Test
        @DisplayName("toBuilder copies every field")
        void toBuilderCopies() {
            Task original = task("t1", TaskStatus.REVIEW).toBuilder()
                    .agentId("agent-a")
                    .confidenceScore(0.8)
                    .reviewNotes("ok")
                    .retryCount(2)
                    .firstAttemptAt(T0)
                    .build();

            assertEquals(original, original.toBuilder().build());
        }

        @Test
        @DisplayName("touchedAt moves updatedAt forward")
        void touchedAtForward() {
            Task touched = task("t1", TaskStatus.TODO).touchedAt(T0.plusSeconds(5));
            assertEquals(T0.plusSeconds(5), touched.updatedAt());
        }

        @Test
        @DisplayName("touchedAt never moves updatedAt backwards")
        void touchedAtNeverBackwards() {
            Task original = task("t1", TaskStatus.TODO);
            Task touched = original.touchedAt(T0.minusSeconds(5));
            assertSame(original, touched);
            assertEquals(T0, touched.updatedAt());
        }
    }

    @Nested
    @DisplayName("StepLog JSON")
    class StepLogJsonTests {

        @Test
        @DisplayName("object payload reads as metadata and writes back as an object")
        void metadataShape() throws Exception {
            StepLog log = mapper.readValue("{\"model\":\"m-1\",\"tokens\":42}", StepLog.class);

            assertInstanceOf(StepLog.Metadata.class, log);
            Map<String, Object> entries = ((StepLog.Metadata) log).entries();
            assertEquals("m-1", entries.get("model"));
            assertEquals(42, entries.get("tokens"));
            assertEquals("{\"model\":\"m-1\",\"tokens\":42}", mapper.writeValueAsString(log));
        }

        @Test
        @DisplayName("array payload reads as ordered steps")
        void stepsShape() throws Exception {
            String json = "[{\"action\":\"search\",\"confidence\":0.9},{\"action\":\"summarize\",\"outcome\":\"done\"}]";
            StepLog log = mapper.readValue(json, StepLog.class);

            assertInstanceOf(StepLog.Steps.class, log);
            List<StepRecord> steps = ((StepLog.Steps) log).steps();
            assertEquals(2, steps.size());
            assertEquals("search", steps.get(0).action());
            assertEquals(0.9, steps.get(0).confidence());
            assertEquals("done", steps.get(1).outcome());
            assertNull(steps.get(1).confidence());
        }

        @Test
        @DisplayName("steps serialize without null fields")
        void stepsOmitNulls() throws Exception {
            StepLog log = StepLog.steps(List.of(new StepRecord("plan", null, null, null, null)));
            assertEquals("[{\"action\":\"plan\"}]", mapper.writeValueAsString(log));
        }

        @Test
        @DisplayName("scalar payload is rejected")
        void scalarRejected() {
            assertThrows(Exception.class, () -> mapper.readValue("\"just text\"", StepLog.class));
        }

        @Test
        @DisplayName("task keeps its step log shape through JSON")
        void taskCarriesShape() throws Exception {
            Task task = task("t1", TaskStatus.TODO).toBuilder()
                    .reasoningLog(StepLog.metadata(Map.of("why", "because")))
                    .build();

            Task read = mapper.readValue(mapper.writeValueAsString(task), Task.class);
            assertEquals(task.reasoningLog(), read.reasoningLog());
        }
    }

    @Nested
    @DisplayName("TaskFilter")
    class TaskFilterTests {

        @Test
        @DisplayName("none matches everything")
        void noneMatchesAll() {
            assertTrue(TaskFilter.none().matches(task("t1", TaskStatus.DONE)));
        }

        @Test
        @DisplayName("all given criteria must match")
        void conjunction() {
            Task task = task("t1", TaskStatus.REVIEW).toBuilder()
                    .agentId("agent-a")
                    .priority(TaskPriority.HIGH)
                    .requiresReview(true)
                    .build();

            assertTrue(new TaskFilter(TaskStatus.REVIEW, TaskPriority.HIGH, "agent-a", true).matches(task));
            assertFalse(new TaskFilter(TaskStatus.REVIEW, TaskPriority.LOW, null, null).matches(task));
            assertFalse(new TaskFilter(null, null, "agent-b", null).matches(task));
            assertFalse(new TaskFilter(null, null, null, false).matches(task));
        }
    }

    @Nested
    @DisplayName("TaskPatch")
    class TaskPatchTests {

        @Test
        @DisplayName("empty patch has no fields and no actions")
        void emptyPatch() {
            assertTrue(TaskPatch.empty().isEmpty());
            assertTrue(TaskPatch.builder().build().isEmpty());
            assertFalse(TaskPatch.builder().retry(true).build().isEmpty());
            assertFalse(TaskPatch.builder().title("x").build().isEmpty());
        }
    }
}
