package com.taskline.core.store;

import com.taskline.core.model.Task;
import com.taskline.core.model.TaskFilter;
import com.taskline.core.model.TaskStatus;
import com.taskline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryTaskStore(clock);
    }

    private static Task task(String id, String owner, Instant createdAt) {
        return Task.builder().id(id).ownerId(owner).title(id).createdAt(createdAt).updatedAt(createdAt).build();
    }

    @Test
    @DisplayName("get is scoped to the owner")
    void ownerScoped() {
        store.save(task("t1", "alice", T0));

        assertTrue(store.get("t1", "alice").isPresent());
        assertTrue(store.get("t1", "bob").isEmpty());
        assertTrue(store.get("missing", "alice").isEmpty());
    }

    @Test
    @DisplayName("save refreshes updatedAt but never moves it backwards")
    void saveTouches() {
        clock.advance(Duration.ofSeconds(3));
        assertEquals(T0.plusSeconds(3), store.save(task("t1", "alice", T0)).updatedAt());

        clock.set(T0);
        assertEquals(T0.plusSeconds(3), store.save(store.get("t1", "alice").orElseThrow()).updatedAt());
    }

    @Test
    @DisplayName("delete by another owner leaves the task in place")
    void deleteOwnerScoped() {
        store.save(task("t1", "alice", T0));

        assertFalse(store.delete("t1", "bob"));
        assertEquals(1, store.size());
        assertTrue(store.delete("t1", "alice"));
        assertFalse(store.delete("t1", "alice"));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("listing is newest first and filtered")
    void listOrdered() {
        store.save(task("old", "alice", T0));
        store.save(task("new", "alice", T0.plusSeconds(60)));
        store.save(task("done", "alice", T0.plusSeconds(30)).toBuilder().status(TaskStatus.DONE).build());
        store.save(task("other", "bob", T0.plusSeconds(90)));

        List<Task> all = store.listByOwner("alice", null);
        assertEquals(List.of("new", "done", "old"), all.stream().map(Task::id).toList());

        List<Task> done = store.listByOwner("alice", new TaskFilter(TaskStatus.DONE, null, null, null));
        assertEquals(1, done.size());
        assertEquals("done", done.get(0).id());
    }

    @Test
    @DisplayName("in-memory store is always available")
    void available() {
        assertTrue(store.isAvailable());
    }
}
