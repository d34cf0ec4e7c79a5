package com.taskline.core.lifecycle;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per task id, created on demand and discarded once
 * no thread holds or waits for it.
 */
public class TaskLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String taskId, Supplier<T> action) {
        // holders is only touched inside compute, which is atomic per key
        Entry entry = locks.compute(taskId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.holders++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(taskId, (id, e) -> --e.holders == 0 ? null : e);
        }
    }

    /** Number of task ids currently locked or waited on. */
    int activeCount() {
        return locks.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int holders;
    }
}
