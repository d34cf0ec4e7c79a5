package com.taskline.core.lifecycle;

import com.taskline.core.error.InvalidStatusTransitionException;
import com.taskline.core.model.TaskStatus;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The legal status edges. A change of status outside this table is rejected,
 * with the exception of retry, which always moves a task to IN_PROGRESS.
 */
public final class StatusTransitions {

    private static final Map<TaskStatus, List<TaskStatus>> EDGES = new EnumMap<>(TaskStatus.class);

    static {
        EDGES.put(TaskStatus.TODO, List.of(TaskStatus.IN_PROGRESS, TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.IN_PROGRESS,
                List.of(TaskStatus.TODO, TaskStatus.REVIEW, TaskStatus.DONE, TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.REVIEW, List.of(TaskStatus.IN_PROGRESS, TaskStatus.DONE, TaskStatus.CANCELLED));
        EDGES.put(TaskStatus.DONE, List.of(TaskStatus.IN_PROGRESS));
        EDGES.put(TaskStatus.CANCELLED, List.of(TaskStatus.TODO));
    }

    private StatusTransitions() {}

    /** Legal targets from {@code from}, in table order. */
    public static List<TaskStatus> validTargets(TaskStatus from) {
        return EDGES.getOrDefault(from, List.of());
    }

    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        return validTargets(from).contains(to);
    }

    /**
     * @throws InvalidStatusTransitionException when {@code from -> to} is not an edge
     */
    public static void check(TaskStatus from, TaskStatus to) {
        if (!isAllowed(from, to)) {
            throw new InvalidStatusTransitionException(from, to, validTargets(from));
        }
    }
}
