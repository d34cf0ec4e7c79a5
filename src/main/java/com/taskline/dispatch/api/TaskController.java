package com.taskline.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskline.core.lifecycle.TaskStateMachine;
import com.taskline.core.model.Task;
import com.taskline.core.model.TaskStatus;
import com.taskline.core.security.AuthFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the task lifecycle. Every route acts on the caller's
 * own tasks only.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskStateMachine stateMachine;
    private final TaskRequestValidator validator;
    private final TaskStreamingService streamingService;

    public TaskController(TaskStateMachine stateMachine,
                          TaskRequestValidator validator,
                          TaskStreamingService streamingService) {
        this.stateMachine = stateMachine;
        this.validator = validator;
        this.streamingService = streamingService;
    }

    /**
     * POST /api/v1/tasks — Create a task in TODO.
     */
    @PostMapping
    public ResponseEntity<Task> create(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                                       @RequestBody JsonNode body) {
        String owner = CurrentUser.require(userId);
        Task task = stateMachine.create(owner, validator.parseCreate(body));
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    /**
     * GET /api/v1/tasks — List tasks, newest first, optionally filtered.
     */
    @GetMapping
    public List<Task> list(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                           @RequestParam(required = false) String status,
                           @RequestParam(required = false) String priority,
                           @RequestParam(required = false) String agentId,
                           @RequestParam(required = false) String requiresReview) {
        String owner = CurrentUser.require(userId);
        return stateMachine.list(owner, validator.parseFilter(status, priority, agentId, requiresReview));
    }

    /**
     * GET /api/v1/tasks/stats — Task counts per status plus the total.
     */
    @GetMapping("/stats")
    public Map<String, Object> stats(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId) {
        Map<TaskStatus, Long> counts = stateMachine.countByStatus(CurrentUser.require(userId));
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<TaskStatus, Long> entry : counts.entrySet()) {
            byStatus.put(entry.getKey().name(), entry.getValue());
            total += entry.getValue();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total", total);
        result.put("byStatus", byStatus);
        return result;
    }

    /**
     * GET /api/v1/tasks/events — SSE stream of the caller's task events.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId) {
        return streamingService.createEmitter(CurrentUser.require(userId));
    }

    @GetMapping("/{id}")
    public Task get(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                    @PathVariable String id) {
        return stateMachine.get(CurrentUser.require(userId), id);
    }

    /**
     * PATCH /api/v1/tasks/{id} — Partial update, optionally reviewing or retrying in the same call.
     */
    @PatchMapping("/{id}")
    public Task update(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                       @PathVariable String id,
                       @RequestBody JsonNode body) {
        String owner = CurrentUser.require(userId);
        return stateMachine.update(owner, id, validator.parsePatch(body));
    }

    /**
     * POST /api/v1/tasks/{id}/override — The caller overrides the agent's result.
     */
    @PostMapping("/{id}/override")
    public Task override(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                         @PathVariable String id,
                         @RequestBody(required = false) OverrideRequest request) {
        String owner = CurrentUser.require(userId);
        String notes = request != null ? request.reviewNotes() : null;
        log.info("Override requested for task {}", id);
        return stateMachine.recordOverride(owner, id, owner, notes);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId,
                                      @PathVariable String id) {
        stateMachine.delete(CurrentUser.require(userId), id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("deletedId", id);
        return result;
    }

    public record OverrideRequest(String reviewNotes) {}
}
