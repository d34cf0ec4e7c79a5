package com.taskline.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskline.core.model.Task;

import java.time.Instant;

/**
 * A message queued on a subscriber channel: the connection acknowledgement,
 * a liveness heartbeat, or a task lifecycle event.
 *
 * @param type      CONNECTED, HEARTBEAT, or the event's wire name
 * @param taskId    task concerned, absent for CONNECTED and HEARTBEAT
 * @param data      task snapshot, present for created and updated events
 * @param timestamp when the message was produced
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelMessage(
    String type,
    String taskId,
    Task data,
    Instant timestamp
) {

    public static final String CONNECTED = "CONNECTED";
    public static final String HEARTBEAT = "HEARTBEAT";

    public static ChannelMessage connected(Instant now) {
        return new ChannelMessage(CONNECTED, null, null, now);
    }

    public static ChannelMessage heartbeat(Instant now) {
        return new ChannelMessage(HEARTBEAT, null, null, now);
    }

    public static ChannelMessage of(TaskEvent event) {
        return new ChannelMessage(event.type().wireName(), event.taskId(), event.task(), event.timestamp());
    }

    public boolean isHeartbeat() {
        return HEARTBEAT.equals(type);
    }
}
