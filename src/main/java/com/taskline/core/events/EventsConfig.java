package com.taskline.core.events;

import com.taskline.config.TasklineProperties;
import com.taskline.core.metrics.TasklineMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Creates the single {@link EventBroadcaster} and ties its lifecycle to the
 * application context.
 */
@Configuration
public class EventsConfig {

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public EventBroadcaster eventBroadcaster(TasklineProperties properties, Clock clock, TasklineMetrics metrics) {
        TasklineProperties.Events events = properties.getEvents();
        return new EventBroadcaster(events.getSubscriberBufferSize(), events.getHeartbeatInterval(), clock, metrics);
    }
}
