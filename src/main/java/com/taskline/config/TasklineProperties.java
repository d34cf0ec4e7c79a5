package com.taskline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "taskline")
public class TasklineProperties {

    private Events events = new Events();
    private Store store = new Store();

    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Events {
        /** Interval between HEARTBEAT messages on every open channel. */
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        /** Pending messages a channel holds before new ones are dropped. */
        private int subscriberBufferSize = 256;
        /** How long an SSE response stays open; zero means no timeout. */
        private Duration emitterTimeout = Duration.ZERO;
        /** Threads that write queued messages to SSE connections. */
        private int deliveryThreads = 4;

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public int getSubscriberBufferSize() { return subscriberBufferSize; }
        public void setSubscriberBufferSize(int subscriberBufferSize) { this.subscriberBufferSize = subscriberBufferSize; }
        public Duration getEmitterTimeout() { return emitterTimeout; }
        public void setEmitterTimeout(Duration emitterTimeout) { this.emitterTimeout = emitterTimeout; }
        public int getDeliveryThreads() { return deliveryThreads; }
        public void setDeliveryThreads(int deliveryThreads) { this.deliveryThreads = deliveryThreads; }
    }

    public static class Store {
        /** {@code memory} or {@code jdbc}. */
        private String type = "memory";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }
}
