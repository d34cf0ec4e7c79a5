package com.taskline.dispatch.api;

import com.taskline.config.TasklineProperties;
import com.taskline.core.events.EventBroadcaster;
import com.taskline.core.events.SubscriberChannel;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges {@link EventBroadcaster} channels to {@link SseEmitter} responses.
 * <p>
 * Each connection gets its own channel. Queued messages are written to the
 * emitter by a shared pool of delivery threads, so a slow client never holds
 * up a publisher. Every message is an unnamed SSE {@code data:} frame carrying
 * the JSON message, including CONNECTED and HEARTBEAT.
 * <p>
 * When the client goes away (completion, timeout, error, or a failed write)
 * the channel is closed and removed from the broadcaster immediately.
 */
@Service
public class TaskStreamingService {

    private static final Logger log = LoggerFactory.getLogger(TaskStreamingService.class);

    private final EventBroadcaster broadcaster;
    private final long timeoutMs;
    private final ExecutorService deliveryExecutor;

    public TaskStreamingService(EventBroadcaster broadcaster, TasklineProperties properties) {
        this(broadcaster,
                properties.getEvents().getEmitterTimeout().toMillis(),
                properties.getEvents().getDeliveryThreads());
    }

    TaskStreamingService(EventBroadcaster broadcaster, long timeoutMs, int deliveryThreads) {
        this.broadcaster = broadcaster;
        this.timeoutMs = timeoutMs;
        AtomicInteger threadCount = new AtomicInteger();
        this.deliveryExecutor = Executors.newFixedThreadPool(Math.max(1, deliveryThreads), r -> {
            Thread t = new Thread(r, "sse-delivery-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void stopDelivery() {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE delivery pool stopped");
    }

    /**
     * Subscribes {@code userId} and returns an emitter that streams the
     * channel, starting with the CONNECTED acknowledgement.
     */
    public SseEmitter createEmitter(String userId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBroadcaster.Subscription subscription = broadcaster.subscribe(userId);
        SubscriberChannel channel = subscription.channel();

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for user {} (channel {})", userId, channel.id());
            subscription.unsubscribe();
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for user {} (channel {})", userId, channel.id());
            subscription.unsubscribe();
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for user {} (channel {}): {}", userId, channel.id(), ex.getMessage());
            subscription.unsubscribe();
        });

        channel.onClose(() -> {
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("Emitter for channel {} already finished", channel.id());
            }
        });

        channel.attach(message -> emitter.send(SseEmitter.event().data(message, MediaType.APPLICATION_JSON)),
                deliveryExecutor);

        log.info("SSE stream opened for user {} (channel={}, timeout={}ms)", userId, channel.id(), timeoutMs);
        return emitter;
    }

    public int activeStreamCount() {
        return broadcaster.totalSubscriberCount();
    }
}
