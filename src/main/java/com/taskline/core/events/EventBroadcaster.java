package com.taskline.core.events;

import com.taskline.core.metrics.TasklineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory, per-user fan-out of task lifecycle events.
 * <p>
 * Each subscriber owns a bounded {@link SubscriberChannel}. Publishing offers
 * the event to every open channel of the task's owner and never blocks: a
 * full or closed channel loses that event and nobody else is affected.
 * A daemon scheduler puts a HEARTBEAT on every channel at a fixed interval.
 * <p>
 * Events are not persisted. A subscriber that reconnects receives only what
 * is published after it subscribed again.
 */
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    /** Open channels keyed by user id. */
    private final ConcurrentHashMap<String, CopyOnWriteArraySet<SubscriberChannel>> channels =
            new ConcurrentHashMap<>();

    private final int bufferSize;
    private final Duration heartbeatInterval;
    private final Clock clock;
    private final TasklineMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile ScheduledExecutorService heartbeatScheduler;

    public EventBroadcaster(int bufferSize, Duration heartbeatInterval, Clock clock, TasklineMetrics metrics) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("Subscriber buffer size must be positive: " + bufferSize);
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + heartbeatInterval);
        }
        this.bufferSize = bufferSize;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
        this.metrics = metrics;
        metrics.registerSubscriberGauge(this::totalSubscriberCount);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskline-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = heartbeatInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::sendHeartbeats, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        heartbeatScheduler = scheduler;
        log.info("Event broadcaster started (heartbeat={}ms, buffer={})", intervalMs, bufferSize);
    }

    /** Stops heartbeats and closes every channel. */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService scheduler = heartbeatScheduler;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        int closed = 0;
        for (Set<SubscriberChannel> userChannels : channels.values()) {
            for (SubscriberChannel channel : userChannels) {
                channel.close();
                closed++;
            }
        }
        channels.clear();
        log.info("Event broadcaster stopped ({} channels closed)", closed);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Opens a channel for {@code userId}. The CONNECTED acknowledgement is
     * already queued on it when this returns.
     */
    public Subscription subscribe(String userId) {
        SubscriberChannel channel = new SubscriberChannel(userId, bufferSize);
        channel.offer(ChannelMessage.connected(clock.instant()));
        channel.onClose(() -> deregister(channel));
        channels.compute(userId, (k, userChannels) -> {
            CopyOnWriteArraySet<SubscriberChannel> set =
                    userChannels != null ? userChannels : new CopyOnWriteArraySet<>();
            set.add(channel);
            return set;
        });
        log.debug("Channel {} subscribed for user {}", channel.id(), userId);
        return new Subscription(channel, this);
    }

    /**
     * Offers {@code event} to every channel registered for {@code userId}.
     * Returns the number of channels that accepted it.
     */
    public int publish(String userId, TaskEvent event) {
        metrics.recordEventPublished(event.type().wireName());
        Set<SubscriberChannel> userChannels = channels.get(userId);
        if (userChannels == null || userChannels.isEmpty()) {
            return 0;
        }
        ChannelMessage message = ChannelMessage.of(event);
        int delivered = 0;
        for (SubscriberChannel channel : userChannels) {
            switch (channel.offer(message)) {
                case ACCEPTED -> delivered++;
                case FULL -> {
                    metrics.recordEventDropped("buffer_full");
                    log.debug("Dropped {} for task {} on channel {}: buffer full",
                            event.type(), event.taskId(), channel.id());
                }
                case CLOSED -> {
                    metrics.recordEventDropped("channel_closed");
                    log.debug("Dropped {} for task {} on channel {}: channel closed",
                            event.type(), event.taskId(), channel.id());
                }
            }
        }
        return delivered;
    }

    /** Closes and removes {@code channel}. Safe to call more than once. */
    public void unsubscribe(SubscriberChannel channel) {
        channel.close();
        deregister(channel);
    }

    public int subscriberCount(String userId) {
        Set<SubscriberChannel> userChannels = channels.get(userId);
        return userChannels == null ? 0 : userChannels.size();
    }

    public int totalSubscriberCount() {
        int total = 0;
        for (Set<SubscriberChannel> userChannels : channels.values()) {
            total += userChannels.size();
        }
        return total;
    }

    void sendHeartbeats() {
        if (channels.isEmpty()) {
            return;
        }
        ChannelMessage heartbeat = ChannelMessage.heartbeat(clock.instant());
        int sent = 0;
        for (Set<SubscriberChannel> userChannels : channels.values()) {
            for (SubscriberChannel channel : userChannels) {
                if (channel.offer(heartbeat) == SubscriberChannel.OfferResult.ACCEPTED) {
                    sent++;
                }
            }
        }
        log.debug("Heartbeat queued on {} channels", sent);
    }

    private void deregister(SubscriberChannel channel) {
        channels.computeIfPresent(channel.userId(), (userId, userChannels) -> {
            userChannels.remove(channel);
            return userChannels.isEmpty() ? null : userChannels;
        });
    }

    /**
     * Handle returned by {@link #subscribe}: the channel to consume plus a
     * way to give it up.
     */
    public record Subscription(SubscriberChannel channel, EventBroadcaster broadcaster) {

        public void unsubscribe() {
            broadcaster.unsubscribe(channel);
        }
    }
}
