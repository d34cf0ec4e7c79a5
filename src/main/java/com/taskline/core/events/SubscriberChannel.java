package com.taskline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One subscriber's bounded, FIFO message queue.
 * <p>
 * Producers call {@link #offer}, which never blocks. Consumers either
 * {@link #poll} directly or {@link #attach} a {@link MessageSink}, in which
 * case queued messages are written to the sink on the given executor by at
 * most one drain task at a time. A sink failure closes the channel.
 */
public class SubscriberChannel {

    private static final Logger log = LoggerFactory.getLogger(SubscriberChannel.class);

    public enum OfferResult { ACCEPTED, FULL, CLOSED }

    private final String id = UUID.randomUUID().toString();
    private final String userId;
    private final BlockingQueue<ChannelMessage> queue;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

    private volatile MessageSink sink;
    private volatile Executor executor;

    public SubscriberChannel(String userId, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.userId = userId;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public boolean isOpen() {
        return open.get();
    }

    public int pendingCount() {
        return queue.size();
    }

    public OfferResult offer(ChannelMessage message) {
        if (!open.get()) {
            return OfferResult.CLOSED;
        }
        if (!queue.offer(message)) {
            return OfferResult.FULL;
        }
        scheduleDrain();
        return OfferResult.ACCEPTED;
    }

    /** Takes the next message without waiting, or {@code null}. */
    public ChannelMessage poll() {
        return queue.poll();
    }

    public ChannelMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Starts pushing queued messages to {@code sink}. Anything already queued
     * (at least the CONNECTED acknowledgement) is delivered first.
     */
    public void attach(MessageSink sink, Executor executor) {
        this.executor = executor;
        this.sink = sink;
        scheduleDrain();
    }

    /**
     * Registers a callback run once when the channel closes. Runs immediately
     * if the channel is already closed.
     */
    public void onClose(Runnable listener) {
        closeListeners.add(listener);
        if (!open.get() && closeListeners.remove(listener)) {
            listener.run();
        }
    }

    /** Closes the channel and discards undelivered messages. Idempotent. */
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        queue.clear();
        for (Runnable listener : closeListeners) {
            if (!closeListeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Close listener failed for channel {}: {}", id, e.getMessage(), e);
            }
        }
    }

    private void scheduleDrain() {
        MessageSink currentSink = sink;
        Executor currentExecutor = executor;
        if (currentSink == null || currentExecutor == null || !open.get()) {
            return;
        }
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            currentExecutor.execute(() -> drain(currentSink));
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.debug("Delivery executor rejected channel {}; closing", id);
            close();
        }
    }

    private void drain(MessageSink target) {
        try {
            ChannelMessage message;
            while (open.get() && (message = queue.poll()) != null) {
                target.write(message);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Delivery failed for channel {} (user {}): {}", id, userId, e.getMessage());
            close();
        } finally {
            draining.set(false);
        }
        // a message offered while the drainer was finishing still needs a drainer
        if (open.get() && !queue.isEmpty()) {
            scheduleDrain();
        }
    }
}
