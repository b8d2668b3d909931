/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kitbash Viewer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kitbash.portal.hub;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.ClientMessage;
import com.hellblazer.kitbash.common.ConnectionState;
import com.hellblazer.kitbash.common.wire.EventCodec;
import com.hellblazer.kitbash.common.wire.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Fan-out of the sequenced event stream to every connected viewer.
 * <p>
 * Each subscription owns a bounded queue and at most one active delivery task, so messages reach a connection in the
 * order they were published. A slow connection never holds back the others: when its queue would overflow, the queued
 * per-file events are dropped and replaced by a single {@link ChangeEvent.ResyncAll} of the current registry, which
 * the viewer applies in place of everything it missed.
 * <p>
 * Every new subscription starts with a {@link ChangeEvent.ResyncAll} ahead of the live tail.
 *
 * @author hal.hildebrand
 */
public class SubscriptionHub implements Consumer<ChangeEvent>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionHub.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    private static class Subscription {
        final EventChannel       channel;
        final Deque<ChangeEvent> queue = new ArrayDeque<>();
        ConnectionState state = ConnectionState.CONNECTING;
        boolean         delivering;
        boolean         closeWhenDrained;
        boolean         quitRequested;
        Instant         lastSeen;
        long            delivered;
        long            overflows;

        Subscription(EventChannel channel) {
            this.channel = channel;
            this.lastSeen = Instant.now();
        }
    }

    private final Supplier<ChangeEvent.ResyncAll> snapshots;
    private final EventCodec                 codec;
    private final int                        capacity;
    private final Executor                   delivery;
    private final ExecutorService            ownedDelivery;
    private final Map<String, Subscription>  subscriptions = new LinkedHashMap<>();

    private volatile Consumer<String> quitListener = id -> {
    };
    private          boolean          closed;

    /**
     * Create a hub with its own delivery pool.
     *
     * @param snapshots source of the current full registry snapshot
     * @param codec     wire encoder
     * @param capacity  per-connection queue bound
     */
    public SubscriptionHub(Supplier<ChangeEvent.ResyncAll> snapshots, EventCodec codec, int capacity) {
        this(snapshots, codec, capacity, newDeliveryPool(), true);
    }

    public SubscriptionHub(Supplier<ChangeEvent.ResyncAll> snapshots, EventCodec codec, int capacity, Executor delivery) {
        this(snapshots, codec, capacity, delivery, false);
    }

    private SubscriptionHub(Supplier<ChangeEvent.ResyncAll> snapshots, EventCodec codec, int capacity, Executor delivery,
                            boolean ownsDelivery) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.snapshots = Objects.requireNonNull(snapshots);
        this.codec = Objects.requireNonNull(codec);
        this.capacity = capacity;
        this.delivery = Objects.requireNonNull(delivery);
        this.ownedDelivery = ownsDelivery ? (ExecutorService) delivery : null;
    }

    private static ExecutorService newDeliveryPool() {
        var count = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "kitbash-delivery-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Receives the id of every connection that asked to quit, once it has been flushed and closed.
     */
    public void setQuitListener(Consumer<String> quitListener) {
        this.quitListener = Objects.requireNonNull(quitListener);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Add a connection. Its first message is a snapshot of the current registry.
     *
     * @throws IllegalArgumentException if a connection with the same id is already registered
     * @throws IllegalStateException    if the hub is closed
     */
    public synchronized void register(EventChannel channel) {
        if (closed) {
            throw new IllegalStateException("Subscription hub is closed");
        }
        var id = channel.id();
        if (subscriptions.containsKey(id)) {
            throw new IllegalArgumentException("Duplicate connection id: " + id);
        }
        var subscription = new Subscription(channel);
        subscriptions.put(id, subscription);
        subscription.queue.add(snapshots.get());
        log.info("Viewer {} connected ({} active)", id, subscriptions.size());
        schedule(subscription);
    }

    /**
     * Drop a connection whose transport has already closed.
     *
     * @return true if the connection was registered
     */
    public synchronized boolean unregister(String id) {
        var subscription = subscriptions.remove(id);
        if (subscription == null) {
            return false;
        }
        disconnect(subscription);
        log.info("Viewer {} disconnected ({} active)", id, subscriptions.size());
        return true;
    }

    /**
     * Publish one event to every live connection.
     */
    @Override
    public synchronized void accept(ChangeEvent event) {
        Objects.requireNonNull(event);
        for (var subscription : List.copyOf(subscriptions.values())) {
            if (subscription.state.isTerminal()) {
                continue;
            }
            enqueue(subscription, event);
            schedule(subscription);
        }
    }

    /**
     * Handle a message received from a viewer.
     */
    public void onMessage(String id, String text) {
        ClientMessage message;
        try {
            message = codec.decodeClientMessage(text);
        } catch (ProtocolException e) {
            log.warn("Ignoring malformed message from viewer {}: {}", id, e.getMessage());
            return;
        }
        synchronized (this) {
            var subscription = subscriptions.get(id);
            if (subscription == null) {
                log.debug("Message from unknown viewer {}", id);
                return;
            }
            subscription.lastSeen = Instant.now();
            switch (message) {
                case PING -> log.trace("Ping from viewer {}", id);
                case QUIT -> {
                    if (subscription.state.isTerminal()) {
                        return;
                    }
                    log.info("Viewer {} requested quit", id);
                    subscription.state = subscription.state.transitionTo(ConnectionState.DRAINING);
                    subscription.quitRequested = true;
                    subscription.closeWhenDrained = true;
                    schedule(subscription);
                }
            }
        }
    }

    public synchronized int connectionCount() {
        return subscriptions.size();
    }

    public synchronized List<SubscriptionStats> stats() {
        var stats = new ArrayList<SubscriptionStats>(subscriptions.size());
        for (var s : subscriptions.values()) {
            stats.add(new SubscriptionStats(s.channel.id(), s.state, s.queue.size(), s.delivered, s.overflows,
                                            s.lastSeen));
        }
        return stats;
    }

    /**
     * Flush and close every connection.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            for (var subscription : List.copyOf(subscriptions.values())) {
                if (!subscription.state.isTerminal()) {
                    subscription.state = subscription.state.transitionTo(ConnectionState.DRAINING);
                }
                subscription.closeWhenDrained = true;
                schedule(subscription);
            }
        }
        if (ownedDelivery != null) {
            ownedDelivery.shutdown();
            try {
                if (!ownedDelivery.awaitTermination(2, TimeUnit.SECONDS)) {
                    ownedDelivery.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ownedDelivery.shutdownNow();
            }
        }
        List<Subscription> remaining;
        synchronized (this) {
            remaining = new ArrayList<>(subscriptions.values());
            subscriptions.clear();
        }
        remaining.forEach(s -> s.channel.close());
        log.debug("Subscription hub closed");
    }

    private void enqueue(Subscription subscription, ChangeEvent event) {
        if (event instanceof ChangeEvent.ResyncAll) {
            subscription.queue.clear();
            subscription.queue.add(event);
            return;
        }
        if (subscription.queue.size() >= capacity) {
            // the registry already reflects this event, so the snapshot covers it
            subscription.queue.clear();
            subscription.queue.add(snapshots.get());
            subscription.overflows++;
            log.warn("Viewer {} fell behind by {} events, replacing its queue with a resync",
                     subscription.channel.id(), capacity);
            return;
        }
        subscription.queue.add(event);
    }

    private void schedule(Subscription subscription) {
        if (subscription.delivering) {
            return;
        }
        if (subscription.queue.isEmpty() && !subscription.closeWhenDrained) {
            return;
        }
        subscription.delivering = true;
        try {
            delivery.execute(() -> deliver(subscription));
        } catch (RejectedExecutionException e) {
            subscription.delivering = false;
            log.warn("Delivery to viewer {} rejected: {}", subscription.channel.id(), e.getMessage());
        }
    }

    private void deliver(Subscription subscription) {
        while (true) {
            ChangeEvent next;
            synchronized (this) {
                next = subscription.queue.poll();
                if (next == null) {
                    subscription.delivering = false;
                    break;
                }
            }
            try {
                subscription.channel.send(codec.encode(next));
            } catch (IOException | RuntimeException e) {
                failed(subscription, e);
                return;
            }
            synchronized (this) {
                subscription.delivered++;
                if (subscription.state == ConnectionState.CONNECTING) {
                    subscription.state = subscription.state.transitionTo(ConnectionState.CONNECTED);
                }
            }
        }
        if (subscription.closeWhenDrained) {
            finish(subscription);
        }
    }

    private void finish(Subscription subscription) {
        var id = subscription.channel.id();
        synchronized (this) {
            if (subscriptions.get(id) != subscription || !subscription.queue.isEmpty()) {
                return;
            }
            subscriptions.remove(id);
        }
        subscription.channel.close();
        log.info("Viewer {} drained and closed after {} messages", id, subscription.delivered);
        if (subscription.quitRequested) {
            quitListener.accept(id);
        }
    }

    private void failed(Subscription subscription, Exception e) {
        var id = subscription.channel.id();
        synchronized (this) {
            subscription.delivering = false;
            if (subscriptions.get(id) == subscription) {
                subscriptions.remove(id);
            }
            disconnect(subscription);
        }
        log.warn("Delivery to viewer {} failed, dropping connection: {}", id, e.getMessage());
        subscription.channel.close();
    }

    private static void disconnect(Subscription subscription) {
        if (subscription.state.canTransitionTo(ConnectionState.DISCONNECTED)) {
            subscription.state = ConnectionState.DISCONNECTED;
        }
        subscription.queue.clear();
    }
}
