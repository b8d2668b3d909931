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
package com.hellblazer.kitbash.viewer.connect;

import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.ClientMessage;
import com.hellblazer.kitbash.common.ConnectionState;
import com.hellblazer.kitbash.common.wire.EventCodec;
import com.hellblazer.kitbash.common.wire.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Keeps the viewer's event channel alive.
 * <p>
 * Every lost connection, including a failed attempt, schedules a retry after the current backoff delay, which then
 * grows up to the policy's cap. A successful connection resets the delay. Retries never give up. {@link #shutdown()}
 * sends a quit request and moves to {@link ConnectionState#DRAINING}, after which nothing reconnects.
 * <p>
 * Each attempt carries a generation number; callbacks from superseded attempts are ignored.
 *
 * @author hal.hildebrand
 */
public class ReconnectSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);

    private final EventConnector              connector;
    private final BackoffPolicy               backoff;
    private final Duration                    pingInterval;
    private final ScheduledExecutorService    scheduler;
    private final EventCodec                  codec;
    private final Consumer<ChangeEvent>       events;
    private final Consumer<ConnectionState>   status;

    private ConnectionState           state = ConnectionState.DISCONNECTED;
    private long                      generation;
    private Duration                  nextDelay;
    private EventConnector.Connection connection;
    private ScheduledFuture<?>        retryTimer;
    private ScheduledFuture<?>        pingTimer;
    private long                      attempts;

    /**
     * @param connector    opens connections
     * @param backoff      reconnect delays
     * @param pingInterval interval between liveness pings while connected, zero to disable
     * @param scheduler    runs retry and ping timers
     * @param codec        wire codec
     * @param events       receives every decoded event, on the connection's callback thread
     * @param status       notified of every state change
     */
    public ReconnectSupervisor(EventConnector connector, BackoffPolicy backoff, Duration pingInterval,
                               ScheduledExecutorService scheduler, EventCodec codec, Consumer<ChangeEvent> events,
                               Consumer<ConnectionState> status) {
        this.connector = Objects.requireNonNull(connector);
        this.backoff = Objects.requireNonNull(backoff);
        this.pingInterval = Objects.requireNonNull(pingInterval);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.codec = Objects.requireNonNull(codec);
        this.events = Objects.requireNonNull(events);
        this.status = Objects.requireNonNull(status);
        this.nextDelay = backoff.initial();
    }

    /**
     * Make the first connection attempt.
     */
    public synchronized void start() {
        if (state != ConnectionState.DISCONNECTED || connection != null || retryTimer != null) {
            log.debug("Supervisor already running in state {}", state);
            return;
        }
        connect();
    }

    /**
     * Retry immediately if currently waiting out a backoff delay. The delay ladder is left untouched.
     *
     * @return true if a new attempt was started
     */
    public synchronized boolean reloadNow() {
        if (state != ConnectionState.DISCONNECTED) {
            return false;
        }
        cancel(retryTimer);
        retryTimer = null;
        log.info("Manual reload, reconnecting now");
        connect();
        return true;
    }

    /**
     * Ask the server to close gracefully and stop reconnecting.
     */
    public synchronized void shutdown() {
        if (state.isTerminal()) {
            return;
        }
        cancel(retryTimer);
        cancel(pingTimer);
        retryTimer = null;
        pingTimer = null;
        generation++;
        var open = connection;
        connection = null;
        if (open != null) {
            if (!open.send(codec.encode(ClientMessage.QUIT))) {
                log.debug("Unable to send quit request");
            }
            open.close();
        }
        transition(ConnectionState.DRAINING);
        log.info("Event channel shut down after {} attempts", attempts);
    }

    @Override
    public void close() {
        shutdown();
    }

    public synchronized ConnectionState state() {
        return state;
    }

    /**
     * @return the delay the next loss will wait before retrying
     */
    public synchronized Duration nextDelay() {
        return nextDelay;
    }

    public synchronized long attempts() {
        return attempts;
    }

    private void connect() {
        var attempt = ++generation;
        attempts++;
        transition(ConnectionState.CONNECTING);
        EventConnector.Connection opened;
        try {
            opened = connector.connect(new AttemptListener(attempt));
        } catch (RuntimeException e) {
            log.warn("Connection attempt failed: {}", e.getMessage());
            lost(attempt, e.getMessage());
            return;
        }
        if (attempt == generation && state != ConnectionState.DISCONNECTED && !state.isTerminal()) {
            connection = opened;
        } else {
            opened.close();
        }
    }

    private synchronized void opened(long attempt) {
        if (attempt != generation || state != ConnectionState.CONNECTING) {
            return;
        }
        nextDelay = backoff.initial();
        transition(ConnectionState.CONNECTED);
        if (!pingInterval.isZero()) {
            pingTimer = scheduler.scheduleAtFixedRate(() -> ping(attempt), pingInterval.toMillis(),
                                                      pingInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Event channel connected");
    }

    private synchronized void lost(long attempt, String reason) {
        if (attempt != generation || state.isTerminal() || state == ConnectionState.DISCONNECTED) {
            return;
        }
        cancel(pingTimer);
        pingTimer = null;
        connection = null;
        transition(ConnectionState.DISCONNECTED);
        var delay = nextDelay;
        nextDelay = backoff.next(delay);
        log.info("Event channel lost ({}), retrying in {} ms", reason, delay.toMillis());
        retryTimer = scheduler.schedule(this::retry, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void retry() {
        retryTimer = null;
        if (state != ConnectionState.DISCONNECTED) {
            return;
        }
        connect();
    }

    private synchronized void ping(long attempt) {
        if (attempt != generation || state != ConnectionState.CONNECTED || connection == null) {
            return;
        }
        if (!connection.send(codec.encode(ClientMessage.PING))) {
            log.debug("Ping not sent");
        }
    }

    private boolean current(long attempt) {
        synchronized (this) {
            return attempt == generation && state == ConnectionState.CONNECTED;
        }
    }

    private void transition(ConnectionState target) {
        state = state.transitionTo(target);
        try {
            status.accept(target);
        } catch (RuntimeException e) {
            log.warn("Status listener failed", e);
        }
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private class AttemptListener implements EventConnector.Listener {
        private final long attempt;

        AttemptListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen() {
            opened(attempt);
        }

        @Override
        public void onMessage(String text) {
            if (!current(attempt)) {
                return;
            }
            ChangeEvent event;
            try {
                event = codec.decodeEvent(text);
            } catch (ProtocolException e) {
                log.warn("Skipping malformed event: {}", e.getMessage());
                return;
            }
            events.accept(event);
        }

        @Override
        public void onClosed(String reason) {
            lost(attempt, reason);
        }

        @Override
        public void onFailure(Throwable cause) {
            lost(attempt, String.valueOf(cause.getMessage()));
        }
    }
}
