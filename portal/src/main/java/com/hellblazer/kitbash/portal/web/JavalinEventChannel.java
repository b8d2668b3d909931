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
package com.hellblazer.kitbash.portal.web;

import com.hellblazer.kitbash.portal.hub.EventChannel;
import io.javalin.websocket.WsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link EventChannel} over a Javalin WebSocket session.
 *
 * @author hal.hildebrand
 */
class JavalinEventChannel implements EventChannel {
    private static final Logger log = LoggerFactory.getLogger(JavalinEventChannel.class);

    private final WsContext context;
    private final String    id;
    private volatile boolean open = true;
    private final AtomicBoolean closed = new AtomicBoolean();

    JavalinEventChannel(WsContext context) {
        this.context = context;
        this.id = context.sessionId();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) throws IOException {
        if (!open) {
            throw new IOException("Connection " + id + " is closed");
        }
        try {
            context.send(text);
        } catch (Exception e) {
            open = false;
            throw new IOException("Send to " + id + " failed", e);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Mark the transport closed without touching the session, for close notifications from the peer.
     */
    void peerClosed() {
        open = false;
        closed.set(true);
    }

    @Override
    public void close() {
        open = false;
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            context.closeSession();
        } catch (Exception e) {
            log.debug("Error closing session {}: {}", id, e.getMessage());
        }
    }
}
