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

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * {@link EventConnector} over an OkHttp WebSocket.
 *
 * @author hal.hildebrand
 */
public class OkHttpEventConnector implements EventConnector {
    private static final Logger log = LoggerFactory.getLogger(OkHttpEventConnector.class);

    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient client;
    private final URI          eventsUri;

    /**
     * @param client    shared HTTP client
     * @param eventsUri WebSocket address of the event stream, e.g. {@code ws://127.0.0.1:8080/events}
     */
    public OkHttpEventConnector(OkHttpClient client, URI eventsUri) {
        this.client = Objects.requireNonNull(client);
        this.eventsUri = Objects.requireNonNull(eventsUri);
    }

    public URI eventsUri() {
        return eventsUri;
    }

    @Override
    public Connection connect(Listener listener) {
        log.debug("Connecting to {}", eventsUri);
        var request = new Request.Builder().url(eventsUri.toString()).build();
        var socket = client.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                listener.onOpen();
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                listener.onMessage(text);
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(NORMAL_CLOSURE, null);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                listener.onClosed(code + " " + reason);
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                listener.onFailure(t);
            }
        });
        return new Connection() {
            @Override
            public boolean send(String text) {
                return socket.send(text);
            }

            @Override
            public void close() {
                socket.close(NORMAL_CLOSURE, "viewer closed");
            }
        };
    }
}
