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
package com.hellblazer.kitbash.common.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.kitbash.common.ChangeEvent;
import com.hellblazer.kitbash.common.ClientMessage;
import com.hellblazer.kitbash.common.FileEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the {@code /events} channel.
 * <p>
 * Server to viewer:
 * <pre>
 * {"type":"added"|"modified","name":"cube.obj","mtime":1718000000000,"size":1024,"version":3}
 * {"type":"removed","name":"cube.obj","version":4}
 * {"type":"resync_all","epoch":1718000000000,"files":[{"name":..,"mtime":..,"size":..,"version":..}, ...]}
 * </pre>
 * Viewer to server: {@code {"type":"ping"}} and {@code {"type":"quit"}}.
 * <p>
 * Entries carry an optional {@code digest} field when the server computes content digests. Unknown fields are
 * ignored so either side may add fields without breaking the other. Instances are thread safe.
 *
 * @author hal.hildebrand
 */
public class EventCodec {

    private static final String TYPE    = "type";
    private static final String NAME    = "name";
    private static final String MTIME   = "mtime";
    private static final String SIZE    = "size";
    private static final String VERSION = "version";
    private static final String DIGEST  = "digest";
    private static final String FILES   = "files";
    private static final String EPOCH   = "epoch";

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(new ObjectMapper());
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode an event to its JSON text form.
     */
    public String encode(ChangeEvent event) {
        return write(toNode(event));
    }

    /**
     * Encode a viewer message to its JSON text form.
     */
    public String encode(ClientMessage message) {
        var node = objectMapper.createObjectNode();
        node.put(TYPE, message.type());
        return write(node);
    }

    /**
     * Build the JSON tree of an event.
     */
    public ObjectNode toNode(ChangeEvent event) {
        var node = objectMapper.createObjectNode();
        node.put(TYPE, event.type());
        if (event instanceof ChangeEvent.Added added) {
            writeEntry(node, added.entry());
        } else if (event instanceof ChangeEvent.Modified modified) {
            writeEntry(node, modified.entry());
        } else if (event instanceof ChangeEvent.Removed removed) {
            node.put(NAME, removed.name());
            node.put(VERSION, removed.version());
        } else if (event instanceof ChangeEvent.ResyncAll resync) {
            if (resync.epoch() != 0) {
                node.put(EPOCH, resync.epoch());
            }
            node.set(FILES, toNodes(resync.files()));
        }
        return node;
    }

    /**
     * Build a JSON array of entries in the given order.
     */
    public ArrayNode toNodes(List<FileEntry> entries) {
        var array = objectMapper.createArrayNode();
        for (var entry : entries) {
            writeEntry(array.addObject(), entry);
        }
        return array;
    }

    /**
     * Decode a server event.
     *
     * @throws ProtocolException if the text is not a well formed event
     */
    public ChangeEvent decodeEvent(String text) {
        var node = read(text);
        var type = requireText(node, TYPE);
        try {
            return switch (type) {
                case ChangeEvent.Added.TYPE -> new ChangeEvent.Added(readEntry(node));
                case ChangeEvent.Modified.TYPE -> new ChangeEvent.Modified(readEntry(node));
                case ChangeEvent.Removed.TYPE -> new ChangeEvent.Removed(requireText(node, NAME),
                                                                         requireLong(node, VERSION));
                case ChangeEvent.ResyncAll.TYPE -> new ChangeEvent.ResyncAll(readEntries(node),
                                                                           node.has(EPOCH) ? requireLong(node, EPOCH)
                                                                                           : 0);
                default -> throw new ProtocolException("Unknown event type: " + type);
            };
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + type + " event: " + e.getMessage(), e);
        }
    }

    /**
     * Decode a viewer message.
     *
     * @throws ProtocolException if the text is not a known viewer message
     */
    public ClientMessage decodeClientMessage(String text) {
        var type = requireText(read(text), TYPE);
        var message = ClientMessage.fromType(type);
        if (message == null) {
            throw new ProtocolException("Unknown client message type: " + type);
        }
        return message;
    }

    private List<FileEntry> readEntries(JsonNode node) {
        var files = node.get(FILES);
        if (files == null || !files.isArray()) {
            throw new ProtocolException("Missing array field: " + FILES);
        }
        var entries = new ArrayList<FileEntry>(files.size());
        for (var file : files) {
            entries.add(readEntry(file));
        }
        return entries;
    }

    private FileEntry readEntry(JsonNode node) {
        var digest = node.get(DIGEST);
        return new FileEntry(requireText(node, NAME), requireLong(node, MTIME), requireLong(node, SIZE),
                             requireLong(node, VERSION), digest == null || digest.isNull() ? null : digest.asText());
    }

    private void writeEntry(ObjectNode node, FileEntry entry) {
        node.put(NAME, entry.name());
        node.put(MTIME, entry.mtime());
        node.put(SIZE, entry.size());
        node.put(VERSION, entry.version());
        if (entry.hasDigest()) {
            node.put(DIGEST, entry.contentDigest());
        }
    }

    private JsonNode read(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty message");
        }
        try {
            var node = objectMapper.readTree(text);
            if (node == null || !node.isObject()) {
                throw new ProtocolException("Message is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // tree nodes always serialize
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    private static String requireText(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ProtocolException("Missing text field: " + field);
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new ProtocolException("Missing integer field: " + field);
        }
        return value.asLong();
    }
}
