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
package com.hellblazer.kitbash.common;

/**
 * Messages a viewer sends back over the event channel.
 *
 * @author hal.hildebrand
 */
public enum ClientMessage {
    /** Liveness only, carries no state. */
    PING("ping"),
    /** Requests a graceful close of the connection. */
    QUIT("quit");

    private final String type;

    ClientMessage(String type) {
        this.type = type;
    }

    public String type() {
        return type;
    }

    /**
     * @param type wire discriminator
     * @return the matching message, or null if the type is unknown
     */
    public static ClientMessage fromType(String type) {
        for (var message : values()) {
            if (message.type.equals(type)) {
                return message;
            }
        }
        return null;
    }
}
