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
 * Lifecycle of one event-channel connection, tracked by the server per subscriber and mirrored by the viewer.
 * <p>
 * Transition rules:
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED
 *      ↑              |            |
 *      +--------------+------------+   (failed attempt, loss)
 * any non-terminal state → DRAINING     (explicit shutdown, terminal)
 * </pre>
 *
 * @author hal.hildebrand
 */
public enum ConnectionState {
    CONNECTING, CONNECTED, DRAINING, DISCONNECTED;

    /**
     * Check whether moving from this state to {@code target} is legal.
     *
     * @param target requested next state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(ConnectionState target) {
        return switch (this) {
            case DISCONNECTED -> target == CONNECTING || target == DRAINING;
            case CONNECTING -> target == CONNECTED || target == DISCONNECTED || target == DRAINING;
            case CONNECTED -> target == DISCONNECTED || target == DRAINING;
            case DRAINING -> false;
        };
    }

    /**
     * Validate and perform a transition.
     *
     * @param target requested next state
     * @return {@code target}
     * @throws IllegalStateException if the transition is not allowed
     */
    public ConnectionState transitionTo(ConnectionState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("Illegal connection transition " + this + " -> " + target);
        }
        return target;
    }

    public boolean isTerminal() {
        return this == DRAINING;
    }
}
