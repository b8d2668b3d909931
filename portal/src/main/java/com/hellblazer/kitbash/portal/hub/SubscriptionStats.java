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

import com.hellblazer.kitbash.common.ConnectionState;

import java.time.Instant;

/**
 * Point-in-time view of one subscription, reported by {@code /api/info}.
 *
 * @param id         connection id
 * @param state      connection state
 * @param queued     messages waiting for delivery
 * @param delivered  messages sent so far
 * @param overflows  times the queue overflowed and was replaced by a resync
 * @param lastSeen   last time the viewer sent anything
 */
public record SubscriptionStats(String id, ConnectionState state, int queued, long delivered, long overflows,
                                Instant lastSeen) {
}
