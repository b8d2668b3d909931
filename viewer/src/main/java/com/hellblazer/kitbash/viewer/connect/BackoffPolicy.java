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

import java.time.Duration;

/**
 * Bounded exponential reconnect delays.
 *
 * @param initial    first delay, and the delay after every successful connection
 * @param multiplier growth factor between consecutive failures
 * @param max        cap on the delay
 * @author hal.hildebrand
 */
public record BackoffPolicy(Duration initial, double multiplier, Duration max) {

    public BackoffPolicy {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive: " + initial);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1: " + multiplier);
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Maximum delay " + max + " is below the initial delay " + initial);
        }
    }

    /**
     * 1s, 2s, 4s, 8s, 8s, ...
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(8));
    }

    /**
     * @param current the delay just used
     * @return the delay to use after another consecutive failure
     */
    public Duration next(Duration current) {
        var grown = (long) Math.min(current.toMillis() * multiplier, (double) max.toMillis());
        return Duration.ofMillis(Math.max(grown, initial.toMillis()));
    }
}
