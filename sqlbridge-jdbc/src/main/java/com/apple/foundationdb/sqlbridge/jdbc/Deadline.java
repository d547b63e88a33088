/*
 * Deadline.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.sqlbridge.jdbc;

import com.google.common.base.Ticker;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * A point in time on a monotonic {@link Ticker}, or no point at all.
 */
final class Deadline {
    static final Deadline NONE = new Deadline(null, Long.MAX_VALUE);

    @Nullable
    private final Ticker ticker;
    private final long expiresAtNanos;

    private Deadline(@Nullable Ticker ticker, long expiresAtNanos) {
        this.ticker = ticker;
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * A deadline the given duration from now.
     *
     * @param duration how long until the deadline; zero or negative means no deadline
     * @param ticker the clock
     * @return the deadline, or {@link #NONE}
     */
    @Nonnull
    static Deadline after(@Nonnull Duration duration, @Nonnull Ticker ticker) {
        if (duration.isZero() || duration.isNegative()) {
            return NONE;
        }
        return new Deadline(ticker, ticker.read() + duration.toNanos());
    }

    boolean isBounded() {
        return ticker != null;
    }

    long remainingNanos() {
        if (ticker == null) {
            return Long.MAX_VALUE;
        }
        return expiresAtNanos - ticker.read();
    }

    boolean isExpired() {
        return remainingNanos() <= 0;
    }

    /**
     * Whether this deadline comes strictly before another. An unbounded deadline comes before nothing.
     *
     * @param other the deadline to compare with
     * @return {@code true} if this one expires first
     */
    boolean isBefore(@Nonnull Deadline other) {
        if (!isBounded()) {
            return false;
        }
        if (!other.isBounded()) {
            return true;
        }
        // nanoTime values may wrap, so compare the difference
        return expiresAtNanos - other.expiresAtNanos < 0;
    }

    @Override
    public String toString() {
        return isBounded() ? "Deadline(" + Duration.ofNanos(remainingNanos()) + ")" : "Deadline(none)";
    }
}
