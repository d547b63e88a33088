/*
 * ConnectionPool.java
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

import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded pool of {@link WireConnection}s to one bridge endpoint.
 *
 * <p>A fair {@link Semaphore} with one permit per checked out connection bounds the connections in use, and hands
 * permits to blocked callers in arrival order. New connections are only opened when no idle one is left, so the
 * total never exceeds the maximum either. The idle connections sit in a deque guarded by a lock that is only
 * held to push or pop; sockets are opened and closed outside it.</p>
 */
public final class ConnectionPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    @Nonnull
    private final ConnectionConfig config;
    @Nonnull
    private final DeadlineManager deadlines;
    private final int maxConnections;
    private final Semaphore permits;
    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final Deque<WireConnection> idle = new ArrayDeque<>();
    @GuardedBy("lock")
    private boolean closed;
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public ConnectionPool(@Nonnull ConnectionConfig config, @Nonnull DeadlineManager deadlines) {
        this.config = config;
        this.deadlines = deadlines;
        this.maxConnections = config.getMaxConnections();
        this.permits = new Semaphore(maxConnections, true);
    }

    @Nonnull
    public DeadlineManager getDeadlines() {
        return deadlines;
    }

    /**
     * Take a connection for exclusive use. Reuses the most recently returned idle connection, opens a new one if
     * there is none, and waits if the pool is at its maximum.
     *
     * @return a {@link WireConnection.State#BUSY} connection, to be given back with {@link #checkin(WireConnection)}
     * @throws BridgeException with {@link ErrorCode#POOL_EXHAUSTED} if no connection freed up within the checkout
     *     timeout, {@link ErrorCode#CONNECTION_CLOSED} if the pool is closed, or the failure to open a new one
     */
    @Nonnull
    public WireConnection checkout() throws BridgeException {
        acquirePermit();
        try {
            WireConnection connection;
            while ((connection = pollIdle()) != null) {
                if (connection.markBusy()) {
                    return connection;
                }
                // broke while idle
                discard(connection);
            }
            connection = WireConnection.open(config, deadlines);
            created.incrementAndGet();
            return connection;
        } catch (BridgeException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    private void acquirePermit() throws BridgeException {
        checkOpen();
        final Duration checkoutTimeout = config.getCheckoutTimeout();
        try {
            if (checkoutTimeout.isZero()) {
                permits.acquire();
            } else if (!permits.tryAcquire(checkoutTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                logger.warn(KeyValueLogMessage.of("Connection pool exhausted",
                        LogMessageKeys.ENDPOINT, config.getEndpoint(),
                        LogMessageKeys.POOL_MAX, maxConnections,
                        LogMessageKeys.CHECKOUT_TIMEOUT_MILLIS, checkoutTimeout.toMillis()));
                throw new BridgeException("No connection to " + config.getEndpoint() + " became available within " +
                        checkoutTimeout.getSeconds() + "s (maxConnections=" + maxConnections + ")", ErrorCode.POOL_EXHAUSTED);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException("Interrupted while waiting for a connection", ErrorCode.OPERATION_CANCELED, e);
        }
    }

    private WireConnection pollIdle() throws BridgeException {
        lock.lock();
        try {
            if (closed) {
                throw new BridgeException("Connection pool is closed", ErrorCode.CONNECTION_CLOSED);
            }
            return idle.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Give back a connection taken with {@link #checkout()}. A healthy connection becomes idle; a broken one is
     * closed, freeing its slot for a new connection.
     *
     * @param connection the connection
     */
    public void checkin(@Nonnull WireConnection connection) {
        if (connection.getState() == WireConnection.State.IDLE) {
            throw new IllegalStateException("Connection " + connection.getId() + " checked in twice");
        }
        try {
            if (connection.markIdle()) {
                lock.lock();
                try {
                    if (!closed) {
                        idle.addFirst(connection);
                        return;
                    }
                } finally {
                    lock.unlock();
                }
            }
            discard(connection);
        } finally {
            permits.release();
        }
    }

    private void discard(@Nonnull WireConnection connection) {
        discarded.incrementAndGet();
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("Discarding pooled connection",
                    LogMessageKeys.CONNECTION_ID, connection.getId(),
                    LogMessageKeys.CONNECTION_STATE, connection.getState()));
        }
        connection.close();
    }

    private void checkOpen() throws BridgeException {
        lock.lock();
        try {
            if (closed) {
                throw new BridgeException("Connection pool is closed", ErrorCode.CONNECTION_CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int getIdleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Connections currently checked out.
     *
     * @return the busy count
     */
    public int getBusyCount() {
        return maxConnections - permits.availablePermits();
    }

    public int getTotalCount() {
        return getBusyCount() + getIdleCount();
    }

    public long getCreatedCount() {
        return created.get();
    }

    public long getDiscardedCount() {
        return discarded.get();
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * Close every idle connection and refuse further checkouts. Connections still checked out are closed when
     * they come back.
     */
    @Override
    public void close() {
        final Deque<WireConnection> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayDeque<>(idle);
            idle.clear();
        } finally {
            lock.unlock();
        }
        for (WireConnection connection : toClose) {
            connection.close();
        }
        logger.debug(KeyValueLogMessage.of("Closed connection pool",
                LogMessageKeys.ENDPOINT, config.getEndpoint(),
                LogMessageKeys.POOL_IDLE, toClose.size(),
                LogMessageKeys.POOL_TOTAL, created.get()));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("endpoint", config.getEndpoint())
                .add("max", maxConnections)
                .add("idle", getIdleCount())
                .add("busy", getBusyCount())
                .toString();
    }
}
