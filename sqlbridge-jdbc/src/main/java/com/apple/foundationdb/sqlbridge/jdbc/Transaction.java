/*
 * Transaction.java
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
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A bridge transaction, pinned to one pooled connection from begin until commit or rollback.
 *
 * <p>Any number of threads may send requests on a transaction at once; they share the pinned socket and are told
 * apart by correlation id. Commit and rollback wait for those requests to finish, and once either has run every
 * further use fails with {@link ErrorCode#TRANSACTION_INACTIVE}.</p>
 */
final class Transaction implements RequestRoute {
    private static final Logger logger = LoggerFactory.getLogger(Transaction.class);

    enum State {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    @Nonnull
    private final ConnectionPool pool;
    @Nonnull
    private final WireConnection pinned;
    private final long transactionId;
    // requests hold the read lock, commit and rollback the write lock
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile State state = State.ACTIVE;

    private Transaction(@Nonnull ConnectionPool pool, @Nonnull WireConnection pinned, long transactionId) {
        this.pool = pool;
        this.pinned = pinned;
        this.transactionId = transactionId;
    }

    /**
     * Check out a connection and begin a transaction on it.
     *
     * @param pool the pool to take the connection from
     * @param requestTimeout execution timeout for the begin request, or {@code null} for the configured one
     * @return the active transaction
     * @throws BridgeException if no connection could be had or the bridge refused to begin
     */
    @Nonnull
    static Transaction begin(@Nonnull ConnectionPool pool, @Nullable Duration requestTimeout) throws BridgeException {
        final WireConnection connection = pool.checkout();
        try {
            final Response response = connection.roundTrip(BridgeCodec.begin(), requestTimeout, ResponseValidator.NONE);
            final Transaction transaction = new Transaction(pool, connection, response.getBegin().getTransactionId());
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Began transaction",
                        LogMessageKeys.TRANSACTION_ID, transaction.transactionId,
                        LogMessageKeys.CONNECTION_ID, connection.getId()));
            }
            return transaction;
        } catch (BridgeException e) {
            pool.checkin(connection);
            throw e;
        }
    }

    @Nonnull
    @Override
    public Response send(@Nonnull Request.Builder request, @Nullable Duration requestTimeout,
                         @Nonnull ResponseValidator validator) throws BridgeException {
        lock.readLock().lock();
        try {
            checkActive();
            return pinned.roundTrip(request, requestTimeout, validator);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long transactionId() {
        return transactionId;
    }

    @Override
    public boolean isOpen() {
        return state == State.ACTIVE;
    }

    @Nonnull
    State getState() {
        return state;
    }

    @Nonnull
    WireConnection getPinnedConnection() {
        return pinned;
    }

    void commit(@Nullable Duration requestTimeout) throws BridgeException {
        end(true, requestTimeout);
    }

    void rollback(@Nullable Duration requestTimeout) throws BridgeException {
        end(false, requestTimeout);
    }

    /**
     * Commit or roll back, then give the pinned connection back to the pool, which discards it if it broke. A
     * transaction whose commit failed counts as rolled back.
     */
    private void end(boolean commit, @Nullable Duration requestTimeout) throws BridgeException {
        lock.writeLock().lock();
        try {
            checkActive();
            final long start = System.nanoTime();
            try {
                pinned.roundTrip(commit ? BridgeCodec.commit(transactionId) : BridgeCodec.rollback(transactionId),
                        requestTimeout, ResponseValidator.NONE);
                state = commit ? State.COMMITTED : State.ROLLED_BACK;
            } catch (BridgeException e) {
                state = State.ROLLED_BACK;
                throw e;
            } finally {
                pool.checkin(pinned);
                if (logger.isDebugEnabled()) {
                    logger.debug(KeyValueLogMessage.of("Ended transaction",
                            LogMessageKeys.TRANSACTION_ID, transactionId,
                            LogMessageKeys.REQUEST_KIND, commit ? Request.PayloadCase.COMMIT : Request.PayloadCase.ROLLBACK,
                            LogMessageKeys.TRANSACTION_STATE, state,
                            LogMessageKeys.CONNECTION_STATE, pinned.getState(),
                            LogMessageKeys.ELAPSED_MILLIS, (System.nanoTime() - start) / 1_000_000L));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void checkActive() throws BridgeException {
        if (state != State.ACTIVE) {
            throw new BridgeException("Transaction " + transactionId + " is no longer active (" + state + ")",
                    ErrorCode.TRANSACTION_INACTIVE);
        }
    }

    @Override
    public String toString() {
        return "Transaction(" + transactionId + ", " + state + ")";
    }
}
