/*
 * DeadlineManager.java
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
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enforces the two timers of every request.
 *
 * <ul>
 *     <li>The <em>execution timeout</em> starts when the request is created and bounds the time the bridge may
 *     spend on it. Its expiry fails only that request.</li>
 *     <li>The <em>read deadline</em> starts once the request is on the wire and bounds the wait for the response
 *     bytes. Its expiry fails the request with {@link ErrorCode#READ_DEADLINE_EXCEEDED}, which tells the owning
 *     connection its stream can no longer be trusted.</li>
 * </ul>
 *
 * <p>Whichever expires first decides the outcome; on a tie the execution timeout wins. A request resolved by its
 * response or by its connection before a timer fires is never failed by the timer.</p>
 */
public final class DeadlineManager {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineManager.class);

    @Nonnull
    private final Duration executionTimeout;
    @Nonnull
    private final Duration readDeadline;
    @Nonnull
    private final Ticker ticker;

    public DeadlineManager(@Nonnull Duration executionTimeout, @Nonnull Duration readDeadline) {
        this(executionTimeout, readDeadline, Ticker.systemTicker());
    }

    @VisibleForTesting
    DeadlineManager(@Nonnull Duration executionTimeout, @Nonnull Duration readDeadline, @Nonnull Ticker ticker) {
        this.executionTimeout = executionTimeout;
        this.readDeadline = readDeadline;
        this.ticker = ticker;
    }

    @Nonnull
    public static DeadlineManager forConfig(@Nonnull ConnectionConfig config) {
        return new DeadlineManager(config.getExecutionTimeout(), config.getReadDeadline());
    }

    @Nonnull
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    @Nonnull
    public Duration getReadDeadline() {
        return readDeadline;
    }

    /**
     * Create the pending state of a request, starting its execution timeout.
     *
     * @param correlationId the id of the request
     * @param kind the kind of request
     * @param requestTimeout execution timeout for this request, or {@code null} to use the configured one
     * @return the pending request
     */
    @Nonnull
    PendingRequest newPendingRequest(long correlationId, @Nonnull Request.PayloadCase kind, @Nullable Duration requestTimeout) {
        return new PendingRequest(correlationId, kind, Deadline.after(effectiveTimeout(requestTimeout), ticker));
    }

    @Nonnull
    Duration effectiveTimeout(@Nullable Duration requestTimeout) {
        return requestTimeout == null ? executionTimeout : requestTimeout;
    }

    /**
     * Wait for a request that was just written to the wire, starting its read deadline.
     *
     * @param pending the request
     * @return its response
     * @throws BridgeException the request failed, was interrupted, or one of its timers expired first
     */
    @Nonnull
    Response await(@Nonnull PendingRequest pending) throws BridgeException {
        final Deadline readBy = Deadline.after(readDeadline, ticker);
        final Deadline executeBy = pending.getExecutionDeadline();
        while (true) {
            final boolean readFirst = readBy.isBefore(executeBy);
            final Deadline next = readFirst ? readBy : executeBy;
            if (next.isBounded() && next.isExpired()) {
                final BridgeException timeout = readFirst ? readDeadlineExceeded(pending) : executionTimedOut(pending);
                if (pending.fail(timeout)) {
                    if (logger.isDebugEnabled()) {
                        logger.debug(KeyValueLogMessage.of("Request timed out",
                                LogMessageKeys.CORRELATION_ID, pending.getCorrelationId(),
                                LogMessageKeys.REQUEST_KIND, pending.getKind(),
                                LogMessageKeys.ERROR_CODE, timeout.getErrorCode()));
                    }
                    throw timeout;
                }
                // resolved while the timer fired
                return collect(pending);
            }
            final Response response = waitUntil(pending, next);
            if (response != null) {
                return response;
            }
        }
    }

    @Nullable
    private static Response waitUntil(@Nonnull PendingRequest pending, @Nonnull Deadline deadline) throws BridgeException {
        try {
            if (!deadline.isBounded()) {
                return pending.getResult().get();
            }
            return pending.getResult().get(Math.max(deadline.remainingNanos(), 0L), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            return null;
        } catch (ExecutionException e) {
            throw BridgeException.convert(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final BridgeException canceled = new BridgeException("Interrupted while waiting for the bridge",
                    ErrorCode.OPERATION_CANCELED, e);
            if (pending.fail(canceled)) {
                throw canceled;
            }
            return collect(pending);
        }
    }

    @Nonnull
    private static Response collect(@Nonnull PendingRequest pending) throws BridgeException {
        try {
            return pending.getResult().join();
        } catch (CompletionException e) {
            throw BridgeException.convert(e.getCause());
        }
    }

    @Nonnull
    private BridgeException executionTimedOut(@Nonnull PendingRequest pending) {
        return new BridgeException("Request " + pending.getKind() + " exceeded its execution timeout",
                ErrorCode.EXECUTION_TIMEOUT);
    }

    @Nonnull
    private BridgeException readDeadlineExceeded(@Nonnull PendingRequest pending) {
        return new BridgeException("No response to " + pending.getKind() + " within the read deadline of " +
                readDeadline.getSeconds() + "s", ErrorCode.READ_DEADLINE_EXCEEDED);
    }
}
