/*
 * WireConnection.java
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
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorKind;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.FrameCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One TCP socket to the bridge, multiplexed by correlation id.
 *
 * <p>Any number of threads may have requests outstanding on a connection at once. Writes are serialized by a
 * lock; a single reader thread owns the input side and hands every response to the {@link PendingRequest} with
 * the same correlation id, so responses may arrive in any order.</p>
 *
 * <p>A connection is {@link State#IDLE} in the pool or {@link State#BUSY} while a caller holds it. It becomes
 * {@link State#BROKEN} on a socket failure, a protocol violation, or an expired read deadline, after which it
 * accepts no new requests. A socket failure or protocol violation fails every outstanding request at once. An
 * expired read deadline fails only the request that timed out; the others keep waiting and the socket is closed
 * once the last of them resolves.</p>
 */
public final class WireConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WireConnection.class);

    private static final AtomicLong IDS = new AtomicLong();
    private static final ThreadFactory READER_THREADS = new ThreadFactoryBuilder()
            .setNameFormat("sqlbridge-reader-%d")
            .setDaemon(true)
            .build();

    /**
     * Life cycle of a connection.
     */
    public enum State {
        IDLE,
        BUSY,
        BROKEN,
        CLOSED
    }

    private final long id;
    @Nonnull
    private final URI endpoint;
    @Nonnull
    private final Socket socket;
    @Nonnull
    private final FrameCodec codec;
    @Nonnull
    private final DeadlineManager deadlines;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong lastIssued = new AtomicLong();
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.BUSY);

    private WireConnection(@Nonnull URI endpoint, @Nonnull Socket socket, @Nonnull DeadlineManager deadlines) throws IOException {
        this.id = IDS.incrementAndGet();
        this.endpoint = endpoint;
        this.socket = socket;
        this.codec = new FrameCodec(socket.getInputStream(), socket.getOutputStream());
        this.deadlines = deadlines;
    }

    /**
     * Connect to the bridge. The new connection is {@link State#BUSY}, held by the caller.
     *
     * @param config the connection settings; the read deadline, if any, also bounds the connect
     * @param deadlines the timers applied to every request sent on the connection
     * @return the connection
     * @throws BridgeException with {@link ErrorCode#UNABLE_TO_ESTABLISH_CONNECTION} if the bridge cannot be reached
     */
    @Nonnull
    public static WireConnection open(@Nonnull ConnectionConfig config, @Nonnull DeadlineManager deadlines) throws BridgeException {
        final Socket socket = new Socket();
        final WireConnection connection;
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(config.getHost(), config.getPort()),
                    Ints.saturatedCast(deadlines.getReadDeadline().toMillis()));
            connection = new WireConnection(config.getEndpoint(), socket, deadlines);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new BridgeException("Unable to connect to bridge at " + config.getEndpoint() + ": " + e.getMessage(),
                    ErrorCode.UNABLE_TO_ESTABLISH_CONNECTION, e);
        }
        final Thread reader = READER_THREADS.newThread(connection::readLoop);
        reader.start();
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("Opened bridge connection",
                    LogMessageKeys.CONNECTION_ID, connection.id,
                    LogMessageKeys.ENDPOINT, connection.endpoint));
        }
        return connection;
    }

    public long getId() {
        return id;
    }

    @Nonnull
    public URI getEndpoint() {
        return endpoint;
    }

    @Nonnull
    public State getState() {
        return state.get();
    }

    /**
     * Whether the connection can carry new requests.
     *
     * @return {@code true} if idle or busy
     */
    public boolean isHealthy() {
        final State current = state.get();
        return current == State.IDLE || current == State.BUSY;
    }

    public int pendingCount() {
        return pending.size();
    }

    boolean markBusy() {
        return state.compareAndSet(State.IDLE, State.BUSY);
    }

    boolean markIdle() {
        return state.compareAndSet(State.BUSY, State.IDLE);
    }

    /**
     * Send a request and wait for its response.
     *
     * @param builder the request, without correlation id or execution timeout
     * @param requestTimeout execution timeout for this request, or {@code null} for the configured one
     * @param validator further checks on the response
     * @return the response, of the kind the request expects
     * @throws BridgeException the bridge reported an error, the connection failed, or a timer expired
     */
    @Nonnull
    public Response roundTrip(@Nonnull Request.Builder builder, @Nullable Duration requestTimeout,
                              @Nonnull ResponseValidator validator) throws BridgeException {
        checkHealthy();
        final long correlationId = lastIssued.incrementAndGet();
        final Request request = builder
                .setCorrelationId(correlationId)
                .setExecutionTimeoutMillis(deadlines.effectiveTimeout(requestTimeout).toMillis())
                .build();
        final PendingRequest pendingRequest = deadlines.newPendingRequest(correlationId, request.getPayloadCase(), requestTimeout);
        pending.put(correlationId, pendingRequest);
        try {
            // the connection may have failed between the check and the registration
            checkHealthy();
            send(request);
            final Response response = BridgeCodec.checkResponse(request, deadlines.await(pendingRequest));
            validator.check(response);
            return response;
        } catch (BridgeException e) {
            if (e.getErrorCode() == ErrorCode.READ_DEADLINE_EXCEEDED) {
                readDeadlineExpired(pendingRequest);
            } else if (e.getKind() == ErrorKind.PROTOCOL) {
                fail(e);
            }
            throw e;
        } finally {
            pending.remove(correlationId, pendingRequest);
            closeIfDrained();
        }
    }

    private void send(@Nonnull Request request) throws BridgeException {
        writeLock.lock();
        try {
            codec.writeFrame(request);
        } catch (IOException e) {
            final BridgeException failure = new BridgeException("Failed to send to bridge at " + endpoint + ": " +
                    e.getMessage(), ErrorCode.CONNECTION_FAILURE, e);
            fail(failure);
            throw failure;
        } finally {
            writeLock.unlock();
        }
    }

    private void checkHealthy() throws BridgeException {
        final State current = state.get();
        if (current == State.CLOSED) {
            throw new BridgeException("Connection " + id + " is closed", ErrorCode.CONNECTION_CLOSED);
        } else if (current == State.BROKEN) {
            throw new BridgeException("Connection " + id + " to " + endpoint + " is broken", ErrorCode.CONNECTION_FAILURE);
        }
    }

    private void readLoop() {
        try {
            while (true) {
                final Response response = codec.readFrame(Response.parser());
                if (response == null) {
                    fail(new BridgeException("Bridge closed the connection", ErrorCode.CONNECTION_FAILURE));
                    return;
                }
                dispatch(response);
            }
        } catch (IOException e) {
            fail(new BridgeException("Lost connection to bridge at " + endpoint + ": " + e.getMessage(),
                    ErrorCode.CONNECTION_FAILURE, e));
        } catch (BridgeException e) {
            fail(e);
        }
    }

    @VisibleForTesting
    void dispatch(@Nonnull Response response) throws BridgeException {
        final long correlationId = response.getCorrelationId();
        if (correlationId <= 0 || correlationId > lastIssued.get()) {
            throw new BridgeException("Response for correlation id " + correlationId + " that was never issued",
                    ErrorCode.PROTOCOL_VIOLATION);
        }
        final PendingRequest target = pending.get(correlationId);
        if (target == null || !target.complete(response)) {
            logger.info(KeyValueLogMessage.of("Late response dropped",
                    LogMessageKeys.CONNECTION_ID, id,
                    LogMessageKeys.CORRELATION_ID, correlationId,
                    LogMessageKeys.RESPONSE_KIND, response.getPayloadCase()));
        }
    }

    /**
     * Break the connection and fail every outstanding request with the given cause.
     *
     * @param cause why the connection failed
     */
    void fail(@Nonnull BridgeException cause) {
        final State previous = state.getAndUpdate(current -> current == State.CLOSED ? current : State.BROKEN);
        if (previous == State.IDLE || previous == State.BUSY) {
            logger.warn(KeyValueLogMessage.of("Bridge connection broken",
                    LogMessageKeys.CONNECTION_ID, id,
                    LogMessageKeys.ENDPOINT, endpoint,
                    LogMessageKeys.PENDING_REQUESTS, pending.size(),
                    LogMessageKeys.ERROR_CODE, cause.getErrorCode(),
                    LogMessageKeys.MESSAGE, cause.getMessage()));
        }
        for (PendingRequest request : pending.values()) {
            request.fail(new BridgeException(cause.getMessage(), cause.getErrorCode(), cause));
        }
        closeSocket();
    }

    private void readDeadlineExpired(@Nonnull PendingRequest expired) {
        final State previous = state.getAndUpdate(current -> current == State.CLOSED ? current : State.BROKEN);
        if (previous == State.IDLE || previous == State.BUSY) {
            logger.warn(KeyValueLogMessage.of("Read deadline expired, discarding connection",
                    LogMessageKeys.CONNECTION_ID, id,
                    LogMessageKeys.CORRELATION_ID, expired.getCorrelationId(),
                    LogMessageKeys.REQUEST_KIND, expired.getKind(),
                    LogMessageKeys.READ_DEADLINE_MILLIS, deadlines.getReadDeadline().toMillis(),
                    LogMessageKeys.PENDING_REQUESTS, pending.size() - 1));
        }
    }

    private void closeIfDrained() {
        if (state.get() == State.BROKEN && pending.isEmpty()) {
            closeSocket();
        }
    }

    @Override
    public void close() {
        final State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        for (PendingRequest request : pending.values()) {
            request.fail(new BridgeException("Connection " + id + " closed", ErrorCode.CONNECTION_CLOSED));
        }
        closeSocket();
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("Closed bridge connection",
                    LogMessageKeys.CONNECTION_ID, id,
                    LogMessageKeys.CONNECTION_STATE, previous));
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug(KeyValueLogMessage.of("Failed to close socket",
                    LogMessageKeys.CONNECTION_ID, id,
                    LogMessageKeys.MESSAGE, e.getMessage()), e);
        }
    }

    @Override
    public String toString() {
        return "WireConnection(" + id + ", " + endpoint + ", " + state.get() + ")";
    }
}
