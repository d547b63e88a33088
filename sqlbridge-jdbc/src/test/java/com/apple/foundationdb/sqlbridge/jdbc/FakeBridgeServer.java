/*
 * FakeBridgeServer.java
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
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.FrameCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A bridge listening on a loopback port, for tests. Each request is answered on a worker thread of its own, so
 * responses on one socket come back in whatever order the work finishes. Requests go to a {@link FakeBridgeEngine}
 * unless a test installs a {@link Handler} of its own.
 */
final class FakeBridgeServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FakeBridgeServer.class);

    /**
     * Answers one request.
     */
    @FunctionalInterface
    interface Handler {
        /**
         * Answer a request.
         *
         * @param request the request
         * @return the response, or {@code null} to never answer
         * @throws InterruptedException if the server is shutting down
         */
        @Nullable
        Response handle(@Nonnull Request request) throws InterruptedException;
    }

    @Nonnull
    private final ServerSocket serverSocket;
    @Nonnull
    private final FakeBridgeEngine engine;
    @Nonnull
    private volatile Handler handler;
    private final ExecutorService workers = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("fake-bridge-worker-%d")
            .setDaemon(true)
            .build());
    private final Set<Socket> sockets = ConcurrentHashMap.newKeySet();
    private final AtomicInteger accepted = new AtomicInteger();
    private volatile boolean closed;

    private FakeBridgeServer(@Nonnull ServerSocket serverSocket) {
        this.serverSocket = serverSocket;
        this.engine = new FakeBridgeEngine();
        this.engine.setActiveConnections(sockets::size);
        this.handler = engine::handle;
    }

    /**
     * Listen on an ephemeral loopback port and start accepting connections.
     *
     * @return the running server
     * @throws IOException if no port could be bound
     */
    @Nonnull
    static FakeBridgeServer start() throws IOException {
        final FakeBridgeServer server = new FakeBridgeServer(new ServerSocket(0, 128, InetAddress.getLoopbackAddress()));
        final Thread acceptor = new ThreadFactoryBuilder()
                .setNameFormat("fake-bridge-acceptor-%d")
                .setDaemon(true)
                .build()
                .newThread(server::acceptLoop);
        acceptor.start();
        return server;
    }

    int getPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * A JDBC URL for this server.
     *
     * @param parameters the query string, without the leading {@code ?}, or empty
     * @return the URL
     */
    @Nonnull
    String url(@Nonnull String parameters) {
        return BridgeURI.JDBC_BASE_URL + "127.0.0.1:" + getPort() + "/" + (parameters.isEmpty() ? "" : "?" + parameters);
    }

    @Nonnull
    String url() {
        return url("");
    }

    @Nonnull
    FakeBridgeEngine getEngine() {
        return engine;
    }

    /**
     * Route requests to {@code handler} instead of the engine.
     *
     * @param handler the handler, or {@code null} to go back to the engine
     */
    void setHandler(@Nullable Handler handler) {
        this.handler = handler == null ? engine::handle : handler;
    }

    int activeConnections() {
        return sockets.size();
    }

    int acceptedConnections() {
        return accepted.get();
    }

    private void acceptLoop() {
        while (!closed) {
            final Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!closed) {
                    logger.warn(KeyValueLogMessage.of("Fake bridge failed to accept", LogMessageKeys.MESSAGE, e.getMessage()), e);
                }
                return;
            }
            accepted.incrementAndGet();
            sockets.add(socket);
            workers.execute(() -> serve(socket));
        }
    }

    private void serve(@Nonnull Socket socket) {
        final Object writeLock = new Object();
        try {
            socket.setTcpNoDelay(true);
            final FrameCodec codec = new FrameCodec(socket.getInputStream(), socket.getOutputStream());
            Request request;
            while ((request = codec.readFrame(Request.parser())) != null) {
                final Request received = request;
                workers.execute(() -> respond(codec, writeLock, received));
            }
        } catch (SocketException e) {
            logger.debug(KeyValueLogMessage.of("Fake bridge socket closed", LogMessageKeys.MESSAGE, e.getMessage()));
        } catch (IOException | BridgeException e) {
            logger.warn(KeyValueLogMessage.of("Fake bridge failed to read", LogMessageKeys.MESSAGE, e.getMessage()), e);
        } finally {
            sockets.remove(socket);
            closeSocket(socket);
        }
    }

    private void respond(@Nonnull FrameCodec codec, @Nonnull Object writeLock, @Nonnull Request request) {
        try {
            final Response response = handler.handle(request);
            if (response == null) {
                return;
            }
            synchronized (writeLock) {
                codec.writeFrame(response);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            logger.debug(KeyValueLogMessage.of("Fake bridge could not answer",
                    LogMessageKeys.CORRELATION_ID, request.getCorrelationId(),
                    LogMessageKeys.MESSAGE, e.getMessage()));
        }
    }

    /**
     * Close every client socket, as if the bridge had crashed, while staying up for new connections.
     */
    void dropConnections() {
        for (Socket socket : sockets) {
            closeSocket(socket);
        }
    }

    private static void closeSocket(@Nonnull Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug(KeyValueLogMessage.of("Fake bridge failed to close socket", LogMessageKeys.MESSAGE, e.getMessage()));
        }
    }

    @Override
    public void close() throws IOException, InterruptedException {
        closed = true;
        serverSocket.close();
        dropConnections();
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
    }
}
