/*
 * WireConnectionTest.java
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
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Acknowledgement;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

class WireConnectionTest {
    private FakeBridgeServer server;
    private WireConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeBridgeServer.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (connection != null) {
            connection.close();
        }
        server.close();
    }

    private WireConnection open(DeadlineManager deadlines) throws BridgeException {
        connection = WireConnection.open(ConnectionConfig.parse(server.url(), null), deadlines);
        return connection;
    }

    private WireConnection open() throws BridgeException {
        return open(new DeadlineManager(Duration.ZERO, Duration.ofSeconds(10)));
    }

    private static Request.Builder sleep(int seconds) {
        return BridgeCodec.query(null, "select sleep(" + seconds + ")", List.of(), 0, 10);
    }

    @Test
    void roundTripMatchesRequestToResponse() throws Exception {
        WireConnection wire = open();
        Response response = wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE);
        Assertions.assertThat(response.getPayloadCase()).isEqualTo(Response.PayloadCase.STATUS);
        Assertions.assertThat(response.getStatus().getVersion()).isEqualTo(FakeBridgeEngine.VERSION);
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.BUSY);
        Assertions.assertThat(wire.pendingCount()).isZero();
    }

    @Test
    void outOfOrderResponsesReachTheirCallers() throws Exception {
        WireConnection wire = open();
        CompletableFuture<Response> slow = CompletableFuture.supplyAsync(() -> roundTrip(wire, sleep(1)));
        BridgeAssertions.awaitCondition("the slow request is in flight", () -> wire.pendingCount() == 1);
        Response fast = wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE);
        Assertions.assertThat(fast.getPayloadCase()).isEqualTo(Response.PayloadCase.STATUS);
        Assertions.assertThat(slow).isNotDone();
        Response slowResponse = slow.get(10, TimeUnit.SECONDS);
        Assertions.assertThat(slowResponse.getPayloadCase()).isEqualTo(Response.PayloadCase.QUERY);
        Assertions.assertThat(slowResponse.getQuery().getFirstPage().getRow(0).getColumn(0).getLong()).isEqualTo(1L);
        Assertions.assertThat(wire.isHealthy()).isTrue();
    }

    @Test
    void manyConcurrentRequestsShareOneSocket() throws Exception {
        WireConnection wire = open();
        List<CompletableFuture<Response>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(CompletableFuture.supplyAsync(() -> roundTrip(wire, BridgeCodec.status())));
        }
        for (CompletableFuture<Response> future : futures) {
            Assertions.assertThat(future.get(10, TimeUnit.SECONDS).getPayloadCase()).isEqualTo(Response.PayloadCase.STATUS);
        }
        Assertions.assertThat(server.acceptedConnections()).isEqualTo(1);
    }

    @Test
    void unknownCorrelationIdBreaksTheConnection() throws Exception {
        server.setHandler(request -> server.getEngine().handle(request).toBuilder()
                .setCorrelationId(request.getCorrelationId() + 1000)
                .build());
        WireConnection wire = open();
        BridgeAssertions.assertBridgeFailure(ErrorCode.PROTOCOL_VIOLATION,
                () -> wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.BROKEN);
        Assertions.assertThat(wire.isHealthy()).isFalse();
        BridgeAssertions.assertBridgeFailure(ErrorCode.CONNECTION_FAILURE,
                () -> wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
    }

    @Test
    void wrongResponseKindBreaksTheConnection() throws Exception {
        server.setHandler(request -> Response.newBuilder()
                .setCorrelationId(request.getCorrelationId())
                .setAcknowledgement(Acknowledgement.getDefaultInstance())
                .build());
        WireConnection wire = open();
        BridgeAssertions.assertBridgeFailure(ErrorCode.PROTOCOL_VIOLATION,
                () -> wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.BROKEN);
    }

    @Test
    void responseNeverIssuedIsRejected() throws Exception {
        WireConnection wire = open();
        wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE);
        Response stray = Response.newBuilder()
                .setCorrelationId(99)
                .setAcknowledgement(Acknowledgement.getDefaultInstance())
                .build();
        BridgeAssertions.assertBridgeFailure(ErrorCode.PROTOCOL_VIOLATION, () -> wire.dispatch(stray));
    }

    @Test
    void lateResponseIsDropped() throws Exception {
        WireConnection wire = open();
        wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE);
        // correlation id 1 was issued and already answered
        wire.dispatch(Response.newBuilder()
                .setCorrelationId(1)
                .setAcknowledgement(Acknowledgement.getDefaultInstance())
                .build());
        Assertions.assertThat(wire.isHealthy()).isTrue();
    }

    @Test
    void expiredReadDeadlineDiscardsTheConnection() throws Exception {
        server.setHandler(request -> null);
        WireConnection wire = open(new DeadlineManager(Duration.ZERO, Duration.ofMillis(200)));
        BridgeAssertions.assertBridgeFailure(ErrorCode.READ_DEADLINE_EXCEEDED,
                () -> wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.BROKEN);
        Assertions.assertThat(wire.pendingCount()).isZero();
    }

    @Test
    void executionTimeoutKeepsTheConnection() throws Exception {
        WireConnection wire = open(new DeadlineManager(Duration.ZERO, Duration.ZERO));
        // the bridge enforces a one second budget; the client gives up at the same time
        BridgeAssertions.assertBridgeFailure(ErrorCode.EXECUTION_TIMEOUT,
                () -> wire.roundTrip(sleep(3), Duration.ofSeconds(1), ResponseValidator.NONE));
        Assertions.assertThat(wire.isHealthy()).isTrue();
        Assertions.assertThat(wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE).hasStatus()).isTrue();
    }

    @Test
    void sqlErrorLeavesTheConnectionUsable() throws Exception {
        WireConnection wire = open();
        BridgeException e = BridgeAssertions.assertBridgeFailure(ErrorCode.UNKNOWN,
                () -> wire.roundTrip(BridgeCodec.execute(null, "frobnicate everything", List.of(), 0), null,
                        ResponseValidator.NONE));
        Assertions.assertThat(e.getSqlState()).isEqualTo("42000");
        Assertions.assertThat(wire.isHealthy()).isTrue();
        Assertions.assertThat(wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE).hasStatus()).isTrue();
    }

    @Test
    void droppedSocketFailsPendingRequests() throws Exception {
        server.setHandler(request -> null);
        WireConnection wire = open(new DeadlineManager(Duration.ZERO, Duration.ZERO));
        CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> roundTrip(wire, BridgeCodec.status()));
        BridgeAssertions.awaitCondition("the request is in flight", () -> wire.pendingCount() == 1);
        server.dropConnections();
        BridgeAssertions.assertBridgeFailure(ErrorCode.CONNECTION_FAILURE, () -> join(waiting));
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.BROKEN);
    }

    @Test
    void closeFailsPendingRequests() throws Exception {
        server.setHandler(request -> null);
        WireConnection wire = open(new DeadlineManager(Duration.ZERO, Duration.ZERO));
        CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> roundTrip(wire, BridgeCodec.status()));
        BridgeAssertions.awaitCondition("the request is in flight", () -> wire.pendingCount() == 1);
        wire.close();
        BridgeAssertions.assertBridgeFailure(ErrorCode.CONNECTION_CLOSED, () -> join(waiting));
        Assertions.assertThat(wire.getState()).isEqualTo(WireConnection.State.CLOSED);
        BridgeAssertions.assertBridgeFailure(ErrorCode.CONNECTION_CLOSED,
                () -> wire.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
    }

    @Test
    void unreachableBridgeFailsToOpen() throws Exception {
        ConnectionConfig config = ConnectionConfig.parse(server.url(), null);
        server.close();
        BridgeAssertions.assertBridgeFailure(ErrorCode.UNABLE_TO_ESTABLISH_CONNECTION,
                () -> WireConnection.open(config, DeadlineManager.forConfig(config)));
    }

    private static Response roundTrip(WireConnection wire, Request.Builder request) {
        try {
            return wire.roundTrip(request, null, ResponseValidator.NONE);
        } catch (BridgeException e) {
            throw new IllegalStateException(e);
        }
    }

    // unwraps the failure roundTrip wrapped
    private static void join(CompletableFuture<?> future) throws Exception {
        try {
            future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw (Exception) e.getCause().getCause();
        }
    }
}
