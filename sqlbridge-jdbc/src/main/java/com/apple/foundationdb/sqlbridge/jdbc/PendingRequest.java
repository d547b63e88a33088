/*
 * PendingRequest.java
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
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * A request sent on a {@link WireConnection} that has not been resolved yet. It is resolved exactly once: by its
 * response, by the failure of its connection, or by one of its deadlines, whichever comes first.
 */
final class PendingRequest {
    private final long correlationId;
    @Nonnull
    private final Request.PayloadCase kind;
    @Nonnull
    private final Deadline executionDeadline;
    @Nonnull
    private final CompletableFuture<Response> result = new CompletableFuture<>();

    PendingRequest(long correlationId, @Nonnull Request.PayloadCase kind, @Nonnull Deadline executionDeadline) {
        this.correlationId = correlationId;
        this.kind = kind;
        this.executionDeadline = executionDeadline;
    }

    long getCorrelationId() {
        return correlationId;
    }

    @Nonnull
    Request.PayloadCase getKind() {
        return kind;
    }

    @Nonnull
    Deadline getExecutionDeadline() {
        return executionDeadline;
    }

    @Nonnull
    CompletableFuture<Response> getResult() {
        return result;
    }

    /**
     * Resolve with a response.
     *
     * @param response the response
     * @return {@code true} if this call resolved the request, {@code false} if it was already resolved
     */
    boolean complete(@Nonnull Response response) {
        return result.complete(response);
    }

    boolean fail(@Nonnull BridgeException cause) {
        return result.completeExceptionally(cause);
    }

    boolean isDone() {
        return result.isDone();
    }

    @Override
    public String toString() {
        return "PendingRequest(" + correlationId + ", " + kind + ")";
    }
}
