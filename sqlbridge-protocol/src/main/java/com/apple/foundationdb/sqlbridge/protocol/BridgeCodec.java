/*
 * BridgeCodec.java
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

package com.apple.foundationdb.sqlbridge.protocol;

import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.v1.BeginRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.CloseResultSetRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.CloseStatementRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.CommitRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.ErrorResponse;
import com.apple.foundationdb.sqlbridge.protocol.v1.ExecuteRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.FetchPageRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.Parameter;
import com.apple.foundationdb.sqlbridge.protocol.v1.PrepareRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.QueryRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.apple.foundationdb.sqlbridge.protocol.v1.RollbackRequest;
import com.apple.foundationdb.sqlbridge.protocol.v1.StatusRequest;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Builds the request for each operation and validates the response the bridge sends back for it.
 *
 * <p>Requests are returned as builders without a correlation id or execution timeout; the connection that sends
 * them fills those in.</p>
 */
public final class BridgeCodec {

    private BridgeCodec() {
    }

    @Nonnull
    public static Request.Builder prepare(@Nonnull String sql) {
        return Request.newBuilder().setPrepare(PrepareRequest.newBuilder().setSql(sql));
    }

    /**
     * Execute a statement that does not return rows.
     *
     * @param statementHandle handle of a prepared statement, or {@code null} to send {@code sql} inline
     * @param sql the SQL text, used when there is no handle
     * @param parameters bound parameters
     * @param transactionId the transaction to run in, 0 for none
     * @return the request
     */
    @Nonnull
    public static Request.Builder execute(@Nullable Long statementHandle, @Nullable String sql,
                                          @Nonnull List<Parameter> parameters, long transactionId) {
        final ExecuteRequest.Builder execute = ExecuteRequest.newBuilder()
                .addAllParameter(parameters)
                .setTransactionId(transactionId);
        if (statementHandle != null) {
            execute.setStatementHandle(statementHandle);
        } else {
            execute.setSql(sql == null ? "" : sql);
        }
        return Request.newBuilder().setExecute(execute);
    }

    @Nonnull
    public static Request.Builder query(@Nullable Long statementHandle, @Nullable String sql,
                                        @Nonnull List<Parameter> parameters, long transactionId, int pageSize) {
        final QueryRequest.Builder query = QueryRequest.newBuilder()
                .addAllParameter(parameters)
                .setTransactionId(transactionId)
                .setPageSize(pageSize);
        if (statementHandle != null) {
            query.setStatementHandle(statementHandle);
        } else {
            query.setSql(sql == null ? "" : sql);
        }
        return Request.newBuilder().setQuery(query);
    }

    @Nonnull
    public static Request.Builder fetchPage(long resultSetHandle, int pageSize) {
        return Request.newBuilder().setFetchPage(FetchPageRequest.newBuilder()
                .setResultSetHandle(resultSetHandle)
                .setPageSize(pageSize));
    }

    @Nonnull
    public static Request.Builder closeResultSet(long resultSetHandle) {
        return Request.newBuilder().setCloseResultSet(CloseResultSetRequest.newBuilder().setResultSetHandle(resultSetHandle));
    }

    @Nonnull
    public static Request.Builder closeStatement(long statementHandle) {
        return Request.newBuilder().setCloseStatement(CloseStatementRequest.newBuilder().setStatementHandle(statementHandle));
    }

    @Nonnull
    public static Request.Builder begin() {
        return Request.newBuilder().setBegin(BeginRequest.getDefaultInstance());
    }

    @Nonnull
    public static Request.Builder commit(long transactionId) {
        return Request.newBuilder().setCommit(CommitRequest.newBuilder().setTransactionId(transactionId));
    }

    @Nonnull
    public static Request.Builder rollback(long transactionId) {
        return Request.newBuilder().setRollback(RollbackRequest.newBuilder().setTransactionId(transactionId));
    }

    @Nonnull
    public static Request.Builder status() {
        return Request.newBuilder().setStatus(StatusRequest.getDefaultInstance());
    }

    /**
     * The kind of response a successful request of the given kind gets.
     *
     * @param requestCase the kind of request
     * @return the kind of response
     */
    @Nonnull
    public static Response.PayloadCase expectedResponse(@Nonnull Request.PayloadCase requestCase) {
        switch (requestCase) {
            case PREPARE:
                return Response.PayloadCase.PREPARE;
            case EXECUTE:
                return Response.PayloadCase.EXECUTE;
            case QUERY:
                return Response.PayloadCase.QUERY;
            case FETCH_PAGE:
                return Response.PayloadCase.FETCH_PAGE;
            case BEGIN:
                return Response.PayloadCase.BEGIN;
            case STATUS:
                return Response.PayloadCase.STATUS;
            case CLOSE_RESULT_SET:
            case CLOSE_STATEMENT:
            case COMMIT:
            case ROLLBACK:
                return Response.PayloadCase.ACKNOWLEDGEMENT;
            default:
                throw new IllegalArgumentException("Request has no payload");
        }
    }

    /**
     * Check a response against the request it answers. Errors reported by the bridge become exceptions of the
     * matching kind; anything that does not fit the request is a protocol violation.
     *
     * @param request the request that was sent
     * @param response the response received for its correlation id
     * @return {@code response}, known to carry the expected payload
     * @throws BridgeException the bridge reported a failure, or the response does not fit the request
     */
    @Nonnull
    public static Response checkResponse(@Nonnull Request request, @Nonnull Response response) throws BridgeException {
        if (response.getCorrelationId() != request.getCorrelationId()) {
            throw new BridgeException("Response " + response.getCorrelationId() + " delivered for request " +
                    request.getCorrelationId(), ErrorCode.PROTOCOL_VIOLATION);
        }
        if (response.getPayloadCase() == Response.PayloadCase.ERROR) {
            throw toException(response.getError());
        }
        final Response.PayloadCase expected = expectedResponse(request.getPayloadCase());
        if (response.getPayloadCase() != expected) {
            throw new BridgeException("Wrong kind of response received, expected " + expected + " but was " +
                    response.getPayloadCase(), ErrorCode.PROTOCOL_VIOLATION);
        }
        return response;
    }

    /**
     * Map an error reported by the bridge to an exception.
     *
     * @param error the error response
     * @return the exception to throw
     */
    @Nonnull
    public static BridgeException toException(@Nonnull ErrorResponse error) {
        switch (error.getKind()) {
            case TIMEOUT:
                return new BridgeException("Bridge timed out executing the request: " + error.getMessage(),
                        ErrorCode.EXECUTION_TIMEOUT);
            case PROTOCOL:
                return new BridgeException("Bridge rejected the request: " + error.getMessage(),
                        ErrorCode.PROTOCOL_VIOLATION);
            case SQL:
            default:
                final String sqlState = error.getSqlState().isEmpty() ? ErrorCode.UNKNOWN.getErrorCode() : error.getSqlState();
                return BridgeException.fromBridge(error.getMessage(), sqlState, error.getVendorCode());
        }
    }
}
