/*
 * BridgeJDBCStatement.java
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

import com.apple.foundationdb.sqlbridge.api.BridgeConnection;
import com.apple.foundationdb.sqlbridge.api.BridgeResultSet;
import com.apple.foundationdb.sqlbridge.api.BridgeStatement;
import com.apple.foundationdb.sqlbridge.api.UpdateResult;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.ExecuteResponse;
import com.apple.foundationdb.sqlbridge.protocol.v1.Parameter;
import com.apple.foundationdb.sqlbridge.protocol.v1.QueryResponse;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Column;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.ColumnMetadata;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Row;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.Ints;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

class BridgeJDBCStatement implements BridgeStatement {
    /**
     * Special value that is used to indicate that a statement returned a {@link java.sql.ResultSet}. The
     * method #getUpdateCount() will return this value if the previous statement that
     * was executed with {@link Statement#execute(String)} returned a {@link java.sql.ResultSet}.
     */
    public static final int STATEMENT_RESULT_SET = -1;

    /**
     * Special value that is used to indicate that a statement had no result yet.
     */
    public static final int STATEMENT_NO_RESULT = -2;

    /**
     * Statements that {@link #execute(String)} sends as a query rather than an update: those whose first keyword
     * (after any comments and opening parentheses) is one of these.
     */
    private static final Pattern QUERY_PATTERN = Pattern.compile(
            "^(?:\\s|--[^\\n]*(?:\\n|$)|/\\*.*?\\*/|\\()*(?:SELECT|WITH|VALUES|TABLE|SHOW|EXPLAIN|DESCRIBE|DESC)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final List<ColumnMetadata> GENERATED_KEY_COLUMNS = List.of(ColumnMetadata.newBuilder()
            .setName("GENERATED_KEY")
            .setJavaSqlTypesCode(Types.BIGINT)
            .setTypeName("BIGINT")
            .build());

    @Nonnull
    private final BridgeJDBCConnection connection;
    private volatile boolean closed;
    @Nullable
    private BridgeJDBCResultSet currentResultSet;
    private int updateCount = STATEMENT_NO_RESULT;
    @Nullable
    private Long lastGeneratedKey;
    private int fetchSize;
    private int maxRows;
    /**
     * Execution timeout set with {@link #setQueryTimeout(int)}; {@code null} until then, meaning the connection's.
     */
    @Nullable
    private volatile Duration queryTimeout;

    BridgeJDBCStatement(@Nonnull BridgeJDBCConnection connection) {
        this.connection = connection;
        this.fetchSize = connection.getConfig().getFetchSize();
    }

    void checkOpen() throws SQLException {
        if (isClosed()) {
            throw new BridgeException("Statement closed", ErrorCode.STATEMENT_CLOSED).toSqlException();
        }
    }

    @VisibleForTesting
    static boolean looksLikeQuery(@Nonnull String sql) {
        return QUERY_PATTERN.matcher(sql).find();
    }

    @Nonnull
    BridgeJDBCConnection getBridgeConnection() {
        return connection;
    }

    @Nullable
    Duration getRequestTimeout() {
        return queryTimeout;
    }

    synchronized int getPageSize() {
        return fetchSize;
    }

    /**
     * Engine to run a statement that does not return rows, for both plain and prepared statements. Touches no
     * state of this statement, so any number of threads may call it at once.
     *
     * @param statementHandle handle of a prepared statement, or {@code null} to send {@code sql} inline
     * @param sql the SQL, if there is no handle
     * @param parameters bound parameters, in order
     * @return the row count and generated key
     * @throws BridgeException if the execution fails
     */
    @Nonnull
    UpdateResult runUpdate(@Nullable Long statementHandle, @Nullable String sql, @Nonnull List<Parameter> parameters)
            throws BridgeException {
        final Duration timeout = getRequestTimeout();
        final RequestRoute route = connection.route(timeout);
        final Response response = route.send(BridgeCodec.execute(statementHandle, sql, parameters, route.transactionId()),
                timeout, ResponseValidator.NONE);
        final ExecuteResponse execute = response.getExecute();
        return new UpdateResult(execute.getRowCount(), execute.hasGeneratedKey() ? execute.getGeneratedKey() : null);
    }

    /**
     * Engine to run a query, for both plain and prepared statements. Like {@link #runUpdate}, touches no state of
     * this statement.
     *
     * @param statementHandle handle of a prepared statement, or {@code null} to send {@code sql} inline
     * @param sql the SQL, if there is no handle
     * @param parameters bound parameters, in order
     * @return a cursor holding the first page
     * @throws BridgeException if the query fails
     */
    @Nonnull
    ResultCursor runQuery(@Nullable Long statementHandle, @Nullable String sql, @Nonnull List<Parameter> parameters)
            throws BridgeException {
        final Duration timeout = getRequestTimeout();
        final int pageSize = getPageSize();
        final RequestRoute route = connection.route(timeout);
        final Response response = route.send(
                BridgeCodec.query(statementHandle, sql, parameters, route.transactionId(), pageSize), timeout,
                r -> ResultCursor.checkPage(r.getQuery().getMetadata().getColumnList(), r.getQuery().getFirstPage(), pageSize));
        final QueryResponse query = response.getQuery();
        return ResultCursor.open(route, query, pageSize, timeout);
    }

    /**
     * Run a statement and make its outcome the current result of this statement.
     *
     * @param statementHandle handle of a prepared statement, or {@code null} to send {@code sql} inline
     * @param sql the SQL, if there is no handle
     * @param parameters bound parameters, in order
     * @param query whether to run it as a query
     * @return {@code query}
     * @throws SQLException if the statement is closed or the execution fails
     */
    synchronized boolean execute(@Nullable Long statementHandle, @Nullable String sql, @Nonnull List<Parameter> parameters,
                                 boolean query) throws SQLException {
        checkOpen();
        closeCurrentResultSet();
        updateCount = STATEMENT_NO_RESULT;
        lastGeneratedKey = null;
        try {
            if (query) {
                currentResultSet = new BridgeJDBCResultSet(this, runQuery(statementHandle, sql, parameters), maxRows);
                updateCount = STATEMENT_RESULT_SET;
            } else {
                final UpdateResult result = runUpdate(statementHandle, sql, parameters);
                updateCount = Ints.saturatedCast(result.getRowCount());
                lastGeneratedKey = result.getGeneratedKey().isPresent() ? result.getGeneratedKey().getAsLong() : null;
            }
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        return query;
    }

    @Override
    public boolean execute(String sql) throws SQLException {
        return execute(null, sql, List.of(), looksLikeQuery(sql));
    }

    @Override
    public boolean execute(String sql, int autoGeneratedKeys) throws SQLException {
        // generated keys are always returned
        return execute(sql);
    }

    @Override
    public BridgeResultSet executeQuery(@Nonnull String sql) throws SQLException {
        execute(null, sql, List.of(), true);
        return getResultSet();
    }

    @Override
    public int executeUpdate(@Nonnull String sql) throws SQLException {
        execute(null, sql, List.of(), false);
        return getUpdateCount();
    }

    @Override
    public int executeUpdate(String sql, int autoGeneratedKeys) throws SQLException {
        return executeUpdate(sql);
    }

    @Override
    public synchronized int getUpdateCount() throws SQLException {
        checkOpen();
        return updateCount;
    }

    @Override
    public synchronized boolean getMoreResults() throws SQLException {
        checkOpen();
        closeCurrentResultSet();
        updateCount = STATEMENT_RESULT_SET;
        return false;
    }

    @Override
    public synchronized BridgeResultSet getResultSet() throws SQLException {
        checkOpen();
        if (currentResultSet != null && !currentResultSet.isClosed()) {
            return currentResultSet;
        }
        throw new BridgeException("No open result set available", ErrorCode.NO_RESULT_SET).toSqlException();
    }

    @Override
    public synchronized BridgeResultSet getGeneratedKeys() throws SQLException {
        checkOpen();
        final List<Row> rows = lastGeneratedKey == null ? List.of() : List.of(Row.newBuilder()
                .addColumn(Column.newBuilder().setLong(lastGeneratedKey))
                .build());
        return new BridgeJDBCResultSet(this, ResultCursor.ofRows(GENERATED_KEY_COLUMNS, rows), 0);
    }

    private void closeCurrentResultSet() throws SQLException {
        if (currentResultSet != null) {
            final BridgeJDBCResultSet toClose = currentResultSet;
            currentResultSet = null;
            toClose.close();
        }
    }

    @Override
    public void close() throws SQLException {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            closeResources();
        } finally {
            connection.statementClosed(this);
        }
    }

    /**
     * Release what this statement holds, once, when it is closed.
     *
     * @throws SQLException if a release failed
     */
    void closeResources() throws SQLException {
        synchronized (this) {
            closeCurrentResultSet();
        }
    }

    @Override
    public boolean isClosed() throws SQLException {
        return closed;
    }

    @Override
    public synchronized int getMaxRows() throws SQLException {
        checkOpen();
        return maxRows;
    }

    @Override
    public synchronized void setMaxRows(int max) throws SQLException {
        checkOpen();
        if (max < 0) {
            throw new BridgeException("Max rows must not be negative: " + max, ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        this.maxRows = max;
    }

    @Override
    public int getQueryTimeout() throws SQLException {
        checkOpen();
        final Duration timeout = queryTimeout;
        return Ints.saturatedCast((timeout == null ? connection.getConfig().getExecutionTimeout() : timeout).getSeconds());
    }

    @Override
    public void setQueryTimeout(int seconds) throws SQLException {
        checkOpen();
        if (seconds < 0) {
            throw new BridgeException("Query timeout must not be negative: " + seconds, ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        this.queryTimeout = Duration.ofSeconds(seconds);
    }

    @Override
    public synchronized void setFetchSize(int rows) throws SQLException {
        checkOpen();
        if (rows < 0) {
            throw new BridgeException("Fetch size must not be negative: " + rows, ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        // 0 means the driver picks
        this.fetchSize = rows == 0 ? connection.getConfig().getFetchSize() : rows;
    }

    @Override
    public synchronized int getFetchSize() throws SQLException {
        checkOpen();
        return fetchSize;
    }

    @Override
    public BridgeConnection getConnection() throws SQLException {
        checkOpen();
        return connection;
    }
}
