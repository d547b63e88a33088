/*
 * BridgeJDBCConnection.java
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
import com.apple.foundationdb.sqlbridge.api.BridgePreparedStatement;
import com.apple.foundationdb.sqlbridge.api.BridgeStatement;
import com.apple.foundationdb.sqlbridge.api.ServerStatus;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.PrepareResponse;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.net.URI;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connect to a SQL bridge.
 *
 * <p>The connection owns a {@link ConnectionPool} of sockets to the bridge named by its URL. With auto-commit on,
 * every request borrows a socket for just that request. With auto-commit off, the first statement begins a
 * {@link Transaction}, and every statement after it shares the socket the transaction pinned until
 * {@link #commit()} or {@link #rollback()}.</p>
 */
class BridgeJDBCConnection implements BridgeConnection {
    private static final Logger logger = LoggerFactory.getLogger(BridgeJDBCConnection.class);

    @Nonnull
    private final ConnectionConfig config;
    @Nonnull
    private final ConnectionPool pool;
    @Nonnull
    private final PooledRoute pooledRoute;
    private volatile boolean autoCommit = true;
    private volatile boolean closed;
    private final Object transactionLock = new Object();
    @GuardedBy("transactionLock")
    @Nullable
    private Transaction transaction;
    private final Set<BridgeJDBCStatement> statements = ConcurrentHashMap.newKeySet();

    BridgeJDBCConnection(@Nonnull ConnectionConfig config) {
        this(config, new ConnectionPool(config, DeadlineManager.forConfig(config)));
    }

    @VisibleForTesting
    BridgeJDBCConnection(@Nonnull ConnectionConfig config, @Nonnull ConnectionPool pool) {
        this.config = config;
        this.pool = pool;
        this.pooledRoute = new PooledRoute(pool);
    }

    @Nonnull
    ConnectionConfig getConfig() {
        return config;
    }

    @Nonnull
    ConnectionPool getPool() {
        return pool;
    }

    @Nonnull
    RequestRoute pooledRoute() {
        return pooledRoute;
    }

    /**
     * Where the next statement goes: the pool with auto-commit on, otherwise the current transaction, which is begun
     * here if there is none. Concurrent callers that find no transaction begin just one between them.
     *
     * @param requestTimeout execution timeout for a begin request, or {@code null} for the configured one
     * @return the route
     * @throws BridgeException if this connection is closed or a transaction could not be begun
     */
    @Nonnull
    RequestRoute route(@Nullable Duration requestTimeout) throws BridgeException {
        checkOpen();
        if (autoCommit) {
            return pooledRoute;
        }
        synchronized (transactionLock) {
            if (transaction == null || !transaction.isOpen()) {
                transaction = Transaction.begin(pool, requestTimeout);
            }
            return transaction;
        }
    }

    @Nullable
    @VisibleForTesting
    Transaction currentTransaction() {
        synchronized (transactionLock) {
            return transaction;
        }
    }

    @Nullable
    private Transaction takeTransaction() {
        synchronized (transactionLock) {
            final Transaction active = transaction;
            transaction = null;
            return active;
        }
    }

    void statementClosed(@Nonnull BridgeJDBCStatement statement) {
        statements.remove(statement);
    }

    @VisibleForTesting
    int openStatementCount() {
        return statements.size();
    }

    private void checkOpen() throws BridgeException {
        if (closed) {
            throw new BridgeException("Connection closed", ErrorCode.CONNECTION_CLOSED);
        }
    }

    @Override
    public BridgeStatement createStatement() throws SQLException {
        try {
            checkOpen();
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        final BridgeJDBCStatement statement = new BridgeJDBCStatement(this);
        statements.add(statement);
        return statement;
    }

    @Override
    public BridgePreparedStatement prepareStatement(String sql) throws SQLException {
        try {
            checkOpen();
            final Response response = pooledRoute.send(BridgeCodec.prepare(sql), null, ResponseValidator.NONE);
            final PrepareResponse prepared = response.getPrepare();
            final BridgeJDBCPreparedStatement statement = new BridgeJDBCPreparedStatement(this, sql,
                    prepared.getStatementHandle(), prepared.getParameterCount());
            statements.add(statement);
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Prepared statement",
                        LogMessageKeys.STATEMENT_HANDLE, prepared.getStatementHandle(),
                        LogMessageKeys.ENDPOINT, config.getEndpoint()));
            }
            return statement;
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public BridgePreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException {
        // generated keys are always returned
        return prepareStatement(sql);
    }

    @Override
    public void setAutoCommit(boolean autoCommit) throws SQLException {
        if (autoCommit == getAutoCommit()) {
            return;
        }
        if (autoCommit) {
            // commit any remaining work
            final Transaction active = takeTransaction();
            this.autoCommit = true;
            if (active != null && active.isOpen()) {
                try {
                    active.commit(null);
                } catch (BridgeException e) {
                    throw e.toSqlException();
                }
            }
        } else {
            this.autoCommit = false;
        }
    }

    @Override
    public boolean getAutoCommit() throws SQLException {
        return autoCommit;
    }

    @Override
    public void commit() throws SQLException {
        endTransaction(true);
    }

    @Override
    public void rollback() throws SQLException {
        endTransaction(false);
    }

    private void endTransaction(boolean commit) throws SQLException {
        try {
            checkOpen();
            if (getAutoCommit()) {
                throw new BridgeException((commit ? "Commit" : "Rollback") + " cannot be called when auto commit is ON",
                        ErrorCode.TRANSACTION_INACTIVE);
            }
            final Transaction active = takeTransaction();
            if (active == null || !active.isOpen()) {
                // no statement ran since the last commit or rollback
                return;
            }
            if (commit) {
                active.commit(null);
            } else {
                active.rollback(null);
            }
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    /**
     * Roll back the active transaction, close the statements created here, and close the pool. The first failure
     * is thrown once everything has been closed.
     */
    @Override
    public void close() throws SQLException {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        SQLException failure = null;
        final Transaction active = takeTransaction();
        if (active != null && active.isOpen()) {
            try {
                active.rollback(null);
            } catch (BridgeException e) {
                logger.warn(KeyValueLogMessage.of("Failed to roll back transaction on close",
                        LogMessageKeys.TRANSACTION_ID, active.transactionId(),
                        LogMessageKeys.ERROR_CODE, e.getErrorCode()), e);
                failure = e.toSqlException();
            }
        }
        for (BridgeJDBCStatement statement : List.copyOf(statements)) {
            try {
                statement.close();
            } catch (SQLException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        pool.close();
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public boolean isClosed() throws SQLException {
        return closed;
    }

    @Nonnull
    @Override
    public ServerStatus getServerStatus() throws SQLException {
        try {
            checkOpen();
            return StatusProbe.toServerStatus(pooledRoute.send(BridgeCodec.status(), null, ResponseValidator.NONE));
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public boolean isValid(int timeout) throws SQLException {
        if (timeout < 0) {
            throw new BridgeException("Timeout must not be negative: " + timeout, ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        if (closed) {
            return false;
        }
        try {
            pooledRoute.send(BridgeCodec.status(), timeout == 0 ? null : Duration.ofSeconds(timeout), ResponseValidator.NONE);
            return true;
        } catch (BridgeException e) {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Connection is not valid",
                        LogMessageKeys.ENDPOINT, config.getEndpoint(),
                        LogMessageKeys.ERROR_CODE, e.getErrorCode()), e);
            }
            return false;
        }
    }

    @Nonnull
    @Override
    public URI getEndpoint() {
        return config.getEndpoint();
    }

    @Override
    public void setReadOnly(boolean readOnly) throws SQLException {
        if (readOnly) {
            throw new SQLFeatureNotSupportedException("Read-only connections are not supported by the bridge driver",
                    ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
        }
    }

    @Override
    public boolean isReadOnly() throws SQLException {
        return false;
    }

    @Override
    public void setTransactionIsolation(int level) throws SQLException {
        if (level != Connection.TRANSACTION_READ_COMMITTED) {
            throw new SQLFeatureNotSupportedException("Only TRANSACTION_READ_COMMITTED is supported",
                    ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
        }
    }

    @Override
    public int getTransactionIsolation() throws SQLException {
        return Connection.TRANSACTION_READ_COMMITTED;
    }

    @Override
    public SQLWarning getWarnings() throws SQLException {
        return null;
    }

    @Override
    public void clearWarnings() throws SQLException {
    }

    @Override
    public int getHoldability() throws SQLException {
        return ResultSet.CLOSE_CURSORS_AT_COMMIT;
    }

    @Override
    public String toString() {
        return "BridgeJDBCConnection(" + config.getEndpoint() + ", " + pool + ")";
    }
}
