/*
 * BridgeConnection.java
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

package com.apple.foundationdb.sqlbridge.api;

import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;

import javax.annotation.Nonnull;
import java.net.URI;
import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.Clob;
import java.sql.DatabaseMetaData;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Executor;

/**
 * A connection to a SQL bridge.
 *
 * <p>
 *  This functions very much like a {@link java.sql.Connection}, except that the statements it creates are sent to a
 *  bridge process over a pool of TCP sockets. A single {@code BridgeConnection} may be shared by many threads:
 *  each execution borrows its own socket from the pool, or, when auto-commit is off, multiplexes over the socket
 *  pinned by the current transaction.
 * </p>
 */
public interface BridgeConnection extends java.sql.Connection {
    /**
     * Create a statement that sends its SQL text to the bridge as is.
     *
     * @return a new statement
     * @throws SQLException if this connection is closed
     */
    @Override
    BridgeStatement createStatement() throws SQLException;

    /**
     * Prepare a statement on the bridge. The returned handle can be executed concurrently by many threads through
     * {@link BridgePreparedStatement#executeUpdateWith(Object...)} and
     * {@link BridgePreparedStatement#executeQueryWith(Object...)}.
     *
     * @param sql the SQL text, with {@code ?} parameter markers
     * @return the prepared statement
     * @throws SQLException if the bridge rejects the statement or cannot be reached
     */
    @Override
    BridgePreparedStatement prepareStatement(String sql) throws SQLException;

    @Override
    BridgePreparedStatement prepareStatement(String sql, int autoGeneratedKeys) throws SQLException;

    /**
     * Ask the bridge for a snapshot of its state. Uses a pooled socket and obeys the same deadlines as any statement.
     *
     * @return the status snapshot
     * @throws SQLException if the bridge cannot be reached
     */
    @Nonnull
    ServerStatus getServerStatus() throws SQLException;

    /**
     * The bridge endpoint this connection talks to, as {@code tcp://host:port}.
     *
     * @return the endpoint
     */
    @Nonnull
    URI getEndpoint();

    /* Unsupported JDBC features */
    @Override
    default Statement createStatement(int resultSetType, int resultSetConcurrency) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Statement createStatement(int resultSetType, int resultSetConcurrency, int resultSetHoldability) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default PreparedStatement prepareStatement(String sql, int resultSetType, int resultSetConcurrency, int resultSetHoldability) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default PreparedStatement prepareStatement(String sql, int[] columnIndexes) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default PreparedStatement prepareStatement(String sql, String[] columnNames) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default CallableStatement prepareCall(String sql) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default CallableStatement prepareCall(String sql, int resultSetType, int resultSetConcurrency, int resultSetHoldability) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String nativeSQL(String sql) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default DatabaseMetaData getMetaData() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void abort(Executor executor) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNetworkTimeout(Executor executor, int milliseconds) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default int getNetworkTimeout() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setCatalog(String catalog) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String getCatalog() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setSchema(String schema) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String getSchema() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Map<String, Class<?>> getTypeMap() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setTypeMap(Map<String, Class<?>> map) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setHoldability(int holdability) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Savepoint setSavepoint() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Savepoint setSavepoint(String name) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void rollback(Savepoint savepoint) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void releaseSavepoint(Savepoint savepoint) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Clob createClob() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Blob createBlob() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default NClob createNClob() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default SQLXML createSQLXML() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Array createArrayOf(String typeName, Object[] elements) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Struct createStruct(String typeName, Object[] attributes) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setClientInfo(String name, String value) throws SQLClientInfoException {
        throw new SQLClientInfoException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode(), null);
    }

    @Override
    default void setClientInfo(Properties properties) throws SQLClientInfoException {
        throw new SQLClientInfoException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode(), null);
    }

    @Override
    default String getClientInfo(String name) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Properties getClientInfo() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException("Not a wrapper for " + iface.getName(), ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this);
    }
}
