/*
 * BridgeStatement.java
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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;

/**
 * A {@link java.sql.Statement} whose SQL text is forwarded verbatim to the bridge.
 *
 * <p>The query timeout set with {@link #setQueryTimeout(int)} replaces the connection's execution timeout for the
 * requests sent by this statement. Only forward-only, read-only result sets are produced.</p>
 */
public interface BridgeStatement extends java.sql.Statement {

    @Override
    BridgeResultSet executeQuery(String sql) throws SQLException;

    @Override
    BridgeResultSet getResultSet() throws SQLException;

    @Override
    BridgeResultSet getGeneratedKeys() throws SQLException;

    @Override
    BridgeConnection getConnection() throws SQLException;

    @Override
    default int getFetchDirection() throws SQLException {
        return ResultSet.FETCH_FORWARD;
    }

    @Override
    default int getResultSetConcurrency() throws SQLException {
        return ResultSet.CONCUR_READ_ONLY;
    }

    @Override
    default int getResultSetType() throws SQLException {
        return ResultSet.TYPE_FORWARD_ONLY;
    }

    @Override
    default int getResultSetHoldability() throws SQLException {
        return ResultSet.CLOSE_CURSORS_AT_COMMIT;
    }

    @Override
    default SQLWarning getWarnings() throws SQLException {
        return null;
    }

    @Override
    default void clearWarnings() throws SQLException {
    }

    @Override
    default boolean isPoolable() throws SQLException {
        return false;
    }

    @Override
    default boolean isCloseOnCompletion() throws SQLException {
        return false;
    }

    /* Unsupported JDBC features */
    @Override
    default int getMaxFieldSize() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setMaxFieldSize(int max) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setEscapeProcessing(boolean enable) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setCursorName(String name) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean getMoreResults(int current) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default int executeUpdate(String sql, int[] columnIndexes) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default int executeUpdate(String sql, String[] columnNames) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean execute(String sql, int[] columnIndexes) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean execute(String sql, String[] columnNames) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setFetchDirection(int direction) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void addBatch(String sql) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void clearBatch() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default int[] executeBatch() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void cancel() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setPoolable(boolean poolable) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void closeOnCompletion() throws SQLException {
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
