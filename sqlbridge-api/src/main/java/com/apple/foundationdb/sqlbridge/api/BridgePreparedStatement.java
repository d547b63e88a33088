/*
 * BridgePreparedStatement.java
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
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.net.URL;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.NClob;
import java.sql.ParameterMetaData;
import java.sql.Ref;
import java.sql.ResultSetMetaData;
import java.sql.RowId;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLXML;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.Calendar;

/**
 * A statement prepared on the bridge and identified there by a handle.
 *
 * <p>The {@code setXxx}/{@code executeXxx()} methods inherited from {@link java.sql.PreparedStatement} keep their
 * parameters on the statement and so must not be called from several threads at once. The {@code ...With} methods
 * take their parameters as arguments and share nothing across calls but the handle; any number of threads may call
 * them on one statement concurrently.</p>
 */
public interface BridgePreparedStatement extends java.sql.PreparedStatement, BridgeStatement {

    @Override
    BridgeResultSet executeQuery() throws SQLException;

    /**
     * Execute this statement with the given parameters, without touching the parameters set on the statement.
     *
     * @param parameters one value per parameter marker, in order; {@code null} binds SQL NULL
     * @return the affected row count and the key generated by the bridge, if any
     * @throws SQLException if the statement is closed, the bridge rejects it, or it times out
     */
    @Nonnull
    UpdateResult executeUpdateWith(Object... parameters) throws SQLException;

    /**
     * Run this query with the given parameters, without touching the parameters set on the statement. The returned
     * result set is independent of {@link #getResultSet()} and must be closed by the caller.
     *
     * @param parameters one value per parameter marker, in order; {@code null} binds SQL NULL
     * @return a result set positioned before the first row
     * @throws SQLException if the statement is closed, the bridge rejects it, or it times out
     */
    @Nonnull
    BridgeResultSet executeQueryWith(Object... parameters) throws SQLException;

    /* Unsupported JDBC features */
    @Override
    default void setBigDecimal(int parameterIndex, BigDecimal x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBytes(int parameterIndex, byte[] x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setDate(int parameterIndex, Date x, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setTime(int parameterIndex, Time x, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setTimestamp(int parameterIndex, Timestamp x, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNull(int parameterIndex, int sqlType, String typeName) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setObject(int parameterIndex, Object x, int targetSqlType, int scaleOrLength) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setAsciiStream(int parameterIndex, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setAsciiStream(int parameterIndex, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setAsciiStream(int parameterIndex, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setUnicodeStream(int parameterIndex, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBinaryStream(int parameterIndex, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBinaryStream(int parameterIndex, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBinaryStream(int parameterIndex, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setCharacterStream(int parameterIndex, Reader reader, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setCharacterStream(int parameterIndex, Reader reader, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setCharacterStream(int parameterIndex, Reader reader) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNCharacterStream(int parameterIndex, Reader value, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNCharacterStream(int parameterIndex, Reader value) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setRef(int parameterIndex, Ref x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBlob(int parameterIndex, Blob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBlob(int parameterIndex, InputStream inputStream, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setBlob(int parameterIndex, InputStream inputStream) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setClob(int parameterIndex, Clob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setClob(int parameterIndex, Reader reader, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setClob(int parameterIndex, Reader reader) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNClob(int parameterIndex, NClob value) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNClob(int parameterIndex, Reader reader, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNClob(int parameterIndex, Reader reader) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setArray(int parameterIndex, Array x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setURL(int parameterIndex, URL x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setRowId(int parameterIndex, RowId x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setNString(int parameterIndex, String value) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setSQLXML(int parameterIndex, SQLXML xmlObject) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void addBatch() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default ResultSetMetaData getMetaData() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default ParameterMetaData getParameterMetaData() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }
}
