/*
 * BridgeJDBCPreparedStatement.java
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

import com.apple.foundationdb.sqlbridge.api.BridgePreparedStatement;
import com.apple.foundationdb.sqlbridge.api.BridgeResultSet;
import com.apple.foundationdb.sqlbridge.api.UpdateResult;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Parameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

class BridgeJDBCPreparedStatement extends BridgeJDBCStatement implements BridgePreparedStatement {
    private static final Logger logger = LoggerFactory.getLogger(BridgeJDBCPreparedStatement.class);

    @Nonnull
    private final String sql;
    private final long statementHandle;
    private final int parameterCount;
    private final boolean query;
    @GuardedBy("this")
    private final Map<Integer, Parameter> parameters = new TreeMap<>();

    BridgeJDBCPreparedStatement(@Nonnull BridgeJDBCConnection connection, @Nonnull String sql, long statementHandle,
                                int parameterCount) {
        super(connection);
        this.sql = sql;
        this.statementHandle = statementHandle;
        this.parameterCount = parameterCount;
        this.query = looksLikeQuery(sql);
    }

    long getStatementHandle() {
        return statementHandle;
    }

    int getParameterCount() {
        return parameterCount;
    }

    @Nonnull
    private synchronized List<Parameter> boundParameters() throws SQLException {
        final List<Parameter> bound = new ArrayList<>(parameterCount);
        for (int i = 1; i <= parameterCount; i++) {
            final Parameter parameter = parameters.get(i);
            if (parameter == null) {
                throw new BridgeException("No value set for parameter " + i + " of '" + sql + "'",
                        ErrorCode.INVALID_PARAMETER).toSqlException();
            }
            bound.add(parameter);
        }
        return bound;
    }

    @Nonnull
    private List<Parameter> toParameters(@Nonnull Object[] values) throws SQLException {
        if (values.length != parameterCount) {
            throw new BridgeException("Statement '" + sql + "' takes " + parameterCount + " parameters, got " + values.length,
                    ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        final List<Parameter> bound = new ArrayList<>(values.length);
        try {
            for (Object value : values) {
                bound.add(ParameterHelper.ofObject(value));
            }
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        return bound;
    }

    @Override
    public BridgeResultSet executeQuery() throws SQLException {
        execute(statementHandle, null, boundParameters(), true);
        return getResultSet();
    }

    @Override
    public int executeUpdate() throws SQLException {
        execute(statementHandle, null, boundParameters(), false);
        return getUpdateCount();
    }

    @Override
    public boolean execute() throws SQLException {
        return execute(statementHandle, null, boundParameters(), query);
    }

    @Nonnull
    @Override
    public UpdateResult executeUpdateWith(Object... values) throws SQLException {
        checkOpen();
        final List<Parameter> bound = toParameters(values);
        try {
            return runUpdate(statementHandle, null, bound);
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Nonnull
    @Override
    public BridgeResultSet executeQueryWith(Object... values) throws SQLException {
        checkOpen();
        final List<Parameter> bound = toParameters(values);
        try {
            return new BridgeJDBCResultSet(this, runQuery(statementHandle, null, bound), getMaxRows());
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public BridgeResultSet executeQuery(String sql) throws SQLException {
        throw new BridgeException("Cannot pass SQL text to a prepared statement", ErrorCode.INVALID_PARAMETER).toSqlException();
    }

    @Override
    public int executeUpdate(String sql) throws SQLException {
        throw new BridgeException("Cannot pass SQL text to a prepared statement", ErrorCode.INVALID_PARAMETER).toSqlException();
    }

    @Override
    public boolean execute(String sql) throws SQLException {
        throw new BridgeException("Cannot pass SQL text to a prepared statement", ErrorCode.INVALID_PARAMETER).toSqlException();
    }

    private synchronized void set(int parameterIndex, @Nonnull Parameter parameter) throws SQLException {
        checkOpen();
        if (parameterIndex < 1 || parameterIndex > parameterCount) {
            throw new BridgeException("Parameter index " + parameterIndex + " out of range [1, " + parameterCount + "]",
                    ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        parameters.put(parameterIndex, parameter);
    }

    @Override
    public void setNull(int parameterIndex, int sqlType) throws SQLException {
        set(parameterIndex, ParameterHelper.ofNull(sqlType));
    }

    @Override
    public void setBoolean(int parameterIndex, boolean x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofBoolean(x));
    }

    @Override
    public void setByte(int parameterIndex, byte x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofInt(x));
    }

    @Override
    public void setShort(int parameterIndex, short x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofInt(x));
    }

    @Override
    public void setInt(int parameterIndex, int x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofInt(x));
    }

    @Override
    public void setLong(int parameterIndex, long x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofLong(x));
    }

    @Override
    public void setFloat(int parameterIndex, float x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofDouble(x));
    }

    @Override
    public void setDouble(int parameterIndex, double x) throws SQLException {
        set(parameterIndex, ParameterHelper.ofDouble(x));
    }

    @Override
    public void setString(int parameterIndex, String x) throws SQLException {
        if (x == null) {
            setNull(parameterIndex, java.sql.Types.VARCHAR);
        } else {
            set(parameterIndex, ParameterHelper.ofString(x));
        }
    }

    @Override
    public void setDate(int parameterIndex, Date x) throws SQLException {
        setTimestamp(parameterIndex, x == null ? null : new Timestamp(x.getTime()));
    }

    @Override
    public void setTime(int parameterIndex, Time x) throws SQLException {
        setTimestamp(parameterIndex, x == null ? null : new Timestamp(x.getTime()));
    }

    @Override
    public void setTimestamp(int parameterIndex, Timestamp x) throws SQLException {
        if (x == null) {
            setNull(parameterIndex, java.sql.Types.TIMESTAMP);
        } else {
            set(parameterIndex, ParameterHelper.ofTimestamp(x));
        }
    }

    @Override
    public void setObject(int parameterIndex, Object x, int targetSqlType) throws SQLException {
        if (x == null) {
            setNull(parameterIndex, targetSqlType);
        } else {
            setObject(parameterIndex, x);
        }
    }

    @Override
    public void setObject(int parameterIndex, Object x) throws SQLException {
        final Parameter parameter;
        try {
            parameter = ParameterHelper.ofObject(x);
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        set(parameterIndex, parameter);
    }

    @Override
    public synchronized void clearParameters() throws SQLException {
        checkOpen();
        parameters.clear();
    }

    // handles outlive transactions, so the close goes through the pool
    @Override
    void closeResources() throws SQLException {
        try {
            super.closeResources();
        } finally {
            releaseHandle();
        }
    }

    private void releaseHandle() throws SQLException {
        final RequestRoute route = getBridgeConnection().pooledRoute();
        if (!route.isOpen()) {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Pool closed, statement left for the bridge to free",
                        LogMessageKeys.STATEMENT_HANDLE, statementHandle));
            }
            return;
        }
        try {
            route.send(BridgeCodec.closeStatement(statementHandle), getRequestTimeout(), ResponseValidator.NONE);
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public String toString() {
        return "BridgeJDBCPreparedStatement(" + statementHandle + ", '" + sql + "')";
    }
}
