/*
 * BridgeDriver.java
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
import com.apple.foundationdb.sqlbridge.api.ServerStatus;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Properties;

/**
 * JDBC driver for a SQL bridge.
 * URLs read {@code jdbc:bridge:tcp://HOST[:PORT]/[?param=value&...]}; see {@link ConnectionParameter} for the
 * parameters.
 */
@SuppressWarnings({"PMD.SystemPrintln"}) // Used in extreme when a failure to register Driver
public class BridgeDriver implements Driver {
    private static final Logger logger = LoggerFactory.getLogger(BridgeDriver.class);

    static final int MAJOR_VERSION = 1;
    static final int MINOR_VERSION = 0;

    // Load this driver and register it with the DriverManager.
    // JDBC 4.3, Code Example 9-1.
    static {
        try {
            DriverManager.registerDriver(new BridgeDriver());
        } catch (SQLException sqlException) {
            System.err.println(sqlException);
        }
    }

    /**
     * Open a connection to the bridge named by {@code url}. No socket is opened until the first request.
     *
     * @param url the bridge URL
     * @param info further parameters; URL parameters win over these, and {@code user} and {@code password} are
     *     ignored
     * @return the connection, or {@code null} if {@code url} is not a bridge URL
     * @throws SQLException with {@link ErrorCode#INVALID_CONNECTION_STRING} if the URL or a parameter is malformed
     *     or unknown
     */
    @Override
    public BridgeConnection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        final ConnectionConfig config;
        try {
            config = ConnectionConfig.parse(url, info);
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("Opening bridge connection",
                    LogMessageKeys.ENDPOINT, config.getEndpoint(),
                    LogMessageKeys.POOL_MAX, config.getMaxConnections(),
                    LogMessageKeys.EXECUTION_TIMEOUT_MILLIS, config.getExecutionTimeout().toMillis(),
                    LogMessageKeys.READ_DEADLINE_MILLIS, config.getReadDeadline().toMillis()));
        }
        return new BridgeJDBCConnection(config);
    }

    @Override
    public boolean acceptsURL(String url) throws SQLException {
        return BridgeURI.accepts(url);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        final ConnectionParameter[] parameters = ConnectionParameter.values();
        final DriverPropertyInfo[] result = new DriverPropertyInfo[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            final ConnectionParameter parameter = parameters[i];
            final String given = info == null ? null : info.getProperty(parameter.getParameterName());
            result[i] = new DriverPropertyInfo(parameter.getParameterName(),
                    given == null ? Integer.toString(parameter.getDefaultValue()) : given);
            result[i].description = parameter.getDescription();
            result[i].required = false;
        }
        return result;
    }

    /**
     * Ask the bridge named by {@code url} for its status, over a connection opened and closed for just this call.
     *
     * @param url a bridge URL, as passed to {@link #connect(String, Properties)}
     * @return the bridge's status
     * @throws SQLException if the URL is malformed or the bridge could not be reached in time
     */
    @Nonnull
    public static ServerStatus serverStatus(@Nonnull String url) throws SQLException {
        try {
            return StatusProbe.probe(ConnectionConfig.parse(url, null));
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public int getMajorVersion() {
        return MAJOR_VERSION;
    }

    @Override
    public int getMinorVersion() {
        return MINOR_VERSION;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("The bridge driver logs through SLF4J",
                ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }
}
