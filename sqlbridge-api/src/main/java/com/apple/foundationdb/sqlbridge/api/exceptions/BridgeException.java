/*
 * BridgeException.java
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

package com.apple.foundationdb.sqlbridge.api.exceptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Checked exception thrown throughout the driver internals. The JDBC facade turns it into a {@link SQLException}
 * with {@link #toSqlException()} at its boundary.
 *
 * <p>An exception carrying an error reported by the bridge keeps the bridge's SQLSTATE and vendor code verbatim,
 * in which case {@link #getErrorCode()} is {@link ErrorCode#UNKNOWN}.</p>
 */
public class BridgeException extends Exception {
    private static final long serialVersionUID = 1L;

    @Nonnull
    private final ErrorCode errorCode;
    @Nonnull
    private final String sqlState;
    private final int vendorCode;

    public BridgeException(String message, @Nonnull ErrorCode errorCode) {
        this(message, errorCode, null);
    }

    public BridgeException(String message, @Nonnull ErrorCode errorCode, @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sqlState = errorCode.getErrorCode();
        this.vendorCode = 0;
    }

    public BridgeException(@Nonnull ErrorCode errorCode, @Nonnull Throwable cause) {
        this(cause.getMessage(), errorCode, cause);
    }

    private BridgeException(String message, @Nonnull String sqlState, int vendorCode) {
        super(message);
        this.errorCode = ErrorCode.get(sqlState);
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
    }

    /**
     * Create an exception for a statement the database behind the bridge rejected.
     *
     * @param message the message from the bridge
     * @param sqlState the SQLSTATE from the bridge
     * @param vendorCode the database's own error number, or 0
     * @return the new exception
     */
    @Nonnull
    public static BridgeException fromBridge(String message, @Nonnull String sqlState, int vendorCode) {
        return new BridgeException(message, sqlState, vendorCode);
    }

    /**
     * Convert any throwable into a {@code BridgeException}, keeping the state of SQL exceptions.
     *
     * @param t the throwable
     * @return {@code t} itself if it already is one, otherwise a wrapper
     */
    @Nonnull
    public static BridgeException convert(@Nonnull Throwable t) {
        if (t instanceof BridgeException) {
            return (BridgeException) t;
        } else if (t instanceof SQLException) {
            final SQLException se = (SQLException) t;
            return new BridgeException(se.getMessage(), ErrorCode.get(se.getSQLState()), se);
        }
        return new BridgeException(ErrorCode.UNKNOWN, t);
    }

    @Nonnull
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Nonnull
    public String getSqlState() {
        return sqlState;
    }

    public int getVendorCode() {
        return vendorCode;
    }

    @Nonnull
    public ErrorKind getKind() {
        return errorCode.getKind();
    }

    /**
     * Convert to the {@link SQLException} subclass that matches the kind of this failure. If this exception only
     * wraps a {@link SQLException}, the wrapped exception is returned as is.
     *
     * @return the JDBC exception to throw to the caller
     */
    @Nonnull
    public SQLException toSqlException() {
        if (getCause() instanceof SQLException) {
            return (SQLException) getCause();
        }
        final String message = getMessage();
        switch (getKind()) {
            case TIMEOUT:
                return new SQLTimeoutException(message, sqlState, vendorCode, this);
            case CONNECTION:
            case PROTOCOL:
                return new SQLNonTransientConnectionException(message, sqlState, vendorCode, this);
            case POOL_EXHAUSTED:
                return new SQLTransientConnectionException(message, sqlState, vendorCode, this);
            case SQL:
                if (sqlState.startsWith("42")) {
                    return new SQLSyntaxErrorException(message, sqlState, vendorCode, this);
                } else if (sqlState.startsWith("23")) {
                    return new SQLIntegrityConstraintViolationException(message, sqlState, vendorCode, this);
                }
                return new SQLException(message, sqlState, vendorCode, this);
            default:
                if (errorCode == ErrorCode.UNSUPPORTED_OPERATION) {
                    return new SQLFeatureNotSupportedException(message, sqlState, vendorCode, this);
                }
                return new SQLException(message, sqlState, vendorCode, this);
        }
    }
}
