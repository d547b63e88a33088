/*
 * ErrorCode.java
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
import java.util.HashMap;
import java.util.Map;

/**
 * SQL states raised by the driver itself. The value of each constant is the five character SQLSTATE reported
 * through {@link java.sql.SQLException#getSQLState()}.
 *
 * <p>States reported by the database behind the bridge are passed through untouched; {@link #get(String)} maps
 * them to {@link #UNKNOWN}, whose kind is {@link ErrorKind#SQL}.</p>
 */
public enum ErrorCode {
    // Class 07 - dynamic SQL error
    INVALID_COLUMN_REFERENCE("07009", ErrorKind.CLIENT),

    // Class 08 - connection exception
    UNABLE_TO_ESTABLISH_CONNECTION("08001", ErrorKind.CONNECTION),
    CONNECTION_CLOSED("08003", ErrorKind.CLIENT),
    CONNECTION_FAILURE("08006", ErrorKind.CONNECTION),
    PROTOCOL_VIOLATION("08P01", ErrorKind.PROTOCOL),
    POOL_EXHAUSTED("08P02", ErrorKind.POOL_EXHAUSTED),

    // Class HY - driver state
    INTERNAL_ERROR("HY000", ErrorKind.CLIENT),
    CANNOT_CONVERT_TYPE("HY003", ErrorKind.CLIENT),
    OPERATION_CANCELED("HY008", ErrorKind.CLIENT),
    TRANSACTION_INACTIVE("HY010", ErrorKind.CLIENT),
    INVALID_CONNECTION_STRING("HY024", ErrorKind.CLIENT),
    INVALID_PARAMETER("HY105", ErrorKind.CLIENT),
    INVALID_CURSOR_STATE("HY109", ErrorKind.CLIENT),
    UNSUPPORTED_OPERATION("HYC00", ErrorKind.CLIENT),
    STATEMENT_CLOSED("HYS01", ErrorKind.CLIENT),
    RESULT_SET_CLOSED("HYS02", ErrorKind.CLIENT),
    NO_RESULT_SET("HYS03", ErrorKind.CLIENT),

    // Class HYT - timeouts
    EXECUTION_TIMEOUT("HYT00", ErrorKind.TIMEOUT),
    READ_DEADLINE_EXCEEDED("HYT01", ErrorKind.TIMEOUT),

    UNKNOWN("XXXXX", ErrorKind.SQL);

    private static final Map<String, ErrorCode> BY_STATE = new HashMap<>();

    static {
        for (ErrorCode code : values()) {
            BY_STATE.put(code.errorCode, code);
        }
    }

    private final String errorCode;
    private final ErrorKind kind;

    ErrorCode(String errorCode, ErrorKind kind) {
        this.errorCode = errorCode;
        this.kind = kind;
    }

    /**
     * Get the SQLSTATE of this code.
     *
     * @return the five character state
     */
    @Nonnull
    public String getErrorCode() {
        return errorCode;
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Look up the code that owns a SQLSTATE.
     *
     * @param sqlState the state to look up, possibly {@code null}
     * @return the matching code, or {@link #UNKNOWN} if the driver does not own that state
     */
    @Nonnull
    public static ErrorCode get(@Nullable String sqlState) {
        if (sqlState == null) {
            return UNKNOWN;
        }
        return BY_STATE.getOrDefault(sqlState, UNKNOWN);
    }
}
