/*
 * LogMessageKeys.java
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

package com.apple.foundationdb.sqlbridge.api.logging;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the driver.
 * All keys live here so that collisions are easy to spot.
 */
public enum LogMessageKeys {
    // endpoint
    ENDPOINT,
    CONNECTION_ID("conn_id"),
    CONNECTION_STATE("conn_state"),

    // requests
    CORRELATION_ID("corr_id"),
    REQUEST_KIND,
    RESPONSE_KIND,
    PENDING_REQUESTS,
    ELAPSED_MILLIS,
    EXECUTION_TIMEOUT_MILLIS,
    READ_DEADLINE_MILLIS,

    // statements, cursors and transactions
    STATEMENT_HANDLE,
    RESULT_SET_HANDLE,
    TRANSACTION_ID,
    TRANSACTION_STATE,
    PAGE_SIZE,
    ROW_COUNT,

    // pool
    POOL_TOTAL,
    POOL_IDLE,
    POOL_MAX,
    CHECKOUT_TIMEOUT_MILLIS,

    // errors
    ERROR_CODE,
    MESSAGE;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
