/*
 * ErrorKind.java
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
import java.sql.SQLException;

/**
 * The coarse category of a failure raised by the driver. Callers use it to tell a slow bridge apart from a
 * refused one, or a broken socket apart from a statement the database rejected.
 */
public enum ErrorKind {
    /**
     * Socket-level failure: refused, reset, or closed mid-request. The connection that saw it is discarded.
     */
    CONNECTION,
    /**
     * The execution timeout or the read deadline of a request expired.
     */
    TIMEOUT,
    /**
     * A response was malformed or out of sequence. Always fatal to the connection that received it.
     */
    PROTOCOL,
    /**
     * The bridge reported that the SQL itself failed. The connection stays usable.
     */
    SQL,
    /**
     * No pooled connection could be obtained within the configured checkout timeout.
     */
    POOL_EXHAUSTED,
    /**
     * The API was misused: a closed handle, an inactive transaction, a bad parameter or connection string.
     */
    CLIENT;

    /**
     * Classify an exception thrown by the driver. SQL states the driver does not own are assumed to come from the
     * database behind the bridge.
     *
     * @param e the exception to classify
     * @return the kind of failure
     */
    @Nonnull
    public static ErrorKind of(@Nonnull SQLException e) {
        return ErrorCode.get(e.getSQLState()).getKind();
    }
}
