/*
 * RequestRoute.java
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

import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Where a request goes: through the pool, or over the connection pinned by a transaction.
 */
interface RequestRoute {

    /**
     * Send a request and wait for its response.
     *
     * @param request the request, without correlation id
     * @param requestTimeout execution timeout for this request, or {@code null} for the configured one
     * @param validator further checks on the response
     * @return the response
     * @throws BridgeException if the request fails
     */
    @Nonnull
    Response send(@Nonnull Request.Builder request, @Nullable Duration requestTimeout,
                  @Nonnull ResponseValidator validator) throws BridgeException;

    /**
     * The transaction requests on this route run in.
     *
     * @return the transaction id, or 0 outside a transaction
     */
    long transactionId();

    boolean isOpen();
}
