/*
 * PooledRoute.java
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
 * Sends each request on a connection checked out of the pool for just that request.
 */
final class PooledRoute implements RequestRoute {
    @Nonnull
    private final ConnectionPool pool;

    PooledRoute(@Nonnull ConnectionPool pool) {
        this.pool = pool;
    }

    @Nonnull
    @Override
    public Response send(@Nonnull Request.Builder request, @Nullable Duration requestTimeout,
                         @Nonnull ResponseValidator validator) throws BridgeException {
        final WireConnection connection = pool.checkout();
        try {
            return connection.roundTrip(request, requestTimeout, validator);
        } finally {
            pool.checkin(connection);
        }
    }

    @Override
    public long transactionId() {
        return 0L;
    }

    @Override
    public boolean isOpen() {
        return !pool.isClosed();
    }
}
