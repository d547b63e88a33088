/*
 * ConnectionParameter.java
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

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * The parameters a bridge URL, or the {@link java.util.Properties} passed along with it, may carry. Every value is
 * a non-negative integer; anything else is rejected when the connection is opened.
 */
public enum ConnectionParameter {
    EXECUTION_TIMEOUT("queryTimeout", "Seconds the bridge may spend executing one request; 0 for no limit", 0, 0),
    READ_DEADLINE("readDeadline", "Seconds to wait for the response to a request once it is sent; 0 for no limit. " +
            "A socket whose read deadline expires is discarded", 0, 0),
    FETCH_SIZE("fetchSize", "Rows the bridge returns per page of a result set", 100, 1),
    MAX_CONNECTIONS("maxConnections", "Maximum number of sockets pooled by one connection", 16, 1),
    CHECKOUT_TIMEOUT("checkoutTimeout", "Seconds to wait for a free pooled socket; 0 to wait forever", 0, 0);

    @Nonnull
    private final String parameterName;
    @Nonnull
    private final String description;
    private final int defaultValue;
    private final int minimum;

    ConnectionParameter(@Nonnull String parameterName, @Nonnull String description, int defaultValue, int minimum) {
        this.parameterName = parameterName;
        this.description = description;
        this.defaultValue = defaultValue;
        this.minimum = minimum;
    }

    /**
     * The name used in URLs and properties.
     *
     * @return the parameter name
     */
    @Nonnull
    public String getParameterName() {
        return parameterName;
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    public int getMinimum() {
        return minimum;
    }

    @Nonnull
    public static Optional<ConnectionParameter> forName(@Nonnull String parameterName) {
        for (ConnectionParameter parameter : values()) {
            if (parameter.parameterName.equals(parameterName)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }
}
