/*
 * ConnectionConfig.java
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
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * The settings of one connection, parsed from its URL and properties. Immutable.
 *
 * <p>Parameters may be given in the URL query or as properties under the same names. A URL value wins over a
 * property. Parameters the driver does not know are rejected.
 */
public final class ConnectionConfig {
    /**
     * Properties {@link java.sql.DriverManager} callers commonly pass along. The bridge does its own
     * authentication, so these are accepted and ignored.
     */
    private static final Set<String> IGNORED_PROPERTIES = ImmutableSet.of("user", "password");

    @Nonnull
    private final String host;
    private final int port;
    @Nonnull
    private final Map<ConnectionParameter, Integer> values;

    private ConnectionConfig(@Nonnull String host, int port, @Nonnull Map<ConnectionParameter, Integer> values) {
        this.host = host;
        this.port = port;
        this.values = values;
    }

    /**
     * Parse a bridge URL and its properties.
     *
     * @param url the JDBC URL
     * @param info properties passed to {@link java.sql.Driver#connect(String, Properties)}, possibly {@code null}
     * @return the configuration
     * @throws BridgeException with {@link ErrorCode#INVALID_CONNECTION_STRING} if the URL is malformed, names an
     *     unknown parameter, gives one twice, or gives a value that is not an integer in range
     */
    @Nonnull
    public static ConnectionConfig parse(@Nonnull String url, @Nullable Properties info) throws BridgeException {
        final URI uri = BridgeURI.parse(url);
        final Map<ConnectionParameter, Integer> values = new EnumMap<>(ConnectionParameter.class);
        if (info != null) {
            for (String name : info.stringPropertyNames()) {
                if (IGNORED_PROPERTIES.contains(name)) {
                    continue;
                }
                final ConnectionParameter parameter = lookup(name);
                values.put(parameter, parseValue(parameter, info.getProperty(name)));
            }
        }
        final Map<String, List<String>> query = BridgeURI.splitQuery(uri);
        for (Map.Entry<String, List<String>> entry : query.entrySet()) {
            final ConnectionParameter parameter = lookup(entry.getKey());
            if (entry.getValue().size() > 1) {
                throw new BridgeException("Parameter " + entry.getKey() + " given more than once",
                        ErrorCode.INVALID_CONNECTION_STRING);
            }
            values.put(parameter, parseValue(parameter, BridgeURI.getFirstValue(entry.getKey(), query)));
        }
        for (ConnectionParameter parameter : ConnectionParameter.values()) {
            values.putIfAbsent(parameter, parameter.getDefaultValue());
        }
        return new ConnectionConfig(uri.getHost(), BridgeURI.getPort(uri), values);
    }

    @Nonnull
    private static ConnectionParameter lookup(@Nonnull String name) throws BridgeException {
        return ConnectionParameter.forName(name).orElseThrow(() ->
                new BridgeException("Unknown connection parameter: " + name, ErrorCode.INVALID_CONNECTION_STRING));
    }

    private static int parseValue(@Nonnull ConnectionParameter parameter, @Nullable String value) throws BridgeException {
        if (value == null || value.isEmpty()) {
            throw new BridgeException("Parameter " + parameter.getParameterName() + " has no value",
                    ErrorCode.INVALID_CONNECTION_STRING);
        }
        final int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new BridgeException("Parameter " + parameter.getParameterName() + " must be an integer, was '" +
                    value + "'", ErrorCode.INVALID_CONNECTION_STRING, e);
        }
        if (parsed < parameter.getMinimum()) {
            throw new BridgeException("Parameter " + parameter.getParameterName() + " must be at least " +
                    parameter.getMinimum() + ", was " + parsed, ErrorCode.INVALID_CONNECTION_STRING);
        }
        return parsed;
    }

    @Nonnull
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Nonnull
    public URI getEndpoint() {
        return URI.create(BridgeURI.TRANSPORT_SCHEME + "://" + host + ":" + port);
    }

    public int get(@Nonnull ConnectionParameter parameter) {
        return values.get(parameter);
    }

    /**
     * Time the bridge may spend executing one request. {@link Duration#ZERO} means no limit.
     *
     * @return the execution timeout
     */
    @Nonnull
    public Duration getExecutionTimeout() {
        return Duration.ofSeconds(get(ConnectionParameter.EXECUTION_TIMEOUT));
    }

    /**
     * Time to wait for a response once its request is on the wire. {@link Duration#ZERO} means no limit.
     *
     * @return the read deadline
     */
    @Nonnull
    public Duration getReadDeadline() {
        return Duration.ofSeconds(get(ConnectionParameter.READ_DEADLINE));
    }

    @Nonnull
    public Duration getCheckoutTimeout() {
        return Duration.ofSeconds(get(ConnectionParameter.CHECKOUT_TIMEOUT));
    }

    public int getFetchSize() {
        return get(ConnectionParameter.FETCH_SIZE);
    }

    public int getMaxConnections() {
        return get(ConnectionParameter.MAX_CONNECTIONS);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("endpoint", getEndpoint())
                .add("values", values)
                .toString();
    }
}
