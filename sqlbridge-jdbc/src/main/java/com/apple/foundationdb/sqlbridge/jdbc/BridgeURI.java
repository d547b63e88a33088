/*
 * BridgeURI.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JDBC connection URL public utility and constants.
 * A bridge URL reads {@code jdbc:bridge:tcp://HOST[:PORT]/[?param=value&...]}.
 */
@SuppressWarnings("AbbreviationAsWordInName")
public final class BridgeURI {
    public static final String JDBC_URL_PREFIX = "jdbc:";
    public static final String JDBC_URL_SCHEME = "bridge";
    public static final String TRANSPORT_SCHEME = "tcp";

    /**
     * Base URL. {@link BridgeDriver#acceptsURL(String)} accepts any JDBC URL that starts with it.
     */
    public static final String JDBC_BASE_URL = JDBC_URL_PREFIX + JDBC_URL_SCHEME + ":" + TRANSPORT_SCHEME + "://";

    public static final int DEFAULT_PORT = 7777;

    private BridgeURI() {
    }

    public static boolean accepts(@Nullable String url) {
        return url != null && url.toLowerCase(Locale.ROOT).startsWith(JDBC_BASE_URL);
    }

    /**
     * Strip the {@code jdbc:bridge:} prefix and check what is left is a well formed {@code tcp://} URI.
     *
     * @param url the JDBC URL
     * @return the transport URI, with host, optional port, optional {@code /} path and optional query
     * @throws BridgeException with {@link ErrorCode#INVALID_CONNECTION_STRING} if the URL is not a bridge URL
     */
    @Nonnull
    public static URI parse(@Nonnull String url) throws BridgeException {
        if (!accepts(url)) {
            throw new BridgeException("Not a bridge URL, expected " + JDBC_BASE_URL + "HOST[:PORT]/: " + url,
                    ErrorCode.INVALID_CONNECTION_STRING);
        }
        final URI uri;
        try {
            uri = new URI(url.substring((JDBC_URL_PREFIX + JDBC_URL_SCHEME + ":").length()));
        } catch (URISyntaxException e) {
            throw new BridgeException("Malformed bridge URL: " + e.getMessage(), ErrorCode.INVALID_CONNECTION_STRING, e);
        }
        if (uri.getHost() == null) {
            throw new BridgeException("Bridge URL has no host: " + url, ErrorCode.INVALID_CONNECTION_STRING);
        }
        final String path = uri.getPath();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            throw new BridgeException("Bridge URL must not have a path, found '" + path + "'", ErrorCode.INVALID_CONNECTION_STRING);
        }
        return uri;
    }

    public static int getPort(@Nonnull URI uri) {
        return uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();
    }

    /**
     * Return first value in the values list.
     * @param key Key to use looking up values list.
     * @param map Map to search.
     * @return First value in values list or null if no values found.
     */
    @Nullable
    public static String getFirstValue(String key, Map<String, List<String>> map) {
        List<String> values = map.get(key);
        return values == null ? null : values.get(0);
    }

    /**
     * Split the query component of a URI into its parameters, URL decoding names and values. A parameter given
     * without {@code =} has a {@code null} value.
     *
     * @param uri the URI
     * @return lists of values keyed by parameter name, in order of first appearance
     */
    @Nonnull
    public static Map<String, List<String>> splitQuery(@Nonnull URI uri) {
        final Map<String, List<String>> params = new LinkedHashMap<>();
        final String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            final int idx = pair.indexOf('=');
            final String key = decode(idx > 0 ? pair.substring(0, idx) : pair);
            final String value = idx > 0 && pair.length() > idx + 1 ? decode(pair.substring(idx + 1)) : null;
            params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        return params;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
