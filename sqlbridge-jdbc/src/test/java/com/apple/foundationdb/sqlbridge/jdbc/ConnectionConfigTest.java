/*
 * ConnectionConfigTest.java
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

import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;
import java.time.Duration;
import java.util.Properties;

class ConnectionConfigTest {

    @Test
    void defaults() throws Exception {
        ConnectionConfig config = ConnectionConfig.parse("jdbc:bridge:tcp://db.example.com/", null);
        Assertions.assertThat(config.getHost()).isEqualTo("db.example.com");
        Assertions.assertThat(config.getPort()).isEqualTo(BridgeURI.DEFAULT_PORT);
        Assertions.assertThat(config.getEndpoint()).isEqualTo(URI.create("tcp://db.example.com:7777"));
        Assertions.assertThat(config.getExecutionTimeout()).isEqualTo(Duration.ZERO);
        Assertions.assertThat(config.getReadDeadline()).isEqualTo(Duration.ZERO);
        Assertions.assertThat(config.getCheckoutTimeout()).isEqualTo(Duration.ZERO);
        Assertions.assertThat(config.getFetchSize()).isEqualTo(100);
        Assertions.assertThat(config.getMaxConnections()).isEqualTo(16);
    }

    @Test
    void everyParameter() throws Exception {
        ConnectionConfig config = ConnectionConfig.parse("jdbc:bridge:tcp://127.0.0.1:9000/?queryTimeout=1&readDeadline=10" +
                "&fetchSize=500&maxConnections=4&checkoutTimeout=3", null);
        Assertions.assertThat(config.getPort()).isEqualTo(9000);
        Assertions.assertThat(config.getExecutionTimeout()).isEqualTo(Duration.ofSeconds(1));
        Assertions.assertThat(config.getReadDeadline()).isEqualTo(Duration.ofSeconds(10));
        Assertions.assertThat(config.getFetchSize()).isEqualTo(500);
        Assertions.assertThat(config.getMaxConnections()).isEqualTo(4);
        Assertions.assertThat(config.getCheckoutTimeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void urlWinsOverProperties() throws Exception {
        Properties info = new Properties();
        info.setProperty("fetchSize", "20");
        info.setProperty("maxConnections", "2");
        info.setProperty("password", "secret");
        ConnectionConfig config = ConnectionConfig.parse("jdbc:bridge:tcp://localhost/?fetchSize=30", info);
        Assertions.assertThat(config.getFetchSize()).isEqualTo(30);
        Assertions.assertThat(config.getMaxConnections()).isEqualTo(2);
    }

    @Test
    void urlWithoutTrailingSlash() throws Exception {
        ConnectionConfig config = ConnectionConfig.parse("jdbc:bridge:tcp://localhost:1234", null);
        Assertions.assertThat(config.getPort()).isEqualTo(1234);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "jdbc:bridge:tcp://localhost/?pageSize=10",
            "jdbc:bridge:tcp://localhost/?fetchSize=10&fetchSize=20",
            "jdbc:bridge:tcp://localhost/?fetchSize=0",
            "jdbc:bridge:tcp://localhost/?fetchSize=",
            "jdbc:bridge:tcp://localhost/?fetchSize",
            "jdbc:bridge:tcp://localhost/?queryTimeout=1.5",
            "jdbc:bridge:tcp://localhost/?readDeadline=-3",
            "jdbc:bridge:tcp://localhost/db",
            "jdbc:bridge:tcp:///",
            "jdbc:bridge:tcp://local host/",
            "jdbc:mysql://localhost/",
    })
    void invalidConnectionStrings(String url) {
        BridgeAssertions.assertBridgeFailure(ErrorCode.INVALID_CONNECTION_STRING, () -> ConnectionConfig.parse(url, null));
    }

    @Test
    void unknownPropertyIsRejected() {
        Properties info = new Properties();
        info.setProperty("timeout", "5");
        BridgeAssertions.assertBridgeFailure(ErrorCode.INVALID_CONNECTION_STRING,
                () -> ConnectionConfig.parse("jdbc:bridge:tcp://localhost/", info));
    }
}
