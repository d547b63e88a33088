/*
 * ConcurrentInsertTest.java
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

import com.apple.foundationdb.sqlbridge.api.BridgeConnection;
import com.apple.foundationdb.sqlbridge.api.BridgePreparedStatement;
import com.apple.foundationdb.sqlbridge.api.BridgeResultSet;
import com.apple.foundationdb.sqlbridge.api.BridgeStatement;
import com.apple.foundationdb.sqlbridge.api.UpdateResult;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Many threads executing one shared prepared statement.
 */
class ConcurrentInsertTest {
    private static final int INSERTS = 200;

    private FakeBridgeServer server;
    private BridgeConnection connection;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeBridgeServer.start();
        connection = DriverManager.getConnection(server.url("maxConnections=8&readDeadline=10"))
                .unwrap(BridgeConnection.class);
        try (BridgeStatement statement = connection.createStatement()) {
            statement.executeUpdate("create table items (id bigint auto_increment, name varchar, qty bigint)");
        }
        executor = Executors.newFixedThreadPool(32, new ThreadFactoryBuilder().setNameFormat("inserter-%d").build());
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        connection.close();
        server.close();
    }

    @Test
    void concurrentInsertsThroughOneStatement() throws Exception {
        List<Future<UpdateResult>> results = new ArrayList<>();
        try (BridgePreparedStatement insert = connection.prepareStatement("insert into items (name, qty) values (?, ?)")) {
            for (int i = 0; i < INSERTS; i++) {
                final int n = i;
                results.add(executor.submit(() -> insert.executeUpdateWith("item-" + n, n)));
            }
            List<Long> keys = new ArrayList<>();
            for (Future<UpdateResult> result : results) {
                UpdateResult update = result.get(30, TimeUnit.SECONDS);
                Assertions.assertThat(update.getRowCount()).isEqualTo(1);
                Assertions.assertThat(update.getGeneratedKey()).isPresent();
                keys.add(update.getGeneratedKey().getAsLong());
            }
            Assertions.assertThat(keys).doesNotHaveDuplicates().hasSize(INSERTS);
        }

        Map<String, Long> stored = new HashMap<>();
        try (BridgeStatement statement = connection.createStatement();
                BridgeResultSet rs = statement.executeQuery("select name, qty from items")) {
            while (rs.next()) {
                Assertions.assertThat(stored.put(rs.getString("name"), rs.getLong("qty"))).isNull();
            }
        }
        Assertions.assertThat(stored).hasSize(INSERTS);
        for (int i = 0; i < INSERTS; i++) {
            Assertions.assertThat(stored).containsEntry("item-" + i, (long) i);
        }
        Assertions.assertThat(connection.unwrap(BridgeJDBCConnection.class).getPool().getTotalCount()).isLessThanOrEqualTo(8);
        // one prepare serves every execution
        Assertions.assertThat(server.getEngine().requestCount(Request.PayloadCase.PREPARE))
                .isEqualTo(1);
    }

    @Test
    void concurrentQueriesThroughOneStatement() throws Exception {
        try (BridgePreparedStatement insert = connection.prepareStatement("insert into items (name, qty) values (?, ?)")) {
            for (int i = 0; i < 20; i++) {
                insert.executeUpdateWith("item-" + i, i * 10);
            }
        }
        List<Future<Long>> results = new ArrayList<>();
        try (BridgePreparedStatement select = connection.prepareStatement("select qty from items where name = ?")) {
            for (int i = 0; i < 20; i++) {
                final int n = i;
                results.add(executor.submit(() -> {
                    try (BridgeResultSet rs = select.executeQueryWith("item-" + n)) {
                        Assertions.assertThat(rs.next()).isTrue();
                        long qty = rs.getLong(1);
                        Assertions.assertThat(rs.next()).isFalse();
                        return qty;
                    }
                }));
            }
            for (int i = 0; i < 20; i++) {
                Assertions.assertThat(results.get(i).get(30, TimeUnit.SECONDS)).isEqualTo(i * 10L);
            }
        }
    }

    @Test
    void boundParametersAreCheckedBeforeSending() throws Exception {
        try (BridgePreparedStatement insert = connection.prepareStatement("insert into items (name, qty) values (?, ?)")) {
            BridgeAssertions.assertSqlState(ErrorCode.INVALID_PARAMETER,
                    () -> insert.executeUpdateWith("only one"));
            insert.setString(1, "half bound");
            BridgeAssertions.assertSqlState(ErrorCode.INVALID_PARAMETER,
                    insert::executeUpdate);
            insert.setLong(2, 5);
            Assertions.assertThat(insert.executeUpdate()).isEqualTo(1);
            try (BridgeResultSet keys = insert.getGeneratedKeys()) {
                Assertions.assertThat(keys.next()).isTrue();
                Assertions.assertThat(keys.getLong("GENERATED_KEY")).isPositive();
            }
        }
        Assertions.assertThat(server.getEngine().committedRows("items")).isEqualTo(1);
    }
}
