/*
 * FetchSizeTest.java
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
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Result sets larger than one page.
 */
class FetchSizeTest {
    private static final int ROWS = 1000;

    private FakeBridgeServer server;
    private BridgeConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeBridgeServer.start();
        connection = DriverManager.getConnection(server.url("fetchSize=500")).unwrap(BridgeConnection.class);
        try (BridgeStatement statement = connection.createStatement()) {
            statement.executeUpdate("create table numbers (id bigint, label varchar)");
        }
        try (BridgePreparedStatement insert = connection.prepareStatement("insert into numbers (id, label) values (?, ?)")) {
            for (long i = 1; i <= ROWS; i++) {
                insert.executeUpdateWith(i, "n" + i);
            }
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
        server.close();
    }

    private long fetches() {
        return server.getEngine().requestCount(Request.PayloadCase.FETCH_PAGE);
    }

    private static List<Long> readIds(BridgeResultSet rs) throws Exception {
        List<Long> ids = new ArrayList<>();
        while (rs.next()) {
            ids.add(rs.getLong("id"));
            Assertions.assertThat(rs.getString("label")).isEqualTo("n" + rs.getLong("id"));
            Assertions.assertThat(rs.getRow()).isEqualTo(ids.size());
        }
        return ids;
    }

    @Test
    void everyRowExactlyOnceInOrder() throws Exception {
        long before = fetches();
        try (BridgeStatement statement = connection.createStatement();
                BridgeResultSet rs = statement.executeQuery("select * from numbers order by id")) {
            Assertions.assertThat(rs.getFetchSize()).isEqualTo(500);
            Assertions.assertThat(readIds(rs)).containsExactlyElementsOf(
                    LongStream.rangeClosed(1, ROWS).boxed().collect(Collectors.toList()));
            Assertions.assertThat(rs.next()).isFalse();
        }
        // the first page comes with the query, the second is fetched
        Assertions.assertThat(fetches() - before).isEqualTo(1);
        Assertions.assertThat(server.getEngine().openResultSets()).isZero();
    }

    @ParameterizedTest
    @CsvSource({"1000, 0", "300, 3", "999, 1", "1, 999", "2000, 0"})
    void statementFetchSizeOverridesTheConnection(int fetchSize, long expectedFetches) throws Exception {
        long before = fetches();
        try (BridgeStatement statement = connection.createStatement()) {
            statement.setFetchSize(fetchSize);
            try (BridgeResultSet rs = statement.executeQuery("select id, label from numbers order by id")) {
                Assertions.assertThat(readIds(rs)).hasSize(ROWS).doesNotHaveDuplicates().isSorted();
            }
        }
        Assertions.assertThat(fetches() - before).isEqualTo(expectedFetches);
    }

    @Test
    void fetchSizeChangedWhileReading() throws Exception {
        long before = fetches();
        try (BridgeStatement statement = connection.createStatement();
                BridgeResultSet rs = statement.executeQuery("select * from numbers order by id")) {
            for (int i = 0; i < 500; i++) {
                Assertions.assertThat(rs.next()).isTrue();
            }
            rs.setFetchSize(100);
            List<Long> rest = readIds(rs);
            Assertions.assertThat(rest).hasSize(500);
            Assertions.assertThat(rest.get(0)).isEqualTo(501L);
        }
        Assertions.assertThat(fetches() - before).isEqualTo(5);
    }

    @Test
    void closingEarlyReleasesTheResultSet() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            BridgeResultSet rs = statement.executeQuery("select * from numbers");
            Assertions.assertThat(rs.next()).isTrue();
            Assertions.assertThat(server.getEngine().openResultSets()).isEqualTo(1);
            rs.close();
            Assertions.assertThat(rs.isClosed()).isTrue();
            Assertions.assertThat(server.getEngine().openResultSets()).isZero();
            Assertions.assertThat(server.getEngine().requestCount(Request.PayloadCase.CLOSE_RESULT_SET)).isEqualTo(1);
            BridgeAssertions.assertSqlState(ErrorCode.RESULT_SET_CLOSED, rs::next);
        }
    }

    @Test
    void nextQueryClosesThePreviousResultSet() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            BridgeResultSet first = statement.executeQuery("select * from numbers");
            BridgeResultSet second = statement.executeQuery("select count(*) from numbers");
            Assertions.assertThat(first.isClosed()).isTrue();
            Assertions.assertThat(second.next()).isTrue();
            Assertions.assertThat(second.getLong(1)).isEqualTo(ROWS);
            Assertions.assertThat(server.getEngine().openResultSets()).isZero();
        }
    }

    @Test
    void maxRowsLimitsTheRowsReturned() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            statement.setMaxRows(750);
            try (BridgeResultSet rs = statement.executeQuery("select * from numbers order by id")) {
                Assertions.assertThat(readIds(rs)).hasSize(750).endsWith(750L);
            }
        }
        Assertions.assertThat(server.getEngine().openResultSets()).isZero();
    }

    @Test
    void negativeFetchSizeIsRejected() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            BridgeAssertions.assertSqlState(ErrorCode.INVALID_PARAMETER, () -> statement.setFetchSize(-1));
            statement.setFetchSize(0);
            Assertions.assertThat(statement.getFetchSize()).isEqualTo(500);
        }
    }
}
