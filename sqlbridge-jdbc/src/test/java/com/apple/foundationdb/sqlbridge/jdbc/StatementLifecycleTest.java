/*
 * StatementLifecycleTest.java
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
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorKind;
import com.apple.foundationdb.sqlbridge.protocol.v1.Request;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;

class StatementLifecycleTest {
    private FakeBridgeServer server;
    private BridgeConnection connection;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeBridgeServer.start();
        connection = DriverManager.getConnection(server.url("maxConnections=1")).unwrap(BridgeConnection.class);
        try (BridgeStatement statement = connection.createStatement()) {
            statement.executeUpdate("create table people (id bigint auto_increment, name varchar)");
            statement.executeUpdate("insert into people (name) values ('ada')");
            statement.executeUpdate("insert into people (name) values ('grace')");
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
        server.close();
    }

    @Test
    void closedStatementFailsPredictably() throws Exception {
        BridgeStatement statement = connection.createStatement();
        statement.close();
        Assertions.assertThat(statement.isClosed()).isTrue();
        statement.close();
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, () -> statement.executeQuery("select * from people"));
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, () -> statement.executeUpdate("delete from people"));
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, () -> statement.execute("select * from people"));
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, statement::getResultSet);
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, () -> statement.setFetchSize(10));
        Assertions.assertThat(ErrorKind.of(BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, statement::getUpdateCount)))
                .isEqualTo(ErrorKind.CLIENT);
        Assertions.assertThat(server.getEngine().committedRows("people")).isEqualTo(2);
    }

    @Test
    void closedPreparedStatementReleasesItsHandle() throws Exception {
        BridgePreparedStatement select = connection.prepareStatement("select name from people where id = ?");
        Assertions.assertThat(server.getEngine().openStatements()).isEqualTo(1);
        try (BridgeResultSet rs = select.executeQueryWith(1L)) {
            Assertions.assertThat(rs.next()).isTrue();
            Assertions.assertThat(rs.getString(1)).isEqualTo("ada");
        }
        select.close();
        Assertions.assertThat(server.getEngine().requestCount(Request.PayloadCase.CLOSE_STATEMENT)).isEqualTo(1);
        Assertions.assertThat(server.getEngine().openStatements()).isZero();
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, () -> select.executeQueryWith(2L));
        BridgeAssertions.assertSqlState(ErrorCode.STATEMENT_CLOSED, select::executeQuery);
        select.close();
        Assertions.assertThat(server.getEngine().requestCount(Request.PayloadCase.CLOSE_STATEMENT)).isEqualTo(1);

        // other statements are unaffected
        try (BridgePreparedStatement other = connection.prepareStatement("select name from people where id = ?");
                BridgeResultSet rs = other.executeQueryWith(2L)) {
            Assertions.assertThat(rs.next()).isTrue();
            Assertions.assertThat(rs.getString("NAME")).isEqualTo("grace");
        }
    }

    @Test
    void closingAStatementClosesItsResultSet() throws Exception {
        BridgeStatement statement = connection.createStatement();
        statement.setFetchSize(1);
        BridgeResultSet rs = statement.executeQuery("select * from people");
        Assertions.assertThat(rs.getStatement()).isSameAs(statement);
        Assertions.assertThat(server.getEngine().openResultSets()).isEqualTo(1);
        statement.close();
        Assertions.assertThat(rs.isClosed()).isTrue();
        Assertions.assertThat(server.getEngine().openResultSets()).isZero();
        BridgeAssertions.assertSqlState(ErrorCode.RESULT_SET_CLOSED, rs::next);
    }

    @Test
    void closingTheConnectionClosesItsStatements() throws Exception {
        BridgeConnection closing = DriverManager.getConnection(server.url()).unwrap(BridgeConnection.class);
        BridgeStatement statement = closing.createStatement();
        BridgePreparedStatement prepared = closing.prepareStatement("select * from people");
        Assertions.assertThat(closing.unwrap(BridgeJDBCConnection.class).openStatementCount()).isEqualTo(2);
        closing.close();
        Assertions.assertThat(statement.isClosed()).isTrue();
        Assertions.assertThat(prepared.isClosed()).isTrue();
        Assertions.assertThat(closing.unwrap(BridgeJDBCConnection.class).openStatementCount()).isZero();
        Assertions.assertThat(server.getEngine().openStatements()).isZero();
        BridgeAssertions.assertSqlState(ErrorCode.CONNECTION_CLOSED, () -> closing.prepareStatement("select * from people"));
    }

    @Test
    void sqlErrorLeavesTheConnectionReusable() throws Exception {
        BridgeJDBCConnection bridge = connection.unwrap(BridgeJDBCConnection.class);
        try (BridgeStatement statement = connection.createStatement()) {
            SQLException syntax = BridgeAssertions.assertSqlState("42000", () -> statement.executeQuery("selekt nothing"));
            Assertions.assertThat((Throwable) syntax).isInstanceOf(SQLSyntaxErrorException.class);
            Assertions.assertThat(ErrorKind.of(syntax)).isEqualTo(ErrorKind.SQL);

            BridgeAssertions.assertSqlState("42S02", () -> statement.executeQuery("select * from nowhere"));

            try (BridgeResultSet rs = statement.executeQuery("select count(*) from people")) {
                Assertions.assertThat(rs.next()).isTrue();
                Assertions.assertThat(rs.getInt(1)).isEqualTo(2);
            }
        }
        // the single pooled socket survived both errors
        Assertions.assertThat(bridge.getPool().getCreatedCount()).isEqualTo(1);
        Assertions.assertThat(bridge.getPool().getDiscardedCount()).isZero();
        Assertions.assertThat(server.acceptedConnections()).isEqualTo(1);
    }

    @Test
    void prepareFailureIsReported() {
        BridgeAssertions.assertSqlState("42000", () -> connection.prepareStatement("gibberish here"));
    }

    @Test
    void executeChoosesQueryOrUpdate() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            Assertions.assertThat(statement.execute("  select * from people")).isTrue();
            Assertions.assertThat(statement.getUpdateCount()).isEqualTo(BridgeJDBCStatement.STATEMENT_RESULT_SET);
            try (BridgeResultSet rs = statement.getResultSet()) {
                Assertions.assertThat(rs.next()).isTrue();
            }
            Assertions.assertThat(statement.execute("insert into people (name) values ('linus')")).isFalse();
            Assertions.assertThat(statement.getUpdateCount()).isEqualTo(1);
            BridgeAssertions.assertSqlState(ErrorCode.NO_RESULT_SET, statement::getResultSet);
            try (BridgeResultSet keys = statement.getGeneratedKeys()) {
                Assertions.assertThat(keys.next()).isTrue();
                Assertions.assertThat(keys.getLong(1)).isEqualTo(3L);
                Assertions.assertThat(keys.next()).isFalse();
            }
            Assertions.assertThat(statement.getMoreResults()).isFalse();
        }
    }

    @Test
    void queryAndUpdateAreNotInterchangeable() throws Exception {
        try (BridgeStatement statement = connection.createStatement()) {
            BridgeAssertions.assertSqlState("42000", () -> statement.executeUpdate("select * from people"));
            BridgeAssertions.assertSqlState("42000", () -> statement.executeQuery("delete from people"));
        }
        try (BridgePreparedStatement prepared = connection.prepareStatement("select * from people")) {
            BridgeAssertions.assertSqlState(ErrorCode.INVALID_PARAMETER, () -> prepared.executeQuery("select 1"));
        }
        Assertions.assertThat(server.getEngine().committedRows("people")).isEqualTo(2);
    }

    @Test
    void recognizesQueries() {
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("SELECT 1")).isTrue();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("  with x as (select 1) select * from x")).isTrue();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("-- comment\nselect 1")).isTrue();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("/* hint */ (select 1)")).isTrue();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("show tables")).isTrue();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("insert into t values (1)")).isFalse();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("selection_update")).isFalse();
        Assertions.assertThat(BridgeJDBCStatement.looksLikeQuery("update t set a = 'select'")).isFalse();
    }
}
