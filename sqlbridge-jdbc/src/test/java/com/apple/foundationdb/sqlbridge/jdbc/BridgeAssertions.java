/*
 * BridgeAssertions.java
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
import org.assertj.core.api.Assertions;
import org.assertj.core.api.ThrowableAssert;

import javax.annotation.Nonnull;
import java.sql.SQLException;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Assertions shared by the driver tests.
 */
final class BridgeAssertions {
    private BridgeAssertions() {
    }

    /**
     * Assert that a JDBC call fails with the SQL state of {@code code}.
     *
     * @param code the expected code
     * @param call the call
     * @return the exception, for further checks
     */
    @Nonnull
    static SQLException assertSqlState(@Nonnull ErrorCode code, @Nonnull ThrowableAssert.ThrowingCallable call) {
        return assertSqlState(code.getErrorCode(), call);
    }

    /**
     * Assert that a JDBC call fails with a SQL state passed on from the database.
     *
     * @param sqlState the expected SQL state
     * @param call the call
     * @return the exception, for further checks
     */
    @Nonnull
    static SQLException assertSqlState(@Nonnull String sqlState, @Nonnull ThrowableAssert.ThrowingCallable call) {
        final Throwable thrown = Assertions.catchThrowable(call);
        Assertions.assertThat(thrown).isInstanceOf(SQLException.class);
        final SQLException e = (SQLException) thrown;
        Assertions.assertThat(e.getSQLState()).as(e.getMessage()).isEqualTo(sqlState);
        return e;
    }

    @Nonnull
    static BridgeException assertBridgeFailure(@Nonnull ErrorCode code, @Nonnull ThrowableAssert.ThrowingCallable call) {
        final Throwable thrown = Assertions.catchThrowable(call);
        Assertions.assertThat(thrown).isInstanceOf(BridgeException.class);
        final BridgeException e = (BridgeException) thrown;
        Assertions.assertThat(e.getErrorCode()).as(e.getMessage()).isEqualTo(code);
        return e;
    }

    /**
     * Poll until {@code condition} holds.
     *
     * @param description what is awaited, for the failure message
     * @param condition the condition
     * @throws InterruptedException if interrupted while polling
     */
    static void awaitCondition(@Nonnull String description, @Nonnull BooleanSupplier condition) throws InterruptedException {
        final long giveUpAt = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - giveUpAt > 0) {
                Assertions.fail("Timed out waiting until " + description);
            }
            Thread.sleep(10);
        }
    }
}
