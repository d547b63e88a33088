/*
 * StatusProbe.java
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

import com.apple.foundationdb.sqlbridge.api.ServerStatus;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.apple.foundationdb.sqlbridge.protocol.v1.StatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * Asks a bridge for its status over a connection of its own, outside of any pool.
 */
public final class StatusProbe {
    private static final Logger logger = LoggerFactory.getLogger(StatusProbe.class);

    private StatusProbe() {
    }

    /**
     * Open a connection to the configured endpoint, send a status request on it, and close it again. The request
     * obeys the configured execution timeout and read deadline.
     *
     * @param config the endpoint and deadlines
     * @return the bridge's status
     * @throws BridgeException if the bridge could not be reached or did not answer in time
     */
    @Nonnull
    public static ServerStatus probe(@Nonnull ConnectionConfig config) throws BridgeException {
        final long start = System.nanoTime();
        try (WireConnection connection = WireConnection.open(config, DeadlineManager.forConfig(config))) {
            final ServerStatus status = toServerStatus(connection.roundTrip(BridgeCodec.status(), null, ResponseValidator.NONE));
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Probed bridge status",
                        LogMessageKeys.ENDPOINT, config.getEndpoint(),
                        LogMessageKeys.CONNECTION_ID, connection.getId(),
                        LogMessageKeys.ELAPSED_MILLIS, (System.nanoTime() - start) / 1_000_000L));
            }
            return status;
        }
    }

    @Nonnull
    static ServerStatus toServerStatus(@Nonnull Response response) {
        final StatusResponse status = response.getStatus();
        return new ServerStatus(status.getVersion(), Duration.ofMillis(status.getUptimeMillis()),
                status.getActiveConnections(), status.getOpenStatements(), status.getOpenResultSets(),
                status.getOpenTransactions());
    }
}
