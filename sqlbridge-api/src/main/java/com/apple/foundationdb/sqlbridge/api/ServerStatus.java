/*
 * ServerStatus.java
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

package com.apple.foundationdb.sqlbridge.api;

import com.google.common.base.MoreObjects;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * A snapshot of the bridge's state, as reported by a status request.
 */
public final class ServerStatus {
    @Nonnull
    private final String version;
    @Nonnull
    private final Duration uptime;
    private final int activeConnections;
    private final int openStatements;
    private final int openResultSets;
    private final int openTransactions;

    public ServerStatus(@Nonnull String version, @Nonnull Duration uptime, int activeConnections,
                        int openStatements, int openResultSets, int openTransactions) {
        this.version = version;
        this.uptime = uptime;
        this.activeConnections = activeConnections;
        this.openStatements = openStatements;
        this.openResultSets = openResultSets;
        this.openTransactions = openTransactions;
    }

    @Nonnull
    public String getVersion() {
        return version;
    }

    @Nonnull
    public Duration getUptime() {
        return uptime;
    }

    /**
     * Number of client sockets the bridge currently has open, including the one that asked.
     *
     * @return the active connection count
     */
    public int getActiveConnections() {
        return activeConnections;
    }

    public int getOpenStatements() {
        return openStatements;
    }

    public int getOpenResultSets() {
        return openResultSets;
    }

    public int getOpenTransactions() {
        return openTransactions;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("version", version)
                .add("uptime", uptime)
                .add("activeConnections", activeConnections)
                .add("openStatements", openStatements)
                .add("openResultSets", openResultSets)
                .add("openTransactions", openTransactions)
                .toString();
    }
}
