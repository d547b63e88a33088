/*
 * package-info.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2021-2024 Apple Inc. and the FoundationDB project authors
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

/**
 * SQL Bridge JDBC Driver
 *
 * The bridge JDBC URL starts with <code>jdbc:bridge:tcp://</code> and names the host and port a bridge process
 * listens on. The query string carries connection parameters; see {@link com.apple.foundationdb.sqlbridge.jdbc.ConnectionParameter}.
 * For example:
 * <pre>
 *  jdbc:bridge:tcp://127.0.0.1
 *  jdbc:bridge:tcp://localhost:7777/
 *  jdbc:bridge:tcp://bridge.example.com:7777/?queryTimeout=30&amp;readDeadline=10&amp;fetchSize=500
 * </pre>
 *
 * <h2>Requests</h2>
 * Every JDBC call that needs the bridge becomes one request frame, tagged with a correlation id, on a pooled socket.
 * Requests on one socket may be answered in any order; a reader thread per socket hands each response to the caller
 * whose id it carries. Callers wait for their response under two deadlines: the execution timeout, also sent to the
 * bridge, and the read deadline. An expired read deadline leaves the socket out of sync, so the socket is discarded.
 *
 * <h2>Exceptions</h2>
 * Internally everything throws {@link com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException}, carrying an
 * {@link com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode}. The JDBC classes convert at their boundary into
 * the {@link java.sql.SQLException} subclass for the code's
 * {@link com.apple.foundationdb.sqlbridge.api.exceptions.ErrorKind}. Errors the bridge reports for a statement keep
 * the bridge's SQLState and vendor code.
 */
// Names in this package carry a BridgeJDBC prefix for the same reason the driver is not called Driver: the simple
// names would shadow the java.sql interfaces they implement.
package com.apple.foundationdb.sqlbridge.jdbc;
