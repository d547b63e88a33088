/*
 * ResponseValidator.java
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
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;

import javax.annotation.Nonnull;

/**
 * Checks a response beyond its envelope. Runs on the thread that sent the request; an exception of kind
 * {@link com.apple.foundationdb.sqlbridge.api.exceptions.ErrorKind#PROTOCOL} breaks the connection that carried it.
 */
@FunctionalInterface
interface ResponseValidator {
    ResponseValidator NONE = response -> { };

    void check(@Nonnull Response response) throws BridgeException;
}
