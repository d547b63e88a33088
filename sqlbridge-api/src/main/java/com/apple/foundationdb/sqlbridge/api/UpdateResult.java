/*
 * UpdateResult.java
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

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of a statement that does not return rows: the number of rows it affected and, for inserts into a table
 * with a generated key, the key the database assigned.
 */
public final class UpdateResult {
    private final long rowCount;
    @Nullable
    private final Long generatedKey;

    public UpdateResult(long rowCount, @Nullable Long generatedKey) {
        this.rowCount = rowCount;
        this.generatedKey = generatedKey;
    }

    public long getRowCount() {
        return rowCount;
    }

    public OptionalLong getGeneratedKey() {
        return generatedKey == null ? OptionalLong.empty() : OptionalLong.of(generatedKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UpdateResult that = (UpdateResult) o;
        return rowCount == that.rowCount && Objects.equals(generatedKey, that.generatedKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, generatedKey);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rowCount", rowCount)
                .add("generatedKey", generatedKey)
                .toString();
    }
}
