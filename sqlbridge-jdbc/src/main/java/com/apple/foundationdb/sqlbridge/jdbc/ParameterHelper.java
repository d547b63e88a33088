/*
 * ParameterHelper.java
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
import com.apple.foundationdb.sqlbridge.protocol.TypeConversion;
import com.apple.foundationdb.sqlbridge.protocol.v1.Parameter;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Column;

import java.sql.Timestamp;
import java.sql.Types;

public final class ParameterHelper {

    private ParameterHelper() {
    }

    public static Parameter ofBoolean(boolean b) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.BOOLEAN)
                .setParameter(Column.newBuilder().setLong(b ? 1L : 0L))
                .build();
    }

    public static Parameter ofInt(int i) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.INTEGER)
                .setParameter(Column.newBuilder().setLong(i))
                .build();
    }

    public static Parameter ofLong(long l) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.BIGINT)
                .setParameter(Column.newBuilder().setLong(l))
                .build();
    }

    public static Parameter ofDouble(double d) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.DOUBLE)
                .setParameter(Column.newBuilder().setDouble(d))
                .build();
    }

    public static Parameter ofString(String s) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.VARCHAR)
                .setParameter(Column.newBuilder().setString(s))
                .build();
    }

    public static Parameter ofTimestamp(Timestamp t) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.TIMESTAMP)
                .setParameter(Column.newBuilder().setTimestamp(TypeConversion.toProtobuf(t.toInstant())))
                .build();
    }

    public static Parameter ofNull(int sqlType) {
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(Types.NULL)
                .setParameter(TypeConversion.nullColumn(sqlType))
                .build();
    }

    public static Parameter ofObject(Object x) throws BridgeException {
        final Column column = TypeConversion.toColumn(x);
        return Parameter.newBuilder()
                .setJavaSqlTypesCode(TypeConversion.toSqlType(column))
                .setParameter(column)
                .build();
    }
}
