/*
 * TypeConversion.java
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

package com.apple.foundationdb.sqlbridge.protocol;

import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Column;
import com.google.protobuf.Timestamp;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Conversion between Java values and the protobuf {@link Column} carried on the wire. Used by the driver to bind
 * parameters and decode rows, and by bridges to do the reverse.
 *
 * <p>The wire knows five kinds of value: 64-bit integers, text, doubles, timestamps and null. Narrower integers and
 * booleans widen to 64-bit integers, floats widen to doubles. Timestamps keep nanosecond precision end to end.</p>
 */
public final class TypeConversion {

    private TypeConversion() {
    }

    /**
     * Create a {@link Column} from a Java object.
     *
     * @param value the value, or {@code null} for SQL NULL
     * @return the column
     * @throws BridgeException with {@link ErrorCode#INVALID_PARAMETER} if the type cannot travel on the wire
     */
    @Nonnull
    public static Column toColumn(@Nullable Object value) throws BridgeException {
        final Column.Builder builder = Column.newBuilder();
        if (value == null) {
            return builder.setNullType(Types.NULL).build();
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return builder.setLong(((Number) value).longValue()).build();
        } else if (value instanceof Boolean) {
            return builder.setLong((Boolean) value ? 1L : 0L).build();
        } else if (value instanceof Double || value instanceof Float) {
            return builder.setDouble(((Number) value).doubleValue()).build();
        } else if (value instanceof String) {
            return builder.setString((String) value).build();
        } else if (value instanceof Character) {
            return builder.setString(value.toString()).build();
        } else if (value instanceof java.sql.Timestamp) {
            return builder.setTimestamp(toProtobuf(((java.sql.Timestamp) value).toInstant())).build();
        } else if (value instanceof Instant) {
            return builder.setTimestamp(toProtobuf((Instant) value)).build();
        } else if (value instanceof LocalDateTime) {
            return builder.setTimestamp(toProtobuf(((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant())).build();
        } else if (value instanceof java.util.Date) {
            // java.sql.Date and java.sql.Time do not support toInstant()
            return builder.setTimestamp(toProtobuf(Instant.ofEpochMilli(((java.util.Date) value).getTime()))).build();
        }
        throw new BridgeException("Values of type " + value.getClass().getName() + " cannot be sent to the bridge",
                ErrorCode.INVALID_PARAMETER);
    }

    /**
     * A typed SQL NULL.
     *
     * @param sqlType the {@link Types} code of the null
     * @return the column
     */
    @Nonnull
    public static Column nullColumn(int sqlType) {
        return Column.newBuilder().setNullType(sqlType).build();
    }

    /**
     * Return the Java object stored within the proto: a {@link Long}, {@link String}, {@link Double},
     * {@link java.sql.Timestamp}, or {@code null}.
     *
     * @param column the column to read
     * @return the value
     * @throws BridgeException with {@link ErrorCode#PROTOCOL_VIOLATION} if the column carries no value at all
     */
    @Nullable
    public static Object fromColumn(@Nonnull Column column) throws BridgeException {
        switch (column.getKindCase()) {
            case LONG:
                return column.getLong();
            case STRING:
                return column.getString();
            case DOUBLE:
                return column.getDouble();
            case TIMESTAMP:
                return toTimestamp(column.getTimestamp());
            case NULL_TYPE:
                return null;
            default:
                throw new BridgeException("Column carries no value", ErrorCode.PROTOCOL_VIOLATION);
        }
    }

    /**
     * The {@link Types} code matching the kind of value a column holds.
     *
     * @param column the column
     * @return the SQL type code
     */
    public static int toSqlType(@Nonnull Column column) {
        switch (column.getKindCase()) {
            case LONG:
                return Types.BIGINT;
            case STRING:
                return Types.VARCHAR;
            case DOUBLE:
                return Types.DOUBLE;
            case TIMESTAMP:
                return Types.TIMESTAMP;
            default:
                return Types.NULL;
        }
    }

    @Nonnull
    public static Timestamp toProtobuf(@Nonnull Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    @Nonnull
    public static Instant toInstant(@Nonnull Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    @Nonnull
    public static java.sql.Timestamp toTimestamp(@Nonnull Timestamp timestamp) {
        return java.sql.Timestamp.from(toInstant(timestamp));
    }
}
