/*
 * BridgeJDBCResultSet.java
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

import com.apple.foundationdb.sqlbridge.api.BridgeResultSet;
import com.apple.foundationdb.sqlbridge.api.BridgeStatement;
import com.apple.foundationdb.sqlbridge.api.exceptions.BridgeException;
import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;
import com.apple.foundationdb.sqlbridge.protocol.TypeConversion;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Column;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.ColumnMetadata;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Shorts;

import javax.annotation.Nonnull;
import java.sql.Date;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * JDBC view of a {@link ResultCursor}. Values are converted between the wire kinds where the conversion is lossless
 * or standard JDBC practice; anything else fails with {@link ErrorCode#CANNOT_CONVERT_TYPE}.
 */
class BridgeJDBCResultSet implements BridgeResultSet {
    @Nonnull
    private final BridgeStatement statement;
    @Nonnull
    private final ResultCursor cursor;
    @Nonnull
    private final List<ColumnMetadata> columns;
    @Nonnull
    private final Map<String, Integer> labels;
    private final long maxRows;
    private long rowsReturned;
    private boolean lastWasNull;

    BridgeJDBCResultSet(@Nonnull BridgeStatement statement, @Nonnull ResultCursor cursor, long maxRows) {
        this.statement = statement;
        this.cursor = cursor;
        this.columns = cursor.getColumns();
        this.maxRows = maxRows;
        this.labels = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < columns.size(); i++) {
            // the first of two columns with the same label wins, as in most drivers
            labels.putIfAbsent(columns.get(i).getName(), i + 1);
        }
    }

    @Override
    public boolean next() throws SQLException {
        try {
            if (maxRows > 0 && rowsReturned >= maxRows) {
                if (cursor.isClosed()) {
                    throw new BridgeException("ResultSet closed", ErrorCode.RESULT_SET_CLOSED);
                }
                return false;
            }
            final boolean hasRow = cursor.advance();
            if (hasRow) {
                rowsReturned++;
            }
            return hasRow;
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public void close() throws SQLException {
        try {
            cursor.close();
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    public boolean isClosed() throws SQLException {
        return cursor.isClosed();
    }

    @Override
    public boolean wasNull() throws SQLException {
        return lastWasNull;
    }

    @Nonnull
    private Column column(int oneBasedColumn) throws SQLException {
        final int index = BridgeJDBCResultSetMetaData.toProtobufIndex(columns, oneBasedColumn);
        final Column column;
        try {
            column = cursor.currentRow().getColumn(index);
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
        lastWasNull = column.getKindCase() == Column.KindCase.NULL_TYPE;
        return column;
    }

    private static SQLException cannotConvert(@Nonnull Column column, @Nonnull String target) {
        return new BridgeException("Cannot convert " + column.getKindCase() + " value to " + target,
                ErrorCode.CANNOT_CONVERT_TYPE).toSqlException();
    }

    @Override
    public String getString(int oneBasedColumn) throws SQLException {
        final Column column = column(oneBasedColumn);
        switch (column.getKindCase()) {
            case STRING:
                return column.getString();
            case LONG:
                return Long.toString(column.getLong());
            case DOUBLE:
                return Double.toString(column.getDouble());
            case TIMESTAMP:
                return TypeConversion.toTimestamp(column.getTimestamp()).toString();
            case NULL_TYPE:
                return null;
            default:
                throw cannotConvert(column, "String");
        }
    }

    @Override
    public boolean getBoolean(int oneBasedColumn) throws SQLException {
        final Column column = column(oneBasedColumn);
        switch (column.getKindCase()) {
            case LONG:
                return column.getLong() != 0L;
            case DOUBLE:
                return column.getDouble() != 0.0d;
            case STRING:
                return parseBoolean(column);
            case NULL_TYPE:
                return false;
            default:
                throw cannotConvert(column, "boolean");
        }
    }

    private static boolean parseBoolean(@Nonnull Column column) throws SQLException {
        final String value = column.getString().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(value) || "1".equals(value)) {
            return true;
        } else if ("false".equals(value) || "0".equals(value)) {
            return false;
        }
        throw cannotConvert(column, "boolean");
    }

    @Override
    public long getLong(int oneBasedColumn) throws SQLException {
        final Column column = column(oneBasedColumn);
        switch (column.getKindCase()) {
            case LONG:
                return column.getLong();
            case DOUBLE:
                return (long) column.getDouble();
            case STRING:
                try {
                    return Long.parseLong(column.getString().trim());
                } catch (NumberFormatException e) {
                    throw cannotConvert(column, "long");
                }
            case NULL_TYPE:
                return 0L;
            default:
                throw cannotConvert(column, "long");
        }
    }

    @Override
    public int getInt(int oneBasedColumn) throws SQLException {
        final long value = getLong(oneBasedColumn);
        try {
            return Ints.checkedCast(value);
        } catch (IllegalArgumentException e) {
            throw new BridgeException("Value " + value + " does not fit in an int", ErrorCode.CANNOT_CONVERT_TYPE, e)
                    .toSqlException();
        }
    }

    @Override
    public short getShort(int oneBasedColumn) throws SQLException {
        final long value = getLong(oneBasedColumn);
        try {
            return Shorts.checkedCast(value);
        } catch (IllegalArgumentException e) {
            throw new BridgeException("Value " + value + " does not fit in a short", ErrorCode.CANNOT_CONVERT_TYPE, e)
                    .toSqlException();
        }
    }

    @Override
    public double getDouble(int oneBasedColumn) throws SQLException {
        final Column column = column(oneBasedColumn);
        switch (column.getKindCase()) {
            case DOUBLE:
                return column.getDouble();
            case LONG:
                return column.getLong();
            case STRING:
                try {
                    return Double.parseDouble(column.getString().trim());
                } catch (NumberFormatException e) {
                    throw cannotConvert(column, "double");
                }
            case NULL_TYPE:
                return 0.0d;
            default:
                throw cannotConvert(column, "double");
        }
    }

    @Override
    public float getFloat(int oneBasedColumn) throws SQLException {
        return (float) getDouble(oneBasedColumn);
    }

    @Override
    public Timestamp getTimestamp(int oneBasedColumn) throws SQLException {
        final Column column = column(oneBasedColumn);
        switch (column.getKindCase()) {
            case TIMESTAMP:
                return TypeConversion.toTimestamp(column.getTimestamp());
            case STRING:
                try {
                    return Timestamp.valueOf(column.getString().trim());
                } catch (IllegalArgumentException e) {
                    throw cannotConvert(column, "Timestamp");
                }
            case NULL_TYPE:
                return null;
            default:
                throw cannotConvert(column, "Timestamp");
        }
    }

    @Override
    public Date getDate(int oneBasedColumn) throws SQLException {
        final Timestamp timestamp = getTimestamp(oneBasedColumn);
        return timestamp == null ? null : new Date(timestamp.getTime());
    }

    @Override
    public Time getTime(int oneBasedColumn) throws SQLException {
        final Timestamp timestamp = getTimestamp(oneBasedColumn);
        return timestamp == null ? null : new Time(timestamp.getTime());
    }

    @Override
    public Object getObject(int oneBasedColumn) throws SQLException {
        try {
            return TypeConversion.fromColumn(column(oneBasedColumn));
        } catch (BridgeException e) {
            throw e.toSqlException();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getObject(int oneBasedColumn, Class<T> type) throws SQLException {
        final Column column = column(oneBasedColumn);
        if (lastWasNull) {
            return null;
        }
        if (type == Object.class) {
            return (T) getObject(oneBasedColumn);
        } else if (type == Long.class) {
            return (T) Long.valueOf(getLong(oneBasedColumn));
        } else if (type == Integer.class) {
            return (T) Integer.valueOf(getInt(oneBasedColumn));
        } else if (type == Short.class) {
            return (T) Short.valueOf(getShort(oneBasedColumn));
        } else if (type == Double.class) {
            return (T) Double.valueOf(getDouble(oneBasedColumn));
        } else if (type == Float.class) {
            return (T) Float.valueOf(getFloat(oneBasedColumn));
        } else if (type == Boolean.class) {
            return (T) Boolean.valueOf(getBoolean(oneBasedColumn));
        } else if (type == String.class) {
            return (T) getString(oneBasedColumn);
        } else if (type == Timestamp.class) {
            return (T) getTimestamp(oneBasedColumn);
        } else if (type == Instant.class) {
            return (T) getTimestamp(oneBasedColumn).toInstant();
        } else if (type == LocalDateTime.class) {
            return (T) getTimestamp(oneBasedColumn).toLocalDateTime();
        }
        throw cannotConvert(column, type.getName());
    }

    @Override
    public int findColumn(String columnLabel) throws SQLException {
        final Integer index = columnLabel == null ? null : labels.get(columnLabel);
        if (index == null) {
            throw new BridgeException("No column labelled " + columnLabel, ErrorCode.INVALID_COLUMN_REFERENCE).toSqlException();
        }
        return index;
    }

    @Override
    public String getString(String columnLabel) throws SQLException {
        return getString(findColumn(columnLabel));
    }

    @Override
    public boolean getBoolean(String columnLabel) throws SQLException {
        return getBoolean(findColumn(columnLabel));
    }

    @Override
    public short getShort(String columnLabel) throws SQLException {
        return getShort(findColumn(columnLabel));
    }

    @Override
    public int getInt(String columnLabel) throws SQLException {
        return getInt(findColumn(columnLabel));
    }

    @Override
    public long getLong(String columnLabel) throws SQLException {
        return getLong(findColumn(columnLabel));
    }

    @Override
    public float getFloat(String columnLabel) throws SQLException {
        return getFloat(findColumn(columnLabel));
    }

    @Override
    public double getDouble(String columnLabel) throws SQLException {
        return getDouble(findColumn(columnLabel));
    }

    @Override
    public Date getDate(String columnLabel) throws SQLException {
        return getDate(findColumn(columnLabel));
    }

    @Override
    public Time getTime(String columnLabel) throws SQLException {
        return getTime(findColumn(columnLabel));
    }

    @Override
    public Timestamp getTimestamp(String columnLabel) throws SQLException {
        return getTimestamp(findColumn(columnLabel));
    }

    @Override
    public Object getObject(String columnLabel) throws SQLException {
        return getObject(findColumn(columnLabel));
    }

    @Override
    public <T> T getObject(String columnLabel, Class<T> type) throws SQLException {
        return getObject(findColumn(columnLabel), type);
    }

    @Override
    public ResultSetMetaData getMetaData() throws SQLException {
        return new BridgeJDBCResultSetMetaData(columns);
    }

    @Override
    public void setFetchSize(int rows) throws SQLException {
        if (rows < 0) {
            throw new BridgeException("Fetch size must not be negative: " + rows, ErrorCode.INVALID_PARAMETER).toSqlException();
        }
        if (rows > 0) {
            cursor.setPageSize(rows);
        }
    }

    @Override
    public int getFetchSize() throws SQLException {
        return cursor.getPageSize();
    }

    @Override
    public int getRow() throws SQLException {
        return Ints.saturatedCast(cursor.getRowNumber());
    }

    @Override
    public BridgeStatement getStatement() throws SQLException {
        return statement;
    }

    @Override
    public String toString() {
        return "BridgeJDBCResultSet(" + cursor.getHandle() + ")";
    }
}
