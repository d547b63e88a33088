/*
 * BridgeJDBCResultSetMetaData.java
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
import com.apple.foundationdb.sqlbridge.protocol.v1.column.ColumnMetadata;

import javax.annotation.Nonnull;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

class BridgeJDBCResultSetMetaData implements ResultSetMetaData {
    @Nonnull
    private final List<ColumnMetadata> columns;

    BridgeJDBCResultSetMetaData(@Nonnull List<ColumnMetadata> columns) {
        this.columns = columns;
    }

    /**
     * Convert a one-based JDBC column index to the position in the protobuf row.
     *
     * @param columns the columns of the result set
     * @param oneBasedColumn the JDBC index
     * @return the zero-based index
     * @throws SQLException with {@link ErrorCode#INVALID_COLUMN_REFERENCE} if there is no such column
     */
    static int toProtobufIndex(@Nonnull List<ColumnMetadata> columns, int oneBasedColumn) throws SQLException {
        if (oneBasedColumn < 1 || oneBasedColumn > columns.size()) {
            throw new BridgeException("Column index " + oneBasedColumn + " out of range [1, " + columns.size() + "]",
                    ErrorCode.INVALID_COLUMN_REFERENCE).toSqlException();
        }
        return oneBasedColumn - 1;
    }

    private ColumnMetadata column(int oneBasedColumn) throws SQLException {
        return columns.get(toProtobufIndex(columns, oneBasedColumn));
    }

    @Override
    public int getColumnCount() throws SQLException {
        return columns.size();
    }

    @Override
    public String getColumnName(int oneBasedColumn) throws SQLException {
        return column(oneBasedColumn).getName();
    }

    @Override
    public String getColumnLabel(int oneBasedColumn) throws SQLException {
        return getColumnName(oneBasedColumn);
    }

    @Override
    public int getColumnType(int oneBasedColumn) throws SQLException {
        return column(oneBasedColumn).getJavaSqlTypesCode();
    }

    @Override
    public String getColumnTypeName(int oneBasedColumn) throws SQLException {
        return column(oneBasedColumn).getTypeName();
    }

    @Override
    public String getColumnClassName(int oneBasedColumn) throws SQLException {
        switch (getColumnType(oneBasedColumn)) {
            case Types.BIGINT:
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
            case Types.BOOLEAN:
                return Long.class.getName();
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.REAL:
                return Double.class.getName();
            case Types.TIMESTAMP:
            case Types.DATE:
            case Types.TIME:
                return Timestamp.class.getName();
            default:
                return String.class.getName();
        }
    }

    @Override
    public int isNullable(int oneBasedColumn) throws SQLException {
        return column(oneBasedColumn).getNullable() ? columnNullable : columnNoNulls;
    }

    @Override
    public boolean isAutoIncrement(int oneBasedColumn) throws SQLException {
        return false;
    }

    @Override
    public boolean isCaseSensitive(int oneBasedColumn) throws SQLException {
        return getColumnType(oneBasedColumn) == Types.VARCHAR;
    }

    @Override
    public boolean isSearchable(int oneBasedColumn) throws SQLException {
        return true;
    }

    @Override
    public boolean isCurrency(int oneBasedColumn) throws SQLException {
        return false;
    }

    @Override
    public boolean isSigned(int oneBasedColumn) throws SQLException {
        final int type = getColumnType(oneBasedColumn);
        return type == Types.BIGINT || type == Types.INTEGER || type == Types.DOUBLE;
    }

    @Override
    public int getColumnDisplaySize(int oneBasedColumn) throws SQLException {
        return 0;
    }

    @Override
    public String getSchemaName(int oneBasedColumn) throws SQLException {
        return "";
    }

    @Override
    public int getPrecision(int oneBasedColumn) throws SQLException {
        return 0;
    }

    @Override
    public int getScale(int oneBasedColumn) throws SQLException {
        return 0;
    }

    @Override
    public String getTableName(int oneBasedColumn) throws SQLException {
        return "";
    }

    @Override
    public String getCatalogName(int oneBasedColumn) throws SQLException {
        return "";
    }

    @Override
    public boolean isReadOnly(int oneBasedColumn) throws SQLException {
        return true;
    }

    @Override
    public boolean isWritable(int oneBasedColumn) throws SQLException {
        return false;
    }

    @Override
    public boolean isDefinitelyWritable(int oneBasedColumn) throws SQLException {
        return false;
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        return iface.cast(this);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this);
    }
}
