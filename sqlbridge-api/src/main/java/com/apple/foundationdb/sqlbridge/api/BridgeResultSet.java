/*
 * BridgeResultSet.java
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

import com.apple.foundationdb.sqlbridge.api.exceptions.ErrorCode;

import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.net.URL;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.NClob;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.RowId;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.Calendar;
import java.util.Map;

/**
 * A forward-only, read-only cursor over the rows of a query run on the bridge. Rows are pulled from the bridge one
 * page at a time as the cursor advances.
 */
public interface BridgeResultSet extends java.sql.ResultSet {

    @Override
    default int getType() throws SQLException {
        return ResultSet.TYPE_FORWARD_ONLY;
    }

    @Override
    default int getConcurrency() throws SQLException {
        return ResultSet.CONCUR_READ_ONLY;
    }

    @Override
    default int getFetchDirection() throws SQLException {
        return ResultSet.FETCH_FORWARD;
    }

    @Override
    default int getHoldability() throws SQLException {
        return ResultSet.CLOSE_CURSORS_AT_COMMIT;
    }

    @Override
    default SQLWarning getWarnings() throws SQLException {
        return null;
    }

    @Override
    default void clearWarnings() throws SQLException {
    }

    /* Unsupported JDBC features */
    @Override
    default byte getByte(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default byte getByte(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default byte[] getBytes(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default byte[] getBytes(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default BigDecimal getBigDecimal(int columnIndex, int scale) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default BigDecimal getBigDecimal(String columnLabel, int scale) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default BigDecimal getBigDecimal(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default BigDecimal getBigDecimal(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Date getDate(int columnIndex, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Date getDate(String columnLabel, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Time getTime(int columnIndex, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Time getTime(String columnLabel, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Timestamp getTimestamp(int columnIndex, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Timestamp getTimestamp(String columnLabel, Calendar cal) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getAsciiStream(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getAsciiStream(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getUnicodeStream(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getUnicodeStream(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getBinaryStream(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default InputStream getBinaryStream(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Reader getCharacterStream(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Reader getCharacterStream(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Reader getNCharacterStream(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Reader getNCharacterStream(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String getNString(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String getNString(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default String getCursorName() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Object getObject(int columnIndex, Map<String, Class<?>> map) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Object getObject(String columnLabel, Map<String, Class<?>> map) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Ref getRef(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Ref getRef(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Blob getBlob(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Blob getBlob(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Clob getClob(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Clob getClob(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default NClob getNClob(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default NClob getNClob(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Array getArray(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default Array getArray(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default URL getURL(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default URL getURL(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default RowId getRowId(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default RowId getRowId(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default SQLXML getSQLXML(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default SQLXML getSQLXML(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isBeforeFirst() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isAfterLast() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isFirst() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isLast() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void beforeFirst() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void afterLast() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean first() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean last() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean absolute(int row) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean relative(int rows) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean previous() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void setFetchDirection(int direction) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean rowUpdated() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean rowInserted() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean rowDeleted() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void insertRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void deleteRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void refreshRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void cancelRowUpdates() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void moveToInsertRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void moveToCurrentRow() throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    /* Updates are not supported */
    @Override
    default void updateNull(int columnIndex) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBoolean(int columnIndex, boolean x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateByte(int columnIndex, byte x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateShort(int columnIndex, short x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateInt(int columnIndex, int x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateLong(int columnIndex, long x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateFloat(int columnIndex, float x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateDouble(int columnIndex, double x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBigDecimal(int columnIndex, BigDecimal x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateString(int columnIndex, String x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBytes(int columnIndex, byte[] x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateDate(int columnIndex, Date x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateTime(int columnIndex, Time x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateTimestamp(int columnIndex, Timestamp x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(int columnIndex, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(int columnIndex, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(int columnIndex, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(int columnIndex, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(int columnIndex, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(int columnIndex, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(int columnIndex, Reader x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(int columnIndex, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(int columnIndex, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNCharacterStream(int columnIndex, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNCharacterStream(int columnIndex, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateObject(int columnIndex, Object x, int scaleOrLength) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateObject(int columnIndex, Object x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateRef(int columnIndex, Ref x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(int columnIndex, Blob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(int columnIndex, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(int columnIndex, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(int columnIndex, Clob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(int columnIndex, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(int columnIndex, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(int columnIndex, NClob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(int columnIndex, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(int columnIndex, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateArray(int columnIndex, Array x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateRowId(int columnIndex, RowId x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNString(int columnIndex, String x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateSQLXML(int columnIndex, SQLXML x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNull(String columnLabel) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBoolean(String columnLabel, boolean x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateByte(String columnLabel, byte x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateShort(String columnLabel, short x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateInt(String columnLabel, int x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateLong(String columnLabel, long x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateFloat(String columnLabel, float x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateDouble(String columnLabel, double x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBigDecimal(String columnLabel, BigDecimal x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateString(String columnLabel, String x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBytes(String columnLabel, byte[] x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateDate(String columnLabel, Date x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateTime(String columnLabel, Time x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateTimestamp(String columnLabel, Timestamp x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(String columnLabel, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(String columnLabel, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateAsciiStream(String columnLabel, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(String columnLabel, InputStream x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(String columnLabel, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBinaryStream(String columnLabel, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(String columnLabel, Reader x, int length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(String columnLabel, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateCharacterStream(String columnLabel, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNCharacterStream(String columnLabel, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNCharacterStream(String columnLabel, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateObject(String columnLabel, Object x, int scaleOrLength) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateObject(String columnLabel, Object x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateRef(String columnLabel, Ref x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(String columnLabel, Blob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(String columnLabel, InputStream x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateBlob(String columnLabel, InputStream x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(String columnLabel, Clob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(String columnLabel, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateClob(String columnLabel, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(String columnLabel, NClob x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(String columnLabel, Reader x, long length) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNClob(String columnLabel, Reader x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateArray(String columnLabel, Array x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateRowId(String columnLabel, RowId x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateNString(String columnLabel, String x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default void updateSQLXML(String columnLabel, SQLXML x) throws SQLException {
        throw new SQLFeatureNotSupportedException("Not supported by the bridge driver", ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException("Not a wrapper for " + iface.getName(), ErrorCode.UNSUPPORTED_OPERATION.getErrorCode());
    }

    @Override
    default boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this);
    }
}
