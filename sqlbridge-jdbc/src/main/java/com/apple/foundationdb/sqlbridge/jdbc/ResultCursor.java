/*
 * ResultCursor.java
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
import com.apple.foundationdb.sqlbridge.api.logging.KeyValueLogMessage;
import com.apple.foundationdb.sqlbridge.api.logging.LogMessageKeys;
import com.apple.foundationdb.sqlbridge.protocol.BridgeCodec;
import com.apple.foundationdb.sqlbridge.protocol.v1.Page;
import com.apple.foundationdb.sqlbridge.protocol.v1.QueryResponse;
import com.apple.foundationdb.sqlbridge.protocol.v1.Response;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.ColumnMetadata;
import com.apple.foundationdb.sqlbridge.protocol.v1.column.Row;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.lang.ref.Cleaner;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A forward-only cursor over a result set held by the bridge, buffering one page of rows at a time.
 *
 * <p>Moving past the buffered page fetches the next one over the route the query ran on. Advances are serialized,
 * so pages are consumed in the order the bridge hands them out. The bridge frees the result set itself once it
 * reports the last page; a cursor closed before that sends a close request, and a cursor dropped without being
 * closed has that request sent for it by a {@link Cleaner}.</p>
 */
final class ResultCursor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ResultCursor.class);

    private static final Cleaner CLEANER = Cleaner.create(new ThreadFactoryBuilder()
            .setNameFormat("sqlbridge-cursor-cleaner-%d")
            .setDaemon(true)
            .build());

    @Nullable
    private final RequestRoute route;
    @Nonnull
    private final List<ColumnMetadata> columns;
    private final long handle;
    @GuardedBy("this")
    private int pageSize;
    @Nullable
    private final Duration requestTimeout;
    @Nonnull
    private final HandleRelease release;
    @Nullable
    private final Cleaner.Cleanable cleanable;

    @GuardedBy("this")
    private List<Row> page;
    @GuardedBy("this")
    private int position = -1;
    @GuardedBy("this")
    private boolean exhausted;
    @GuardedBy("this")
    private boolean closed;
    @GuardedBy("this")
    private long rowNumber;

    private ResultCursor(@Nullable RequestRoute route, @Nonnull List<ColumnMetadata> columns, long handle, int pageSize,
                         @Nullable Duration requestTimeout, @Nonnull Page firstPage) {
        this.route = route;
        this.columns = columns;
        this.handle = handle;
        this.pageSize = pageSize;
        this.requestTimeout = requestTimeout;
        this.page = firstPage.getRowList();
        this.exhausted = firstPage.getExhausted();
        this.release = new HandleRelease(route, handle);
        if (exhausted || route == null) {
            release.claim();
            this.cleanable = null;
        } else {
            this.cleanable = CLEANER.register(this, release);
        }
    }

    /**
     * Wrap the response to a query, whose first page has been checked with {@link #checkPage(List, Page, int)}.
     *
     * @param route the route the query ran on, used for further pages
     * @param response the query response
     * @param pageSize rows to ask for per page
     * @param requestTimeout execution timeout of each page request, or {@code null} for the configured one
     * @return the cursor, positioned before the first row
     */
    @Nonnull
    static ResultCursor open(@Nonnull RequestRoute route, @Nonnull QueryResponse response, int pageSize,
                             @Nullable Duration requestTimeout) {
        return new ResultCursor(route, response.getMetadata().getColumnList(), response.getResultSetHandle(), pageSize,
                requestTimeout, response.getFirstPage());
    }

    /**
     * A cursor over rows held in memory, with nothing to release on the bridge.
     *
     * @param columns the columns
     * @param rows the rows
     * @return the cursor, positioned before the first row
     */
    @Nonnull
    static ResultCursor ofRows(@Nonnull List<ColumnMetadata> columns, @Nonnull List<Row> rows) {
        return new ResultCursor(null, columns, 0L, Math.max(rows.size(), 1), null,
                Page.newBuilder().addAllRow(rows).setExhausted(true).build());
    }

    /**
     * Check a page the bridge sent against the columns of its result set.
     *
     * @param columns the columns of the result set
     * @param page the page
     * @param pageSize the number of rows asked for
     * @throws BridgeException with {@link ErrorCode#PROTOCOL_VIOLATION} if the page is larger than asked for, is
     *     empty without being the last, or has a row of the wrong width
     */
    static void checkPage(@Nonnull List<ColumnMetadata> columns, @Nonnull Page page, int pageSize) throws BridgeException {
        if (page.getRowCount() > pageSize) {
            throw new BridgeException("Page of " + page.getRowCount() + " rows exceeds the requested " + pageSize,
                    ErrorCode.PROTOCOL_VIOLATION);
        }
        if (page.getRowCount() == 0 && !page.getExhausted()) {
            throw new BridgeException("Empty page before the end of the result set", ErrorCode.PROTOCOL_VIOLATION);
        }
        for (Row row : page.getRowList()) {
            if (row.getColumnCount() != columns.size()) {
                throw new BridgeException("Row has " + row.getColumnCount() + " columns, expected " + columns.size(),
                        ErrorCode.PROTOCOL_VIOLATION);
            }
        }
    }

    @Nonnull
    List<ColumnMetadata> getColumns() {
        return columns;
    }

    long getHandle() {
        return handle;
    }

    synchronized int getPageSize() {
        return pageSize;
    }

    /**
     * Change the number of rows asked for by later page fetches.
     *
     * @param pageSize the page size, at least 1
     */
    synchronized void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    /**
     * Move to the next row, fetching a page if the buffered one is used up.
     *
     * @return {@code true} if there is a row, {@code false} past the last one
     * @throws BridgeException if the cursor is closed or a page could not be fetched
     */
    synchronized boolean advance() throws BridgeException {
        checkOpen();
        while (position + 1 >= page.size()) {
            if (exhausted) {
                position = page.size();
                return false;
            }
            fetchNextPage();
        }
        position++;
        rowNumber++;
        return true;
    }

    @GuardedBy("this")
    private void fetchNextPage() throws BridgeException {
        if (route == null) {
            throw new BridgeException("Result set " + handle + " has no route to fetch from", ErrorCode.INTERNAL_ERROR);
        }
        final int requested = pageSize;
        final Response response = route.send(BridgeCodec.fetchPage(handle, requested), requestTimeout,
                r -> checkPage(columns, r.getFetchPage().getPage(), requested));
        final Page next = response.getFetchPage().getPage();
        page = next.getRowList();
        position = -1;
        exhausted = next.getExhausted();
        if (logger.isTraceEnabled()) {
            logger.trace(KeyValueLogMessage.of("Fetched page",
                    LogMessageKeys.RESULT_SET_HANDLE, handle,
                    LogMessageKeys.ROW_COUNT, page.size(),
                    LogMessageKeys.PAGE_SIZE, pageSize));
        }
        if (exhausted) {
            // the bridge freed the handle with the last page
            release.claim();
            if (cleanable != null) {
                cleanable.clean();
            }
        }
    }

    /**
     * The row the cursor is on.
     *
     * @return the row
     * @throws BridgeException with {@link ErrorCode#INVALID_CURSOR_STATE} before the first or after the last row
     */
    @Nonnull
    synchronized Row currentRow() throws BridgeException {
        checkOpen();
        if (position < 0 || position >= page.size()) {
            throw new BridgeException("Cursor is not on a row", ErrorCode.INVALID_CURSOR_STATE);
        }
        return page.get(position);
    }

    /**
     * One-based number of the current row, or 0 if there is none.
     *
     * @return the row number
     */
    synchronized long getRowNumber() {
        return position >= 0 && position < page.size() ? rowNumber : 0L;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    private void checkOpen() throws BridgeException {
        if (closed) {
            throw new BridgeException("ResultSet closed", ErrorCode.RESULT_SET_CLOSED);
        }
    }

    /**
     * Close the cursor, releasing the result set on the bridge if it has not been read to the end.
     *
     * @throws BridgeException if the close request failed
     */
    @Override
    public synchronized void close() throws BridgeException {
        if (closed) {
            return;
        }
        closed = true;
        page = List.of();
        if (release.claim()) {
            try {
                release.send();
            } finally {
                if (cleanable != null) {
                    cleanable.clean();
                }
            }
        }
    }

    /**
     * Releases the bridge's result set at most once, either from {@link #close()} or, for a cursor that became
     * unreachable first, from the cleaner thread. Holds no reference to the cursor.
     */
    private static final class HandleRelease implements Runnable {
        @Nullable
        private final RequestRoute route;
        private final long handle;
        private final AtomicBoolean outstanding = new AtomicBoolean(true);

        HandleRelease(@Nullable RequestRoute route, long handle) {
            this.route = route;
            this.handle = handle;
        }

        boolean claim() {
            return outstanding.compareAndSet(true, false);
        }

        void send() throws BridgeException {
            if (route == null || !route.isOpen()) {
                if (logger.isDebugEnabled()) {
                    logger.debug(KeyValueLogMessage.of("Route gone, result set left for the bridge to free",
                            LogMessageKeys.RESULT_SET_HANDLE, handle));
                }
                return;
            }
            route.send(BridgeCodec.closeResultSet(handle), null, ResponseValidator.NONE);
        }

        @Override
        public void run() {
            if (!claim()) {
                return;
            }
            logger.warn(KeyValueLogMessage.of("ResultSet was not closed before it became unreachable",
                    LogMessageKeys.RESULT_SET_HANDLE, handle));
            try {
                send();
            } catch (BridgeException e) {
                logger.warn(KeyValueLogMessage.of("Failed to release leaked result set",
                        LogMessageKeys.RESULT_SET_HANDLE, handle,
                        LogMessageKeys.ERROR_CODE, e.getErrorCode()), e);
            }
        }
    }
}
