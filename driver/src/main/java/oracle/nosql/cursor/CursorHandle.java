/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import oracle.nosql.cursor.ops.Cursor;
import oracle.nosql.cursor.ops.FindRequest;
import oracle.nosql.cursor.values.Document;

/**
 * CursorHandle is the entry point for running queries whose results are read
 * through a {@link Cursor}. A handle is created with
 * {@link CursorHandleFactory#createCursorHandle} and combines a
 * {@link BatchSource}, which performs the round trips, with a
 * {@link SessionManager}, which supplies a session per cursor.
 * <p>
 * The handle is thread-safe. Each cursor it returns is not, see
 * {@link Cursor}. Closing the handle closes the cursors it created that are
 * still open.
 */
public interface CursorHandle extends AutoCloseable {

    /**
     * Creates a cursor over the results of a query. No round trip is made
     * until the cursor is first used. Unset request parameters are taken from
     * the handle's {@link CursorConfig}. The request is copied, so later
     * changes to it do not affect the cursor.
     *
     * @param request the query
     *
     * @return the cursor
     *
     * @throws IllegalArgumentException if the request is null
     * @throws IllegalStateException if the handle is closed
     */
    Cursor<Document> find(FindRequest request);

    /**
     * Closes the handle and every cursor it created that has not terminated,
     * waiting for the kill requests to complete. Failures are logged.
     * Calling this more than once has no further effect.
     */
    @Override
    void close();
}
