/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import static oracle.nosql.cursor.util.CheckNull.requireNonNullIAE;

import oracle.nosql.cursor.client.CursorHandleImpl;

/**
 * Factory class used to produce cursor handles.
 */
public class CursorHandleFactory {

    /**
     * Creates a handle that runs queries against the given source. The
     * application should invoke {@link CursorHandle#close} when it is done,
     * to release cursors that are still open.
     *
     * @param config the configuration parameters
     * @param source performs the round trips
     * @param sessionManager supplies a session for each cursor
     *
     * @return a valid {@link CursorHandle} instance, ready for use
     *
     * @throws IllegalArgumentException if an argument is null
     *
     * @see CursorHandle#close
     */
    public static CursorHandle createCursorHandle(
        CursorConfig config,
        BatchSource source,
        SessionManager sessionManager) {

        requireNonNullIAE(config,
            "CursorHandleFactory.createCursorHandle: config cannot be null");
        requireNonNullIAE(source,
            "CursorHandleFactory.createCursorHandle: source cannot be null");
        requireNonNullIAE(sessionManager,
            "CursorHandleFactory.createCursorHandle: sessionManager " +
            "cannot be null");
        return new CursorHandleImpl(config.clone(), source, sessionManager);
    }
}
