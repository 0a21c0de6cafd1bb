/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

/**
 * Thrown when a document is requested from a cursor that was killed, either
 * explicitly by {@code close()} or as a side effect of a failure. A cursor
 * that ran out of results naturally does not throw this exception; it keeps
 * returning null instead.
 */
public class CursorExhaustedException extends CursorUsageException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public CursorExhaustedException(String msg) {
        super(msg);
    }
}
