/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

/**
 * Thrown when a cursor is used in a way its API does not allow, for example
 * when two pulling operations overlap on the same cursor, when a transform
 * registered with {@code map} returns null, or when a transform is added
 * after iteration has started.
 * <p>
 * A usage error is never retryable.
 */
public class CursorUsageException extends CursorException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public CursorUsageException(String msg) {
        super(msg);
    }
}
