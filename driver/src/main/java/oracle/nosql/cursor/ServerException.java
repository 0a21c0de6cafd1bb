/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

/**
 * An exception a {@link BatchSource} may use to report that the server
 * rejected a request, for example because the filter of a query is
 * malformed. The cursor passes it to the caller unchanged.
 */
public class ServerException extends CursorException {

    private static final long serialVersionUID = 1L;

    private final int errorCode;
    private final boolean retryable;

    /**
     * Creates a non-retryable server exception.
     *
     * @param errorCode the error code reported by the server
     * @param msg the message
     */
    public ServerException(int errorCode, String msg) {
        this(errorCode, msg, false);
    }

    /**
     * Creates a server exception.
     *
     * @param errorCode the error code reported by the server
     * @param msg the message
     * @param retryable whether the operation may succeed if retried
     */
    public ServerException(int errorCode, String msg, boolean retryable) {
        super(msg);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    /**
     * Returns the error code reported by the server.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return errorCode;
    }

    @Override
    public boolean okToRetry() {
        return retryable;
    }

    @Override
    public String toString() {
        return super.toString() + " (code " + errorCode + ")";
    }
}
