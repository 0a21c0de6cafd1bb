/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * An exception indicating a problem parsing JSON into a document. It covers
 * both illegal JSON and {@link java.io.IOException} errors during parsing.
 * If available the location in the JSON input is provided.
 */
public class JsonParseException extends CursorException {

    private static final long serialVersionUID = 1L;

    private final transient JsonLocation location;

    /**
     * @hidden
     * @param msg the exception message
     * @param location the location in the input, or null
     */
    public JsonParseException(String msg, JsonLocation location) {
        super(msg);
        this.location = location;
    }

    /**
     * Returns the location of the problem in the JSON input, or null if
     * it is not known.
     *
     * @return the location, or null
     */
    public JsonLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location == null) {
            return super.getMessage();
        }
        return super.getMessage() + ", at line " + location.getLineNr() +
            ", column " + location.getColumnNr();
    }
}
