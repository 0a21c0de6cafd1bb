/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

/**
 * Creates the sessions cursors run under. Each cursor (and each rewind of a
 * cursor) starts a new session and becomes its only owner.
 */
@FunctionalInterface
public interface SessionManager {

    /**
     * Starts a new session.
     *
     * @return the session
     */
    SessionHandle startSession();
}
