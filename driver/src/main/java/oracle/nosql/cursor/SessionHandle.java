/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

/**
 * A handle on a server-side session that scopes one or more operations.
 * A cursor owns its session exclusively and ends it exactly once, when the
 * cursor terminates.
 */
public interface SessionHandle {

    /**
     * Ends the session. Calling this more than once has no further effect.
     */
    void end();

    /**
     * Returns whether {@link #end} has been called.
     *
     * @return true if the session has ended
     */
    boolean hasEnded();
}
