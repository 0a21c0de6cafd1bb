/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

/**
 * The lifecycle states of a {@link Cursor}. A cursor moves from
 * {@link #OPEN} to {@link #ITERATING} on its first fetch and ends in one of
 * the two terminal states.
 */
public enum CursorState {

    /**
     * Created, nothing fetched yet.
     */
    OPEN,

    /**
     * At least one batch has been fetched.
     */
    ITERATING,

    /**
     * Every document was consumed and one more was requested. The cursor
     * returns null from then on.
     */
    EXHAUSTED,

    /**
     * Terminated before exhaustion, by close or by a failure. Pulling
     * from the cursor throws {@link oracle.nosql.cursor.CursorExhaustedException}.
     */
    KILLED;

    /**
     * Returns whether the state is EXHAUSTED or KILLED.
     *
     * @return true for a terminal state
     */
    public boolean isTerminal() {
        return this == EXHAUSTED || this == KILLED;
    }
}
