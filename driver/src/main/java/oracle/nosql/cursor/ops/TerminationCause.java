/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

/*
 * Why a cursor left its non-terminal states. Only NATURAL leads to
 * EXHAUSTED, the others to KILLED.
 */
enum TerminationCause {
    NATURAL,
    CLOSED,
    TRANSFORM_FAILED,
    UPSTREAM_FAILED;

    CursorState targetState() {
        return (this == NATURAL ? CursorState.EXHAUSTED : CursorState.KILLED);
    }
}
