/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

/**
 * The outcome of a single advance of a cursor: either a produced value or
 * the "no value" marker. Produced values are never null, so a value equal to
 * zero, an empty string, false or {@code Optional.empty()} is never mistaken
 * for the end of the results.
 */
final class NextResult<T> {

    private static final NextResult<?> NONE = new NextResult<Object>(null);

    private final T value;

    private NextResult(T value) {
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    static <T> NextResult<T> none() {
        return (NextResult<T>) NONE;
    }

    static <T> NextResult<T> of(T value) {
        assert value != null : "a produced value is never null";
        return new NextResult<T>(value);
    }

    boolean isNone() {
        return this == NONE;
    }

    T get() {
        if (isNone()) {
            throw new IllegalStateException("No value");
        }
        return value;
    }

    /*
     * null for "no value", the form the public API hands out
     */
    T orNull() {
        return value;
    }
}
