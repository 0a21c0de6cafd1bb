/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import oracle.nosql.cursor.CursorUsageException;

/**
 * The ordered list of mapping functions registered on a cursor with
 * {@link Cursor#map}. Functions run in registration order, each one on the
 * output of the previous one. None of them may return null.
 * <p>
 * Instances are not thread-safe; the owning cursor guards them.
 */
final class TransformChain {

    private final List<Function<Object, Object>> transforms;

    TransformChain() {
        transforms = new ArrayList<Function<Object, Object>>();
    }

    private TransformChain(List<Function<Object, Object>> transforms) {
        this.transforms = new ArrayList<Function<Object, Object>>(transforms);
    }

    @SuppressWarnings("unchecked")
    void add(Function<?, ?> transform) {
        transforms.add((Function<Object, Object>) transform);
    }

    int size() {
        return transforms.size();
    }

    /**
     * Runs every transform on the raw value. An exception thrown by a
     * transform is propagated as is.
     *
     * @throws CursorUsageException if a transform returns null
     */
    Object apply(Object raw) {
        Object current = raw;
        for (int i = 0; i < transforms.size(); i++) {
            current = transforms.get(i).apply(current);
            if (current == null) {
                throw new CursorUsageException(
                    "Cursor transform " + (i + 1) + " of " +
                    transforms.size() + " returned null; a transform " +
                    "must return a value");
            }
        }
        return current;
    }

    TransformChain copy() {
        return new TransformChain(transforms);
    }
}
