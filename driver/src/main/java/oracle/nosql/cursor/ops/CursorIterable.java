/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import static oracle.nosql.cursor.util.ConcurrentUtil.unwrapCompletionException;

import java.util.Iterator;
import java.util.NoSuchElementException;

import oracle.nosql.cursor.CursorException;

/**
 * CursorIterable represents an {@link Iterable} over the remaining results
 * of a {@link Cursor}. Iteration blocks the calling thread while batches are
 * fetched.
 * <p>
 * Example:
 * <pre>
 * CursorHandle handle = ...;
 *
 * try (CursorIterable&lt;Document&gt; docs =
 *          handle.find(new FindRequest().setNamespace("db.users"))
 *                .toIterable()) {
 *
 *     for (Document doc : docs) {
 *         // do something with doc
 *     }
 * }
 * </pre>
 * The iterator reads one value ahead: {@code hasNext()} produces the next
 * value, running the cursor's transforms on it, and {@code next()} returns
 * it. If producing a value fails the cursor is closed and the failure is
 * thrown from the iterator method that triggered it.
 * <p>
 * Note: Iterators returned by this class share the cursor, so only one can
 * be used at a time, and only by one thread at a time unless synchronized
 * externally.
 *
 * @param <T> the type of the values
 *
 * @see Cursor#toIterable()
 */
public class CursorIterable<T> implements Iterable<T>, AutoCloseable {

    private final Cursor<T> cursor;

    CursorIterable(Cursor<T> cursor) {
        this.cursor = cursor;
    }

    /**
     * Returns an iterator over the remaining results. The first round trip,
     * if one is needed, happens at the first hasNext()/next() call.
     *
     * @return the iterator
     */
    @Override
    public Iterator<T> iterator() {
        return new CursorIterator();
    }

    /**
     * Closes the underlying cursor.
     */
    @Override
    public void close() {
        cursor.close();
    }

    private class CursorIterator implements Iterator<T> {

        /* the value read ahead, null if none */
        private T next;
        private boolean done;

        private void compute() {
            if (next != null || done) {
                return;
            }
            final NextResult<T> r;
            try {
                r = cursor.advanceExclusive().join();
            } catch (RuntimeException re) {
                done = true;
                throw closeAndUnwrap(re);
            }
            if (r == null || r.isNone()) {
                done = true;
                return;
            }
            next = r.get();
        }

        /*
         * Errors raised by the cursor itself already closed it; this covers
         * the ones that did not, such as the wait being cancelled.
         */
        private RuntimeException closeAndUnwrap(RuntimeException re) {
            final Throwable cause = unwrapCompletionException(re);
            if (!cursor.isTerminated()) {
                cursor.closeAfterFailure(cause);
            }
            if (cause instanceof RuntimeException) {
                return (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            return new CursorException(
                "Cursor iteration failed: " + cause.getMessage(), cause);
        }

        @Override
        public boolean hasNext() {
            compute();
            return next != null;
        }

        @Override
        public T next() {
            compute();
            if (next == null) {
                throw new NoSuchElementException();
            }
            final T value = next;
            next = null;
            return value;
        }
    }
}
