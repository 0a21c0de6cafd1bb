/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.util;

import oracle.nosql.cursor.CursorException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public class ConcurrentUtil {

    private static final CompletableFuture<Void> COMPLETED =
        CompletableFuture.completedFuture(null);

    /**
     * A convenient function to hold the lock and run.
     */
    public static <T> T synchronizedCall(ReentrantLock lock,
                                         Supplier<T> s) {
        lock.lock();
        try {
            return s.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * A convenient function to hold the lock and run.
     */
    public static void synchronizedCall(ReentrantLock lock,
                                        Runnable r) {
        lock.lock();
        try {
            r.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * A helper function to wait for the future to complete. A runtime
     * exception the future failed with is rethrown as is.
     */
    public static <T> T awaitFuture(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            final Throwable cause = unwrapCompletionException(e.getCause());
            appendCurrentStack(cause);
            if (cause instanceof RuntimeException) {
                throw ((RuntimeException) cause);
            }
            if (cause instanceof Error) {
                throw ((Error) cause);
            }
            throw new CursorException("ExecutionException: "
                + e.getMessage(), cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CursorException("Request interrupted: "
                + ie.getMessage(), ie);
        }
    }

    /**
     * Returns the cause if the exception is a CompletionException, otherwise
     * returns the exception.
     */
    public static Throwable unwrapCompletionException(Throwable t) {
        Throwable actual = t;
        while (true) {
            if (!(actual instanceof CompletionException)
                    || (actual.getCause() == null)) {
                return actual;
            }
            actual = actual.getCause();
        }
    }

    /**
     * Returns a future failed with the given exception.
     */
    public static <T> CompletableFuture<T> failedFuture(Throwable t) {
        return CompletableFuture.failedFuture(t);
    }

    /**
     * Returns a shared, already completed future.
     */
    public static CompletableFuture<Void> completed() {
        return COMPLETED;
    }

    /**
     * Invokes the supplier, turning an exception thrown while creating the
     * future into a failed future.
     */
    public static <T> CompletableFuture<T> safeCall(
        Supplier<CompletableFuture<T>> s) {
        try {
            final CompletableFuture<T> f = s.get();
            if (f == null) {
                return failedFuture(new IllegalStateException(
                    "Asynchronous call returned a null future"));
            }
            return f;
        } catch (Throwable t) {
            return failedFuture(t);
        }
    }

    private static void appendCurrentStack(Throwable exception) {
        Objects.requireNonNull(exception, "exception");
        final StackTraceElement[] existing = exception.getStackTrace();
        final StackTraceElement[] current = new Throwable().getStackTrace();
        final StackTraceElement[] updated =
                new StackTraceElement[existing.length + current.length];
        System.arraycopy(existing, 0, updated, 0, existing.length);
        System.arraycopy(current, 0, updated, existing.length, current.length);
        exception.setStackTrace(updated);
    }
}
