/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import static oracle.nosql.cursor.util.ConcurrentUtil.unwrapCompletionException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import oracle.nosql.cursor.CursorUsageException;
import oracle.nosql.cursor.util.LogUtil;

/**
 * Subscription that pulls values from a cursor on behalf of a single
 * subscriber.
 * <p>All subscriber signals are serialized. At most one pull is outstanding
 * at any time, and a value is only pulled while there is unmet demand, so
 * nothing is buffered beyond what the cursor itself holds.</p>
 */
class CursorSubscription<T, R> implements Flow.Subscription {

    private static final Logger defaultLogger =
        Logger.getLogger(CursorSubscription.class.getName());

    private final Cursor<T> cursor;
    private final Function<? super T, ? extends R> transform;
    private final Flow.Subscriber<? super R> subscriber;
    private final Logger logger;

    /* Backpressure and state */
    private final AtomicLong demand = new AtomicLong();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean cancelled;

    /* set while a pull is outstanding */
    private volatile boolean pulling;

    /* set when the cursor has no more values, or on failure */
    private volatile boolean done;
    private volatile Throwable error;

    /* the value pulled but not yet emitted */
    private volatile R pending;

    CursorSubscription(Cursor<T> cursor,
                       Function<? super T, ? extends R> transform,
                       Flow.Subscriber<? super R> subscriber) {
        this.cursor = cursor;
        this.transform = transform;
        this.subscriber = subscriber;
        this.logger = (cursor.getLogger() != null ?
                       cursor.getLogger() : defaultLogger);
    }

    @Override
    public void request(long n) {
        if (cancelled) {
            return;
        }
        if (n <= 0) {
            /* negative or zero demand is illegal -> onError and cancel */
            onErrorOnce(new IllegalArgumentException(subscriber +
                " violated the Reactive Streams rule 3.9 by requesting a " +
                "non-positive number of elements."));
            signalError(error);
            return;
        }
        Backpressure.addCap(demand, n);
        drain();
    }

    @Override
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        closeCursor();
    }

    /* Core loop: serialize all emission/pull transitions */
    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        while (true) {
            if (cancelled) {
                pending = null;
                return;
            }

            final R v = pending;
            if (v != null && demand.get() > 0) {
                pending = null;
                signalNext(v);
                Backpressure.produced(demand, 1);
                continue;
            }

            if (v == null && done) {
                final Throwable ex = error;
                if (ex != null) {
                    signalError(ex);
                } else {
                    signalComplete();
                }
                return;
            }

            if (v == null && !pulling && demand.get() > 0) {
                pull();
            }

            int w = wip.get();
            if (missed == w) {
                missed = wip.addAndGet(-missed);
                if (missed == 0) {
                    break;
                }
            } else {
                missed = w;
            }
        }
    }

    private void pull() {
        pulling = true;
        final CompletableFuture<NextResult<T>> f = cursor.advanceExclusive();
        f.whenComplete((r, err) -> {
            if (err != null) {
                /* the cursor closed itself before failing the pull */
                onErrorOnce(unwrapCompletionException(err));
                done = true;
            } else if (r.isNone()) {
                done = true;
            } else {
                emitLater(r.get());
            }
            pulling = false;
            drain();
        });
    }

    private void emitLater(T value) {
        final R out;
        try {
            out = transform.apply(value);
        } catch (Throwable t) {
            failAndClose(t);
            return;
        }
        if (out == null) {
            failAndClose(new CursorUsageException(
                "Stream transform returned null; a transform must return " +
                "a value"));
            return;
        }
        pending = out;
    }

    private void failAndClose(Throwable ex) {
        onErrorOnce(ex);
        done = true;
        cursor.closeAfterFailure(ex);
    }

    private void onErrorOnce(Throwable ex) {
        if (error == null) {
            error = ex;
        }
    }

    private void closeCursor() {
        cursor.closeAsync().whenComplete((v, err) -> {
            if (err != null) {
                LogUtil.logWarning(logger, "Failed to close cursor on " +
                    "cancel: " + unwrapCompletionException(err));
            }
        });
    }

    void signalNext(R v) {
        try {
            subscriber.onNext(v);
        } catch (Throwable ex) {
            /*
             * downstream threw error. Make sure that we are cancelled, since
             * we cannot do anything else since the Subscriber is faulty.
             */
            cancel();
            onErrorOnce(ex);
            logger.log(Level.WARNING,
                subscriber +
                " violated the Reactive Streams rule 2.13 by " +
                "throwing an exception from onNext.", ex);
        }
    }

    void signalError(Throwable ex) {
        if (cancelled) {
            return;
        }
        cancelled = true; // ensure terminal
        if (!cursor.isTerminated()) {
            closeCursor();
        }
        try {
            subscriber.onError(ex);
        } catch (Throwable t) {
            logger.log(Level.WARNING, subscriber +
                " violated the Reactive Streams rule 2.13 by " +
                "throwing an exception from onError.", t);
        }
    }

    void signalComplete() {
        if (cancelled) {
            return;
        }
        cancelled = true; // ensure terminal
        try {
            subscriber.onComplete();
        } catch (Throwable t) {
            logger.log(Level.WARNING, subscriber +
                " violated the Reactive Streams rule 2.13 by " +
                "throwing an exception from onComplete.", t);
        }
    }

    /* Small utility to handle requested arithmetic safely */
    static final class Backpressure {
        static void addCap(AtomicLong requested, long n) {
            for (; ; ) {
                long r = requested.get();
                long u = r + n;
                if (u < 0L) { // overflow -> cap
                    u = Long.MAX_VALUE;
                }
                if (requested.compareAndSet(r, u)) {
                    return;
                }
            }
        }

        static void produced(AtomicLong requested, long n) {
            for (; ; ) {
                long r = requested.get();
                long u = r - n;
                if (u < 0L) {
                    u = 0L;
                }
                if (requested.compareAndSet(r, u)) {
                    return;
                }
            }
        }
    }
}
