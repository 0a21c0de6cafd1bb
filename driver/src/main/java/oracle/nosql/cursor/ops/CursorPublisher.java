/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Publisher of the remaining results of a cursor.
 *
 * @param <T> the type the cursor produces
 * @param <R> the type emitted, after the stream transform
 */
public class CursorPublisher<T, R> implements Flow.Publisher<R> {

    private final Cursor<T> cursor;
    private final Function<? super T, ? extends R> transform;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    CursorPublisher(Cursor<T> cursor,
                    Function<? super T, ? extends R> transform) {
        this.cursor = cursor;
        this.transform = transform;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super R> subscriber) {
        if (subscriber == null) {
            throw new NullPointerException("subscriber must be non-null");
        }
        /* only allow one subscriber */
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }
                @Override
                public void cancel() {
                }
            });
            subscriber.onError(new IllegalStateException("already subscribed"));
            return;
        }
        subscriber.onSubscribe(
            new CursorSubscription<T, R>(cursor, transform, subscriber));
    }
}
