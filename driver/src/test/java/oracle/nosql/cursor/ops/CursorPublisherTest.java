/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import static oracle.nosql.cursor.InMemoryBatchSource.CURSOR_ID;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicReference;

import oracle.nosql.cursor.CursorTestBase;
import oracle.nosql.cursor.CursorUsageException;
import oracle.nosql.cursor.InMemoryBatchSource;
import oracle.nosql.cursor.ServerException;
import oracle.nosql.cursor.values.Document;

import org.junit.Test;

import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Consuming a cursor as a Flow.Publisher, through project reactor.
 */
public class CursorPublisherTest extends CursorTestBase {

    private static <T> Flux<T> flux(Flow.Publisher<T> publisher) {
        return JdkFlowAdapter.flowPublisherToFlux(publisher);
    }

    @Test
    public void testStreamAll() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Integer> cursor =
            newCursor(source, 2).map(d -> d.getInt("_id"));

        StepVerifier.create(flux(cursor.stream()))
            .expectNext(0, 1, 2, 3, 4)
            .verifyComplete();

        assertTrue(cursor.isClosed());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testStreamEmpty() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(0), 2);

        StepVerifier.create(flux(cursor.stream()))
            .verifyComplete();
        assertTrue(cursor.isClosed());
    }

    @Test
    public void testBackpressure() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Integer> cursor =
            newCursor(source, 2).map(d -> d.getInt("_id"));

        StepVerifier.create(flux(cursor.stream()), 1)
            .expectNext(0)
            .then(() -> assertEquals(1, source.getFetchInitialCount()))
            .then(() -> assertEquals(0, source.getFetchMoreCount()))
            .thenRequest(2)
            .expectNext(1, 2)
            .thenRequest(10)
            .expectNext(3, 4)
            .verifyComplete();
    }

    @Test
    public void testStreamTransform() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(3), 0);

        StepVerifier.create(flux(cursor.stream(d -> d.getString("name"))))
            .expectNext("doc0", "doc1", "doc2")
            .verifyComplete();
    }

    @Test
    public void testStreamTransformNull() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Document> cursor = newCursor(source, 2);

        StepVerifier.create(flux(cursor.stream(
                d -> (d.getInt("_id") == 1 ? null : d.getInt("_id")))))
            .expectNext(0)
            .expectError(CursorUsageException.class)
            .verify();

        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testStreamTransformThrows() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(3), 0);

        StepVerifier.create(flux(cursor.stream(d -> {
                throw new IllegalStateException("bad");
            })))
            .expectErrorMessage("bad")
            .verify();
        assertTrue(cursor.isKilled());
    }

    @Test
    public void testStreamTransformError() {
        InMemoryBatchSource source = new InMemoryBatchSource(3);
        Cursor<Document> cursor = newCursor(source, 2);

        StepVerifier.create(flux(cursor.stream(d -> {
                throw new AssertionError("stage");
            })))
            .expectErrorMatches(e -> e instanceof AssertionError &&
                                "stage".equals(e.getMessage()))
            .verify();
        assertTrue(cursor.isKilled());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testUpstreamError() {
        ServerException failure = new ServerException(11600, "interrupted");
        InMemoryBatchSource source =
            new InMemoryBatchSource(5).failFetchMore(1, failure);
        Cursor<Document> cursor = newCursor(source, 2);

        StepVerifier.create(flux(cursor.stream()))
            .expectNext(doc(0), doc(1))
            .expectErrorMatches(e -> e == failure)
            .verify();

        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testCancelClosesCursor() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Document> cursor = newCursor(source, 2);

        StepVerifier.create(flux(cursor.stream()), 1)
            .expectNext(doc(0))
            .thenCancel()
            .verify();

        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testTake() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Integer> cursor =
            newCursor(source, 2).map(d -> d.getInt("_id"));

        StepVerifier.create(flux(cursor.stream()).take(3))
            .expectNext(0, 1, 2)
            .verifyComplete();
        assertTrue(cursor.isKilled());
    }

    @Test
    public void testSingleSubscriber() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(3), 0);
        Flow.Publisher<Document> publisher = cursor.stream();

        StepVerifier.create(flux(publisher))
            .expectNextCount(3)
            .verifyComplete();
        StepVerifier.create(flux(publisher))
            .expectError(IllegalStateException.class)
            .verify();
    }

    @Test
    public void testNonPositiveRequest() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(3), 0);
        AtomicReference<Throwable> error = new AtomicReference<>();

        cursor.stream().subscribe(new Flow.Subscriber<Document>() {
            @Override
            public void onSubscribe(Flow.Subscription s) {
                s.request(0);
            }

            @Override
            public void onNext(Document item) {
            }

            @Override
            public void onError(Throwable t) {
                error.set(t);
            }

            @Override
            public void onComplete() {
            }
        });

        assertTrue(error.get() instanceof IllegalArgumentException);
        assertTrue(error.get().getMessage().contains("3.9"));
        /* nothing was fetched, the cursor is released */
        assertEquals(0, cursor.bufferedCount());
        assertTrue(cursor.isKilled());
    }
}
