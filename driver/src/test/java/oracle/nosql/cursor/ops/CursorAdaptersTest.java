/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import static oracle.nosql.cursor.InMemoryBatchSource.CURSOR_ID;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import oracle.nosql.cursor.CursorTestBase;
import oracle.nosql.cursor.InMemoryBatchSource;
import oracle.nosql.cursor.ServerException;
import oracle.nosql.cursor.values.Document;

import org.junit.Test;

/**
 * The ways of consuming a cursor all see the same sequence.
 */
public class CursorAdaptersTest extends CursorTestBase {

    @Test
    public void testForEach() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Document> cursor = newCursor(source, 2);
        List<Document> seen = new ArrayList<>();

        cursor.forEach(seen::add).join();
        assertEquals(docs(0, 5), seen);
        assertTrue(cursor.isClosed());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testForEachWhileLeavesRest() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Integer> cursor =
            newCursor(source, 2).map(d -> d.getInt("_id"));
        List<Integer> seen = new ArrayList<>();

        cursor.forEachWhile(i -> {
            seen.add(i);
            return i < 1;
        }).join();

        assertEquals(2, seen.size());
        assertFalse(cursor.isTerminated());
        assertEquals(Integer.valueOf(2), cursor.next().join());
    }

    @Test
    public void testVisitorFailureClosesCursor() {
        RuntimeException failure = new RuntimeException("visitor");
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Document> cursor = newCursor(source, 2);
        AtomicInteger visits = new AtomicInteger();

        Throwable t = expectFailure(cursor.forEach(d -> {
            if (visits.incrementAndGet() == 3) {
                throw failure;
            }
        }), RuntimeException.class);

        assertSame(failure, t);
        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testVisitorErrorAfterFetchCompletes() {
        AssertionError failure = new AssertionError("visitor");
        InMemoryBatchSource source = new InMemoryBatchSource(5).hold();
        Cursor<Document> cursor = newCursor(source, 2);

        CompletableFuture<Void> done = cursor.forEach(d -> {
            throw failure;
        });
        assertFalse(done.isDone());
        source.release();

        assertSame(failure, expectFailure(done, AssertionError.class));
        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testIteratorRethrowsTransformFailureUnchanged() {
        IllegalStateException failure = new IllegalStateException("bad");
        Cursor<Integer> cursor = newCursor(new InMemoryBatchSource(3), 0)
            .map(d -> {
                throw failure;
            });
        Iterator<Integer> iter = cursor.toIterable().iterator();

        try {
            iter.next();
            fail("next should report the failure");
        } catch (IllegalStateException ise) {
            assertSame(failure, ise);
            assertEquals(0, ise.getSuppressed().length);
        }
        assertTrue(cursor.isKilled());
    }

    @Test
    public void testUpstreamFailureInForEach() {
        ServerException failure = new ServerException(1, "lost");
        InMemoryBatchSource source =
            new InMemoryBatchSource(5).failFetchMore(2, failure);
        Cursor<Document> cursor = newCursor(source, 2);
        List<Document> seen = new ArrayList<>();

        assertSame(failure,
                   expectFailure(cursor.forEach(seen::add),
                                 ServerException.class));
        assertEquals(docs(0, 4), seen);
        assertTrue(cursor.isKilled());
        assertEquals(1, session(0).getEndCount());
    }

    @Test
    public void testToList() {
        Cursor<Document> cursor = newCursor(new InMemoryBatchSource(4), 3);

        assertEquals(docs(0, 4), cursor.toList().join());
        assertTrue(cursor.isClosed());
        assertTrue(cursor.toList().join().isEmpty());
    }

    @Test
    public void testLongResultIsNotRecursive() {
        Cursor<Document> cursor =
            newCursor(new InMemoryBatchSource(20000), 5000);
        AtomicInteger count = new AtomicInteger();

        cursor.forEach(d -> count.incrementAndGet()).join();
        assertEquals(20000, count.get());
    }

    @Test
    public void testIterable() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        List<Integer> seen = new ArrayList<>();

        try (CursorIterable<Integer> ids =
                 newCursor(source, 2).map(d -> d.getInt("_id"))
                                     .toIterable()) {
            for (Integer id : ids) {
                seen.add(id);
            }
        }
        assertEquals(List.of(0, 1, 2, 3, 4), seen);
        assertEquals(1, session(0).getEndCount());
        assertTrue(source.getKilledIds().isEmpty());
    }

    @Test
    public void testIteratorLooksAhead() {
        AtomicInteger calls = new AtomicInteger();
        Cursor<Integer> cursor = newCursor(new InMemoryBatchSource(2), 0)
            .map(d -> {
                calls.incrementAndGet();
                return d.getInt("_id");
            });
        Iterator<Integer> iter = cursor.toIterable().iterator();

        assertTrue(iter.hasNext());
        assertEquals(1, calls.get());
        assertTrue(iter.hasNext());
        assertEquals(1, calls.get());
        assertEquals(Integer.valueOf(0), iter.next());
        assertEquals(Integer.valueOf(1), iter.next());
        assertFalse(iter.hasNext());
        assertTrue(cursor.isClosed());

        try {
            iter.next();
            fail("next past the end should fail");
        } catch (NoSuchElementException nse) {
            /* success */
        }
    }

    @Test
    public void testIteratorFailure() {
        ServerException failure = new ServerException(1, "lost");
        InMemoryBatchSource source =
            new InMemoryBatchSource(5).failFetchMore(1, failure);
        Cursor<Document> cursor = newCursor(source, 2);
        Iterator<Document> iter = cursor.toIterable().iterator();

        assertEquals(doc(0), iter.next());
        assertEquals(doc(1), iter.next());
        try {
            iter.hasNext();
            fail("hasNext should report the failure");
        } catch (ServerException se) {
            assertSame(failure, se);
        }
        assertTrue(cursor.isKilled());
        assertFalse(iter.hasNext());
    }

    @Test
    public void testIterableCloseKills() {
        InMemoryBatchSource source = new InMemoryBatchSource(5);
        Cursor<Document> cursor = newCursor(source, 2);

        try (CursorIterable<Document> docs = cursor.toIterable()) {
            assertEquals(doc(0), docs.iterator().next());
        }
        assertTrue(cursor.isKilled());
        assertEquals(Collections.singletonList(CURSOR_ID),
                     source.getKilledIds());
    }

    @Test
    public void testAllAdaptersSameOrder() {
        InMemoryBatchSource source = new InMemoryBatchSource(9);
        Cursor<Integer> first =
            newCursor(source, 4).map(d -> d.getInt("_id"));

        List<Integer> pulled = new ArrayList<>();
        Cursor<Integer> byNext = first.copy();
        for (Integer i = byNext.next().join(); i != null;
             i = byNext.next().join()) {
            pulled.add(i);
        }

        List<Integer> visited = new ArrayList<>();
        first.copy().forEach(visited::add).join();

        List<Integer> iterated = new ArrayList<>();
        first.copy().toIterable().forEach(iterated::add);

        List<Integer> listed = first.toList().join();

        assertEquals(9, listed.size());
        assertEquals(listed, pulled);
        assertEquals(listed, visited);
        assertEquals(listed, iterated);
    }
}
