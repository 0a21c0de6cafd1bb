/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

import oracle.nosql.cursor.ops.Cursor;
import oracle.nosql.cursor.ops.FindRequest;
import oracle.nosql.cursor.values.Document;

/**
 * Shared setup for cursor tests: an in-memory source and a session manager
 * that keeps the sessions it hands out.
 */
public class CursorTestBase {

    protected static final Logger logger =
        Logger.getLogger(CursorTestBase.class.getName());

    protected final List<CountingSession> sessions = new ArrayList<>();

    protected final SessionManager sessionManager = () -> {
        CountingSession s = new CountingSession();
        synchronized (sessions) {
            sessions.add(s);
        }
        return s;
    };

    public static Document doc(int id) {
        return new Document().put("_id", id).put("name", "doc" + id);
    }

    public static List<Document> docs(int from, int to) {
        List<Document> list = new ArrayList<>();
        for (int i = from; i < to; i++) {
            list.add(doc(i));
        }
        return list;
    }

    protected Cursor<Document> newCursor(InMemoryBatchSource source,
                                         int batchSize) {
        FindRequest req = new FindRequest()
            .setNamespace("test.docs")
            .setBatchSize(batchSize);
        return new Cursor<Document>(source, req, sessionManager, logger);
    }

    protected CountingSession session(int i) {
        synchronized (sessions) {
            return sessions.get(i);
        }
    }

    protected int sessionCount() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    /**
     * Waits for the future and returns the exception it failed with.
     */
    protected static Throwable expectFailure(CompletableFuture<?> future,
                                             Class<?> expected) {
        try {
            future.join();
            fail("Operation should have failed with " + expected.getName());
        } catch (CompletionException ce) {
            Throwable cause = ce.getCause();
            assertTrue("Unexpected exception: " + cause,
                       expected.isInstance(cause));
            return cause;
        }
        return null;
    }
}
