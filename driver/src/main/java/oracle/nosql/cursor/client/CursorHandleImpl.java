/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.client;

import static oracle.nosql.cursor.util.CheckNull.requireNonNullIAE;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

import oracle.nosql.cursor.BatchSource;
import oracle.nosql.cursor.CursorConfig;
import oracle.nosql.cursor.CursorHandle;
import oracle.nosql.cursor.SessionManager;
import oracle.nosql.cursor.ops.Cursor;
import oracle.nosql.cursor.ops.FindRequest;
import oracle.nosql.cursor.util.ConcurrentUtil;
import oracle.nosql.cursor.util.LogUtil;
import oracle.nosql.cursor.values.Document;

/**
 * The methods in this class require non-null arguments. Because they all
 * ultimately go to the {@link BatchSource}, null checks are done on the
 * request object here and the source is trusted for the rest.
 */
public class CursorHandleImpl implements CursorHandle {

    private final CursorConfig config;
    private final BatchSource source;
    private final SessionManager sessionManager;
    private final Logger logger;

    /* cursors created by find(), dropped once unreachable */
    private final Set<Cursor<?>> cursors =
        Collections.synchronizedSet(
            Collections.newSetFromMap(new WeakHashMap<Cursor<?>, Boolean>()));

    private volatile boolean closed;

    /**
     * @hidden
     * @param config the configuration, already copied by the caller
     * @param source performs the round trips
     * @param sessionManager supplies sessions
     */
    public CursorHandleImpl(CursorConfig config,
                            BatchSource source,
                            SessionManager sessionManager) {
        this.config = config;
        this.source = source;
        this.sessionManager = sessionManager;
        this.logger = config.getLogger();
        LogUtil.logFine(logger, "CursorHandle created, default batchSize " +
                        config.getDefaultBatchSize() + ", requestTimeout " +
                        config.getRequestTimeout());
    }

    @Override
    public Cursor<Document> find(FindRequest request) {
        requireNonNullIAE(request,
                          "CursorHandle.find: request must be non-null");
        final FindRequest req = request.copy().setDefaults(config);
        final Cursor<Document> cursor;
        synchronized (this) {
            checkClient();
            cursor = new Cursor<Document>(source, req, sessionManager, logger);
            cursors.add(cursor);
        }
        LogUtil.logFine(logger, "Created cursor for " + req);
        return cursor;
    }

    @Override
    public void close() {
        final List<Cursor<?>> open;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            synchronized (cursors) {
                open = new ArrayList<Cursor<?>>(cursors);
                cursors.clear();
            }
        }

        final List<CompletableFuture<Void>> closing =
            new ArrayList<CompletableFuture<Void>>();
        for (Cursor<?> c : open) {
            if (c.isTerminated()) {
                continue;
            }
            closing.add(c.closeAsync().exceptionally(err -> {
                LogUtil.logWarning(logger, "Failed to close " + c + ": " +
                    ConcurrentUtil.unwrapCompletionException(err));
                return null;
            }));
        }
        LogUtil.logFine(logger, "Closing CursorHandle, " + closing.size() +
                        " open cursors");
        ConcurrentUtil.awaitFuture(CompletableFuture.allOf(
            closing.toArray(new CompletableFuture<?>[0])));
    }

    /**
     * Returns the number of cursors created by this handle that are still
     * tracked.
     *
     * @return the number of cursors
     * @hidden
     */
    public int getTrackedCursorCount() {
        return cursors.size();
    }

    private void checkClient() {
        if (closed) {
            throw new IllegalStateException("CursorHandle is closed");
        }
    }
}
