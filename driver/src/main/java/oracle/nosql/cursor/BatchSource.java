/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import java.util.concurrent.CompletableFuture;

import oracle.nosql.cursor.ops.Batch;
import oracle.nosql.cursor.ops.FindRequest;
import oracle.nosql.cursor.ops.InitialBatch;

/**
 * BatchSource performs the network round trips a cursor needs: the initial
 * query, subsequent page fetches and the kill request that releases a
 * server-side cursor. Wire encoding, connection handling, authentication and
 * timeouts are the responsibility of the implementation.
 * <p>
 * All methods are asynchronous. A failure is reported by completing the
 * returned future exceptionally; the cursor passes that exception to its
 * caller unchanged and does not retry. Methods may also throw directly,
 * which the cursor treats the same way.
 * <p>
 * A cursor never has more than one call outstanding on its source at a
 * time, and a kill is only issued once any outstanding fetch has completed.
 */
public interface BatchSource {

    /**
     * Runs the query and returns its first batch.
     *
     * @param request the query
     * @param session the session the query runs under
     *
     * @return a future completed with the first batch
     */
    CompletableFuture<InitialBatch> fetchInitial(FindRequest request,
                                                 SessionHandle session);

    /**
     * Fetches the next batch of a live server-side cursor.
     *
     * @param cursorId the current, non-zero cursor id
     * @param session the session the query runs under
     * @param batchSize the maximum number of documents, 0 for the server
     * default
     *
     * @return a future completed with the next batch
     */
    CompletableFuture<Batch> fetchMore(long cursorId,
                                       SessionHandle session,
                                       int batchSize);

    /**
     * Releases a live server-side cursor.
     *
     * @param cursorId the non-zero cursor id
     * @param session the session the query runs under
     *
     * @return a future completed when the server acknowledged the request
     */
    CompletableFuture<Void> kill(long cursorId, SessionHandle session);
}
