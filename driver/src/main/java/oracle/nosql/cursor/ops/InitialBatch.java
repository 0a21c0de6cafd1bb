/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import java.util.List;

import oracle.nosql.cursor.SessionHandle;
import oracle.nosql.cursor.values.Document;

/**
 * The first batch of a query, returned by
 * {@link oracle.nosql.cursor.BatchSource#fetchInitial}. In addition to the
 * cursor id and documents it carries the session the query ran under.
 */
public class InitialBatch extends Batch {

    private final SessionHandle session;

    /**
     * Creates an initial batch.
     *
     * @param cursorId the cursor id returned by the server, 0 if exhausted
     * @param documents the documents, in server order
     * @param session the session the query ran under
     */
    public InitialBatch(long cursorId,
                        List<Document> documents,
                        SessionHandle session) {
        super(cursorId, documents);
        this.session = session;
    }

    /**
     * Returns the session the query ran under. A source normally returns
     * the session it was given; null means the same.
     *
     * @return the session, or null
     */
    public SessionHandle getSession() {
        return session;
    }
}
