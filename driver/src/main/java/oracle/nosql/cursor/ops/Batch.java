/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import java.util.Collections;
import java.util.List;

import oracle.nosql.cursor.values.Document;

/**
 * One round trip's worth of documents, plus the cursor id the server
 * returned with them. A cursor id of 0 means the server holds no more
 * results for the query; the documents of this batch are the last ones.
 * <p>
 * A batch may be empty while the cursor id is still live, for example when
 * the server stopped reading before any document matched.
 */
public class Batch {

    private final long cursorId;
    private final List<Document> documents;

    /**
     * Creates a batch.
     *
     * @param cursorId the cursor id returned by the server, 0 if exhausted
     * @param documents the documents, in server order, may be null for none
     */
    public Batch(long cursorId, List<Document> documents) {
        this.cursorId = cursorId;
        this.documents = (documents != null ?
                          Collections.unmodifiableList(documents) :
                          Collections.emptyList());
    }

    /**
     * Returns the cursor id. 0 means no live server-side cursor remains.
     *
     * @return the cursor id
     */
    public long getCursorId() {
        return cursorId;
    }

    /**
     * Returns the documents, in the order returned by the server.
     *
     * @return the documents
     */
    public List<Document> getDocuments() {
        return documents;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[cursorId=" + cursorId +
            ", documents=" + documents.size() + "]";
    }
}
