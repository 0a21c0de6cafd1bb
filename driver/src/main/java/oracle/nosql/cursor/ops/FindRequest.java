/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import oracle.nosql.cursor.BatchSource;
import oracle.nosql.cursor.CursorConfig;
import oracle.nosql.cursor.CursorHandle;
import oracle.nosql.cursor.values.Document;

/**
 * A request that describes a query whose results are read through a
 * {@link Cursor}. The request is handed to
 * {@link BatchSource#fetchInitial} unchanged; how the filter and sort are
 * interpreted is up to the source.
 * <p>
 * Usage example:
 * <pre>
 *    CursorHandle handle = ...;
 *
 *    FindRequest req = new FindRequest()
 *        .setNamespace("shop.orders")
 *        .setFilter(new Document().put("status", "open"))
 *        .setBatchSize(100);
 *
 *    try (Cursor&lt;Document&gt; cursor = handle.find(req)) {
 *        for (Document doc : cursor.toIterable()) {
 *            // do something with doc
 *        }
 *    }
 * </pre>
 * FindRequest instances are not thread-safe.
 *
 * @see CursorHandle#find(FindRequest)
 */
public class FindRequest {

    private String namespace;

    private Document filter;

    private Document sort;

    private int batchSize;

    private int limit;

    private int timeoutMs;

    /**
     * Returns the namespace the query reads from, or null if not set.
     *
     * @return the namespace
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * Sets the namespace the query reads from, for example a
     * "database.collection" name.
     *
     * @param namespace the namespace
     *
     * @return this
     */
    public FindRequest setNamespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    /**
     * Returns the query filter, or null if not set, meaning all documents.
     *
     * @return the filter
     */
    public Document getFilter() {
        return filter;
    }

    /**
     * Sets the query filter.
     *
     * @param filter the filter
     *
     * @return this
     */
    public FindRequest setFilter(Document filter) {
        this.filter = filter;
        return this;
    }

    /**
     * Returns the sort document, or null if not set.
     *
     * @return the sort document
     */
    public Document getSort() {
        return sort;
    }

    /**
     * Sets the sort document, a document mapping field names to 1 for
     * ascending or -1 for descending order.
     *
     * @param sort the sort document
     *
     * @return this
     */
    public FindRequest setSort(Document sort) {
        this.sort = sort;
        return this;
    }

    /**
     * Returns the maximum number of documents per batch. If not set by the
     * application this value will be 0 which means the server default.
     *
     * @return the batch size, or 0 if not set
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Sets the maximum number of documents returned by each round trip to
     * the server. The batch size only affects how many round trips are
     * made; it never changes the documents returned or their order.
     *
     * @param batchSize the batch size, 0 for the server default
     *
     * @return this
     *
     * @throws IllegalArgumentException if the batch size is less than 0.
     */
    public FindRequest setBatchSize(int batchSize) {
        if (batchSize < 0) {
            throw new IllegalArgumentException("batchSize must be >= 0");
        }
        this.batchSize = batchSize;
        return this;
    }

    /**
     * Returns the limit on the total number of documents returned. If
     * not set by the application this value will be 0 which means no limit.
     *
     * @return the limit, or 0 if not set
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Sets the limit on the total number of documents returned by the query.
     * The limit is enforced by the source.
     *
     * @param limit the limit in terms of number of documents returned
     *
     * @return this
     *
     * @throws IllegalArgumentException if the limit value is less than 0.
     */
    public FindRequest setLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        this.limit = limit;
        return this;
    }

    /**
     * Returns the timeout used for each round trip, in milliseconds, or 0 if
     * not set.
     *
     * @return the timeout
     */
    public int getTimeout() {
        return timeoutMs;
    }

    /**
     * Sets the request timeout value, in milliseconds. This overrides any
     * default value set with {@link CursorConfig#setRequestTimeout}.
     * The cursor does not enforce the timeout itself, the source does, and
     * the failure it raises is propagated unchanged.
     *
     * @param timeoutMs the timeout value, in milliseconds
     *
     * @return this
     *
     * @throws IllegalArgumentException if the timeout value is less than
     * or equal to 0
     */
    public FindRequest setTimeout(int timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMs = timeoutMs;
        return this;
    }

    /**
     * Internal use only.
     *
     * Sets default values based on the specified config object.
     *
     * @param config the configuration object
     * @return this
     * @hidden
     */
    public FindRequest setDefaults(CursorConfig config) {
        if (timeoutMs == 0) {
            timeoutMs = config.getRequestTimeout();
        }
        if (batchSize == 0) {
            batchSize = config.getDefaultBatchSize();
        }
        return this;
    }

    /**
     * Returns a copy of this request. Filter and sort documents are copied
     * as well, so the copy can be modified independently.
     *
     * @return the copy
     */
    public FindRequest copy() {
        FindRequest req = new FindRequest();
        req.namespace = namespace;
        req.filter = (filter != null ? filter.copy() : null);
        req.sort = (sort != null ? sort.copy() : null);
        req.batchSize = batchSize;
        req.limit = limit;
        req.timeoutMs = timeoutMs;
        return req;
    }

    @Override
    public String toString() {
        return "FindRequest[namespace=" + namespace +
            ", filter=" + filter + ", sort=" + sort +
            ", batchSize=" + batchSize + ", limit=" + limit + "]";
    }
}
