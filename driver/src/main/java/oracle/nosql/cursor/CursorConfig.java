/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import static oracle.nosql.cursor.util.CheckNull.requireNonNull;

import java.util.logging.Logger;

/**
 * CursorConfig groups parameters used to configure a {@link CursorHandle}.
 * It also provides a way to default common parameters for the cursors
 * created by the handle. When creating a {@link CursorHandle} the
 * CursorConfig instance is copied so modification operations on the
 * instance have no effect on existing handles. Defaults can be overridden
 * in individual {@link oracle.nosql.cursor.ops.FindRequest} instances.
 * <p>
 * The default batch size and request timeout can also be set with the
 * system properties {@value #BATCH_SIZE_PROPERTY} and
 * {@value #REQUEST_TIMEOUT_PROPERTY}; values set through this class take
 * precedence.
 */
public class CursorConfig implements Cloneable {

    /**
     * The default value for the request timeout in milliseconds, if not
     * configured.
     */
    private static final int DEFAULT_TIMEOUT = 5000;

    /**
     * System property for the default batch size.
     */
    public static final String BATCH_SIZE_PROPERTY =
        "oracle.nosql.cursor.batchSize";

    /**
     * System property for the default request timeout, in milliseconds.
     */
    public static final String REQUEST_TIMEOUT_PROPERTY =
        "oracle.nosql.cursor.requestTimeout";

    /*
     * 0 means the server decides
     */
    private int defaultBatchSize;

    private int timeout;

    /**
     * The Logger used by the driver, or null if not configured by the user.
     */
    private Logger logger;

    /**
     * Creates a configuration with default values, taking the batch size
     * and request timeout from system properties when they are set.
     *
     * @throws IllegalArgumentException if a system property holds an
     * invalid value
     */
    public CursorConfig() {
        Integer batchSize = Integer.getInteger(BATCH_SIZE_PROPERTY);
        if (batchSize != null) {
            setDefaultBatchSize(batchSize);
        }
        Integer requestTimeout = Integer.getInteger(REQUEST_TIMEOUT_PROPERTY);
        if (requestTimeout != null) {
            setRequestTimeout(requestTimeout);
        }
    }

    /**
     * Returns the default batch size, or 0 if the server default is used.
     *
     * @return the batch size
     */
    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    /**
     * Sets the default number of documents returned per round trip. A
     * value of 0 leaves the choice to the server.
     *
     * @param batchSize the batch size
     *
     * @return this
     *
     * @throws IllegalArgumentException if the batch size is negative
     */
    public CursorConfig setDefaultBatchSize(int batchSize) {
        if (batchSize < 0) {
            throw new IllegalArgumentException(
                "CursorConfig.setDefaultBatchSize: batchSize must be >= 0");
        }
        this.defaultBatchSize = batchSize;
        return this;
    }

    /**
     * Returns the configured request timeout value, in milliseconds, or the
     * default of 5000 if it has not been configured.
     *
     * @return the value
     */
    public int getRequestTimeout() {
        return (timeout == 0 ? DEFAULT_TIMEOUT : timeout);
    }

    /**
     * Sets the default request timeout. The default timeout is
     * 5 seconds. The timeout is enforced by the {@link BatchSource}.
     *
     * @param timeout the timeout value, in milliseconds
     *
     * @return this
     *
     * @throws IllegalArgumentException if the timeout is not positive
     */
    public CursorConfig setRequestTimeout(int timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException(
                "CursorConfig.setRequestTimeout: timeout must be > 0");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Sets the Logger used for the driver.
     *
     * @param logger the Logger.
     *
     * @return this
     */
    public CursorConfig setLogger(Logger logger) {
        requireNonNull(logger,
                       "CursorConfig.setLogger: logger must be non-null");

        this.logger = logger;
        return this;
    }

    /**
     * Returns the Logger, or null if not configured by user.
     *
     * @return the Logger
     */
    public Logger getLogger() {
        return logger;
    }

    @Override
    public CursorConfig clone() {
        try {
            return (CursorConfig) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException(
                "Unable to copy CursorConfig: " + e.getMessage(), e);
        }
    }
}
