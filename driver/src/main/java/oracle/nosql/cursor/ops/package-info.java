/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * The cursor, the request that creates it, and the batches a
 * {@link oracle.nosql.cursor.BatchSource} returns.
 */
package oracle.nosql.cursor.ops;
