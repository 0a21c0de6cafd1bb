/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * The classes in this package represent the documents returned by a query.
 * A {@link oracle.nosql.cursor.values.Document} is an ordered map of field
 * names to values. Values are plain Java objects: {@link java.lang.String},
 * {@link java.lang.Integer}, {@link java.lang.Long},
 * {@link java.lang.Double}, {@link java.math.BigDecimal},
 * {@link java.lang.Boolean}, {@link java.util.List}, nested documents, or
 * null.
 */
package oracle.nosql.cursor.values;
