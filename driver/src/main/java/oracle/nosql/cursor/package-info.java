/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the public API for reading query results through a cursor, as
 * well as configuration and exception classes. Value classes used for data
 * are in the
 * <a href="{@docRoot}/oracle/nosql/cursor/values/package-summary.html#package.description">
 * values package.
 * </a>
 * The cursor and its request and batch objects are in the
 * <a href="{@docRoot}/oracle/nosql/cursor/ops/package-summary.html#package.description">
 * ops package.
 * </a>
 * <p>
 * The overall flow of an application is:
 * <ol>
 * <li>Provide a {@link oracle.nosql.cursor.BatchSource}, which performs the
 * round trips to the server, and a
 * {@link oracle.nosql.cursor.SessionManager}, which starts sessions.</li>
 * <li>Configure defaults with {@link oracle.nosql.cursor.CursorConfig} and
 * obtain a {@link oracle.nosql.cursor.CursorHandle} from
 * {@link oracle.nosql.cursor.CursorHandleFactory}.</li>
 * <li>Call {@link oracle.nosql.cursor.CursorHandle#find} to create a
 * {@link oracle.nosql.cursor.ops.Cursor}, optionally add transforms with
 * {@link oracle.nosql.cursor.ops.Cursor#map}, and consume it.</li>
 * <li>Close the handle when done.</li>
 * </ol>
 * <p>
 * Errors are reported with unchecked exceptions. Misuse of a cursor raises
 * {@link oracle.nosql.cursor.CursorUsageException}; failures of the
 * {@link oracle.nosql.cursor.BatchSource} and of user transforms are passed
 * through unchanged.
 */
package oracle.nosql.cursor;
