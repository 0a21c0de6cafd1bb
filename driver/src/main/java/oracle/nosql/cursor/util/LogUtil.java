/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging. All methods accept a null logger,
 * which is the case when the application did not configure one.
 */
public class LogUtil {

    public static boolean isFineEnabled(Logger logger) {
        return logger != null && logger.isLoggable(Level.FINE);
    }

    public static void logWarning(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.WARNING, msg);
        }
    }

    public static void logWarning(Logger logger, String msg, Throwable thrown) {
        if (logger != null) {
            logger.log(Level.WARNING, msg, thrown);
        }
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Trace == FINEST
     */
    public static void logTrace(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINEST, msg);
        }
    }
}
