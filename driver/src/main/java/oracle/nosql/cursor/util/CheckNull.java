/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.util;

import java.util.Objects;

/**
 * @hidden
 * Argument checks shared by the public API.
 */
public class CheckNull {

    public static <T> T requireNonNull(T value, String message) {
        return Objects.requireNonNull(value, message);
    }

    /*
     * throws IAE instead of NPE
     */
    public static <T> T requireNonNullIAE(T value, String message) {
        if (value == null) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(
                name + " must be non-negative: " + value);
        }
        return value;
    }
}
