/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A session that counts every call to end(), so tests can check it is ended
 * exactly once.
 */
public class CountingSession implements SessionHandle {

    private final AtomicInteger ends = new AtomicInteger();

    @Override
    public void end() {
        ends.incrementAndGet();
    }

    @Override
    public boolean hasEnded() {
        return ends.get() > 0;
    }

    public int getEndCount() {
        return ends.get();
    }
}
