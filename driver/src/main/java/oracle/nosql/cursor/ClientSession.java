/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import oracle.nosql.cursor.util.LogUtil;

/**
 * A basic {@link SessionHandle} identified by a random id. Ending it runs
 * an optional release action once, which a {@link SessionManager} can use to
 * return server resources.
 */
public class ClientSession implements SessionHandle {

    private final UUID id;
    private final Runnable onEnd;
    private final Logger logger;
    private final AtomicBoolean ended = new AtomicBoolean();

    /**
     * Creates a session with no release action.
     */
    public ClientSession() {
        this(null, null);
    }

    /**
     * Creates a session.
     *
     * @param onEnd action run once when the session ends, or null
     * @param logger the logger, or null
     */
    public ClientSession(Runnable onEnd, Logger logger) {
        this.id = UUID.randomUUID();
        this.onEnd = onEnd;
        this.logger = logger;
    }

    /**
     * Returns the session id.
     *
     * @return the id
     */
    public UUID getId() {
        return id;
    }

    @Override
    public void end() {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        LogUtil.logFine(logger, "Ending session " + id);
        if (onEnd != null) {
            onEnd.run();
        }
    }

    @Override
    public boolean hasEnded() {
        return ended.get();
    }

    @Override
    public String toString() {
        return "ClientSession[" + id + (hasEnded() ? ", ended]" : "]");
    }
}
