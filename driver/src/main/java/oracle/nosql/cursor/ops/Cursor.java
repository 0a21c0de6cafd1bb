/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.nosql.cursor.ops;

import static oracle.nosql.cursor.util.ConcurrentUtil.completed;
import static oracle.nosql.cursor.util.ConcurrentUtil.failedFuture;
import static oracle.nosql.cursor.util.ConcurrentUtil.safeCall;
import static oracle.nosql.cursor.util.ConcurrentUtil.synchronizedCall;
import static oracle.nosql.cursor.util.ConcurrentUtil.unwrapCompletionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

import oracle.nosql.cursor.BatchSource;
import oracle.nosql.cursor.CursorExhaustedException;
import oracle.nosql.cursor.CursorHandle;
import oracle.nosql.cursor.CursorUsageException;
import oracle.nosql.cursor.SessionHandle;
import oracle.nosql.cursor.SessionManager;
import oracle.nosql.cursor.util.CheckNull;
import oracle.nosql.cursor.util.LogUtil;
import oracle.nosql.cursor.values.Document;

import reactor.core.publisher.Mono;

/**
 * Cursor is a lazy iterator over the results of a query that the server
 * returns in batches. Nothing is fetched until a document is first asked
 * for; after that the cursor fetches a new batch whenever its buffer runs
 * empty and the server still holds results (its cursor id is not 0).
 * <p>
 * Documents can be consumed in several ways, all of which read from the same
 * position and produce the same sequence:
 * <ul>
 * <li>one at a time with {@link #next}, {@link #tryNext} and
 * {@link #hasNext}</li>
 * <li>with a callback, {@link #forEach} and {@link #forEachWhile}</li>
 * <li>all at once with {@link #toList}</li>
 * <li>with a blocking {@link Iterable}, {@link #toIterable}</li>
 * <li>as a {@link Flow.Publisher}, {@link #stream()}</li>
 * </ul>
 * Each raw document can be transformed by functions registered with
 * {@link #map}. Transforms run when a document is produced, never when the
 * cursor only checks whether one is available.
 * <p>
 * Example:
 * <pre>
 * CursorHandle handle = ...;
 *
 * Cursor&lt;String&gt; names = handle.find(new FindRequest())
 *     .map(doc -&gt; doc.getString("name"));
 *
 * names.forEach(System.out::println).join();
 * </pre>
 * <p>
 * A cursor is a single-consumer object. Pulling operations must not overlap:
 * an operation started while another one has not completed fails with
 * {@link CursorUsageException}. {@link #closeAsync} can be called at any
 * time.
 * <p>
 * The cursor owns a session, which it ends exactly once, when it reaches a
 * terminal state: {@link CursorState#EXHAUSTED} after one document more than
 * available was requested, or {@link CursorState#KILLED} after
 * {@link #closeAsync}, a failing transform or a failing round trip. A killed
 * cursor also releases the server-side cursor if it is still live.
 *
 * @param <T> the type of the values produced
 *
 * @see CursorHandle#find(FindRequest)
 */
public class Cursor<T> implements AutoCloseable {

    private final BatchSource source;
    private final FindRequest request;
    private final SessionManager sessionManager;
    private final Logger logger;
    private final TransformChain transforms;

    /* guards the mutable state below, and orders fetch against kill */
    private final ReentrantLock lock = new ReentrantLock();

    /* set while a pulling operation is outstanding */
    private final AtomicBoolean consuming = new AtomicBoolean();

    private final Deque<Document> buffer = new ArrayDeque<Document>();

    private volatile long id;

    private volatile CursorState state = CursorState.OPEN;

    private volatile SessionHandle session;

    private volatile int batchSize;

    /* the outstanding fetch, completed after its batch has been applied */
    private CompletableFuture<Void> inFlight;

    /* set once, by the first transition to a terminal state */
    private CompletableFuture<Void> termination;

    private TerminationCause cause;

    /**
     * @hidden
     * Cursors are created by {@link CursorHandle#find}.
     *
     * @param source the source of batches
     * @param request the query
     * @param sessionManager creates the session the cursor owns
     * @param logger the logger, or null
     */
    public Cursor(BatchSource source,
                  FindRequest request,
                  SessionManager sessionManager,
                  Logger logger) {
        this(source, request, sessionManager, logger, new TransformChain());
    }

    private Cursor(BatchSource source,
                   FindRequest request,
                   SessionManager sessionManager,
                   Logger logger,
                   TransformChain transforms) {
        CheckNull.requireNonNullIAE(source, "Cursor: source must be non-null");
        CheckNull.requireNonNullIAE(request,
                                    "Cursor: request must be non-null");
        CheckNull.requireNonNullIAE(sessionManager,
            "Cursor: sessionManager must be non-null");
        this.source = source;
        this.request = request;
        this.sessionManager = sessionManager;
        this.logger = logger;
        this.transforms = transforms;
        this.batchSize = request.getBatchSize();
        this.session = sessionManager.startSession();
    }

    /**
     * Adds a transform that is applied to every document the cursor
     * produces, after the transforms added before it. The same cursor is
     * returned, typed by the transform's result.
     * <p>
     * A transform must not return null. If it does, the cursor is killed and
     * the consuming operation fails with {@link CursorUsageException}. If a
     * transform throws, the cursor is killed and the exception is passed to
     * the consuming operation unchanged.
     *
     * @param <R> the type the transform produces
     * @param transform the transform
     *
     * @return this cursor
     *
     * @throws IllegalArgumentException if the transform is null
     * @throws CursorUsageException if the cursor has already started fetching
     */
    public <R> Cursor<R> map(Function<? super T, ? extends R> transform) {
        CheckNull.requireNonNullIAE(transform,
                                    "Cursor.map: transform must be non-null");
        lock.lock();
        try {
            if (state != CursorState.OPEN || inFlight != null) {
                throw new CursorUsageException(
                    "Cursor is already initialized; transforms must be " +
                    "added before iteration starts");
            }
            transforms.add(transform);
        } finally {
            lock.unlock();
        }
        @SuppressWarnings("unchecked")
        Cursor<R> self = (Cursor<R>) this;
        return self;
    }

    /**
     * Returns whether another document is available, fetching batches from
     * the server as needed. No document is consumed and no transform is run.
     * If no document remains the cursor becomes exhausted.
     *
     * @return a future completed with true if a document is available
     */
    public CompletableFuture<Boolean> hasNext() {
        return this.<Boolean>exclusive(() -> {
            final CursorState s = state;
            if (s == CursorState.KILLED) {
                return failedFuture(killedException());
            }
            if (s == CursorState.EXHAUSTED) {
                return CompletableFuture.completedFuture(Boolean.FALSE);
            }
            return fill(false).thenCompose(v -> {
                lock.lock();
                try {
                    if (state == CursorState.KILLED) {
                        return failedFuture(killedException());
                    }
                    if (!buffer.isEmpty()) {
                        return CompletableFuture.completedFuture(Boolean.TRUE);
                    }
                } finally {
                    lock.unlock();
                }
                return terminate(TerminationCause.NATURAL, null)
                    .thenApply(x -> Boolean.FALSE);
            });
        });
    }

    /**
     * Returns the next document, with all transforms applied, fetching
     * batches from the server as needed. Once all documents have been
     * returned the future completes with null, and keeps doing so on later
     * calls.
     *
     * @return a future completed with the next value, or null when there
     * are no more
     *
     * @throws CursorExhaustedException (through the future) if the cursor
     * was killed
     */
    public CompletableFuture<T> next() {
        return exclusive(() -> advance(false)).thenApply(NextResult::orNull);
    }

    /**
     * Like {@link #next} but makes at most one round trip. If that round trip
     * returns no documents while the server cursor is still live, the future
     * completes with null and the cursor stays usable.
     *
     * @return a future completed with the next value, or null
     */
    public CompletableFuture<T> tryNext() {
        return exclusive(() -> advance(true)).thenApply(NextResult::orNull);
    }

    /**
     * Calls the visitor for every remaining document, in order. If the
     * visitor throws, iteration stops, the cursor is closed and the returned
     * future fails with the visitor's exception.
     *
     * @param visitor the visitor
     *
     * @return a future completed when all documents were visited
     */
    public CompletableFuture<Void> forEach(Consumer<? super T> visitor) {
        CheckNull.requireNonNullIAE(visitor,
                                    "Cursor.forEach: visitor must be non-null");
        return forEachWhile(value -> {
            visitor.accept(value);
            return true;
        });
    }

    /**
     * Calls the visitor for the remaining documents, in order, until it
     * returns false. Documents not visited stay in the cursor.
     *
     * @param visitor the visitor, returning false to stop
     *
     * @return a future completed when iteration stops
     */
    public CompletableFuture<Void> forEachWhile(
        Predicate<? super T> visitor) {

        CheckNull.requireNonNullIAE(visitor,
            "Cursor.forEachWhile: visitor must be non-null");
        return exclusive(() -> drive(visitor));
    }

    /**
     * Returns all remaining documents, in order.
     *
     * @return a future completed with the documents
     */
    public CompletableFuture<List<T>> toList() {
        return this.<List<T>>exclusive(() -> {
            final List<T> results = new ArrayList<T>();
            return drive(results::add)
                .thenApply(v -> results);
        });
    }

    /**
     * Returns an {@link Iterable} whose iterator blocks on the cursor. The
     * iterator looks one value ahead, so its {@code hasNext()} runs the
     * transforms of the document it returns next. Any failure closes the
     * cursor and is thrown from the iterator.
     *
     * @return the iterable
     */
    public CursorIterable<T> toIterable() {
        return new CursorIterable<T>(this);
    }

    /**
     * Returns a publisher that emits the remaining documents. The publisher
     * accepts a single subscriber, completes when the cursor is exhausted and
     * reports any failure with {@code onError}. Cancelling the subscription
     * closes the cursor.
     *
     * @return the publisher
     */
    public Flow.Publisher<T> stream() {
        return new CursorPublisher<T, T>(this, Function.identity());
    }

    /**
     * Like {@link #stream()}, with an additional transform applied to each
     * document after the cursor's own transforms. A failure of this
     * transform is reported with {@code onError} and closes the cursor.
     *
     * @param <R> the type the transform produces
     * @param transform the transform
     *
     * @return the publisher
     */
    public <R> Flow.Publisher<R> stream(
        Function<? super T, ? extends R> transform) {

        CheckNull.requireNonNullIAE(transform,
                                    "Cursor.stream: transform must be non-null");
        return new CursorPublisher<T, R>(this, transform);
    }

    /**
     * Closes the cursor. If it has not terminated, it becomes
     * {@link CursorState#KILLED}, buffered documents are discarded, the
     * server-side cursor is killed if it is live, and the session is ended.
     * A fetch in progress is allowed to complete first, so the kill request
     * targets the cursor id it returned. Closing a terminated cursor has no
     * effect.
     *
     * @return a future completed when the kill request and session end have
     * completed, failing if the kill request failed
     */
    public CompletableFuture<Void> closeAsync() {
        return terminate(TerminationCause.CLOSED, null);
    }

    /**
     * Closes the cursor and waits for it, see {@link #closeAsync}.
     */
    @Override
    public void close() {
        Mono.fromFuture(closeAsync()).block();
    }

    /**
     * Resets the cursor so the query runs again from the beginning. The
     * current execution is closed first, then the cursor returns to
     * {@link CursorState#OPEN} with a new session. Transforms are kept.
     *
     * @return a future completed when the cursor is ready to be used again
     *
     * @throws CursorUsageException (through the future) if an operation is
     * in progress on the cursor
     */
    public CompletableFuture<Void> rewind() {
        if (consuming.get()) {
            return failedFuture(new CursorUsageException(
                "Cursor cannot be rewound while it is being consumed"));
        }
        return closeAsync().handle((v, err) -> {
            reset();
            if (err != null) {
                throw new CompletionException(unwrapCompletionException(err));
            }
            return null;
        });
    }

    /**
     * Returns a new cursor for the same query, with the same transforms and
     * batch size. The new cursor has not fetched anything and owns a new
     * session.
     *
     * @return the new cursor
     */
    public Cursor<T> copy() {
        final TransformChain chain =
            synchronizedCall(lock, () -> transforms.copy());
        Cursor<T> c = new Cursor<T>(source, request.copy(), sessionManager,
                                    logger, chain);
        c.batchSize = batchSize;
        return c;
    }

    /**
     * Sets the number of documents requested by subsequent round trips,
     * including the first one if the cursor has not fetched yet.
     *
     * @param batchSize the batch size, 0 for the server default
     *
     * @return this
     *
     * @throws IllegalArgumentException if the batch size is negative
     */
    public Cursor<T> setBatchSize(int batchSize) {
        this.batchSize = CheckNull.requireNonNegative(batchSize, "batchSize");
        return this;
    }

    /**
     * Returns the number of documents requested per round trip, 0 for the
     * server default.
     *
     * @return the batch size
     */
    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Returns the number of fetched documents not consumed yet.
     *
     * @return the number of buffered documents
     */
    public int bufferedCount() {
        return synchronizedCall(lock, () -> buffer.size());
    }

    /**
     * Removes and returns all buffered documents, untransformed. No round
     * trip is made.
     *
     * @return the buffered documents
     */
    public List<Document> readBufferedDocuments() {
        return readBufferedDocuments(Integer.MAX_VALUE);
    }

    /**
     * Removes and returns up to {@code max} buffered documents,
     * untransformed. No round trip is made and no transform is run.
     *
     * @param max the maximum number of documents
     *
     * @return the documents, possibly empty
     *
     * @throws IllegalArgumentException if max is negative
     */
    public List<Document> readBufferedDocuments(int max) {
        CheckNull.requireNonNegative(max, "max");
        lock.lock();
        try {
            final List<Document> docs =
                new ArrayList<Document>(Math.min(max, buffer.size()));
            while (docs.size() < max && !buffer.isEmpty()) {
                docs.add(buffer.poll());
            }
            return docs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current server cursor id. 0 means there is no live
     * server-side cursor: nothing was fetched yet, the server returned its
     * last batch, or the cursor was killed.
     *
     * @return the cursor id
     */
    public long getId() {
        return id;
    }

    /**
     * Returns true only if the cursor ran out of documents naturally.
     *
     * @return true if exhausted
     */
    public boolean isClosed() {
        return state == CursorState.EXHAUSTED;
    }

    /**
     * Returns true only if the cursor was killed, by {@link #closeAsync} or
     * by a failure.
     *
     * @return true if killed
     */
    public boolean isKilled() {
        return state == CursorState.KILLED;
    }

    /**
     * Returns true if the cursor is exhausted or killed.
     *
     * @return true if terminated
     */
    public boolean isTerminated() {
        return state.isTerminal();
    }

    /**
     * Returns the lifecycle state.
     *
     * @return the state
     */
    public CursorState getState() {
        return state;
    }

    /**
     * Returns the session owned by the cursor.
     *
     * @return the session
     */
    public SessionHandle getSession() {
        return session;
    }

    /**
     * Returns the query of this cursor.
     *
     * @return the request
     */
    public FindRequest getRequest() {
        return request;
    }

    Logger getLogger() {
        return logger;
    }

    /*
     * The single-consumer variant of advance() used by the adapters.
     */
    CompletableFuture<NextResult<T>> advanceExclusive() {
        return exclusive(() -> advance(false));
    }

    /*
     * Closes the cursor after an operation failed. A kill failure is
     * logged; the operation's own failure is what the caller reports.
     */
    CompletableFuture<Void> closeAfterFailure(Throwable failure) {
        return closeAsync().handle((v, err) -> {
            if (err != null) {
                LogUtil.logWarning(logger,
                    "Failed to close cursor after " + failure + ": " +
                    unwrapCompletionException(err));
            }
            return null;
        });
    }

    /**
     * Produces the next value: fills the buffer if needed, then either
     * transforms and returns the head document, or, when the buffer stays
     * empty and the server cursor is gone, exhausts the cursor and returns
     * the no-value marker.
     *
     * @param singleAttempt make at most one round trip
     */
    CompletableFuture<NextResult<T>> advance(boolean singleAttempt) {
        final CursorState s = state;
        if (s == CursorState.KILLED) {
            return failedFuture(killedException());
        }
        if (s == CursorState.EXHAUSTED) {
            return CompletableFuture.completedFuture(NextResult.<T>none());
        }
        return fill(singleAttempt).thenCompose(v -> produce());
    }

    private CompletableFuture<NextResult<T>> produce() {
        final Document raw;
        lock.lock();
        try {
            if (state == CursorState.KILLED) {
                return failedFuture(killedException());
            }
            if (state == CursorState.EXHAUSTED) {
                return CompletableFuture.completedFuture(NextResult.<T>none());
            }
            raw = buffer.poll();
            if (raw == null && id != 0) {
                /* tryNext: the one round trip returned nothing */
                return CompletableFuture.completedFuture(NextResult.<T>none());
            }
        } finally {
            lock.unlock();
        }

        if (raw == null) {
            return terminate(TerminationCause.NATURAL, null)
                .thenApply(v -> NextResult.<T>none());
        }

        final Object value;
        try {
            value = transforms.apply(raw);
        } catch (Throwable t) {
            LogUtil.logFine(logger, "Cursor transform failed: " + t);
            return failAfter(terminate(TerminationCause.TRANSFORM_FAILED, t),
                             t);
        }
        @SuppressWarnings("unchecked")
        final T produced = (T) value;
        return CompletableFuture.completedFuture(NextResult.of(produced));
    }

    /*
     * Fetches until the buffer holds a document or the server cursor is
     * gone.
     */
    private CompletableFuture<Void> fill(boolean singleAttempt) {
        final boolean needFetch;
        lock.lock();
        try {
            needFetch = buffer.isEmpty() &&
                (state == CursorState.OPEN ||
                 (state == CursorState.ITERATING && id != 0));
        } finally {
            lock.unlock();
        }
        if (!needFetch) {
            return completed();
        }
        final CompletableFuture<Void> fetched = fetchBatch();
        if (singleAttempt) {
            return fetched;
        }
        return fetched.thenCompose(v -> fill(false));
    }

    private CompletableFuture<Void> fetchBatch() {
        final CompletableFuture<Void> pending = new CompletableFuture<Void>();
        final boolean initial;
        final long cursorId;
        final SessionHandle s;
        final int size;
        lock.lock();
        try {
            if (inFlight != null) {
                return failedFuture(new CursorUsageException(
                    "A fetch is already in progress on this cursor"));
            }
            inFlight = pending;
            initial = (state == CursorState.OPEN);
            cursorId = id;
            s = session;
            size = batchSize;
        } finally {
            lock.unlock();
        }

        if (LogUtil.isFineEnabled(logger)) {
            LogUtil.logFine(logger, (initial ? "Running query " + request :
                                     "Fetching more from cursor " + cursorId) +
                            ", batchSize " + size);
        }

        if (initial) {
            final FindRequest first = (size == request.getBatchSize() ?
                request : request.copy().setBatchSize(size));
            safeCall(() -> source.fetchInitial(first, s)).whenComplete(
                (batch, err) -> onBatch(batch, err, pending));
        } else {
            safeCall(() -> source.fetchMore(cursorId, s, size)).whenComplete(
                (batch, err) -> onBatch(batch, err, pending));
        }
        return pending;
    }

    private void onBatch(Batch batch,
                         Throwable err,
                         CompletableFuture<Void> pending) {
        final Throwable error = (err == null && batch == null ?
            new IllegalStateException("BatchSource returned a null batch") :
            unwrapCompletionException(err));
        final boolean wasTerminal;
        SessionHandle replaced = null;
        lock.lock();
        try {
            inFlight = null;
            wasTerminal = state.isTerminal();
            if (error == null) {
                if (batch instanceof InitialBatch) {
                    SessionHandle bound = ((InitialBatch) batch).getSession();
                    if (bound != null && bound != session) {
                        replaced = session;
                        session = bound;
                    }
                }
                /* recorded even when killed, so the kill targets it */
                id = batch.getCursorId();
                if (state == CursorState.OPEN) {
                    state = CursorState.ITERATING;
                }
                if (state == CursorState.ITERATING) {
                    buffer.addAll(batch.getDocuments());
                }
            }
        } finally {
            lock.unlock();
        }

        if (replaced != null) {
            /* started by this cursor, not by the source */
            LogUtil.logFine(logger, "Cursor session replaced, ending " +
                            replaced);
            endSession(replaced);
        }
        if (error == null) {
            LogUtil.logTrace(logger, "Received " + batch);
            pending.complete(null);
            return;
        }
        LogUtil.logFine(logger, "Cursor fetch failed: " + error);
        if (wasTerminal) {
            pending.completeExceptionally(error);
            return;
        }
        terminate(TerminationCause.UPSTREAM_FAILED, error).whenComplete(
            (v, e) -> pending.completeExceptionally(error));
    }

    /**
     * The one transition into a terminal state. The first call wins and
     * performs the cleanup: wait for an outstanding fetch, kill the server
     * cursor if live, end the session. Later calls return the same future.
     */
    private CompletableFuture<Void> terminate(TerminationCause why,
                                              Throwable failure) {
        final CompletableFuture<Void> result = new CompletableFuture<Void>();
        final CompletableFuture<Void> pending;
        lock.lock();
        try {
            if (termination != null) {
                return termination;
            }
            termination = result;
            cause = why;
            state = why.targetState();
            buffer.clear();
            pending = inFlight;
        } finally {
            lock.unlock();
        }

        if (LogUtil.isFineEnabled(logger)) {
            LogUtil.logFine(logger, "Cursor " + id + " terminating, cause " +
                            why + (failure != null ? ": " + failure : ""));
        }

        final CompletableFuture<Void> ready = (pending == null ? completed() :
            pending.handle((v, e) -> (Void) null));
        ready.thenCompose(v -> killIfLive()).whenComplete((v, err) -> {
            endSession();
            final Throwable killError = unwrapCompletionException(err);
            if (killError == null) {
                result.complete(null);
            } else if (why == TerminationCause.CLOSED) {
                result.completeExceptionally(killError);
            } else {
                LogUtil.logWarning(logger,
                    "Failed to kill cursor after " + why + ": " + killError);
                result.complete(null);
            }
        });
        return result;
    }

    private CompletableFuture<Void> killIfLive() {
        final long liveId;
        final SessionHandle s;
        lock.lock();
        try {
            liveId = id;
            id = 0;
            s = session;
        } finally {
            lock.unlock();
        }
        if (liveId == 0) {
            return completed();
        }
        LogUtil.logFine(logger, "Killing server cursor " + liveId);
        return safeCall(() -> source.kill(liveId, s));
    }

    private void endSession() {
        endSession(session);
    }

    private void endSession(SessionHandle s) {
        if (s == null) {
            return;
        }
        try {
            s.end();
        } catch (RuntimeException re) {
            LogUtil.logWarning(logger, "Failed to end session " + s, re);
        }
    }

    private void reset() {
        synchronizedCall(lock, () -> {
            buffer.clear();
            id = 0;
            inFlight = null;
            termination = null;
            cause = null;
            session = sessionManager.startSession();
            state = CursorState.OPEN;
        });
        LogUtil.logFine(logger, "Cursor rewound");
    }

    /*
     * Drives advance() until the visitor stops or the cursor is exhausted,
     * looping rather than recursing over documents that are already
     * buffered.
     */
    private CompletableFuture<Void> drive(Predicate<? super T> visitor) {
        final CompletableFuture<Void> done = new CompletableFuture<Void>();
        driveLoop(visitor, done);
        return done;
    }

    private void driveLoop(Predicate<? super T> visitor,
                           CompletableFuture<Void> done) {
        while (true) {
            final CompletableFuture<NextResult<T>> step = advance(false);
            if (!step.isDone()) {
                step.whenComplete((r, err) -> {
                    if (visit(r, err, visitor, done)) {
                        driveLoop(visitor, done);
                    }
                });
                return;
            }
            /* already complete, so handle() runs right here */
            if (!step.handle((r, err) -> visit(r, err, visitor, done))
                     .join()) {
                return;
            }
        }
    }

    /*
     * Returns true if the drive loop should continue.
     */
    private boolean visit(NextResult<T> r,
                          Throwable err,
                          Predicate<? super T> visitor,
                          CompletableFuture<Void> done) {
        if (err != null) {
            final Throwable error = unwrapCompletionException(err);
            closeAfterFailure(error).whenComplete(
                (v, e) -> done.completeExceptionally(error));
            return false;
        }
        if (r.isNone()) {
            done.complete(null);
            return false;
        }
        final boolean more;
        try {
            more = visitor.test(r.get());
        } catch (Throwable t) {
            closeAfterFailure(t).whenComplete(
                (v, e) -> done.completeExceptionally(t));
            return false;
        }
        if (!more) {
            done.complete(null);
        }
        return more;
    }

    private <X> CompletableFuture<X> exclusive(
        Supplier<CompletableFuture<X>> operation) {

        if (!consuming.compareAndSet(false, true)) {
            return failedFuture(new CursorUsageException(
                "Cursor is already being consumed by another operation; " +
                "operations on a cursor must not overlap"));
        }
        return safeCall(operation).whenComplete(
            (r, e) -> consuming.set(false));
    }

    private CursorExhaustedException killedException() {
        final TerminationCause why = cause;
        return new CursorExhaustedException(
            "Cursor is killed and cannot be used" +
            (why == TerminationCause.CLOSED ? ", it was closed" :
             ", it was terminated by an earlier failure"));
    }

    private static <X> CompletableFuture<X> failAfter(
        CompletableFuture<Void> cleanup, Throwable failure) {
        return cleanup.handle((v, e) -> (Void) null)
            .thenCompose(v -> failedFuture(failure));
    }

    @Override
    public String toString() {
        return "Cursor[id=" + id + ", state=" + state +
            ", buffered=" + bufferedCount() + "]";
    }
}
