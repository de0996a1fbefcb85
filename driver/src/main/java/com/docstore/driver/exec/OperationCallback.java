/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import static com.docstore.driver.util.LogUtil.logWarning;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import com.docstore.driver.CommandFailedException;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.util.ConcurrentUtil;
import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * The callback handed to an {@link Invocation}, also used for the outcome
 * of an operation as a whole. It turns the single
 * {@code (result, error)} outcome into the completion of a future:
 * <ul>
 * <li>only the first outcome counts, later calls are logged and
 * ignored</li>
 * <li>an outcome with both or neither of result and error set becomes an
 * IllegalStateException</li>
 * <li>a reply document whose ok field is not 1 becomes a
 * {@link CommandFailedException}</li>
 * <li>an outcome reported before the invocation returned is delivered on
 * the task executor, never on the caller's stack</li>
 * </ul>
 *
 * @param <T> the type of the result
 */
class OperationCallback<T> implements ResultCallback<T> {

    private final CompletableFuture<T> future;
    private final Executor taskExecutor;
    private final Logger logger;
    private final String description;

    private final AtomicBoolean called = new AtomicBoolean(false);
    private volatile boolean invocationReturned;

    OperationCallback(CompletableFuture<T> future,
                      Executor taskExecutor,
                      Logger logger,
                      String description) {
        this.future = future;
        this.taskExecutor = taskExecutor;
        this.logger = logger;
        this.description = description;
    }

    /**
     * Called by the executor once {@link Invocation#invoke}, or the start
     * of an operation, has returned.
     */
    void invocationReturned() {
        invocationReturned = true;
    }

    @Override
    public void onResult(T result, Throwable error) {
        if (!called.compareAndSet(false, true)) {
            logWarning(logger, description + " completed more than once, " +
                       "ignoring result=" + result + " error=" + error);
            return;
        }
        if (invocationReturned) {
            complete(result, error);
            return;
        }
        try {
            taskExecutor.execute(() -> complete(result, error));
        } catch (RejectedExecutionException ree) {
            /* executor shut down */
            complete(result, error);
        }
    }

    private void complete(T result, Throwable error) {
        if ((result == null) == (error == null)) {
            future.completeExceptionally(new IllegalStateException(
                description + " completed with " +
                (result == null ? "neither a result nor an error" :
                 "both a result and an error")));
            return;
        }
        if (error != null) {
            future.completeExceptionally(
                ConcurrentUtil.unwrapCompletionException(error));
            return;
        }
        if (result instanceof Document) {
            Document reply = (Document) result;
            if (Documents.hasOk(reply) && !Documents.isOk(reply)) {
                future.completeExceptionally(
                    CommandFailedException.fromResponse(reply));
                return;
            }
        }
        future.complete(result);
    }
}
