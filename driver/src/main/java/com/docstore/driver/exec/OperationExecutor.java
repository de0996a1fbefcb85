/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import static com.docstore.driver.util.CheckNull.requireNonNull;
import static com.docstore.driver.util.LogUtil.isLoggable;
import static com.docstore.driver.util.LogUtil.logFine;
import static com.docstore.driver.util.LogUtil.logWarning;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.docstore.driver.DocStoreException;
import com.docstore.driver.DriverConfig;
import com.docstore.driver.RequestTimeoutException;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.RetryHandler;
import com.docstore.driver.RetryableException;
import com.docstore.driver.ops.Aspect;
import com.docstore.driver.ops.Operation;
import com.docstore.driver.ops.Result;
import com.docstore.driver.server.Server;
import com.docstore.driver.server.ServerSelector;
import com.docstore.driver.util.ConcurrentUtil;

/**
 * Runs operations and collaborator invocations and delivers their outcome
 * either as a future or to a {@link ResultCallback}. Both forms are built on
 * the same future, so for the same outcome a callback receives exactly the
 * value or exception that the future completes with.
 * <p>
 * {@link #execute} adds server selection and retries on top of
 * {@link #executeOperation}:
 * <ol>
 * <li>if the operation type declares {@link Aspect#EXECUTE_WITH_SELECTION}
 * a server is selected using the operation's read preference</li>
 * <li>the operation is invoked on that server</li>
 * <li>if the attempt fails with a {@link RetryableException}, and the
 * operation, the configuration and the {@link RetryHandler} all allow it,
 * a new attempt with a fresh server selection is scheduled after the
 * delay the handler asks for</li>
 * </ol>
 * Any other failure, including a command that the server rejected, is
 * passed on unchanged. Retries are bounded by the operation timeout; once
 * it has elapsed a {@link RequestTimeoutException} carrying the last
 * failure is reported instead.
 */
public class OperationExecutor {

    private final Logger logger;
    private final DriverConfig config;
    private final ServerSelector selector;
    private final RetryHandler retryHandler;

    /* scheduled pool used for retries and deferred completions */
    private final ScheduledExecutorService taskExecutor;

    private final AtomicLong maxRequestId = new AtomicLong(1);

    /**
     * Per-operation state passed through the asynchronous chain.
     */
    private static class OperationContext<T> {
        private final Operation<T> operation;
        private final String operationName;
        private final Supplier<Long> nextIdSupplier;
        private volatile String requestId;
        private volatile Server server;
        private volatile Throwable exception;

        OperationContext(Operation<T> operation,
                         Supplier<Long> nextIdSupplier) {
            this.operation = operation;
            this.operationName = operation.getTypeName();
            this.nextIdSupplier = nextIdSupplier;
            this.requestId = Long.toString(nextIdSupplier.get());
        }
    }

    /**
     * @param logger the logger
     * @param config the configuration, which must have a retry handler
     * @param selector the server selector
     * @param taskExecutor the pool used for retries and deferred
     * completions, owned by the caller
     */
    public OperationExecutor(Logger logger,
                             DriverConfig config,
                             ServerSelector selector,
                             ScheduledExecutorService taskExecutor) {
        this.logger = requireNonNull(logger, "logger must be non-null");
        this.config = requireNonNull(config, "config must be non-null");
        this.selector = requireNonNull(selector,
                                       "server selector must be non-null");
        this.taskExecutor = requireNonNull(taskExecutor,
                                           "task executor must be non-null");
        this.retryHandler = requireNonNull(config.getRetryHandler(),
            "config must have a retry handler");
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * Get the next executor-scoped request id, used in log messages.
     */
    private long nextRequestId() {
        return maxRequestId.addAndGet(1);
    }

    /**
     * Runs one invocation and returns a future for its outcome. The future
     * is never completed on the stack of this method.
     *
     * @param <T> the result type
     * @param invocation the invocation
     *
     * @return the future
     */
    public <T> CompletableFuture<T> executeOperation(Invocation<T> invocation) {
        requireNonNull(invocation, "invocation must be non-null");
        CompletableFuture<T> future = new CompletableFuture<>();
        invoke(invocation, "Invocation " + nextRequestId(), future);
        return future;
    }

    /**
     * Runs one invocation and passes its outcome to the callback, exactly
     * once.
     *
     * @param <T> the result type
     * @param invocation the invocation
     * @param callback the callback
     */
    public <T> void executeOperation(Invocation<T> invocation,
                                     ResultCallback<T> callback) {
        requireNonNull(invocation, "invocation must be non-null");
        requireNonNull(callback, "callback must be non-null");
        CompletableFuture<T> future = new CompletableFuture<>();
        deliver(future, callback);
        invoke(invocation, "Invocation " + nextRequestId(), future);
    }

    /**
     * Executes an operation and returns a future for its result. The
     * operation instance must not have been executed before.
     *
     * @param <T> the result type
     * @param operation the operation
     *
     * @return the future
     *
     * @throws IllegalStateException if the operation was already submitted
     */
    public <T> CompletableFuture<T> execute(Operation<T> operation) {
        CompletableFuture<T> resultFuture = new CompletableFuture<>();
        submit(operation, resultFuture);
        return resultFuture;
    }

    /**
     * Executes an operation and passes its outcome to the callback, exactly
     * once.
     *
     * @param <T> the result type
     * @param operation the operation
     * @param callback the callback
     *
     * @throws IllegalStateException if the operation was already submitted
     */
    public <T> void execute(Operation<T> operation,
                            ResultCallback<T> callback) {
        requireNonNull(callback, "callback must be non-null");
        CompletableFuture<T> resultFuture = new CompletableFuture<>();
        deliver(resultFuture, callback);
        submit(operation, resultFuture);
    }

    /*
     * Starts the first attempt. The outcome completes resultFuture.
     */
    private <T> void submit(Operation<T> operation,
                            CompletableFuture<T> resultFuture) {
        requireNonNull(operation, "operation must be non-null");
        operation.markSubmitted();

        /*
         * Assign defaults from the config, such as the timeout, that the
         * operation did not set itself.
         */
        operation.setDefaults(config);
        operation.setStartNanos(System.nanoTime());

        OperationContext<T> ctx =
            new OperationContext<>(operation, this::nextRequestId);
        logFine(logger, () -> "Executing " + ctx.operationName +
                " requestId=" + ctx.requestId + " aspects=" +
                operation.getAspects());

        /*
         * Complete a separate future so that failures reach the caller
         * without the CompletionException added by composition. The first
         * attempt can fail before anything was invoked, for example when
         * server selection fails at once; such an outcome is handed to the
         * task executor like an inline invocation result.
         */
        OperationCallback<T> done = new OperationCallback<>(
            resultFuture, taskExecutor, logger,
            ctx.operationName + " requestId=" + ctx.requestId);
        try {
            executeWithRetry(ctx).whenComplete((res, err) -> {
                if (err != null) {
                    done.onResult(
                        null, ConcurrentUtil.unwrapCompletionException(err));
                } else {
                    done.onResult(res, null);
                }
            });
        } finally {
            done.invocationReturned();
        }
    }

    /*
     * One attempt: select, invoke, then either return the result or
     * decide on a retry.
     */
    private <T> CompletableFuture<T> executeWithRetry(OperationContext<T> ctx) {

        final Operation<T> operation = ctx.operation;
        final int timeoutMs = operation.getTimeout();
        final int thisIterationTimeoutMs =
            getIterationTimeoutMs(timeoutMs, operation.getStartNanos());

        /* Check for overall operation timeout first */
        if (thisIterationTimeoutMs <= 0) {
            RequestTimeoutException rte = new RequestTimeoutException(
                timeoutMs,
                ctx.operationName + " timed out: requestId=" +
                ctx.requestId + " " +
                (operation.getRetryStats() != null ?
                 operation.getRetryStats() : ""),
                ctx.exception);
            return CompletableFuture.failedFuture(rte);
        }

        if (operation.getNumRetries() > 0) {
            logRetries(ctx);
        }

        return selectServer(ctx)
        .thenCompose((Server server) -> {
            ctx.server = server;
            CompletableFuture<T> attempt = new CompletableFuture<>();
            invoke(done -> operation.execute(server, done),
                   ctx.operationName + " requestId=" + ctx.requestId,
                   attempt);
            return attempt;
        })
        .handle((T result, Throwable err) -> {
            if (err != null) {
                return handleError(ctx, err);
            }
            return CompletableFuture.completedFuture(handleResult(ctx, result));
        })
        .thenCompose(Function.identity());
    }

    private <T> CompletableFuture<Server> selectServer(OperationContext<T> ctx) {
        Operation<T> operation = ctx.operation;
        if (!operation.hasAspect(Aspect.EXECUTE_WITH_SELECTION)) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Server> selected;
        try {
            selected = selector.selectServer(operation.getReadPreference());
        } catch (RuntimeException re) {
            return CompletableFuture.failedFuture(re);
        }
        if (selected == null) {
            return CompletableFuture.failedFuture(new DocStoreException(
                "Server selector returned no future for " +
                ctx.operationName));
        }
        return selected;
    }

    private <T> void invoke(Invocation<T> invocation,
                            String description,
                            CompletableFuture<T> future) {
        OperationCallback<T> done = new OperationCallback<>(
            future, taskExecutor, logger, description);
        try {
            invocation.invoke(done);
        } catch (RuntimeException re) {
            done.onResult(null, re);
        } finally {
            done.invocationReturned();
        }
    }

    private <T> T handleResult(OperationContext<T> ctx, T result) {
        if (result instanceof Result) {
            ((Result) result).setRetryStats(ctx.operation.getRetryStats());
        }
        logFine(logger, () -> ctx.operationName + " requestId=" +
                ctx.requestId + " succeeded");
        return result;
    }

    /*
     * Main error handling entry point. Only transient failures of
     * retryable operations are retried, everything else fails the
     * operation.
     */
    private <T> CompletableFuture<T> handleError(OperationContext<T> ctx,
                                                 Throwable err) {
        final Throwable actualCause =
            ConcurrentUtil.unwrapCompletionException(err);

        /* set exception on context */
        ctx.exception = actualCause;

        if (actualCause instanceof RetryableException) {
            RetryableException re = (RetryableException) actualCause;
            if (isRetryAllowed(ctx, re)) {
                logFine(logger, "Retryable exception: " + re.getMessage());
                int delayMs = retryHandler.delayTime(
                    ctx.operation, ctx.operation.getNumRetries(), re);
                return retryOperation(ctx, delayMs, re);
            }
        }
        return failOperation(ctx, actualCause);
    }

    private <T> boolean isRetryAllowed(OperationContext<T> ctx,
                                       RetryableException re) {
        Operation<T> operation = ctx.operation;
        if (!operation.shouldRetry()) {
            return false;
        }
        if (operation.hasAspect(Aspect.WRITE_OPERATION)) {
            if (!config.getRetryWrites()) {
                return false;
            }
            Server server = ctx.server;
            if (server != null && !server.supportsRetryableWrites()) {
                return false;
            }
        } else if (!config.getRetryReads()) {
            return false;
        }
        return retryHandler.doRetry(operation, operation.getNumRetries(), re);
    }

    /*
     * Marks the operation as failed and returns a failed future.
     */
    private <T> CompletableFuture<T> failOperation(OperationContext<T> ctx,
                                                   Throwable ex) {
        logFine(logger, () -> String.format(
            "%s requestId=%s failed %s: %s", ctx.operationName,
            ctx.requestId, ex.getClass().getName(), ex.getMessage()));
        return CompletableFuture.failedFuture(ex);
    }

    /*
     * Updates the retry statistics and schedules the next attempt.
     */
    private <T> CompletableFuture<T> retryOperation(OperationContext<T> ctx,
                                                    int delayMs,
                                                    Throwable ex) {
        Operation<T> operation = ctx.operation;
        operation.addRetryException(ex.getClass());
        operation.incrementRetries();
        operation.addRetryDelayMs(delayMs);
        return scheduleRetry(ctx, delayMs);
    }

    private <T> CompletableFuture<T> scheduleRetry(OperationContext<T> ctx,
                                                   int delayMs) {
        CompletableFuture<T> retryFuture = new CompletableFuture<>();
        try {
            taskExecutor.schedule(() -> {
                /* new request id for the retry */
                ctx.requestId = String.valueOf(ctx.nextIdSupplier.get());
                executeWithRetry(ctx).whenComplete((res, e) -> {
                    if (e != null) {
                        retryFuture.completeExceptionally(
                            ConcurrentUtil.unwrapCompletionException(e));
                    } else {
                        retryFuture.complete(res);
                    }
                });
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ree) {
            /* the facade was closed, report the last failure */
            logFine(logger, "Retry of " + ctx.operationName +
                    " rejected, executor is shut down");
            retryFuture.completeExceptionally(ctx.exception);
        }
        return retryFuture;
    }

    private <T> void logRetries(OperationContext<T> ctx) {
        if (!isLoggable(logger, Level.FINE)) {
            return;
        }
        Throwable re = ctx.exception;
        logFine(logger, "Client, doing retry: " +
                ctx.operation.getNumRetries() + " of " + ctx.operationName +
                " requestId=" + ctx.requestId +
                (re != null ? ", exception: " + re : ""));
    }

    /**
     * Calculate the timeout for the next iteration.
     * This is basically the given timeout minus the time
     * elapsed since the start of the operation. If this returns zero or
     * negative, the operation is aborted with a timeout exception.
     */
    private static int getIterationTimeoutMs(long timeoutMs, long startNanos) {
        long diffNanos = System.nanoTime() - startNanos;
        return ((int) timeoutMs - Math.toIntExact(diffNanos / 1_000_000));
    }

    /*
     * Adapts a future to a callback. Exceptions thrown by the callback are
     * logged, they have nowhere else to go.
     */
    private <T> void deliver(CompletableFuture<T> future,
                             ResultCallback<T> callback) {
        future.whenComplete((T result, Throwable err) -> {
            try {
                if (err != null) {
                    callback.onResult(
                        null, ConcurrentUtil.unwrapCompletionException(err));
                } else {
                    callback.onResult(result, null);
                }
            } catch (RuntimeException re) {
                logWarning(logger, "Exception thrown by result callback", re);
            }
        });
    }
}
