/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.docstore.driver.DriverConfig;
import com.docstore.driver.ReadPreference;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.Server;

/**
 * An operation is a single user call reified as an object: the command it
 * issues, the options it was given and the aspects its type declares.
 * Operations are executed by submitting them to an executor, which
 * selects a server when the type declares
 * {@link Aspect#EXECUTE_WITH_SELECTION}, invokes {@link #execute} and
 * decides from the aspects whether a failed attempt may be retried.
 * <p>
 * An operation owns a private copy of the options it was constructed with.
 * The caller's options object is never modified and may be reused.
 * <p>
 * An operation instance may be submitted only once.
 *
 * @param <T> the type of the operation result
 */
public abstract class Operation<T> {

    /*
     * The operation's own copy of the options, set by subclasses
     */
    private final CommandOptions options;

    /**
     * Timeout for the whole operation, including retries, in milliseconds.
     * 0 means the executor default is used.
     */
    private int timeoutMs;

    /**
     * @hidden
     * Retry stats, created on the first retry.
     */
    private RetryStats retryStats;

    /**
     * @hidden
     * The start time of the operation, set by the executor.
     */
    private volatile long startNanos;

    private final AtomicBoolean submitted = new AtomicBoolean();

    /**
     * @param options the operation's own options; subclasses pass a copy
     */
    protected Operation(CommandOptions options) {
        this.options = options == null ? new CommandOptions() : options;
    }

    /**
     * Performs one attempt of the operation against the server: exactly
     * one collaborator call, then exactly one call to {@code done}.
     *
     * @param server the selected server, or null if the type does not
     * declare {@link Aspect#EXECUTE_WITH_SELECTION}
     * @param done the completion
     */
    public abstract void execute(Server server, ResultCallback<T> done);

    /**
     * @return the options owned by this operation
     */
    public CommandOptions getOptions() {
        return options;
    }

    /**
     * @return the aspects declared for the type of this operation
     */
    public Set<Aspect> getAspects() {
        return AspectRegistry.aspectsOf(getClass());
    }

    /**
     * @param aspect the aspect
     * @return true if the type of this operation declares the aspect
     */
    public boolean hasAspect(Aspect aspect) {
        return AspectRegistry.hasAspect(getClass(), aspect);
    }

    /**
     * Returns whether repeating this write is safe. Operations that target
     * at most one document are safe, so the default is true. Bulk
     * operations override this.
     *
     * @return true if the write may be repeated
     */
    public boolean canRetryWrite() {
        return true;
    }

    /**
     * Returns whether the operation may be retried after a transient
     * failure. The type must declare {@link Aspect#RETRYABLE} and, if it is a
     * write, {@link #canRetryWrite} must return true.
     *
     * @return true if a retry is allowed
     */
    public boolean shouldRetry() {
        if (!hasAspect(Aspect.RETRYABLE)) {
            return false;
        }
        return !hasAspect(Aspect.WRITE_OPERATION) || canRetryWrite();
    }

    /**
     * Returns the read preference used for server selection. Writes always
     * go to the primary.
     *
     * @return the read preference
     */
    public ReadPreference getReadPreference() {
        if (hasAspect(Aspect.WRITE_OPERATION)) {
            return ReadPreference.PRIMARY;
        }
        ReadPreference rp = options.getReadPreference();
        return rp == null ? ReadPreference.PRIMARY : rp;
    }

    /**
     * Returns the name of the operation type used in log messages.
     *
     * @return the name
     */
    public String getTypeName() {
        return getClass().getSimpleName();
    }

    /**
     * Sets the timeout for the operation, including all retries.
     *
     * @param timeoutMs the timeout in milliseconds, must be &gt; 0
     *
     * @return this
     */
    public Operation<T> setTimeout(int timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMs = timeoutMs;
        return this;
    }

    /**
     * @return the timeout in milliseconds, 0 if not set
     */
    public int getTimeout() {
        return timeoutMs;
    }

    /**
     * @hidden
     * Applies defaults from the configuration for values not set.
     * @param config the configuration
     * @return this
     */
    public Operation<T> setDefaults(DriverConfig config) {
        if (timeoutMs == 0) {
            timeoutMs = config.getDefaultRequestTimeout();
        }
        return this;
    }

    /**
     * @hidden
     * Marks the operation as submitted to an executor.
     * @throws IllegalStateException if it was already submitted
     */
    public void markSubmitted() {
        if (!submitted.compareAndSet(false, true)) {
            throw new IllegalStateException(
                getTypeName() + " has already been submitted; " +
                "create a new operation for each call");
        }
    }

    /**
     * @return true if the operation has been submitted
     */
    public boolean isSubmitted() {
        return submitted.get();
    }

    /**
     * Returns the retry stats of the operation, or null if there were no
     * retries.
     *
     * @return the stats
     */
    public RetryStats getRetryStats() {
        return retryStats;
    }

    /**
     * @hidden
     * @param re the exception that caused a retry
     */
    public void addRetryException(Class<? extends Throwable> re) {
        if (retryStats == null) {
            retryStats = new RetryStats();
        }
        retryStats.addException(re);
    }

    /**
     * @hidden
     * @param delayMs time spent waiting before a retry
     */
    public void addRetryDelayMs(int delayMs) {
        if (retryStats == null) {
            retryStats = new RetryStats();
        }
        retryStats.addDelayMs(delayMs);
    }

    /**
     * @hidden
     */
    public void incrementRetries() {
        if (retryStats == null) {
            retryStats = new RetryStats();
        }
        retryStats.incrementRetries();
    }

    /**
     * @hidden
     * @return the number of retries so far
     */
    public int getNumRetries() {
        return retryStats == null ? 0 : retryStats.getRetries();
    }

    /**
     * @hidden
     * @return the time spent waiting before retries so far, in milliseconds
     */
    public int getRetryDelayMs() {
        return retryStats == null ? 0 : retryStats.getDelayMs();
    }

    /**
     * @hidden
     * @param nanos the start time
     */
    public void setStartNanos(long nanos) {
        startNanos = nanos;
    }

    /**
     * @hidden
     * @return the start time
     */
    public long getStartNanos() {
        return startNanos;
    }

    @Override
    public String toString() {
        return getTypeName() + getAspects();
    }
}
