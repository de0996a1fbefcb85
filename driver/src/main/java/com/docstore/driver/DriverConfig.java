/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import static com.docstore.driver.util.CheckNull.requireNonNull;

import java.util.logging.Logger;

/**
 * DriverConfig groups the parameters used to create the admin and
 * collection facades. Most parameters are optional and have default
 * values. The facades take a copy of the configuration when they are
 * created, so changes made afterwards have no effect on them.
 * <p>
 * The retry parameters decide which failed operations are executed again.
 * An operation is only retried if its type allows it and the failure was
 * transient, see {@link RetryHandler}. Retryable writes and retryable reads
 * can additionally be turned off as a whole.
 */
public class DriverConfig implements Cloneable {

    /**
     * The default value for the request timeout in milliseconds.
     */
    private static final int DEFAULT_TIMEOUT = 5000;

    /**
     * The default number of retries of the default retry handler.
     */
    static final int DEFAULT_NUM_RETRIES = 1;

    /*
     * The default timeout for an operation, including retries, in
     * milliseconds. 0 means use the default.
     */
    private int timeout;

    /*
     * The number of threads of the task pool used for retry scheduling and
     * completion delivery. 0 means the number of CPUs.
     */
    private int numThreads;

    /*
     * The retry handler, defaulted by DriverFactory.
     */
    private RetryHandler retryHandler;

    private boolean retryWrites = true;

    private boolean retryReads = true;

    /*
     * The logger used by the driver. If null a logger named after the
     * facade implementation class is used.
     */
    private Logger logger;

    public DriverConfig() {}

    /**
     * Returns the configured request timeout value, in milliseconds.
     *
     * @return the timeout, in milliseconds, or 0 if it has not been set
     */
    public int getRequestTimeout() {
        return timeout;
    }

    /**
     * Returns the default value for request timeout. If there is no
     * configured timeout or it is configured as 0, a "default" default
     * value of 5000 milliseconds is used.
     *
     * @return the default timeout, in milliseconds
     */
    public int getDefaultRequestTimeout() {
        return timeout == 0 ? DEFAULT_TIMEOUT : timeout;
    }

    /**
     * Sets the default timeout of an operation. The timeout covers the
     * whole operation including retries and delays between them; it does
     * not interrupt an attempt that is in progress. The default is
     * 5 seconds.
     *
     * @param timeout the timeout value, in milliseconds
     *
     * @return this
     */
    public DriverConfig setRequestTimeout(int timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException(
                "DriverConfig.setRequestTimeout: timeout must " +
                "be a non-negative value");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Sets the number of threads of the task pool used to schedule retries
     * and to deliver completions. If set to 0 or not modified the default
     * is the number of CPUs available.
     *
     * @param numThreads the number
     *
     * @return this
     */
    public DriverConfig setNumThreads(int numThreads) {
        if (numThreads < 0) {
            throw new IllegalArgumentException(
                "DriverConfig.setNumThreads: numThreads must " +
                "be a non-negative value");
        }
        this.numThreads = numThreads;
        return this;
    }

    /**
     * Returns the number of threads of the task pool.
     *
     * @return the number of threads or 0 if not set
     */
    public int getNumThreads() {
        return numThreads;
    }

    /**
     * Sets the {@link RetryHandler} to use. If no handler is configured a
     * default is used. The handler must be safely usable by multiple
     * threads.
     *
     * @param retryHandler the handler
     *
     * @return this
     */
    public DriverConfig setRetryHandler(RetryHandler retryHandler) {
        requireNonNull(
            retryHandler,
            "DriverConfig.setRetryHandler: retryHandler must be non-null");

        this.retryHandler = retryHandler;
        return this;
    }

    /**
     * Returns the {@link RetryHandler} configured, or null if none is set.
     *
     * @return the handler
     */
    public RetryHandler getRetryHandler() {
        return retryHandler;
    }

    /**
     * Sets the {@link RetryHandler} using a default retry handler configured
     * with the specified number of retries and a static delay.
     * A delay of 0 means "use the default delay algorithm" which is an
     * incremental backoff algorithm.
     *
     * @param numRetries the number of retries to perform automatically.
     * This parameter may be 0 for no retries.
     * @param delayMS the delay, in milliseconds. Pass 0 to use the default
     * delay algorithm.
     *
     * @return this
     */
    public DriverConfig configureDefaultRetryHandler(int numRetries,
                                                     int delayMS) {
        retryHandler = new DefaultRetryHandler(numRetries, delayMS);
        return this;
    }

    /**
     * Sets whether retryable writes are retried once after a transient
     * failure. The default is true.
     *
     * @param retryWrites the value
     *
     * @return this
     */
    public DriverConfig setRetryWrites(boolean retryWrites) {
        this.retryWrites = retryWrites;
        return this;
    }

    /**
     * @return true if retryable writes are enabled
     */
    public boolean getRetryWrites() {
        return retryWrites;
    }

    /**
     * Sets whether retryable reads are retried after a transient failure.
     * The default is true.
     *
     * @param retryReads the value
     *
     * @return this
     */
    public DriverConfig setRetryReads(boolean retryReads) {
        this.retryReads = retryReads;
        return this;
    }

    /**
     * @return true if retryable reads are enabled
     */
    public boolean getRetryReads() {
        return retryReads;
    }

    /**
     * Sets the Logger used for the driver.
     *
     * @param logger the Logger.
     *
     * @return this
     */
    public DriverConfig setLogger(Logger logger) {
        requireNonNull(logger,
                       "DriverConfig.setLogger: logger must be non-null");

        this.logger = logger;
        return this;
    }

    /**
     * Returns the Logger, or null if not configured by user.
     *
     * @return the Logger
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * @hidden
     */
    @Override
    public DriverConfig clone() {
        try {
            DriverConfig clone = (DriverConfig) super.clone();
            return clone;
        } catch (CloneNotSupportedException neverHappens) {
            throw new IllegalStateException(neverHappens);
        }
    }
}
