/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import com.docstore.driver.ops.Operation;

/**
 * Default retry handler.
 * This may be extended by clients for specific use cases.
 *
 * The default retry handler decides when and for how long retries will
 * be attempted. See {@link RetryHandler} for more information on
 * retry handlers.
 */
public class DefaultRetryHandler implements RetryHandler {

    private final int maxRetries;
    private final int fixedDelayMs;

    DefaultRetryHandler(int retries, int delayMS) {
        if (retries < 0) {
            throw new IllegalArgumentException(
                "Retry handler: number of retries must " +
                "be a non-negative value");
        }
        if (delayMS < 0) {
            throw new IllegalArgumentException(
                "Retry handler: delay milliseconds must " +
                "be a non-negative value");
        }
        this.fixedDelayMs = delayMS;
        this.maxRetries = retries;
    }

    @Override
    public int getNumRetries() {
        return maxRetries;
    }

    /**
     * Retries while the operation allows it and the number of retries is
     * below the maximum.
     */
    @Override
    public boolean doRetry(Operation<?> operation,
                           int numRetries,
                           RetryableException re) {
        if (!re.okToRetry() || !operation.shouldRetry()) {
            return false;
        }
        return numRetries < maxRetries;
    }

    /**
     * If delayMS is non-zero, use it. Otherwise, use an incremental backoff
     * algorithm to compute the time of delay.
     */
    @Override
    public int delayTime(Operation<?> operation,
                         int numRetries,
                         RetryableException re) {
        return computeBackoffDelay(operation, fixedDelayMs);
    }

    /**
     * Compute an incremental backoff delay in milliseconds.
     * This method also checks the operation's timeout and ensures the
     * delay will not exceed it.
     *
     * @param operation The operation being executed
     * @param fixedDelayMs A specific delay to use and check for timeout.
     *        Pass zero to use the default backoff logic.
     *
     * @return The number of milliseconds to delay. If zero,
     *         do not delay at all.
     */
    public static int computeBackoffDelay(Operation<?> operation,
                                          int fixedDelayMs) {
        int delayMs = fixedDelayMs;
        if (delayMs == 0) {
            /* add 200ms plus a small random amount */
            int mSecToAdd = 200 + (int)(Math.random() * 50);

            delayMs = operation.getRetryDelayMs();
            delayMs += mSecToAdd;
        }

        /*
         * if the delay would put us over the timeout, reduce it to just before
         * the timeout would occur.
         */
        int timeoutMs = operation.getTimeout();
        if (timeoutMs <= 0) {
            return delayMs;
        }
        long nanosUsed = System.nanoTime() - operation.getStartNanos();
        int msUsed = Math.toIntExact(nanosUsed / 1_000_000);
        int msLeft = (timeoutMs - msUsed) - 1;
        if (msLeft < delayMs) {
            delayMs = msLeft;
            if (delayMs < 1) {
                return 0;
            }
        }

        return delayMs;
    }
}
