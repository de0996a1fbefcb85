/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import com.docstore.driver.ops.Operation;

/**
 * RetryHandler is consulted by the executor when an attempt of a retryable
 * operation fails with a {@link RetryableException}. It controls the number
 * of retries as well as the delay between them. A default RetryHandler is
 * always configured and can be replaced using
 * {@link DriverConfig#setRetryHandler} or adjusted using
 * {@link DriverConfig#configureDefaultRetryHandler}.
 * <p>
 * The handler is only asked about operations whose type allows a retry.
 * It cannot make an operation retryable that is not: an update or delete
 * that may touch several documents is never retried whatever the handler
 * returns.
 * <p>
 * Instances of this interface must be immutable so they can be shared
 * among threads.
 */
public interface RetryHandler {

    /**
     * Returns the number of retries that this handler instance will allow
     * before the exception is passed to the application.
     *
     * @return the max number of retries
     */
    int getNumRetries();

    /**
     * Determines whether to perform a retry.
     *
     * @param operation the operation that has triggered the exception
     *
     * @param numRetries the number of retries that have occurred for the
     * operation
     *
     * @param re the exception that was thrown
     *
     * @return true if the operation should be retried, false if not, causing
     * the exception to be passed to the application.
     */
    boolean doRetry(Operation<?> operation,
                    int numRetries,
                    RetryableException re);

    /**
     * Returns the time to wait before the next attempt. It is called after
     * {@link #doRetry} returned true. The executor schedules the next
     * attempt rather than sleeping, so implementations must not block.
     *
     * @param operation the operation that has triggered the exception
     *
     * @param numRetries the number of retries that have occurred for the
     * operation
     *
     * @param re the exception that was thrown
     *
     * @return the delay in milliseconds, 0 for none
     */
    int delayTime(Operation<?> operation,
                  int numRetries,
                  RetryableException re);
}
