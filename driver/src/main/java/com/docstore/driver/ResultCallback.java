/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

/**
 * Receives the outcome of an asynchronous operation. Exactly one of
 * {@code result} and {@code error} is non-null, and the callback is invoked
 * exactly once per operation.
 * <p>
 * Callbacks are invoked on a driver or server thread and should not block.
 *
 * @param <T> the type of the result
 */
@FunctionalInterface
public interface ResultCallback<T> {

    /**
     * Called when the operation completes.
     *
     * @param result the result, or null if the operation failed
     * @param error the failure, or null if the operation succeeded
     */
    void onResult(T result, Throwable error);
}
