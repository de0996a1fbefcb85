/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

/**
 * A base exception for all exceptions that may be retried with a reasonable
 * expectation that they may succeed on retry. Only transport level failures
 * reported by a server are retryable; a command that reached the server and
 * failed there is reported as {@link CommandFailedException} instead.
 */
public class RetryableException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     */
    protected RetryableException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     */
    protected RetryableException(String msg, Throwable cause) {
        super(msg, cause);
    }

    @Override
    public boolean okToRetry() {
        return true;
    }
}
