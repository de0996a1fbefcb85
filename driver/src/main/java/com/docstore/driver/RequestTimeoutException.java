/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

/**
 * Thrown when an operation cannot be retried within its timeout. The first
 * attempt of an operation is never timed out by the driver; the timeout only
 * bounds automatic retries.
 */
public class RequestTimeoutException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    private volatile int timeoutMs;

    /**
     * @hidden
     * Internal use only.
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message string for the timeout
     * @param cause the last failure observed before giving up
     */
    public RequestTimeoutException(int timeoutMs,
                                   String msg,
                                   Throwable cause) {
        super(msg, cause);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (timeoutMs != 0) {
            sb.append(" Timeout: ");
            sb.append(timeoutMs);
            sb.append("ms");
        }

        Throwable cause = getCause();
        if (cause != null) {
            sb.append("\nCaused by: ");
            sb.append(cause.getClass().getName());
            sb.append(": ");
            sb.append(cause.getMessage());
        }
        return sb.toString();
    }

    /**
     * Returns the timeout that was in effect for the operation.
     *
     * @return the timeout in milliseconds, 0 if not known
     */
    public int getTimeoutMs() {
        return timeoutMs;
    }
}
