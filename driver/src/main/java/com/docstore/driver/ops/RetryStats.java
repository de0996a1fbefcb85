/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.HashMap;
import java.util.Map;

import com.docstore.driver.RetryHandler;

/**
 * A class that maintains stats on retries during an operation.
 *
 * This object tracks statistics about retries performed while executing an
 * operation. It can be accessed from within retry handlers
 * (see {@link RetryHandler}) or after an operation is finished by calling
 * {@link Operation#getRetryStats}.
 */
public class RetryStats {

    /* total number of retries of this operation */
    private int retries;

    /* amount of time, in millis, spent delaying in retry handling */
    private int delayMs;

    /* exception type --> number of such exceptions during this operation */
    private final Map<Class<? extends Throwable>, Integer> exceptionMap;

    /**
     * @hidden
     * Internal use only.
     */
    public RetryStats() {
        this.exceptionMap = new HashMap<Class<? extends Throwable>, Integer>();
    }

    /**
     * @hidden
     * Adds an exception class, incrementing the count for that class.
     * @param e the exception class
     */
    public void addException(Class<? extends Throwable> e) {
        exceptionMap.merge(e, 1, Integer::sum);
    }

    /**
     * @hidden
     * @param d number of milliseconds to add to the delay total
     */
    public void addDelayMs(int d) {
        delayMs += d;
    }

    /**
     * @hidden
     */
    public void incrementRetries() {
        retries++;
    }

    /**
     * Returns the number of exceptions of a particular class.
     * @param e the class of exception to query
     * @return the number of exceptions of this class, zero if none
     */
    public int getNumExceptions(Class<? extends Throwable> e) {
        Integer i = exceptionMap.get(e);
        return i == null ? 0 : i;
    }

    /**
     * Returns the total time delayed between retries.
     * @return time delayed during retries, in milliseconds
     */
    public int getDelayMs() {
        return delayMs;
    }

    /**
     * Returns the number of retries.
     * @return number of retries
     */
    public int getRetries() {
        return retries;
    }

    /**
     * @hidden
     * Clears the stats object.
     */
    public void clear() {
        delayMs = 0;
        retries = 0;
        exceptionMap.clear();
    }

    public Map<Class<? extends Throwable>, Integer> getExceptionMap() {
        return exceptionMap;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("retries=").append(retries)
            .append(" delayMs=").append(delayMs)
            .append(" exceptionMap=").append(exceptionMap);
        return sb.toString();
    }
}
