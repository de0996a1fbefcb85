/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

/**
 * Result is a base class for the typed results of write operations.
 * All state other than retry statistics is maintained by extending classes.
 */
public class Result {

    /*
     * Copied over from the Operation when it succeeds.
     */
    private RetryStats retryStats;

    protected Result() {}

    /**
     * Returns the retry statistics of the operation that produced this
     * result, or null if the operation was not retried.
     *
     * @return the stats
     */
    public RetryStats getRetryStats() {
        return retryStats;
    }

    /**
     * @hidden
     * @param rs the stats object to use
     */
    public void setRetryStats(RetryStats rs) {
        retryStats = rs;
    }
}
