/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

import java.util.concurrent.CompletableFuture;

import com.docstore.driver.ReadPreference;

/**
 * Chooses the server an operation runs on. Topology monitoring, failover
 * and selection timeouts are the selector's responsibility.
 */
@FunctionalInterface
public interface ServerSelector {

    /**
     * Selects a server suitable for the read preference. The future fails
     * if no suitable server is found.
     *
     * @param readPreference the read preference, PRIMARY for writes
     *
     * @return the future server
     */
    CompletableFuture<Server> selectServer(ReadPreference readPreference);
}
