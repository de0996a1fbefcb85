/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import static com.docstore.driver.util.CheckNull.requireNonNull;

import com.docstore.driver.exec.AdminAsyncImpl;
import com.docstore.driver.exec.AdminImpl;
import com.docstore.driver.exec.CollectionAsyncImpl;
import com.docstore.driver.server.CollectionHandle;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.ServerSelector;

/**
 * Factory class used to produce the admin and collection facades. The
 * application must invoke {@code close} on each facade when it is done
 * with it to free the associated thread pool.
 */
public class DriverFactory {

    /**
     * Creates an asynchronous admin facade for a database.
     *
     * @param config the configuration parameters
     * @param selector selects the server for operations that need one
     * @param db the database
     *
     * @return the facade
     *
     * @throws IllegalArgumentException if an illegal configuration parameter
     * is specified.
     */
    public static AdminAsync createAdminAsync(DriverConfig config,
                                              ServerSelector selector,
                                              DatabaseHandle db) {
        return new AdminAsyncImpl(configCopy(config, "createAdminAsync"),
                                  selector, db);
    }

    /**
     * Creates a blocking admin facade for a database.
     *
     * @param config the configuration parameters
     * @param selector selects the server for operations that need one
     * @param db the database
     *
     * @return the facade
     */
    public static Admin createAdmin(DriverConfig config,
                                    ServerSelector selector,
                                    DatabaseHandle db) {
        return new AdminImpl(configCopy(config, "createAdmin"),
                             selector, db);
    }

    /**
     * Creates an asynchronous facade for updates and deletes on a
     * collection.
     *
     * @param config the configuration parameters
     * @param selector selects the server for each operation
     * @param collection the collection
     *
     * @return the facade
     */
    public static CollectionAsync createCollectionAsync(
        DriverConfig config,
        ServerSelector selector,
        CollectionHandle collection) {
        return new CollectionAsyncImpl(
            configCopy(config, "createCollectionAsync"),
            selector, collection);
    }

    private static DriverConfig configCopy(DriverConfig config,
                                           String method) {
        requireNonNull(
            config,
            "DriverFactory." + method + ": config cannot be null");
        DriverConfig configCopy = config.clone();
        if (configCopy.getRetryHandler() == null) {
            /*
             * Default retry handler: a single retry, default backoff
             */
            configCopy.configureDefaultRetryHandler(
                DriverConfig.DEFAULT_NUM_RETRIES, 0);
        }
        return configCopy;
    }
}
