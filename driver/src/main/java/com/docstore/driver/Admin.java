/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.ListDatabasesOptions;
import com.docstore.driver.ops.UserOptions;
import com.docstore.driver.ops.ValidateOptions;

import org.bson.Document;

/**
 * The blocking form of {@link AdminAsync}. Each method waits for the
 * outcome and either returns the result or throws the exception that
 * {@link AdminAsync} would have reported.
 */
public interface Admin extends AutoCloseable {

    Document command(Document command, CommandOptions options);

    Document buildInfo();

    Document serverInfo();

    Document serverStatus();

    Document ping();

    Document listDatabases(ListDatabasesOptions options);

    Document replSetGetStatus();

    Document addUser(String username, String password, UserOptions options);

    Document removeUser(String username, UserOptions options);

    /**
     * @param collectionName the collection
     * @param options the options, may be null
     *
     * @return the validate reply
     *
     * @throws CollectionValidationException if the collection is invalid
     */
    Document validateCollection(String collectionName,
                                ValidateOptions options);

    /**
     * @param level "off", "slow_only" or "all"
     *
     * @return the level
     *
     * @throws IllegalArgumentException if the level is not recognized
     */
    String setProfilingLevel(String level);

    @Override
    void close();
}
