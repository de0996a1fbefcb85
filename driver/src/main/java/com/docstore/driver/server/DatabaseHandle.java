/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

import com.docstore.driver.ResultCallback;
import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.UserOptions;

import org.bson.Document;

/**
 * A database, as seen by the admin facade. The handle runs commands through
 * its own topology and reports raw replies; it does not interpret
 * {@code ok}.
 */
public interface DatabaseHandle extends CommandTarget {

    /**
     * Runs a command against the admin database.
     *
     * @param command the command document
     * @param options the options, never null
     * @param callback receives the raw reply
     */
    void executeDbAdminCommand(Document command,
                               CommandOptions options,
                               ResultCallback<Document> callback);

    /**
     * Creates a user.
     *
     * @param username the user name
     * @param password the password
     * @param options the options, including the resolved write concern and
     * the database the user is defined on
     * @param callback receives the raw reply
     */
    void addUser(String username,
                 String password,
                 UserOptions options,
                 ResultCallback<Document> callback);

    /**
     * Drops a user.
     *
     * @param username the user name
     * @param options the options, including the resolved write concern and
     * the database the user is defined on
     * @param callback receives the raw reply
     */
    void removeUser(String username,
                    UserOptions options,
                    ResultCallback<Document> callback);
}
