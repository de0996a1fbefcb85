/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import java.util.concurrent.CompletableFuture;

import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.ListDatabasesOptions;
import com.docstore.driver.ops.UserOptions;
import com.docstore.driver.ops.ValidateOptions;

import org.bson.Document;

/**
 * AdminAsync runs administrative commands against the database it was
 * created for. Instances are created using {@link DriverFactory}.
 * <p>
 * Every method is available in two forms. The first returns a
 * {@link CompletableFuture}; the second passes the outcome to a
 * {@link ResultCallback} and returns nothing. For the same outcome both
 * forms report the same value or the same exception instance. Futures are
 * completed, and callbacks called, on a driver or server thread and never
 * before the method has returned.
 * <p>
 * A reply whose ok field is not 1 is reported as a
 * {@link CommandFailedException}. Commands issued through this interface
 * are not retried, except where noted.
 * <p>
 * Argument errors, such as a null command, are thrown directly by the
 * method and are not reported through the future or callback.
 * <p>
 * An instance holds a thread pool. The {@link #close} method must be
 * invoked when the application is done with it.
 */
public interface AdminAsync extends AutoCloseable {

    /**
     * Runs a command against the admin database.
     *
     * @param command the command
     * @param options the options, may be null
     *
     * @return the future reply
     */
    CompletableFuture<Document> command(Document command,
                                        CommandOptions options);

    /**
     * Callback form of {@link #command(Document, CommandOptions)}.
     *
     * @param command the command
     * @param options the options, may be null
     * @param callback the callback
     */
    void command(Document command,
                 CommandOptions options,
                 ResultCallback<Document> callback);

    /**
     * Returns the build information of the server, the reply to
     * <code>{buildinfo: 1}</code>.
     *
     * @return the future reply
     */
    CompletableFuture<Document> buildInfo();

    void buildInfo(ResultCallback<Document> callback);

    /**
     * Same as {@link #buildInfo()}.
     *
     * @return the future reply
     */
    CompletableFuture<Document> serverInfo();

    void serverInfo(ResultCallback<Document> callback);

    /**
     * Returns the reply to <code>{serverStatus: 1}</code>.
     *
     * @return the future reply
     */
    CompletableFuture<Document> serverStatus();

    void serverStatus(ResultCallback<Document> callback);

    /**
     * Sends <code>{ping: 1}</code>.
     *
     * @return the future reply
     */
    CompletableFuture<Document> ping();

    void ping(ResultCallback<Document> callback);

    /**
     * Lists the databases of the server.
     *
     * @param options the options, may be null
     *
     * @return the future reply
     */
    CompletableFuture<Document> listDatabases(ListDatabasesOptions options);

    void listDatabases(ListDatabasesOptions options,
                       ResultCallback<Document> callback);

    /**
     * Returns the replica set status, the reply to
     * <code>{replSetGetStatus: 1}</code>.
     *
     * @return the future reply
     */
    CompletableFuture<Document> replSetGetStatus();

    void replSetGetStatus(ResultCallback<Document> callback);

    /**
     * Adds a user to the admin database. The write concern of the
     * database applies unless the options give one.
     *
     * @param username the user name
     * @param password the password
     * @param options the options, may be null; dbName is always "admin"
     *
     * @return the future reply
     */
    CompletableFuture<Document> addUser(String username,
                                        String password,
                                        UserOptions options);

    void addUser(String username,
                 String password,
                 UserOptions options,
                 ResultCallback<Document> callback);

    /**
     * Removes a user from the admin database. The write concern of the
     * database applies unless the options give one.
     *
     * @param username the user name
     * @param options the options, may be null; dbName is always "admin"
     *
     * @return the future reply
     */
    CompletableFuture<Document> removeUser(String username,
                                           UserOptions options);

    void removeUser(String username,
                    UserOptions options,
                    ResultCallback<Document> callback);

    /**
     * Validates a collection. The future fails with a
     * {@link CommandFailedException} if the command itself fails, and with
     * a {@link CollectionValidationException} if the reply reports the
     * collection as invalid or carries unexpected validation data.
     *
     * @param collectionName the collection
     * @param options the options, may be null
     *
     * @return the future reply
     */
    CompletableFuture<Document> validateCollection(String collectionName,
                                                   ValidateOptions options);

    void validateCollection(String collectionName,
                            ValidateOptions options,
                            ResultCallback<Document> callback);

    /**
     * Sets the profiling level of the database: "off", "slow_only" or
     * "all". The future completes with the level that was passed in. An
     * unknown level fails the future with an IllegalArgumentException
     * without sending a command.
     *
     * @param level the level
     *
     * @return the future level
     */
    CompletableFuture<String> setProfilingLevel(String level);

    void setProfilingLevel(String level, ResultCallback<String> callback);

    /**
     * Releases the resources of this instance. Using it afterwards throws
     * IllegalStateException.
     */
    @Override
    void close();
}
