/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

import java.util.List;

import com.docstore.driver.ResultCallback;
import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.DeleteStatement;
import com.docstore.driver.ops.UpdateStatement;

import org.bson.Document;

/**
 * A selected server, as seen by operations. Implementations own the wire
 * protocol, connection checkout and socket I/O; none of that is visible
 * here.
 * <p>
 * Every method completes asynchronously by invoking the callback exactly
 * once with either the raw reply document or an exception. Transport
 * failures are reported as {@link com.docstore.driver.NetworkException} so
 * that they can be classified as retryable.
 */
public interface Server {

    /**
     * Sends an update command with the given statements.
     *
     * @param namespace the target namespace, "db.collection"
     * @param statements the update statements, in order
     * @param options the options for the command
     * @param callback receives the raw reply
     */
    void update(String namespace,
                List<UpdateStatement> statements,
                CommandOptions options,
                ResultCallback<Document> callback);

    /**
     * Sends a delete command with the given statements.
     *
     * @param namespace the target namespace, "db.collection"
     * @param statements the delete statements, in order
     * @param options the options for the command
     * @param callback receives the raw reply
     */
    void remove(String namespace,
                List<DeleteStatement> statements,
                CommandOptions options,
                ResultCallback<Document> callback);

    /**
     * Runs a command against a database.
     *
     * @param database the database name
     * @param command the command document
     * @param options the options for the command
     * @param callback receives the raw reply
     */
    void command(String database,
                 Document command,
                 CommandOptions options,
                 ResultCallback<Document> callback);

    /**
     * @return the address of the server, used in log messages
     */
    String getAddress();

    /**
     * Returns whether this server accepts retried writes. When false, write
     * operations selected onto it are never retried.
     *
     * @return true if writes may be retried
     */
    default boolean supportsRetryableWrites() {
        return true;
    }
}
