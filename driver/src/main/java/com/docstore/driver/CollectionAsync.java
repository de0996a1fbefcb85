/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.docstore.driver.ops.DeleteOptions;
import com.docstore.driver.ops.DeleteResult;
import com.docstore.driver.ops.DeleteStatement;
import com.docstore.driver.ops.UpdateOptions;
import com.docstore.driver.ops.UpdateResult;
import com.docstore.driver.ops.UpdateStatement;

import org.bson.Document;

/**
 * CollectionAsync runs update and delete operations on one collection.
 * Instances are created using {@link DriverFactory}.
 * <p>
 * As with {@link AdminAsync}, each method comes in a future form and a
 * callback form that report identical outcomes.
 * <p>
 * Operations that touch at most one document, {@link #updateOne} and
 * {@link #deleteOne}, are retried once by default after a transient
 * failure such as a lost connection. {@link #updateMany} and
 * {@link #deleteMany} are never retried. A bulk operation is retried only
 * if none of its statements can affect more than one document.
 * <p>
 * The write concern of the collection applies unless the options give
 * one.
 */
public interface CollectionAsync extends AutoCloseable {

    /**
     * @return the namespace of the collection
     */
    String getNamespace();

    /**
     * Updates at most one document matching the filter.
     *
     * @param filter the filter
     * @param update the update, which must use update operators such as
     * {@code $set}
     * @param options the options, may be null
     *
     * @return the future result
     *
     * @throws IllegalArgumentException if the filter is null or the update
     * has no update operator
     */
    CompletableFuture<UpdateResult> updateOne(Document filter,
                                              Document update,
                                              UpdateOptions options);

    void updateOne(Document filter,
                   Document update,
                   UpdateOptions options,
                   ResultCallback<UpdateResult> callback);

    /**
     * Updates all documents matching the filter.
     *
     * @param filter the filter
     * @param update the update, which must use update operators
     * @param options the options, may be null
     *
     * @return the future result
     *
     * @throws IllegalArgumentException if the filter is null or the update
     * has no update operator
     */
    CompletableFuture<UpdateResult> updateMany(Document filter,
                                               Document update,
                                               UpdateOptions options);

    void updateMany(Document filter,
                    Document update,
                    UpdateOptions options,
                    ResultCallback<UpdateResult> callback);

    /**
     * Removes at most one document matching the filter.
     *
     * @param filter the filter, null matches any document
     * @param options the options, may be null
     *
     * @return the future result
     */
    CompletableFuture<DeleteResult> deleteOne(Document filter,
                                              DeleteOptions options);

    void deleteOne(Document filter,
                   DeleteOptions options,
                   ResultCallback<DeleteResult> callback);

    /**
     * Removes all documents matching the filter.
     *
     * @param filter the filter
     * @param options the options, may be null
     *
     * @return the future result
     *
     * @throws IllegalArgumentException if the filter is null
     */
    CompletableFuture<DeleteResult> deleteMany(Document filter,
                                               DeleteOptions options);

    void deleteMany(Document filter,
                    DeleteOptions options,
                    ResultCallback<DeleteResult> callback);

    /**
     * Sends a list of update statements as one command. The future
     * completes with the raw reply, which may contain write errors.
     *
     * @param statements the statements
     * @param options the options, may be null
     *
     * @return the future reply
     */
    CompletableFuture<Document> bulkUpdate(List<UpdateStatement> statements,
                                           UpdateOptions options);

    void bulkUpdate(List<UpdateStatement> statements,
                    UpdateOptions options,
                    ResultCallback<Document> callback);

    /**
     * Sends a list of delete statements as one command. The future
     * completes with the raw reply, which may contain write errors.
     *
     * @param statements the statements
     * @param options the options, may be null
     *
     * @return the future reply
     */
    CompletableFuture<Document> bulkDelete(List<DeleteStatement> statements,
                                           DeleteOptions options);

    void bulkDelete(List<DeleteStatement> statements,
                    DeleteOptions options,
                    ResultCallback<Document> callback);

    @Override
    void close();
}
