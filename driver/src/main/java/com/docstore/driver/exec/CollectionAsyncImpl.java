/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import static com.docstore.driver.util.CheckNull.requireNonNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.docstore.driver.CollectionAsync;
import com.docstore.driver.DriverConfig;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.ops.DeleteManyOperation;
import com.docstore.driver.ops.DeleteOneOperation;
import com.docstore.driver.ops.DeleteOperation;
import com.docstore.driver.ops.DeleteOptions;
import com.docstore.driver.ops.DeleteResult;
import com.docstore.driver.ops.DeleteStatement;
import com.docstore.driver.ops.Operation;
import com.docstore.driver.ops.UpdateManyOperation;
import com.docstore.driver.ops.UpdateOneOperation;
import com.docstore.driver.ops.UpdateOperation;
import com.docstore.driver.ops.UpdateOptions;
import com.docstore.driver.ops.UpdateResult;
import com.docstore.driver.ops.UpdateStatement;
import com.docstore.driver.ops.WriteConcernResolver;
import com.docstore.driver.server.CollectionHandle;
import com.docstore.driver.server.ServerSelector;

import org.bson.Document;

/**
 * The methods in this class build an operation and hand it to the
 * executor. Argument checks are done by the operation constructors.
 */
public class CollectionAsyncImpl extends AsyncFacadeBase
    implements CollectionAsync {

    private final CollectionHandle collection;

    public CollectionAsyncImpl(DriverConfig config,
                               ServerSelector selector,
                               CollectionHandle collection) {
        super(config, selector);
        this.collection = requireNonNull(collection,
                                         "collection must be non-null");
    }

    @Override
    public String getNamespace() {
        return collection.getNamespace();
    }

    @Override
    public CompletableFuture<UpdateResult> updateOne(Document filter,
                                                     Document update,
                                                     UpdateOptions options) {
        return executeAsync(
            new UpdateOneOperation(collection, filter, update, options));
    }

    @Override
    public void updateOne(Document filter,
                          Document update,
                          UpdateOptions options,
                          ResultCallback<UpdateResult> callback) {
        executeAsync(
            new UpdateOneOperation(collection, filter, update, options),
            callback);
    }

    @Override
    public CompletableFuture<UpdateResult> updateMany(Document filter,
                                                      Document update,
                                                      UpdateOptions options) {
        return executeAsync(
            new UpdateManyOperation(collection, filter, update, options));
    }

    @Override
    public void updateMany(Document filter,
                           Document update,
                           UpdateOptions options,
                           ResultCallback<UpdateResult> callback) {
        executeAsync(
            new UpdateManyOperation(collection, filter, update, options),
            callback);
    }

    @Override
    public CompletableFuture<DeleteResult> deleteOne(Document filter,
                                                     DeleteOptions options) {
        return executeAsync(
            new DeleteOneOperation(collection, filter, options));
    }

    @Override
    public void deleteOne(Document filter,
                          DeleteOptions options,
                          ResultCallback<DeleteResult> callback) {
        executeAsync(new DeleteOneOperation(collection, filter, options),
                     callback);
    }

    @Override
    public CompletableFuture<DeleteResult> deleteMany(Document filter,
                                                      DeleteOptions options) {
        return executeAsync(
            new DeleteManyOperation(collection, filter, options));
    }

    @Override
    public void deleteMany(Document filter,
                           DeleteOptions options,
                           ResultCallback<DeleteResult> callback) {
        executeAsync(new DeleteManyOperation(collection, filter, options),
                     callback);
    }

    @Override
    public CompletableFuture<Document> bulkUpdate(
        List<UpdateStatement> statements,
        UpdateOptions options) {
        return executeAsync(bulkUpdateOperation(statements, options));
    }

    @Override
    public void bulkUpdate(List<UpdateStatement> statements,
                           UpdateOptions options,
                           ResultCallback<Document> callback) {
        executeAsync(bulkUpdateOperation(statements, options), callback);
    }

    private UpdateOperation bulkUpdateOperation(
        List<UpdateStatement> statements,
        UpdateOptions options) {
        UpdateOptions resolved = WriteConcernResolver.resolve(
            options == null ? new UpdateOptions() : options, collection);
        return new UpdateOperation(collection.getNamespace(), statements,
                                   resolved);
    }

    @Override
    public CompletableFuture<Document> bulkDelete(
        List<DeleteStatement> statements,
        DeleteOptions options) {
        return executeAsync(bulkDeleteOperation(statements, options));
    }

    @Override
    public void bulkDelete(List<DeleteStatement> statements,
                           DeleteOptions options,
                           ResultCallback<Document> callback) {
        executeAsync(bulkDeleteOperation(statements, options), callback);
    }

    private DeleteOperation bulkDeleteOperation(
        List<DeleteStatement> statements,
        DeleteOptions options) {
        DeleteOptions resolved = WriteConcernResolver.resolve(
            options == null ? new DeleteOptions() : options, collection);
        return new DeleteOperation(collection.getNamespace(), statements,
                                   resolved);
    }

    <T> CompletableFuture<T> executeAsync(Operation<T> operation) {
        checkClient();
        return executor.execute(operation);
    }

    <T> void executeAsync(Operation<T> operation,
                          ResultCallback<T> callback) {
        checkClient();
        executor.execute(operation, callback);
    }
}
