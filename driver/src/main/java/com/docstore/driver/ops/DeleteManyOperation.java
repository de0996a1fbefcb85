/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.CollectionHandle;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.CheckNull;

import org.bson.Document;

/**
 * Removes every document of a collection that matches a filter. Not
 * retryable.
 * <p>
 * If the options set single to true the command is sent with a limit of
 * 1, but the operation is still not retried.
 */
public class DeleteManyOperation extends CommandOperation<DeleteResult> {

    private final CollectionHandle collection;
    private final Document filter;
    private final DeleteOptions options;

    /**
     * @param collection the collection
     * @param filter the selection filter, required
     * @param options the options, copied, may be null
     *
     * @throws IllegalArgumentException if the filter is null
     */
    public DeleteManyOperation(CollectionHandle collection,
                               Document filter,
                               DeleteOptions options) {
        super(collection, ownOptions(options));
        this.collection = collection;
        this.filter = CheckNull.requireNonNullIAE(
            filter, "filter is a required parameter");
        this.options = (DeleteOptions) getOptions();
    }

    private static DeleteOptions ownOptions(DeleteOptions options) {
        DeleteOptions copy =
            options == null ? new DeleteOptions() : options.copy();
        if (copy.getSingle() == null) {
            copy.setSingle(false);
        }
        return copy;
    }

    public Document getFilter() {
        return filter;
    }

    @Override
    public void execute(Server server, ResultCallback<DeleteResult> done) {
        WriteOperations.removeDocuments(server, collection, filter,
                                        options, done);
    }
}
