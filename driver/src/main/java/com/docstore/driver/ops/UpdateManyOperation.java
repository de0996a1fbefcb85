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
import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * Updates every document of a collection that matches a filter. Not
 * retryable, as a repeated attempt could apply the update twice to
 * documents changed by the first attempt.
 */
public class UpdateManyOperation extends CommandOperation<UpdateResult> {

    private final CollectionHandle collection;
    private final Document filter;
    private final Document update;
    private final UpdateOptions options;

    /**
     * @param collection the collection
     * @param filter the selection filter
     * @param update the update document, which must use update operators
     * @param options the options, copied, may be null; multi is ignored
     *
     * @throws IllegalArgumentException if the filter is null or the update
     * has no update operator
     */
    public UpdateManyOperation(CollectionHandle collection,
                               Document filter,
                               Document update,
                               UpdateOptions options) {
        super(collection, ownOptions(options));
        this.collection = collection;
        this.filter = CheckNull.requireNonNullIAE(
            filter, "filter is a required parameter");
        if (!Documents.hasAtomicOperators(update)) {
            throw new IllegalArgumentException(
                "Update document requires atomic operators");
        }
        this.update = update;
        this.options = (UpdateOptions) getOptions();
    }

    private static UpdateOptions ownOptions(UpdateOptions options) {
        UpdateOptions copy =
            options == null ? new UpdateOptions() : options.copy();
        return copy.setMulti(true);
    }

    public Document getFilter() {
        return filter;
    }

    public Document getUpdate() {
        return update;
    }

    @Override
    public void execute(Server server, ResultCallback<UpdateResult> done) {
        WriteOperations.updateDocuments(server, collection, filter, update,
                                        options, done);
    }
}
