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

import org.bson.Document;

/**
 * Removes at most one document of a collection. Retryable. A null filter
 * matches any document.
 */
public class DeleteOneOperation extends CommandOperation<DeleteResult> {

    private final CollectionHandle collection;
    private final Document filter;
    private final DeleteOptions options;

    /**
     * @param collection the collection
     * @param filter the selection filter, null for any document
     * @param options the options, copied, may be null; single is ignored
     */
    public DeleteOneOperation(CollectionHandle collection,
                              Document filter,
                              DeleteOptions options) {
        super(collection, ownOptions(options));
        this.collection = collection;
        this.filter = filter == null ? new Document() : filter;
        this.options = (DeleteOptions) getOptions();
    }

    private static DeleteOptions ownOptions(DeleteOptions options) {
        DeleteOptions copy =
            options == null ? new DeleteOptions() : options.copy();
        return copy.setSingle(true);
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
