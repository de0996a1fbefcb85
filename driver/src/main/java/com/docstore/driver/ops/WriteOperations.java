/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.Collections;
import java.util.List;

import com.docstore.driver.CommandFailedException;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.CollectionHandle;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * Shared execution of the single statement update and delete operations.
 * Each builds one statement, resolves the write concern against the
 * collection, runs the matching bulk operation and converts the reply.
 */
final class WriteOperations {

    private WriteOperations() {}

    static void updateDocuments(Server server,
                                CollectionHandle collection,
                                Document filter,
                                Document update,
                                UpdateOptions options,
                                ResultCallback<UpdateResult> done) {
        UpdateOptions resolved =
            WriteConcernResolver.resolve(options, collection);
        UpdateStatement stmt = new UpdateStatement(
            filter, update, resolved.getMulti(),
            Boolean.TRUE.equals(resolved.getUpsert()), resolved.getHint());

        UpdateOperation op = new UpdateOperation(
            collection.getNamespace(), Collections.singletonList(stmt),
            resolved);
        op.execute(server, (response, err) -> {
            if (err != null) {
                done.onResult(null, err);
                return;
            }
            UpdateResult result;
            try {
                Document reply = checkReply(response);
                result = UpdateResult.fromResponse(reply);
            } catch (RuntimeException re) {
                done.onResult(null, re);
                return;
            }
            done.onResult(result, null);
        });
    }

    static void removeDocuments(Server server,
                                CollectionHandle collection,
                                Document filter,
                                DeleteOptions options,
                                ResultCallback<DeleteResult> done) {
        DeleteOptions resolved =
            WriteConcernResolver.resolve(options, collection);
        int limit = Boolean.TRUE.equals(resolved.getSingle()) ? 1 : 0;
        DeleteStatement stmt =
            new DeleteStatement(filter, limit, resolved.getHint());

        DeleteOperation op = new DeleteOperation(
            collection.getNamespace(), Collections.singletonList(stmt),
            resolved);
        op.execute(server, (response, err) -> {
            if (err != null) {
                done.onResult(null, err);
                return;
            }
            DeleteResult result;
            try {
                Document reply = checkReply(response);
                result = DeleteResult.fromResponse(reply);
            } catch (RuntimeException re) {
                done.onResult(null, re);
                return;
            }
            done.onResult(result, null);
        });
    }

    /**
     * Returns the reply to convert, or throws the error it carries. A
     * missing reply counts as {ok: 1}. A reply with an error code, an ok
     * of 0 or a non-empty writeErrors list is a failure; for write errors
     * the first one is reported.
     */
    static Document checkReply(Document response) {
        if (response == null) {
            return new Document("ok", 1);
        }
        if (response.containsKey("code") || Documents.isNotOk(response)) {
            throw CommandFailedException.fromResponse(response);
        }
        Object writeErrors = response.get("writeErrors");
        if (writeErrors instanceof List && !((List<?>) writeErrors).isEmpty()) {
            Object first = ((List<?>) writeErrors).get(0);
            if (first instanceof Document) {
                throw CommandFailedException.fromResponse((Document) first);
            }
            throw new CommandFailedException(String.valueOf(first));
        }
        return response;
    }
}
