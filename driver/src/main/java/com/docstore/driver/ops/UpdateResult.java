/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.List;

import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * The result of an update operation.
 */
public class UpdateResult extends Result {

    private final int matchedCount;
    private final int modifiedCount;
    private final int upsertedCount;
    private final Object upsertedId;
    private final Document response;

    UpdateResult(int matchedCount,
                 int modifiedCount,
                 int upsertedCount,
                 Object upsertedId,
                 Document response) {
        this.matchedCount = matchedCount;
        this.modifiedCount = modifiedCount;
        this.upsertedCount = upsertedCount;
        this.upsertedId = upsertedId;
        this.response = response;
    }

    /**
     * Builds a result from an update command response. When a document was
     * upserted the matched count is 0. The modified count is taken from
     * nModified, falling back to n for servers that do not report it.
     *
     * @param response the server response
     *
     * @return the result
     */
    public static UpdateResult fromResponse(Document response) {
        int n = Documents.getInt(response, "n");
        Object nModified = response.get("nModified");
        int modified = nModified instanceof Number ?
            ((Number) nModified).intValue() : n;

        List<?> upserted = response.get("upserted", List.class);
        if (upserted != null && !upserted.isEmpty()) {
            Object first = upserted.get(0);
            Object id = first instanceof Document ?
                ((Document) first).get("_id") : first;
            return new UpdateResult(0, modified, upserted.size(), id,
                                    response);
        }
        return new UpdateResult(n, modified, 0, null, response);
    }

    /**
     * @return the number of documents that matched the filter
     */
    public int getMatchedCount() {
        return matchedCount;
    }

    /**
     * @return the number of documents modified
     */
    public int getModifiedCount() {
        return modifiedCount;
    }

    /**
     * @return the number of documents inserted by an upsert
     */
    public int getUpsertedCount() {
        return upsertedCount;
    }

    /**
     * @return the id of the first upserted document, or null
     */
    public Object getUpsertedId() {
        return upsertedId;
    }

    /**
     * @return the raw server response
     */
    public Document getResponse() {
        return response;
    }

    @Override
    public String toString() {
        return "UpdateResult[matched=" + matchedCount + ", modified=" +
            modifiedCount + ", upserted=" + upsertedCount +
            ", upsertedId=" + upsertedId + "]";
    }
}
