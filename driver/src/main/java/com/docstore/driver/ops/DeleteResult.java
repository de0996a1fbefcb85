/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * The result of a delete operation.
 */
public class DeleteResult extends Result {

    private final int deletedCount;
    private final Document response;

    DeleteResult(int deletedCount, Document response) {
        this.deletedCount = deletedCount;
        this.response = response;
    }

    /**
     * Builds a result from a delete command response, reading the deleted
     * count from n.
     *
     * @param response the server response
     *
     * @return the result
     */
    public static DeleteResult fromResponse(Document response) {
        return new DeleteResult(Documents.getInt(response, "n"), response);
    }

    /**
     * @return the number of documents removed
     */
    public int getDeletedCount() {
        return deletedCount;
    }

    /**
     * @return the raw server response
     */
    public Document getResponse() {
        return response;
    }

    @Override
    public String toString() {
        return "DeleteResult[deleted=" + deletedCount + "]";
    }
}
