/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import org.bson.Document;

/**
 * Thrown by {@link AdminAsync#validateCollection} when the server
 * accepted the validate command but its reply shows the collection, or the
 * validation data itself, to be invalid.
 */
public class CollectionValidationException extends DocStoreException {

    private static final long serialVersionUID = 1L;

    private final String collectionName;
    private final transient Document response;

    /**
     * @hidden
     * @param msg the message
     * @param collectionName the validated collection
     * @param response the validate reply
     */
    public CollectionValidationException(String msg,
                                         String collectionName,
                                         Document response) {
        super(msg);
        this.collectionName = collectionName;
        this.response = response;
    }

    /**
     * @return the name of the collection that failed validation
     */
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * @return the validate reply
     */
    public Document getResponse() {
        return response;
    }
}
