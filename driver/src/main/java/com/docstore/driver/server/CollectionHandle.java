/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

/**
 * A collection, as seen by operations.
 */
public interface CollectionHandle extends CommandTarget {

    /**
     * @return the collection name
     */
    String getName();

    /**
     * @return the namespace, "db.collection"
     */
    default String getNamespace() {
        return getDatabaseName() + "." + getName();
    }
}
