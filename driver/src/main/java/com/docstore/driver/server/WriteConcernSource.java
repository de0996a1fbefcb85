/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

import com.docstore.driver.WriteConcern;

/**
 * Something that carries a default write concern, such as a database or a
 * collection.
 */
public interface WriteConcernSource {

    /**
     * @return the default write concern, or null if there is none
     */
    WriteConcern getWriteConcern();
}
