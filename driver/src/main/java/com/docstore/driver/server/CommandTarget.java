/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.server;

/**
 * The database or collection a command operation is bound to.
 */
public interface CommandTarget extends WriteConcernSource {

    /**
     * @return the name of the database commands are run against
     */
    String getDatabaseName();
}
