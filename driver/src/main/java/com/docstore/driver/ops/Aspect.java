/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

/**
 * Capabilities declared by an operation type. The set of aspects for a type
 * is fixed and is looked up in {@link AspectRegistry}.
 */
public enum Aspect {

    /**
     * The operation may be re-issued after a transient failure. For write
     * operations the dynamic check {@link Operation#canRetryWrite} must
     * also pass.
     */
    RETRYABLE,

    /**
     * The operation modifies data. Write operations always go to the
     * primary and carry the resolved write concern.
     */
    WRITE_OPERATION,

    /**
     * The executor selects a server before invoking the operation.
     */
    EXECUTE_WITH_SELECTION
}
