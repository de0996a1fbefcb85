/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import com.docstore.driver.ResultCallback;

/**
 * One call into a collaborator that reports its outcome through a
 * callback, for example running a command on a database handle or one
 * attempt of an operation on a selected server.
 * <p>
 * The invocation must call {@code done} exactly once. A runtime exception
 * thrown by {@link #invoke} is treated as the outcome of the call.
 *
 * @param <T> the type of the result
 */
@FunctionalInterface
public interface Invocation<T> {

    void invoke(ResultCallback<T> done);
}
