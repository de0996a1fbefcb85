/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.util;

import java.util.concurrent.CompletionException;

public class ConcurrentUtil {

    /**
     * Returns the cause if the exception is a CompletionException, otherwise
     * returns the exception.
     */
    public static Throwable unwrapCompletionException(Throwable t) {
        Throwable actual = t;
        while (true) {
            if (!(actual instanceof CompletionException)
                    || (actual.getCause() == null)) {
                return actual;
            }
            actual = actual.getCause();
        }
    }
}
