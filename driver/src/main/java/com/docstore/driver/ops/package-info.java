/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * Contains the operation classes, their options and results. These
 * include classes derived from {@link com.docstore.driver.ops.Operation}
 * and {@link com.docstore.driver.ops.Result}.
 * <p>
 * Each operation type declares a fixed set of
 * {@link com.docstore.driver.ops.Aspect}s, listed in
 * {@link com.docstore.driver.ops.AspectRegistry}. The aspects, together
 * with {@link com.docstore.driver.ops.Operation#canRetryWrite} for bulk
 * writes, decide whether an operation may be retried.
 * <p>
 * Option instances are copied when an operation is constructed and can be
 * reused by the application. Operation instances are not thread-safe and
 * may be executed only once.
 */
package com.docstore.driver.ops;
