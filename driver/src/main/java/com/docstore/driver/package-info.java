/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * Contains the public API of the driver core: the admin and collection
 * facades, configuration, the retry handler and the exception classes.
 * Facades are created by {@link com.docstore.driver.DriverFactory} from a
 * {@link com.docstore.driver.DriverConfig}.
 * <p>
 * Operation and option classes are in the
 * <a href="{@docRoot}/com/docstore/driver/ops/package-summary.html#package.description">
 * ops package.
 * </a>
 * The contracts of the server, database and collection collaborators that
 * the driver core calls into are in the
 * <a href="{@docRoot}/com/docstore/driver/server/package-summary.html#package.description">
 * server package.
 * </a>
 */
package com.docstore.driver;
