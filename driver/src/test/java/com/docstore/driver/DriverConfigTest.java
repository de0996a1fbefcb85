/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.logging.Logger;

import com.docstore.driver.exec.AdminAsyncImpl;

import org.junit.Test;

public class DriverConfigTest extends DriverTestBase {

    @Test
    public void testDefaults() {
        DriverConfig config = new DriverConfig();
        assertEquals(0, config.getRequestTimeout());
        assertEquals(5000, config.getDefaultRequestTimeout());
        assertEquals(0, config.getNumThreads());
        assertNull(config.getRetryHandler());
        assertTrue(config.getRetryWrites());
        assertTrue(config.getRetryReads());
        assertNull(config.getLogger());
    }

    @Test
    public void testSetters() {
        DriverConfig config = new DriverConfig().setRequestTimeout(750)
            .setNumThreads(3).setRetryWrites(false).setRetryReads(false);
        assertEquals(750, config.getDefaultRequestTimeout());
        assertEquals(3, config.getNumThreads());
        assertFalse(config.getRetryWrites());
        assertFalse(config.getRetryReads());

        assertThrows(IllegalArgumentException.class,
                     () -> config.setRequestTimeout(-1));
        assertThrows(NullPointerException.class,
                     () -> config.setRetryHandler(null));
    }

    @Test
    public void testClone() {
        Logger logger = Logger.getLogger("clone-test");
        DriverConfig config = new DriverConfig().setRequestTimeout(100)
            .setLogger(logger);
        DriverConfig clone = config.clone();
        clone.setRequestTimeout(200);
        assertEquals(100, config.getRequestTimeout());
        assertSame(logger, clone.getLogger());
    }

    @Test
    public void testFactoryInstallsDefaultHandler() {
        DriverConfig config = new DriverConfig();
        AdminAsync admin = DriverFactory.createAdminAsync(
            config, new FakeSelector(new FakeServer()),
            new FakeDatabase("test"));
        try {
            /* the caller's config is not modified */
            assertNull(config.getRetryHandler());
            assertTrue(admin instanceof AdminAsyncImpl);
            assertNotNull(((AdminAsyncImpl) admin).getExecutor());
        } finally {
            admin.close();
        }
        assertThrows(NullPointerException.class,
                     () -> DriverFactory.createAdminAsync(
                         null, new FakeSelector(new FakeServer()),
                         new FakeDatabase("test")));
    }

    @Test
    public void testConfiguredHandlerKept() {
        DriverConfig config = testConfig();
        RetryHandler handler = config.getRetryHandler();
        assertEquals(1, handler.getNumRetries());
        CollectionAsync coll = DriverFactory.createCollectionAsync(
            config, new FakeSelector(new FakeServer()),
            new FakeCollection("test", "coll"));
        coll.close();
        assertSame(handler, config.getRetryHandler());
    }
}
