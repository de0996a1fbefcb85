/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import static com.docstore.driver.ops.Aspect.EXECUTE_WITH_SELECTION;
import static com.docstore.driver.ops.Aspect.RETRYABLE;
import static com.docstore.driver.ops.Aspect.WRITE_OPERATION;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.junit.Test;

public class AspectRegistryTest {

    @Test
    public void testDeclaredAspects() {
        Set<Aspect> all = EnumSet.of(RETRYABLE, WRITE_OPERATION,
                                     EXECUTE_WITH_SELECTION);
        Set<Aspect> writeOnly = EnumSet.of(WRITE_OPERATION,
                                           EXECUTE_WITH_SELECTION);

        assertEquals(all, AspectRegistry.aspectsOf(UpdateOperation.class));
        assertEquals(all, AspectRegistry.aspectsOf(UpdateOneOperation.class));
        assertEquals(all, AspectRegistry.aspectsOf(DeleteOperation.class));
        assertEquals(all, AspectRegistry.aspectsOf(DeleteOneOperation.class));
        assertEquals(writeOnly,
                     AspectRegistry.aspectsOf(UpdateManyOperation.class));
        assertEquals(writeOnly,
                     AspectRegistry.aspectsOf(DeleteManyOperation.class));
        assertEquals(EnumSet.of(EXECUTE_WITH_SELECTION),
                     AspectRegistry.aspectsOf(
                         SetProfilingLevelOperation.class));
        assertEquals(EnumSet.of(EXECUTE_WITH_SELECTION),
                     AspectRegistry.aspectsOf(
                         ValidateCollectionOperation.class));
    }

    @Test
    public void testUnregisteredType() {
        assertTrue(AspectRegistry.aspectsOf(String.class).isEmpty());
        assertFalse(AspectRegistry.hasAspect(CommandOperation.class,
                                             RETRYABLE));
    }

    @Test
    public void testTableIsFrozen() {
        assertThrows(UnsupportedOperationException.class,
                     () -> AspectRegistry.table().put(String.class,
                                                      EnumSet.of(RETRYABLE)));
        assertThrows(UnsupportedOperationException.class,
                     () -> AspectRegistry.aspectsOf(UpdateManyOperation.class)
                         .add(RETRYABLE));
        assertFalse(AspectRegistry.hasAspect(UpdateManyOperation.class,
                                             RETRYABLE));
    }

    @Test
    public void testDuplicateDefinition() {
        Map<Class<?>, Set<Aspect>> table = new HashMap<>();
        AspectRegistry.define(table, UpdateOperation.class, RETRYABLE);
        assertThrows(IllegalStateException.class,
                     () -> AspectRegistry.define(table, UpdateOperation.class,
                                                 WRITE_OPERATION));
        assertEquals(EnumSet.of(RETRYABLE), table.get(UpdateOperation.class));
    }
}
