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

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * The table of aspects per operation type. The table is built once when the
 * class is initialized and cannot be changed afterwards. A type that is not
 * in the table has no aspects.
 */
public final class AspectRegistry {

    private static final Map<Class<?>, Set<Aspect>> ASPECTS;

    static {
        Map<Class<?>, Set<Aspect>> table = new HashMap<>();

        define(table, UpdateOperation.class,
               RETRYABLE, WRITE_OPERATION, EXECUTE_WITH_SELECTION);
        define(table, UpdateOneOperation.class,
               RETRYABLE, WRITE_OPERATION, EXECUTE_WITH_SELECTION);
        define(table, UpdateManyOperation.class,
               WRITE_OPERATION, EXECUTE_WITH_SELECTION);

        define(table, DeleteOperation.class,
               RETRYABLE, WRITE_OPERATION, EXECUTE_WITH_SELECTION);
        define(table, DeleteOneOperation.class,
               RETRYABLE, WRITE_OPERATION, EXECUTE_WITH_SELECTION);
        define(table, DeleteManyOperation.class,
               WRITE_OPERATION, EXECUTE_WITH_SELECTION);

        define(table, SetProfilingLevelOperation.class,
               EXECUTE_WITH_SELECTION);
        define(table, ValidateCollectionOperation.class,
               EXECUTE_WITH_SELECTION);

        ASPECTS = Collections.unmodifiableMap(table);
    }

    private AspectRegistry() {}

    /**
     * Adds a type to the table.
     *
     * @throws IllegalStateException if the type is already defined
     */
    static void define(Map<Class<?>, Set<Aspect>> table,
                       Class<?> type,
                       Aspect... aspects) {
        if (table.containsKey(type)) {
            throw new IllegalStateException(
                "Aspects already defined for " + type.getName());
        }
        Set<Aspect> set = EnumSet.noneOf(Aspect.class);
        Collections.addAll(set, aspects);
        table.put(type, Collections.unmodifiableSet(set));
    }

    /**
     * Returns the aspects of a type.
     *
     * @param type the operation type
     *
     * @return an unmodifiable set, empty if the type is not registered
     */
    public static Set<Aspect> aspectsOf(Class<?> type) {
        Set<Aspect> set = ASPECTS.get(type);
        return set == null ? Collections.<Aspect>emptySet() : set;
    }

    /**
     * Returns true if the type declares the aspect.
     *
     * @param type the operation type
     * @param aspect the aspect
     *
     * @return true if declared
     */
    public static boolean hasAspect(Class<?> type, Aspect aspect) {
        return aspectsOf(type).contains(aspect);
    }

    /**
     * @return an unmodifiable view of the whole table
     */
    public static Map<Class<?>, Set<Aspect>> table() {
        return ASPECTS;
    }
}
