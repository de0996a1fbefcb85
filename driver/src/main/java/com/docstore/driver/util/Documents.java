/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.util;

import org.bson.Document;

/**
 * @hidden
 * Helpers for inspecting command and response documents.
 */
public final class Documents {

    private Documents() {}

    /**
     * Returns true if the document carries an {@code ok} field. A response
     * without one is not a command reply and is never treated as a failure.
     */
    public static boolean hasOk(Document doc) {
        return doc != null && doc.containsKey("ok");
    }

    /**
     * Returns true if the {@code ok} field is numerically 1 (1, 1L, 1.0) or
     * boolean true.
     */
    public static boolean isOk(Document doc) {
        return okEquals(doc, 1);
    }

    /**
     * Returns true if the {@code ok} field is numerically 0 or boolean false.
     */
    public static boolean isNotOk(Document doc) {
        return okEquals(doc, 0);
    }

    private static boolean okEquals(Document doc, int expected) {
        if (doc == null) {
            return false;
        }
        Object ok = doc.get("ok");
        if (ok instanceof Number) {
            return ((Number) ok).doubleValue() == expected;
        }
        if (ok instanceof Boolean) {
            return ((Boolean) ok) == (expected == 1);
        }
        return false;
    }

    /**
     * Returns true if any top level key of the update document is an update
     * operator, i.e. starts with '$'.
     */
    public static boolean hasAtomicOperators(Document update) {
        if (update == null) {
            return false;
        }
        for (String key : update.keySet()) {
            if (key.startsWith("$")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads a numeric field as an int, 0 if missing or not a number.
     */
    public static int getInt(Document doc, String field) {
        Object value = doc.get(field);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return 0;
    }
}
