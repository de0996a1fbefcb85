/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.CompletionException;

import org.bson.Document;
import org.junit.Test;

public class DocumentsTest {

    @Test
    public void testOk() {
        assertTrue(Documents.isOk(new Document("ok", 1)));
        assertTrue(Documents.isOk(new Document("ok", 1L)));
        assertTrue(Documents.isOk(new Document("ok", 1.0)));
        assertTrue(Documents.isOk(new Document("ok", true)));
        assertFalse(Documents.isOk(new Document("ok", 0)));
        assertFalse(Documents.isOk(new Document("ok", "1")));
        assertFalse(Documents.isOk(new Document()));
        assertFalse(Documents.isOk(null));

        assertTrue(Documents.isNotOk(new Document("ok", 0.0)));
        assertTrue(Documents.isNotOk(new Document("ok", false)));
        assertFalse(Documents.isNotOk(new Document()));

        assertTrue(Documents.hasOk(new Document("ok", 0)));
        assertFalse(Documents.hasOk(new Document("n", 1)));
    }

    @Test
    public void testAtomicOperators() {
        assertTrue(Documents.hasAtomicOperators(
            new Document("$set", new Document("a", 1))));
        assertTrue(Documents.hasAtomicOperators(
            new Document("a", 1).append("$inc", new Document("b", 1))));
        assertFalse(Documents.hasAtomicOperators(new Document("a", 1)));
        assertFalse(Documents.hasAtomicOperators(new Document()));
        assertFalse(Documents.hasAtomicOperators(null));
    }

    @Test
    public void testGetInt() {
        assertEquals(3, Documents.getInt(new Document("n", 3L), "n"));
        assertEquals(0, Documents.getInt(new Document("n", "3"), "n"));
        assertEquals(0, Documents.getInt(new Document(), "n"));
    }

    @Test
    public void testUnwrap() {
        IllegalStateException ise = new IllegalStateException("x");
        assertSame(ise, ConcurrentUtil.unwrapCompletionException(
            new CompletionException(new CompletionException(ise))));
        assertSame(ise, ConcurrentUtil.unwrapCompletionException(ise));
    }
}
