/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.bson.Document;
import org.junit.Test;

public class WriteConcernTest {

    @Test
    public void testUnspecified() {
        assertFalse(WriteConcern.UNSPECIFIED.isSpecified());
        assertEquals(new Document(), WriteConcern.UNSPECIFIED.toDocument());
        assertFalse(WriteConcern.fromDocument(new Document()).isSpecified());
    }

    @Test
    public void testFalseAndZeroArePresent() {
        assertTrue(WriteConcern.UNSPECIFIED.withJournal(false).isSpecified());
        assertTrue(WriteConcern.UNSPECIFIED.withWTimeout(0).isSpecified());
        assertTrue(WriteConcern.UNSPECIFIED.withW(0).isSpecified());
        assertEquals(new Document("j", false),
                     WriteConcern.UNSPECIFIED.withJournal(false).toDocument());
    }

    @Test
    public void testFromDocument() {
        WriteConcern wc = WriteConcern.fromDocument(
            new Document("w", "majority").append("wtimeout", 100L)
                .append("j", true).append("fsync", false));
        assertEquals("majority", wc.getW());
        assertEquals(Integer.valueOf(100), wc.getWTimeout());
        assertEquals(Boolean.TRUE, wc.getJournal());
        assertEquals(Boolean.FALSE, wc.getFsync());
        assertEquals(new Document("w", "majority").append("wtimeout", 100)
                     .append("j", true).append("fsync", false),
                     wc.toDocument());

        assertEquals(WriteConcern.W1,
                     WriteConcern.fromDocument(new Document("w", 1.0)));
    }

    @Test
    public void testInvalidDocuments() {
        assertThrows(IllegalArgumentException.class,
                     () -> WriteConcern.fromDocument(
                         new Document("wTimeoutMS", 5)));
        assertThrows(IllegalArgumentException.class,
                     () -> WriteConcern.fromDocument(new Document("w", true)));
        assertThrows(IllegalArgumentException.class,
                     () -> WriteConcern.fromDocument(new Document("j", 1)));
    }

    @Test
    public void testWithersCopy() {
        WriteConcern base = WriteConcern.W1;
        WriteConcern journaled = base.withJournal(true);
        assertNull(base.getJournal());
        assertEquals(Integer.valueOf(1), journaled.getW());
        assertEquals(journaled, WriteConcern.W1.withJournal(true));
        assertEquals(journaled.hashCode(),
                     WriteConcern.W1.withJournal(true).hashCode());
    }
}
