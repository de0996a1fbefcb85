/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.docstore.driver.DriverTestBase;

import org.bson.Document;
import org.junit.Test;

/**
 * Tests the write retry checks of the update and delete operations.
 */
public class RetryEligibilityTest extends DriverTestBase {

    private static final String NS = "test.coll";
    private static final Document FILTER = new Document("a", 1);
    private static final Document UPDATE =
        new Document("$set", new Document("b", 2));

    private static UpdateStatement update(Boolean multi) {
        return new UpdateStatement(FILTER, UPDATE, multi, false, null);
    }

    private static DeleteStatement delete(Integer limit) {
        return new DeleteStatement(FILTER, limit, null);
    }

    private static UpdateOperation updates(UpdateStatement... stmts) {
        return new UpdateOperation(NS, Arrays.asList(stmts), null);
    }

    private static DeleteOperation deletes(DeleteStatement... stmts) {
        return new DeleteOperation(NS, Arrays.asList(stmts), null);
    }

    @Test
    public void testUpdateCanRetryWrite() {
        assertTrue(updates(update(false)).canRetryWrite());
        assertFalse(updates(update(true)).canRetryWrite());
        assertTrue(updates(update(null), update(false)).canRetryWrite());
        assertFalse(updates(update(null), update(true)).canRetryWrite());
        assertTrue(updates().canRetryWrite());
    }

    @Test
    public void testDeleteCanRetryWrite() {
        assertTrue(deletes(delete(1)).canRetryWrite());
        assertFalse(deletes(delete(0)).canRetryWrite());
        assertTrue(deletes(delete(null)).canRetryWrite());
        assertFalse(deletes(delete(1), delete(0)).canRetryWrite());
        assertTrue(deletes().canRetryWrite());
    }

    @Test
    public void testShouldRetry() {
        assertTrue(updates(update(false)).shouldRetry());
        assertFalse(updates(update(true)).shouldRetry());
        assertTrue(deletes(delete(1)).shouldRetry());
        assertFalse(deletes(delete(0)).shouldRetry());

        FakeCollection coll = new FakeCollection("test", "coll");
        assertTrue(new UpdateOneOperation(coll, FILTER, UPDATE, null)
                   .shouldRetry());
        assertTrue(new DeleteOneOperation(coll, FILTER, null).shouldRetry());

        /* the many variants lack RETRYABLE, whatever canRetryWrite says */
        UpdateManyOperation updateMany =
            new UpdateManyOperation(coll, FILTER, UPDATE, null);
        assertTrue(updateMany.canRetryWrite());
        assertFalse(updateMany.shouldRetry());
        assertFalse(new DeleteManyOperation(coll, FILTER, null)
                    .shouldRetry());
        assertFalse(new DeleteManyOperation(
                        coll, FILTER, new DeleteOptions().setSingle(true))
                    .shouldRetry());

        assertFalse(new SetProfilingLevelOperation(
                        new FakeDatabase("test"), "all", null).shouldRetry());
    }

    @Test
    public void testStatementsAreCopied() {
        List<UpdateStatement> stmts =
            new ArrayList<>(Collections.singletonList(update(false)));
        UpdateOperation op = new UpdateOperation(NS, stmts, null);
        stmts.add(update(true));
        assertTrue(op.canRetryWrite());
        assertEquals(1, op.getStatements().size());
    }
}
