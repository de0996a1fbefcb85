/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.docstore.driver.CollectionValidationException;
import com.docstore.driver.CommandFailedException;
import com.docstore.driver.DriverTestBase;

import org.bson.Document;
import org.junit.Test;

public class ValidateCollectionOperationTest extends DriverTestBase {

    private static RuntimeException check(Document response) {
        return ValidateCollectionOperation.checkResponse("coll", response);
    }

    @Test
    public void testValidReply() {
        assertNull(check(new Document("ok", 1).append("valid", true)));
        assertNull(check(new Document("ok", 1)
                         .append("result", "validate details: all good")));
    }

    @Test
    public void testNotOk() {
        RuntimeException e = check(new Document("ok", 0));
        assertTrue(e instanceof CommandFailedException);
        assertEquals("Error with validate command", e.getMessage());
    }

    @Test
    public void testResultNotAString() {
        RuntimeException e =
            check(new Document("ok", 1).append("result", 5));
        assertTrue(e instanceof CollectionValidationException);
        assertEquals("Error with validation data", e.getMessage());
    }

    @Test
    public void testResultMentionsException() {
        RuntimeException e = check(new Document("ok", 1)
                                   .append("result", "exception caught"));
        assertEquals("Error: invalid collection coll", e.getMessage());

        e = check(new Document("ok", 1)
                  .append("result", "data is corrupt"));
        assertTrue(e instanceof CollectionValidationException);
    }

    @Test
    public void testInvalidFlag() {
        Document reply = new Document("ok", 1).append("valid", false);
        CollectionValidationException e =
            (CollectionValidationException) check(reply);
        assertEquals("Error: invalid collection coll", e.getMessage());
        assertEquals("coll", e.getCollectionName());
        assertSame(reply, e.getResponse());
    }

    @Test
    public void testExecute() throws Exception {
        FakeServer server = new FakeServer();
        Document reply = new Document("ok", 1).append("valid", true);
        server.script.thenReply(reply);

        ValidateCollectionOperation op = new ValidateCollectionOperation(
            new FakeDatabase("test"), "coll",
            new ValidateOptions().setFull(true));
        RecordingCallback<Document> cb = new RecordingCallback<>();
        op.execute(server, cb);
        cb.await();

        assertSame(reply, cb.result);
        assertEquals(new Document("validate", "coll").append("full", true),
                     server.commands.get(0));
        assertEquals("test", server.commandDatabases.get(0));
    }

    @Test
    public void testExecuteInvalid() throws Exception {
        FakeServer server = new FakeServer();
        server.script.thenReply(new Document("ok", 1).append("valid", false));
        RecordingCallback<Document> cb = new RecordingCallback<>();
        new ValidateCollectionOperation(new FakeDatabase("test"), "coll", null)
            .execute(server, cb);
        cb.await();
        assertNull(cb.result);
        assertTrue(cb.error instanceof CollectionValidationException);
    }

    @Test
    public void testEmptyName() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ValidateCollectionOperation(
                         new FakeDatabase("test"), "", null));
    }
}
