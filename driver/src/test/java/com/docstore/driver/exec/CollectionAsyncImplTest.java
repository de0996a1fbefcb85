/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import com.docstore.driver.CollectionAsync;
import com.docstore.driver.DriverFactory;
import com.docstore.driver.DriverTestBase;
import com.docstore.driver.NetworkException;
import com.docstore.driver.WriteConcern;
import com.docstore.driver.ops.DeleteOptions;
import com.docstore.driver.ops.DeleteResult;
import com.docstore.driver.ops.DeleteStatement;
import com.docstore.driver.ops.UpdateOptions;
import com.docstore.driver.ops.UpdateResult;
import com.docstore.driver.ops.UpdateStatement;

import org.bson.Document;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class CollectionAsyncImplTest extends DriverTestBase {

    private static final Document FILTER = new Document("a", 1);
    private static final Document UPDATE =
        new Document("$set", new Document("b", 2));

    private FakeServer server;
    private FakeCollection coll;
    private CollectionAsync collection;

    @Before
    public void setUp() {
        server = new FakeServer();
        coll = new FakeCollection("test", "coll");
        collection = DriverFactory.createCollectionAsync(
            testConfig(), new FakeSelector(server), coll);
    }

    @After
    public void tearDown() {
        collection.close();
    }

    @Test
    public void testNamespace() {
        assertEquals("test.coll", collection.getNamespace());
    }

    @Test
    public void testUpdateOneRetried() throws Throwable {
        server.script.thenError(new NetworkException("localhost:27017",
                                                     "reset"))
            .thenReply(new Document("ok", 1).append("n", 1)
                       .append("nModified", 1));
        UpdateResult result =
            await(collection.updateOne(FILTER, UPDATE, null));
        assertEquals(1, result.getModifiedCount());
        assertEquals(1, result.getRetryStats().getRetries());
        assertEquals(2, server.callCount());
    }

    @Test
    public void testUpdateMany() throws Throwable {
        server.script.thenReply(new Document("ok", 1).append("n", 4)
                                .append("nModified", 3));
        RecordingCallback<UpdateResult> cb = new RecordingCallback<>();
        collection.updateMany(FILTER, UPDATE,
                              new UpdateOptions().setUpsert(true), cb);
        cb.await();
        assertEquals(4, cb.result.getMatchedCount());
        assertEquals(3, cb.result.getModifiedCount());
        UpdateStatement stmt = server.updates.get(0).get(0);
        assertTrue(stmt.isMulti());
        assertTrue(stmt.isUpsert());
    }

    @Test
    public void testDeletes() throws Throwable {
        DeleteResult one = await(collection.deleteOne(FILTER, null));
        assertEquals(1, one.getDeletedCount());

        server.script.thenReply(new Document("ok", 1).append("n", 5));
        DeleteResult many = await(collection.deleteMany(FILTER, null));
        assertEquals(5, many.getDeletedCount());

        assertEquals(Integer.valueOf(1),
                     server.deletes.get(0).get(0).getLimit());
        assertEquals(Integer.valueOf(0),
                     server.deletes.get(1).get(0).getLimit());
    }

    @Test
    public void testValidationFailsFast() {
        assertThrows(IllegalArgumentException.class,
                     () -> collection.updateOne(null, UPDATE, null));
        assertThrows(IllegalArgumentException.class,
                     () -> collection.updateMany(FILTER,
                                                 new Document("b", 1), null));
        assertThrows(IllegalArgumentException.class,
                     () -> collection.deleteMany(null, null));
        assertEquals(0, server.callCount());
    }

    @Test
    public void testBulkUpdate() throws Throwable {
        coll.setWriteConcern(WriteConcern.MAJORITY);
        Document reply = await(collection.bulkUpdate(Arrays.asList(
            new UpdateStatement(FILTER, UPDATE),
            new UpdateStatement(new Document("c", 1), UPDATE, true, false,
                                null)), null));
        assertEquals(Integer.valueOf(1), reply.get("n"));
        assertEquals("test.coll", server.namespaces.get(0));
        assertEquals(2, server.updates.get(0).size());
        assertEquals(WriteConcern.MAJORITY,
                     server.options.get(0).getWriteConcern());
    }

    @Test
    public void testBulkUpdateWithMultiNotRetried() throws Exception {
        server.script.thenError(new NetworkException("localhost:27017",
                                                     "reset"));
        Throwable t = awaitFailure(collection.bulkUpdate(Arrays.asList(
            new UpdateStatement(FILTER, UPDATE, true, false, null)), null));
        assertTrue(t instanceof NetworkException);
        assertEquals(1, server.callCount());
    }

    @Test
    public void testBulkDelete() throws Throwable {
        RecordingCallback<Document> cb = new RecordingCallback<>();
        collection.bulkDelete(Arrays.asList(
            new DeleteStatement(FILTER, 1, null),
            new DeleteStatement(new Document(), 0, null)),
            new DeleteOptions().setWriteConcern(WriteConcern.W1), cb);
        cb.await();
        assertNull(cb.error);
        assertEquals(2, server.deletes.get(0).size());
        assertEquals(WriteConcern.W1, server.options.get(0).getWriteConcern());
    }

    @Test
    public void testClosed() {
        collection.close();
        assertThrows(IllegalStateException.class,
                     () -> collection.deleteOne(FILTER, null));
    }
}
