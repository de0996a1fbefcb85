/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import com.docstore.driver.ReadPreference;
import com.docstore.driver.WriteConcern;

import org.bson.Document;
import org.junit.Test;

public class OptionsTest {

    @Test
    public void testCommandOptionsFromDocument() {
        CommandOptions options = CommandOptions.fromDocument(
            new Document("maxTimeMS", 100)
                .append("readPreference", "secondaryPreferred")
                .append("comment", "nightly")
                .append("writeConcern", new Document("w", "majority")));
        assertEquals(Integer.valueOf(100), options.getMaxTimeMS());
        assertEquals(ReadPreference.SECONDARY_PREFERRED,
                     options.getReadPreference());
        assertEquals("nightly", options.getComment());
        assertEquals(WriteConcern.MAJORITY, options.getWriteConcern());
    }

    @Test
    public void testTopLevelWriteConcernFields() {
        CommandOptions options = CommandOptions.fromDocument(
            new Document("w", 2).append("j", false));
        assertEquals(WriteConcern.UNSPECIFIED.withW(2).withJournal(false),
                     options.getWriteConcern());

        assertThrows(IllegalArgumentException.class,
                     () -> CommandOptions.fromDocument(
                         new Document("w", 2).append(
                             "writeConcern", new Document("w", 1))));
    }

    @Test
    public void testUnknownKeysRejected() {
        IllegalArgumentException iae = assertThrows(
            IllegalArgumentException.class,
            () -> CommandOptions.fromDocument(new Document("multi", true)));
        assertTrue(iae.getMessage().contains("multi"));

        assertThrows(IllegalArgumentException.class,
                     () -> UpdateOptions.fromDocument(
                         new Document("single", true)));
        assertThrows(IllegalArgumentException.class,
                     () -> DeleteOptions.fromDocument(
                         new Document("upsert", true)));
        assertThrows(IllegalArgumentException.class,
                     () -> UserOptions.fromDocument(
                         new Document("password", "x")));
        assertThrows(IllegalArgumentException.class,
                     () -> ListDatabasesOptions.fromDocument(
                         new Document("maxTimeMS", 5)));
        assertThrows(IllegalArgumentException.class,
                     () -> ValidateOptions.fromDocument(
                         new Document("scandata", true)));
    }

    @Test
    public void testWrongTypesRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> UpdateOptions.fromDocument(
                         new Document("multi", "yes")));
        assertThrows(IllegalArgumentException.class,
                     () -> CommandOptions.fromDocument(
                         new Document("readPreference", "fastest")));
        assertThrows(IllegalArgumentException.class,
                     () -> DeleteOptions.fromDocument(
                         new Document("hint", 5)));
        assertThrows(IllegalArgumentException.class,
                     () -> UserOptions.fromDocument(
                         new Document("roles", Arrays.asList("read", 3))));
    }

    @Test
    public void testSubclassKeys() {
        UpdateOptions update = UpdateOptions.fromDocument(
            new Document("multi", true).append("upsert", true)
                .append("hint", new Document("a", 1)).append("maxTimeMS", 5));
        assertEquals(Boolean.TRUE, update.getMulti());
        assertEquals(Boolean.TRUE, update.getUpsert());
        assertEquals(new Document("a", 1), update.getHint());
        assertEquals(Integer.valueOf(5), update.getMaxTimeMS());

        DeleteOptions delete = DeleteOptions.fromDocument(
            new Document("single", true));
        assertEquals(Boolean.TRUE, delete.getSingle());

        UserOptions user = UserOptions.fromDocument(
            new Document("roles", Arrays.asList(
                "read", new Document("role", "dbAdmin").append("db", "x")))
                .append("dbName", "other"));
        assertEquals(2, user.getRoles().size());
        assertEquals("other", user.getDbName());
    }

    @Test
    public void testCopyIsIndependent() {
        UpdateOptions original = new UpdateOptions().setMulti(true)
            .setComment("c").setWriteConcern(WriteConcern.W1);
        UpdateOptions copy = original.copy();
        assertNotSame(original, copy);
        copy.setMulti(false).setComment("d");
        assertEquals(Boolean.TRUE, original.getMulti());
        assertEquals("c", original.getComment());
        assertEquals(WriteConcern.W1, copy.getWriteConcern());

        UserOptions user = new UserOptions().setRoles(Arrays.asList("read"));
        UserOptions userCopy = user.copy().setDbName("admin");
        assertNull(user.getDbName());
        assertEquals(user.getRoles(), userCopy.getRoles());
    }

    @Test
    public void testListDatabasesCommand() {
        Document cmd = new ListDatabasesOptions().setNameOnly(true)
            .setFilter(new Document("name", "x"))
            .appendTo(new Document("listDatabases", 1));
        assertEquals(Integer.valueOf(1), cmd.get("nameOnly"));
        assertEquals(new Document("name", "x"), cmd.get("filter"));

        cmd = new ListDatabasesOptions().setNameOnly(false)
            .appendTo(new Document("listDatabases", 1));
        assertEquals(Integer.valueOf(0), cmd.get("nameOnly"));
    }

    @Test
    public void testNegativeMaxTime() {
        assertThrows(IllegalArgumentException.class,
                     () -> new CommandOptions().setMaxTimeMS(-1));
    }
}
