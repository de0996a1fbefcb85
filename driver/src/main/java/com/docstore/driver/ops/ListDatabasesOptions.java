/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import org.bson.Document;

/**
 * Options for the listDatabases command. {@link #fromDocument} accepts
 * {@code nameOnly} (Boolean), {@code filter} (Document) and
 * {@code authorizedDatabases} (Boolean).
 */
public class ListDatabasesOptions {

    private Boolean nameOnly;
    private Document filter;
    private Boolean authorizedDatabases;

    public ListDatabasesOptions() {}

    /**
     * Builds options from a document.
     *
     * @param doc the document
     *
     * @return the options
     *
     * @throws IllegalArgumentException if the document contains an
     * unrecognized key or a value of the wrong type
     */
    public static ListDatabasesOptions fromDocument(Document doc) {
        ListDatabasesOptions options = new ListDatabasesOptions();
        for (String key : doc.keySet()) {
            Object value = doc.get(key);
            switch (key) {
            case "nameOnly":
                options.nameOnly = CommandOptions.requireType(
                    key, value, Boolean.class);
                break;
            case "filter":
                options.filter = CommandOptions.requireType(
                    key, value, Document.class);
                break;
            case "authorizedDatabases":
                options.authorizedDatabases = CommandOptions.requireType(
                    key, value, Boolean.class);
                break;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized option for ListDatabasesOptions: " + key);
            }
        }
        return options;
    }

    public ListDatabasesOptions setNameOnly(boolean nameOnly) {
        this.nameOnly = nameOnly;
        return this;
    }

    public Boolean getNameOnly() {
        return nameOnly;
    }

    public ListDatabasesOptions setFilter(Document filter) {
        this.filter = filter;
        return this;
    }

    public Document getFilter() {
        return filter;
    }

    public ListDatabasesOptions setAuthorizedDatabases(boolean value) {
        this.authorizedDatabases = value;
        return this;
    }

    public Boolean getAuthorizedDatabases() {
        return authorizedDatabases;
    }

    /**
     * Appends the options that are set to a listDatabases command. The
     * server expects nameOnly as a number.
     *
     * @param command the command
     *
     * @return the command
     */
    public Document appendTo(Document command) {
        if (nameOnly != null) {
            command.append("nameOnly", nameOnly ? 1 : 0);
        }
        if (filter != null) {
            command.append("filter", filter);
        }
        if (authorizedDatabases != null) {
            command.append("authorizedDatabases", authorizedDatabases);
        }
        return command;
    }

    public ListDatabasesOptions copy() {
        ListDatabasesOptions copy = new ListDatabasesOptions();
        copy.nameOnly = nameOnly;
        copy.filter = filter;
        copy.authorizedDatabases = authorizedDatabases;
        return copy;
    }
}
