/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import com.docstore.driver.util.CheckNull;

import org.bson.Document;

/**
 * One statement of an update command. Instances are immutable.
 * <p>
 * A null {@code multi} means the field is absent from the statement, which
 * the server treats as false.
 */
public final class UpdateStatement {

    private final Document filter;
    private final Document update;
    private final Boolean multi;
    private final boolean upsert;
    private final Object hint;

    /**
     * Creates a statement with no multi field, no upsert and no hint.
     *
     * @param filter the selection filter
     * @param update the update document
     */
    public UpdateStatement(Document filter, Document update) {
        this(filter, update, null, false, null);
    }

    /**
     * Creates a statement.
     *
     * @param filter the selection filter
     * @param update the update document
     * @param multi whether more than one document may be updated, or null
     * to leave the field absent
     * @param upsert whether to insert a document if none match
     * @param hint an index name or key pattern, or null
     */
    public UpdateStatement(Document filter,
                           Document update,
                           Boolean multi,
                           boolean upsert,
                           Object hint) {
        this.filter = CheckNull.requireNonNullIAE(
            filter, "Update statement requires a filter");
        this.update = CheckNull.requireNonNullIAE(
            update, "Update statement requires an update document");
        this.multi = multi;
        this.upsert = upsert;
        this.hint = hint;
    }

    public Document getFilter() {
        return filter;
    }

    public Document getUpdate() {
        return update;
    }

    /**
     * @return the multi field, or null if absent
     */
    public Boolean getMulti() {
        return multi;
    }

    public boolean isUpsert() {
        return upsert;
    }

    public Object getHint() {
        return hint;
    }

    /**
     * @return true if this statement may modify more than one document
     */
    public boolean isMulti() {
        return Boolean.TRUE.equals(multi);
    }

    /**
     * Returns the statement as it appears in the updates array of an
     * update command.
     *
     * @return the document
     */
    public Document toDocument() {
        Document doc = new Document("q", filter).append("u", update);
        if (multi != null) {
            doc.append("multi", multi);
        }
        if (upsert) {
            doc.append("upsert", true);
        }
        if (hint != null) {
            doc.append("hint", hint);
        }
        return doc;
    }

    @Override
    public String toString() {
        return "UpdateStatement" + toDocument().toJson();
    }
}
