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
 * One statement of a delete command. Instances are immutable.
 * <p>
 * A limit of 0 removes every matching document, a limit of 1 removes at
 * most one. A null limit means the field is absent from the statement.
 */
public final class DeleteStatement {

    private final Document filter;
    private final Integer limit;
    private final Object hint;

    /**
     * Creates a statement with no limit field and no hint.
     *
     * @param filter the selection filter
     */
    public DeleteStatement(Document filter) {
        this(filter, null, null);
    }

    /**
     * Creates a statement.
     *
     * @param filter the selection filter
     * @param limit 0 or 1, or null to leave the field absent
     * @param hint an index name or key pattern, or null
     */
    public DeleteStatement(Document filter, Integer limit, Object hint) {
        this.filter = CheckNull.requireNonNullIAE(
            filter, "Delete statement requires a filter");
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException(
                "Delete limit must be >= 0: " + limit);
        }
        this.limit = limit;
        this.hint = hint;
    }

    public Document getFilter() {
        return filter;
    }

    /**
     * @return the limit, or null if absent
     */
    public Integer getLimit() {
        return limit;
    }

    public Object getHint() {
        return hint;
    }

    /**
     * Returns the statement as it appears in the deletes array of a delete
     * command.
     *
     * @return the document
     */
    public Document toDocument() {
        Document doc = new Document("q", filter);
        if (limit != null) {
            doc.append("limit", limit);
        }
        if (hint != null) {
            doc.append("hint", hint);
        }
        return doc;
    }

    @Override
    public String toString() {
        return "DeleteStatement" + toDocument().toJson();
    }
}
