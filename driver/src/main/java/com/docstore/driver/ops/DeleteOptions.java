/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import com.docstore.driver.ReadPreference;
import com.docstore.driver.WriteConcern;

import org.bson.Document;

/**
 * Options for delete operations. In addition to the keys recognized by
 * {@link CommandOptions}, {@link #fromDocument} accepts {@code single}
 * (Boolean) and {@code hint} (a String index name or an index key
 * Document).
 */
public class DeleteOptions extends CommandOptions {

    private Boolean single;
    private Object hint;

    public DeleteOptions() {}

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
    public static DeleteOptions fromDocument(Document doc) {
        DeleteOptions options = new DeleteOptions();
        options.applyDocument(doc);
        return options;
    }

    @Override
    protected boolean applyOption(String key, Object value) {
        switch (key) {
        case "single":
            single = requireType(key, value, Boolean.class);
            return true;
        case "hint":
            if (!(value instanceof String) && !(value instanceof Document)) {
                throw new IllegalArgumentException(
                    "Option hint must be a String or a Document");
            }
            hint = value;
            return true;
        default:
            return super.applyOption(key, value);
        }
    }

    /**
     * Sets whether at most one matching document is removed.
     *
     * @param single the value
     *
     * @return this
     */
    public DeleteOptions setSingle(boolean single) {
        this.single = single;
        return this;
    }

    /**
     * @return the single setting, or null if not set
     */
    public Boolean getSingle() {
        return single;
    }

    /**
     * Sets the index to use, by name.
     *
     * @param indexName the index name
     *
     * @return this
     */
    public DeleteOptions setHint(String indexName) {
        this.hint = indexName;
        return this;
    }

    /**
     * Sets the index to use, by key pattern.
     *
     * @param indexKeys the index key pattern
     *
     * @return this
     */
    public DeleteOptions setHint(Document indexKeys) {
        this.hint = indexKeys;
        return this;
    }

    /**
     * @return the hint, a String or a Document, or null if not set
     */
    public Object getHint() {
        return hint;
    }

    @Override
    public DeleteOptions setWriteConcern(WriteConcern writeConcern) {
        super.setWriteConcern(writeConcern);
        return this;
    }

    @Override
    public DeleteOptions setMaxTimeMS(int maxTimeMS) {
        super.setMaxTimeMS(maxTimeMS);
        return this;
    }

    @Override
    public DeleteOptions setReadPreference(ReadPreference readPreference) {
        super.setReadPreference(readPreference);
        return this;
    }

    @Override
    public DeleteOptions setComment(String comment) {
        super.setComment(comment);
        return this;
    }

    @Override
    public DeleteOptions copy() {
        DeleteOptions copy = new DeleteOptions();
        copyTo(copy);
        copy.single = single;
        copy.hint = hint;
        return copy;
    }
}
