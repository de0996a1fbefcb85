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
 * Options for update operations. In addition to the keys recognized by
 * {@link CommandOptions}, {@link #fromDocument} accepts {@code multi}
 * (Boolean), {@code upsert} (Boolean) and {@code hint} (a String index name
 * or an index key Document).
 * <p>
 * The {@code multi} option is only consulted by a bulk update. The
 * single and many update operations set it themselves on their own copy.
 */
public class UpdateOptions extends CommandOptions {

    private Boolean multi;
    private Boolean upsert;
    private Object hint;

    public UpdateOptions() {}

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
    public static UpdateOptions fromDocument(Document doc) {
        UpdateOptions options = new UpdateOptions();
        options.applyDocument(doc);
        return options;
    }

    @Override
    protected boolean applyOption(String key, Object value) {
        switch (key) {
        case "multi":
            multi = requireType(key, value, Boolean.class);
            return true;
        case "upsert":
            upsert = requireType(key, value, Boolean.class);
            return true;
        case "hint":
            setHintInternal(key, value);
            return true;
        default:
            return super.applyOption(key, value);
        }
    }

    private void setHintInternal(String key, Object value) {
        if (!(value instanceof String) && !(value instanceof Document)) {
            throw new IllegalArgumentException(
                "Option " + key + " must be a String or a Document");
        }
        hint = value;
    }

    /**
     * Sets whether an update statement may modify more than one document.
     *
     * @param multi the value
     *
     * @return this
     */
    public UpdateOptions setMulti(boolean multi) {
        this.multi = multi;
        return this;
    }

    /**
     * @return the multi setting, or null if not set
     */
    public Boolean getMulti() {
        return multi;
    }

    /**
     * Sets whether a document is inserted when no document matches the
     * filter.
     *
     * @param upsert the value
     *
     * @return this
     */
    public UpdateOptions setUpsert(boolean upsert) {
        this.upsert = upsert;
        return this;
    }

    /**
     * @return the upsert setting, or null if not set
     */
    public Boolean getUpsert() {
        return upsert;
    }

    /**
     * Sets the index to use, by name.
     *
     * @param indexName the index name
     *
     * @return this
     */
    public UpdateOptions setHint(String indexName) {
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
    public UpdateOptions setHint(Document indexKeys) {
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
    public UpdateOptions setWriteConcern(WriteConcern writeConcern) {
        super.setWriteConcern(writeConcern);
        return this;
    }

    @Override
    public UpdateOptions setMaxTimeMS(int maxTimeMS) {
        super.setMaxTimeMS(maxTimeMS);
        return this;
    }

    @Override
    public UpdateOptions setReadPreference(ReadPreference readPreference) {
        super.setReadPreference(readPreference);
        return this;
    }

    @Override
    public UpdateOptions setComment(String comment) {
        super.setComment(comment);
        return this;
    }

    @Override
    public UpdateOptions copy() {
        UpdateOptions copy = new UpdateOptions();
        copyTo(copy);
        copy.multi = multi;
        copy.upsert = upsert;
        copy.hint = hint;
        return copy;
    }
}
