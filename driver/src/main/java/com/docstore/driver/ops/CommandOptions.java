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
 * Options shared by every command. Subclasses add the options of one kind of
 * operation. All fields are optional; an unset field is null.
 * <p>
 * The recognized keys, when options are built from a document with
 * {@link #fromDocument}, are:
 * <ul>
 * <li>{@code writeConcern}: a write concern document</li>
 * <li>{@code w}, {@code wtimeout}, {@code j}, {@code fsync}: write concern
 * fields given at the top level</li>
 * <li>{@code maxTimeMS}: a server side time limit for the command</li>
 * <li>{@code readPreference}: a read preference mode name</li>
 * <li>{@code comment}: a comment attached to the command</li>
 * </ul>
 * Operations copy their options before use, so an options instance may be
 * reused by the caller once the operation is constructed.
 */
public class CommandOptions {

    private WriteConcern writeConcern;
    private Integer maxTimeMS;
    private ReadPreference readPreference;
    private String comment;

    public CommandOptions() {}

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
    public static CommandOptions fromDocument(Document doc) {
        CommandOptions options = new CommandOptions();
        options.applyDocument(doc);
        return options;
    }

    /**
     * Applies each key of the document, rejecting any key that neither this
     * class nor a subclass recognizes.
     */
    protected final void applyDocument(Document doc) {
        Document flatConcern = new Document();
        for (String key : doc.keySet()) {
            Object value = doc.get(key);
            switch (key) {
            case "w":
            case "wtimeout":
            case "j":
            case "fsync":
                flatConcern.append(key, value);
                break;
            default:
                if (!applyOption(key, value)) {
                    throw new IllegalArgumentException(
                        "Unrecognized option for " +
                        getClass().getSimpleName() + ": " + key);
                }
            }
        }
        if (!flatConcern.isEmpty()) {
            if (writeConcern != null) {
                throw new IllegalArgumentException(
                    "writeConcern cannot be combined with top level " +
                    "w, wtimeout, j or fsync");
            }
            writeConcern = WriteConcern.fromDocument(flatConcern);
        }
    }

    /**
     * Applies one option. Subclasses handle their own keys and delegate the
     * rest to this method.
     *
     * @return false if the key is not recognized
     */
    protected boolean applyOption(String key, Object value) {
        switch (key) {
        case "writeConcern":
            if (value instanceof WriteConcern) {
                writeConcern = (WriteConcern) value;
            } else {
                writeConcern = WriteConcern.fromDocument(
                    requireType(key, value, Document.class));
            }
            return true;
        case "maxTimeMS":
            setMaxTimeMS(requireType(key, value, Number.class).intValue());
            return true;
        case "readPreference":
            if (value instanceof ReadPreference) {
                readPreference = (ReadPreference) value;
            } else {
                readPreference = ReadPreference.fromMode(
                    requireType(key, value, String.class));
            }
            return true;
        case "comment":
            comment = requireType(key, value, String.class);
            return true;
        default:
            return false;
        }
    }

    protected static <V> V requireType(String key,
                                       Object value,
                                       Class<V> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Option " + key + " must be of type " + type.getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * Sets the write concern. Fields left absent may be filled in from the
     * database or collection default, but only if no field is present.
     *
     * @param writeConcern the write concern
     *
     * @return this
     */
    public CommandOptions setWriteConcern(WriteConcern writeConcern) {
        this.writeConcern = writeConcern;
        return this;
    }

    /**
     * @return the write concern, or null if not set
     */
    public WriteConcern getWriteConcern() {
        return writeConcern;
    }

    /**
     * Sets a time limit for processing the command on the server.
     *
     * @param maxTimeMS the limit in milliseconds, must be &gt;= 0
     *
     * @return this
     */
    public CommandOptions setMaxTimeMS(int maxTimeMS) {
        if (maxTimeMS < 0) {
            throw new IllegalArgumentException("maxTimeMS must be >= 0");
        }
        this.maxTimeMS = maxTimeMS;
        return this;
    }

    /**
     * @return the time limit, or null if not set
     */
    public Integer getMaxTimeMS() {
        return maxTimeMS;
    }

    /**
     * Sets the read preference used when selecting a server for a read.
     *
     * @param readPreference the read preference
     *
     * @return this
     */
    public CommandOptions setReadPreference(ReadPreference readPreference) {
        this.readPreference = readPreference;
        return this;
    }

    /**
     * @return the read preference, or null if not set
     */
    public ReadPreference getReadPreference() {
        return readPreference;
    }

    /**
     * Sets a comment that is attached to the command and shows up in server
     * logs and profiler output.
     *
     * @param comment the comment
     *
     * @return this
     */
    public CommandOptions setComment(String comment) {
        this.comment = comment;
        return this;
    }

    /**
     * @return the comment, or null if not set
     */
    public String getComment() {
        return comment;
    }

    /**
     * Returns a copy of these options.
     *
     * @return the copy
     */
    public CommandOptions copy() {
        CommandOptions copy = new CommandOptions();
        copyTo(copy);
        return copy;
    }

    /**
     * Copy the common fields to another options object.
     * @param other the object to copy to
     */
    protected void copyTo(CommandOptions other) {
        other.writeConcern = this.writeConcern;
        other.maxTimeMS = this.maxTimeMS;
        other.readPreference = this.readPreference;
        other.comment = this.comment;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[writeConcern=" + writeConcern +
            ", maxTimeMS=" + maxTimeMS + ", readPreference=" +
            readPreference + ", comment=" + comment + "]";
    }
}
