/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import java.util.Objects;
import java.util.Set;

import org.bson.Document;

/**
 * Defines the acknowledgement and durability requested for a write. A
 * write concern has four optional fields:
 * <ul>
 * <li>{@code w}: the number of members that must acknowledge the write, or
 * a tag set name such as "majority"</li>
 * <li>{@code wtimeout}: a time limit, in milliseconds, for {@code w}</li>
 * <li>{@code j}: whether the write must reach the on-disk journal</li>
 * <li>{@code fsync}: whether the write must be flushed to disk</li>
 * </ul>
 * A field is either present or absent; an absent field is null. Presence is
 * what matters when a write concern is merged with a default, so an explicit
 * {@code j=false} is a specified value.
 * <p>
 * Instances are immutable; the {@code with} methods return new instances.
 */
public class WriteConcern {

    /**
     * A write concern with no fields present. Commands using it are sent
     * without a write concern and the server default applies.
     */
    public static final WriteConcern UNSPECIFIED =
        new WriteConcern(null, null, null, null);

    /**
     * Acknowledged by the primary only.
     */
    public static final WriteConcern W1 = UNSPECIFIED.withW(1);

    /**
     * Acknowledged by a majority of data bearing members.
     */
    public static final WriteConcern MAJORITY = UNSPECIFIED.withW("majority");

    private static final Set<String> FIELDS =
        Set.of("w", "wtimeout", "j", "fsync");

    private final Object w;
    private final Integer wtimeout;
    private final Boolean j;
    private final Boolean fsync;

    private WriteConcern(Object w,
                         Integer wtimeout,
                         Boolean j,
                         Boolean fsync) {
        this.w = w;
        this.wtimeout = wtimeout;
        this.j = j;
        this.fsync = fsync;
    }

    /**
     * Creates a write concern from a document such as
     * <code>{w: 2, wtimeout: 100}</code>.
     *
     * @param doc the document
     *
     * @return the write concern
     *
     * @throws IllegalArgumentException if the document contains a key other
     * than w, wtimeout, j and fsync, or a value of the wrong type
     */
    public static WriteConcern fromDocument(Document doc) {
        WriteConcern wc = UNSPECIFIED;
        for (String key : doc.keySet()) {
            if (!FIELDS.contains(key)) {
                throw new IllegalArgumentException(
                    "Unrecognized write concern option: " + key);
            }
        }
        Object wValue = doc.get("w");
        if (wValue instanceof Number) {
            wc = wc.withW(((Number) wValue).intValue());
        } else if (wValue instanceof String) {
            wc = wc.withW((String) wValue);
        } else if (wValue != null) {
            throw new IllegalArgumentException(
                "Write concern w must be a number or a string");
        }
        Object timeout = doc.get("wtimeout");
        if (timeout != null) {
            if (!(timeout instanceof Number)) {
                throw new IllegalArgumentException(
                    "Write concern wtimeout must be a number");
            }
            wc = wc.withWTimeout(((Number) timeout).intValue());
        }
        if (doc.containsKey("j")) {
            wc = wc.withJournal(requireBoolean(doc, "j"));
        }
        if (doc.containsKey("fsync")) {
            wc = wc.withFsync(requireBoolean(doc, "fsync"));
        }
        return wc;
    }

    private static boolean requireBoolean(Document doc, String key) {
        Object value = doc.get(key);
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "Write concern " + key + " must be a boolean");
        }
        return (Boolean) value;
    }

    /**
     * @param w the number of acknowledging members, must be &gt;= 0
     * @return a copy with w set
     */
    public WriteConcern withW(int w) {
        if (w < 0) {
            throw new IllegalArgumentException("w must be >= 0");
        }
        return new WriteConcern(w, wtimeout, j, fsync);
    }

    /**
     * @param w a tag set name, for example "majority"
     * @return a copy with w set
     */
    public WriteConcern withW(String w) {
        Objects.requireNonNull(w, "WriteConcern.withW: w must be non-null");
        return new WriteConcern(w, wtimeout, j, fsync);
    }

    /**
     * @param wtimeoutMs the timeout in milliseconds, must be &gt;= 0
     * @return a copy with wtimeout set
     */
    public WriteConcern withWTimeout(int wtimeoutMs) {
        if (wtimeoutMs < 0) {
            throw new IllegalArgumentException("wtimeout must be >= 0");
        }
        return new WriteConcern(w, wtimeoutMs, j, fsync);
    }

    /**
     * @param journal the journal flag
     * @return a copy with j set
     */
    public WriteConcern withJournal(boolean journal) {
        return new WriteConcern(w, wtimeout, journal, fsync);
    }

    /**
     * @param sync the fsync flag
     * @return a copy with fsync set
     */
    public WriteConcern withFsync(boolean sync) {
        return new WriteConcern(w, wtimeout, j, sync);
    }

    /**
     * @return w, an Integer or a String, or null if absent
     */
    public Object getW() {
        return w;
    }

    /**
     * @return wtimeout in milliseconds, or null if absent
     */
    public Integer getWTimeout() {
        return wtimeout;
    }

    /**
     * @return the journal flag, or null if absent
     */
    public Boolean getJournal() {
        return j;
    }

    /**
     * @return the fsync flag, or null if absent
     */
    public Boolean getFsync() {
        return fsync;
    }

    /**
     * Returns true if any of the four fields is present.
     *
     * @return true if specified
     */
    public boolean isSpecified() {
        return w != null || wtimeout != null || j != null || fsync != null;
    }

    /**
     * Returns the document form sent with a command, containing only the
     * present fields.
     *
     * @return the document
     */
    public Document toDocument() {
        Document doc = new Document();
        if (w != null) {
            doc.append("w", w);
        }
        if (wtimeout != null) {
            doc.append("wtimeout", wtimeout);
        }
        if (j != null) {
            doc.append("j", j);
        }
        if (fsync != null) {
            doc.append("fsync", fsync);
        }
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WriteConcern)) {
            return false;
        }
        WriteConcern other = (WriteConcern) o;
        return Objects.equals(w, other.w) &&
            Objects.equals(wtimeout, other.wtimeout) &&
            Objects.equals(j, other.j) &&
            Objects.equals(fsync, other.fsync);
    }

    @Override
    public int hashCode() {
        return Objects.hash(w, wtimeout, j, fsync);
    }

    @Override
    public String toString() {
        return "WriteConcern" + toDocument().toJson();
    }
}
