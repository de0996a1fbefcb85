/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

/**
 * The members a read may be routed to. Writes are always routed to the
 * primary regardless of the read preference in their options.
 */
public enum ReadPreference {

    PRIMARY("primary"),
    PRIMARY_PREFERRED("primaryPreferred"),
    SECONDARY("secondary"),
    SECONDARY_PREFERRED("secondaryPreferred"),
    NEAREST("nearest");

    private final String mode;

    ReadPreference(String mode) {
        this.mode = mode;
    }

    /**
     * @return the mode name used in commands, for example "primaryPreferred"
     */
    public String getMode() {
        return mode;
    }

    /**
     * Returns the read preference with the given mode name.
     *
     * @param mode the mode name, case-insensitive
     *
     * @return the read preference
     *
     * @throws IllegalArgumentException if the mode is not known
     */
    public static ReadPreference fromMode(String mode) {
        for (ReadPreference rp : values()) {
            if (rp.mode.equalsIgnoreCase(mode)) {
                return rp;
            }
        }
        throw new IllegalArgumentException(
            "Unrecognized read preference: " + mode);
    }
}
