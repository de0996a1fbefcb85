/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import com.docstore.driver.WriteConcern;
import com.docstore.driver.server.WriteConcernSource;
import com.docstore.driver.util.CheckNull;

/**
 * Merges the write concern given in a command's options with the default
 * write concern of the database or collection the command targets.
 * <p>
 * An explicit write concern wins as a whole: if any of w, wtimeout, j or
 * fsync is present in the options, nothing is taken from the default, so
 * an explicit {@code j=false} also suppresses the default. Otherwise the
 * fields present in the default are used.
 */
public final class WriteConcernResolver {

    private WriteConcernResolver() {}

    /**
     * Returns a copy of the options with the effective write concern. The
     * options passed in are not modified.
     *
     * @param <O> the options type
     * @param options the command options
     * @param source the target carrying a default, may be null
     *
     * @return the resolved copy
     */
    @SuppressWarnings("unchecked")
    public static <O extends CommandOptions> O resolve(
        O options,
        WriteConcernSource source) {

        CheckNull.requireNonNull(options, "options must be non-null");
        O copy = (O) options.copy();
        copy.setWriteConcern(resolve(options.getWriteConcern(), source));
        return copy;
    }

    /**
     * Returns the effective write concern.
     *
     * @param explicit the write concern given by the caller, may be null
     * @param source the target carrying a default, may be null
     *
     * @return the effective write concern, or the explicit value (possibly
     * null) if there is nothing to take from the default
     */
    public static WriteConcern resolve(WriteConcern explicit,
                                       WriteConcernSource source) {
        if (explicit != null && explicit.isSpecified()) {
            return explicit;
        }
        WriteConcern inherited = source == null ?
            null : source.getWriteConcern();
        if (inherited == null || !inherited.isSpecified()) {
            return explicit;
        }
        return inherited;
    }
}
