/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.Collections;

import com.docstore.driver.CommandFailedException;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * Sets the profiling level of a database. The level is given by name:
 * "off", "slow_only" or "all", sent to the server as 0, 1 and 2. On
 * success the result is the level name that was passed in.
 * <p>
 * An unknown name is not rejected by the constructor. Executing the
 * operation fails with an IllegalArgumentException and no command is sent.
 */
public class SetProfilingLevelOperation extends CommandOperation<String> {

    private final String level;

    /* null if the level name is not recognized */
    private final Integer profile;

    /**
     * @param db the database
     * @param level the level name
     * @param options the options, copied, may be null
     */
    public SetProfilingLevelOperation(DatabaseHandle db,
                                      String level,
                                      CommandOptions options) {
        super(db, options == null ? new CommandOptions() : options.copy());
        this.level = level;
        this.profile = toProfile(level);
    }

    /**
     * Maps a level name to the value of the profile command, or null if
     * the name is not recognized.
     *
     * @param level the level name
     *
     * @return 0, 1, 2 or null
     */
    public static Integer toProfile(String level) {
        if (level == null) {
            return null;
        }
        switch (level) {
        case "off":
            return 0;
        case "slow_only":
            return 1;
        case "all":
            return 2;
        default:
            return null;
        }
    }

    public String getLevel() {
        return level;
    }

    /**
     * @return the profile value sent to the server, or null if the level
     * name is not recognized
     */
    public Integer getProfile() {
        return profile;
    }

    @Override
    public void execute(Server server, ResultCallback<String> done) {
        if (profile == null) {
            done.onResult(null, new IllegalArgumentException(
                "Error: illegal profiling level value " + level));
            return;
        }
        executeCommand(server, new Document("profile", profile),
            (response, err) -> {
                if (err != null) {
                    done.onResult(null, err);
                    return;
                }
                if (!Documents.isOk(response)) {
                    done.onResult(null, new CommandFailedException(
                        "Error with profile command", 0, null,
                        Collections.emptyList(), response));
                    return;
                }
                done.onResult(level, null);
            });
    }
}
