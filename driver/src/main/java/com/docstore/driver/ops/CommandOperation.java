/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.logging.Logger;

import com.docstore.driver.ResultCallback;
import com.docstore.driver.WriteConcern;
import com.docstore.driver.server.CommandTarget;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.CheckNull;
import com.docstore.driver.util.LogUtil;

import org.bson.Document;

/**
 * An operation bound to one database or collection that runs a command on
 * the selected server.
 *
 * @param <T> the type of the operation result
 */
public abstract class CommandOperation<T> extends Operation<T> {

    private static final Logger logger =
        Logger.getLogger(CommandOperation.class.getName());

    private final CommandTarget target;

    /**
     * @param target the database or collection
     * @param options the operation's own copy of the options
     */
    protected CommandOperation(CommandTarget target, CommandOptions options) {
        super(options);
        this.target = CheckNull.requireNonNull(
            target, "Command target must be non-null");
    }

    /**
     * @return the database or collection this operation is bound to
     */
    public CommandTarget getTarget() {
        return target;
    }

    /**
     * Returns the write concern sent with the command: the one given in the
     * options, or the default of the target if the options specify none.
     *
     * @return the write concern, or null
     */
    public WriteConcern getWriteConcern() {
        return WriteConcernResolver.resolve(getOptions().getWriteConcern(),
                                            target);
    }

    /**
     * Decorates the command with the write concern (write operations
     * only), maxTimeMS and comment, then runs it on the server against the
     * target's database. The command document is modified in place.
     *
     * @param server the server
     * @param command the command
     * @param done the completion, called with the raw reply
     */
    protected void executeCommand(Server server,
                                  Document command,
                                  ResultCallback<Document> done) {
        CommandOptions options = getOptions();
        if (hasAspect(Aspect.WRITE_OPERATION)) {
            WriteConcern wc = getWriteConcern();
            if (wc != null && wc.isSpecified()) {
                command.append("writeConcern", wc.toDocument());
            }
        }
        if (options.getMaxTimeMS() != null) {
            command.append("maxTimeMS", options.getMaxTimeMS());
        }
        if (options.getComment() != null) {
            command.append("comment", options.getComment());
        }
        LogUtil.logFine(logger, () -> getTypeName() + " running " +
                        command.toJson() + " on " + server.getAddress());
        server.command(target.getDatabaseName(), command, options, done);
    }
}
