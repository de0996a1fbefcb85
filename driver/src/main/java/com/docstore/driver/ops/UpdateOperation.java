/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.CheckNull;

import org.bson.Document;

/**
 * A bulk update: a list of update statements sent as one update command
 * to a namespace. The result is the raw server reply.
 * <p>
 * The operation is retryable only if no statement may modify more than one
 * document, see {@link #canRetryWrite}.
 */
public class UpdateOperation extends Operation<Document> {

    private final String namespace;
    private final List<UpdateStatement> statements;
    private final UpdateOptions options;

    /**
     * @param namespace the "db.collection" namespace
     * @param statements the statements, must not be null
     * @param options the options, copied, may be null
     */
    public UpdateOperation(String namespace,
                           List<UpdateStatement> statements,
                           UpdateOptions options) {
        super(options == null ? new UpdateOptions() : options.copy());
        this.namespace = CheckNull.requireNonEmpty(
            namespace, "Update requires a namespace");
        CheckNull.requireNonNullIAE(
            statements, "Update requires a list of statements");
        for (UpdateStatement stmt : statements) {
            CheckNull.requireNonNullIAE(stmt, "Update statement is null");
        }
        this.statements =
            Collections.unmodifiableList(new ArrayList<>(statements));
        this.options = (UpdateOptions) getOptions();
    }

    public String getNamespace() {
        return namespace;
    }

    public List<UpdateStatement> getStatements() {
        return statements;
    }

    /**
     * Returns true if no statement has multi set to true. A statement that
     * may modify several documents cannot be repeated safely because the
     * first attempt may have partially applied.
     */
    @Override
    public boolean canRetryWrite() {
        for (UpdateStatement stmt : statements) {
            if (stmt.isMulti()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void execute(Server server, ResultCallback<Document> done) {
        server.update(namespace, statements, options, done);
    }
}
