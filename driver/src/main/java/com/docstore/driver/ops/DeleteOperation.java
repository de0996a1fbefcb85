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
 * A bulk delete: a list of delete statements sent as one delete command
 * to a namespace. The result is the raw server reply.
 * <p>
 * The operation is retryable only if every statement removes at most one
 * document, see {@link #canRetryWrite}.
 */
public class DeleteOperation extends Operation<Document> {

    private final String namespace;
    private final List<DeleteStatement> statements;
    private final DeleteOptions options;

    /**
     * @param namespace the "db.collection" namespace
     * @param statements the statements, must not be null
     * @param options the options, copied, may be null
     */
    public DeleteOperation(String namespace,
                           List<DeleteStatement> statements,
                           DeleteOptions options) {
        super(options == null ? new DeleteOptions() : options.copy());
        this.namespace = CheckNull.requireNonEmpty(
            namespace, "Delete requires a namespace");
        CheckNull.requireNonNullIAE(
            statements, "Delete requires a list of statements");
        for (DeleteStatement stmt : statements) {
            CheckNull.requireNonNullIAE(stmt, "Delete statement is null");
        }
        this.statements =
            Collections.unmodifiableList(new ArrayList<>(statements));
        this.options = (DeleteOptions) getOptions();
    }

    public String getNamespace() {
        return namespace;
    }

    public List<DeleteStatement> getStatements() {
        return statements;
    }

    /**
     * Returns true if every statement has no limit or a limit greater than
     * 0. A limit of 0 removes all matching documents and cannot be repeated
     * safely.
     */
    @Override
    public boolean canRetryWrite() {
        for (DeleteStatement stmt : statements) {
            Integer limit = stmt.getLimit();
            if (limit != null && limit <= 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void execute(Server server, ResultCallback<Document> done) {
        server.remove(namespace, statements, options, done);
    }
}
