/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.ops;

import java.util.regex.Pattern;

import com.docstore.driver.CollectionValidationException;
import com.docstore.driver.CommandFailedException;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.Server;
import com.docstore.driver.util.CheckNull;
import com.docstore.driver.util.Documents;

import org.bson.Document;

/**
 * Runs the validate command on a collection and checks the reply. The
 * reply is rejected, in this order, if
 * <ol>
 * <li>ok is 0</li>
 * <li>the result field is present but not a string</li>
 * <li>the result field mentions an exception or corruption</li>
 * <li>valid is false</li>
 * </ol>
 * Otherwise the reply is the result.
 */
public class ValidateCollectionOperation extends CommandOperation<Document> {

    private static final Pattern INVALID =
        Pattern.compile("exception|corrupt");

    private final String collectionName;
    private final ValidateOptions validateOptions;

    /**
     * @param db the database
     * @param collectionName the collection to validate
     * @param validateOptions the validate options, copied, may be null
     */
    public ValidateCollectionOperation(DatabaseHandle db,
                                       String collectionName,
                                       ValidateOptions validateOptions) {
        super(db, new CommandOptions());
        this.collectionName = CheckNull.requireNonEmpty(
            collectionName, "Collection name must be non-empty");
        this.validateOptions = validateOptions == null ?
            new ValidateOptions() : validateOptions.copy();
    }

    public String getCollectionName() {
        return collectionName;
    }

    /**
     * @return the validate command document
     */
    public Document buildCommand() {
        return validateOptions.appendTo(
            new Document("validate", collectionName));
    }

    @Override
    public void execute(Server server, ResultCallback<Document> done) {
        executeCommand(server, buildCommand(), (response, err) -> {
            if (err != null) {
                done.onResult(null, err);
                return;
            }
            RuntimeException failure = checkResponse(collectionName,
                                                     response);
            if (failure != null) {
                done.onResult(null, failure);
                return;
            }
            done.onResult(response, null);
        });
    }

    /**
     * Returns the exception describing why the reply is rejected, or null
     * if it is accepted.
     *
     * @param collectionName the validated collection
     * @param response the validate reply
     *
     * @return the exception or null
     */
    public static RuntimeException checkResponse(String collectionName,
                                                 Document response) {
        if (response == null || Documents.isNotOk(response)) {
            return new CommandFailedException("Error with validate command");
        }
        Object result = response.get("result");
        if (result != null) {
            if (!(result instanceof String)) {
                return new CollectionValidationException(
                    "Error with validation data", collectionName, response);
            }
            if (INVALID.matcher((String) result).find()) {
                return new CollectionValidationException(
                    "Error: invalid collection " + collectionName,
                    collectionName, response);
            }
        }
        if (Boolean.FALSE.equals(response.get("valid"))) {
            return new CollectionValidationException(
                "Error: invalid collection " + collectionName,
                collectionName, response);
        }
        return null;
    }
}
