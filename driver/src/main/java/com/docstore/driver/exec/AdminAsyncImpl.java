/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import static com.docstore.driver.util.CheckNull.requireNonEmpty;
import static com.docstore.driver.util.CheckNull.requireNonNull;

import java.util.concurrent.CompletableFuture;

import com.docstore.driver.AdminAsync;
import com.docstore.driver.CommandFailedException;
import com.docstore.driver.DriverConfig;
import com.docstore.driver.ResultCallback;
import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.ListDatabasesOptions;
import com.docstore.driver.ops.SetProfilingLevelOperation;
import com.docstore.driver.ops.UserOptions;
import com.docstore.driver.ops.ValidateCollectionOperation;
import com.docstore.driver.ops.ValidateOptions;
import com.docstore.driver.ops.WriteConcernResolver;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.ServerSelector;
import com.docstore.driver.util.Documents;

import org.bson.Document;

public class AdminAsyncImpl extends AsyncFacadeBase implements AdminAsync {

    private static final String ADMIN_DB = "admin";

    private final DatabaseHandle db;

    public AdminAsyncImpl(DriverConfig config,
                          ServerSelector selector,
                          DatabaseHandle db) {
        super(config, selector);
        this.db = requireNonNull(db, "database handle must be non-null");
    }

    @Override
    public CompletableFuture<Document> command(Document command,
                                               CommandOptions options) {
        return adminCommand(command, options);
    }

    @Override
    public void command(Document command,
                        CommandOptions options,
                        ResultCallback<Document> callback) {
        adminCommand(command, options, callback);
    }

    @Override
    public CompletableFuture<Document> buildInfo() {
        return adminCommand(new Document("buildinfo", 1), null);
    }

    @Override
    public void buildInfo(ResultCallback<Document> callback) {
        adminCommand(new Document("buildinfo", 1), null, callback);
    }

    @Override
    public CompletableFuture<Document> serverInfo() {
        return buildInfo();
    }

    @Override
    public void serverInfo(ResultCallback<Document> callback) {
        buildInfo(callback);
    }

    @Override
    public CompletableFuture<Document> serverStatus() {
        return executeAsync(okRequired(
            adminCommandInvocation(new Document("serverStatus", 1), null)));
    }

    @Override
    public void serverStatus(ResultCallback<Document> callback) {
        executeAsync(okRequired(
            adminCommandInvocation(new Document("serverStatus", 1), null)),
            callback);
    }

    @Override
    public CompletableFuture<Document> ping() {
        return adminCommand(new Document("ping", 1), null);
    }

    @Override
    public void ping(ResultCallback<Document> callback) {
        adminCommand(new Document("ping", 1), null, callback);
    }

    @Override
    public CompletableFuture<Document> listDatabases(
        ListDatabasesOptions options) {
        return adminCommand(listDatabasesCommand(options), null);
    }

    @Override
    public void listDatabases(ListDatabasesOptions options,
                              ResultCallback<Document> callback) {
        adminCommand(listDatabasesCommand(options), null, callback);
    }

    private static Document listDatabasesCommand(ListDatabasesOptions options) {
        Document cmd = new Document("listDatabases", 1);
        if (options != null) {
            options.appendTo(cmd);
        }
        return cmd;
    }

    @Override
    public CompletableFuture<Document> replSetGetStatus() {
        return executeAsync(okRequired(adminCommandInvocation(
            new Document("replSetGetStatus", 1), null)));
    }

    @Override
    public void replSetGetStatus(ResultCallback<Document> callback) {
        executeAsync(okRequired(adminCommandInvocation(
            new Document("replSetGetStatus", 1), null)), callback);
    }

    @Override
    public CompletableFuture<Document> addUser(String username,
                                               String password,
                                               UserOptions options) {
        return executeAsync(addUserInvocation(username, password, options));
    }

    @Override
    public void addUser(String username,
                        String password,
                        UserOptions options,
                        ResultCallback<Document> callback) {
        executeAsync(addUserInvocation(username, password, options),
                     callback);
    }

    private Invocation<Document> addUserInvocation(String username,
                                                   String password,
                                                   UserOptions options) {
        requireNonEmpty(username, "username must be non-empty");
        requireNonNull(password, "password must be non-null");
        UserOptions own = userOptions(options);
        return done -> db.addUser(username, password, own, done);
    }

    @Override
    public CompletableFuture<Document> removeUser(String username,
                                                  UserOptions options) {
        return executeAsync(removeUserInvocation(username, options));
    }

    @Override
    public void removeUser(String username,
                           UserOptions options,
                           ResultCallback<Document> callback) {
        executeAsync(removeUserInvocation(username, options), callback);
    }

    private Invocation<Document> removeUserInvocation(String username,
                                                      UserOptions options) {
        requireNonEmpty(username, "username must be non-empty");
        UserOptions own = userOptions(options);
        return done -> db.removeUser(username, own, done);
    }

    /*
     * Users managed through the admin facade always live in the admin
     * database.
     */
    private UserOptions userOptions(UserOptions options) {
        UserOptions own = WriteConcernResolver.resolve(
            options == null ? new UserOptions() : options, db);
        return own.setDbName(ADMIN_DB);
    }

    @Override
    public CompletableFuture<Document> validateCollection(
        String collectionName,
        ValidateOptions options) {
        checkClient();
        return executor.execute(
            new ValidateCollectionOperation(db, collectionName, options));
    }

    @Override
    public void validateCollection(String collectionName,
                                   ValidateOptions options,
                                   ResultCallback<Document> callback) {
        checkClient();
        executor.execute(
            new ValidateCollectionOperation(db, collectionName, options),
            callback);
    }

    @Override
    public CompletableFuture<String> setProfilingLevel(String level) {
        checkClient();
        return executor.execute(
            new SetProfilingLevelOperation(db, level, null));
    }

    @Override
    public void setProfilingLevel(String level,
                                  ResultCallback<String> callback) {
        checkClient();
        executor.execute(new SetProfilingLevelOperation(db, level, null),
                         callback);
    }

    private CompletableFuture<Document> adminCommand(Document command,
                                                     CommandOptions options) {
        return executeAsync(adminCommandInvocation(command, options));
    }

    private void adminCommand(Document command,
                              CommandOptions options,
                              ResultCallback<Document> callback) {
        executeAsync(adminCommandInvocation(command, options), callback);
    }

    private Invocation<Document> adminCommandInvocation(
        Document command,
        CommandOptions options) {
        requireNonNull(command, "command must be non-null");
        CommandOptions own =
            options == null ? new CommandOptions() : options.copy();
        return done -> db.executeDbAdminCommand(command, own, done);
    }

    /*
     * Status replies must carry ok: 1. A reply without an ok field is a
     * failure too.
     */
    private static Invocation<Document> okRequired(
        Invocation<Document> invocation) {
        return done -> invocation.invoke((reply, err) -> {
            if (err == null && reply != null && !Documents.isOk(reply)) {
                done.onResult(null,
                              CommandFailedException.fromResponse(reply));
                return;
            }
            done.onResult(reply, err);
        });
    }

    <T> CompletableFuture<T> executeAsync(Invocation<T> invocation) {
        checkClient();
        return executor.executeOperation(invocation);
    }

    <T> void executeAsync(Invocation<T> invocation,
                          ResultCallback<T> callback) {
        checkClient();
        executor.executeOperation(invocation, callback);
    }
}
