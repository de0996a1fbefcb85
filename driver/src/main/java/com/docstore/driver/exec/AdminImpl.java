/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import com.docstore.driver.Admin;
import com.docstore.driver.AdminAsync;
import com.docstore.driver.DriverConfig;
import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.ListDatabasesOptions;
import com.docstore.driver.ops.UserOptions;
import com.docstore.driver.ops.ValidateOptions;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.ServerSelector;

import org.bson.Document;

import reactor.core.publisher.Mono;

/**
 * The methods in this class require non-null arguments. Because they all
 * ultimately call the asynchronous facade the check for null is done
 * there in a single place.
 */
public class AdminImpl implements Admin {

    private final AdminAsync client;

    public AdminImpl(DriverConfig config,
                     ServerSelector selector,
                     DatabaseHandle db) {
        client = new AdminAsyncImpl(config, selector, db);
    }

    @Override
    public Document command(Document command, CommandOptions options) {
        return Mono.fromFuture(client.command(command, options)).block();
    }

    @Override
    public Document buildInfo() {
        return Mono.fromFuture(client.buildInfo()).block();
    }

    @Override
    public Document serverInfo() {
        return Mono.fromFuture(client.serverInfo()).block();
    }

    @Override
    public Document serverStatus() {
        return Mono.fromFuture(client.serverStatus()).block();
    }

    @Override
    public Document ping() {
        return Mono.fromFuture(client.ping()).block();
    }

    @Override
    public Document listDatabases(ListDatabasesOptions options) {
        return Mono.fromFuture(client.listDatabases(options)).block();
    }

    @Override
    public Document replSetGetStatus() {
        return Mono.fromFuture(client.replSetGetStatus()).block();
    }

    @Override
    public Document addUser(String username,
                            String password,
                            UserOptions options) {
        return Mono.fromFuture(
            client.addUser(username, password, options)).block();
    }

    @Override
    public Document removeUser(String username, UserOptions options) {
        return Mono.fromFuture(client.removeUser(username, options)).block();
    }

    @Override
    public Document validateCollection(String collectionName,
                                       ValidateOptions options) {
        return Mono.fromFuture(
            client.validateCollection(collectionName, options)).block();
    }

    @Override
    public String setProfilingLevel(String level) {
        return Mono.fromFuture(client.setProfilingLevel(level)).block();
    }

    @Override
    public void close() {
        client.close();
    }
}
