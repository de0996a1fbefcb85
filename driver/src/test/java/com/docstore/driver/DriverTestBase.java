/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver;

import static org.junit.Assert.fail;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.docstore.driver.exec.OperationExecutor;
import com.docstore.driver.ops.CommandOptions;
import com.docstore.driver.ops.DeleteStatement;
import com.docstore.driver.ops.UpdateStatement;
import com.docstore.driver.ops.UserOptions;
import com.docstore.driver.server.CollectionHandle;
import com.docstore.driver.server.DatabaseHandle;
import com.docstore.driver.server.Server;
import com.docstore.driver.server.ServerSelector;

import org.bson.Document;
import org.junit.After;

/**
 * A common base for driver tests. It provides in-memory stand-ins for the
 * server, selector, database and collection collaborators, and helpers to
 * wait for futures and callbacks.
 */
public class DriverTestBase {

    protected static final Logger testLogger =
        Logger.getLogger(DriverTestBase.class.getName());

    protected static final int WAIT_SECONDS = 5;

    private final List<ScheduledExecutorService> pools = new ArrayList<>();

    @After
    public void shutdownPools() {
        for (ScheduledExecutorService pool : pools) {
            pool.shutdownNow();
        }
        pools.clear();
    }

    /*
     * Returns a config with a fixed small retry delay so retry tests
     * run quickly.
     */
    protected static DriverConfig testConfig() {
        return new DriverConfig().configureDefaultRetryHandler(1, 10);
    }

    protected OperationExecutor newExecutor(DriverConfig config,
                                            ServerSelector selector) {
        ScheduledExecutorService pool = new ScheduledThreadPoolExecutor(2);
        pools.add(pool);
        return new OperationExecutor(testLogger, config, selector, pool);
    }

    /**
     * Waits for the future and returns its value, or throws the exception
     * it completed with.
     */
    protected static <T> T await(Future<T> future) throws Throwable {
        try {
            return future.get(WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException ee) {
            throw ee.getCause();
        } catch (TimeoutException te) {
            fail("Future did not complete in " + WAIT_SECONDS + "s");
            return null;
        }
    }

    /**
     * Waits for the future to fail and returns the exception.
     */
    protected static Throwable awaitFailure(Future<?> future)
        throws Exception {
        try {
            future.get(WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException ee) {
            return ee.getCause();
        }
        fail("Expected the future to fail");
        return null;
    }

    /**
     * A callback that records every invocation.
     */
    protected static class RecordingCallback<T> implements ResultCallback<T> {
        private final CountDownLatch latch = new CountDownLatch(1);
        public final AtomicInteger calls = new AtomicInteger();
        public volatile T result;
        public volatile Throwable error;
        public volatile Thread thread;

        public RecordingCallback() {}

        @Override
        public void onResult(T result, Throwable error) {
            this.result = result;
            this.error = error;
            this.thread = Thread.currentThread();
            calls.incrementAndGet();
            latch.countDown();
        }

        public RecordingCallback<T> await() throws InterruptedException {
            if (!latch.await(WAIT_SECONDS, TimeUnit.SECONDS)) {
                fail("Callback was not called in " + WAIT_SECONDS + "s");
            }
            return this;
        }
    }

    /**
     * One scripted reply of a fake collaborator.
     */
    protected static class Outcome {
        final Document reply;
        final Throwable error;

        private Outcome(Document reply, Throwable error) {
            this.reply = reply;
            this.error = error;
        }

        public static Outcome reply(Document reply) {
            return new Outcome(reply, null);
        }

        public static Outcome error(Throwable error) {
            return new Outcome(null, error);
        }
    }

    /**
     * Holds scripted outcomes. When the script is exhausted every call
     * gets the default reply.
     */
    protected static class Script {
        private final Deque<Outcome> outcomes = new ArrayDeque<>();
        private volatile Document defaultReply =
            new Document("ok", 1).append("n", 1);
        private volatile boolean async;

        public synchronized Script then(Outcome outcome) {
            outcomes.add(outcome);
            return this;
        }

        public Script thenReply(Document reply) {
            return then(Outcome.reply(reply));
        }

        public Script thenError(Throwable error) {
            return then(Outcome.error(error));
        }

        public Script setDefaultReply(Document reply) {
            defaultReply = reply;
            return this;
        }

        /*
         * If true outcomes are reported on a new thread, otherwise on
         * the calling thread before the call returns.
         */
        public Script setAsync(boolean async) {
            this.async = async;
            return this;
        }

        private synchronized Outcome next() {
            Outcome next = outcomes.poll();
            return next != null ? next : Outcome.reply(defaultReply);
        }

        void respond(ResultCallback<Document> callback) {
            Outcome outcome = next();
            if (async) {
                Thread t = new Thread(
                    () -> callback.onResult(outcome.reply, outcome.error));
                t.setDaemon(true);
                t.start();
            } else {
                callback.onResult(outcome.reply, outcome.error);
            }
        }
    }

    /**
     * A server that records calls and replies from a script.
     */
    protected static class FakeServer implements Server {
        public final Script script = new Script();
        public final String address;
        public volatile boolean retryableWrites = true;

        public final List<String> namespaces =
            Collections.synchronizedList(new ArrayList<>());
        public final List<List<UpdateStatement>> updates =
            Collections.synchronizedList(new ArrayList<>());
        public final List<List<DeleteStatement>> deletes =
            Collections.synchronizedList(new ArrayList<>());
        public final List<Document> commands =
            Collections.synchronizedList(new ArrayList<>());
        public final List<String> commandDatabases =
            Collections.synchronizedList(new ArrayList<>());
        public final List<CommandOptions> options =
            Collections.synchronizedList(new ArrayList<>());

        public FakeServer(String address) {
            this.address = address;
        }

        public FakeServer() {
            this("localhost:27017");
        }

        @Override
        public void update(String namespace,
                           List<UpdateStatement> statements,
                           CommandOptions opts,
                           ResultCallback<Document> callback) {
            namespaces.add(namespace);
            updates.add(statements);
            options.add(opts);
            script.respond(callback);
        }

        @Override
        public void remove(String namespace,
                           List<DeleteStatement> statements,
                           CommandOptions opts,
                           ResultCallback<Document> callback) {
            namespaces.add(namespace);
            deletes.add(statements);
            options.add(opts);
            script.respond(callback);
        }

        @Override
        public void command(String database,
                            Document command,
                            CommandOptions opts,
                            ResultCallback<Document> callback) {
            commandDatabases.add(database);
            commands.add(command);
            options.add(opts);
            script.respond(callback);
        }

        @Override
        public String getAddress() {
            return address;
        }

        @Override
        public boolean supportsRetryableWrites() {
            return retryableWrites;
        }

        public int callCount() {
            return options.size();
        }
    }

    /**
     * A selector that always returns the same server and records the read
     * preferences it was asked for.
     */
    protected static class FakeSelector implements ServerSelector {
        private final Server server;
        public final List<ReadPreference> requests =
            Collections.synchronizedList(new ArrayList<>());

        public FakeSelector(Server server) {
            this.server = server;
        }

        @Override
        public CompletableFuture<Server> selectServer(
            ReadPreference readPreference) {
            requests.add(readPreference);
            return CompletableFuture.completedFuture(server);
        }
    }

    protected static class FakeCollection implements CollectionHandle {
        private final String dbName;
        private final String name;
        private volatile WriteConcern writeConcern;

        public FakeCollection(String dbName, String name) {
            this.dbName = dbName;
            this.name = name;
        }

        public FakeCollection setWriteConcern(WriteConcern wc) {
            this.writeConcern = wc;
            return this;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDatabaseName() {
            return dbName;
        }

        @Override
        public WriteConcern getWriteConcern() {
            return writeConcern;
        }
    }

    /**
     * A database that records the admin calls made on it.
     */
    protected static class FakeDatabase implements DatabaseHandle {
        private final String name;
        private volatile WriteConcern writeConcern;
        public final Script script = new Script();

        public final List<Document> adminCommands =
            Collections.synchronizedList(new ArrayList<>());
        public final List<CommandOptions> adminOptions =
            Collections.synchronizedList(new ArrayList<>());
        public final List<String> users =
            Collections.synchronizedList(new ArrayList<>());
        public final List<UserOptions> userOptions =
            Collections.synchronizedList(new ArrayList<>());

        public FakeDatabase(String name) {
            this.name = name;
        }

        public FakeDatabase setWriteConcern(WriteConcern wc) {
            this.writeConcern = wc;
            return this;
        }

        @Override
        public String getDatabaseName() {
            return name;
        }

        @Override
        public WriteConcern getWriteConcern() {
            return writeConcern;
        }

        @Override
        public void executeDbAdminCommand(Document command,
                                          CommandOptions options,
                                          ResultCallback<Document> callback) {
            adminCommands.add(command);
            adminOptions.add(options);
            script.respond(callback);
        }

        @Override
        public void addUser(String username,
                            String password,
                            UserOptions options,
                            ResultCallback<Document> callback) {
            users.add("add:" + username);
            userOptions.add(options);
            script.respond(callback);
        }

        @Override
        public void removeUser(String username,
                               UserOptions options,
                               ResultCallback<Document> callback) {
            users.add("remove:" + username);
            userOptions.add(options);
            script.respond(callback);
        }
    }
}
