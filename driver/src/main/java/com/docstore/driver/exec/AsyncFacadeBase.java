/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package com.docstore.driver.exec;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.docstore.driver.DriverConfig;
import com.docstore.driver.server.ServerSelector;
import com.docstore.driver.util.ConcurrentUtil;
import com.docstore.driver.util.LogUtil;

/**
 * State shared by the asynchronous facades: the task pool, the executor
 * built on it and the closed flag.
 */
abstract class AsyncFacadeBase implements AutoCloseable {

    private static final int cores =
        Runtime.getRuntime().availableProcessors();

    protected final OperationExecutor executor;
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    /* thread-pool for scheduling tasks */
    private final ScheduledExecutorService taskExecutor;

    protected AsyncFacadeBase(DriverConfig config, ServerSelector selector) {
        final Logger logger = getLogger(config);
        int numThreads = config.getNumThreads() > 0 ?
            config.getNumThreads() : cores;
        taskExecutor = new ScheduledThreadPoolExecutor(numThreads,
            new ThreadFactory() {
                private final AtomicInteger threadNumber = new AtomicInteger(1);
                @Override
                public Thread newThread(Runnable r) {
                    final Thread t = Executors.defaultThreadFactory()
                                              .newThread(r);
                    t.setName(String.format("docstore-task-executor-%s",
                                            threadNumber.getAndIncrement()));
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((thread, error) -> {
                        if (ConcurrentUtil.unwrapCompletionException(error)
                            instanceof RejectedExecutionException) {
                            /*
                             * Expected while the executor shuts down.
                             */
                            return;
                        }
                        logger.warning(() -> String.format(
                            "Uncaught exception from %s: %s",
                            error, LogUtil.getStackTrace(error)));
                    });
                    return t;
                }
            });
        executor = new OperationExecutor(logger, config, selector,
                                         taskExecutor);
    }

    /**
     * Returns the logger used for the driver. If no logger is specified
     * create one based on this class name.
     */
    private Logger getLogger(DriverConfig config) {
        if (config.getLogger() != null) {
            return config.getLogger();
        }

        /*
         * The default logger logs at INFO. If this is too verbose users
         * must create a logger and pass it in.
         */
        return Logger.getLogger(getClass().getName());
    }

    @Override
    public void close() {
        if (isClosed.compareAndSet(false, true)) {
            taskExecutor.shutdown();
        }
    }

    void checkClient() {
        if (isClosed.get()) {
            throw new IllegalStateException(
                getClass().getSimpleName() + " has been closed");
        }
    }

    /**
     * @hidden
     * For testing use
     */
    public OperationExecutor getExecutor() {
        return executor;
    }

    public ScheduledExecutorService getTaskExecutor() {
        return taskExecutor;
    }
}
