/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.orioledb.testkit.executor;

import com.orioledb.testkit.common.TestkitException;
import com.orioledb.testkit.internal.ExecutorServiceUtil;
import com.orioledb.testkit.internal.TestkitExecutors;
import com.orioledb.testkit.node.NodeConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single statement on a background thread, typically one that is expected to block on a
 * stop event while the test drives the server from its own connection.
 * <pre>{@code
 * ThreadQueryExecutor blocked = ThreadQueryExecutor.start(connection, "SELECT ...");
 * breakpointWaiter.waitForStopEvent(node, pid);
 * ...
 * List<List<Object>> rows = blocked.join();
 * }</pre>
 * The connection must not be used by another thread until the statement completes.
 */
public final class ThreadQueryExecutor {
    public static final String THREAD_NAME_FORMAT = "testkit-query-%d";
    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadQueryExecutor.class);
    private final String sql;
    private final ExecutorService executor;
    private final Future<List<List<Object>>> future;

    private ThreadQueryExecutor(NodeConnection connection, String sql) {
        this.sql = sql;
        this.executor = TestkitExecutors.newDaemonSingleThreadExecutor(THREAD_NAME_FORMAT);
        this.future = executor.submit(() -> connection.execute(sql));
        // runs the submitted statement, then lets the thread go
        executor.shutdown();
    }

    /**
     * Submits {@code sql} and returns immediately.
     *
     * @param connection the session to run the statement on
     * @param sql        the statement
     * @return a handle to join the statement
     */
    public static ThreadQueryExecutor start(NodeConnection connection, String sql) {
        LOGGER.debug("Running '{}' in the background", sql);
        return new ThreadQueryExecutor(connection, sql);
    }

    public String getSql() {
        return sql;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * Waits for the statement to complete.
     *
     * @return rows returned by the statement
     * @throws ThreadPropagatedException if the statement failed, the failure is the cause
     */
    public List<List<Object>> join() {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new ThreadPropagatedException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestkitException("Interrupted while joining '" + sql + "'", e);
        }
    }

    /**
     * Waits at most {@code timeout} for the statement to complete. The statement keeps running
     * when the wait expires.
     *
     * @param timeout maximum time to wait
     * @return rows returned by the statement
     * @throws TimeoutException          if the statement is still running
     * @throws ThreadPropagatedException if the statement failed
     */
    public List<List<Object>> join(Duration timeout) throws TimeoutException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new ThreadPropagatedException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestkitException("Interrupted while joining '" + sql + "'", e);
        }
    }

    /**
     * Interrupts the background thread and waits for it to terminate. A statement blocked inside
     * the server keeps running there until its session is closed.
     *
     * @return true if the thread terminated
     */
    public boolean cancel() {
        future.cancel(true);
        return ExecutorServiceUtil.shutdownNowThenAwaitTermination(executor);
    }
}
