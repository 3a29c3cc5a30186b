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

package com.orioledb.testkit.node;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;

/**
 * A PostgreSQL server instance owned by a test.
 * <p>
 * A node owns its base directory exclusively. The data directory lives below it, see {@link #getDataDir()}.
 * Nodes spawned from a backup keep a reference to the node the backup was taken from.
 */
public interface Node {

    String getName();

    Path getBaseDir();

    Path getDataDir();

    int getPort();

    /**
     * @return the node this one was backed up or replicated from, {@code null} for a fresh node
     */
    @Nullable
    Node getParent();

    /**
     * Creates the data directory of a fresh node.
     */
    void init();

    void start();

    void stop();

    NodeStatus status();

    /**
     * Opens a new session. The caller owns the connection and must close it.
     *
     * @return a new connection
     */
    NodeConnection connect();

    /**
     * Runs a statement on a short-lived connection.
     *
     * @param sql the statement
     * @return the rows of the first result set
     */
    List<List<Object>> execute(String sql);

    /**
     * Appends {@code key = value} to the server configuration file.
     *
     * @param key   the setting
     * @param value the value, strings are quoted
     */
    void appendConfig(String key, Object value);

    void appendConfigLine(String line);

    /**
     * Runs {@code sql} on the node until the first column of its first row equals {@code expected}.
     *
     * @param sql      the query
     * @param expected the awaited value
     */
    void pollQueryUntil(String sql, Object expected);

    /**
     * Blocks until this replica has replayed everything its parent had written when the call was made.
     *
     * @throws IllegalStateException if the node has no parent
     */
    void catchup();

    /**
     * Stops the node if it is running and removes its base directory.
     */
    void cleanup();
}
