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

import com.orioledb.testkit.common.utils.Directories;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory node for unit tests. Statements are answered by a scripted responder and recorded
 * in order, file system operations work on a real directory.
 */
public class FakeNode implements Node {
    private final String name;
    private final Path baseDir;
    private final int port;
    private final Node parent;
    private final List<String> statements = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger catchupCalls = new AtomicInteger();
    private volatile Function<String, List<List<Object>>> responder = (sql) -> List.of();
    private volatile NodeStatus status = NodeStatus.STOPPED;
    private volatile int closedConnections;

    public FakeNode(String name, Path baseDir, int port, @Nullable Node parent) {
        this.name = name;
        this.baseDir = baseDir;
        this.port = port;
        this.parent = parent;
    }

    public static List<List<Object>> rows(Object... firstRow) {
        return List.of(List.of(firstRow));
    }

    public void setResponder(Function<String, List<List<Object>>> responder) {
        this.responder = responder;
    }

    public void setStatus(NodeStatus status) {
        this.status = status;
    }

    public List<String> getStatements() {
        synchronized (statements) {
            return List.copyOf(statements);
        }
    }

    public int getCatchupCalls() {
        return catchupCalls.get();
    }

    public int getClosedConnections() {
        return closedConnections;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public Path getDataDir() {
        return baseDir.resolve(PostgresNode.DATA_DIR);
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    @Nullable
    public Node getParent() {
        return parent;
    }

    /**
     * Creates a minimal data directory.
     */
    @Override
    public void init() {
        try {
            Files.createDirectories(getDataDir().resolve("global"));
            Files.writeString(getDataDir().resolve("PG_VERSION"), "16\n");
            Files.writeString(getDataDir().resolve("global/pg_control"), "control");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void start() {
        status = NodeStatus.RUNNING;
    }

    @Override
    public void stop() {
        status = NodeStatus.STOPPED;
    }

    @Override
    public NodeStatus status() {
        return status;
    }

    List<List<Object>> answer(String sql) {
        statements.add(sql);
        return responder.apply(sql);
    }

    @Override
    public NodeConnection connect() {
        return new NodeConnection() {
            @Override
            public List<List<Object>> execute(String sql) {
                return answer(sql);
            }

            @Override
            public void close() {
                closedConnections++;
            }
        };
    }

    @Override
    public List<List<Object>> execute(String sql) {
        return answer(sql);
    }

    @Override
    public void appendConfig(String key, Object value) {
        appendConfigLine(PostgresNode.configLine(key, value));
    }

    @Override
    public void appendConfigLine(String line) {
        try {
            Files.createDirectories(getDataDir());
            Files.writeString(getDataDir().resolve(PostgresNode.CONF_FILE), line + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String readConfig() throws IOException {
        return Files.readString(getDataDir().resolve(PostgresNode.CONF_FILE));
    }

    @Override
    public void pollQueryUntil(String sql, Object expected) {
        while (true) {
            List<List<Object>> rows = answer(sql);
            if (!rows.isEmpty() && Objects.equals(rows.get(0).get(0), expected)) {
                return;
            }
        }
    }

    @Override
    public void catchup() {
        if (parent == null) {
            throw new IllegalStateException("Node '" + name + "' has no parent to catch up with");
        }
        catchupCalls.incrementAndGet();
        statements.add("catchup");
    }

    @Override
    public void cleanup() {
        status = NodeStatus.STOPPED;
        try {
            Directories.deleteRecursively(baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
