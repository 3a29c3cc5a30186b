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
import com.orioledb.testkit.config.TestkitConfig;
import com.orioledb.testkit.sync.Poller;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A PostgreSQL instance driven through {@code initdb} and {@code pg_ctl}.
 * <p>
 * Layout of the base directory:
 * <pre>
 * $base_dir/data                 data directory
 * $base_dir/logs/postgresql.log  server log
 * </pre>
 */
public class PostgresNode implements Node {
    public static final String DATA_DIR = "data";
    public static final String LOGS_DIR = "logs";
    public static final String LOG_FILE = "postgresql.log";
    public static final String CONF_FILE = "postgresql.conf";
    public static final String STANDBY_SIGNAL_FILE = "standby.signal";
    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresNode.class);

    // pg_ctl status exit codes
    private static final int PG_CTL_RUNNING = 0;
    private static final int PG_CTL_STOPPED = 3;

    private final String name;
    private final Path baseDir;
    private final int port;
    private final Node parent;
    private final TestkitConfig config;
    private final ProcessRunner runner;
    private final Poller poller;

    public PostgresNode(String name, Path baseDir, int port, @Nullable Node parent, TestkitConfig config) {
        this.name = name;
        this.baseDir = baseDir;
        this.port = port;
        this.parent = parent;
        this.config = config;
        this.runner = new ProcessRunner(config);
        this.poller = new Poller(config.pollInterval());
    }

    /**
     * Formats a configuration line. Strings are single-quoted, everything else is written as is.
     *
     * @param key   the setting
     * @param value its value
     * @return {@code key = value}
     */
    public static String configLine(String key, Object value) {
        if (value instanceof CharSequence) {
            String escaped = value.toString().replace("'", "''");
            return String.format("%s = '%s'", key, escaped);
        }
        return String.format("%s = %s", key, value);
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
        return baseDir.resolve(DATA_DIR);
    }

    public Path getLogFile() {
        return baseDir.resolve(LOGS_DIR).resolve(LOG_FILE);
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

    private void writeDefaultConfig() {
        appendConfigLine("");
        appendConfig("listen_addresses", config.host());
        appendConfig("port", port);
        appendConfig("fsync", "off");
        appendConfig("wal_level", "replica");
        appendConfig("max_wal_senders", 10);
        appendConfig("hot_standby", "on");
        appendConfig("log_line_prefix", "%m [%p] ");
    }

    @Override
    public void init() {
        Instant start = Instant.now();
        try {
            Files.createDirectories(baseDir.resolve(LOGS_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        runner.run("initdb", List.of(
                "-D", getDataDir().toString(),
                "-U", config.username(),
                "-A", "trust",
                "-E", "UTF8",
                "-N"
        ));
        writeDefaultConfig();
        LOGGER.info("Node '{}' initialized in {} ms", name, Duration.between(start, Instant.now()).toMillis());
    }

    @Override
    public void start() {
        Instant start = Instant.now();
        try {
            Files.createDirectories(baseDir.resolve(LOGS_DIR));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        try {
            runner.run("pg_ctl", List.of(
                    "-D", getDataDir().toString(),
                    "-l", getLogFile().toString(),
                    "-w", "start"
            ));
        } catch (ProcessFailedException e) {
            LOGGER.error("Node '{}' failed to start, see {}", name, getLogFile());
            throw e;
        }
        LOGGER.atInfo().setMessage("Node '{}' started on port {} in {} ms").
                addArgument(name).
                addArgument(port).
                addArgument(Duration.between(start, Instant.now()).toMillis()).
                log();
    }

    @Override
    public void stop() {
        runner.run("pg_ctl", List.of(
                "-D", getDataDir().toString(),
                "-m", "fast",
                "-w", "stop"
        ));
        LOGGER.info("Node '{}' stopped", name);
    }

    @Override
    public NodeStatus status() {
        ProcessResult result = runner.execute("pg_ctl", List.of("-D", getDataDir().toString(), "status"));
        return switch (result.exitCode()) {
            case PG_CTL_RUNNING -> NodeStatus.RUNNING;
            case PG_CTL_STOPPED -> NodeStatus.STOPPED;
            default -> NodeStatus.UNKNOWN;
        };
    }

    @Override
    public NodeConnection connect() {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setServerNames(new String[]{config.host()});
        dataSource.setPortNumbers(new int[]{port});
        dataSource.setDatabaseName(config.database());
        dataSource.setUser(config.username());
        dataSource.setApplicationName(name);
        try {
            return new JdbcNodeConnection(dataSource.getConnection());
        } catch (SQLException e) {
            throw new SqlExecutionException(null, e);
        }
    }

    @Override
    public List<List<Object>> execute(String sql) {
        try (NodeConnection connection = connect()) {
            return connection.execute(sql);
        }
    }

    @Override
    public void appendConfig(String key, Object value) {
        appendConfigLine(configLine(key, value));
    }

    @Override
    public void appendConfigLine(String line) {
        try {
            Files.writeString(
                    getDataDir().resolve(CONF_FILE),
                    line + System.lineSeparator(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void pollQueryUntil(String sql, Object expected) {
        poller.until(() -> {
            List<List<Object>> rows = execute(sql);
            return !rows.isEmpty() && !rows.get(0).isEmpty() && Objects.equals(rows.get(0).get(0), expected);
        });
    }

    /**
     * Waits until the parent reports, in {@code pg_stat_replication}, that this node has replayed the
     * parent's current WAL position. The node must stream with {@code application_name} set to its name.
     */
    @Override
    public void catchup() {
        if (parent == null) {
            throw new IllegalStateException("Node '" + name + "' has no parent to catch up with");
        }
        String lsn = String.valueOf(parent.execute("SELECT pg_current_wal_lsn()::text").get(0).get(0));
        String query = String.format(
                "SELECT '%s'::pg_lsn <= replay_lsn FROM pg_stat_replication WHERE application_name = '%s'",
                lsn, name.replace("'", "''")
        );
        LOGGER.debug("Node '{}' is catching up with '{}' at {}", name, parent.getName(), lsn);
        poller.until(() -> Poller.isTrue(parent.execute(query)));
    }

    @Override
    public void cleanup() {
        if (Files.exists(getDataDir()) && status() == NodeStatus.RUNNING) {
            stop();
        }
        try {
            Directories.deleteRecursively(baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOGGER.debug("Node '{}' removed {}", name, baseDir);
    }

    @Override
    public String toString() {
        return "PostgresNode{name='" + name + "', port=" + port + ", baseDir=" + baseDir + "}";
    }
}
