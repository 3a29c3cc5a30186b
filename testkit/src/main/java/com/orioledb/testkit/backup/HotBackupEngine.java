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

package com.orioledb.testkit.backup;

import com.orioledb.testkit.common.utils.DirectoryCopier;
import com.orioledb.testkit.common.utils.DirectoryFilter;
import com.orioledb.testkit.common.utils.Directories;
import com.orioledb.testkit.config.TestkitConfig;
import com.orioledb.testkit.node.Node;
import com.orioledb.testkit.node.NodeConnection;
import com.orioledb.testkit.node.NodeStatus;
import com.orioledb.testkit.node.PostgresNode;
import com.orioledb.testkit.node.SqlExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Takes file-level backups of a node's data directory.
 * <p>
 * A stopped node is copied as is. A running node is copied inside a backup bracket opened with the
 * configured begin statement and closed with the end statement on the same session, so the server
 * keeps the on-disk state recoverable while the files are read. The end statement runs on every
 * exit path once the begin statement succeeded, a failed copy never leaves the source in backup mode.
 * <p>
 * After the bracket is closed the WAL directory is copied again so that every segment up to the
 * end-of-backup record is complete in the copy, the label and tablespace map returned by the end
 * statement are written, and the server's lock file is removed. A fresh server would refuse to
 * start on a data directory that still holds the source's lock file.
 */
public class HotBackupEngine {
    public static final String BACKUP_DIR_PREFIX = "tgsb_";
    private static final Logger LOGGER = LoggerFactory.getLogger(HotBackupEngine.class);
    private final TestkitConfig config;

    public HotBackupEngine(TestkitConfig config) {
        this.config = config;
    }

    public Backup backup(Node source) {
        return backup(source, null, DirectoryFilter.NONE);
    }

    /**
     * Copies the data directory of {@code source} to {@code destinationDir/data}.
     *
     * @param source         the node to back up, running or stopped
     * @param destinationDir base directory of the backup, a temporary directory is created when {@code null}
     * @param filter         decides which entries of each visited directory are skipped
     * @return the backup
     * @throws BackupFailureException if the copy or one of the backup statements fails
     */
    public Backup backup(Node source, @Nullable Path destinationDir, DirectoryFilter filter) {
        Instant start = Instant.now();
        Path baseDir = prepareBaseDir(destinationDir);
        Path dataDir = baseDir.resolve(PostgresNode.DATA_DIR);

        boolean online = source.status() == NodeStatus.RUNNING;
        if (online) {
            List<List<Object>> stopResult = copyInBackupMode(source, dataDir, filter);
            finishOnlineCopy(source, dataDir, filter, stopResult);
        } else {
            try {
                DirectoryCopier.copyTree(source.getDataDir(), dataDir, filter);
            } catch (IOException e) {
                throw new BackupFailureException("Failed to copy " + source.getDataDir(), e);
            }
        }

        BackupManifest manifest = new BackupManifest(
                source.getName(),
                source.getDataDir().toAbsolutePath().toString(),
                source.getPort(),
                online,
                start.toEpochMilli()
        );
        Backup backup = new Backup(baseDir, manifest, source);
        try {
            backup.writeManifest();
        } catch (IOException e) {
            throw new BackupFailureException("Failed to write the backup manifest", e);
        }

        LOGGER.atInfo().setMessage("Backup of node '{}' taken into {} in {} ms, online = {}").
                addArgument(source.getName()).
                addArgument(baseDir).
                addArgument(Duration.between(start, Instant.now()).toMillis()).
                addArgument(online).
                log();
        return backup;
    }

    private Path prepareBaseDir(@Nullable Path destinationDir) {
        try {
            if (destinationDir == null) {
                return Directories.createTempDirectory(config.tempDir(), BACKUP_DIR_PREFIX);
            }
            return Files.createDirectories(destinationDir);
        } catch (IOException e) {
            throw new BackupFailureException("Failed to create the backup directory", e);
        }
    }

    /**
     * Opens a session, runs the begin statement, copies the data directory and runs the end statement.
     *
     * @return rows returned by the end statement
     */
    private List<List<Object>> copyInBackupMode(Node source, Path dataDir, DirectoryFilter filter) {
        try (NodeConnection connection = source.connect()) {
            try {
                connection.execute(config.backupBeginStatement());
            } catch (RuntimeException e) {
                throw new BackupFailureException("Failed to start backup on node '" + source.getName() + "'", e);
            }
            LOGGER.debug("Node '{}' is in backup mode", source.getName());

            BackupFailureException failure = null;
            Error error = null;
            List<List<Object>> stopResult = List.of();
            try {
                DirectoryCopier.copyTree(source.getDataDir(), dataDir, filter);
            } catch (IOException | RuntimeException e) {
                failure = new BackupFailureException("Failed to copy " + source.getDataDir(), e);
            } catch (Error e) {
                error = e;
                throw e;
            } finally {
                try {
                    stopResult = connection.execute(config.backupEndStatement());
                    LOGGER.debug("Node '{}' has left backup mode", source.getName());
                } catch (RuntimeException e) {
                    if (error != null) {
                        error.addSuppressed(e);
                    } else if (failure == null) {
                        failure = new BackupFailureException("Failed to stop backup on node '" + source.getName() + "'", e);
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }

            if (failure != null) {
                throw failure;
            }
            return stopResult;
        } catch (SqlExecutionException e) {
            // connect or close
            throw new BackupFailureException("Backup session on node '" + source.getName() + "' failed", e);
        }
    }

    @Nullable
    private static String column(List<List<Object>> rows, int index) {
        if (rows.isEmpty() || rows.get(0).size() <= index) {
            return null;
        }
        Object value = rows.get(0).get(index);
        if (value instanceof String text && !text.isEmpty()) {
            return text;
        }
        return null;
    }

    private void finishOnlineCopy(Node source, Path dataDir, DirectoryFilter filter, List<List<Object>> stopResult) {
        String walDirectory = config.walDirectory();
        Path sourceWal = source.getDataDir().resolve(walDirectory);
        try {
            boolean walExcluded = filter.entriesToExclude(source.getDataDir(), List.of(walDirectory)).contains(walDirectory);
            if (!walExcluded && Files.isDirectory(sourceWal)) {
                DirectoryCopier.refreshTree(sourceWal, dataDir.resolve(walDirectory), filter);
            }

            String label = column(stopResult, 0);
            if (label != null) {
                Files.writeString(dataDir.resolve(config.labelFile()), label, StandardCharsets.UTF_8);
            }
            String tablespaceMap = column(stopResult, 1);
            if (tablespaceMap != null) {
                Files.writeString(dataDir.resolve(config.tablespaceMapFile()), tablespaceMap, StandardCharsets.UTF_8);
            }

            Files.deleteIfExists(dataDir.resolve(config.lockFile()));
        } catch (IOException e) {
            throw new BackupFailureException("Failed to finalize the backup of node '" + source.getName() + "'", e);
        }
    }
}
