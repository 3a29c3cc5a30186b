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

import com.orioledb.testkit.common.TestkitException;
import com.orioledb.testkit.internal.JSONUtil;
import com.orioledb.testkit.node.Node;
import com.orioledb.testkit.node.PostgresNode;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * An immutable copy of a node's data directory.
 * <pre>
 * $base_dir/data         copied data directory
 * $base_dir/backup.json  manifest
 * </pre>
 * Nothing writes to a backup once it has been created, any number of nodes can be spawned from it.
 */
public final class Backup {
    public static final String MANIFEST_FILE = "backup.json";
    private final Path baseDir;
    private final BackupManifest manifest;
    private final Node source;

    Backup(Path baseDir, BackupManifest manifest, @Nullable Node source) {
        this.baseDir = baseDir;
        this.manifest = manifest;
        this.source = source;
    }

    /**
     * Opens a backup directory written earlier. The returned backup has no live source node.
     *
     * @param baseDir the backup directory
     * @return the backup
     * @throws TestkitException if the manifest is missing or unreadable
     */
    public static Backup open(Path baseDir) {
        Path manifestFile = baseDir.resolve(MANIFEST_FILE);
        try {
            BackupManifest manifest = JSONUtil.readFile(manifestFile, BackupManifest.class);
            return new Backup(baseDir, manifest, null);
        } catch (NoSuchFileException e) {
            throw new TestkitException("No backup manifest found in " + baseDir, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    void writeManifest() throws IOException {
        JSONUtil.writeFile(baseDir.resolve(MANIFEST_FILE), manifest);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path getDataDir() {
        return baseDir.resolve(PostgresNode.DATA_DIR);
    }

    public BackupManifest getManifest() {
        return manifest;
    }

    /**
     * @return the node the backup was taken from, empty for backups reopened from disk
     */
    public Optional<Node> getSource() {
        return Optional.ofNullable(source);
    }

    @Override
    public String toString() {
        return "Backup{source='" + manifest.sourceName() + "', baseDir=" + baseDir + ", online=" + manifest.online() + "}";
    }
}
