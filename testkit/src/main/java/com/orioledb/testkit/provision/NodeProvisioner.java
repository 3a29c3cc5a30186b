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

package com.orioledb.testkit.provision;

import com.orioledb.testkit.backup.Backup;
import com.orioledb.testkit.common.utils.DirectoryCopier;
import com.orioledb.testkit.common.utils.DirectoryFilter;
import com.orioledb.testkit.config.TestkitConfig;
import com.orioledb.testkit.naming.PortRange;
import com.orioledb.testkit.naming.WorkingDirectories;
import com.orioledb.testkit.node.Node;
import com.orioledb.testkit.node.NodeFactory;
import com.orioledb.testkit.node.PostgresNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Turns a backup into a new node on the secondary port of a test module.
 * <p>
 * A replica streams from the node the backup was taken from. A branch is an independent primary
 * whose data directory carries a provenance file naming the source data directory, OrioleDB reads
 * the data files it left out of the copy from there.
 * <p>
 * Neither kind of node is started, the caller starts it after any further configuration.
 */
public class NodeProvisioner {
    public static final String GLOBAL_DIR = "global";
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeProvisioner.class);
    private final TestkitConfig config;
    private final NodeFactory nodeFactory;
    private final PortRange ports;
    private final WorkingDirectories directories;

    public NodeProvisioner(TestkitConfig config, NodeFactory nodeFactory, PortRange ports, WorkingDirectories directories) {
        this.config = config;
        this.nodeFactory = nodeFactory;
        this.ports = ports;
        this.directories = directories;
    }

    /**
     * Creates a streaming standby of the backup's source node.
     *
     * @param backup a backup with a live source node
     * @param name   name of the replica, also its {@code application_name} on the primary
     * @return the replica, not started
     * @throws ProvisionException if the backup is malformed, has no source or the port is taken
     */
    public Node spawnReplica(Backup backup, String name) {
        Node source = backup.getSource().orElseThrow(
                () -> new ProvisionException("Backup " + backup.getBaseDir() + " has no live source node to replicate from")
        );
        Node replica = spawn(backup, name, source);
        try {
            Files.createFile(replica.getDataDir().resolve(PostgresNode.STANDBY_SIGNAL_FILE));
        } catch (IOException e) {
            throw new ProvisionException("Failed to write " + PostgresNode.STANDBY_SIGNAL_FILE, e);
        }
        replica.appendConfig("primary_conninfo", primaryConninfo(name, source));
        LOGGER.info("Replica '{}' of node '{}' provisioned in {}", name, source.getName(), replica.getBaseDir());
        return replica;
    }

    /**
     * Creates an independent primary, a branch, from a backup taken with the branching filter.
     *
     * @param backup a backup, usually taken with {@link com.orioledb.testkit.backup.BranchingDataFilter}
     * @param name   name of the branch
     * @return the branch, not started
     * @throws ProvisionException if the backup is malformed or the port is taken
     */
    public Node spawnPrimary(Backup backup, String name) {
        Node branch = spawn(backup, name, backup.getSource().orElse(null));
        Path provenance = branch.getDataDir().resolve(config.provenanceFile());
        try {
            Files.writeString(provenance, backup.getManifest().sourceDataDir() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProvisionException("Failed to write " + provenance, e);
        }
        LOGGER.atInfo().setMessage("Branch '{}' of {} provisioned in {}").
                addArgument(name).
                addArgument(backup.getManifest().sourceDataDir()).
                addArgument(branch.getBaseDir()).
                log();
        return branch;
    }

    String primaryConninfo(String name, Node source) {
        return String.format("application_name=%s port=%d user=%s host=%s",
                name, source.getPort(), config.username(), config.host());
    }

    private void validate(Backup backup) {
        Path dataDir = backup.getDataDir();
        if (!Files.isDirectory(dataDir)) {
            throw new ProvisionException("Malformed backup, data directory is missing: " + dataDir);
        }
        if (!Files.isDirectory(dataDir.resolve(GLOBAL_DIR))) {
            throw new ProvisionException("Malformed backup, " + GLOBAL_DIR + " directory is missing: " + dataDir);
        }
    }

    private Node spawn(Backup backup, String name, @Nullable Node parent) {
        validate(backup);

        int port = ports.secondary();
        if (PortProbe.isBound(config.host(), port)) {
            throw new ProvisionException("Port " + port + " is already in use on " + config.host());
        }

        Path baseDir = directories.newSpawnedDir();
        try {
            DirectoryCopier.copyTree(backup.getDataDir(), baseDir.resolve(PostgresNode.DATA_DIR), DirectoryFilter.NONE);
        } catch (IOException e) {
            throw new ProvisionException("Failed to copy backup " + backup.getBaseDir(), e);
        }

        Node node = nodeFactory.newNode(name, baseDir, port, parent);
        node.appendConfigLine("");
        node.appendConfig("port", port);
        return node;
    }
}
