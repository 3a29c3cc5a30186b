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

package com.orioledb.testkit.integration;

import com.orioledb.testkit.backup.Backup;
import com.orioledb.testkit.backup.HotBackupEngine;
import com.orioledb.testkit.common.utils.DirectoryFilter;
import com.orioledb.testkit.executor.ThreadPropagatedException;
import com.orioledb.testkit.executor.ThreadQueryExecutor;
import com.orioledb.testkit.junit.BaseNodeTest;
import com.orioledb.testkit.node.Node;
import com.orioledb.testkit.node.NodeConnection;
import com.orioledb.testkit.node.NodeStatus;
import com.orioledb.testkit.node.PgConfig;
import com.orioledb.testkit.node.SqlExecutionException;
import com.orioledb.testkit.sync.BreakpointWaiter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a PostgreSQL installation with OrioleDB, located by {@code TESTKIT_PG_BIN_DIR}.
 */
@EnabledIfEnvironmentVariable(named = "TESTKIT_PG_BIN_DIR", matches = ".+")
@Timeout(120)
class ReplicationIntegrationTest extends BaseNodeTest {

    @Test
    void shouldStartPrimaryNode() {
        node.start();

        assertEquals(NodeStatus.RUNNING, node.status());
        assertEquals(List.of(List.of(1)), node.execute("SELECT 1"));
        assertTrue(new PgConfig(config).majorVersion() >= 13);
    }

    @Test
    void shouldTakeOnlineBackup() {
        node.start();
        node.execute("CREATE EXTENSION IF NOT EXISTS orioledb");

        Backup backup = new HotBackupEngine(config).backup(node, getDirectories().newBackupDir(), DirectoryFilter.NONE);

        assertTrue(backup.getManifest().online());
        assertTrue(Files.exists(backup.getDataDir().resolve(config.labelFile())));
        assertFalse(Files.exists(backup.getDataDir().resolve(config.lockFile())));
    }

    @Test
    void shouldReplicateToReplica() {
        node.start();
        node.execute("CREATE EXTENSION IF NOT EXISTS orioledb");
        node.execute("CREATE TABLE o_test (id int PRIMARY KEY, value text) USING orioledb");

        node.execute("INSERT INTO o_test SELECT i, 'value' || i FROM generate_series(1, 50) i");

        Node replica = getReplica();
        replica.start();

        node.execute("INSERT INTO o_test SELECT i, 'value' || i FROM generate_series(51, 100) i");
        catchupOrioledb(replica);

        assertEquals(List.of(List.of(100L)), replica.execute("SELECT count(*) FROM o_test"));
        assertEquals(List.of(List.of(50L)), replica.execute("SELECT count(*) FROM o_test WHERE id <= 50"));
    }

    @Test
    void shouldBranchPrimary() {
        node.start();
        node.execute("CREATE EXTENSION IF NOT EXISTS orioledb");
        node.execute("CREATE TABLE o_test (id int PRIMARY KEY) USING orioledb");
        node.execute("INSERT INTO o_test SELECT generate_series(1, 10)");
        node.execute("CHECKPOINT");

        Node branch = getBranch();
        branch.start();

        assertEquals(List.of(List.of(10L)), branch.execute("SELECT count(*) FROM o_test"));
    }

    @Test
    void shouldPropagateBackgroundFailure() {
        node.start();

        try (NodeConnection connection = node.connect()) {
            ThreadQueryExecutor executor = ThreadQueryExecutor.start(connection, "SELECT * FROM missing_table");
            ThreadPropagatedException exception = assertThrows(ThreadPropagatedException.class, executor::join);
            assertInstanceOf(SqlExecutionException.class, exception.getCause());
            assertErrorMessageEquals(exception, "relation \"missing_table\" does not exist");
        }
    }

    @Test
    void shouldHoldCheckpointOnStopEvent() throws TimeoutException {
        node.appendConfigLine("orioledb.enable_stopevents = true");
        node.start();
        node.execute("CREATE EXTENSION IF NOT EXISTS orioledb");
        node.execute("CREATE TABLE o_test (id int PRIMARY KEY) USING orioledb");
        node.execute("INSERT INTO o_test SELECT generate_series(1, 1000)");
        node.execute("SELECT pg_stopevent_set('checkpoint_step', 'true')");

        try (NodeConnection connection = node.connect()) {
            ThreadQueryExecutor checkpoint = ThreadQueryExecutor.start(connection, "CHECKPOINT");
            new BreakpointWaiter(config).waitForCheckpointerStopEvent(node);
            assertFalse(checkpoint.isDone());

            node.execute("SELECT pg_stopevent_reset('checkpoint_step')");
            checkpoint.join(Duration.ofSeconds(60));
        }

        assertEquals(List.of(List.of(1000L)), node.execute("SELECT count(*) FROM o_test"));
    }
}
