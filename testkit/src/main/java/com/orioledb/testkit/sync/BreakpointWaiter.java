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

package com.orioledb.testkit.sync;

import com.orioledb.testkit.config.TestkitConfig;
import com.orioledb.testkit.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Waits for server processes to reach a stop event, a named breakpoint compiled into OrioleDB
 * test builds. A process blocked on a stop event lists itself in the {@code waiter_pids}
 * of {@code pg_stopevents()}.
 * <p>
 * There is no timeout. A pid that never blocks keeps the caller waiting until its thread is
 * interrupted.
 */
public class BreakpointWaiter {
    private static final Logger LOGGER = LoggerFactory.getLogger(BreakpointWaiter.class);
    private final TestkitConfig config;
    private final Poller poller;

    public BreakpointWaiter(TestkitConfig config) {
        this.config = config;
        this.poller = new Poller(config.pollInterval());
    }

    /**
     * Blocks until the process {@code pid} waits on a stop event of {@code node}.
     *
     * @param node the node
     * @param pid  the blocked backend or worker
     * @throws PollInterruptedException if the calling thread is interrupted
     */
    public void waitForStopEvent(Node node, long pid) {
        String query = String.format(config.stopEventsQuery(), pid);
        LOGGER.debug("Waiting for pid {} to block on a stop event of node '{}'", pid, node.getName());
        poller.until(() -> Poller.isTrue(node.execute(query)));
        LOGGER.debug("Pid {} is blocked on a stop event of node '{}'", pid, node.getName());
    }

    /**
     * Polls {@code pg_stat_activity} until a process of the given backend type shows up.
     *
     * @param node        the node
     * @param backendType e.g. {@code checkpointer}
     * @return pid of the first matching process
     */
    public long resolveWorkerPid(Node node, String backendType) {
        String query = String.format(
                "SELECT pid FROM pg_stat_activity WHERE backend_type = '%s'",
                backendType.replace("'", "''")
        );
        // the worker may not have started yet
        return poller.<Long>untilPresent(() -> {
            List<List<Object>> rows = node.execute(query);
            if (rows.isEmpty() || rows.get(0).isEmpty() || rows.get(0).get(0) == null) {
                return Optional.empty();
            }
            return Optional.of(((Number) rows.get(0).get(0)).longValue());
        });
    }

    public void waitForCheckpointerStopEvent(Node node) {
        waitForStopEvent(node, resolveWorkerPid(node, config.checkpointerBackendType()));
    }

    public void waitForBackgroundWriterStopEvent(Node node) {
        waitForStopEvent(node, resolveWorkerPid(node, config.backgroundWriterBackendType()));
    }
}
