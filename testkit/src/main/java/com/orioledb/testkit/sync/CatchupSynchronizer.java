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

import java.time.Duration;
import java.time.Instant;

/**
 * Waits until a replica has replayed everything its parent wrote and OrioleDB has finished
 * applying it. WAL replay alone is not enough, OrioleDB recovery workers apply the replayed
 * records asynchronously.
 */
public class CatchupSynchronizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatchupSynchronizer.class);
    private final TestkitConfig config;
    private final Poller poller;

    public CatchupSynchronizer(TestkitConfig config) {
        this.config = config;
        this.poller = new Poller(config.pollInterval());
    }

    /**
     * @param replica a started replica with a parent
     * @throws IllegalStateException    if the replica has no parent
     * @throws PollInterruptedException if the calling thread is interrupted
     */
    public void waitCatchup(Node replica) {
        Instant start = Instant.now();
        replica.catchup();
        String query = config.recoverySynchronizedQuery();
        poller.until(() -> Poller.isTrue(replica.execute(query)));
        LOGGER.atDebug().setMessage("Replica '{}' synchronized in {} ms").
                addArgument(replica.getName()).
                addArgument(Duration.between(start, Instant.now()).toMillis()).
                log();
    }
}
