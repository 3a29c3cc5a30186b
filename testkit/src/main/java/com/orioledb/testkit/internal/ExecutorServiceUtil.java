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

package com.orioledb.testkit.internal;

import com.orioledb.testkit.common.TestkitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

public final class ExecutorServiceUtil {
    public static final Duration DEFAULT_TERMINATION_TIMEOUT = Duration.ofSeconds(10);
    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {
    }

    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor) {
        return shutdownNowThenAwaitTermination(executor, DEFAULT_TERMINATION_TIMEOUT);
    }

    /**
     * Interrupts the running tasks of {@code executor} and waits for its threads to exit.
     * A task that ignores interrupts keeps its thread alive, the executor is then reported as not terminated.
     *
     * @param executor the executor, may be null
     * @param timeout  maximum time to wait
     * @return true if the executor terminated in time
     * @throws TestkitException if the waiting thread is interrupted
     */
    public static boolean shutdownNowThenAwaitTermination(ExecutorService executor, Duration timeout) {
        if (executor == null || executor.isTerminated()) {
            return true;
        }

        executor.shutdownNow();
        try {
            boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                LOGGER.warn("Executor did not terminate within {} ms", timeout.toMillis());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestkitException("Interrupted while waiting for executor termination", e);
        }
    }
}
