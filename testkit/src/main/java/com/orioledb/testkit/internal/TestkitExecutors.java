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

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public final class TestkitExecutors {

    private TestkitExecutors() {
    }

    /**
     * Creates a single-thread executor whose thread is a daemon, so a statement that never returns
     * does not keep the JVM alive after the test run.
     * <p>
     * The thread terminates after being idle for one second, there is no need to shut the
     * executor down once its last task has finished.
     *
     * @param nameFormat thread name format, e.g. {@code "testkit-query-%d"}
     * @return a new executor
     */
    public static ExecutorService newDaemonSingleThreadExecutor(String nameFormat) {
        ThreadFactory factory = new ThreadFactoryBuilder().
                setNameFormat(nameFormat).
                setDaemon(true).
                build();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                1,
                1,
                1,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
