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

import com.orioledb.testkit.config.TestConfigs;
import com.orioledb.testkit.config.TestkitConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessRunnerTest {
    private final TestkitConfig config = TestConfigs.of(Map.of("testkit.pg_bin_dir", ""));

    @Test
    void shouldResolveAgainstPathWithoutBinDir() {
        assertEquals("pg_ctl", new ProcessRunner(config).resolve("pg_ctl"));
    }

    @Test
    void shouldResolveAgainstConfiguredBinDir() {
        ProcessRunner runner = new ProcessRunner(TestConfigs.of(Map.of("testkit.pg_bin_dir", "/opt/pg/bin")));
        assertEquals(Path.of("/opt/pg/bin", "pg_ctl").toString(), runner.resolve("pg_ctl"));
    }

    @Test
    void shouldCollectExitCodeAndOutput() {
        ProcessResult result = new ProcessRunner(config).execute("sh", List.of("-c", "echo out; echo err 1>&2; exit 3"));

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
        assertEquals(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), result.command());
    }

    @Test
    void shouldFailOnNonZeroExitCode() {
        ProcessFailedException exception = assertThrows(
                ProcessFailedException.class,
                () -> new ProcessRunner(config).run("sh", List.of("-c", "exit 1"))
        );
        assertEquals(1, exception.getResult().exitCode());
    }

    @Test
    void shouldReturnResultOnSuccess() {
        ProcessResult result = new ProcessRunner(config).run("sh", List.of("-c", "echo PostgreSQL 16.2"));
        assertEquals(16, PgConfig.parseMajorVersion(result.output()));
    }
}
