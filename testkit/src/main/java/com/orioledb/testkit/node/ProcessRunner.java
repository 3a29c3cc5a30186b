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

import com.orioledb.testkit.common.TestkitException;
import com.orioledb.testkit.config.TestkitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the PostgreSQL command line utilities and collects their output.
 */
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private final Optional<Path> binDir;

    public ProcessRunner(TestkitConfig config) {
        this.binDir = config.pgBinDir();
    }

    /**
     * Resolves a utility against the configured binary directory, falls back to {@code PATH}.
     *
     * @param program name of the utility, e.g. {@code pg_ctl}
     * @return the executable path or bare name
     */
    public String resolve(String program) {
        return binDir.map(dir -> dir.resolve(program).toString()).orElse(program);
    }

    /**
     * Runs a utility and waits for it, whatever its exit code is.
     *
     * @param program name of the utility
     * @param args    its arguments
     * @return exit code and combined stdout/stderr
     */
    public ProcessResult execute(String program, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(resolve(program));
        command.addAll(args);

        LOGGER.debug("Running {}", command);
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        try {
            Process process = builder.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            return new ProcessResult(List.copyOf(command), exitCode, output);
        } catch (IOException e) {
            throw new TestkitException("Failed to run " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestkitException("Interrupted while running " + command, e);
        }
    }

    /**
     * Runs a utility and fails unless it exits with zero.
     *
     * @param program name of the utility
     * @param args    its arguments
     * @return the result of the successful run
     * @throws ProcessFailedException if the exit code is not zero
     */
    public ProcessResult run(String program, List<String> args) {
        ProcessResult result = execute(program, args);
        if (!result.succeeded()) {
            throw new ProcessFailedException(result);
        }
        return result;
    }
}
