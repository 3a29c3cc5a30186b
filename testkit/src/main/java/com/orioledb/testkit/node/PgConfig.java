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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Build information of the PostgreSQL installation, read from {@code pg_config}.
 */
public class PgConfig {
    private static final Pattern MAJOR_VERSION = Pattern.compile("\\d+");
    private final ProcessRunner runner;

    public PgConfig(TestkitConfig config) {
        this(new ProcessRunner(config));
    }

    PgConfig(ProcessRunner runner) {
        this.runner = runner;
    }

    /**
     * Extracts the major version from a {@code pg_config --version} line such as {@code PostgreSQL 16.2}.
     *
     * @param versionLine output of {@code pg_config --version}
     * @return the major version
     */
    public static int parseMajorVersion(String versionLine) {
        Matcher matcher = MAJOR_VERSION.matcher(versionLine);
        if (!matcher.find()) {
            throw new TestkitException("Cannot parse PostgreSQL version: " + versionLine.strip());
        }
        return Integer.parseInt(matcher.group());
    }

    public int majorVersion() {
        return parseMajorVersion(runner.run("pg_config", List.of("--version")).output());
    }

    /**
     * @return whether the server was configured with {@code --with-icu}
     */
    public boolean withIcu() {
        return runner.run("pg_config", List.of("--configure")).output().contains("--with-icu");
    }
}
