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

package com.orioledb.testkit.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Typed view of the {@code testkit} configuration tree.
 * <p>
 * Defaults come from {@code reference.conf}. Every getter reads the underlying {@link Config}, so
 * a TestkitConfig is as immutable as the Config it wraps.
 */
public class TestkitConfig {
    public static final String ROOT = "testkit";
    private final Config config;

    public TestkitConfig(Config config) {
        this.config = config;
    }

    public static TestkitConfig load() {
        return new TestkitConfig(ConfigFactory.load());
    }

    /**
     * Loads the given classpath resource with {@code reference.conf} as fallback.
     *
     * @param resourceName name of the resource, for example {@code test.conf}
     * @return the loaded configuration
     */
    public static TestkitConfig load(String resourceName) {
        return new TestkitConfig(ConfigFactory.load(resourceName));
    }

    public Config getConfig() {
        return config;
    }

    private String path(String key) {
        String path = ROOT + "." + key;
        if (!config.hasPath(path)) {
            throw new MissingConfigException(path + " is missing in configuration");
        }
        return path;
    }

    public int basePort() {
        return config.getInt(path("base_port"));
    }

    public Optional<Path> pgBinDir() {
        String dir = config.getString(path("pg_bin_dir"));
        if (dir.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Path.of(dir));
    }

    public String host() {
        return config.getString(path("host"));
    }

    public String username() {
        String username = config.getString(path("username"));
        if (username.isBlank()) {
            return System.getProperty("user.name");
        }
        return username;
    }

    public String database() {
        return config.getString(path("database"));
    }

    public Path tempDir() {
        String dir = config.getString(path("temp_dir"));
        if (dir.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        return Path.of(dir);
    }

    public Duration pollInterval() {
        return config.getDuration(path("poll_interval"));
    }

    public String sharedPreloadLibraries() {
        return config.getString(path("shared_preload_libraries"));
    }

    public String sharedBaseModule() {
        return config.getString(path("shared_base_module"));
    }

    public String backupBeginStatement() {
        return config.getString(path("backup.begin_statement"));
    }

    public String backupEndStatement() {
        return config.getString(path("backup.end_statement"));
    }

    public String lockFile() {
        return config.getString(path("backup.lock_file"));
    }

    public String walDirectory() {
        return config.getString(path("backup.wal_directory"));
    }

    public String labelFile() {
        return config.getString(path("backup.label_file"));
    }

    public String tablespaceMapFile() {
        return config.getString(path("backup.tablespace_map_file"));
    }

    public String provenanceFile() {
        return config.getString(path("branch.provenance_file"));
    }

    public String branchDataDirectory() {
        return config.getString(path("branch.data_directory"));
    }

    public List<String> branchKeptSuffixes() {
        return config.getStringList(path("branch.kept_suffixes"));
    }

    public String stopEventsQuery() {
        return config.getString(path("breakpoint.stop_events_query"));
    }

    public String checkpointerBackendType() {
        return config.getString(path("breakpoint.checkpointer_backend_type"));
    }

    public String backgroundWriterBackendType() {
        return config.getString(path("breakpoint.background_writer_backend_type"));
    }

    public String recoverySynchronizedQuery() {
        return config.getString(path("recovery.synchronized_query"));
    }
}
