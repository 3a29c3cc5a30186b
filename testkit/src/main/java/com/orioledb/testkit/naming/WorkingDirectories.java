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

package com.orioledb.testkit.naming;

import com.orioledb.testkit.common.utils.Directories;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Creates the working directories of a test module under a common root.
 * <p>
 * Directory names start with the module's short name, so leftovers of a failed run are easy to
 * attribute, and end with a random suffix, so repeated runs never collide:
 * <pre>
 * $root/Checkpoint_tgsn_8412352977   primary node
 * $root/Checkpoint_tgsb_1093377463   backup
 * $root/Checkpoint_tgsr_5518820914   node spawned from a backup
 * </pre>
 */
public class WorkingDirectories {
    public static final String PRIMARY_MARKER = "_tgsn_";
    public static final String BACKUP_MARKER = "_tgsb_";
    public static final String SPAWNED_MARKER = "_tgsr_";
    private final Path root;
    private final String moduleShortName;

    public WorkingDirectories(Path root, String moduleShortName) {
        this.root = root;
        this.moduleShortName = moduleShortName;
    }

    public Path getRoot() {
        return root;
    }

    public String getModuleShortName() {
        return moduleShortName;
    }

    private Path create(String marker) {
        try {
            return Directories.createTempDirectory(root, moduleShortName + marker);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Path newPrimaryDir() {
        return create(PRIMARY_MARKER);
    }

    public Path newBackupDir() {
        return create(BACKUP_MARKER);
    }

    public Path newSpawnedDir() {
        return create(SPAWNED_MARKER);
    }
}
