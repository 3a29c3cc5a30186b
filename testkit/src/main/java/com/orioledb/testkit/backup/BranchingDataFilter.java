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

package com.orioledb.testkit.backup;

import com.orioledb.testkit.common.utils.DirectoryFilter;
import com.orioledb.testkit.config.TestkitConfig;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Skips the bulk data of the engine's own data directory and keeps its control files.
 * <p>
 * Inside a directory named {@code orioledb_data} every entry is excluded unless its name ends with one of
 * the kept suffixes ({@code control}, {@code .xid}). All other directories are copied in full.
 */
public class BranchingDataFilter implements DirectoryFilter {
    private final String dataDirectory;
    private final List<String> keptSuffixes;

    public BranchingDataFilter(String dataDirectory, List<String> keptSuffixes) {
        this.dataDirectory = dataDirectory;
        this.keptSuffixes = List.copyOf(keptSuffixes);
    }

    public BranchingDataFilter(TestkitConfig config) {
        this(config.branchDataDirectory(), config.branchKeptSuffixes());
    }

    private boolean isKept(String name) {
        for (String suffix : keptSuffixes) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<String> entriesToExclude(Path directory, List<String> names) {
        Path fileName = directory.getFileName();
        if (fileName == null || !fileName.toString().equals(dataDirectory)) {
            return Set.of();
        }
        Set<String> excluded = new HashSet<>();
        for (String name : names) {
            if (!isKept(name)) {
                excluded.add(name);
            }
        }
        return excluded;
    }
}
