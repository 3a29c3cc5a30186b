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

package com.orioledb.testkit.common.utils;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Decides which entries of a directory listing are skipped by {@link DirectoryCopier}.
 * <p>
 * The filter is invoked once for every directory visited during a copy. It receives the
 * directory being copied and the names of its entries, and returns the subset of those names
 * that must not be copied. Excluded directories are not descended into.
 */
@FunctionalInterface
public interface DirectoryFilter {

    /**
     * Copies everything.
     */
    DirectoryFilter NONE = (directory, names) -> Set.of();

    /**
     * Returns the names to exclude from the copy.
     *
     * @param directory the source directory being listed
     * @param names     the entry names of {@code directory}
     * @return the subset of {@code names} to skip, never {@code null}
     */
    Set<String> entriesToExclude(Path directory, List<String> names);
}
