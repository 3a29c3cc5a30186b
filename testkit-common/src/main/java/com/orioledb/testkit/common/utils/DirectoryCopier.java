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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Recursive directory copy with a per-directory exclusion callback.
 * <p>
 * Symbolic links are followed, the copy contains the linked content. Entries that disappear from
 * the source while the copy is running are skipped: a live data directory keeps creating and
 * removing temporary files and the copy must not fail because of them.
 */
public final class DirectoryCopier {
    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryCopier.class);

    private DirectoryCopier() {
    }

    /**
     * Copies {@code source} into {@code target}, which must not exist yet.
     *
     * @param source the directory to copy
     * @param target the destination directory, created by this call
     * @param filter decides which entries of each visited directory are skipped
     * @throws FileAlreadyExistsException if {@code target} already exists
     * @throws NotDirectoryException      if {@code source} is not a directory
     * @throws IOException                if any other I/O error occurs
     */
    public static void copyTree(Path source, Path target, DirectoryFilter filter) throws IOException {
        Objects.requireNonNull(filter, "filter cannot be null");
        if (!Files.isDirectory(source)) {
            throw new NotDirectoryException(source.toString());
        }
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        copyDirectory(source, target, filter, false);
    }

    /**
     * Copies every entry of {@code source} into {@code target}, replacing files that already exist.
     * Files present only in {@code target} are left untouched.
     *
     * @param source the directory to copy
     * @param target the destination directory, created if missing
     * @param filter decides which entries of each visited directory are skipped
     * @throws IOException if an I/O error occurs
     */
    public static void refreshTree(Path source, Path target, DirectoryFilter filter) throws IOException {
        Objects.requireNonNull(filter, "filter cannot be null");
        if (!Files.isDirectory(source)) {
            throw new NotDirectoryException(source.toString());
        }
        copyDirectory(source, target, filter, true);
    }

    private static List<String> list(Path directory) throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.forEach(entry -> names.add(entry.getFileName().toString()));
        }
        names.sort(String::compareTo);
        return names;
    }

    private static void copyDirectory(Path source, Path target, DirectoryFilter filter, boolean replaceExisting) throws IOException {
        List<String> names = list(source);
        Set<String> excluded = Objects.requireNonNullElse(filter.entriesToExclude(source, names), Set.of());

        Files.createDirectories(target);
        for (String name : names) {
            if (excluded.contains(name)) {
                continue;
            }

            Path from = source.resolve(name);
            Path to = target.resolve(name);
            try {
                BasicFileAttributes attrs = Files.readAttributes(from, BasicFileAttributes.class);
                if (attrs.isDirectory()) {
                    copyDirectory(from, to, filter, replaceExisting);
                } else if (replaceExisting) {
                    Files.copy(from, to, StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.copy(from, to, StandardCopyOption.COPY_ATTRIBUTES);
                }
            } catch (NoSuchFileException e) {
                if (!from.toString().equals(e.getFile())) {
                    throw e;
                }
                // Removed by the source after the listing
                LOGGER.debug("{} vanished during the copy, skipped", from);
            }
        }
    }
}
