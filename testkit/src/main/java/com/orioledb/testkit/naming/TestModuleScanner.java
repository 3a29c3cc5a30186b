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

import com.orioledb.testkit.common.TestkitException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Discovers the sibling test modules of a test class: the compiled {@code *Test} classes of the same
 * package directory on the class path. Inner classes and the shared base module are left out.
 */
public final class TestModuleScanner {
    public static final String CLASS_FILE_SUFFIX = TestModuleNames.TEST_SUFFIX + ".class";

    private TestModuleScanner() {
    }

    /**
     * Lists the test module names found in {@code directory}.
     *
     * @param directory        directory of compiled test classes
     * @param sharedBaseModule simple name of the shared base class to leave out
     * @return sorted simple class names
     */
    public static List<String> scan(Path directory, String sharedBaseModule) {
        List<String> modules = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile).forEach(entry -> {
                String fileName = entry.getFileName().toString();
                if (!fileName.endsWith(CLASS_FILE_SUFFIX) || fileName.contains("$")) {
                    return;
                }
                String module = fileName.substring(0, fileName.length() - ".class".length());
                if (!module.equals(sharedBaseModule)) {
                    modules.add(module);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        modules.sort(String::compareTo);
        return modules;
    }

    /**
     * Locates the class file directory of {@code testClass} and scans it.
     *
     * @param testClass        a test class loaded from a directory
     * @param sharedBaseModule simple name of the shared base class to leave out
     * @return sorted simple class names, {@code testClass} included
     * @throws TestkitException if the class was not loaded from a directory
     */
    public static List<String> siblingsOf(Class<?> testClass, String sharedBaseModule) {
        URL location = testClass.getResource(testClass.getSimpleName() + ".class");
        if (location == null || !"file".equals(location.getProtocol())) {
            throw new TestkitException("Cannot locate the class file directory of " + testClass.getName() + ": " + location);
        }
        try {
            return scan(Path.of(location.toURI()).getParent(), sharedBaseModule);
        } catch (URISyntaxException e) {
            throw new TestkitException(e);
        }
    }
}
