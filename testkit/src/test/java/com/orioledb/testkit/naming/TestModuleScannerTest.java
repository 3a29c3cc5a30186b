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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TestModuleScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldListTestClassesOnly() throws IOException {
        for (String name : List.of("TrxTest.class", "CheckpointTest.class", "CheckpointTest$Worker.class",
                "BaseTest.class", "Helper.class", "NotesTest.txt")) {
            Files.writeString(tempDir.resolve(name), "");
        }
        Files.createDirectories(tempDir.resolve("NestedTest.class"));

        assertEquals(List.of("CheckpointTest", "TrxTest"), TestModuleScanner.scan(tempDir, "BaseTest"));
    }

    @Test
    void shouldFindSiblingsOnClassPath() {
        List<String> siblings = TestModuleScanner.siblingsOf(TestModuleScannerTest.class, "BaseTest");

        assertThat(siblings).
                contains("TestModuleScannerTest", "PortAllocatorTest", "WorkingDirectoriesTest").
                doesNotContain("PortAllocator").
                isSorted();
    }

    @Test
    void shouldExcludeSharedBaseModule() {
        List<String> siblings = TestModuleScanner.siblingsOf(TestModuleScannerTest.class, "PortAllocatorTest");
        assertFalse(siblings.contains("PortAllocatorTest"));
    }

    @Test
    void shouldRejectClassesOutsideDirectories() {
        assertThrows(TestkitException.class, () -> TestModuleScanner.siblingsOf(String.class, "BaseTest"));
    }
}
