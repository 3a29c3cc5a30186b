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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TestStringsTest {

    @Test
    void shouldGenerateSameStringForSameId() {
        assertEquals(TestStrings.md5Chunks(1, 100), TestStrings.md5Chunks(1, 100));
        assertEquals(TestStrings.md5Chunks("key", 3000), TestStrings.md5Chunks("key", 3000));
    }

    @Test
    void shouldGenerateDifferentStringsForDifferentIds() {
        assertNotEquals(TestStrings.md5Chunks(1, 50), TestStrings.md5Chunks(2, 50));
    }

    @Test
    void shouldStartWithEncodedDigestOfFirstChunk() {
        // base64(md5("1-0"))
        assertEquals("7KJpQbxRh9HimDlh7bbbtg==", TestStrings.md5Chunks(1, 24));
    }

    @Test
    void shouldConcatenateChunkDigests() {
        assertEquals("7KJpQbxRh9HimDlh7bbbtg==6mbAbB", TestStrings.md5Chunks(1, 30));
    }

    @Test
    void shouldHonorRequestedLength() {
        for (int length : new int[]{0, 1, 20, 21, 22, 24, 25, 100, 1001}) {
            assertEquals(length, TestStrings.md5Chunks("id", length).length());
        }
    }

    @Test
    void shouldExtendPrefixWhenLonger() {
        String shortString = TestStrings.md5Chunks(7, 30);
        String longString = TestStrings.md5Chunks(7, 300);
        assertTrue(longString.startsWith(shortString));
    }

    @Test
    void shouldRejectNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> TestStrings.md5Chunks(1, -1));
    }

    @Test
    void shouldGenerateReproducibleAlphanumericStringWithSeed() {
        String first = TestStrings.alphanumeric(64, 42L);
        assertEquals(first, TestStrings.alphanumeric(64, 42L));
        assertEquals(64, first.length());
        assertTrue(first.matches("[A-Za-z0-9]+"));
    }

    @Test
    void shouldGenerateAlphanumericStringWithoutSeed() {
        String value = TestStrings.alphanumeric(32, null);
        assertEquals(32, value.length());
        assertTrue(value.matches("[A-Za-z0-9]+"));
    }
}
