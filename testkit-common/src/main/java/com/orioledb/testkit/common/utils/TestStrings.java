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

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generators of test payloads.
 */
public final class TestStrings {
    private static final int CHUNK_LENGTH = 21;
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private TestStrings() {
    }

    /**
     * Returns a deterministic ASCII string of {@code length} characters for the given id.
     * <p>
     * The string is the concatenation of the Base64 encoded MD5 digests of {@code "<id>-0"},
     * {@code "<id>-1"}, ... truncated to {@code length}. The same id always yields the same string.
     *
     * @param id     seed of the string
     * @param length length of the result
     * @return the generated string
     */
    @SuppressWarnings("deprecation")
    public static String md5Chunks(Object id, int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length cannot be negative: " + length);
        }
        StringBuilder result = new StringBuilder();
        for (int i = 0; i * CHUNK_LENGTH < length; i++) {
            byte[] digest = Hashing.md5().hashString(id + "-" + i, StandardCharsets.US_ASCII).asBytes();
            result.append(BaseEncoding.base64().encode(digest));
        }
        return result.substring(0, Math.min(length, result.length()));
    }

    /**
     * Returns a random alphanumeric string.
     *
     * @param size number of characters
     * @param seed seed of the generator, {@code null} or zero for a non-reproducible string
     * @return the generated string
     */
    public static String alphanumeric(int size, Long seed) {
        Random random = (seed == null || seed == 0) ? ThreadLocalRandom.current() : new Random(seed);
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
