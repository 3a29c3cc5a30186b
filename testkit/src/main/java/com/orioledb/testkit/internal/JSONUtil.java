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

package com.orioledb.testkit.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the JSON files the harness leaves next to its working directories.
 * Files are pretty-printed so they can be read during a post-mortem, unknown properties are
 * ignored so files written by a newer harness still open.
 */
public final class JSONUtil {
    public static final ObjectMapper objectMapper = new ObjectMapper().
            enable(SerializationFeature.INDENT_OUTPUT).
            disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JSONUtil() {
    }

    /**
     * @param file      the JSON file
     * @param valueType type to bind to
     * @return the bound value
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws IOException                       if the file cannot be read or parsed
     */
    public static <T> T readFile(Path file, Class<T> valueType) throws IOException {
        return objectMapper.readValue(Files.readAllBytes(file), valueType);
    }

    public static void writeFile(Path file, Object value) throws IOException {
        Files.write(file, objectMapper.writeValueAsBytes(value));
    }
}
