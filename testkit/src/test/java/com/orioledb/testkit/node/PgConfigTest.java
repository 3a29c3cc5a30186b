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

package com.orioledb.testkit.node;

import com.orioledb.testkit.common.TestkitException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PgConfigTest {

    @Test
    void shouldParseMajorVersion() {
        assertEquals(16, PgConfig.parseMajorVersion("PostgreSQL 16.2\n"));
        assertEquals(17, PgConfig.parseMajorVersion("PostgreSQL 17beta1"));
        assertEquals(13, PgConfig.parseMajorVersion("13.14"));
    }

    @Test
    void shouldRejectUnparseableVersion() {
        TestkitException exception = assertThrows(TestkitException.class, () -> PgConfig.parseMajorVersion("PostgreSQL devel"));
        assertEquals("Cannot parse PostgreSQL version: PostgreSQL devel", exception.getMessage());
    }
}
