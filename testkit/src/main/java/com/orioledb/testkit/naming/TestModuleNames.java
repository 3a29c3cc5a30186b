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

public final class TestModuleNames {
    public static final String TEST_SUFFIX = "Test";

    private TestModuleNames() {
    }

    /**
     * Returns the short name of a test module: its simple class name without the {@code Test} suffix.
     * It prefixes the module's working directories.
     *
     * @param testClass the test class
     * @return e.g. {@code Checkpoint} for {@code CheckpointTest}
     */
    public static String shortName(Class<?> testClass) {
        return shortName(testClass.getSimpleName());
    }

    public static String shortName(String simpleName) {
        if (simpleName.endsWith(TEST_SUFFIX) && simpleName.length() > TEST_SUFFIX.length()) {
            return simpleName.substring(0, simpleName.length() - TEST_SUFFIX.length());
        }
        return simpleName;
    }
}
