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

/**
 * Thrown when a server utility such as {@code initdb} or {@code pg_ctl} exits with a non-zero code.
 */
public class ProcessFailedException extends TestkitException {
    private final ProcessResult result;

    public ProcessFailedException(ProcessResult result) {
        super(String.format("Process %s failed with exit code %d:%n%s", result.command(), result.exitCode(), result.output()));
        this.result = result;
    }

    public ProcessResult getResult() {
        return result;
    }
}
