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

package com.orioledb.testkit.executor;

import com.orioledb.testkit.common.TestkitException;

/**
 * Carries a failure raised by a statement on a background thread to the thread that joins it.
 * The original failure is the cause.
 */
public class ThreadPropagatedException extends TestkitException {

    public ThreadPropagatedException(Throwable cause) {
        super("Background statement failed: " + cause.getMessage(), cause);
    }
}
