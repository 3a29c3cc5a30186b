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

import java.util.List;

/**
 * A session on a node. Statements run in auto-commit mode.
 */
public interface NodeConnection extends AutoCloseable {

    /**
     * Executes a statement and returns the rows of its first result set.
     *
     * @param sql the statement
     * @return the rows, empty when the statement returns no result set
     * @throws SqlExecutionException if the server rejects the statement
     */
    List<List<Object>> execute(String sql);

    @Override
    void close();
}
