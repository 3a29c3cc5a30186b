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

import java.sql.SQLException;

/**
 * Thrown when a statement or a connection attempt fails. The cause is the driver's {@link SQLException}.
 */
public class SqlExecutionException extends TestkitException {
    private final String sql;

    public SqlExecutionException(String sql, SQLException cause) {
        super(cause.getMessage(), cause);
        this.sql = sql;
    }

    /**
     * @return the failed statement, {@code null} for connection failures
     */
    public String getSql() {
        return sql;
    }

    public String getSQLState() {
        return ((SQLException) getCause()).getSQLState();
    }
}
