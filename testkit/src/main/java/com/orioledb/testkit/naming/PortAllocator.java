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

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Derives ports from the name of a test module without any runtime coordination.
 * <p>
 * Every module gets {@code configuredBasePort + 2 * ordinal}, where the ordinal is the rank of the
 * module's name among its sorted siblings. Two modules of the same run therefore never share a
 * port. Adding or removing a module shifts the ports of the modules sorted after it, ports are
 * stable within a run, not across runs.
 */
public final class PortAllocator {
    public static final int PORTS_PER_MODULE = 2;

    private PortAllocator() {
    }

    /**
     * Returns the rank of {@code module} among the sorted, de-duplicated {@code siblings}.
     *
     * @param siblings names of all modules, {@code module} included
     * @param module   the module to rank
     * @return zero-based ordinal
     * @throws IllegalArgumentException if {@code module} is not one of {@code siblings}
     */
    public static int ordinal(Collection<String> siblings, String module) {
        List<String> sorted = List.copyOf(new TreeSet<>(siblings));
        int ordinal = sorted.indexOf(module);
        if (ordinal < 0) {
            throw new IllegalArgumentException("unknown test module: " + module);
        }
        return ordinal;
    }

    public static int basePort(int configuredBasePort, Collection<String> siblings, String module) {
        return configuredBasePort + PORTS_PER_MODULE * ordinal(siblings, module);
    }

    public static PortRange allocate(int configuredBasePort, Collection<String> siblings, String module) {
        return PortRange.of(basePort(configuredBasePort, siblings, module));
    }
}
