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

package com.orioledb.testkit.sync;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Fixed-interval poll loop without a deadline.
 * <p>
 * The only way out of a condition that never holds is an interrupt of the polling thread,
 * normally delivered by the test framework's own timeout.
 */
public class Poller {
    private final Duration interval;

    public Poller(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    /**
     * Returns true if the first column of the first row is boolean {@code true}.
     *
     * @param rows result of a query
     * @return whether the query answered true
     */
    public static boolean isTrue(List<List<Object>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return false;
        }
        return Boolean.TRUE.equals(rows.get(0).get(0));
    }

    public Duration getInterval() {
        return interval;
    }

    private void pause() {
        try {
            TimeUnit.NANOSECONDS.sleep(interval.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PollInterruptedException("Interrupted while polling", e);
        }
    }

    /**
     * Evaluates {@code condition} until it returns true, sleeping one interval after every miss.
     *
     * @param condition the condition to wait for
     */
    public void until(BooleanSupplier condition) {
        while (!condition.getAsBoolean()) {
            pause();
        }
    }

    /**
     * Calls {@code supplier} until it returns a value.
     *
     * @param supplier produces an empty optional while the value is not available yet
     * @param <T>      type of the value
     * @return the first value produced
     */
    public <T> T untilPresent(Supplier<Optional<T>> supplier) {
        while (true) {
            Optional<T> value = supplier.get();
            if (value.isPresent()) {
                return value.get();
            }
            pause();
        }
    }
}
