/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.modelengine.tasks;

import java.util.Locale;

/**
 * What a task batch does when a task fails.
 */
public enum ErrorStrategy {
    /** Mark the task failed and pause the batch. */
    STOP_ON_ERROR,
    /** Mark the task failed, log it and move on. */
    LOG_AND_CONTINUE,
    /** Queue the task once more; a second failure marks it failed and the batch moves on. */
    RETRY_ONCE,
    /** Mark the task skipped and move on. */
    SKIP_AND_CONTINUE;

    /**
     * Lenient lookup accepting {@code RETRY_ONCE}, {@code retryOnce} or {@code retry-once}.
     *
     * @return {@code defaultValue} when {@code value} is null or blank
     * @throws IllegalArgumentException when {@code value} names no strategy
     */
    public static ErrorStrategy parse(String value, ErrorStrategy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String wanted = normalize(value);
        for (ErrorStrategy s : values()) {
            if (normalize(s.name()).equals(wanted)) return s;
        }
        throw new IllegalArgumentException("Unknown error strategy '" + value + "'");
    }

    private static String normalize(String s) {
        return s.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }
}
