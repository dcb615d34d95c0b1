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


package com.firefly.modelengine.group;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Labeled marker recorded inside an active transaction group. Purely observational.
 */
public record Checkpoint(String label, LocalDateTime timestamp) {

    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public Checkpoint {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Renders as {@code HH:mm:ss - label}. */
    public String render() {
        return TIME.format(timestamp) + " - " + label;
    }
}
