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


package com.firefly.modelengine.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named operation invocation with its raw parameter map. Immutable once constructed.
 */
public record Operation(String name, Map<String, Object> params) {

    public Operation {
        Objects.requireNonNull(name, "name");
        // LinkedHashMap copy: caller JSON may legitimately carry null values
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Operation of(String name) {
        return new Operation(name, Map.of());
    }

    public static Operation of(String name, Map<String, ?> params) {
        return new Operation(name, params == null ? null : new LinkedHashMap<>(params));
    }

    /** Name for reports; a blank name shows as {@code (empty)}. */
    public String displayName() {
        return name.isBlank() ? "(empty)" : name;
    }

    public OperationParams typedParams() {
        return new OperationParams(params);
    }
}
