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


package com.firefly.modelengine.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound call shape: {@code {method, params}}.
 */
public record CommandRequest(String method, Map<String, Object> params) {

    public CommandRequest {
        Objects.requireNonNull(method, "method");
        params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static CommandRequest of(String method) {
        return new CommandRequest(method, Map.of());
    }

    public static CommandRequest of(String method, Map<String, ?> params) {
        return new CommandRequest(method, params == null ? null : new LinkedHashMap<>(params));
    }
}
