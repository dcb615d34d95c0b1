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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.util.JsonUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outbound call shape: {@code {success, ...payload fields, error?}}. Serializes as a flat JSON object.
 */
public final class CommandResponse {
    private final Map<String, Object> fields;

    private CommandResponse(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static CommandResponse from(OperationResult result) {
        return new CommandResponse(result.toMap());
    }

    /** Build from a payload; {@code success} is put first, {@code error} is added only when given. */
    public static CommandResponse of(boolean success, Map<String, ?> payload, String error) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("success", success);
        if (payload != null) m.putAll(payload);
        if (error != null) m.put("error", error);
        return new CommandResponse(m);
    }

    public boolean success() {
        return Boolean.TRUE.equals(fields.get("success"));
    }

    public Optional<String> error() {
        Object e = fields.get("error");
        return e == null ? Optional.empty() : Optional.of(e.toString());
    }

    public Object get(String key) {
        return fields.get(key);
    }

    @JsonAnyGetter
    public Map<String, Object> fields() {
        return fields;
    }

    public String toJson() {
        return JsonUtils.write(this);
    }

    @Override
    public String toString() {
        return "CommandResponse" + fields;
    }
}
