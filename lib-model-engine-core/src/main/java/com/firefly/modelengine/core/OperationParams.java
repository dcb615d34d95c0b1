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

import com.firefly.modelengine.util.JsonUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over the untyped parameter map that crosses the command boundary.
 * <p>
 * Handlers either pull single values through the typed accessors or convert the whole map into a
 * parameter record with {@link #as(Class)}. Both paths report problems through
 * {@link ParameterValidationException} so every handler shares one "missing/invalid field" error path.
 */
public final class OperationParams {
    private final Map<String, Object> values;

    public OperationParams(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    public static OperationParams empty() {
        return new OperationParams(Map.of());
    }

    public Map<String, Object> raw() {
        return values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Optional<String> getString(String key) {
        Object v = values.get(key);
        return v == null ? Optional.empty() : Optional.of(v.toString());
    }

    public String requireString(String key) {
        String s = getString(key).orElse(null);
        if (s == null || s.isBlank()) {
            throw new ParameterValidationException(key, key + " is required");
        }
        return s;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        throw new ParameterValidationException(key, key + " must be a boolean but was '" + s + "'");
    }

    public long requireLong(String key) {
        Object v = values.get(key);
        if (v == null) {
            throw new ParameterValidationException(key, key + " is required");
        }
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ParameterValidationException(key, key + " must be an integer but was '" + v + "'", e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ParameterValidationException(key, key + " must be a number but was '" + v + "'", e);
        }
    }

    /** Nested object parameter; an absent key yields an empty map. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object v = values.get(key);
        if (v == null) return Map.of();
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new ParameterValidationException(key, key + " must be an object");
    }

    /** Array parameter; an absent key yields an empty list. */
    public List<?> getList(String key) {
        Object v = values.get(key);
        if (v == null) return List.of();
        if (v instanceof List<?> l) return l;
        throw new ParameterValidationException(key, key + " must be an array");
    }

    /**
     * Convert the whole parameter map into a typed parameter object (usually a record).
     * A {@link ParameterValidationException} raised by the record's constructor is rethrown as is.
     */
    public <T> T as(Class<T> type) {
        try {
            return JsonUtils.mapper().convertValue(values, type);
        } catch (IllegalArgumentException e) {
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof ParameterValidationException pve) throw pve;
            }
            String detail = e.getMessage() != null ? e.getMessage().split("\n", 2)[0] : type.getSimpleName();
            throw new ParameterValidationException(null, "Invalid parameters for " + type.getSimpleName() + ": " + detail, e);
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
