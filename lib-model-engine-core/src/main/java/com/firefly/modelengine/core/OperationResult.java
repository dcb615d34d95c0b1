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
import java.util.Optional;

/**
 * Immutable outcome of a single operation invocation.
 * Expected failures (validation, not found, domain failures) are carried as values;
 * only unexpected faults are converted into {@link ErrorKind#EXCEPTION} by the executors.
 */
public final class OperationResult {
    private final boolean success;
    private final Map<String, Object> payload;
    private final String errorMessage; // null on success
    private final ErrorKind errorKind;

    private OperationResult(boolean success, Map<String, Object> payload, String errorMessage, ErrorKind errorKind) {
        this.success = success;
        this.payload = payload;
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
    }

    public static OperationResult success() {
        return new OperationResult(true, Map.of(), null, ErrorKind.NONE);
    }

    public static OperationResult success(Map<String, ?> payload) {
        return new OperationResult(true, copy(payload), null, ErrorKind.NONE);
    }

    public static OperationResult failure(ErrorKind kind, String message) {
        return failure(kind, message, Map.of());
    }

    public static OperationResult failure(ErrorKind kind, String message, Map<String, ?> payload) {
        Objects.requireNonNull(kind, "kind");
        if (kind == ErrorKind.NONE) {
            throw new IllegalArgumentException("A failed result needs an error kind other than NONE");
        }
        return new OperationResult(false, copy(payload), message != null ? message : kind.name(), kind);
    }

    public static OperationResult validation(String message) {
        return failure(ErrorKind.VALIDATION, message);
    }

    public static OperationResult notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    /** Result recorded when an operation name cannot be resolved. */
    public static OperationResult unknownOperation(String name) {
        return failure(ErrorKind.NOT_FOUND, "Method '" + name + "' not found");
    }

    /** Convert an unexpected fault raised by a handler. */
    public static OperationResult fromException(Throwable error) {
        String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return failure(ErrorKind.EXCEPTION, msg);
    }

    /** Copy of this result with one more payload entry. */
    public OperationResult with(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(payload);
        merged.put(key, value);
        return new OperationResult(success, Collections.unmodifiableMap(merged), errorMessage, errorKind);
    }

    public boolean isSuccess() { return success; }
    public Map<String, Object> payload() { return payload; }
    public Optional<String> errorMessage() { return Optional.ofNullable(errorMessage); }
    public ErrorKind errorKind() { return errorKind; }

    /** Typed payload accessor; empty when the key is missing or holds another type. */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> payloadValue(String key, Class<T> type) {
        Object v = payload.get(key);
        return type.isInstance(v) ? Optional.of((T) v) : Optional.empty();
    }

    /** Flatten into the {@code {success, ...payload, error?}} calling convention. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", success);
        out.putAll(payload);
        if (!success) {
            out.put("error", errorMessage);
            out.put("errorKind", errorKind.name());
        }
        return out;
    }

    private static Map<String, Object> copy(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    @Override
    public String toString() {
        return success
                ? "OperationResult{success, payload=" + payload + "}"
                : "OperationResult{" + errorKind + ": " + errorMessage + "}";
    }
}
