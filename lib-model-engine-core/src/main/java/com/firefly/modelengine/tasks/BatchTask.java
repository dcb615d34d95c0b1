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

import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One queued operation of a {@link TaskBatch}. Mutable; only {@link TaskBatchManager} changes it.
 */
public class BatchTask {
    private final int id;
    private final String name;
    private final String description;
    private final Operation operation;

    private TaskStatus status = TaskStatus.PENDING;
    private int attempts;
    private OperationResult lastResult;
    private Instant startedAt;
    private Instant endedAt;

    public BatchTask(int id, String name, String description, Operation operation) {
        this.id = id;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.name = name == null || name.isBlank() ? operation.displayName() : name;
        this.description = description;
    }

    public int id() { return id; }
    public String name() { return name; }
    public String description() { return description; }
    public Operation operation() { return operation; }
    public TaskStatus status() { return status; }
    public int attempts() { return attempts; }
    public OperationResult lastResult() { return lastResult; }

    public long durationMillis() {
        if (startedAt == null || endedAt == null) return 0L;
        return Duration.between(startedAt, endedAt).toMillis();
    }

    public String errorMessage() {
        return lastResult == null ? null : lastResult.errorMessage().orElse(null);
    }

    void begin(Instant now) {
        status = TaskStatus.IN_PROGRESS;
        attempts++;
        startedAt = now;
        endedAt = null;
    }

    void finish(TaskStatus outcome, OperationResult result, Instant now) {
        status = outcome;
        lastResult = result;
        endedAt = now;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("name", name);
        m.put("method", operation.displayName());
        m.put("status", status.name());
        m.put("attempts", attempts);
        m.put("durationMs", durationMillis());
        m.put("error", errorMessage());
        return m;
    }
}
