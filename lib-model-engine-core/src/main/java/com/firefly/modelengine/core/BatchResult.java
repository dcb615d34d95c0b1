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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one batch run: per-operation outcomes in execution order plus aggregate counts.
 * Not retained by the engine after the call returns.
 */
public final class BatchResult {
    private final String batchName;
    private final int totalOperations;
    private final List<OperationOutcome> perOperation;
    private final int succeededCount;
    private final int failedCount;
    private final boolean rolledBack;
    private final boolean committed;
    private final String message;
    private final OperationResult scopeFailure; // batch-level failure (rejected, or commit refused), null otherwise

    public record OperationOutcome(int index, String name, OperationResult result) {}

    BatchResult(String batchName,
                int totalOperations,
                List<OperationOutcome> perOperation,
                boolean rolledBack,
                boolean committed,
                String message,
                OperationResult scopeFailure) {
        this.batchName = batchName;
        this.totalOperations = totalOperations;
        this.perOperation = List.copyOf(perOperation);
        int ok = 0;
        for (OperationOutcome o : perOperation) {
            if (o.result().isSuccess()) ok++;
        }
        this.succeededCount = ok;
        this.failedCount = perOperation.size() - ok;
        this.rolledBack = rolledBack;
        this.committed = committed;
        this.message = message;
        this.scopeFailure = scopeFailure;
    }

    public static BatchResult committed(String batchName, int total, List<OperationOutcome> outcomes) {
        long failed = outcomes.stream().filter(o -> !o.result().isSuccess()).count();
        String msg = failed == 0
                ? "Batch '" + batchName + "' completed successfully"
                : "Batch had " + failed + " failures";
        return new BatchResult(batchName, total, outcomes, false, true, msg, null);
    }

    /** Rolled back because the operation at {@code failing} failed under stop-on-error. */
    public static BatchResult rolledBackAt(String batchName, int total, List<OperationOutcome> outcomes, OperationOutcome failing) {
        String reason = failing.result().errorKind() == ErrorKind.EXCEPTION ? "threw exception" : "failed";
        String msg = "Operation " + failing.index() + " (" + failing.name() + ") " + reason + ": "
                + failing.result().errorMessage().orElse("") + ". Transaction rolled back.";
        return new BatchResult(batchName, total, outcomes, true, false, msg, null);
    }

    /** Rolled back because the resource refused to commit the batch scope. */
    public static BatchResult scopeFailed(String batchName, int total, List<OperationOutcome> outcomes, OperationResult failure) {
        String msg = "Batch '" + batchName + "' could not be committed: "
                + failure.errorMessage().orElse("") + ". Transaction rolled back.";
        return new BatchResult(batchName, total, outcomes, true, false, msg, failure);
    }

    /** Refused before any scope was opened (empty list, malformed entry). */
    public static BatchResult rejected(String batchName, int total, OperationResult failure) {
        String msg = "Batch '" + batchName + "' rejected: " + failure.errorMessage().orElse("");
        return new BatchResult(batchName, total, List.of(), false, false, msg, failure);
    }

    public String batchName() { return batchName; }
    public int totalOperations() { return totalOperations; }
    public List<OperationOutcome> perOperation() { return perOperation; }
    public int succeededCount() { return succeededCount; }
    public int failedCount() { return failedCount; }
    public boolean rolledBack() { return rolledBack; }
    public boolean committed() { return committed; }
    public String message() { return message; }
    public Optional<OperationResult> scopeFailure() { return Optional.ofNullable(scopeFailure); }

    /** Caller-facing success flag under the given reporting mode. */
    public boolean isSuccess(PartialSuccessMode mode) {
        if (!committed) return false;
        return failedCount == 0 || mode == PartialSuccessMode.REPORT_SUCCESS;
    }

    /** Ids reported by succeeded operations under the conventional id payload keys. */
    public List<Object> createdIds() {
        List<Object> ids = new ArrayList<>();
        for (OperationOutcome o : perOperation) {
            if (!o.result().isSuccess()) continue;
            Map<String, Object> p = o.result().payload();
            for (String key : List.of("wallId", "elementId", "instanceId")) {
                if (p.get(key) != null) {
                    ids.add(p.get(key));
                    break;
                }
            }
        }
        return ids;
    }

    public Map<String, Object> summary() {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("total", totalOperations);
        s.put("succeeded", succeededCount);
        s.put("failed", failedCount);
        s.put("rolledBack", rolledBack);
        return s;
    }
}
