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

/**
 * Outcome of a safe execution: the inner operation result plus whether the private scope was rolled back.
 *
 * @param operationName display name the scope was opened with
 * @param method        resolved operation name
 * @param result        inner result (an exception is already converted)
 * @param wasRolledBack true when the scope was rolled back
 */
public record SafeExecuteResult(String operationName, String method, OperationResult result, boolean wasRolledBack) {

    public boolean isSuccess() {
        return result.isSuccess() && !wasRolledBack;
    }

    public String message() {
        if (isSuccess()) return "'" + operationName + "' completed successfully";
        if (!wasRolledBack) return "'" + operationName + "' failed";
        return result.errorKind() == ErrorKind.EXCEPTION
                ? "'" + operationName + "' threw exception and was rolled back"
                : "'" + operationName + "' failed and was rolled back";
    }
}
