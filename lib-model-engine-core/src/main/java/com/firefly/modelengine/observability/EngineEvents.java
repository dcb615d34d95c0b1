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


package com.firefly.modelengine.observability;

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.failure.FailureProcessingOutcome;
import com.firefly.modelengine.group.GroupState;

/**
 * Observability hook for scope, operation and transaction group lifecycle events.
 * Provide your own Spring bean of this type to export metrics/traces/logs.
 * A default logger-based implementation is provided: {@link EngineLoggerEvents}.
 *
 * Notes:
 * - {@code scope} is the name the scope was opened with (batch name, safe-execute display name, group name).
 * - {@code index} is the position of the operation in its batch, or -1 outside a batch.
 */
public interface EngineEvents {

    EngineEvents NO_OP = new EngineEvents() {};

    default void onScopeOpened(String scope, String scopeId, int depth) {}
    default void onScopeCommitted(String scope, String scopeId) {}
    default void onScopeRolledBack(String scope, String scopeId, String reason) {}
    default void onFailuresProcessed(String scope, FailureProcessingOutcome outcome) {}

    default void onOperationStarted(String scope, int index, String operation) {}
    default void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {}
    default void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {}
    default void onBatchCompleted(String batch, int succeeded, int failed, boolean rolledBack) {}

    default void onGroupStarted(String group) {}
    default void onCheckpoint(String group, String label, int checkpointCount) {}
    default void onGroupCompleted(String group, GroupState state, int checkpointCount) {}
}
