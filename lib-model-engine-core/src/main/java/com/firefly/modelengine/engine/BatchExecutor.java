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


package com.firefly.modelengine.engine;

import com.firefly.modelengine.core.BatchPolicy;
import com.firefly.modelengine.core.BatchResult;
import com.firefly.modelengine.core.BatchResult.OperationOutcome;
import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.registry.OperationDefinition;
import com.firefly.modelengine.registry.OperationRegistry;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.resource.ResourceScopes;
import com.firefly.modelengine.resource.ScopeGuard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs an ordered list of operations inside one scope owned by the call.
 * <p>
 * Operations run strictly in list order on the calling thread. With
 * {@link BatchPolicy#isolateOperations()} each operation gets a nested scope: a failing one leaves no
 * partial effects, a succeeding one is committed into the batch scope. Under stop-on-error the first
 * failure rolls back the whole batch scope and the remaining operations never run.
 * <p>
 * Without isolation a resource fault or an unexpected exception cannot be contained, so it rolls the batch
 * back even when continuing on error.
 * <p>
 * An entry whose name does not resolve, blank names included, is recorded as a not-found outcome, and an
 * entry whose parameters fail the operation's check is recorded as a validation outcome. Neither opens a
 * sub-scope; both count as failures under the batch policy.
 */
public class BatchExecutor {

    private final OperationRegistry registry;
    private final OperationInvoker invoker;
    private final FailureClassificationPolicy failurePolicy;
    private final EngineEvents events;

    public BatchExecutor(OperationRegistry registry,
                         OperationInvoker invoker,
                         FailureClassificationPolicy failurePolicy,
                         EngineEvents events) {
        this.registry = registry;
        this.invoker = invoker;
        this.failurePolicy = failurePolicy;
        this.events = events != null ? events : EngineEvents.NO_OP;
    }

    public BatchResult run(ResourceHandle resource, List<Operation> operations, BatchPolicy policy) {
        String batchName = policy.name();
        if (operations == null || operations.isEmpty()) {
            return BatchResult.rejected(batchName, 0, OperationResult.validation("No operations provided"));
        }

        int total = operations.size();
        FailureClassificationPolicy scopePolicy = policy.continueOnWarning() == null
                ? failurePolicy
                : failurePolicy.withWarnings(policy.continueOnWarning());
        List<OperationOutcome> outcomes = new ArrayList<>(total);
        BatchResult result;
        try (ScopeGuard batch = ScopeGuard.open(resource, batchName, scopePolicy, events)) {
            OperationOutcome abortedAt = null;
            for (int i = 0; i < total; i++) {
                Operation op = operations.get(i) != null ? operations.get(i) : Operation.of("");
                OperationResult opResult = runOne(resource, op, batchName, i, policy, scopePolicy);
                OperationOutcome outcome = new OperationOutcome(i, op.displayName(), opResult);
                outcomes.add(outcome);
                if (outcome.result().isSuccess()) continue;
                if (policy.stopOnError() || !contained(outcome.result(), policy)) {
                    abortedAt = outcome;
                    break;
                }
            }
            if (abortedAt != null) {
                batch.rollback("Operation " + abortedAt.index() + " (" + abortedAt.name() + ") failed");
                result = BatchResult.rolledBackAt(batchName, total, outcomes, abortedAt);
            } else {
                result = commit(batch, batchName, total, outcomes);
            }
        }
        events.onBatchCompleted(batchName, result.succeededCount(), result.failedCount(), result.rolledBack());
        return result;
    }

    private OperationResult runOne(ResourceHandle resource, Operation op, String batchName, int index,
                                   BatchPolicy policy, FailureClassificationPolicy scopePolicy) {
        Optional<OperationDefinition> definition = registry.resolve(op.name());
        if (definition.isEmpty()) {
            return invoker.unresolved(op, batchName, index);
        }
        OperationDefinition def = definition.get();
        Optional<OperationResult> invalid = invoker.checkParameters(def, op, batchName, index);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        if (!policy.isolateOperations()) {
            return invoker.invoke(resource, def, op, batchName, index);
        }
        return ResourceScopes.requiresNew(resource, def.name(), scopePolicy, events,
                () -> invoker.invoke(resource, def, op, batchName, index));
    }

    private static boolean contained(OperationResult failed, BatchPolicy policy) {
        if (policy.isolateOperations()) return true;
        ErrorKind kind = failed.errorKind();
        return kind != ErrorKind.RESOURCE && kind != ErrorKind.EXCEPTION;
    }

    private static BatchResult commit(ScopeGuard batch, String batchName, int total, List<OperationOutcome> outcomes) {
        try {
            batch.commit();
            return BatchResult.committed(batchName, total, outcomes);
        } catch (ResourceException e) {
            return BatchResult.scopeFailed(batchName, total, outcomes, OperationResult.failure(ErrorKind.RESOURCE, e.getMessage()));
        }
    }
}
