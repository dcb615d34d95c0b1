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

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.SafeExecuteResult;
import com.firefly.modelengine.core.VerifyPhase;
import com.firefly.modelengine.core.VerifyResult;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.group.TransactionGroupManager;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.registry.OperationDefinition;
import com.firefly.modelengine.registry.OperationRegistry;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.resource.ResourceScopes;
import com.firefly.modelengine.resource.ScopeGuard;

import java.util.Optional;

/**
 * Single-operation protocols that each own a private scope: safe execution, execute-then-verify and
 * execute-as-one-undo-step. Unresolved operation names and rejected parameters are reported without
 * opening a scope.
 */
public class GuardedExecutor {

    private final OperationRegistry registry;
    private final OperationInvoker invoker;
    private final FailureClassificationPolicy failurePolicy;
    private final EngineEvents events;

    public GuardedExecutor(OperationRegistry registry,
                           OperationInvoker invoker,
                           FailureClassificationPolicy failurePolicy,
                           EngineEvents events) {
        this.registry = registry;
        this.invoker = invoker;
        this.failurePolicy = failurePolicy;
        this.events = events != null ? events : EngineEvents.NO_OP;
    }

    /** Commit if the operation succeeds, roll back if it fails or throws. */
    public SafeExecuteResult safeExecute(ResourceHandle resource, Operation operation, String displayName) {
        String name = displayName == null || displayName.isBlank() ? operation.name() : displayName;
        Optional<OperationDefinition> definition = registry.resolve(operation.name());
        if (definition.isEmpty()) {
            return new SafeExecuteResult(name, operation.name(), invoker.unresolved(operation, name, -1), false);
        }
        OperationDefinition def = definition.get();
        Optional<OperationResult> invalid = invoker.checkParameters(def, operation, name, -1);
        if (invalid.isPresent()) {
            return new SafeExecuteResult(name, def.name(), invalid.get(), false);
        }
        try (ScopeGuard scope = ScopeGuard.open(resource, name, failurePolicy, events)) {
            OperationResult result = invoker.invoke(resource, def, operation, name, -1);
            if (!result.isSuccess()) {
                scope.rollback(result.errorMessage().orElse(result.errorKind().name()));
                return new SafeExecuteResult(name, def.name(), result, true);
            }
            try {
                scope.commit();
            } catch (ResourceException e) {
                return new SafeExecuteResult(name, def.name(), OperationResult.failure(ErrorKind.RESOURCE, e.getMessage()), true);
            }
            return new SafeExecuteResult(name, def.name(), result, false);
        }
    }

    /**
     * Run {@code main}, then {@code verify} against the mutated model, inside one scope.
     * The scope is committed only when both succeed.
     */
    public VerifyResult verifyAndRollback(ResourceHandle resource, Operation main, Operation verify, String displayName) {
        String name = displayName == null || displayName.isBlank() ? main.name() : displayName;
        Optional<OperationDefinition> mainDef = registry.resolve(main.name());
        if (mainDef.isEmpty()) {
            return VerifyResult.rejected(VerifyPhase.EXECUTION, invoker.unresolved(main, name, -1));
        }
        Optional<OperationDefinition> verifyDef = registry.resolve(verify.name());
        if (verifyDef.isEmpty()) {
            return VerifyResult.rejected(VerifyPhase.VERIFICATION, invoker.unresolved(verify, name, -1));
        }
        Optional<OperationResult> invalidMain = invoker.checkParameters(mainDef.get(), main, name, 0);
        if (invalidMain.isPresent()) {
            return VerifyResult.rejected(VerifyPhase.EXECUTION, invalidMain.get());
        }
        Optional<OperationResult> invalidVerify = invoker.checkParameters(verifyDef.get(), verify, name, 1);
        if (invalidVerify.isPresent()) {
            return VerifyResult.rejected(VerifyPhase.VERIFICATION, invalidVerify.get());
        }
        try (ScopeGuard scope = ScopeGuard.open(resource, name, failurePolicy, events)) {
            OperationResult mainResult = invoker.invoke(resource, mainDef.get(), main, name, 0);
            if (!mainResult.isSuccess()) {
                scope.rollback("main operation failed");
                return VerifyResult.executionFailed(mainResult);
            }
            OperationResult verifyResult = invoker.invoke(resource, verifyDef.get(), verify, name, 1);
            if (!verifyResult.isSuccess()) {
                scope.rollback("verification failed");
                return VerifyResult.verificationFailed(mainResult, verifyResult);
            }
            try {
                scope.commit();
            } catch (ResourceException e) {
                return VerifyResult.commitFailed(mainResult, verifyResult, OperationResult.failure(ErrorKind.RESOURCE, e.getMessage()));
            }
            return VerifyResult.complete(mainResult, verifyResult);
        }
    }

    /**
     * Run one operation as its own undo step named {@code undoName}, recording a checkpoint
     * {@code Execute: undoName} when a transaction group is active.
     */
    public OperationResult executeWithUndo(ResourceHandle resource,
                                           TransactionGroupManager groups,
                                           Operation operation,
                                           String undoName) {
        String name = undoName == null || undoName.isBlank() ? operation.name() : undoName;
        Optional<OperationDefinition> definition = registry.resolve(operation.name());
        if (definition.isEmpty()) {
            return invoker.unresolved(operation, name, -1);
        }
        Optional<OperationResult> invalid = invoker.checkParameters(definition.get(), operation, name, -1);
        if (invalid.isPresent()) {
            return invalid.get().with("undoName", name);
        }
        groups.checkpointIfActive("Execute: " + name);
        OperationResult result = ResourceScopes.requiresNew(resource, name, failurePolicy, events,
                () -> invoker.invoke(resource, definition.get(), operation, name, -1));
        return result.with("undoName", name);
    }

    /** Run one operation in a scope of its own, nested in the active group's scope when there is one. */
    public OperationResult execute(ResourceHandle resource, Operation operation) {
        Optional<OperationDefinition> definition = registry.resolve(operation.name());
        if (definition.isEmpty()) {
            return invoker.unresolved(operation, operation.name(), -1);
        }
        OperationDefinition def = definition.get();
        Optional<OperationResult> invalid = invoker.checkParameters(def, operation, def.name(), -1);
        if (invalid.isPresent()) {
            return invalid.get();
        }
        return ResourceScopes.requiresNew(resource, def.name(), failurePolicy, events,
                () -> invoker.invoke(resource, def, operation, def.name(), -1));
    }
}
