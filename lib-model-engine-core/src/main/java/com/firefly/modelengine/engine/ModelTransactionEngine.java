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
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.PartialSuccessMode;
import com.firefly.modelengine.core.SafeExecuteResult;
import com.firefly.modelengine.core.VerifyResult;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.group.TransactionGroupManager;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.registry.OperationRegistry;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the engine for one {@link ResourceHandle}.
 * <p>
 * Bundles the registry, the transaction group session and the execution protocols:
 * - {@link #execute(Operation)}: one operation in its own scope
 * - {@link #runBatch(List, BatchPolicy)}: ordered batch under stop-on-error or continue-on-error
 * - {@link #safeExecute(Operation, String)}: commit on success, roll back otherwise
 * - {@link #verifyAndRollback(Operation, Operation, String)}: commit only when a post-condition holds
 * - {@link #executeWithUndo(Operation, String)}: one named undo step, checkpointed inside an active group
 * <p>
 * The engine is not thread-safe with respect to the resource; callers serialize access (see
 * {@link com.firefly.modelengine.dispatch.CommandDispatcher}).
 */
public class ModelTransactionEngine {
    private static final Logger log = LoggerFactory.getLogger(ModelTransactionEngine.class);

    private final ResourceHandle resource;
    private final OperationRegistry registry;
    private final TransactionGroupManager groups;
    private final BatchExecutor batchExecutor;
    private final GuardedExecutor guardedExecutor;
    private final BatchPolicy defaultBatchPolicy;
    private final PartialSuccessMode partialSuccessMode;

    public ModelTransactionEngine(ResourceHandle resource,
                                  OperationRegistry registry,
                                  FailureClassificationPolicy failurePolicy,
                                  EngineEvents events) {
        this(resource, registry, new TransactionGroupManager(resource, failurePolicy, events),
                failurePolicy, events, new BatchPolicy(BatchPolicy.DEFAULT_NAME, true, true), PartialSuccessMode.REPORT_FAILURE);
    }

    public ModelTransactionEngine(ResourceHandle resource,
                                  OperationRegistry registry,
                                  TransactionGroupManager groups,
                                  FailureClassificationPolicy failurePolicy,
                                  EngineEvents events,
                                  BatchPolicy defaultBatchPolicy,
                                  PartialSuccessMode partialSuccessMode) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.groups = Objects.requireNonNull(groups, "groups");
        OperationInvoker invoker = new OperationInvoker(events);
        this.batchExecutor = new BatchExecutor(registry, invoker, failurePolicy, events);
        this.guardedExecutor = new GuardedExecutor(registry, invoker, failurePolicy, events);
        this.defaultBatchPolicy = Objects.requireNonNull(defaultBatchPolicy, "defaultBatchPolicy");
        this.partialSuccessMode = Objects.requireNonNull(partialSuccessMode, "partialSuccessMode");
        log.info(JsonUtils.json(
                "model_event", "engine_ready",
                "model", resource.title(),
                "stopOnError", Boolean.toString(defaultBatchPolicy.stopOnError()),
                "isolateOperations", Boolean.toString(defaultBatchPolicy.isolateOperations()),
                "partialSuccess", partialSuccessMode.name()
        ));
    }

    public OperationResult execute(Operation operation) {
        return guardedExecutor.execute(resource, operation);
    }

    public BatchResult runBatch(List<Operation> operations) {
        return runBatch(operations, defaultBatchPolicy);
    }

    public BatchResult runBatch(List<Operation> operations, BatchPolicy policy) {
        return batchExecutor.run(resource, operations, policy != null ? policy : defaultBatchPolicy);
    }

    public SafeExecuteResult safeExecute(Operation operation, String displayName) {
        return guardedExecutor.safeExecute(resource, operation, displayName);
    }

    public VerifyResult verifyAndRollback(Operation main, Operation verify, String displayName) {
        return guardedExecutor.verifyAndRollback(resource, main, verify, displayName);
    }

    public OperationResult executeWithUndo(Operation operation, String undoName) {
        return guardedExecutor.executeWithUndo(resource, groups, operation, undoName);
    }

    public TransactionGroupManager groups() { return groups; }
    public OperationRegistry registry() { return registry; }
    public ResourceHandle resource() { return resource; }
    public BatchPolicy defaultBatchPolicy() { return defaultBatchPolicy; }
    public PartialSuccessMode partialSuccessMode() { return partialSuccessMode; }
}
