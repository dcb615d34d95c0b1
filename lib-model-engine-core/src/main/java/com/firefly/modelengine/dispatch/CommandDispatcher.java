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

import com.firefly.modelengine.core.BatchPolicy;
import com.firefly.modelengine.core.BatchResult;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.ParameterValidationException;
import com.firefly.modelengine.core.SafeExecuteResult;
import com.firefly.modelengine.core.VerifyResult;
import com.firefly.modelengine.engine.LogPreview;
import com.firefly.modelengine.engine.ModelTransactionEngine;
import com.firefly.modelengine.group.TransactionGroupManager;
import com.firefly.modelengine.registry.OperationDefinition;
import com.firefly.modelengine.tasks.ErrorStrategy;
import com.firefly.modelengine.tasks.TaskBatchManager;
import com.firefly.modelengine.tasks.TaskBatchManager.TaskSpec;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Inbound boundary: turns {@code {method, params}} requests into engine calls and results into
 * {@code {success, ...payload, error?}} responses.
 * <p>
 * {@link #dispatch(CommandRequest)} serializes all work on one dedicated single-threaded scheduler, the
 * model thread, so requests never interleave on the resource. {@link #dispatchNow(CommandRequest)} runs on
 * the caller and is meant for hosts that already own such a thread.
 * <p>
 * Transaction control, orchestration and task-batch commands are built in and matched before the registry;
 * any other method is resolved through the registry and runs standalone in its own scope.
 */
public class CommandDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final Set<String> BUILT_IN_COMMANDS = Set.of(
            "startTransactionGroup",
            "commitTransactionGroup",
            "rollbackTransactionGroup",
            "addCheckpoint",
            "getTransactionStatus",
            "getUndoHistory",
            "executeWithUndo",
            "batchExecute",
            "safeExecute",
            "verifyAndRollback",
            "listOperations",
            "createBatch",
            "loadBatch",
            "executeNextTask",
            "executeAllTasks",
            "pauseBatch",
            "resumeBatch",
            "getBatchStatus"
    );

    private final ModelTransactionEngine engine;
    private final TaskBatchManager tasks;
    private final Scheduler modelThread;
    private final int previewLength;
    private volatile boolean shadowingChecked = false;

    public CommandDispatcher(ModelTransactionEngine engine) {
        this(engine, new TaskBatchManager(engine), "model-dispatch", 200);
    }

    public CommandDispatcher(ModelTransactionEngine engine, TaskBatchManager tasks, String threadName, int previewLength) {
        this.engine = engine;
        this.tasks = tasks;
        this.modelThread = Schedulers.newSingle(threadName == null || threadName.isBlank() ? "model-dispatch" : threadName);
        this.previewLength = previewLength;
    }

    public Mono<CommandResponse> dispatch(CommandRequest request) {
        return Mono.fromCallable(() -> dispatchNow(request))
                .subscribeOn(modelThread);
    }

    public CommandResponse dispatchNow(CommandRequest request) {
        warnShadowedOperations();
        long start = System.currentTimeMillis();
        CommandResponse response;
        try {
            response = route(request.method(), new OperationParams(request.params()));
        } catch (ParameterValidationException e) {
            response = CommandResponse.from(OperationResult.validation(e.getMessage()).with("parameter", e.parameter()));
        } catch (RuntimeException e) {
            log.error("Command '{}' failed unexpectedly", request.method(), e);
            response = CommandResponse.from(OperationResult.fromException(e));
        }
        if (log.isDebugEnabled()) {
            log.debug(JsonUtils.json(
                    "model_event", "command_completed",
                    "method", request.method(),
                    "success", Boolean.toString(response.success()),
                    "latencyMs", Long.toString(System.currentTimeMillis() - start),
                    "response_preview", LogPreview.preview(response.fields(), previewLength)
            ));
        }
        return response;
    }

    private CommandResponse route(String method, OperationParams params) {
        TransactionGroupManager groups = engine.groups();
        switch (method.toLowerCase(Locale.ROOT)) {
            case "starttransactiongroup":
                return CommandResponse.from(groups.start(params.getString("name").orElse(null)));
            case "committransactiongroup":
                return CommandResponse.from(groups.commit());
            case "rollbacktransactiongroup":
                return CommandResponse.from(groups.rollback());
            case "addcheckpoint":
                return CommandResponse.from(groups.checkpoint(params.getString("name").orElse(null)));
            case "gettransactionstatus":
                return CommandResponse.of(true, groups.status().toMap(), null);
            case "getundohistory":
                return CommandResponse.of(true, groups.undoHistory(), null);
            case "executewithundo":
                return CommandResponse.from(engine.executeWithUndo(
                        Operation.of(params.requireString("method"), params.getMap("params")),
                        params.getString("undoName").orElse(null)));
            case "batchexecute":
                return batchExecute(params);
            case "safeexecute":
                return safeExecute(params);
            case "verifyandrollback":
                return verifyAndRollback(params);
            case "listoperations":
                return listOperations();
            case "createbatch":
                return createBatch(params);
            case "loadbatch":
                return CommandResponse.from(tasks.load(params.requireString("batchId")));
            case "executenexttask":
                return CommandResponse.from(tasks.executeNext());
            case "executealltasks":
                return CommandResponse.from(tasks.executeAll());
            case "pausebatch":
                return CommandResponse.from(tasks.pause());
            case "resumebatch":
                return CommandResponse.from(tasks.resume());
            case "getbatchstatus":
                return CommandResponse.from(tasks.status());
            default:
                return CommandResponse.from(engine.execute(Operation.of(method, params.raw())));
        }
    }

    private CommandResponse batchExecute(OperationParams params) {
        BatchPolicy defaults = engine.defaultBatchPolicy();
        BatchPolicy policy = new BatchPolicy(
                params.getString("batchName").orElse(defaults.name()),
                params.getBoolean("stopOnError", defaults.stopOnError()),
                defaults.isolateOperations(),
                params.has("continueOnWarning") ? params.getBoolean("continueOnWarning", true) : null);
        BatchResult result = engine.runBatch(parseOperations(params.getList("operations")), policy);

        List<Map<String, Object>> results = new ArrayList<>();
        for (BatchResult.OperationOutcome o : result.perOperation()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", o.index());
            entry.put("method", o.name());
            entry.putAll(o.result().toMap());
            results.add(entry);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchName", result.batchName());
        payload.put("summary", result.summary());
        payload.put("results", results);
        payload.put("committed", result.committed());
        payload.put("createdElementIds", result.createdIds());
        payload.put("message", result.message());
        boolean success = result.isSuccess(engine.partialSuccessMode());
        result.scopeFailure().ifPresent(f -> payload.put("errorKind", f.errorKind().name()));
        return CommandResponse.of(success, payload, success ? null : result.message());
    }

    private static List<Operation> parseOperations(List<?> raw) {
        List<Operation> operations = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            if (!(raw.get(i) instanceof Map<?, ?> entry)) {
                throw new ParameterValidationException("operations", "Operation " + i + " must be an object");
            }
            OperationParams op = new OperationParams(stringKeys(entry));
            operations.add(Operation.of(op.getString("method").orElse(""), op.getMap("params")));
        }
        return operations;
    }

    private CommandResponse createBatch(OperationParams params) {
        ErrorStrategy strategy;
        try {
            strategy = ErrorStrategy.parse(params.getString("onError").orElse(null), null);
        } catch (IllegalArgumentException e) {
            throw new ParameterValidationException("onError", e.getMessage(), e);
        }
        List<?> raw = params.getList("tasks");
        List<TaskSpec> specs = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            if (!(raw.get(i) instanceof Map<?, ?> entry)) {
                throw new ParameterValidationException("tasks", "Task " + i + " must be an object");
            }
            OperationParams task = new OperationParams(stringKeys(entry));
            specs.add(new TaskSpec(
                    task.getString("name").orElse(null),
                    task.getString("description").orElse(null),
                    Operation.of(task.getString("method").orElse(""), task.getMap("params"))));
        }
        return CommandResponse.from(tasks.create(
                params.getString("batchId").orElse(null),
                params.getString("name").orElse(null),
                params.getString("description").orElse(null),
                strategy,
                specs));
    }

    private CommandResponse safeExecute(OperationParams params) {
        SafeExecuteResult result = engine.safeExecute(
                Operation.of(params.requireString("method"), params.getMap("params")),
                params.getString("operationName").orElse(null));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operationName", result.operationName());
        payload.put("method", result.method());
        payload.put("result", result.result().toMap());
        payload.put("wasRolledBack", result.wasRolledBack());
        payload.put("message", result.message());
        return CommandResponse.of(result.isSuccess(), payload,
                result.isSuccess() ? null : result.result().errorMessage().orElse(result.message()));
    }

    private CommandResponse verifyAndRollback(OperationParams params) {
        VerifyResult result = engine.verifyAndRollback(
                Operation.of(params.requireString("method"), params.getMap("params")),
                Operation.of(params.requireString("verifyMethod"), params.getMap("verifyParams")),
                params.getString("operationName").orElse(null));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", result.phase().name().toLowerCase(Locale.ROOT));
        payload.put("mainResult", result.mainResult().toMap());
        result.verifyResult().ifPresent(v -> payload.put("verifyResult", v.toMap()));
        payload.put("wasRolledBack", result.wasRolledBack());
        payload.put("message", result.message());
        return CommandResponse.of(result.isSuccess(), payload, result.isSuccess() ? null : result.message());
    }

    private CommandResponse listOperations() {
        List<Map<String, Object>> operations = new ArrayList<>();
        for (OperationDefinition def : engine.registry().definitions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", def.name());
            entry.put("category", def.category());
            entry.put("description", def.description());
            entry.put("aliases", def.aliases());
            operations.add(entry);
        }
        return CommandResponse.of(true, Map.of("operations", operations, "count", operations.size()), null);
    }

    private void warnShadowedOperations() {
        if (shadowingChecked) return;
        shadowingChecked = true;
        for (String builtIn : BUILT_IN_COMMANDS) {
            engine.registry().resolve(builtIn).ifPresent(def ->
                    log.warn("Operation '{}' from {} is shadowed by the built-in command", def.name(), def.source()));
        }
    }

    private static Map<String, Object> stringKeys(Map<?, ?> raw) {
        Map<String, Object> m = new LinkedHashMap<>();
        raw.forEach((k, v) -> m.put(String.valueOf(k), v));
        return m;
    }

    public TaskBatchManager tasks() {
        return tasks;
    }

    @Override
    public void close() {
        modelThread.dispose();
    }
}
