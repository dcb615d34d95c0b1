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

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.engine.ModelTransactionEngine;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Task-queue protocol on top of {@link ModelTransactionEngine}: a batch of tasks is created once and then
 * worked off with {@link #executeNext()} or {@link #executeAll()}, with progress available at any time.
 * <p>
 * Each task runs through {@link ModelTransactionEngine#execute(Operation)}, so it commits or rolls back in a
 * scope of its own (nested in the active transaction group, if any). The batch's {@link ErrorStrategy}
 * decides what a failed task does to the rest of the queue.
 * <p>
 * One batch is current at a time; earlier batches stay in memory up to {@code maxBatches} and can be made
 * current again with {@link #load(String)}. Illegal calls are reported as {@link ErrorKind#STATE} results.
 * {@link #pause()} does not take the manager's lock, so it can stop a running {@link #executeAll()} from
 * another thread before its next task.
 */
public class TaskBatchManager {
    private static final Logger log = LoggerFactory.getLogger(TaskBatchManager.class);

    public static final String NO_BATCH = "No batch loaded";
    public static final int DEFAULT_MAX_BATCHES = 20;
    private static final int RETRY_ONCE_ATTEMPTS = 2;

    /** One task as submitted: display name, optional description and the operation to run. */
    public record TaskSpec(String name, String description, Operation operation) {
        public TaskSpec {
            Objects.requireNonNull(operation, "operation");
        }
    }

    private final ModelTransactionEngine engine;
    private final Clock clock;
    private final ErrorStrategy defaultStrategy;
    private final int maxBatches;
    private final Map<String, TaskBatch> batches = new LinkedHashMap<>();
    private volatile TaskBatch current;

    public TaskBatchManager(ModelTransactionEngine engine) {
        this(engine, Clock.systemUTC(), ErrorStrategy.LOG_AND_CONTINUE, DEFAULT_MAX_BATCHES);
    }

    public TaskBatchManager(ModelTransactionEngine engine, Clock clock, ErrorStrategy defaultStrategy, int maxBatches) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : ErrorStrategy.LOG_AND_CONTINUE;
        this.maxBatches = Math.max(1, maxBatches);
    }

    /**
     * Create a batch and make it current.
     *
     * @param batchId  caller-chosen id, or null for a generated one
     * @param strategy null for the manager's default strategy
     */
    public synchronized OperationResult create(String batchId,
                                               String name,
                                               String description,
                                               ErrorStrategy strategy,
                                               List<TaskSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return OperationResult.validation("tasks array is required and must not be empty");
        }
        String id = batchId == null || batchId.isBlank() ? UUID.randomUUID().toString().replace("-", "").substring(0, 8) : batchId;
        TaskBatch existing = batches.get(id);
        if (existing != null && existing.isRunning()) {
            return OperationResult.failure(ErrorKind.STATE, "Batch '" + id + "' is running");
        }
        List<BatchTask> tasks = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            TaskSpec spec = specs.get(i);
            tasks.add(new BatchTask(i + 1, spec.name(), spec.description(), spec.operation()));
        }
        TaskBatch batch = new TaskBatch(id,
                name == null || name.isBlank() ? "Unnamed Batch" : name,
                description,
                strategy != null ? strategy : defaultStrategy,
                clock.instant(),
                tasks);
        batches.remove(id);
        evictOldestBatches();
        batches.put(id, batch);
        current = batch;
        log.info(JsonUtils.json(
                "model_event", "task_batch_created",
                "batchId", id,
                "batchName", batch.name(),
                "tasks", Integer.toString(tasks.size()),
                "onError", batch.strategy().name()
        ));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchId", id);
        payload.put("batchName", batch.name());
        payload.put("totalTasks", tasks.size());
        payload.put("onError", batch.strategy().name());
        payload.put("message", "Created batch with " + tasks.size() + " tasks. Ready to execute.");
        return OperationResult.success(payload);
    }

    /** Make a batch created earlier in this session current again. */
    public synchronized OperationResult load(String batchId) {
        TaskBatch batch = batchId == null ? null : batches.get(batchId);
        if (batch == null) {
            return OperationResult.notFound("Batch '" + batchId + "' not found");
        }
        current = batch;
        TaskBatchStatus status = batch.status();
        Map<String, Object> payload = new LinkedHashMap<>(status.toMap());
        payload.put("message", "Loaded batch at task " + status.current() + " of " + status.total());
        return OperationResult.success(payload);
    }

    /** Run the first pending task of the current batch. */
    public synchronized OperationResult executeNext() {
        TaskBatch batch = current;
        if (batch == null) return noBatch();
        if (batch.isPaused()) {
            return OperationResult.failure(ErrorKind.STATE, "Batch is paused. Use resumeBatch to continue.");
        }
        Optional<BatchTask> next = batch.nextPending();
        if (next.isEmpty()) {
            batch.markCompleted(clock.instant());
            Map<String, Object> payload = new LinkedHashMap<>(batch.status().toMap());
            payload.put("batchComplete", true);
            payload.put("message", "All tasks completed");
            return OperationResult.success(payload);
        }
        BatchTask task = next.get();
        OperationResult result = runTask(batch, task);
        Map<String, Object> payload = new LinkedHashMap<>(task.toMap());
        payload.put("batchProgress", batch.status().progress());
        payload.put("batchPaused", batch.isPaused());
        payload.put("result", result.toMap());
        return task.status() == TaskStatus.COMPLETED
                ? OperationResult.success(payload)
                : OperationResult.failure(result.errorKind(), result.errorMessage().orElse(null), payload);
    }

    /** Run pending tasks until none is left or the batch is paused. Clears an earlier pause first. */
    public synchronized OperationResult executeAll() {
        TaskBatch batch = current;
        if (batch == null) return noBatch();
        if (batch.isRunning()) {
            return OperationResult.failure(ErrorKind.STATE, "Batch is already running");
        }
        batch.setRunning(true);
        batch.setPaused(false);
        int executed = 0;
        try {
            while (!batch.isPaused()) {
                Optional<BatchTask> next = batch.nextPending();
                if (next.isEmpty()) break;
                runTask(batch, next.get());
                executed++;
            }
        } finally {
            batch.setRunning(false);
        }
        if (batch.isComplete()) {
            batch.markCompleted(clock.instant());
        }
        TaskBatchStatus status = batch.status();
        log.info(JsonUtils.json(
                "model_event", "task_batch_finished",
                "batchId", batch.id(),
                "executed", Integer.toString(executed),
                "completed", Integer.toString(status.completed()),
                "failed", Integer.toString(status.failed()),
                "skipped", Integer.toString(status.skipped()),
                "paused", Boolean.toString(status.paused())
        ));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("batchId", batch.id());
        payload.put("batchComplete", status.complete());
        payload.put("tasksExecuted", executed);
        payload.put("completedTasks", status.completed());
        payload.put("failedTasks", status.failed());
        payload.put("skippedTasks", status.skipped());
        payload.put("pendingTasks", status.pending());
        payload.put("wasPaused", status.paused());
        return OperationResult.success(payload);
    }

    public OperationResult pause() {
        TaskBatch batch = current;
        if (batch == null) return noBatch();
        batch.setPaused(true);
        TaskBatchStatus status = batch.status();
        return OperationResult.success(Map.of(
                "message", "Batch paused",
                "currentTask", status.current(),
                "totalTasks", status.total()
        ));
    }

    public synchronized OperationResult resume() {
        TaskBatch batch = current;
        if (batch == null) return noBatch();
        batch.setPaused(false);
        TaskBatchStatus status = batch.status();
        Map<String, Object> payload = new LinkedHashMap<>(status.toMap());
        payload.put("message", "Resumed batch with " + status.pending() + " pending tasks");
        return OperationResult.success(payload);
    }

    /** Progress of the current batch with one entry per task; {@code hasBatch=false} when there is none. */
    public synchronized OperationResult status() {
        TaskBatch batch = current;
        if (batch == null) {
            return OperationResult.success(Map.of("hasBatch", false, "message", NO_BATCH));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("hasBatch", true);
        payload.putAll(batch.status().toMap());
        payload.put("tasks", batch.tasks().stream().map(BatchTask::toMap).toList());
        return OperationResult.success(payload);
    }

    public Optional<TaskBatch> currentBatch() {
        return Optional.ofNullable(current);
    }

    public synchronized Optional<TaskBatch> batch(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    private OperationResult runTask(TaskBatch batch, BatchTask task) {
        batch.markStarted(clock.instant(), batch.tasks().indexOf(task));
        task.begin(clock.instant());
        OperationResult result = engine.execute(task.operation());
        TaskStatus outcome = result.isSuccess() ? TaskStatus.COMPLETED : onFailure(batch, task);
        task.finish(outcome, result, clock.instant());
        if (outcome == TaskStatus.COMPLETED) {
            log.debug(JsonUtils.json(
                    "model_event", "task_completed",
                    "batchId", batch.id(),
                    "taskId", Integer.toString(task.id()),
                    "method", task.operation().displayName()
            ));
        } else {
            log.warn(JsonUtils.json(
                    "model_event", "task_failed",
                    "batchId", batch.id(),
                    "taskId", Integer.toString(task.id()),
                    "method", task.operation().displayName(),
                    "attempt", Integer.toString(task.attempts()),
                    "status", outcome.name(),
                    "error", result.errorMessage().orElse("")
            ));
        }
        if (batch.isComplete()) {
            batch.markCompleted(clock.instant());
        }
        return result;
    }

    private static TaskStatus onFailure(TaskBatch batch, BatchTask task) {
        switch (batch.strategy()) {
            case RETRY_ONCE:
                return task.attempts() < RETRY_ONCE_ATTEMPTS ? TaskStatus.PENDING : TaskStatus.FAILED;
            case SKIP_AND_CONTINUE:
                return TaskStatus.SKIPPED;
            case STOP_ON_ERROR:
                batch.setPaused(true);
                return TaskStatus.FAILED;
            default:
                return TaskStatus.FAILED;
        }
    }

    private void evictOldestBatches() {
        Iterator<TaskBatch> it = batches.values().iterator();
        while (batches.size() >= maxBatches && it.hasNext()) {
            TaskBatch oldest = it.next();
            if (oldest != current && !oldest.isRunning()) {
                it.remove();
            }
        }
    }

    private static OperationResult noBatch() {
        return OperationResult.failure(ErrorKind.STATE, NO_BATCH, Map.of(
                "message", "Use createBatch or loadBatch first"
        ));
    }
}
