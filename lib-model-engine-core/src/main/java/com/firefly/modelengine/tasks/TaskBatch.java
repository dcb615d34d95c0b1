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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A named queue of {@link BatchTask}s worked off one task at a time. Unlike a batch run, a task batch has
 * no enclosing scope: each task commits or rolls back on its own, and the queue can be paused between
 * tasks.
 */
public class TaskBatch {
    private final String id;
    private final String name;
    private final String description;
    private final ErrorStrategy strategy;
    private final Instant createdAt;
    private final List<BatchTask> tasks;

    private Instant startedAt;
    private Instant completedAt;
    private int currentIndex;
    private volatile boolean paused;
    private volatile boolean running;

    public TaskBatch(String id, String name, String description, ErrorStrategy strategy, Instant createdAt, List<BatchTask> tasks) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.strategy = strategy;
        this.createdAt = createdAt;
        this.tasks = List.copyOf(tasks);
    }

    public String id() { return id; }
    public String name() { return name; }
    public String description() { return description; }
    public ErrorStrategy strategy() { return strategy; }
    public Instant createdAt() { return createdAt; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }
    public List<BatchTask> tasks() { return tasks; }
    public boolean isPaused() { return paused; }
    public boolean isRunning() { return running; }

    public Optional<BatchTask> nextPending() {
        return tasks.stream().filter(t -> t.status() == TaskStatus.PENDING).findFirst();
    }

    public int count(TaskStatus status) {
        return (int) tasks.stream().filter(t -> t.status() == status).count();
    }

    public boolean isComplete() {
        return tasks.stream().allMatch(t -> t.status().isFinished());
    }

    public TaskBatchStatus status() {
        int total = tasks.size();
        int completed = count(TaskStatus.COMPLETED);
        int failed = count(TaskStatus.FAILED);
        int skipped = count(TaskStatus.SKIPPED);
        double percent = total == 0 ? 0.0 : (completed + failed + skipped) * 100.0 / total;
        return new TaskBatchStatus(id, name, strategy, running, paused, isComplete(), currentIndex + 1, total,
                completed, failed, skipped, count(TaskStatus.PENDING), percent);
    }

    void markStarted(Instant now, int index) {
        if (startedAt == null) startedAt = now;
        currentIndex = index;
    }

    void markCompleted(Instant now) {
        if (completedAt == null) completedAt = now;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    void setRunning(boolean running) {
        this.running = running;
    }
}
