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


package com.firefly.modelengine.inmemory;

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.failure.FailureProcessingOutcome;
import com.firefly.modelengine.group.GroupState;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of EngineEvents that keeps a limited history of events for debugging and tests.
 */
public class InMemoryEngineEvents implements EngineEvents {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEngineEvents.class);

    private final InMemoryModelEngineProperties.EventsProperties config;
    private final ConcurrentLinkedQueue<EngineEvent> eventHistory = new ConcurrentLinkedQueue<>();
    private final AtomicInteger eventCounter = new AtomicInteger(0);

    public InMemoryEngineEvents(InMemoryModelEngineProperties.EventsProperties config) {
        this.config = config;
        log.info(JsonUtils.json(
                "event", "inmemory_engine_events_initialized",
                "component", "InMemoryEngineEvents",
                "max_events_in_memory", Integer.toString(config.getMaxEventsInMemory())
        ));
    }

    @Override
    public void onScopeOpened(String scope, String scopeId, int depth) {
        recordEvent("SCOPE_OPENED", scope, null, "depth=" + depth);
    }

    @Override
    public void onScopeCommitted(String scope, String scopeId) {
        recordEvent("SCOPE_COMMITTED", scope, null, null);
    }

    @Override
    public void onScopeRolledBack(String scope, String scopeId, String reason) {
        recordEvent("SCOPE_ROLLED_BACK", scope, null, reason);
    }

    @Override
    public void onFailuresProcessed(String scope, FailureProcessingOutcome outcome) {
        if (outcome.total() == 0) return;
        recordEvent("FAILURES_PROCESSED", scope, null,
                "suppressed=" + outcome.suppressed().size()
                        + ",resolved=" + outcome.resolved().size()
                        + ",fatal=" + outcome.fatal().size());
    }

    @Override
    public void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {
        recordEvent("OPERATION_SUCCEEDED", scope, operation, "index=" + index);
    }

    @Override
    public void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {
        recordEvent("OPERATION_FAILED", scope, operation, kind + ": " + error);
    }

    @Override
    public void onBatchCompleted(String batch, int succeeded, int failed, boolean rolledBack) {
        recordEvent("BATCH_COMPLETED", batch, null,
                "succeeded=" + succeeded + ",failed=" + failed + ",rolledBack=" + rolledBack);
    }

    @Override
    public void onGroupStarted(String group) {
        recordEvent("GROUP_STARTED", group, null, null);
    }

    @Override
    public void onCheckpoint(String group, String label, int checkpointCount) {
        recordEvent("CHECKPOINT", group, null, label);
    }

    @Override
    public void onGroupCompleted(String group, GroupState state, int checkpointCount) {
        recordEvent("GROUP_COMPLETED", group, null, state + ",checkpoints=" + checkpointCount);
    }

    private void recordEvent(String eventType, String scope, String operation, String details) {
        if (!config.isEnabled()) return;
        if (eventHistory.size() >= config.getMaxEventsInMemory()) {
            eventHistory.poll(); // Remove oldest event
        }
        eventHistory.offer(new EngineEvent(
                eventCounter.incrementAndGet(),
                Instant.now(),
                eventType,
                scope,
                operation,
                details
        ));
    }

    /**
     * Returns a snapshot of recent engine events for debugging purposes.
     */
    public List<EngineEvent> getRecentEvents() {
        return List.copyOf(eventHistory);
    }

    public List<EngineEvent> eventsOfType(String eventType) {
        return eventHistory.stream().filter(e -> e.eventType().equals(eventType)).toList();
    }

    /**
     * Returns the total number of events processed.
     */
    public int getTotalEventCount() {
        return eventCounter.get();
    }

    public void clearHistory() {
        eventHistory.clear();
    }

    /**
     * An engine event stored in memory.
     */
    public record EngineEvent(long id, Instant timestamp, String eventType, String scope, String operation, String details) {}
}
