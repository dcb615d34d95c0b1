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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of EngineEvents that publishes counters and timers
 * for operations, scopes, batches and failure classification.
 */
public class EngineMicrometerEvents implements EngineEvents {
    private final MeterRegistry registry;

    public EngineMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {
        record(operation, "success", "NONE", latencyMs);
    }

    @Override
    public void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {
        record(operation, "failed", String.valueOf(kind), latencyMs);
    }

    @Override
    public void onScopeCommitted(String scope, String scopeId) {
        registry.counter("model.scope.completed", Tags.of(Tag.of("outcome", "committed"))).increment();
    }

    @Override
    public void onScopeRolledBack(String scope, String scopeId, String reason) {
        registry.counter("model.scope.completed", Tags.of(Tag.of("outcome", "rolled_back"))).increment();
    }

    @Override
    public void onFailuresProcessed(String scope, FailureProcessingOutcome outcome) {
        registry.counter("model.failures.processed", Tags.of(Tag.of("action", "suppressed"))).increment(outcome.suppressed().size());
        registry.counter("model.failures.processed", Tags.of(Tag.of("action", "resolved"))).increment(outcome.resolved().size());
        registry.counter("model.failures.processed", Tags.of(Tag.of("action", "fatal"))).increment(outcome.fatal().size());
    }

    @Override
    public void onBatchCompleted(String batch, int succeeded, int failed, boolean rolledBack) {
        registry.counter("model.batch.completed", Tags.of(Tag.of("rolledBack", String.valueOf(rolledBack)))).increment();
        registry.counter("model.batch.operations", Tags.of(Tag.of("outcome", "success"))).increment(succeeded);
        registry.counter("model.batch.operations", Tags.of(Tag.of("outcome", "failed"))).increment(failed);
    }

    @Override
    public void onGroupCompleted(String group, GroupState state, int checkpointCount) {
        registry.counter("model.group.completed", Tags.of(Tag.of("state", String.valueOf(state)))).increment();
    }

    private void record(String operation, String outcome, String kind, long latencyMs) {
        Tags tags = Tags.of(Tag.of("operation", operation), Tag.of("outcome", outcome), Tag.of("errorKind", kind));
        registry.counter("model.operation.completed", tags).increment();
        Timer.builder("model.operation.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
    }
}
