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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans every event out to a list of sinks. A sink that throws is logged and skipped so the
 * remaining sinks, and the engine, are unaffected.
 */
public class CompositeEngineEvents implements EngineEvents {
    private static final Logger log = LoggerFactory.getLogger(CompositeEngineEvents.class);

    private final List<EngineEvents> sinks;

    public CompositeEngineEvents(List<EngineEvents> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public List<EngineEvents> sinks() {
        return sinks;
    }

    @Override
    public void onScopeOpened(String scope, String scopeId, int depth) {
        each(s -> s.onScopeOpened(scope, scopeId, depth));
    }

    @Override
    public void onScopeCommitted(String scope, String scopeId) {
        each(s -> s.onScopeCommitted(scope, scopeId));
    }

    @Override
    public void onScopeRolledBack(String scope, String scopeId, String reason) {
        each(s -> s.onScopeRolledBack(scope, scopeId, reason));
    }

    @Override
    public void onFailuresProcessed(String scope, FailureProcessingOutcome outcome) {
        each(s -> s.onFailuresProcessed(scope, outcome));
    }

    @Override
    public void onOperationStarted(String scope, int index, String operation) {
        each(s -> s.onOperationStarted(scope, index, operation));
    }

    @Override
    public void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {
        each(s -> s.onOperationSucceeded(scope, index, operation, latencyMs));
    }

    @Override
    public void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {
        each(s -> s.onOperationFailed(scope, index, operation, kind, error, latencyMs));
    }

    @Override
    public void onBatchCompleted(String batch, int succeeded, int failed, boolean rolledBack) {
        each(s -> s.onBatchCompleted(batch, succeeded, failed, rolledBack));
    }

    @Override
    public void onGroupStarted(String group) {
        each(s -> s.onGroupStarted(group));
    }

    @Override
    public void onCheckpoint(String group, String label, int checkpointCount) {
        each(s -> s.onCheckpoint(group, label, checkpointCount));
    }

    @Override
    public void onGroupCompleted(String group, GroupState state, int checkpointCount) {
        each(s -> s.onGroupCompleted(group, state, checkpointCount));
    }

    private void each(Consumer<EngineEvents> call) {
        for (EngineEvents sink : sinks) {
            try {
                call.accept(sink);
            } catch (RuntimeException e) {
                log.warn("Engine events sink {} failed", sink.getClass().getName(), e);
            }
        }
    }
}
