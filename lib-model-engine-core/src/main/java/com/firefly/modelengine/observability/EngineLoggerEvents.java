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

import static com.firefly.modelengine.engine.LogPreview.truncate;
import static com.firefly.modelengine.util.JsonUtils.json;

/**
 * Default {@link EngineEvents} implementation that emits JSON-friendly key=value logs via SLF4J.
 */
public class EngineLoggerEvents implements EngineEvents {
    private static final Logger log = LoggerFactory.getLogger(EngineLoggerEvents.class);

    @Override
    public void onScopeOpened(String scope, String scopeId, int depth) {
        log.debug(json(
                "model_event", "scope_opened",
                "scope", scope,
                "scopeId", scopeId,
                "depth", Integer.toString(depth)
        ));
    }

    @Override
    public void onScopeCommitted(String scope, String scopeId) {
        log.info(json(
                "model_event", "scope_committed",
                "scope", scope,
                "scopeId", scopeId
        ));
    }

    @Override
    public void onScopeRolledBack(String scope, String scopeId, String reason) {
        log.warn(json(
                "model_event", "scope_rolled_back",
                "scope", scope,
                "scopeId", scopeId,
                "reason", truncate(reason, 500)
        ));
    }

    @Override
    public void onFailuresProcessed(String scope, FailureProcessingOutcome outcome) {
        if (outcome.total() == 0) return;
        String msg = json(
                "model_event", "failures_processed",
                "scope", scope,
                "suppressed", Integer.toString(outcome.suppressed().size()),
                "resolved", Integer.toString(outcome.resolved().size()),
                "fatal", Integer.toString(outcome.fatal().size())
        );
        if (outcome.proceed()) {
            log.info(msg);
        } else {
            log.warn(msg);
        }
    }

    @Override
    public void onOperationStarted(String scope, int index, String operation) {
        log.debug(json(
                "model_event", "operation_started",
                "scope", scope,
                "index", Integer.toString(index),
                "operation", operation
        ));
    }

    @Override
    public void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {
        log.info(json(
                "model_event", "operation_success",
                "scope", scope,
                "index", Integer.toString(index),
                "operation", operation,
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {
        log.warn(json(
                "model_event", "operation_failed",
                "scope", scope,
                "index", Integer.toString(index),
                "operation", operation,
                "error_kind", String.valueOf(kind),
                "error_msg", truncate(error, 500),
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onBatchCompleted(String batch, int succeeded, int failed, boolean rolledBack) {
        log.info(json(
                "model_event", "batch_completed",
                "batch", batch,
                "succeeded", Integer.toString(succeeded),
                "failed", Integer.toString(failed),
                "rolledBack", Boolean.toString(rolledBack)
        ));
    }

    @Override
    public void onGroupStarted(String group) {
        log.info(json(
                "model_event", "group_started",
                "group", group
        ));
    }

    @Override
    public void onCheckpoint(String group, String label, int checkpointCount) {
        log.info(json(
                "model_event", "checkpoint",
                "group", group,
                "label", truncate(label, 300),
                "checkpoints", Integer.toString(checkpointCount)
        ));
    }

    @Override
    public void onGroupCompleted(String group, GroupState state, int checkpointCount) {
        log.info(json(
                "model_event", "group_completed",
                "group", group,
                "state", String.valueOf(state),
                "checkpoints", Integer.toString(checkpointCount)
        ));
    }
}
