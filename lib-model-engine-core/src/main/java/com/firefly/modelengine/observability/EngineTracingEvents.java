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
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Micrometer Tracing implementation for EngineEvents.
 * Creates a span per scope and a child span per operation run inside it. Scope spans are tracked by scope
 * id, so nested scopes sharing a name keep separate spans; an operation is parented to the innermost open
 * scope carrying its scope name.
 */
public class EngineTracingEvents implements EngineEvents {
    private final Tracer tracer;
    private final Map<String, Span> scopeSpans = new ConcurrentHashMap<>(); // key: scope id
    private final Map<String, Deque<String>> openScopeIds = new ConcurrentHashMap<>(); // key: scope name, innermost first
    private final Map<String, Span> operationSpans = new ConcurrentHashMap<>(); // key: scope:index:operation

    public EngineTracingEvents(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void onScopeOpened(String scope, String scopeId, int depth) {
        Span span = tracer.nextSpan().name("scope:" + scope).start();
        span.tag("depth", Integer.toString(depth));
        scopeSpans.put(scopeId, span);
        openScopeIds.computeIfAbsent(scope, k -> new ConcurrentLinkedDeque<>()).push(scopeId);
    }

    @Override
    public void onScopeCommitted(String scope, String scopeId) {
        endScope(scope, scopeId, "committed");
    }

    @Override
    public void onScopeRolledBack(String scope, String scopeId, String reason) {
        endScope(scope, scopeId, "rolled_back");
    }

    @Override
    public void onOperationStarted(String scope, int index, String operation) {
        Span parent = innermostScopeSpan(scope);
        Span span = (parent != null ? tracer.nextSpan(parent) : tracer.nextSpan())
                .name("operation:" + operation)
                .start();
        operationSpans.put(key(scope, index, operation), span);
    }

    @Override
    public void onOperationSucceeded(String scope, int index, String operation, long latencyMs) {
        Span span = operationSpans.remove(key(scope, index, operation));
        if (span != null) {
            span.tag("outcome", "success");
            span.end();
        }
    }

    @Override
    public void onOperationFailed(String scope, int index, String operation, ErrorKind kind, String error, long latencyMs) {
        Span span = operationSpans.remove(key(scope, index, operation));
        if (span != null) {
            span.tag("outcome", "failed");
            span.tag("errorKind", String.valueOf(kind));
            span.end();
        }
    }

    private Span innermostScopeSpan(String scope) {
        Deque<String> ids = openScopeIds.get(scope);
        String id = ids == null ? null : ids.peek();
        return id == null ? null : scopeSpans.get(id);
    }

    private void endScope(String scope, String scopeId, String outcome) {
        openScopeIds.computeIfPresent(scope, (name, ids) -> {
            ids.remove(scopeId);
            return ids.isEmpty() ? null : ids;
        });
        Span span = scopeSpans.remove(scopeId);
        if (span != null) {
            span.tag("outcome", outcome);
            span.end();
        }
    }

    private static String key(String scope, int index, String operation) {
        return scope + ":" + index + ":" + operation;
    }
}
