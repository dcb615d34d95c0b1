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


package com.firefly.modelengine.support;

import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.failure.FailureProcessingOutcome;
import com.firefly.modelengine.failure.ModelFailure;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.resource.ScopeToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal snapshot-backed resource for engine tests: a key/value map plus a call journal.
 */
public class TestModel implements ResourceHandle {

    private Map<String, String> values = new LinkedHashMap<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    public final List<String> journal = new ArrayList<>();
    private int sequence;

    private static final class Scope {
        final ScopeToken token;
        final Map<String, String> snapshot;
        final List<ModelFailure> pending = new ArrayList<>();
        FailureClassificationPolicy policy;

        Scope(ScopeToken token, Map<String, String> snapshot) {
            this.token = token;
            this.snapshot = snapshot;
        }
    }

    @Override
    public String title() {
        return "test-model";
    }

    @Override
    public ScopeToken beginScope(String name) {
        ScopeToken token = new ScopeToken("s" + (++sequence), name, scopes.size() + 1);
        scopes.push(new Scope(token, new LinkedHashMap<>(values)));
        journal.add("begin:" + name);
        return token;
    }

    @Override
    public void attachFailurePolicy(ScopeToken token, FailureClassificationPolicy policy) {
        for (Scope s : scopes) {
            if (s.token.equals(token)) {
                s.policy = policy;
            }
        }
    }

    @Override
    public void commit(ScopeToken token) {
        Scope scope = innermost(token);
        if (scope.policy != null) {
            FailureProcessingOutcome outcome = scope.policy.process(scope.pending);
            if (!outcome.proceed()) {
                values = scope.snapshot;
                scopes.pop();
                journal.add("refused:" + token.name());
                throw ResourceException.fatalFailures(token.name(), outcome.fatal());
            }
        }
        scopes.pop();
        journal.add("commit:" + token.name());
    }

    @Override
    public void rollback(ScopeToken token) {
        Scope scope = innermost(token);
        values = scope.snapshot;
        scopes.pop();
        journal.add("rollback:" + token.name());
    }

    @Override
    public int openScopeDepth() {
        return scopes.size();
    }

    public void put(String key, String value) {
        if (scopes.isEmpty()) {
            throw new ResourceException("No open scope");
        }
        values.put(key, value);
    }

    public void raise(ModelFailure failure) {
        if (scopes.isEmpty()) {
            throw new ResourceException("No open scope");
        }
        scopes.peek().pending.add(failure);
    }

    public Map<String, String> values() {
        return Map.copyOf(values);
    }

    private Scope innermost(ScopeToken token) {
        Scope scope = scopes.peek();
        if (scope == null || !scope.token.equals(token)) {
            throw new IllegalStateException("Not the innermost scope: " + token);
        }
        return scope;
    }
}
