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


package com.firefly.modelengine.resource;

import com.firefly.modelengine.failure.FailureAction;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.failure.FailureProcessingOutcome;
import com.firefly.modelengine.failure.ModelFailure;
import com.firefly.modelengine.observability.EngineEvents;

import java.util.List;
import java.util.Objects;

/**
 * One open scope on a {@link ResourceHandle}, usable in try-with-resources.
 * Closing a guard that was neither committed nor rolled back rolls it back.
 * <p>
 * The failure policy is attached as soon as the scope opens and reports every classification to
 * {@link EngineEvents#onFailuresProcessed}.
 */
public final class ScopeGuard implements AutoCloseable {

    private final ResourceHandle handle;
    private final ScopeToken token;
    private final EngineEvents events;
    private boolean active = true;
    private boolean rolledBack = false;

    private ScopeGuard(ResourceHandle handle, ScopeToken token, EngineEvents events) {
        this.handle = handle;
        this.token = token;
        this.events = events;
    }

    public static ScopeGuard open(ResourceHandle handle, String name, FailureClassificationPolicy policy, EngineEvents events) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(policy, "policy");
        EngineEvents ev = events != null ? events : EngineEvents.NO_OP;
        ScopeToken token = handle.beginScope(name);
        handle.attachFailurePolicy(token, reporting(token.name(), policy, ev));
        ev.onScopeOpened(token.name(), token.id(), token.depth());
        return new ScopeGuard(handle, token, ev);
    }

    private static FailureClassificationPolicy reporting(String scope, FailureClassificationPolicy policy, EngineEvents events) {
        return new FailureClassificationPolicy() {
            @Override
            public FailureAction classify(ModelFailure failure) {
                return policy.classify(failure);
            }

            @Override
            public FailureProcessingOutcome process(List<ModelFailure> failures) {
                FailureProcessingOutcome outcome = policy.process(failures);
                events.onFailuresProcessed(scope, outcome);
                return outcome;
            }
        };
    }

    /**
     * @throws ResourceException when the resource refused the commit; the guard is then rolled back
     */
    public void commit() {
        requireActive();
        active = false;
        try {
            handle.commit(token);
        } catch (ResourceException e) {
            rolledBack = true;
            events.onScopeRolledBack(token.name(), token.id(), e.getMessage());
            throw e;
        }
        events.onScopeCommitted(token.name(), token.id());
    }

    public void rollback(String reason) {
        requireActive();
        active = false;
        rolledBack = true;
        handle.rollback(token);
        events.onScopeRolledBack(token.name(), token.id(), reason);
    }

    public boolean isActive() {
        return active;
    }

    public boolean wasRolledBack() {
        return rolledBack;
    }

    public ScopeToken token() {
        return token;
    }

    @Override
    public void close() {
        if (active) {
            rollback("scope closed without commit");
        }
    }

    private void requireActive() {
        if (!active) {
            throw new IllegalStateException("Scope '" + token.name() + "' is already " + (rolledBack ? "rolled back" : "committed"));
        }
    }
}
