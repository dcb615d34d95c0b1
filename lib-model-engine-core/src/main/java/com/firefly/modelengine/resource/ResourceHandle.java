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

import com.firefly.modelengine.failure.FailureClassificationPolicy;

/**
 * The single live external model, supplied by the host and borrowed by the engine for one call.
 * <p>
 * Scopes nest strictly: only the innermost open scope may be committed or rolled back. Committing an inner
 * scope folds its changes into the enclosing one; rolling back any scope reverts every change made since it
 * was opened, including changes of inner scopes already committed into it.
 * <p>
 * Before committing, the resource hands the failures raised while the scope was open to the attached
 * {@link FailureClassificationPolicy}. If the policy reports fatal failures the resource rolls the scope back
 * and throws {@link ResourceException}. Failures pending on a scope without a policy are handed to the
 * enclosing scope on commit.
 * <p>
 * Implementations are not expected to be thread-safe: the engine calls them from one thread at a time.
 */
public interface ResourceHandle {

    /** Human-readable name of the model (e.g. the document title). */
    String title();

    ScopeToken beginScope(String name);

    void attachFailurePolicy(ScopeToken token, FailureClassificationPolicy policy);

    /**
     * @throws ResourceException if the resource refused the commit; the scope is then rolled back
     * @throws IllegalStateException if {@code token} is not the innermost open scope
     */
    void commit(ScopeToken token);

    /**
     * @throws IllegalStateException if {@code token} is not the innermost open scope
     */
    void rollback(ScopeToken token);

    int openScopeDepth();

    default boolean hasOpenScope() {
        return openScopeDepth() > 0;
    }
}
