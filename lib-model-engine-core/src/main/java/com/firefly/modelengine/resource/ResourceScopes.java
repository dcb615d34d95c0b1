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

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.observability.EngineEvents;

import java.util.function.Supplier;

/**
 * Scope propagation helpers for running a unit of work against a {@link ResourceHandle}.
 */
public final class ResourceScopes {
    private ResourceScopes() {}

    /**
     * Runs the work in a scope of its own: top-level when nothing is open on the resource, nested in the
     * innermost open scope otherwise. The scope is committed when the work succeeds and rolled back when it
     * fails; a commit refused by the resource is reported as a {@link ErrorKind#RESOURCE} failure.
     */
    public static OperationResult requiresNew(ResourceHandle handle,
                                              String name,
                                              FailureClassificationPolicy policy,
                                              EngineEvents events,
                                              Supplier<OperationResult> work) {
        try (ScopeGuard scope = ScopeGuard.open(handle, name, policy, events)) {
            OperationResult result = work.get();
            if (!result.isSuccess()) {
                scope.rollback(result.errorMessage().orElse(result.errorKind().name()));
                return result;
            }
            try {
                scope.commit();
            } catch (ResourceException e) {
                return OperationResult.failure(ErrorKind.RESOURCE, e.getMessage());
            }
            return result;
        }
    }
}
