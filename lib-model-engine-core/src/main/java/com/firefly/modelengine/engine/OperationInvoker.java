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


package com.firefly.modelengine.engine;

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.Operation;
import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.core.ParameterValidationException;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.registry.OperationDefinition;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Invokes one resolved operation and turns whatever the handler does into an {@link OperationResult}.
 * <p>
 * Conversions: {@link ParameterValidationException} to {@link ErrorKind#VALIDATION},
 * {@link ResourceException} to {@link ErrorKind#RESOURCE}, any other runtime fault to
 * {@link ErrorKind#EXCEPTION}. {@link Error}s are not caught.
 */
public class OperationInvoker {
    private static final Logger log = LoggerFactory.getLogger(OperationInvoker.class);

    private final EngineEvents events;

    public OperationInvoker(EngineEvents events) {
        this.events = events != null ? events : EngineEvents.NO_OP;
    }

    /**
     * @param scope name of the enclosing batch or wrapper, used for events
     * @param index position in the batch, -1 outside a batch
     */
    public OperationResult invoke(ResourceHandle resource, OperationDefinition definition, Operation operation, String scope, int index) {
        String name = definition.name();
        events.onOperationStarted(scope, index, name);
        long start = System.currentTimeMillis();
        OperationResult result;
        try {
            OperationParams params = operation.typedParams();
            result = definition.handler().handle(resource, params);
            if (result == null) {
                result = OperationResult.failure(ErrorKind.EXCEPTION, "Operation '" + name + "' returned no result");
            }
        } catch (ParameterValidationException e) {
            result = OperationResult.validation(e.getMessage()).with("parameter", e.parameter());
        } catch (ResourceException e) {
            result = OperationResult.failure(ErrorKind.RESOURCE, e.getMessage());
        } catch (RuntimeException e) {
            log.warn(JsonUtils.json(
                    "model_event", "operation_exception",
                    "scope", scope,
                    "operation", name,
                    "error_class", e.getClass().getName(),
                    "error_msg", LogPreview.truncate(e.getMessage(), 500)
            ), e);
            result = OperationResult.fromException(e);
        }
        long latency = System.currentTimeMillis() - start;
        if (result.isSuccess()) {
            events.onOperationSucceeded(scope, index, name, latency);
        } else {
            events.onOperationFailed(scope, index, name, result.errorKind(), result.errorMessage().orElse(null), latency);
        }
        return result;
    }

    /**
     * Run the definition's parameter check. Callers do this before opening a scope, so a rejected call
     * leaves the resource untouched.
     *
     * @return the validation failure, or empty when the parameters are acceptable
     */
    public Optional<OperationResult> checkParameters(OperationDefinition definition, Operation operation, String scope, int index) {
        try {
            definition.validator().validate(operation.typedParams());
            return Optional.empty();
        } catch (ParameterValidationException e) {
            OperationResult result = OperationResult.validation(e.getMessage()).with("parameter", e.parameter());
            events.onOperationFailed(scope, index, definition.name(), result.errorKind(), result.errorMessage().orElse(null), 0L);
            return Optional.of(result);
        }
    }

    /** Record an operation that could not be resolved; no handler runs and no scope is touched. */
    public OperationResult unresolved(Operation operation, String scope, int index) {
        OperationResult result = OperationResult.unknownOperation(operation.displayName());
        events.onOperationFailed(scope, index, operation.displayName(), result.errorKind(), result.errorMessage().orElse(null), 0L);
        return result;
    }
}
