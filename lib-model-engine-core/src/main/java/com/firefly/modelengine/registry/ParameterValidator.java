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


package com.firefly.modelengine.registry;

import com.firefly.modelengine.core.OperationParams;
import com.firefly.modelengine.core.ParameterValidationException;

/**
 * Checks an operation's parameters before the engine opens a scope for it. A rejected call surfaces as a
 * validation result without touching the resource.
 */
@FunctionalInterface
public interface ParameterValidator {

    ParameterValidator NONE = params -> { };

    /**
     * @throws ParameterValidationException when a parameter is missing or malformed
     */
    void validate(OperationParams params);

    /** Validates by converting the parameters into {@code type}, typically the record the handler reads. */
    static ParameterValidator forType(Class<?> type) {
        return params -> params.as(type);
    }

    default ParameterValidator and(ParameterValidator next) {
        return params -> {
            validate(params);
            next.validate(params);
        };
    }
}
