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


package com.firefly.modelengine.core;

/**
 * Raised when a parameter is missing or cannot be converted to the expected type.
 * Executors turn it into an {@link ErrorKind#VALIDATION} result.
 */
public class ParameterValidationException extends RuntimeException {
    private final String parameter;

    public ParameterValidationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public ParameterValidationException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    /** Name of the offending parameter, or null when the whole object failed to convert. */
    public String parameter() {
        return parameter;
    }
}
