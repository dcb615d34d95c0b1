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

import com.firefly.modelengine.failure.ModelFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The resource refused or failed a mutation. When raised from {@link ResourceHandle#commit(ScopeToken)}
 * the scope has already been rolled back by the resource.
 */
public class ResourceException extends RuntimeException {
    private final transient List<ModelFailure> failures;

    public ResourceException(String message) {
        this(message, List.of());
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
        this.failures = List.of();
    }

    public ResourceException(String message, List<ModelFailure> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    /** Build the exception a resource raises when the attached policy left fatal failures. */
    public static ResourceException fatalFailures(String scopeName, List<ModelFailure> fatal) {
        String detail = fatal.stream()
                .map(f -> f.id() + ": " + f.description())
                .collect(Collectors.joining("; "));
        return new ResourceException("Scope '" + scopeName + "' rolled back after fatal failures: " + detail, fatal);
    }

    public List<ModelFailure> failures() {
        return failures;
    }
}
