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

import java.util.Objects;

/**
 * Failure policy for one batch run.
 *
 * @param name              name of the batch scope, shown in the resource's undo history
 * @param stopOnError       roll back and stop at the first failure; otherwise continue to the end and commit
 * @param isolateOperations run each operation in a nested sub-scope so a failed operation leaves no partial effects
 * @param continueOnWarning commit through model warnings ({@code true}) or treat them as fatal ({@code false});
 *                          null keeps the engine's failure policy
 */
public record BatchPolicy(String name, boolean stopOnError, boolean isolateOperations, Boolean continueOnWarning) {

    public static final String DEFAULT_NAME = "Batch Operation";

    public BatchPolicy {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name;
    }

    public BatchPolicy(String name, boolean stopOnError, boolean isolateOperations) {
        this(name, stopOnError, isolateOperations, null);
    }

    public static BatchPolicy stopOnError(String name) {
        return new BatchPolicy(name, true, true);
    }

    public static BatchPolicy continueOnError(String name) {
        return new BatchPolicy(name, false, true);
    }

    public BatchPolicy withName(String newName) {
        Objects.requireNonNull(newName, "newName");
        return new BatchPolicy(newName, stopOnError, isolateOperations, continueOnWarning);
    }

    public BatchPolicy withContinueOnWarning(Boolean continueOnWarning) {
        return new BatchPolicy(name, stopOnError, isolateOperations, continueOnWarning);
    }
}
