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


package com.firefly.modelengine.failure;

import java.util.List;

/**
 * Result of classifying the failures pending on a scope.
 */
public record FailureProcessingOutcome(List<ModelFailure> suppressed,
                                       List<ModelFailure> resolved,
                                       List<ModelFailure> fatal) {

    public static final FailureProcessingOutcome EMPTY = new FailureProcessingOutcome(List.of(), List.of(), List.of());

    public FailureProcessingOutcome {
        suppressed = List.copyOf(suppressed);
        resolved = List.copyOf(resolved);
        fatal = List.copyOf(fatal);
    }

    /** True when the scope may be committed. */
    public boolean proceed() {
        return fatal.isEmpty();
    }

    public int total() {
        return suppressed.size() + resolved.size() + fatal.size();
    }
}
