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

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-cutting filter the engine attaches to every scope it opens. The resource hands it the failures
 * pending on a scope right before committing; the scope commits only if the outcome lets it proceed.
 */
@FunctionalInterface
public interface FailureClassificationPolicy {

    FailureAction classify(ModelFailure failure);

    /**
     * This policy with warnings either suppressed or made fatal; errors are classified as before.
     */
    default FailureClassificationPolicy withWarnings(boolean suppress) {
        return failure -> failure.isWarning()
                ? (suppress ? FailureAction.SUPPRESS : FailureAction.FAIL)
                : classify(failure);
    }

    default FailureProcessingOutcome process(List<ModelFailure> failures) {
        if (failures == null || failures.isEmpty()) return FailureProcessingOutcome.EMPTY;
        List<ModelFailure> suppressed = new ArrayList<>();
        List<ModelFailure> resolved = new ArrayList<>();
        List<ModelFailure> fatal = new ArrayList<>();
        for (ModelFailure f : failures) {
            switch (classify(f)) {
                case SUPPRESS -> suppressed.add(f);
                case RESOLVE -> resolved.add(f);
                case FAIL -> fatal.add(f);
            }
        }
        return new FailureProcessingOutcome(suppressed, resolved, fatal);
    }
}
