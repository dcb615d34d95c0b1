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

/**
 * Suppresses warnings and applies automatic resolutions to resolvable errors; everything else is fatal.
 * <p>
 * With {@code suppressWarnings=false} warnings become fatal as well, and with {@code resolveErrors=false}
 * resolvable errors are not auto-resolved.
 */
public class DefaultFailureClassificationPolicy implements FailureClassificationPolicy {

    private final boolean suppressWarnings;
    private final boolean resolveErrors;

    public DefaultFailureClassificationPolicy() {
        this(true, true);
    }

    public DefaultFailureClassificationPolicy(boolean suppressWarnings, boolean resolveErrors) {
        this.suppressWarnings = suppressWarnings;
        this.resolveErrors = resolveErrors;
    }

    @Override
    public FailureAction classify(ModelFailure failure) {
        if (failure.isWarning()) {
            return suppressWarnings ? FailureAction.SUPPRESS : FailureAction.FAIL;
        }
        if (failure.resolvable() && resolveErrors) {
            return FailureAction.RESOLVE;
        }
        return FailureAction.FAIL;
    }

    public boolean suppressesWarnings() {
        return suppressWarnings;
    }

    public boolean resolvesErrors() {
        return resolveErrors;
    }
}
