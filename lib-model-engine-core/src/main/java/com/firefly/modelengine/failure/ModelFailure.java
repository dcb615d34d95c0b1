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

import java.util.Objects;

/**
 * A warning or error the resource raised while a scope was open.
 *
 * @param id          resource-specific failure identifier
 * @param severity    warning or error
 * @param description human-readable text
 * @param resolvable  whether the resource offers an automatic resolution
 */
public record ModelFailure(String id, FailureSeverity severity, String description, boolean resolvable) {

    public ModelFailure {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        description = description != null ? description : "";
    }

    public static ModelFailure warning(String id, String description) {
        return new ModelFailure(id, FailureSeverity.WARNING, description, false);
    }

    public static ModelFailure error(String id, String description, boolean resolvable) {
        return new ModelFailure(id, FailureSeverity.ERROR, description, resolvable);
    }

    public boolean isWarning() {
        return severity == FailureSeverity.WARNING;
    }
}
