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


package com.firefly.modelengine.annotations;

import java.lang.annotation.*;

/**
 * Marks a Spring bean as a provider of model operations.
 * <p>
 * Public methods annotated with {@link ModelOperation} are discovered by
 * {@link com.firefly.modelengine.registry.OperationRegistry} the first time an operation is resolved.
 * {@code category} groups the operations for discovery; when blank it is derived from the class name
 * with a trailing {@code Operations} or {@code Methods} removed.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OperationProvider {
    String category() default "";
}
