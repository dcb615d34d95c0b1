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
 * Declares a named operation on an {@link OperationProvider} bean.
 * <p>
 * The method must have the signature
 * {@code OperationResult name(ResourceHandle resource, OperationParams params)}; other signatures are
 * skipped with a warning. Names and aliases are matched case-insensitively.
 *
 * Example:
 * <pre>
 * {@code
 * @ModelOperation(name = "createWall", aliases = {"addWall"}, description = "Create a straight wall",
 *                 parameters = CreateWallParams.class)
 * public OperationResult createWall(ResourceHandle resource, OperationParams params) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ModelOperation {
    /** Operation name; defaults to the method name. */
    String name() default "";
    String[] aliases() default {};
    /** Overrides the provider's category for this operation. */
    String category() default "";
    String description() default "";
    /**
     * Parameter record the call must convert into; checked before the engine opens a scope.
     * {@code Void.class} disables the check.
     */
    Class<?> parameters() default Void.class;
}
