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
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.resource.ResourceHandle;

/**
 * Functional operation handler. Expected failures are returned as failed results; an exception
 * escaping the handler is treated as an unexpected fault by the engine.
 */
@FunctionalInterface
public interface OperationHandler {
    OperationResult handle(ResourceHandle resource, OperationParams params);
}
