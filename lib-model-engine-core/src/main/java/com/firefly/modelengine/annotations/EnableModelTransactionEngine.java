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

import com.firefly.modelengine.config.ModelEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the model transaction engine in a Spring application.
 * <p>
 * Imports {@link ModelEngineConfiguration} that wires:
 * - {@code OperationRegistry}: scans {@link OperationProvider} beans and indexes their operations
 * - {@code TransactionGroupManager}: the session owning the single active transaction group
 * - {@code ModelTransactionEngine}: batch, safe-execute and verify protocols
 * - {@code CommandDispatcher}: the {@code {method, params}} inbound boundary
 * - {@code EngineEvents}: logger sink, plus Micrometer/Tracing sinks when available
 * <p>
 * The host must provide a {@code ResourceHandle} bean.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(ModelEngineConfiguration.class)
public @interface EnableModelTransactionEngine {
}
