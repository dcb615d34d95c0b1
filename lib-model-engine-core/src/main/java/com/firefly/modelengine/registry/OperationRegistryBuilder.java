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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent builder to construct an {@link OperationRegistry} programmatically without annotations.
 *
 * <pre>
 * {@code
 * OperationRegistry registry = OperationRegistry.builder()
 *     .operation("createWall").aliases("addWall").category("Walls")
 *         .parameters(CreateWallParams.class).handler(walls::create).add()
 *     .operation("getElement").handler(elements::get).add()
 *     .build();
 * }
 * </pre>
 */
public class OperationRegistryBuilder {
    private final List<OperationDefinition> definitions = new ArrayList<>();

    OperationRegistryBuilder() {}

    public Operation operation(String name) {
        return new Operation(name);
    }

    public OperationRegistryBuilder definition(OperationDefinition definition) {
        definitions.add(definition);
        return this;
    }

    public OperationRegistry build() {
        return new OperationRegistry(definitions);
    }

    public class Operation {
        private final String name;
        private List<String> aliases = List.of();
        private String category;
        private String description;
        private OperationHandler handler;
        private ParameterValidator validator = ParameterValidator.NONE;

        private Operation(String name) {
            this.name = name;
        }

        public Operation aliases(String... aliases) {
            this.aliases = Arrays.asList(aliases);
            return this;
        }

        public Operation category(String category) {
            this.category = category;
            return this;
        }

        public Operation description(String description) {
            this.description = description;
            return this;
        }

        /** Reject calls whose parameters do not convert into {@code type}. */
        public Operation parameters(Class<?> type) {
            this.validator = validator.and(ParameterValidator.forType(type));
            return this;
        }

        public Operation validator(ParameterValidator validator) {
            this.validator = this.validator.and(validator);
            return this;
        }

        public Operation handler(OperationHandler handler) {
            this.handler = handler;
            return this;
        }

        public OperationRegistryBuilder add() {
            if (handler == null) {
                throw new IllegalStateException("Missing handler for operation '" + name + "'");
            }
            definitions.add(new OperationDefinition(name, aliases, category, description, handler, "programmatic", validator));
            return OperationRegistryBuilder.this;
        }
    }
}
