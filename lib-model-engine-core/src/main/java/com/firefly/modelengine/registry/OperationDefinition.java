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

import java.util.List;
import java.util.Objects;

/**
 * Immutable metadata and handler for one registered operation.
 * {@code source} describes where it came from (provider class or "programmatic") and is used in conflict reports.
 * The {@link ParameterValidator} runs before any scope is opened for the operation.
 */
public final class OperationDefinition {
    private final String name;
    private final List<String> aliases;
    private final String category;
    private final String description;
    private final OperationHandler handler;
    private final String source;
    private final ParameterValidator validator;

    public OperationDefinition(String name,
                               List<String> aliases,
                               String category,
                               String description,
                               OperationHandler handler,
                               String source) {
        this(name, aliases, category, description, handler, source, ParameterValidator.NONE);
    }

    public OperationDefinition(String name,
                               List<String> aliases,
                               String category,
                               String description,
                               OperationHandler handler,
                               String source,
                               ParameterValidator validator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
        this.name = name;
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
        this.category = category == null || category.isBlank() ? "General" : category;
        this.description = description == null ? "" : description;
        this.handler = Objects.requireNonNull(handler, "handler");
        this.source = source == null ? "programmatic" : source;
        this.validator = validator == null ? ParameterValidator.NONE : validator;
    }

    public static OperationDefinition of(String name, OperationHandler handler) {
        return new OperationDefinition(name, List.of(), null, null, handler, null);
    }

    public String name() { return name; }
    public List<String> aliases() { return aliases; }
    public String category() { return category; }
    public String description() { return description; }
    public OperationHandler handler() { return handler; }
    public String source() { return source; }
    public ParameterValidator validator() { return validator; }

    @Override
    public String toString() {
        return "OperationDefinition{" + name + (aliases.isEmpty() ? "" : ", aliases=" + aliases) + ", category=" + category + "}";
    }
}
