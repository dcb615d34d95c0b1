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


package com.firefly.modelengine.resource;

/**
 * Opaque reference to a scope opened on a {@link ResourceHandle}.
 *
 * @param id    unique id assigned by the resource
 * @param name  name the scope was opened with
 * @param depth nesting depth, 1 for a top-level scope
 */
public record ScopeToken(String id, String name, int depth) {

    public boolean isTopLevel() {
        return depth == 1;
    }
}
