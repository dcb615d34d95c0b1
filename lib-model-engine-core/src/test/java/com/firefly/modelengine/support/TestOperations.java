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


package com.firefly.modelengine.support;

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.failure.ModelFailure;
import com.firefly.modelengine.registry.OperationRegistry;

import java.util.Map;

/**
 * Programmatic operations over {@link TestModel} shared by the engine tests.
 * <ul>
 *   <li>{@code put{key, value}}: writes a value, returns {@code elementId = key}; {@code key} is checked up front</li>
 *   <li>{@code putThenFail{key}}: writes, then reports "X not found"</li>
 *   <li>{@code putThenThrow{key}}: writes, then throws</li>
 *   <li>{@code warn}/{@code fatal}: raises a warning / non-resolvable error on the scope</li>
 *   <li>{@code expect{key, value}}: read-only assertion</li>
 * </ul>
 */
public final class TestOperations {
    private TestOperations() {}

    public static OperationRegistry registry() {
        return OperationRegistry.builder()
                .operation("put").aliases("set").category("Test")
                        .validator(p -> p.requireString("key"))
                        .handler((r, p) -> {
                    String key = p.requireString("key");
                    ((TestModel) r).put(key, p.getString("value").orElse("v"));
                    return OperationResult.success(Map.of("elementId", key));
                }).add()
                .operation("putThenFail").handler((r, p) -> {
                    ((TestModel) r).put(p.requireString("key"), "partial");
                    return OperationResult.notFound("X not found");
                }).add()
                .operation("putThenThrow").handler((r, p) -> {
                    ((TestModel) r).put(p.requireString("key"), "partial");
                    throw new IllegalStateException("boom");
                }).add()
                .operation("warn").handler((r, p) -> {
                    ((TestModel) r).raise(ModelFailure.warning("W1", "overlap"));
                    return OperationResult.success();
                }).add()
                .operation("fatal").handler((r, p) -> {
                    ((TestModel) r).put("fatal", "partial");
                    ((TestModel) r).raise(ModelFailure.error("E1", "cannot join", false));
                    return OperationResult.success();
                }).add()
                .operation("expect").handler((r, p) -> {
                    String key = p.requireString("key");
                    String expected = p.requireString("value");
                    String actual = ((TestModel) r).values().get(key);
                    return expected.equals(actual)
                            ? OperationResult.success(Map.of("value", actual))
                            : OperationResult.failure(ErrorKind.OPERATION,
                                    key + " is " + actual + ", expected " + expected);
                }).add()
                .build();
    }
}
