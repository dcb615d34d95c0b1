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


package com.firefly.modelengine.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.util.JsonUtils;

import java.util.Collection;
import java.util.Map;

/**
 * Bounded renderings of values for the engine's JSON log lines. The lines themselves are built with
 * {@link JsonUtils#json(String...)}.
 */
public final class LogPreview {
    private static final String ELLIPSIS = "...";

    private LogPreview() {}

    /** At most {@code max} characters of {@code text}, ending in "..." when cut. */
    public static String truncate(String text, int max) {
        if (text == null) return "null";
        if (text.length() <= max) return text;
        if (max <= ELLIPSIS.length()) return text.substring(0, Math.max(max, 0));
        return text.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Results, maps and collections are rendered as JSON, anything else with {@code toString()};
     * the text is then truncated to {@code max} characters.
     */
    public static String preview(Object value, int max) {
        if (value == null) return "null";
        Object shape = value instanceof OperationResult r ? r.toMap() : value;
        String text;
        if (shape instanceof Map<?, ?> || shape instanceof Collection<?>) {
            try {
                text = JsonUtils.mapper().writeValueAsString(shape);
            } catch (JsonProcessingException e) {
                text = String.valueOf(value);
            }
        } else {
            text = String.valueOf(value);
        }
        return truncate(text, max);
    }
}
