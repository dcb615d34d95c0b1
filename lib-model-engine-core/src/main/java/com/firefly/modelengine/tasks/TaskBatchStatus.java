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
package com.firefly.modelengine.tasks;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Progress snapshot of a {@link TaskBatch}.
 *
 * @param current 1-based position of the task last started
 * @param percent share of finished tasks (completed, failed or skipped), 0 to 100
 */
public record TaskBatchStatus(String batchId,
                              String name,
                              ErrorStrategy strategy,
                              boolean running,
                              boolean paused,
                              boolean complete,
                              int current,
                              int total,
                              int completed,
                              int failed,
                              int skipped,
                              int pending,
                              double percent) {

    public Map<String, Object> progress() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("current", current);
        m.put("total", total);
        m.put("completed", completed);
        m.put("failed", failed);
        m.put("skipped", skipped);
        m.put("pending", pending);
        m.put("percent", percent);
        return m;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("batchId", batchId);
        m.put("batchName", name);
        m.put("onError", strategy.name());
        m.put("isRunning", running);
        m.put("isPaused", paused);
        m.put("isComplete", complete);
        m.put("progress", progress());
        return m;
    }
}
