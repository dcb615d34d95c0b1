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


package com.firefly.modelengine.group;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only projection of the transaction group session.
 *
 * @param name        active group name, null when no group is active
 * @param state       ACTIVE, or the state the last group ended in (INACTIVE before any group)
 * @param checkpoints rendered checkpoints of the active group
 */
public record GroupStatus(boolean hasActive, String name, GroupState state, List<String> checkpoints) {

    public GroupStatus {
        checkpoints = List.copyOf(checkpoints);
    }

    public int checkpointCount() {
        return checkpoints.size();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("hasActiveGroup", hasActive);
        m.put("groupName", name);
        m.put("state", state.name());
        m.put("checkpointCount", checkpoints.size());
        m.put("checkpoints", checkpoints);
        return m;
    }
}
