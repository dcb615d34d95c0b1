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

import com.firefly.modelengine.resource.ScopeGuard;

import java.util.ArrayList;
import java.util.List;

/**
 * One transaction group: a top-level scope on the resource plus an append-only checkpoint log.
 * A group is created {@link GroupState#ACTIVE} and moves exactly once to a terminal state; it cannot
 * be restarted. Instances are owned and mutated by {@link TransactionGroupManager} only.
 */
public final class TransactionGroup {
    private final String name;
    private final ScopeGuard scope;
    private final List<Checkpoint> checkpoints = new ArrayList<>();
    private GroupState state = GroupState.ACTIVE;

    TransactionGroup(String name, ScopeGuard scope, Checkpoint initial) {
        this.name = name;
        this.scope = scope;
        this.checkpoints.add(initial);
    }

    public String name() { return name; }
    public GroupState state() { return state; }

    public List<Checkpoint> checkpoints() {
        return List.copyOf(checkpoints);
    }

    public List<String> renderedCheckpoints() {
        return checkpoints.stream().map(Checkpoint::render).toList();
    }

    ScopeGuard scope() {
        return scope;
    }

    int append(Checkpoint checkpoint) {
        requireActive();
        checkpoints.add(checkpoint);
        return checkpoints.size();
    }

    /** Move to a terminal state; returns the rendered log and discards it. */
    List<String> finish(GroupState terminal) {
        requireActive();
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        List<String> log = renderedCheckpoints();
        checkpoints.clear();
        state = terminal;
        return log;
    }

    private void requireActive() {
        if (state != GroupState.ACTIVE) {
            throw new IllegalStateException("Transaction group '" + name + "' is " + state);
        }
    }
}
