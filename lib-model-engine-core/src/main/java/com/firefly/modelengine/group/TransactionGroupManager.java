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

import com.firefly.modelengine.core.ErrorKind;
import com.firefly.modelengine.core.OperationResult;
import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.resource.ScopeGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Session owning the transaction group lifecycle for one {@link ResourceHandle}.
 * <p>
 * At most one group is active at a time: {@code start} while a group is active fails fast with
 * {@code AlreadyActive} and leaves the active group untouched; there is no queuing and no nesting.
 * Illegal transitions are reported as {@link ErrorKind#STATE} results, never thrown.
 * <p>
 * All methods are synchronized; the session is normally driven from the dispatcher's model thread.
 */
public class TransactionGroupManager {
    private static final Logger log = LoggerFactory.getLogger(TransactionGroupManager.class);

    public static final String ALREADY_ACTIVE = "AlreadyActive";
    public static final String NO_ACTIVE_GROUP = "NoActiveGroup";
    public static final String DEFAULT_NAME_PATTERN = "AI Operation %s";

    private final ResourceHandle resource;
    private final FailureClassificationPolicy policy;
    private final EngineEvents events;
    private final Clock clock;
    private final String defaultNamePattern;

    private TransactionGroup active;
    private GroupState lastState = GroupState.INACTIVE;

    public TransactionGroupManager(ResourceHandle resource, FailureClassificationPolicy policy, EngineEvents events) {
        this(resource, policy, events, Clock.systemDefaultZone(), DEFAULT_NAME_PATTERN);
    }

    public TransactionGroupManager(ResourceHandle resource,
                                   FailureClassificationPolicy policy,
                                   EngineEvents events,
                                   Clock clock,
                                   String defaultNamePattern) {
        this.resource = Objects.requireNonNull(resource, "resource");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.events = events != null ? events : EngineEvents.NO_OP;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultNamePattern = defaultNamePattern == null || defaultNamePattern.isBlank()
                ? DEFAULT_NAME_PATTERN
                : defaultNamePattern;
    }

    public synchronized OperationResult start(String requestedName) {
        if (active != null) {
            log.debug("Rejecting group start, '{}' is already active", active.name());
            return OperationResult.failure(ErrorKind.STATE, ALREADY_ACTIVE, Map.of(
                    "activeGroup", active.name(),
                    "message", "A transaction group is already active"
            ));
        }
        if (resource.hasOpenScope()) {
            return OperationResult.failure(ErrorKind.STATE, "A scope is already open on '" + resource.title() + "'");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String name = requestedName == null || requestedName.isBlank()
                ? String.format(defaultNamePattern, Checkpoint.TIME.format(now))
                : requestedName;
        ScopeGuard scope = ScopeGuard.open(resource, name, policy, events);
        active = new TransactionGroup(name, scope, new Checkpoint("Started: " + name, now));
        lastState = GroupState.ACTIVE;
        events.onGroupStarted(name);
        return OperationResult.success(Map.of(
                "groupName", name,
                "message", "Transaction group '" + name + "' started"
        ));
    }

    public synchronized OperationResult checkpoint(String requestedLabel) {
        if (active == null) return noActiveGroup();
        String label = requestedLabel == null || requestedLabel.isBlank()
                ? "Checkpoint " + active.checkpoints().size()
                : requestedLabel;
        Checkpoint cp = new Checkpoint(label, LocalDateTime.now(clock));
        int count = active.append(cp);
        events.onCheckpoint(active.name(), label, count);
        return OperationResult.success(Map.of(
                "checkpoint", cp.render(),
                "checkpointCount", count
        ));
    }

    /** Record a checkpoint only when a group is active; used by operations that form their own undo step. */
    public synchronized void checkpointIfActive(String label) {
        if (active != null) {
            checkpoint(label);
        }
    }

    public synchronized OperationResult commit() {
        if (active == null) return noActiveGroup();
        TransactionGroup group = active;
        active = null;
        try {
            group.scope().commit();
        } catch (ResourceException e) {
            List<String> discarded = group.finish(GroupState.ROLLED_BACK);
            lastState = GroupState.ROLLED_BACK;
            events.onGroupCompleted(group.name(), GroupState.ROLLED_BACK, discarded.size());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("groupName", group.name());
            payload.put("rolledBackCheckpoints", discarded);
            return OperationResult.failure(ErrorKind.RESOURCE, e.getMessage(), payload);
        }
        List<String> log = group.finish(GroupState.COMMITTED);
        lastState = GroupState.COMMITTED;
        events.onGroupCompleted(group.name(), GroupState.COMMITTED, log.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("groupName", group.name());
        payload.put("checkpoints", log);
        payload.put("message", "Transaction group '" + group.name() + "' committed as a single undo step");
        return OperationResult.success(payload);
    }

    public synchronized OperationResult rollback() {
        if (active == null) return noActiveGroup();
        TransactionGroup group = active;
        active = null;
        group.scope().rollback("transaction group rolled back");
        List<String> log = group.finish(GroupState.ROLLED_BACK);
        lastState = GroupState.ROLLED_BACK;
        events.onGroupCompleted(group.name(), GroupState.ROLLED_BACK, log.size());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("groupName", group.name());
        payload.put("rolledBackCheckpoints", log);
        payload.put("message", "Transaction group '" + group.name() + "' rolled back");
        return OperationResult.success(payload);
    }

    public synchronized GroupStatus status() {
        if (active == null) {
            return new GroupStatus(false, null, lastState, List.of());
        }
        return new GroupStatus(true, active.name(), GroupState.ACTIVE, active.renderedCheckpoints());
    }

    /**
     * Session-level undo history: the active group's checkpoints. The resource's own undo stack is not
     * reachable through {@link ResourceHandle}.
     */
    public synchronized Map<String, Object> undoHistory() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("activeGroup", active != null ? active.name() : null);
        m.put("checkpoints", active != null ? active.renderedCheckpoints() : List.of());
        m.put("note", "Use the host application's undo to step back through committed changes");
        return m;
    }

    public synchronized Optional<TransactionGroup> activeGroup() {
        return Optional.ofNullable(active);
    }

    private static OperationResult noActiveGroup() {
        return OperationResult.failure(ErrorKind.STATE, NO_ACTIVE_GROUP, Map.of(
                "message", "No transaction group is active"
        ));
    }
}
