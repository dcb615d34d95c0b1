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


package com.firefly.modelengine.inmemory;

import com.firefly.modelengine.failure.FailureClassificationPolicy;
import com.firefly.modelengine.failure.FailureProcessingOutcome;
import com.firefly.modelengine.failure.ModelFailure;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.resource.ScopeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory model document: a flat set of elements, each a category plus a parameter map.
 * <p>
 * Scopes nest and are backed by snapshots: rolling back a scope restores the elements and the id sequence
 * as they were when it was opened. Mutations are only accepted while a scope is open.
 * <p>
 * The document raises failures the way a real model would:
 * - a second element with the same category and name raises a {@code DUPLICATE_INSTANCE} warning
 * - a {@code hostId} that does not exist raises a resolvable {@code MISSING_HOST} error, resolved by
 *   leaving the element unhosted
 * - deleting a pinned element raises a non-resolvable {@code PINNED_ELEMENT} error
 * <p>
 * Failures wait on the innermost scope until it commits; see {@link ResourceHandle}.
 */
public class InMemoryModelDocument implements ResourceHandle {
    private static final Logger log = LoggerFactory.getLogger(InMemoryModelDocument.class);

    public static final String DUPLICATE_INSTANCE = "DUPLICATE_INSTANCE";
    public static final String MISSING_HOST = "MISSING_HOST";
    public static final String PINNED_ELEMENT = "PINNED_ELEMENT";
    public static final int DEFAULT_MAX_UNDO_HISTORY = 100;

    private final String title;
    private Map<Long, Element> elements = new LinkedHashMap<>();
    private long nextId = 1;
    private final Deque<OpenScope> scopes = new ArrayDeque<>();
    private final Deque<String> undoStack = new ArrayDeque<>();
    private final int maxUndoHistory;
    private long scopeSequence = 0;

    public InMemoryModelDocument(String title) {
        this(title, DEFAULT_MAX_UNDO_HISTORY);
    }

    /**
     * @param maxUndoHistory number of committed top-level scopes kept in {@link #undoHistory()}; must be positive
     */
    public InMemoryModelDocument(String title, int maxUndoHistory) {
        if (maxUndoHistory < 1) {
            throw new IllegalArgumentException("maxUndoHistory must be positive, got " + maxUndoHistory);
        }
        this.title = title == null || title.isBlank() ? "Untitled" : title;
        this.maxUndoHistory = maxUndoHistory;
    }

    /** Stored element; parameters include {@code category} and, when given, {@code name}. */
    public record Element(long id, String category, Map<String, Object> parameters) {
        public Element {
            parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }

        public Optional<String> name() {
            Object n = parameters.get("name");
            return n == null ? Optional.empty() : Optional.of(n.toString());
        }

        public boolean pinned() {
            return Boolean.TRUE.equals(parameters.get("pinned"));
        }

        Element with(String parameter, Object value) {
            Map<String, Object> p = new LinkedHashMap<>(parameters);
            if (value == null) {
                p.remove(parameter);
            } else {
                p.put(parameter, value);
            }
            return new Element(id, category, p);
        }
    }

    private record PendingFailure(ModelFailure failure, Runnable resolution) {}

    private static final class OpenScope {
        final ScopeToken token;
        final Map<Long, Element> elementsSnapshot;
        final long nextIdSnapshot;
        final List<PendingFailure> pending = new ArrayList<>();
        FailureClassificationPolicy policy;

        OpenScope(ScopeToken token, Map<Long, Element> elementsSnapshot, long nextIdSnapshot) {
            this.token = token;
            this.elementsSnapshot = elementsSnapshot;
            this.nextIdSnapshot = nextIdSnapshot;
        }
    }

    @Override
    public String title() {
        return title;
    }

    @Override
    public synchronized ScopeToken beginScope(String name) {
        String scopeName = name == null || name.isBlank() ? "Unnamed" : name;
        ScopeToken token = new ScopeToken("scope-" + (++scopeSequence), scopeName, scopes.size() + 1);
        scopes.push(new OpenScope(token, new LinkedHashMap<>(elements), nextId));
        log.debug("Opened scope {} '{}' at depth {}", token.id(), scopeName, token.depth());
        return token;
    }

    @Override
    public synchronized void attachFailurePolicy(ScopeToken token, FailureClassificationPolicy policy) {
        for (OpenScope scope : scopes) {
            if (scope.token.equals(token)) {
                scope.policy = policy;
                return;
            }
        }
        throw new IllegalStateException("Scope " + token.id() + " is not open");
    }

    @Override
    public synchronized void commit(ScopeToken token) {
        OpenScope scope = innermost(token);
        List<PendingFailure> pending = List.copyOf(scope.pending);
        if (scope.policy != null) {
            FailureProcessingOutcome outcome = scope.policy.process(failuresOf(pending));
            if (!outcome.proceed()) {
                restore(scope);
                throw ResourceException.fatalFailures(token.name(), outcome.fatal());
            }
            applyResolutions(pending, outcome.resolved());
        } else if (!pending.isEmpty()) {
            OpenScope parent = parentOf(scope);
            if (parent != null) {
                parent.pending.addAll(pending);
            } else {
                List<ModelFailure> fatal = failuresOf(pending).stream().filter(f -> !f.isWarning()).toList();
                if (!fatal.isEmpty()) {
                    restore(scope);
                    throw ResourceException.fatalFailures(token.name(), fatal);
                }
            }
        }
        scopes.pop();
        if (scopes.isEmpty()) {
            undoStack.addLast(token.name());
            while (undoStack.size() > maxUndoHistory) {
                undoStack.removeFirst();
            }
        }
        log.debug("Committed scope {} '{}'", token.id(), token.name());
    }

    @Override
    public synchronized void rollback(ScopeToken token) {
        OpenScope scope = innermost(token);
        restore(scope);
        log.debug("Rolled back scope {} '{}'", token.id(), token.name());
    }

    @Override
    public synchronized int openScopeDepth() {
        return scopes.size();
    }

    public synchronized long createElement(String category, Map<String, Object> parameters) {
        OpenScope scope = requireScope("create element");
        Objects.requireNonNull(category, "category");
        Map<String, Object> p = new LinkedHashMap<>(parameters == null ? Map.of() : parameters);
        p.put("category", category);
        long id = nextId++;
        Element element = new Element(id, category, p);
        elements.put(id, element);

        element.name().ifPresent(name -> {
            boolean duplicate = elements.values().stream()
                    .anyMatch(e -> e.id() != id && e.category().equals(category) && name.equals(e.name().orElse(null)));
            if (duplicate) {
                scope.pending.add(new PendingFailure(
                        ModelFailure.warning(DUPLICATE_INSTANCE, "There are identical instances of '" + name + "' in " + category),
                        null));
            }
        });
        Object hostId = p.get("hostId");
        if (hostId != null && !elements.containsKey(toLong(hostId))) {
            scope.pending.add(new PendingFailure(
                    ModelFailure.error(MISSING_HOST, "Host element " + hostId + " of element " + id + " does not exist", true),
                    () -> updateParameter(id, "hostId", null)));
        }
        return id;
    }

    public synchronized void setParameter(long elementId, String parameter, Object value) {
        requireScope("set parameter");
        if (!elements.containsKey(elementId)) {
            throw new ResourceException("Element " + elementId + " does not exist");
        }
        if ("category".equals(parameter)) {
            throw new ResourceException("Parameter 'category' is read-only");
        }
        updateParameter(elementId, parameter, value);
    }

    /** @return true when the element existed */
    public synchronized boolean deleteElement(long elementId) {
        OpenScope scope = requireScope("delete element");
        Element removed = elements.remove(elementId);
        if (removed == null) return false;
        if (removed.pinned()) {
            scope.pending.add(new PendingFailure(
                    ModelFailure.error(PINNED_ELEMENT, "Element " + elementId + " is pinned and cannot be deleted", false),
                    null));
        }
        return true;
    }

    /** Raise a failure on the innermost open scope, as the host would while a mutation is processed. */
    public synchronized void reportFailure(ModelFailure failure) {
        requireScope("report failure").pending.add(new PendingFailure(failure, null));
    }

    public synchronized Optional<Element> element(long elementId) {
        return Optional.ofNullable(elements.get(elementId));
    }

    public synchronized List<Element> elements() {
        return List.copyOf(elements.values());
    }

    public synchronized int elementCount() {
        return elements.size();
    }

    public synchronized long countByCategory(String category) {
        return elements.values().stream().filter(e -> e.category().equalsIgnoreCase(category)).count();
    }

    /** Names of committed top-level scopes, oldest first. */
    public synchronized List<String> undoHistory() {
        return List.copyOf(undoStack);
    }

    private void updateParameter(long elementId, String parameter, Object value) {
        Element current = elements.get(elementId);
        if (current != null) {
            elements.put(elementId, current.with(parameter, value));
        }
    }

    private OpenScope requireScope(String action) {
        OpenScope scope = scopes.peek();
        if (scope == null) {
            throw new ResourceException("Cannot " + action + " in '" + title + "' outside of a scope");
        }
        return scope;
    }

    private OpenScope innermost(ScopeToken token) {
        OpenScope scope = scopes.peek();
        if (scope == null || !scope.token.equals(token)) {
            throw new IllegalStateException("Scope " + token.id() + " '" + token.name() + "' is not the innermost open scope");
        }
        return scope;
    }

    private OpenScope parentOf(OpenScope scope) {
        boolean found = false;
        for (OpenScope s : scopes) {
            if (found) return s;
            if (s == scope) found = true;
        }
        return null;
    }

    private void restore(OpenScope scope) {
        elements = new LinkedHashMap<>(scope.elementsSnapshot);
        nextId = scope.nextIdSnapshot;
        scopes.pop();
    }

    private static void applyResolutions(List<PendingFailure> pending, List<ModelFailure> resolved) {
        Map<ModelFailure, Boolean> toResolve = new IdentityHashMap<>();
        resolved.forEach(f -> toResolve.put(f, Boolean.TRUE));
        for (PendingFailure p : pending) {
            if (p.resolution() != null && toResolve.containsKey(p.failure())) {
                p.resolution().run();
            }
        }
    }

    private static List<ModelFailure> failuresOf(List<PendingFailure> pending) {
        return pending.stream().map(PendingFailure::failure).toList();
    }

    private static long toLong(Object value) {
        if (value instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
