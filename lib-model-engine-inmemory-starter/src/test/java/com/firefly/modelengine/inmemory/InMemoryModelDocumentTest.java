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

import com.firefly.modelengine.failure.DefaultFailureClassificationPolicy;
import com.firefly.modelengine.failure.ModelFailure;
import com.firefly.modelengine.observability.EngineEvents;
import com.firefly.modelengine.resource.ResourceException;
import com.firefly.modelengine.resource.ScopeGuard;
import com.firefly.modelengine.resource.ScopeToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryModelDocumentTest {

    private final InMemoryModelDocument doc = new InMemoryModelDocument("Tower");
    private final DefaultFailureClassificationPolicy policy = new DefaultFailureClassificationPolicy();

    private ScopeGuard open(String name) {
        return ScopeGuard.open(doc, name, policy, EngineEvents.NO_OP);
    }

    @Test
    void mutationsOutsideAScopeAreRefused() {
        ResourceException e = assertThrows(ResourceException.class, () -> doc.createElement("Walls", Map.of()));
        assertTrue(e.getMessage().contains("outside of a scope"));
    }

    @Test
    void rollbackRestoresElementsAndTheIdSequence() {
        try (ScopeGuard first = open("First")) {
            assertEquals(1L, doc.createElement("Walls", Map.of()));
            first.commit();
        }
        try (ScopeGuard discarded = open("Discarded")) {
            assertEquals(2L, doc.createElement("Walls", Map.of()));
            doc.deleteElement(1L);
        }

        assertEquals(1, doc.elementCount());
        try (ScopeGuard again = open("Again")) {
            assertEquals(2L, doc.createElement("Doors", Map.of()));
            again.commit();
        }
        assertEquals(List.of("First", "Again"), doc.undoHistory());
    }

    @Test
    void undoHistoryKeepsOnlyTheMostRecentCommits() {
        InMemoryModelDocument capped = new InMemoryModelDocument("Capped", 2);
        for (String name : List.of("One", "Two", "Three")) {
            try (ScopeGuard guard = ScopeGuard.open(capped, name, policy, EngineEvents.NO_OP)) {
                capped.createElement("Walls", Map.of());
                guard.commit();
            }
        }

        assertEquals(List.of("Two", "Three"), capped.undoHistory());
        assertEquals(3, capped.elementCount());
    }

    @Test
    void undoHistoryLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryModelDocument("Zero", 0));
    }

    @Test
    void rollingBackTheOuterScopeDiscardsCommittedInnerScopes() {
        ScopeGuard outer = open("Outer");
        try (ScopeGuard inner = open("Inner")) {
            doc.createElement("Walls", Map.of());
            inner.commit();
        }
        assertEquals(1, doc.elementCount());

        outer.rollback("changed my mind");

        assertEquals(0, doc.elementCount());
        assertEquals(0, doc.openScopeDepth());
        assertTrue(doc.undoHistory().isEmpty());
    }

    @Test
    void onlyTheInnermostScopeMayBeClosed() {
        ScopeToken outer = doc.beginScope("Outer");
        doc.beginScope("Inner");

        assertThrows(IllegalStateException.class, () -> doc.commit(outer));
        assertThrows(IllegalStateException.class, () -> doc.rollback(outer));
    }

    @Test
    void duplicateNamesRaiseASuppressibleWarning() {
        try (ScopeGuard scope = open("Dupes")) {
            doc.createElement("Furniture", Map.of("name", "Desk"));
            doc.createElement("Furniture", Map.of("name", "Desk"));
            scope.commit();
        }

        assertEquals(2, doc.countByCategory("furniture"));
    }

    @Test
    void duplicateWarningsAreFatalUnderAStrictPolicy() {
        ScopeGuard scope = ScopeGuard.open(doc, "Strict", new DefaultFailureClassificationPolicy(false, true), EngineEvents.NO_OP);
        doc.createElement("Furniture", Map.of("name", "Desk"));
        doc.createElement("Furniture", Map.of("name", "Desk"));

        ResourceException e = assertThrows(ResourceException.class, scope::commit);

        assertEquals(InMemoryModelDocument.DUPLICATE_INSTANCE, e.failures().get(0).id());
        assertEquals(0, doc.elementCount());
    }

    @Test
    void missingHostIsResolvedByDroppingTheHost() {
        long id;
        try (ScopeGuard scope = open("Hosted")) {
            id = doc.createElement("Doors", Map.of("hostId", 99));
            assertEquals(99, doc.element(id).orElseThrow().parameters().get("hostId"));
            scope.commit();
        }

        assertFalse(doc.element(id).orElseThrow().parameters().containsKey("hostId"));
    }

    @Test
    void deletingAPinnedElementCannotBeCommitted() {
        long id;
        try (ScopeGuard setup = open("Setup")) {
            id = doc.createElement("Grids", Map.of("pinned", true));
            setup.commit();
        }

        ScopeGuard delete = open("Delete");
        assertTrue(doc.deleteElement(id));
        ResourceException e = assertThrows(ResourceException.class, delete::commit);

        assertEquals(InMemoryModelDocument.PINNED_ELEMENT, e.failures().get(0).id());
        assertTrue(doc.element(id).isPresent());
        assertTrue(delete.wasRolledBack());
    }

    @Test
    void failuresOfAScopeWithoutPolicyMoveToTheParent() {
        ScopeGuard outer = open("Outer");
        ScopeToken bare = doc.beginScope("Bare");
        doc.createElement("Walls", Map.of());
        doc.reportFailure(ModelFailure.error("E42", "walls do not join", false));
        doc.commit(bare);

        assertThrows(ResourceException.class, outer::commit);
        assertEquals(0, doc.elementCount());
    }

    @Test
    void categoryIsReadOnly() {
        try (ScopeGuard scope = open("Edit")) {
            long id = doc.createElement("Walls", Map.of());
            assertThrows(ResourceException.class, () -> doc.setParameter(id, "category", "Doors"));
            doc.setParameter(id, "height", 3.2);
            assertEquals(3.2, doc.element(id).orElseThrow().parameters().get("height"));
        }
    }
}
