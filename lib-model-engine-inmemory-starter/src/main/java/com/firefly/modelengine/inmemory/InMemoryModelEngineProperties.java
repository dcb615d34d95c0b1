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

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the in-memory model and its companions.
 */
@ConfigurationProperties(prefix = "firefly.model.engine.inmemory")
public class InMemoryModelEngineProperties {

    /**
     * Title of the in-memory document.
     */
    private String documentName = "In-Memory Model";

    /**
     * Maximum number of committed top-level scopes kept in the undo history; the oldest are dropped first.
     */
    private int maxUndoHistory = InMemoryModelDocument.DEFAULT_MAX_UNDO_HISTORY;

    private EventsProperties events = new EventsProperties();
    private OperationsProperties operations = new OperationsProperties();

    public String getDocumentName() {
        return documentName;
    }

    public void setDocumentName(String documentName) {
        this.documentName = documentName;
    }

    public int getMaxUndoHistory() {
        return maxUndoHistory;
    }

    public void setMaxUndoHistory(int maxUndoHistory) {
        this.maxUndoHistory = maxUndoHistory;
    }

    public EventsProperties getEvents() {
        return events;
    }

    public void setEvents(EventsProperties events) {
        this.events = events;
    }

    public OperationsProperties getOperations() {
        return operations;
    }

    public void setOperations(OperationsProperties operations) {
        this.operations = operations;
    }

    public static class EventsProperties {

        private boolean enabled = true;

        /**
         * Maximum number of events kept in the history; the oldest are dropped first.
         */
        private int maxEventsInMemory = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEventsInMemory() {
            return maxEventsInMemory;
        }

        public void setMaxEventsInMemory(int maxEventsInMemory) {
            this.maxEventsInMemory = maxEventsInMemory;
        }
    }

    public static class OperationsProperties {

        /**
         * Register the reference element operations.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
